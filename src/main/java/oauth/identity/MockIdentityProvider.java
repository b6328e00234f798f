package oauth.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import oauth.model.AuthenticatedUser;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Session tokens read from {@code identity/sessions.json} for local development and tests.
 */
@SuppressWarnings("unchecked")
public class MockIdentityProvider implements IdentityProvider {

    private final Map<String, AuthenticatedUser> sessions;

    public MockIdentityProvider() throws IOException {
        List<Map<String, String>> res = new ObjectMapper().readValue(new ClassPathResource("identity/sessions.json").getInputStream(), List.class);
        this.sessions = res.stream().collect(Collectors.toMap(
                m -> m.get("token"),
                m -> new AuthenticatedUser(m.get("id"), m.get("email"))));
    }

    @Override
    public Optional<AuthenticatedUser> authenticate(String sessionToken) {
        return sessionToken == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionToken));
    }
}
