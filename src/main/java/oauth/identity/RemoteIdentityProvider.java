package oauth.identity;

import oauth.model.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

@SuppressWarnings("unchecked")
public class RemoteIdentityProvider implements IdentityProvider {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteIdentityProvider.class);

    private final String url;
    private final String apiKey;
    private final RestTemplate restTemplate;

    public RemoteIdentityProvider(String identityBaseUrl, String apiKey) {
        this(identityBaseUrl, apiKey, new RestTemplate());
        SimpleClientHttpRequestFactory requestFactory = (SimpleClientHttpRequestFactory) restTemplate
                .getRequestFactory();
        requestFactory.setConnectTimeout(10 * 1000);
        requestFactory.setReadTimeout(10 * 1000);
    }

    RemoteIdentityProvider(String identityBaseUrl, String apiKey, RestTemplate restTemplate) {
        this.url = identityBaseUrl + "/auth/v1/user";
        this.apiKey = apiKey;
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<AuthenticatedUser> authenticate(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) {
            return Optional.empty();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(sessionToken);
        headers.add("apikey", apiKey);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        LOG.debug("Resolving session token at {}", url);
        try {
            ResponseEntity<Map> responseEntity = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), Map.class);
            Map<String, Object> body = responseEntity.getBody();
            if (body == null || !StringUtils.hasText((String) body.get("id"))) {
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedUser((String) body.get("id"), (String) body.get("email")));
        } catch (HttpClientErrorException e) {
            LOG.info("Session token rejected by identity provider with status {}", e.getStatusCode().value());
            return Optional.empty();
        }
    }
}
