package oauth.identity;

import oauth.model.AuthenticatedUser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MockIdentityProviderTest {

    @Test
    void authenticate() throws IOException {
        MockIdentityProvider identityProvider = new MockIdentityProvider();
        assertEquals(new AuthenticatedUser("u-1", "student@example.edu"),
                identityProvider.authenticate("student-session").get());
        assertFalse(identityProvider.authenticate("nope").isPresent());
        assertFalse(identityProvider.authenticate(null).isPresent());
    }
}
