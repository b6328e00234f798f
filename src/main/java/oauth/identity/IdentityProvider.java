package oauth.identity;

import oauth.model.AuthenticatedUser;

import java.util.Optional;

/**
 * Resolves the bearer session token of the hosted identity service to the signed-in user.
 */
public interface IdentityProvider {

    /**
     * @return the user, or empty when the session token is unknown, expired or revoked
     */
    Optional<AuthenticatedUser> authenticate(String sessionToken);

}
