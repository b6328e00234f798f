package oauth.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import oauth.model.OAuthClient;

/**
 * A client together with the raw secret generated for it. The raw secret is never stored and this is the only
 * moment it can be handed out. Null for public clients.
 */
@Getter
@AllArgsConstructor
public class RegisteredClient {

    private final OAuthClient client;
    private final String clientSecret;

}
