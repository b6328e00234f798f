package oauth.endpoints;

import lombok.AllArgsConstructor;
import lombok.Getter;
import oauth.model.OAuthClient;

import java.util.List;

@Getter
@AllArgsConstructor
public class ValidatedAuthorizationRequest {

    private final AuthorizationParameters parameters;
    private final OAuthClient client;
    private final List<String> scopes;

}
