package oauth.endpoints;

import lombok.Getter;
import org.springframework.util.MultiValueMap;

import java.util.Arrays;
import java.util.List;

/**
 * The parameters of an authorization request, carried unchanged from the authorize request through the consent
 * form to the confirmation.
 */
@Getter
public class AuthorizationParameters {

    static final List<String> NAMES = Arrays.asList("response_type", "client_id", "redirect_uri", "scope", "state",
            "code_challenge", "code_challenge_method", "token");

    private final String responseType;
    private final String clientId;
    private final String redirectUri;
    private final String scope;
    private final String state;
    private final String codeChallenge;
    private final String codeChallengeMethod;
    private final String sessionToken;

    public AuthorizationParameters(String responseType, String clientId, String redirectUri, String scope, String state,
                                   String codeChallenge, String codeChallengeMethod, String sessionToken) {
        this.responseType = responseType;
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.scope = scope;
        this.state = state;
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallengeMethod;
        this.sessionToken = sessionToken;
    }

    public static ValidationResult<AuthorizationParameters> parse(MultiValueMap<String, String> parameterMap) {
        RequestParameters parameters = new RequestParameters(parameterMap);
        return parameters.repeatedParameter(NAMES)
                .map(name -> ValidationResult.<AuthorizationParameters>error(ErrorKind.MALFORMED_REQUEST,
                        String.format("Parameter %s is repeated", name)))
                .orElseGet(() -> ValidationResult.ok(new AuthorizationParameters(
                        parameters.get("response_type"),
                        parameters.get("client_id"),
                        parameters.get("redirect_uri"),
                        parameters.get("scope"),
                        parameters.get("state"),
                        parameters.get("code_challenge"),
                        parameters.get("code_challenge_method"),
                        parameters.get("token"))));
    }
}
