package oauth.endpoints;

import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import lombok.Getter;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Form parameters of an authorization code exchange. Client credentials are taken from the form or from an HTTP Basic
 * authorization header, never from both.
 */
@Getter
public class TokenRequestParameters {

    static final List<String> NAMES = Arrays.asList("grant_type", "code", "redirect_uri", "client_id", "client_secret",
            "code_verifier");

    private final String code;
    private final String redirectUri;
    private final String clientId;
    private final String clientSecret;
    private final String codeVerifier;
    private final boolean basicAuthentication;

    public TokenRequestParameters(String code, String redirectUri, String clientId, String clientSecret,
                                  String codeVerifier, boolean basicAuthentication) {
        this.code = code;
        this.redirectUri = redirectUri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.codeVerifier = codeVerifier;
        this.basicAuthentication = basicAuthentication;
    }

    public static ValidationResult<TokenRequestParameters> parse(MultiValueMap<String, String> parameterMap,
                                                                 String authorizationHeader) {
        RequestParameters parameters = new RequestParameters(parameterMap);
        Optional<String> repeated = parameters.repeatedParameter(NAMES);
        if (repeated.isPresent()) {
            return ValidationResult.error(ErrorKind.INVALID_TOKEN_REQUEST,
                    String.format("Parameter %s is repeated", repeated.get()));
        }
        String grantType = parameters.get("grant_type");
        if (!GrantType.AUTHORIZATION_CODE.getValue().equals(grantType)) {
            return ValidationResult.error(ErrorKind.UNSUPPORTED_GRANT_TYPE,
                    String.format("Unsupported grant_type %s", grantType));
        }
        String clientId = parameters.get("client_id");
        String clientSecret = parameters.get("client_secret");
        boolean basicAuthentication = StringUtils.hasText(authorizationHeader) &&
                authorizationHeader.regionMatches(true, 0, "Basic ", 0, 6);
        if (basicAuthentication) {
            ClientSecretBasic clientSecretBasic;
            try {
                clientSecretBasic = ClientSecretBasic.parse(authorizationHeader);
            } catch (ParseException e) {
                return ValidationResult.error(ErrorKind.INVALID_TOKEN_REQUEST, "Malformed Basic authorization header");
            }
            String basicClientId = clientSecretBasic.getClientID().getValue();
            if (clientSecret != null || (clientId != null && !clientId.equals(basicClientId))) {
                return ValidationResult.error(ErrorKind.INVALID_TOKEN_REQUEST,
                        "Client credentials must be sent with one authentication method");
            }
            clientId = basicClientId;
            clientSecret = clientSecretBasic.getClientSecret().getValue();
        }
        String code = parameters.get("code");
        String redirectUri = parameters.get("redirect_uri");
        if (code == null || redirectUri == null || clientId == null) {
            return ValidationResult.error(ErrorKind.INVALID_TOKEN_REQUEST,
                    "Parameters code, redirect_uri and client_id are required");
        }
        return ValidationResult.ok(new TokenRequestParameters(code, redirectUri, clientId, clientSecret,
                parameters.get("code_verifier"), basicAuthentication));
    }
}
