package oauth.endpoints;

import com.nimbusds.oauth2.sdk.token.AccessTokenType;
import oauth.crypto.PkceVerifier;
import oauth.log.MDCContext;
import oauth.model.AuthorizationCode;
import oauth.model.OAuthClient;
import oauth.service.AccessTokenStore;
import oauth.service.AuthorizationCodeStore;
import oauth.service.ClientRegistry;
import oauth.service.IssuedAccessToken;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
public class TokenEndpoint {

    private static final Log LOG = LogFactory.getLog(TokenEndpoint.class);

    private static final String INVALID_GRANT_DESCRIPTION = "Authorization code is invalid, expired or already used";

    private final ClientRegistry clientRegistry;
    private final AuthorizationCodeStore authorizationCodeStore;
    private final AccessTokenStore accessTokenStore;

    public TokenEndpoint(ClientRegistry clientRegistry,
                         AuthorizationCodeStore authorizationCodeStore,
                         AccessTokenStore accessTokenStore) {
        this.clientRegistry = clientRegistry;
        this.authorizationCodeStore = authorizationCodeStore;
        this.accessTokenStore = accessTokenStore;
    }

    @PostMapping(value = "/oauth/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Map<String, Object>> token(@RequestParam MultiValueMap<String, String> parameters,
                                                     @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        ValidationResult<Map<String, Object>> result = TokenRequestParameters.parse(parameters, authorization)
                .flatMap(this::authenticateClient)
                .flatMap(this::exchange);
        if (!result.isValid()) {
            LOG.info(String.format("Token request rejected with %s: %s", result.getError(), result.getDescription()));
            return errorResponse(result, authorization);
        }
        return ResponseEntity.ok().headers(responseHeaders()).body(result.getValue());
    }

    private ValidationResult<AuthenticatedClient> authenticateClient(TokenRequestParameters parameters) {
        MDCContext.mdcContext("action", "Token", "client_id", parameters.getClientId());
        Optional<OAuthClient> optionalClient = clientRegistry.getActiveById(parameters.getClientId());
        if (!optionalClient.isPresent()) {
            return ValidationResult.error(ErrorKind.INVALID_CLIENT, "Client authentication failed");
        }
        OAuthClient client = optionalClient.get();
        if (!client.isPublicClient() && !clientRegistry.verifySecret(client, parameters.getClientSecret())) {
            return ValidationResult.error(ErrorKind.INVALID_CLIENT, "Client authentication failed");
        }
        return ValidationResult.ok(new AuthenticatedClient(client, parameters));
    }

    private ValidationResult<Map<String, Object>> exchange(AuthenticatedClient authenticatedClient) {
        TokenRequestParameters parameters = authenticatedClient.parameters;
        OAuthClient client = authenticatedClient.client;

        //the code is burned before any other check, a failed exchange can not be retried with the same code
        Optional<AuthorizationCode> optionalCode = authorizationCodeStore.consume(parameters.getCode());
        if (!optionalCode.isPresent()) {
            return ValidationResult.error(ErrorKind.INVALID_GRANT, INVALID_GRANT_DESCRIPTION);
        }
        AuthorizationCode authorizationCode = optionalCode.get();
        if (!authorizationCode.getClientId().equals(client.getId()) ||
                !authorizationCode.getRedirectUri().equals(parameters.getRedirectUri())) {
            LOG.warn(String.format("Authorization code of client %s redeemed by client %s or with another redirect_uri",
                    authorizationCode.getClientId(), client.getId()));
            return ValidationResult.error(ErrorKind.INVALID_GRANT, INVALID_GRANT_DESCRIPTION);
        }
        if (authorizationCode.hasCodeChallenge()) {
            if (!PkceVerifier.verify(parameters.getCodeVerifier(), authorizationCode.getCodeChallenge())) {
                return ValidationResult.error(ErrorKind.INVALID_GRANT, "code_verifier does not match the code_challenge");
            }
        } else if (client.isPublicClient()) {
            return ValidationResult.error(ErrorKind.INVALID_GRANT, "Public clients must use PKCE");
        }

        IssuedAccessToken accessToken = accessTokenStore.issue(client.getId(), authorizationCode.getUserId(),
                authorizationCode.getScopes());
        LOG.info(String.format("Issued access token to client %s for user %s", client.getId(), authorizationCode.getUserId()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", accessToken.getToken());
        body.put("token_type", AccessTokenType.BEARER.getValue());
        body.put("expires_in", accessToken.getExpiresIn());
        body.put("scope", String.join(" ", authorizationCode.getScopes()));
        return ValidationResult.ok(body);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(ValidationResult<?> result, String authorization) {
        ErrorKind error = result.getError();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.getErrorCode());
        body.put("error_description", result.getDescription());
        HttpHeaders headers = responseHeaders();
        if (error == ErrorKind.INVALID_CLIENT && authorization != null && authorization.regionMatches(true, 0, "Basic ", 0, 6)) {
            headers.add(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oauth\"");
        }
        return new ResponseEntity<>(body, headers, error.getStatus());
    }

    private HttpHeaders responseHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl("no-store");
        headers.setPragma("no-cache");
        return headers;
    }

    private static class AuthenticatedClient {

        private final OAuthClient client;
        private final TokenRequestParameters parameters;

        private AuthenticatedClient(OAuthClient client, TokenRequestParameters parameters) {
            this.client = client;
            this.parameters = parameters;
        }
    }
}
