package oauth.endpoints;

import com.nimbusds.oauth2.sdk.ResponseType;
import oauth.crypto.PkceVerifier;
import oauth.model.OAuthClient;
import oauth.service.ClientRegistry;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates an authorization request in a fixed order. Until the redirect URI is proven to be registered for the
 * client every error is shown on our own error page, afterwards errors are returned to the client.
 */
@Component
public class AuthorizationRequestValidator {

    public static final String DEFAULT_SCOPE = "profile";

    private static final Pattern SCOPE_SEPARATOR = Pattern.compile("[\\s+]+");
    private static final String CODE = ResponseType.Value.CODE.getValue();

    private final ClientRegistry clientRegistry;

    public AuthorizationRequestValidator(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    public ValidationResult<ValidatedAuthorizationRequest> validate(AuthorizationParameters parameters) {
        if (!CODE.equals(parameters.getResponseType())) {
            return ValidationResult.error(ErrorKind.UNSUPPORTED_RESPONSE_TYPE,
                    String.format("Unsupported response_type %s, only %s is supported", parameters.getResponseType(), CODE));
        }
        return validateClient(parameters).flatMap(client -> validateScopesAndPkce(parameters, client));
    }

    /**
     * Client must exist, be active and have the exact redirect URI registered.
     */
    public ValidationResult<OAuthClient> validateClient(AuthorizationParameters parameters) {
        if (parameters.getClientId() == null || parameters.getRedirectUri() == null) {
            return ValidationResult.error(ErrorKind.MALFORMED_REQUEST, "Parameters client_id and redirect_uri are required");
        }
        Optional<OAuthClient> optionalClient = clientRegistry.getActiveById(parameters.getClientId());
        if (!optionalClient.isPresent()) {
            return ValidationResult.error(ErrorKind.UNKNOWN_CLIENT, "Unknown or inactive client");
        }
        OAuthClient client = optionalClient.get();
        if (!client.isRedirectUriRegistered(parameters.getRedirectUri())) {
            return ValidationResult.error(ErrorKind.REDIRECT_URI_MISMATCH, "redirect_uri is not registered for this client");
        }
        return ValidationResult.ok(client);
    }

    public ValidationResult<ValidatedAuthorizationRequest> validateScopesAndPkce(AuthorizationParameters parameters,
                                                                                 OAuthClient client) {
        return validateScopes(client, parameters.getScope())
                .flatMap(scopes -> validatePkce(client, parameters.getCodeChallenge(), parameters.getCodeChallengeMethod())
                        .map(ignored -> new ValidatedAuthorizationRequest(parameters, client, scopes)));
    }

    public static ValidationResult<List<String>> validateScopes(OAuthClient client, String scope) {
        List<String> scopes = parseScopes(scope);
        List<String> notAllowed = scopes.stream().filter(s -> !client.isScopeAllowed(s)).collect(Collectors.toList());
        if (!notAllowed.isEmpty()) {
            return ValidationResult.error(ErrorKind.INVALID_SCOPE,
                    String.format("Scope(s) %s not allowed for this client", String.join(", ", notAllowed)));
        }
        return ValidationResult.ok(scopes);
    }

    public static ValidationResult<Boolean> validatePkce(OAuthClient client, String codeChallenge, String codeChallengeMethod) {
        if (codeChallenge == null) {
            if (client.isPublicClient()) {
                return ValidationResult.error(ErrorKind.INVALID_PKCE_REQUEST, "code_challenge is required for public clients");
            }
            return ValidationResult.ok(Boolean.FALSE);
        }
        if (!PkceVerifier.isSupportedMethod(codeChallengeMethod)) {
            return ValidationResult.error(ErrorKind.INVALID_PKCE_REQUEST,
                    String.format("code_challenge_method must be %s", PkceVerifier.S256));
        }
        return ValidationResult.ok(Boolean.TRUE);
    }

    /**
     * Scopes are separated by whitespace or '+'. Duplicates are dropped, an absent scope means {@value #DEFAULT_SCOPE}.
     */
    public static List<String> parseScopes(String scope) {
        if (!StringUtils.hasText(scope)) {
            return Collections.singletonList(DEFAULT_SCOPE);
        }
        List<String> scopes = Arrays.stream(SCOPE_SEPARATOR.split(scope.trim()))
                .filter(StringUtils::hasText)
                .collect(Collectors.toList());
        return scopes.isEmpty() ? Collections.singletonList(DEFAULT_SCOPE) : new ArrayList<>(new LinkedHashSet<>(scopes));
    }
}
