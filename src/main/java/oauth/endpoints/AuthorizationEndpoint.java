package oauth.endpoints;

import jakarta.servlet.http.HttpServletRequest;
import oauth.config.ScopeDescriptions;
import oauth.identity.IdentityProvider;
import oauth.log.MDCContext;
import oauth.model.AuthenticatedUser;
import oauth.model.OAuthClient;
import oauth.service.AuthorizationCodeStore;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Browser facing part of the authorization code flow. A request moves from validation, to waiting for a session of
 * the user, to consent and finally to issuing a code. Each step yields a {@link ValidationResult} and the endpoint
 * only decides how an error is presented.
 */
@Controller
public class AuthorizationEndpoint {

    private static final Log LOG = LogFactory.getLog(AuthorizationEndpoint.class);

    private final AuthorizationRequestValidator validator;
    private final AuthorizationCodeStore authorizationCodeStore;
    private final IdentityProvider identityProvider;
    private final ScopeDescriptions scopeDescriptions;
    private final String loginUrl;

    public AuthorizationEndpoint(AuthorizationRequestValidator validator,
                                 AuthorizationCodeStore authorizationCodeStore,
                                 IdentityProvider identityProvider,
                                 ScopeDescriptions scopeDescriptions,
                                 @Value("${oauth.login-url}") String loginUrl) {
        this.validator = validator;
        this.authorizationCodeStore = authorizationCodeStore;
        this.identityProvider = identityProvider;
        this.scopeDescriptions = scopeDescriptions;
        this.loginUrl = loginUrl;
    }

    @GetMapping("/oauth/authorize")
    public ModelAndView authorize(@RequestParam MultiValueMap<String, String> parameters, HttpServletRequest request) {
        ValidationResult<AuthorizationParameters> parsed = AuthorizationParameters.parse(parameters);
        if (!parsed.isValid()) {
            return errorResponse(parsed, null);
        }
        AuthorizationParameters authorizationParameters = parsed.getValue();
        MDCContext.mdcContext("action", "Authorize", "client_id", authorizationParameters.getClientId());

        ValidationResult<ValidatedAuthorizationRequest> validated = validator.validate(authorizationParameters);
        if (!validated.isValid()) {
            return errorResponse(validated, authorizationParameters);
        }
        ValidatedAuthorizationRequest authorizationRequest = validated.getValue();

        if (authorizationParameters.getSessionToken() == null) {
            String next = request.getRequestURL().toString() +
                    (StringUtils.hasText(request.getQueryString()) ? "?" + request.getQueryString() : "");
            String location = UriComponentsBuilder.fromUriString(loginUrl)
                    .queryParam("next", UriUtils.encodeQueryParam(next, StandardCharsets.UTF_8))
                    .build(true)
                    .toUriString();
            LOG.debug("No session token present, redirecting to login");
            RedirectView redirectView = new RedirectView(location);
            redirectView.setExpandUriTemplateVariables(false);
            return new ModelAndView(redirectView);
        }

        Optional<AuthenticatedUser> optionalUser = identityProvider.authenticate(authorizationParameters.getSessionToken());
        if (!optionalUser.isPresent()) {
            return errorResponse(ValidationResult.error(ErrorKind.INVALID_SESSION, "Your session is invalid or expired"),
                    authorizationParameters);
        }
        AuthenticatedUser user = optionalUser.get();
        MDCContext.mdcContext(user);
        LOG.info(String.format("Asking consent of user %s for client %s", user.getId(), authorizationRequest.getClient().getId()));
        return consentPage(authorizationRequest);
    }

    @PostMapping(value = "/oauth/authorize/confirm", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ModelAndView confirm(@RequestParam MultiValueMap<String, String> parameters) {
        ValidationResult<ConsentDecision> parsed = ConsentDecision.parse(parameters);
        if (!parsed.isValid()) {
            return errorResponse(parsed, null);
        }
        ConsentDecision decision = parsed.getValue();
        AuthorizationParameters authorizationParameters = decision.getParameters();
        MDCContext.mdcContext("action", "Consent", "client_id", authorizationParameters.getClientId());

        ValidationResult<OAuthClient> clientResult = validator.validateClient(authorizationParameters);
        if (!clientResult.isValid()) {
            return errorResponse(clientResult, authorizationParameters);
        }
        if (decision.isDeny()) {
            LOG.info(String.format("User denied access to client %s", authorizationParameters.getClientId()));
            return errorResponse(ValidationResult.error(ErrorKind.ACCESS_DENIED, "The user denied the request"),
                    authorizationParameters);
        }
        if (!decision.isAllow()) {
            return errorResponse(ValidationResult.error(ErrorKind.INVALID_CONSENT_ACTION, "action must be allow or deny"),
                    authorizationParameters);
        }

        ValidationResult<ValidatedAuthorizationRequest> validated =
                validator.validateScopesAndPkce(authorizationParameters, clientResult.getValue());
        if (!validated.isValid()) {
            return errorResponse(validated, authorizationParameters);
        }
        Optional<AuthenticatedUser> optionalUser = identityProvider.authenticate(authorizationParameters.getSessionToken());
        if (!optionalUser.isPresent()) {
            return errorResponse(ValidationResult.error(ErrorKind.INVALID_SESSION, "Your session is invalid or expired"),
                    authorizationParameters);
        }
        AuthenticatedUser user = optionalUser.get();
        MDCContext.mdcContext(user);

        ValidatedAuthorizationRequest authorizationRequest = validated.getValue();
        String code = authorizationCodeStore.issue(
                authorizationRequest.getClient().getId(),
                user.getId(),
                authorizationParameters.getRedirectUri(),
                authorizationRequest.getScopes(),
                authorizationParameters.getCodeChallenge(),
                authorizationParameters.getCodeChallengeMethod());
        LOG.info(String.format("Issued authorization code to client %s for user %s", authorizationRequest.getClient().getId(), user.getId()));

        Map<String, String> queryParameters = new LinkedHashMap<>();
        queryParameters.put("code", code);
        return redirect(authorizationParameters.getRedirectUri(), queryParameters, authorizationParameters.getState());
    }

    private ModelAndView consentPage(ValidatedAuthorizationRequest authorizationRequest) {
        AuthorizationParameters parameters = authorizationRequest.getParameters();
        OAuthClient client = authorizationRequest.getClient();
        List<String> scopes = authorizationRequest.getScopes();

        Map<String, Object> body = new HashMap<>();
        body.put("client", client.getName());
        body.put("clientDescription", client.getDescription());
        body.put("scopes", scopeDescriptions.labels(scopes));

        Map<String, String> hidden = new HashMap<>();
        hidden.put("response_type", parameters.getResponseType());
        hidden.put("client_id", parameters.getClientId());
        hidden.put("redirect_uri", parameters.getRedirectUri());
        hidden.put("scope", String.join(" ", scopes));
        hidden.put("state", parameters.getState());
        hidden.put("code_challenge", parameters.getCodeChallenge());
        hidden.put("code_challenge_method", parameters.getCodeChallengeMethod());
        hidden.put("token", parameters.getSessionToken());
        hidden.values().removeIf(Objects::isNull);
        body.put("parameters", hidden);
        return new ModelAndView("consent", body);
    }

    private ModelAndView errorResponse(ValidationResult<?> result, AuthorizationParameters parameters) {
        ErrorKind error = result.getError();
        LOG.info(String.format("Authorization request rejected with %s: %s", error, result.getDescription()));
        if (error.getDisposition() == Disposition.CLIENT_REDIRECT && parameters != null) {
            Map<String, String> queryParameters = new LinkedHashMap<>();
            queryParameters.put("error", error.getErrorCode());
            queryParameters.put("error_description", result.getDescription());
            return redirect(parameters.getRedirectUri(), queryParameters, parameters.getState());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("error", error.getErrorCode());
        body.put("error_description", result.getDescription());
        return new ModelAndView("oauth_error", body, error.getStatus());
    }

    /**
     * The redirect URI is registered verbatim, so its own query string is kept and ours is appended.
     */
    private ModelAndView redirect(String redirectUri, Map<String, String> queryParameters, String state) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(redirectUri);
        queryParameters.forEach((name, value) -> builder.queryParam(name, UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8)));
        if (StringUtils.hasText(state)) {
            builder.queryParam("state", UriUtils.encodeQueryParam(state, StandardCharsets.UTF_8));
        }
        RedirectView redirectView = new RedirectView(builder.build(true).toUriString());
        redirectView.setExpandUriTemplateVariables(false);
        return new ModelAndView(redirectView);
    }
}
