package oauth.endpoints;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.util.MultiValueMap;

import java.util.Collections;

/**
 * The posted consent form: the echoed authorization parameters plus the choice of the user.
 */
@Getter
@AllArgsConstructor
public class ConsentDecision {

    public static final String ALLOW = "allow";
    public static final String DENY = "deny";

    private final AuthorizationParameters parameters;
    private final String action;

    public static ValidationResult<ConsentDecision> parse(MultiValueMap<String, String> parameterMap) {
        RequestParameters parameters = new RequestParameters(parameterMap);
        if (parameters.repeatedParameter(Collections.singletonList("action")).isPresent()) {
            return ValidationResult.error(ErrorKind.MALFORMED_REQUEST, "Parameter action is repeated");
        }
        return AuthorizationParameters.parse(parameterMap)
                .map(authorizationParameters -> new ConsentDecision(authorizationParameters, parameters.get("action")));
    }

    public boolean isAllow() {
        return ALLOW.equals(action);
    }

    public boolean isDeny() {
        return DENY.equals(action);
    }
}
