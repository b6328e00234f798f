package oauth.endpoints;

import oauth.log.MDCContext;
import oauth.service.AccessTokenStore;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Revocation never discloses whether the token existed.
 */
@RestController
public class RevocationEndpoint {

    private static final Log LOG = LogFactory.getLog(RevocationEndpoint.class);

    private final AccessTokenStore accessTokenStore;

    public RevocationEndpoint(AccessTokenStore accessTokenStore) {
        this.accessTokenStore = accessTokenStore;
    }

    @PostMapping(value = "/oauth/revoke", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Map<String, Object>> revoke(@RequestParam MultiValueMap<String, String> parameters) {
        RequestParameters requestParameters = new RequestParameters(parameters);
        String token = requestParameters.get("token");
        if (token == null || requestParameters.repeatedParameter(Collections.singletonList("token")).isPresent()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", ErrorKind.INVALID_TOKEN_REQUEST.getErrorCode());
            body.put("error_description", "Exactly one token parameter is required");
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        }
        MDCContext.mdcContext("action", "Revoke");
        boolean revoked = accessTokenStore.revoke(token);
        LOG.debug(String.format("Revocation request handled, token state changed: %s", revoked));
        return ResponseEntity.ok(Collections.<String, Object>singletonMap("success", true));
    }
}
