package oauth.endpoints;

import com.nimbusds.oauth2.sdk.OAuth2Error;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import com.nimbusds.oauth2.sdk.token.BearerTokenError;
import oauth.log.MDCContext;
import oauth.model.AccessToken;
import oauth.model.User;
import oauth.repository.UserRepository;
import oauth.service.AccessTokenStore;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
public class UserInfoEndpoint {

    private static final Log LOG = LogFactory.getLog(UserInfoEndpoint.class);

    public static final String PROFILE_SCOPE = "profile";
    public static final String EMAIL_SCOPE = "email";

    private final AccessTokenStore accessTokenStore;
    private final UserRepository userRepository;

    public UserInfoEndpoint(AccessTokenStore accessTokenStore, UserRepository userRepository) {
        this.accessTokenStore = accessTokenStore;
        this.userRepository = userRepository;
    }

    @GetMapping("/oauth/userinfo")
    public ResponseEntity<Map<String, Object>> getUserInfo(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return userInfo(authorization);
    }

    @PostMapping("/oauth/userinfo")
    public ResponseEntity<Map<String, Object>> postUserInfo(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return userInfo(authorization);
    }

    private ResponseEntity<Map<String, Object>> userInfo(String authorization) {
        if (!StringUtils.hasText(authorization)) {
            return unauthorized(BearerTokenError.MISSING_TOKEN, "Bearer access token required");
        }
        String tokenValue;
        try {
            tokenValue = BearerAccessToken.parse(authorization).getValue();
        } catch (ParseException e) {
            return unauthorized(BearerTokenError.INVALID_TOKEN, "Malformed Bearer authorization header");
        }
        Optional<AccessToken> optionalAccessToken = accessTokenStore.validate(tokenValue);
        if (!optionalAccessToken.isPresent()) {
            return unauthorized(BearerTokenError.INVALID_TOKEN, "Access token is invalid, expired or revoked");
        }
        AccessToken accessToken = optionalAccessToken.get();
        MDCContext.mdcContext("action", "UserInfo", "client_id", accessToken.getClientId(), "user_id", accessToken.getUserId());

        Optional<User> optionalUser = userRepository.findById(accessToken.getUserId());
        if (!optionalUser.isPresent()) {
            LOG.warn(String.format("User %s of a valid access token not found", accessToken.getUserId()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "not_found");
            body.put("error_description", "User not found");
            return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
        }
        return ResponseEntity.ok(claims(optionalUser.get(), accessToken));
    }

    static Map<String, Object> claims(User user, AccessToken accessToken) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", user.getId());
        if (accessToken.hasScope(PROFILE_SCOPE)) {
            claims.put("username", user.getUsername());
            claims.put("display_name", user.getDisplayName());
            claims.put("graduation_year", user.getGraduationYear());
            claims.put("major", user.getMajor());
            claims.put("bio", user.getBio());
            claims.put("avatar_url", user.getAvatarUrl());
        }
        if (accessToken.hasScope(EMAIL_SCOPE)) {
            claims.put("email", user.getEmail());
        }
        return claims;
    }

    private ResponseEntity<Map<String, Object>> unauthorized(BearerTokenError bearerTokenError, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        //a missing token carries no error code in the challenge
        String errorCode = bearerTokenError.getCode();
        body.put("error", errorCode != null ? errorCode : OAuth2Error.INVALID_REQUEST.getCode());
        body.put("error_description", description);
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.WWW_AUTHENTICATE, bearerTokenError.toWWWAuthenticateHeader());
        return new ResponseEntity<>(body, headers, HttpStatus.UNAUTHORIZED);
    }
}
