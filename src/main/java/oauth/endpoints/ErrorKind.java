package oauth.endpoints;

import com.nimbusds.oauth2.sdk.OAuth2Error;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorKind {

    MALFORMED_REQUEST(OAuth2Error.INVALID_REQUEST_CODE, HttpStatus.BAD_REQUEST, Disposition.ERROR_PAGE),
    UNSUPPORTED_RESPONSE_TYPE(OAuth2Error.UNSUPPORTED_RESPONSE_TYPE_CODE, HttpStatus.BAD_REQUEST, Disposition.ERROR_PAGE),
    UNKNOWN_CLIENT(OAuth2Error.INVALID_CLIENT_CODE, HttpStatus.BAD_REQUEST, Disposition.ERROR_PAGE),
    REDIRECT_URI_MISMATCH(OAuth2Error.INVALID_REQUEST_CODE, HttpStatus.BAD_REQUEST, Disposition.ERROR_PAGE),
    INVALID_SESSION(OAuth2Error.ACCESS_DENIED_CODE, HttpStatus.UNAUTHORIZED, Disposition.ERROR_PAGE),

    INVALID_SCOPE(OAuth2Error.INVALID_SCOPE_CODE, HttpStatus.FOUND, Disposition.CLIENT_REDIRECT),
    INVALID_PKCE_REQUEST(OAuth2Error.INVALID_REQUEST_CODE, HttpStatus.FOUND, Disposition.CLIENT_REDIRECT),
    INVALID_CONSENT_ACTION(OAuth2Error.INVALID_REQUEST_CODE, HttpStatus.FOUND, Disposition.CLIENT_REDIRECT),
    ACCESS_DENIED(OAuth2Error.ACCESS_DENIED_CODE, HttpStatus.FOUND, Disposition.CLIENT_REDIRECT),

    UNSUPPORTED_GRANT_TYPE(OAuth2Error.UNSUPPORTED_GRANT_TYPE_CODE, HttpStatus.BAD_REQUEST, Disposition.JSON),
    INVALID_TOKEN_REQUEST(OAuth2Error.INVALID_REQUEST_CODE, HttpStatus.BAD_REQUEST, Disposition.JSON),
    INVALID_CLIENT(OAuth2Error.INVALID_CLIENT_CODE, HttpStatus.UNAUTHORIZED, Disposition.JSON),
    INVALID_GRANT(OAuth2Error.INVALID_GRANT_CODE, HttpStatus.BAD_REQUEST, Disposition.JSON);

    private final String errorCode;
    private final HttpStatus status;
    private final Disposition disposition;

    ErrorKind(String errorCode, HttpStatus status, Disposition disposition) {
        this.errorCode = errorCode;
        this.status = status;
        this.disposition = disposition;
    }
}
