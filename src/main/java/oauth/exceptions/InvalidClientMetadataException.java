package oauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidClientMetadataException extends BaseException {

    public InvalidClientMetadataException(String message) {
        super("invalid_client_metadata", message);
    }
}
