package oauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownClientException extends BaseException {

    public UnknownClientException(String clientId) {
        super("not_found", String.format("Client %s not found", clientId));
    }
}
