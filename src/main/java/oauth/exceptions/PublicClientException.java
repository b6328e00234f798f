package oauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class PublicClientException extends BaseException {

    public PublicClientException(String clientId) {
        super("public_client", String.format("Client %s is a public client and has no secret", clientId));
    }
}
