package oauth.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BaseExceptionTest {

    @Test
    void errorCodes() {
        assertEquals("not_found", new UnknownClientException("c-1").getErrorCode());
        assertEquals("public_client", new PublicClientException("c-1").getErrorCode());
        assertEquals("invalid_client_metadata", new InvalidClientMetadataException("Bad").getErrorCode());
    }

    @Test
    void string() {
        assertEquals("PublicClientException public_client: Client c-1 is a public client and has no secret",
                new PublicClientException("c-1").toString());
    }
}
