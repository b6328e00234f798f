package oauth.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class IssuedAccessToken {

    private final String token;
    private final Instant expiresAt;
    private final long expiresIn;

}
