package oauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@NoArgsConstructor
@Getter
@Document(collection = "oauth_authorization_codes")
public class AuthorizationCode {

    @Id
    private String id;

    private String code;

    private String clientId;

    private String userId;

    private String redirectUri;

    private List<String> scopes;

    private String codeChallenge;

    private String codeChallengeMethod;

    private Instant expiresAt;

    private Instant usedAt;

    public AuthorizationCode(String code, String clientId, String userId, String redirectUri, List<String> scopes,
                             String codeChallenge, String codeChallengeMethod, Instant expiresAt) {
        this.code = code;
        this.clientId = clientId;
        this.userId = userId;
        this.redirectUri = redirectUri;
        this.scopes = scopes;
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallenge != null ? codeChallengeMethod : null;
        this.expiresAt = expiresAt;
    }

    /**
     * A code expiring at exactly this instant is expired.
     */
    @Transient
    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    @Transient
    public boolean isUsed() {
        return usedAt != null;
    }

    @Transient
    public boolean hasCodeChallenge() {
        return codeChallenge != null;
    }
}
