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
@Document(collection = "oauth_access_tokens")
public class AccessToken {

    @Id
    private String id;

    private String token;

    private String clientId;

    private String userId;

    private List<String> scopes;

    private Instant expiresAt;

    private Instant revokedAt;

    private Instant createdAt;

    public AccessToken(String token, String clientId, String userId, List<String> scopes, Instant expiresAt,
                       Instant createdAt) {
        this.token = token;
        this.clientId = clientId;
        this.userId = userId;
        this.scopes = scopes;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    @Transient
    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    @Transient
    public boolean isRevoked() {
        return revokedAt != null;
    }

    @Transient
    public boolean isValid(Clock clock) {
        return !isRevoked() && !isExpired(clock);
    }

    @Transient
    public boolean hasScope(String scope) {
        return scopes != null && scopes.contains(scope);
    }
}
