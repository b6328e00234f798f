package oauth.service;

import com.mongodb.client.result.UpdateResult;
import oauth.crypto.SecretCodec;
import oauth.model.AccessToken;
import oauth.repository.AccessTokenRepository;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class AccessTokenStore {

    private static final Log LOG = LogFactory.getLog(AccessTokenStore.class);

    private final AccessTokenRepository accessTokenRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final long accessTokenValiditySeconds;

    public AccessTokenStore(AccessTokenRepository accessTokenRepository,
                            MongoTemplate mongoTemplate,
                            Clock clock,
                            @Value("${oauth.access-token-validity-seconds}") long accessTokenValiditySeconds) {
        this.accessTokenRepository = accessTokenRepository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.accessTokenValiditySeconds = accessTokenValiditySeconds;
    }

    public IssuedAccessToken issue(String clientId, String userId, List<String> scopes) {
        String token = SecretCodec.newOpaqueToken();
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(accessTokenValiditySeconds);
        accessTokenRepository.insert(new AccessToken(token, clientId, userId, scopes, expiresAt, now));
        LOG.debug(String.format("Issued access token for client %s and user %s", clientId, userId));
        return new IssuedAccessToken(token, expiresAt, accessTokenValiditySeconds);
    }

    public Optional<AccessToken> validate(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        return accessTokenRepository.findByToken(token).filter(accessToken -> accessToken.isValid(clock));
    }

    /**
     * Returns whether this call revoked the token. Unknown and already revoked tokens are not an error.
     */
    public boolean revoke(String token) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        Query query = Query.query(Criteria.where("token").is(token).and("revokedAt").is(null));
        UpdateResult result = mongoTemplate.updateFirst(query, Update.update("revokedAt", clock.instant()), AccessToken.class);
        boolean revoked = result.getModifiedCount() > 0;
        if (revoked) {
            LOG.info("Revoked access token");
        }
        return revoked;
    }
}
