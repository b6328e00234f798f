package oauth.mongo;

import oauth.model.AccessToken;
import oauth.model.AuthorizationCode;
import oauth.model.OAuthClient;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * Ensures the indexes the token and code lookups and the cleaner rely on. Creating an existing index is a no-op.
 */
@Configuration
public class MongoConfiguration {

    private static final Log LOG = LogFactory.getLog(MongoConfiguration.class);

    private final MongoTemplate mongoTemplate;

    public MongoConfiguration(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        IndexOperations codeIndexes = mongoTemplate.indexOps(AuthorizationCode.class);
        codeIndexes.ensureIndex(new Index("code", Sort.Direction.ASC).named("code_unique").unique());
        codeIndexes.ensureIndex(new Index("expiresAt", Sort.Direction.ASC).named("code_expires_at"));

        IndexOperations tokenIndexes = mongoTemplate.indexOps(AccessToken.class);
        tokenIndexes.ensureIndex(new Index("token", Sort.Direction.ASC).named("token_unique").unique());
        tokenIndexes.ensureIndex(new Index("expiresAt", Sort.Direction.ASC).named("token_expires_at"));

        mongoTemplate.indexOps(OAuthClient.class)
                .ensureIndex(new Index("createdAt", Sort.Direction.ASC).named("client_created_at"));
        LOG.info("Ensured indexes of the OAuth collections");
    }
}
