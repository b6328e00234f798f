package oauth.repository;

import oauth.model.AuthorizationCode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Claims a code with one findAndModify round trip, which MongoDB executes atomically per document. Not a
 * derived query method as Spring Data can not express a conditional update returning the changed document.
 */
@Repository
public class ConcurrentAuthorizationCodeRepository {

    private final FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
    private final MongoTemplate mongoTemplate;

    @Autowired
    public ConcurrentAuthorizationCodeRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * @return the claimed code or null when it does not exist or has been claimed before
     */
    public AuthorizationCode findByCodeNotAlreadyUsedAndMarkAsUsed(String code, Instant usedAt) {
        Query query = new Query(Criteria.where("code").is(code).and("usedAt").is(null));
        return mongoTemplate.findAndModify(query, Update.update("usedAt", usedAt), options, AuthorizationCode.class);
    }

}
