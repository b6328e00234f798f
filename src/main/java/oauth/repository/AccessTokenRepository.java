package oauth.repository;

import oauth.model.AccessToken;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface AccessTokenRepository extends MongoRepository<AccessToken, String> {

    Optional<AccessToken> findByToken(String token);

    Long deleteByExpiresAtBefore(Instant expiryDate);

}
