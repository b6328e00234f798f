package oauth.repository;

import oauth.model.AuthorizationCode;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface AuthorizationCodeRepository extends MongoRepository<AuthorizationCode, String> {

    Optional<AuthorizationCode> findByCode(String code);

    Long deleteByExpiresAtBefore(Instant expiryDate);

}
