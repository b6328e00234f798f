package oauth.repository;

import oauth.model.OAuthClient;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OAuthClientRepository extends MongoRepository<OAuthClient, String> {

    Optional<OAuthClient> findByIdAndActiveTrue(String id);

    List<OAuthClient> findAllByOrderByCreatedAtAsc();

}
