package oauth.service;

import oauth.crypto.SecretCodec;
import oauth.exceptions.InvalidClientMetadataException;
import oauth.exceptions.PublicClientException;
import oauth.exceptions.UnknownClientException;
import oauth.log.MDCContext;
import oauth.model.ClientRegistration;
import oauth.model.ClientUpdate;
import oauth.model.OAuthClient;
import oauth.repository.OAuthClientRepository;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registered third-party clients. Every read goes to MongoDB, so a rotated secret or a deactivation is effective
 * for the very next request.
 */
@Service
public class ClientRegistry {

    private static final Log LOG = LogFactory.getLog(ClientRegistry.class);

    private final OAuthClientRepository clientRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final FindAndModifyOptions returnNew = FindAndModifyOptions.options().returnNew(true);

    public ClientRegistry(OAuthClientRepository clientRepository, MongoTemplate mongoTemplate, Clock clock) {
        this.clientRepository = clientRepository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public RegisteredClient create(ClientRegistration registration, String createdBy) {
        if (!StringUtils.hasText(registration.getName())) {
            throw new InvalidClientMetadataException("Client name is required");
        }
        List<String> redirectUris = validRedirectUris(registration.getRedirectUris());
        List<String> allowedScopes = validScopes(registration.getAllowedScopes());

        String rawSecret = registration.isPublicClient() ? null : SecretCodec.newOpaqueToken();
        String secretHash = rawSecret != null ? SecretCodec.hashSecret(rawSecret) : null;

        OAuthClient client = new OAuthClient(UUID.randomUUID().toString(), registration.getName().trim(),
                registration.getDescription(), redirectUris, allowedScopes, registration.isPublicClient(), secretHash,
                createdBy, clock.instant());
        clientRepository.insert(client);

        MDCContext.mdcContext("action", "CreateClient", "client_id", client.getId());
        LOG.info(String.format("Created %s client %s by %s",
                client.isPublicClient() ? "public" : "confidential", client.getId(), createdBy));
        return new RegisteredClient(client, rawSecret);
    }

    public Optional<OAuthClient> getById(String id) {
        return clientRepository.findById(id);
    }

    public Optional<OAuthClient> getActiveById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return clientRepository.findByIdAndActiveTrue(id);
    }

    public List<OAuthClient> list() {
        return clientRepository.findAllByOrderByCreatedAtAsc();
    }

    /**
     * Only the fields present in the update are written, a concurrent rotation or deactivation is left intact.
     */
    public OAuthClient update(String id, ClientUpdate update) {
        OAuthClient client = clientRepository.findById(id).orElseThrow(() -> new UnknownClientException(id));
        Update changes = new Update();
        if (update.getName() != null) {
            if (!StringUtils.hasText(update.getName())) {
                throw new InvalidClientMetadataException("Client name can not be empty");
            }
            client.setName(update.getName().trim());
            changes.set("name", client.getName());
        }
        if (update.getDescription() != null) {
            client.setDescription(update.getDescription());
            changes.set("description", client.getDescription());
        }
        if (update.getRedirectUris() != null) {
            client.setRedirectUris(validRedirectUris(update.getRedirectUris()));
            changes.set("redirectUris", client.getRedirectUris());
        }
        if (update.getAllowedScopes() != null) {
            client.setAllowedScopes(validScopes(update.getAllowedScopes()));
            changes.set("allowedScopes", client.getAllowedScopes());
        }
        if (update.getPublicClient() != null) {
            client.setPublicClient(update.getPublicClient());
            changes.set("publicClient", client.isPublicClient());
            if (client.isPublicClient()) {
                changes.unset("secretHash");
            }
        }
        if (update.getActive() != null) {
            client.setActive(update.getActive());
            changes.set("active", client.isActive());
        }
        if (!client.isConsistent()) {
            throw new InvalidClientMetadataException("Active client requires redirect URIs and scopes");
        }
        if (changes.getUpdateObject().isEmpty()) {
            return client;
        }
        OAuthClient updated = modify(new Query(Criteria.where("id").is(id)), changes)
                .orElseThrow(() -> new UnknownClientException(id));
        LOG.info(String.format("Updated client %s", id));
        return updated;
    }

    public OAuthClient deactivate(String id) {
        OAuthClient deactivated = modify(new Query(Criteria.where("id").is(id)), Update.update("active", false))
                .orElseThrow(() -> new UnknownClientException(id));
        LOG.info(String.format("Deactivated client %s", id));
        return deactivated;
    }

    /**
     * The new hash is only written while the client is still confidential.
     */
    public RegisteredClient rotateSecret(String id) {
        String rawSecret = SecretCodec.newOpaqueToken();
        Query query = new Query(Criteria.where("id").is(id).and("publicClient").is(false));
        Optional<OAuthClient> rotated = modify(query, Update.update("secretHash", SecretCodec.hashSecret(rawSecret)));
        if (!rotated.isPresent()) {
            if (clientRepository.existsById(id)) {
                throw new PublicClientException(id);
            }
            throw new UnknownClientException(id);
        }
        LOG.info(String.format("Rotated secret of client %s", id));
        return new RegisteredClient(rotated.get(), rawSecret);
    }

    public boolean verifySecret(OAuthClient client, String rawSecret) {
        if (!client.hasSecret() || !StringUtils.hasText(rawSecret)) {
            return false;
        }
        return SecretCodec.constantTimeEquals(SecretCodec.hashSecret(rawSecret), client.getSecretHash());
    }

    private Optional<OAuthClient> modify(Query query, Update update) {
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, returnNew, OAuthClient.class));
    }

    private List<String> validRedirectUris(List<String> redirectUris) {
        if (CollectionUtils.isEmpty(redirectUris)) {
            throw new InvalidClientMetadataException("At least one redirect URI is required");
        }
        List<String> result = new ArrayList<>(new LinkedHashSet<>(redirectUris));
        for (String redirectUri : result) {
            if (!StringUtils.hasText(redirectUri)) {
                throw new InvalidClientMetadataException("Redirect URI can not be empty");
            }
            try {
                URI uri = new URI(redirectUri);
                if (!uri.isAbsolute() || uri.getRawFragment() != null) {
                    throw new InvalidClientMetadataException(
                            String.format("Redirect URI %s must be absolute and without a fragment", redirectUri));
                }
            } catch (URISyntaxException e) {
                throw new InvalidClientMetadataException(String.format("Redirect URI %s is not a valid URI", redirectUri));
            }
        }
        return result;
    }

    private List<String> validScopes(List<String> scopes) {
        if (CollectionUtils.isEmpty(scopes)) {
            throw new InvalidClientMetadataException("At least one scope is required");
        }
        List<String> result = new ArrayList<>(new LinkedHashSet<>(scopes));
        result.forEach(scope -> {
            if (!StringUtils.hasText(scope) || StringUtils.containsWhitespace(scope)) {
                throw new InvalidClientMetadataException(String.format("Invalid scope '%s'", scope));
            }
        });
        return result;
    }
}
