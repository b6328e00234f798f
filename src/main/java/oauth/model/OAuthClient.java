package oauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@NoArgsConstructor
@Document(collection = "oauth_clients")
public class OAuthClient {

    @Id
    private String id;
    private String name;
    private String description;
    private List<String> redirectUris = new ArrayList<>();
    private List<String> allowedScopes = new ArrayList<>();
    private boolean publicClient;
    //hex SHA-256 of the raw secret, never the secret itself
    private String secretHash;
    private boolean active;
    private String createdBy;
    private Instant createdAt;

    public OAuthClient(String id, String name, String description, List<String> redirectUris,
                       List<String> allowedScopes, boolean publicClient, String secretHash, String createdBy,
                       Instant createdAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.redirectUris = redirectUris;
        this.allowedScopes = allowedScopes;
        this.publicClient = publicClient;
        this.secretHash = publicClient ? null : secretHash;
        this.active = true;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    @Transient
    public boolean isRedirectUriRegistered(String redirectUri) {
        return redirectUri != null && redirectUris != null && redirectUris.contains(redirectUri);
    }

    @Transient
    public boolean isScopeAllowed(String scope) {
        return allowedScopes != null && allowedScopes.contains(scope);
    }

    @Transient
    public boolean hasSecret() {
        return StringUtils.hasText(secretHash);
    }

    @Transient
    public boolean isConsistent() {
        if (publicClient && secretHash != null) {
            return false;
        }
        return !active || (!CollectionUtils.isEmpty(redirectUris) && !CollectionUtils.isEmpty(allowedScopes));
    }

    public void setName(String name) {
        this.name = name;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setRedirectUris(List<String> redirectUris) {
        this.redirectUris = redirectUris;
    }

    public void setAllowedScopes(List<String> allowedScopes) {
        this.allowedScopes = allowedScopes;
    }

    public void setPublicClient(boolean publicClient) {
        this.publicClient = publicClient;
        if (publicClient) {
            this.secretHash = null;
        }
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
