package oauth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;

/**
 * Metadata of a new client as posted by an administrator.
 */
@Getter
public class ClientRegistration {

    private final String name;
    private final String description;
    private final List<String> redirectUris;
    private final List<String> allowedScopes;
    private final boolean publicClient;

    @JsonCreator
    public ClientRegistration(@JsonProperty("name") String name,
                              @JsonProperty("description") String description,
                              @JsonProperty("redirectUris") List<String> redirectUris,
                              @JsonProperty("allowedScopes") List<String> allowedScopes,
                              @JsonProperty("isPublic") Boolean publicClient) {
        this.name = name;
        this.description = description;
        this.redirectUris = redirectUris;
        this.allowedScopes = allowedScopes;
        this.publicClient = publicClient != null && publicClient;
    }
}
