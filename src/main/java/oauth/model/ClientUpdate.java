package oauth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;

/**
 * Partial update of a client. A null field leaves the stored value untouched.
 */
@Getter
public class ClientUpdate {

    private final String name;
    private final String description;
    private final List<String> redirectUris;
    private final List<String> allowedScopes;
    private final Boolean publicClient;
    private final Boolean active;

    @JsonCreator
    public ClientUpdate(@JsonProperty("name") String name,
                        @JsonProperty("description") String description,
                        @JsonProperty("redirectUris") List<String> redirectUris,
                        @JsonProperty("allowedScopes") List<String> allowedScopes,
                        @JsonProperty("isPublic") Boolean publicClient,
                        @JsonProperty("isActive") Boolean active) {
        this.name = name;
        this.description = description;
        this.redirectUris = redirectUris;
        this.allowedScopes = allowedScopes;
        this.publicClient = publicClient;
        this.active = active;
    }
}
