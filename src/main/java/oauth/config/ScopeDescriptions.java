package oauth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human readable consent labels per scope. Unknown scopes are shown by their name.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scopes")
public class ScopeDescriptions {

    private Map<String, String> labels = new HashMap<>();

    public String label(String scope) {
        return labels.getOrDefault(scope, scope);
    }

    public List<String> labels(List<String> scopes) {
        return scopes.stream().map(this::label).collect(Collectors.toList());
    }
}
