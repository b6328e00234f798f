package oauth.endpoints;

import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Single valued access to request parameters. OAuth forbids repeating a parameter, a request that does so is
 * malformed as a whole.
 */
class RequestParameters {

    private final MultiValueMap<String, String> parameters;

    RequestParameters(MultiValueMap<String, String> parameters) {
        this.parameters = parameters;
    }

    Optional<String> repeatedParameter(Collection<String> names) {
        return names.stream().filter(name -> {
            List<String> values = parameters.get(name);
            return values != null && values.size() > 1;
        }).findFirst();
    }

    /**
     * @return the value or null when absent or blank
     */
    String get(String name) {
        String value = parameters.getFirst(name);
        return StringUtils.hasText(value) ? value : null;
    }
}
