package oauth.api;

import oauth.exceptions.UnknownClientException;
import oauth.model.AuthenticatedUser;
import oauth.model.ClientRegistration;
import oauth.model.ClientUpdate;
import oauth.model.OAuthClient;
import oauth.service.ClientRegistry;
import oauth.service.RegisteredClient;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client management for administrators. The stored secret hash never leaves the server, a raw secret is only
 * returned by create and rotate-secret.
 */
@RestController
@RequestMapping("/admin/oauth-clients")
@PreAuthorize("hasRole('admin')")
public class ClientAdminController {

    private static final Log LOG = LogFactory.getLog(ClientAdminController.class);

    private final ClientRegistry clientRegistry;

    public ClientAdminController(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    @GetMapping
    public List<Map<String, Object>> list() {
        return clientRegistry.list().stream().map(ClientAdminController::representation).collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody ClientRegistration registration,
                                                      Authentication authentication) {
        AuthenticatedUser admin = (AuthenticatedUser) authentication.getPrincipal();
        LOG.info(String.format("Registering client %s by %s", registration.getName(), admin.getEmail()));

        RegisteredClient registeredClient = clientRegistry.create(registration, admin.getId());
        Map<String, Object> body = representation(registeredClient.getClient());
        body.put("client_secret", registeredClient.getClientSecret());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable("id") String id) {
        return clientRegistry.getById(id)
                .map(ClientAdminController::representation)
                .orElseThrow(() -> new UnknownClientException(id));
    }

    @PatchMapping("/{id}")
    public Map<String, Object> update(@PathVariable("id") String id, @RequestBody ClientUpdate update,
                                      Authentication authentication) {
        LOG.info(String.format("Updating client %s by %s", id, ((AuthenticatedUser) authentication.getPrincipal()).getEmail()));
        return representation(clientRegistry.update(id, update));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> deactivate(@PathVariable("id") String id, Authentication authentication) {
        LOG.info(String.format("Deactivating client %s by %s", id, ((AuthenticatedUser) authentication.getPrincipal()).getEmail()));
        clientRegistry.deactivate(id);
        return Collections.singletonMap("success", true);
    }

    @PostMapping("/{id}/rotate-secret")
    public Map<String, Object> rotateSecret(@PathVariable("id") String id, Authentication authentication) {
        LOG.info(String.format("Rotating secret of client %s by %s", id, ((AuthenticatedUser) authentication.getPrincipal()).getEmail()));
        RegisteredClient registeredClient = clientRegistry.rotateSecret(id);
        return Collections.singletonMap("client_secret", registeredClient.getClientSecret());
    }

    static Map<String, Object> representation(OAuthClient client) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", client.getId());
        result.put("name", client.getName());
        result.put("description", client.getDescription());
        result.put("redirectUris", client.getRedirectUris());
        result.put("allowedScopes", client.getAllowedScopes());
        result.put("isPublic", client.isPublicClient());
        result.put("isActive", client.isActive());
        result.put("createdBy", client.getCreatedBy());
        result.put("createdAt", client.getCreatedAt());
        return result;
    }
}
