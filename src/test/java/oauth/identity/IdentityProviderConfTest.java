package oauth.identity;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityProviderConfTest {

    private final IdentityProviderConf subject = new IdentityProviderConf();

    @Test
    void remoteIdentityProvider() throws IOException {
        assertTrue(subject.identityProvider(false, "http://localhost:54321", "key") instanceof RemoteIdentityProvider);
    }

    @Test
    void mockIdentityProvider() throws IOException {
        assertTrue(subject.identityProvider(true, "http://localhost:54321", "key") instanceof MockIdentityProvider);
    }

    @Test
    void applicationDefaultsDoNotTrustFixedSessions() {
        YamlPropertiesFactoryBean factoryBean = new YamlPropertiesFactoryBean();
        factoryBean.setResources(new ClassPathResource("application.yml"));
        Properties properties = factoryBean.getObject();

        assertEquals("false", String.valueOf(properties.get("identity.mock")));
        assertFalse(properties.keySet().stream().anyMatch(name -> name.toString().startsWith("admin.emails[")));
    }
}
