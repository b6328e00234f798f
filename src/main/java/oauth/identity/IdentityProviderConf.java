package oauth.identity;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class IdentityProviderConf {

    @Bean
    public IdentityProvider identityProvider(@Value("${identity.mock}") boolean identityMock,
                                             @Value("${identity.url}") String identityBaseUrl,
                                             @Value("${identity.api-key}") String apiKey) throws IOException {
        return identityMock ? new MockIdentityProvider() : new RemoteIdentityProvider(identityBaseUrl, apiKey);
    }

}
