package oauth.secure;

import oauth.model.AccessToken;
import oauth.model.AuthorizationCode;
import oauth.repository.AccessTokenRepository;
import oauth.repository.AuthorizationCodeRepository;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges expired codes and access tokens. Revoked tokens stay until they expire. Only one node of a cluster should
 * be configured as responsible.
 */
@Component
public class ResourceCleaner {

    private static final Log LOG = LogFactory.getLog(ResourceCleaner.class);

    private final AccessTokenRepository accessTokenRepository;
    private final AuthorizationCodeRepository authorizationCodeRepository;
    private final Clock clock;
    private final boolean cronJobResponsible;

    @Autowired
    public ResourceCleaner(AccessTokenRepository accessTokenRepository,
                           AuthorizationCodeRepository authorizationCodeRepository,
                           Clock clock,
                           @Value("${cron.node-cron-job-responsible}") boolean cronJobResponsible) {
        this.accessTokenRepository = accessTokenRepository;
        this.authorizationCodeRepository = authorizationCodeRepository;
        this.clock = clock;
        this.cronJobResponsible = cronJobResponsible;
    }

    @Scheduled(cron = "${cron.token-cleaner-expression}")
    public void clean() {
        if (!cronJobResponsible) {
            return;
        }
        Instant now = clock.instant();
        info(AccessToken.class, accessTokenRepository.deleteByExpiresAtBefore(now));
        info(AuthorizationCode.class, authorizationCodeRepository.deleteByExpiresAtBefore(now));
    }

    private void info(Class<?> clazz, long count) {
        LOG.info(String.format("Deleted %s instances of %s", count, clazz.getSimpleName()));
    }
}
