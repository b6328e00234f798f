package oauth.service;

import oauth.crypto.SecretCodec;
import oauth.model.AuthorizationCode;
import oauth.repository.AuthorizationCodeRepository;
import oauth.repository.ConcurrentAuthorizationCodeRepository;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class AuthorizationCodeStore {

    private static final Log LOG = LogFactory.getLog(AuthorizationCodeStore.class);

    private final AuthorizationCodeRepository authorizationCodeRepository;
    private final ConcurrentAuthorizationCodeRepository concurrentAuthorizationCodeRepository;
    private final Clock clock;
    private final long codeValiditySeconds;

    public AuthorizationCodeStore(AuthorizationCodeRepository authorizationCodeRepository,
                                  ConcurrentAuthorizationCodeRepository concurrentAuthorizationCodeRepository,
                                  Clock clock,
                                  @Value("${oauth.authorization-code-validity-seconds}") long codeValiditySeconds) {
        this.authorizationCodeRepository = authorizationCodeRepository;
        this.concurrentAuthorizationCodeRepository = concurrentAuthorizationCodeRepository;
        this.clock = clock;
        this.codeValiditySeconds = codeValiditySeconds;
    }

    public String issue(String clientId, String userId, String redirectUri, List<String> scopes,
                        String codeChallenge, String codeChallengeMethod) {
        String code = SecretCodec.newOpaqueToken();
        Instant expiresAt = clock.instant().plusSeconds(codeValiditySeconds);
        String challenge = StringUtils.hasText(codeChallenge) ? codeChallenge : null;
        authorizationCodeRepository.insert(new AuthorizationCode(code, clientId, userId, redirectUri, scopes,
                challenge, codeChallengeMethod, expiresAt));
        LOG.debug(String.format("Issued authorization code for client %s and user %s", clientId, userId));
        return code;
    }

    /**
     * Marks the code as used and returns it, provided it exists, was not used before and has not expired.
     * An expired code is burned as well. Callers can not tell the three failure reasons apart.
     */
    public Optional<AuthorizationCode> consume(String code) {
        if (!StringUtils.hasText(code)) {
            return Optional.empty();
        }
        AuthorizationCode authorizationCode =
                concurrentAuthorizationCodeRepository.findByCodeNotAlreadyUsedAndMarkAsUsed(code, clock.instant());
        if (authorizationCode == null) {
            LOG.info("Authorization code not found or already used");
            return Optional.empty();
        }
        if (authorizationCode.isExpired(clock)) {
            LOG.info(String.format("Authorization code for client %s expired", authorizationCode.getClientId()));
            return Optional.empty();
        }
        return Optional.of(authorizationCode);
    }
}
