package oauth.crypto;

import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * RFC 7636 proof key verification. Only the S256 transform is supported.
 */
public class PkceVerifier {

    public static final String S256 = CodeChallengeMethod.S256.getValue();

    private PkceVerifier() {
    }

    public static boolean isSupportedMethod(String codeChallengeMethod) {
        return S256.equals(codeChallengeMethod);
    }

    public static String challengeFromVerifier(String verifier) {
        if (!StringUtils.hasLength(verifier)) {
            throw new IllegalArgumentException("code_verifier must not be empty");
        }
        byte[] digest = DigestUtils.sha256(verifier.getBytes(StandardCharsets.UTF_8));
        //Base64URL omits the padding
        return Base64URL.encode(digest).toString();
    }

    public static boolean verify(String verifier, String storedChallenge) {
        if (!StringUtils.hasLength(verifier) || !StringUtils.hasLength(storedChallenge)) {
            return false;
        }
        String computed = challengeFromVerifier(verifier);
        return MessageDigest.isEqual(computed.getBytes(StandardCharsets.US_ASCII),
                storedChallenge.getBytes(StandardCharsets.US_ASCII));
    }

}
