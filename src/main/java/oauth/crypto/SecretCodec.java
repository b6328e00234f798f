package oauth.crypto;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Opaque credentials and client secret digests.
 * <p>
 * Codes, access tokens and raw client secrets are all random hex strings. Client secrets are stored as
 * an unsalted SHA-256 digest: they are generated here with 256 bits of entropy, never chosen by a human.
 */
public class SecretCodec {

    public static final int DEFAULT_BYTE_LENGTH = 32;

    private static final SecureRandom random = new SecureRandom();

    private SecretCodec() {
    }

    public static String newOpaqueToken() {
        return newOpaqueToken(DEFAULT_BYTE_LENGTH);
    }

    public static String newOpaqueToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive");
        }
        byte[] bytes = new byte[byteLength];
        random.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    public static String hashSecret(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Secret to hash must not be null");
        }
        return DigestUtils.sha256Hex(raw);
    }

    /**
     * Compares two digests without short-circuiting on the first differing byte. Different lengths
     * return false straight away.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        byte[] left = a.getBytes(StandardCharsets.UTF_8);
        byte[] right = b.getBytes(StandardCharsets.UTF_8);
        if (left.length != right.length) {
            return false;
        }
        return MessageDigest.isEqual(left, right);
    }

}
