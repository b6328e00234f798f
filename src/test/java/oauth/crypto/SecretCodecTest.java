package oauth.crypto;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecretCodecTest {

    @Test
    void newOpaqueTokenIsHex() {
        String token = SecretCodec.newOpaqueToken();
        assertEquals(64, token.length());
        assertTrue(token.matches("[0-9a-f]{64}"));
        assertEquals(32, SecretCodec.newOpaqueToken(16).length());
    }

    @Test
    void newOpaqueTokenIsUnique() {
        Set<String> tokens = new HashSet<>();
        IntStream.range(0, 500).forEach(i -> tokens.add(SecretCodec.newOpaqueToken()));
        assertEquals(500, tokens.size());
    }

    @Test
    void newOpaqueTokenRejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> SecretCodec.newOpaqueToken(0));
    }

    @Test
    void hashSecret() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", SecretCodec.hashSecret("abc"));
        assertEquals(SecretCodec.hashSecret("secret"), SecretCodec.hashSecret("secret"));
        assertThrows(IllegalArgumentException.class, () -> SecretCodec.hashSecret(null));
    }

    @Test
    void constantTimeEquals() {
        String hash = SecretCodec.hashSecret("secret");
        assertTrue(SecretCodec.constantTimeEquals(hash, SecretCodec.hashSecret("secret")));
        assertFalse(SecretCodec.constantTimeEquals(hash, SecretCodec.hashSecret("Secret")));
        assertFalse(SecretCodec.constantTimeEquals(hash, hash.substring(1)));
        assertFalse(SecretCodec.constantTimeEquals(null, hash));
        assertFalse(SecretCodec.constantTimeEquals(hash, null));
    }
}
