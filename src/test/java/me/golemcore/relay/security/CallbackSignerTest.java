package me.golemcore.relay.security;

import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallbackSignerTest {

    private static final String SECRET = "test-secret";
    private static final long TIMESTAMP = 1_700_000_000L;
    private static final String BODY = "{\"message_id\":\"m1\",\"message\":\"hi\"}";

    @Test
    void shouldSignTimestampDotBody() throws GeneralSecurityException {
        String signature = CallbackSigner.sign(SECRET, TIMESTAMP, BODY);

        assertEquals(hmacHex(SECRET, TIMESTAMP + "." + BODY), signature);
        assertEquals(64, signature.length());
    }

    @Test
    void shouldPrefixHeaderValue() {
        String header = CallbackSigner.signatureHeader(SECRET, TIMESTAMP, BODY);

        assertTrue(header.startsWith("sha256="));
        assertEquals(CallbackSigner.sign(SECRET, TIMESTAMP, BODY), header.substring("sha256=".length()));
    }

    @Test
    void shouldVerifyOwnSignature() {
        String header = CallbackSigner.signatureHeader(SECRET, TIMESTAMP, BODY);

        assertTrue(CallbackSigner.verify(SECRET, TIMESTAMP, BODY, header));
    }

    @Test
    void shouldRejectTamperedInputs() {
        String header = CallbackSigner.signatureHeader(SECRET, TIMESTAMP, BODY);

        assertFalse(CallbackSigner.verify("other-secret", TIMESTAMP, BODY, header));
        assertFalse(CallbackSigner.verify(SECRET, TIMESTAMP + 1, BODY, header));
        assertFalse(CallbackSigner.verify(SECRET, TIMESTAMP, BODY + " ", header));
        assertFalse(CallbackSigner.verify(SECRET, TIMESTAMP, BODY, header.substring("sha256=".length())));
        assertFalse(CallbackSigner.verify(SECRET, TIMESTAMP, BODY, null));
    }

    @Test
    void shouldGenerateUrlSafeSecrets() {
        String first = SecretGenerator.callbackSecret();
        String second = SecretGenerator.callbackSecret();

        assertEquals(32, first.length());
        assertTrue(first.matches("[A-Za-z0-9_-]+"));
        assertNotEquals(first, second);
    }

    private static String hmacHex(String secret, String data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }
}
