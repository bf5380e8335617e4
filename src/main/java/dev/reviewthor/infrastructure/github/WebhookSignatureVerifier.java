package dev.reviewthor.infrastructure.github;

import dev.reviewthor.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification for GitHub webhooks over the exact raw request bytes.
 * Fails closed and uses constant-time comparison.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    static final String ALGORITHM_TAG = "sha256=";
    private static final String HMAC_SHA256 = "HmacSHA256";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) { this.properties = properties; }

    /** Verifies against the configured webhook secret. */
    public boolean isValid(byte[] payload, String signature) {
        return verify(payload, signature, properties.webhookSecret());
    }

    /**
     * Pure check of {@code signature} against HMAC-SHA256(secret, payload). Never throws.
     */
    public static boolean verify(byte[] payload, String signature, String secret) {
        if (payload == null || signature == null || !signature.startsWith(ALGORITHM_TAG)) return false;
        if (secret == null || secret.isEmpty()) return false;
        try {
            byte[] expected = sign(payload, secret).getBytes(StandardCharsets.UTF_8);
            byte[] actual = signature.getBytes(StandardCharsets.UTF_8);
            // lengths are public (fixed hex width), content comparison is constant-time
            if (expected.length != actual.length) return false;
            return MessageDigest.isEqual(expected, actual);
        } catch (Exception e) {
            log.error("HMAC computation failed: {}", e.getMessage());
            return false;
        }
    }

    /** {@code sha256=<hex HMAC>} for the payload, as GitHub sends it. */
    public static String sign(byte[] payload, String secret) throws Exception {
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
        return ALGORITHM_TAG + HexFormat.of().formatHex(mac.doFinal(payload));
    }
}
