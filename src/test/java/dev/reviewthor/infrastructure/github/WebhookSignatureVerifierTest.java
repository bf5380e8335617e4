package dev.reviewthor.infrastructure.github;

import dev.reviewthor.config.GitHubProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "It's a Secret to Everybody";
    private static final byte[] BODY = "Hello, World!".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("accepts GitHub's documented example signature")
    void acceptsKnownGoodSignature() {
        // example from GitHub's "Validating webhook deliveries" docs
        String signature = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

        assertThat(WebhookSignatureVerifier.verify(BODY, signature, SECRET)).isTrue();
    }

    @Test
    @DisplayName("accepts a signature computed over the same bytes and secret")
    void acceptsOwnSignature() throws Exception {
        byte[] payload = "{\"action\":\"opened\",\"number\":1}".getBytes(StandardCharsets.UTF_8);
        String signature = WebhookSignatureVerifier.sign(payload, "s3cr3t");

        assertThat(WebhookSignatureVerifier.verify(payload, signature, "s3cr3t")).isTrue();
    }

    @Test
    @DisplayName("rejects when a single payload byte changes")
    void rejectsTamperedPayload() throws Exception {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);
        byte[] tampered = BODY.clone();
        tampered[0] ^= 0x01;

        assertThat(WebhookSignatureVerifier.verify(tampered, signature, SECRET)).isFalse();
    }

    @Test
    @DisplayName("rejects when the secret differs")
    void rejectsWrongSecret() throws Exception {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertThat(WebhookSignatureVerifier.verify(BODY, signature, SECRET + "x")).isFalse();
    }

    @Test
    @DisplayName("rejects length-mismatched signatures")
    void rejectsLengthMismatch() throws Exception {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertThat(WebhookSignatureVerifier.verify(BODY, signature + "0", SECRET)).isFalse();
        assertThat(WebhookSignatureVerifier.verify(BODY, signature.substring(0, 20), SECRET)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"sha1=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17",
            "757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17"})
    @DisplayName("rejects missing headers and headers without the sha256= tag")
    void rejectsBadHeader(String header) {
        assertThat(WebhookSignatureVerifier.verify(BODY, header, SECRET)).isFalse();
    }

    @Test
    @DisplayName("fails closed when no secret is configured")
    void failsClosedWithoutSecret() throws Exception {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);
        var verifier = new WebhookSignatureVerifier(new GitHubProperties(1, null, "", null));

        assertThat(verifier.isValid(BODY, signature)).isFalse();
        assertThat(WebhookSignatureVerifier.verify(BODY, signature, null)).isFalse();
    }

    @Test
    @DisplayName("isValid uses the configured webhook secret")
    void usesConfiguredSecret() throws Exception {
        var verifier = new WebhookSignatureVerifier(new GitHubProperties(1, null, SECRET, null));

        assertThat(verifier.isValid(BODY, WebhookSignatureVerifier.sign(BODY, SECRET))).isTrue();
    }
}
