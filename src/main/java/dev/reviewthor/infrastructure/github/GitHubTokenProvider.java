package dev.reviewthor.infrastructure.github;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import dev.reviewthor.config.GitHubProperties;
import dev.reviewthor.exception.GitHubApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GitHub App authentication: signs a short-lived App JWT and exchanges it for an installation
 * access token. Tokens are cached per installation until five minutes before they expire.
 */
@Component
public class GitHubTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(GitHubTokenProvider.class);

    private static final long REFRESH_MARGIN_SECONDS = 300;

    private final GitHubProperties properties;
    private final WebClient webClient;
    private final Map<Long, InstallationToken> tokens = new ConcurrentHashMap<>();
    private volatile RSAPrivateKey signingKey;

    public GitHubTokenProvider(GitHubProperties properties, WebClient.Builder builder) {
        this.properties = properties;
        this.webClient = builder.clone().baseUrl(properties.apiBaseUrl()).build();
    }

    public String getInstallationToken(long installationId) {
        InstallationToken cached = tokens.get(installationId);
        if (cached != null && cached.expiresAt().isAfter(Instant.now().plusSeconds(REFRESH_MARGIN_SECONDS))) {
            return cached.token();
        }

        Map<?, ?> response;
        try {
            response = webClient.post()
                    .uri("/app/installations/{installationId}/access_tokens", installationId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                    .header(HttpHeaders.ACCEPT, "application/vnd.github+json")
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block();
        } catch (WebClientException e) {
            throw new GitHubApiException("Authentication failed: " + e.getMessage(), e);
        }

        if (response == null || !(response.get("token") instanceof String token)) {
            throw new GitHubApiException("Authentication failed: no token for installation " + installationId);
        }
        Object expiry = response.get("expires_at");
        Instant expiresAt = expiry instanceof String s ? Instant.parse(s) : Instant.now().plusSeconds(3600);

        tokens.put(installationId, new InstallationToken(token, expiresAt));
        log.info("Obtained installation token for installation {} (expires {})", installationId, expiresAt);
        return token;
    }

    String appJwt() {
        Instant now = Instant.now();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(String.valueOf(properties.appId()))
                .issueTime(Date.from(now.minusSeconds(60)))
                .expirationTime(Date.from(now.plusSeconds(600)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        try {
            jwt.sign(new RSASSASigner(signingKey()));
        } catch (JOSEException e) {
            throw new GitHubApiException("Failed to sign GitHub App JWT", e);
        }
        return jwt.serialize();
    }

    private RSAPrivateKey signingKey() {
        RSAPrivateKey key = signingKey;
        if (key == null) {
            key = PemKeys.readRsaPrivateKey(properties.privateKey());
            signingKey = key;
        }
        return key;
    }

    private record InstallationToken(String token, Instant expiresAt) {}

    /**
     * PEM decoding for GitHub App keys. GitHub issues PKCS#1 ("BEGIN RSA PRIVATE KEY");
     * PKCS#8 ("BEGIN PRIVATE KEY") is accepted as well.
     */
    static final class PemKeys {

        private PemKeys() {}

        static RSAPrivateKey readRsaPrivateKey(String pem) {
            if (pem == null || pem.isBlank()) {
                throw new GitHubApiException("GitHub App private key is not configured");
            }
            boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
            String base64 = pem.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "").replaceAll("\\s", "");
            try {
                byte[] der = Base64.getDecoder().decode(base64);
                KeySpec spec = pkcs1 ? new DerReader(der).readPkcs1() : new PKCS8EncodedKeySpec(der);
                return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(spec);
            } catch (GeneralSecurityException | IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new GitHubApiException("Failed to parse GitHub App private key", e);
            }
        }
    }

    /**
     * Minimal DER walker for RSAPrivateKey ::= SEQUENCE { version, n, e, d, p, q, dP, dQ, qInv }.
     */
    static final class DerReader {
        private final byte[] der;
        private int pos;

        DerReader(byte[] der) { this.der = der; }

        RSAPrivateCrtKeySpec readPkcs1() {
            pos++;          // SEQUENCE tag
            readLength();
            readInteger();  // version
            BigInteger n = readInteger();
            BigInteger e = readInteger();
            BigInteger d = readInteger();
            BigInteger p = readInteger();
            BigInteger q = readInteger();
            BigInteger dP = readInteger();
            BigInteger dQ = readInteger();
            BigInteger qInv = readInteger();
            return new RSAPrivateCrtKeySpec(n, e, d, p, q, dP, dQ, qInv);
        }

        private int readLength() {
            int first = der[pos++] & 0xFF;
            if (first < 0x80) return first;
            int length = 0;
            for (int i = 0; i < (first & 0x7F); i++) {
                length = (length << 8) | (der[pos++] & 0xFF);
            }
            return length;
        }

        private BigInteger readInteger() {
            pos++;          // INTEGER tag
            int length = readLength();
            byte[] value = new byte[length];
            System.arraycopy(der, pos, value, 0, length);
            pos += length;
            return new BigInteger(value);
        }
    }
}
