package dev.reviewthor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewthor.github")
public record GitHubProperties(long appId, String privateKey, String webhookSecret, String apiBaseUrl) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
    }
}
