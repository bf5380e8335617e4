package dev.reviewthor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Review-service settings. maxInputTokens is the packing budget for the prompt context.
 */
@ConfigurationProperties(prefix = "reviewthor.ai")
public record AiProperties(String model, int maxInputTokens, int maxOutputTokens,
                           Double temperature, int explainMaxTokens) {
    public AiProperties {
        if (model == null || model.isBlank()) model = "claude-3-opus-20240229";
        if (maxInputTokens <= 0) maxInputTokens = 150_000;
        if (maxOutputTokens <= 0) maxOutputTokens = 4096;
        if (temperature == null) temperature = 0.3;
        if (explainMaxTokens <= 0) explainMaxTokens = 1024;
    }

    public static AiProperties defaults() {
        return new AiProperties(null, 0, 0, null, 0);
    }
}
