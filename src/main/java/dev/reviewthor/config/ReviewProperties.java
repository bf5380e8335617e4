package dev.reviewthor.config;

import dev.reviewthor.domain.enums.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Pipeline limits and filters applied before and after the review call.
 *
 * <p>{@code maxFileSize} is compared against the GitHub {@code changes} count of a file.
 * {@code minimumSeverity} is the floor used when a repository does not declare its own.
 */
@ConfigurationProperties(prefix = "reviewthor.review")
public record ReviewProperties(Severity minimumSeverity, int maxFilesPerReview, int maxCommentsPerPr,
                               long maxFileSize, List<String> enabledFileTypes, List<String> ignoredPaths,
                               Boolean skipDrafts, String instructionsPath, String instructionsRef,
                               boolean includeFileContent) {
    public ReviewProperties {
        if (minimumSeverity == null) minimumSeverity = Severity.INFO;
        if (maxFilesPerReview <= 0) maxFilesPerReview = 50;
        if (maxCommentsPerPr <= 0) maxCommentsPerPr = 20;
        if (maxFileSize <= 0) maxFileSize = 1024 * 1024;
        if (enabledFileTypes == null || enabledFileTypes.isEmpty())
            enabledFileTypes = List.of(".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs");
        if (ignoredPaths == null)
            ignoredPaths = List.of("node_modules/**", "dist/**", "build/**", "coverage/**",
                    "**/*.min.js", "**/*.bundle.js", "vendor/**");
        if (skipDrafts == null) skipDrafts = true;
        if (instructionsPath == null || instructionsPath.isBlank()) instructionsPath = ".reviewthor.md";
        if (instructionsRef == null || instructionsRef.isBlank()) instructionsRef = "HEAD";
    }

    public static ReviewProperties defaults() {
        return new ReviewProperties(null, 0, 0, 0, null, null, null, null, null, false);
    }
}
