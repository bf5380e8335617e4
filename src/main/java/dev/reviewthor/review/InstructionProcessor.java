package dev.reviewthor.review;

import dev.reviewthor.config.ReviewProperties;
import dev.reviewthor.domain.enums.Severity;
import dev.reviewthor.domain.valueobject.CustomInstructions;
import dev.reviewthor.domain.valueobject.RepositoryRef;
import dev.reviewthor.domain.valueobject.ReviewConfig;
import dev.reviewthor.domain.valueobject.ValidationResult;
import dev.reviewthor.infrastructure.github.GitHubApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a repository's {@code .reviewthor.md} and turns it into review preferences.
 *
 * <p>The document is split on {@code ## } headings. Headings are matched case-insensitively by
 * substring: "focus areas", "custom rules", "ignore patterns", "severity". List items start with
 * {@code -}, {@code *} or {@code N.}; every other line is ignored.
 */
@Component
public class InstructionProcessor {
    private static final Logger log = LoggerFactory.getLogger(InstructionProcessor.class);

    static final int MAX_RULE_LENGTH = 200;

    private static final Pattern SECTION_SPLIT = Pattern.compile("(?m)^##\\s+");
    private static final Pattern LIST_ITEM = Pattern.compile("^[-*]\\s+(.+)$|^\\d+\\.\\s+(.+)$");

    static final List<String> DEFAULT_FOCUS_AREAS = List.of(
            "Code quality", "Bug detection", "Security issues", "Performance", "Best practices");
    static final List<String> DEFAULT_CUSTOM_RULES = List.of(
            "Use const/let instead of var",
            "Handle errors properly",
            "Add appropriate TypeScript types",
            "Follow consistent naming conventions");
    static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            "node_modules/**", "dist/**", "build/**", "*.min.js", "*.bundle.js");
    static final List<String> DEFAULT_ENABLED_CHECKS = List.of(
            "syntax", "security", "performance", "best-practices", "type-safety");

    private final GitHubApiClient gitHubClient;
    private final ReviewProperties reviewProperties;

    public InstructionProcessor(GitHubApiClient gitHubClient, ReviewProperties reviewProperties) {
        this.gitHubClient = gitHubClient;
        this.reviewProperties = reviewProperties;
    }

    /** Fetches and parses the instruction document; empty when the repository has none. */
    public Optional<CustomInstructions> fetchCustomInstructions(RepositoryRef repo, long installationId) {
        return gitHubClient.getRepositoryFile(repo, reviewProperties.instructionsPath(),
                        reviewProperties.instructionsRef(), installationId)
                .filter(content -> !content.isEmpty())
                .map(content -> {
                    log.debug("Found {} in {}", reviewProperties.instructionsPath(), repo);
                    return parse(content);
                });
    }

    public CustomInstructions parse(String document) {
        if (document == null) return CustomInstructions.empty();

        List<String> focusAreas = List.of();
        List<String> customRules = List.of();
        List<String> ignorePatterns = List.of();
        Optional<Severity> severity = Optional.empty();

        for (String section : SECTION_SPLIT.split(document)) {
            String[] lines = section.trim().split("\\r?\\n");
            String title = lines[0].toLowerCase(Locale.ROOT);
            List<String> body = List.of(lines).subList(1, lines.length);

            if (title.contains("focus areas")) {
                focusAreas = listItems(body);
            } else if (title.contains("custom rules")) {
                customRules = listItems(body);
            } else if (title.contains("ignore patterns")) {
                ignorePatterns = listItems(body);
            } else if (title.contains("severity")) {
                severity = body.stream()
                        .map(String::trim)
                        .filter(line -> !line.isEmpty())
                        .findFirst()
                        .flatMap(line -> Severity.fromValue(line.toLowerCase(Locale.ROOT)));
            }
        }
        return new CustomInstructions(focusAreas, customRules, ignorePatterns, severity, document);
    }

    /**
     * Defaults first, then the repository's additions. Focus areas are de-duplicated;
     * rules and ignore patterns are concatenated as-is. The comment limit and enabled
     * checks are not overridable from the repository.
     */
    public ReviewConfig merge(CustomInstructions custom, ReviewConfig defaults) {
        LinkedHashSet<String> focusAreas = new LinkedHashSet<>(defaults.focusAreas());
        focusAreas.addAll(custom.focusAreas());

        List<String> customRules = new ArrayList<>(defaults.customRules());
        customRules.addAll(custom.customRules());

        List<String> ignorePatterns = new ArrayList<>(defaults.ignorePatterns());
        ignorePatterns.addAll(custom.ignorePatterns());

        return new ReviewConfig(List.copyOf(focusAreas), customRules, ignorePatterns,
                custom.severity().orElse(defaults.severityFloor()),
                defaults.maxCommentsPerPr(), defaults.enabledChecks());
    }

    public ReviewConfig mergeWithDefaults(CustomInstructions custom) {
        return merge(custom, defaultConfig());
    }

    public ValidationResult validate(CustomInstructions instructions) {
        List<String> errors = new ArrayList<>();
        for (String area : instructions.focusAreas()) {
            if (area.length() > MAX_RULE_LENGTH) {
                errors.add("Focus area too long (max " + MAX_RULE_LENGTH + " characters)");
            }
        }
        for (String rule : instructions.customRules()) {
            if (rule.length() > MAX_RULE_LENGTH) {
                errors.add("Custom rule too long (max " + MAX_RULE_LENGTH + " characters)");
            }
        }
        for (String pattern : instructions.ignorePatterns()) {
            if (!GlobPattern.isValid(pattern)) {
                errors.add("Invalid ignore pattern: " + pattern);
            }
        }
        return new ValidationResult(errors);
    }

    public ReviewConfig defaultConfig() {
        return new ReviewConfig(DEFAULT_FOCUS_AREAS, DEFAULT_CUSTOM_RULES, DEFAULT_IGNORE_PATTERNS,
                Severity.WARNING, reviewProperties.maxCommentsPerPr(), DEFAULT_ENABLED_CHECKS);
    }

    private static List<String> listItems(List<String> lines) {
        List<String> items = new ArrayList<>();
        for (String line : lines) {
            Matcher m = LIST_ITEM.matcher(line.trim());
            if (m.matches()) {
                String item = m.group(1) != null ? m.group(1) : m.group(2);
                if (!item.isBlank()) items.add(item.trim());
            }
        }
        return items;
    }
}
