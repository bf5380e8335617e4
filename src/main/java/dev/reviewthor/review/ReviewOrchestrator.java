package dev.reviewthor.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import dev.reviewthor.config.AiProperties;
import dev.reviewthor.config.ReviewProperties;
import dev.reviewthor.domain.enums.Severity;
import dev.reviewthor.domain.valueobject.Finding;
import dev.reviewthor.domain.valueobject.ReviewAnalysis;
import dev.reviewthor.domain.valueobject.ReviewComment;
import dev.reviewthor.domain.valueobject.ReviewRequest;
import dev.reviewthor.exception.InvalidResponseFormatException;
import dev.reviewthor.exception.ReviewFailure;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient.AiResponse;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient.MessageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the review service for findings and turns them into PR comments.
 *
 * <pre>
 *  1. Render the review prompt (instructions + packed files + response schema)
 *  2. Call the review service once
 *  3. Parse the answer as JSON and validate it against the schema, strictly
 *  4. Filter findings by severity floor and render comments 1:1
 * </pre>
 *
 * <p>Any schema violation fails the whole response with {@link InvalidResponseFormatException};
 * nothing is skipped per finding. {@link #explain} is free text and is not validated.
 */
@Component
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    private final ReviewServiceClient reviewService;
    private final AiProperties aiProperties;
    private final ObjectReader jsonReader;
    private final Severity defaultFloor;

    public ReviewOrchestrator(ReviewServiceClient reviewService, AiProperties aiProperties,
                              ReviewProperties reviewProperties, ObjectMapper objectMapper) {
        this.reviewService = reviewService;
        this.aiProperties = aiProperties;
        this.defaultFloor = reviewProperties.minimumSeverity();
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ReviewAnalysis analyze(ReviewRequest request) {
        String prompt = ReviewPrompts.review(request);
        log.debug("Requesting review of {} files (~{} tokens) for {}",
                request.files().size(), request.estimatedTokens(), request.repository());

        AiResponse response = reviewService.createMessage(prompt,
                MessageOptions.of(aiProperties.maxOutputTokens(), aiProperties.temperature()));
        return parseAnalysis(response.content());
    }

    /** Comments for every finding at least as severe as the configured default floor. */
    public List<ReviewComment> generateComments(ReviewAnalysis analysis) {
        return generateComments(analysis, defaultFloor);
    }

    public List<ReviewComment> generateComments(ReviewAnalysis analysis, Severity floor) {
        Severity effectiveFloor = floor != null ? floor : Severity.INFO;
        return analysis.findings().stream()
                .filter(f -> f.severity().isAdmittedBy(effectiveFloor))
                .map(f -> new ReviewComment(f.file(), f.line(), CommentFormatter.format(f)))
                .toList();
    }

    /** Longer free-text rationale for one finding. */
    public String explain(Finding finding) {
        AiResponse response = reviewService.createMessage(ReviewPrompts.explain(finding),
                MessageOptions.of(aiProperties.explainMaxTokens(), aiProperties.temperature()));
        return response.content().trim();
    }

    ReviewAnalysis parseAnalysis(String content) {
        JsonNode root;
        try {
            root = jsonReader.readTree(content != null ? content : "");
        } catch (JsonProcessingException e) {
            throw new InvalidResponseFormatException(ReviewFailure.of(e).message(), e);
        }
        // blank input parses to a missing node rather than failing
        if (root == null || root.isMissingNode()) {
            throw new InvalidResponseFormatException(ReviewFailure.UNKNOWN_ERROR);
        }

        if (!root.isObject()) {
            throw new InvalidResponseFormatException("Analysis must be an object");
        }
        JsonNode issues = root.get("issues");
        if (issues == null || !issues.isArray()) {
            throw new InvalidResponseFormatException("Analysis must contain an issues array");
        }
        JsonNode summary = root.get("summary");
        if (summary == null || !summary.isTextual() || summary.asText().isEmpty()) {
            throw new InvalidResponseFormatException("Analysis must contain a summary string");
        }
        JsonNode stats = root.get("stats");
        if (stats == null || !stats.isObject()) {
            throw new InvalidResponseFormatException("Analysis must contain stats object");
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode issue : issues) {
            findings.add(toFinding(issue));
        }
        return new ReviewAnalysis(findings, summary.asText(), toStats(stats, findings.size()));
    }

    private static Finding toFinding(JsonNode issue) {
        String file = requiredText(issue, "file");
        JsonNode line = issue.get("line");
        String severity = requiredText(issue, "severity");
        String message = requiredText(issue, "message");
        String category = requiredText(issue, "category");
        if (file == null || line == null || !line.canConvertToInt() || line.asInt() < 1
                || severity == null || message == null || category == null) {
            throw new InvalidResponseFormatException(
                    "Each issue must have file, line, severity, message, and category");
        }
        Severity parsed = Severity.fromValue(severity).orElseThrow(() ->
                new InvalidResponseFormatException("Issue severity must be error, warning, or info"));

        JsonNode suggestion = issue.get("suggestion");
        return new Finding(file, line.asInt(), parsed, message, category,
                suggestion != null && suggestion.isTextual() ? suggestion.asText() : null);
    }

    private static String requiredText(JsonNode issue, String field) {
        JsonNode node = issue.get(field);
        return node != null && node.isTextual() && !node.asText().isEmpty() ? node.asText() : null;
    }

    private static ReviewAnalysis.Stats toStats(JsonNode stats, int findingCount) {
        JsonNode total = stats.get("total");
        return new ReviewAnalysis.Stats(
                total != null && total.canConvertToInt() ? total.asInt() : findingCount,
                counts(stats.get("byCategory")),
                counts(stats.get("bySeverity")));
    }

    private static Map<String, Integer> counts(JsonNode node) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return counts;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            counts.put(entry.getKey(), entry.getValue().asInt(0));
        }
        return counts;
    }
}
