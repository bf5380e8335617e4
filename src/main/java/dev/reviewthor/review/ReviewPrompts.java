package dev.reviewthor.review;

import dev.reviewthor.domain.valueobject.FileContext;
import dev.reviewthor.domain.valueobject.Finding;
import dev.reviewthor.domain.valueobject.RelatedFiles;
import dev.reviewthor.domain.valueobject.ReviewRequest;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt construction for the review service.
 */
public final class ReviewPrompts {

    static final String RESPONSE_SCHEMA = """
            {
              "issues": [
                {
                  "file": "path/to/file.js",
                  "line": 10,
                  "severity": "error|warning|info",
                  "message": "Clear description of the issue",
                  "category": "bug|security|performance|code-quality|type-safety",
                  "suggestion": "Optional code suggestion to fix the issue"
                }
              ],
              "summary": "Brief summary of the review",
              "stats": {
                "total": 0,
                "byCategory": {},
                "bySeverity": {}
              }
            }""";

    private static final String BASE_INSTRUCTIONS = """
            You are reviewing a pull request.
            Analyze the code changes carefully for:
            - Bugs and potential runtime errors
            - Security vulnerabilities
            - Performance issues
            - Code quality and best practices
            - Type safety issues

            Consider the PR description for context about the intended changes.""";

    private ReviewPrompts() {}

    public static String review(ReviewRequest request) {
        var sb = new StringBuilder(BASE_INSTRUCTIONS);
        String instructions = instructions(request.focusAreas(), request.customRules());
        if (!instructions.isEmpty()) {
            sb.append("\n\nAdditional Instructions:\n").append(instructions);
        }
        sb.append("\n\nPlease review the following code changes:\n\n")
          .append("Repository: ").append(request.repository()).append('\n')
          .append("PR Description: ").append(request.prDescription()).append("\n\n")
          .append("Files:\n")
          .append(request.files().stream()
                  .map(f -> file(f, request.relatedFiles().get(f.path())))
                  .collect(Collectors.joining("\n")))
          .append("\nRespond ONLY with JSON in the following format:\n")
          .append(RESPONSE_SCHEMA)
          .append("\n\nBe constructive and helpful. Report line numbers from the new version of each file.");
        return sb.toString();
    }

    public static String explain(Finding finding) {
        return """
                Please explain why this is an issue:

                File: %s
                Line: %d
                Issue: %s
                Category: %s
                Severity: %s

                Provide a detailed explanation that helps the developer understand:
                1. Why this is a problem
                2. What could go wrong
                3. How to fix it properly""".formatted(finding.file(), finding.line(), finding.message(),
                finding.category(), finding.severity().value());
    }

    static String instructions(List<String> focusAreas, List<String> customRules) {
        var sb = new StringBuilder();
        if (!focusAreas.isEmpty()) {
            sb.append("Focus areas:\n");
            focusAreas.forEach(a -> sb.append("- ").append(a).append('\n'));
        }
        if (!customRules.isEmpty()) {
            sb.append("Rules:\n");
            customRules.forEach(r -> sb.append("- ").append(r).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private static String file(FileContext file, RelatedFiles related) {
        var sb = new StringBuilder("\nFile: ").append(file.path())
                .append(" (").append(file.language()).append(")\n");
        if (related != null && !related.isEmpty()) {
            if (!related.imports().isEmpty()) sb.append("Imports: ").append(String.join(", ", related.imports())).append('\n');
            if (!related.exports().isEmpty()) sb.append("Exports: ").append(String.join(", ", related.exports())).append('\n');
        }
        if (!file.content().isEmpty()) {
            sb.append("Content:\n```").append(file.language()).append('\n').append(file.content()).append("\n```\n");
        }
        sb.append("Diff:\n```diff\n").append(file.diff()).append("\n```\n");
        return sb.toString();
    }
}
