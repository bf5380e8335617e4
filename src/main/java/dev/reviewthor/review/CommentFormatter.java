package dev.reviewthor.review;

import dev.reviewthor.domain.enums.Severity;
import dev.reviewthor.domain.valueobject.Finding;

import java.util.Map;

/**
 * Renders a finding as a GitHub-flavoured markdown comment body.
 */
public final class CommentFormatter {

    private static final Map<Severity, String> ICONS = Map.of(
            Severity.ERROR, "❌",
            Severity.WARNING, "⚠️",
            Severity.INFO, "ℹ️");

    private static final Map<String, String> CATEGORY_LABELS = Map.of(
            "bug", "Bug",
            "security", "Security",
            "performance", "Performance",
            "code-quality", "Code Quality",
            "type-safety", "Type Safety",
            "documentation", "Documentation");

    private CommentFormatter() {}

    public static String icon(Severity severity) {
        return ICONS.get(severity);
    }

    /** Known categories get a label; anything else is shown as sent. */
    public static String categoryLabel(String category) {
        return CATEGORY_LABELS.getOrDefault(category, category);
    }

    public static String format(Finding finding) {
        var sb = new StringBuilder()
                .append(icon(finding.severity()))
                .append(" **").append(categoryLabel(finding.category())).append("**: ")
                .append(finding.message());
        if (finding.hasSuggestion()) {
            String language = ContextAssembler.detectLanguage(finding.file());
            sb.append("\n\n**Suggestion:**\n```")
              .append("unknown".equals(language) ? "" : language).append('\n')
              .append(finding.suggestion())
              .append("\n```");
        }
        return sb.toString();
    }
}
