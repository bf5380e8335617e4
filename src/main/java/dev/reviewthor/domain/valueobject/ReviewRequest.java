package dev.reviewthor.domain.valueobject;

import java.util.List;
import java.util.Map;

/**
 * Everything sent to the review service for one pull request.
 *
 * @param files           packed file contexts, in host order
 * @param prDescription   pull-request body
 * @param repository      "owner/name"
 * @param estimatedTokens size estimate produced by the packer, never above the budget
 * @param focusAreas      effective focus areas rendered into the prompt
 * @param customRules     effective custom rules rendered into the prompt
 * @param relatedFiles    optional per-path related-file hints
 */
public record ReviewRequest(List<FileContext> files, String prDescription, String repository, int estimatedTokens,
                            List<String> focusAreas, List<String> customRules, Map<String, RelatedFiles> relatedFiles) {
    public ReviewRequest {
        files = List.copyOf(files);
        if (prDescription == null) prDescription = "";
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        customRules = customRules == null ? List.of() : List.copyOf(customRules);
        relatedFiles = relatedFiles == null ? Map.of() : Map.copyOf(relatedFiles);
    }

    public static ReviewRequest of(List<FileContext> files, String prDescription, String repository, int estimatedTokens) {
        return new ReviewRequest(files, prDescription, repository, estimatedTokens, List.of(), List.of(), Map.of());
    }
}
