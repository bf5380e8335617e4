package dev.reviewthor.domain.valueobject;

/**
 * One entry of the GitHub "list pull request files" response. {@code patch} is absent for binaries
 * and very large diffs.
 */
public record ChangedFile(String path, String status, int additions, int deletions, int changes, String patch) {

    public String patchOrEmpty() {
        return patch != null ? patch : "";
    }

    public boolean hasExtension(String extension) {
        return path != null && path.toLowerCase().endsWith(extension.toLowerCase());
    }
}
