package dev.reviewthor.domain.valueobject;

import java.util.List;

/**
 * Advisory neighbours of a file found by static text scanning.
 */
public record RelatedFiles(List<String> imports, List<String> exports, List<String> candidateTestPaths) {
    public RelatedFiles {
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
        candidateTestPaths = candidateTestPaths == null ? List.of() : List.copyOf(candidateTestPaths);
    }

    public boolean isEmpty() {
        return imports.isEmpty() && exports.isEmpty();
    }
}
