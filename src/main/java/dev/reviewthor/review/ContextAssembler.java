package dev.reviewthor.review;

import com.fasterxml.jackson.databind.JsonNode;
import dev.reviewthor.domain.valueobject.FileContext;
import dev.reviewthor.domain.valueobject.PackedContext;
import dev.reviewthor.domain.valueobject.PrContext;
import dev.reviewthor.domain.valueobject.RelatedFiles;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the bounded-size context sent to the review service.
 *
 * <p>Token counts here are a size proxy, not a tokenizer: characters divided by
 * {@value #AVG_CHARS_PER_TOKEN}, rounded up. Each file costs its path, content and diff plus
 * {@value #FILE_METADATA_CHARS} characters of metadata; the pull request costs its title and
 * description plus {@value #PR_METADATA_CHARS}.
 */
@Component
public class ContextAssembler {

    static final int AVG_CHARS_PER_TOKEN = 4;
    static final int FILE_METADATA_CHARS = 50;
    static final int PR_METADATA_CHARS = 100;
    static final String TRUNCATION_MARKER = "\n... (truncated)";

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("py", "python"),
            Map.entry("xml", "xml"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("json", "json"),
            Map.entry("sql", "sql"));

    private static final Pattern IMPORT_FROM = Pattern.compile("import\\s+.*?\\s+from\\s+['\"](.+?)['\"]");
    private static final Pattern IMPORT_BARE = Pattern.compile("import\\s+['\"](.+?)['\"]");
    private static final Pattern REQUIRE = Pattern.compile("require\\s*\\(['\"](.+?)['\"]\\)");
    private static final Pattern NAMED_EXPORT = Pattern.compile("export\\s+(?:const|let|var|function|class)\\s+(\\w+)");
    private static final Pattern SCRIPT_EXTENSION = Pattern.compile("\\.(js|jsx|ts|tsx)$");

    public FileContext buildFileContext(String path, String content, String diff) {
        return new FileContext(path, content, diff, detectLanguage(path));
    }

    /** Reads title, body, author and branches from a GitHub {@code pull_request} object. */
    public PrContext buildPrContext(JsonNode pullRequest) {
        return new PrContext(
                pullRequest.path("title").asText(""),
                pullRequest.path("body").asText(""),
                pullRequest.path("user").path("login").asText("unknown"),
                pullRequest.path("base").path("ref").asText("main"),
                pullRequest.path("head").path("ref").asText("feature"));
    }

    public static String detectLanguage(String path) {
        if (path == null) return "unknown";
        int dot = path.lastIndexOf('.');
        if (dot < 0 || path.indexOf('/', dot) >= 0) return "unknown";
        return LANGUAGES.getOrDefault(path.substring(dot + 1).toLowerCase(Locale.ROOT), "unknown");
    }

    /**
     * Best-effort static scan for imports, exports and conventional test locations.
     * Advisory only; missing or malformed source yields empty lists.
     */
    public RelatedFiles discoverRelated(String path, String content) {
        String source = content != null ? content : "";
        return new RelatedFiles(extractImports(source), extractExports(source), candidateTestPaths(path));
    }

    /**
     * Fits the files into {@code budgetTokens}. Files are kept whole in order until the first one
     * that overflows; that file loses its content (and, if still too big, has its diff clipped and
     * marked) and iteration stops there.
     */
    public PackedContext pack(List<FileContext> files, PrContext pr, int budgetTokens) {
        int total = estimateTokens(files, pr);
        if (total <= budgetTokens) {
            return new PackedContext(files, pr, false, total);
        }

        List<FileContext> packed = new ArrayList<>();
        int currentTokens = estimateTokens(List.of(), pr);
        for (FileContext file : files) {
            int fileTokens = estimateFileTokens(file);
            if (currentTokens + fileTokens <= budgetTokens) {
                packed.add(file);
                currentTokens += fileTokens;
            } else {
                packed.add(truncate(file, budgetTokens - currentTokens));
                break;
            }
        }
        return new PackedContext(packed, pr, true, budgetTokens);
    }

    public int estimateTokens(List<FileContext> files, PrContext pr) {
        long chars = (long) pr.title().length() + pr.description().length() + PR_METADATA_CHARS;
        for (FileContext file : files) {
            chars += estimateFileChars(file);
        }
        return (int) ceilDiv(chars, AVG_CHARS_PER_TOKEN);
    }

    public int estimateFileTokens(FileContext file) {
        return (int) ceilDiv(estimateFileChars(file), AVG_CHARS_PER_TOKEN);
    }

    private static long estimateFileChars(FileContext file) {
        return (long) file.path().length() + file.content().length() + file.diff().length() + FILE_METADATA_CHARS;
    }

    private static FileContext truncate(FileContext file, int remainingTokens) {
        long available = (long) remainingTokens * AVG_CHARS_PER_TOKEN - file.path().length() - FILE_METADATA_CHARS;
        if (file.diff().length() <= available) {
            return file.withContent("");
        }
        int keep = (int) Math.max(0, available);
        return file.withContent("").withDiff(file.diff().substring(0, keep) + TRUNCATION_MARKER);
    }

    private static long ceilDiv(long x, long y) {
        return (x + y - 1) / y;
    }

    private static List<String> extractImports(String source) {
        Set<String> imports = new LinkedHashSet<>();
        collect(IMPORT_FROM, source, imports);
        collect(IMPORT_BARE, source, imports);
        collect(REQUIRE, source, imports);
        return List.copyOf(imports);
    }

    private static List<String> extractExports(String source) {
        List<String> exports = new ArrayList<>();
        Matcher m = NAMED_EXPORT.matcher(source);
        while (m.find()) {
            exports.add(m.group(1));
        }
        if (source.contains("export default")) {
            exports.add("default");
        }
        return exports;
    }

    private static List<String> candidateTestPaths(String path) {
        if (path == null || path.isEmpty()) return List.of();
        String base = SCRIPT_EXTENSION.matcher(path).replaceFirst("");
        return List.of(
                base + ".test.js",
                base + ".test.ts",
                base + ".spec.js",
                base + ".spec.ts",
                "__tests__/" + base + ".js",
                "__tests__/" + base + ".ts");
    }

    private static void collect(Pattern pattern, String source, Set<String> into) {
        Matcher m = pattern.matcher(source);
        while (m.find()) {
            if (!m.group(1).isEmpty()) into.add(m.group(1));
        }
    }
}
