package dev.reviewthor.infrastructure.github;

import dev.reviewthor.config.GitHubProperties;
import dev.reviewthor.domain.valueobject.ChangedFile;
import dev.reviewthor.domain.valueobject.RepositoryRef;
import dev.reviewthor.domain.valueobject.ReviewComment;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GitHub REST API client for the calls the review pipeline makes.
 * Uses WebClient with .block(); every call runs inside one synchronous webhook request.
 * Failures propagate to the caller, nothing is retried here.
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private static final int FILES_PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(WebClient.Builder builder, GitHubTokenProvider tokenProvider, GitHubProperties properties) {
        this.tokenProvider = tokenProvider;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.clone().baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json").build();
    }

    /** All changed files of a pull request, in the order GitHub returns them. */
    @CircuitBreaker(name = "github-api")
    public List<ChangedFile> getPullRequestFiles(RepositoryRef repo, int pr, long installationId) {
        String token = tokenProvider.getInstallationToken(installationId);
        List<ChangedFile> allFiles = new ArrayList<>();

        for (int page = 1; page <= MAX_PAGES; page++) {
            List<Map<String, Object>> files = webClient.get()
                    .uri("/repos/{owner}/{repo}/pulls/{pr}/files?per_page={perPage}&page={page}",
                            repo.owner(), repo.name(), pr, FILES_PER_PAGE, page)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<Map<String, Object>>>() {})
                    .block();

            if (files == null || files.isEmpty()) break;

            files.stream().map(f -> new ChangedFile(
                    (String) f.get("filename"),
                    (String) f.get("status"),
                    intValue(f.get("additions")),
                    intValue(f.get("deletions")),
                    intValue(f.get("changes")),
                    (String) f.get("patch")
            )).forEach(allFiles::add);

            if (files.size() < FILES_PER_PAGE) break;
        }

        if (allFiles.size() >= FILES_PER_PAGE * MAX_PAGES) {
            log.warn("PR {}#{} has {}+ files, review may be incomplete", repo, pr, allFiles.size());
        }
        return allFiles;
    }

    /**
     * Raw content of a repository file at {@code ref}. Empty when the file does not exist;
     * any other failure propagates.
     */
    @CircuitBreaker(name = "github-api")
    public Optional<String> getRepositoryFile(RepositoryRef repo, String path, String ref, long installationId) {
        String token = tokenProvider.getInstallationToken(installationId);
        try {
            String raw = webClient.get()
                    .uri(b -> b.path("/repos/{owner}/{repo}/contents/").path(path)
                            .queryParam("ref", ref).build(repo.owner(), repo.name()))
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .header(HttpHeaders.ACCEPT, "application/vnd.github.raw+json")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return Optional.ofNullable(raw);
        } catch (WebClientResponseException.NotFound e) {
            log.debug("{} not found in {} at {}", path, repo, ref);
            return Optional.empty();
        }
    }

    /** Submits one review carrying at most 100 inline comments. */
    @CircuitBreaker(name = "github-api")
    public void createReview(RepositoryRef repo, int pr, long installationId, List<ReviewComment> comments) {
        String token = tokenProvider.getInstallationToken(installationId);
        List<Map<String, Object>> body = comments.stream().map(c -> {
            Map<String, Object> comment = new LinkedHashMap<>();
            comment.put("path", c.path());
            comment.put("line", c.line());
            comment.put("body", c.body());
            comment.put("side", "RIGHT");
            return comment;
        }).toList();

        webClient.post().uri("/repos/{owner}/{repo}/pulls/{pr}/reviews", repo.owner(), repo.name(), pr)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("event", "COMMENT", "comments", body))
                .retrieve().toBodilessEntity().block();
        log.info("Review with {} comments posted on {}#{}", comments.size(), repo, pr);
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
