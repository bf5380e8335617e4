package dev.reviewthor.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.reviewthor.config.AiProperties;
import dev.reviewthor.config.ReviewProperties;
import dev.reviewthor.domain.enums.Severity;
import dev.reviewthor.domain.valueobject.ChangedFile;
import dev.reviewthor.domain.valueobject.CustomInstructions;
import dev.reviewthor.domain.valueobject.FileContext;
import dev.reviewthor.domain.valueobject.PackedContext;
import dev.reviewthor.domain.valueobject.PrContext;
import dev.reviewthor.domain.valueobject.RelatedFiles;
import dev.reviewthor.domain.valueobject.RepositoryRef;
import dev.reviewthor.domain.valueobject.ReviewAnalysis;
import dev.reviewthor.domain.valueobject.ReviewComment;
import dev.reviewthor.domain.valueobject.ReviewConfig;
import dev.reviewthor.domain.valueobject.ReviewRequest;
import dev.reviewthor.domain.valueobject.ValidationResult;
import dev.reviewthor.domain.valueobject.WebhookEvent;
import dev.reviewthor.exception.ReviewFailure;
import dev.reviewthor.infrastructure.github.GitHubApiClient;
import dev.reviewthor.infrastructure.github.ReviewCommentSink;
import dev.reviewthor.logging.MdcContext;
import dev.reviewthor.review.ContextAssembler;
import dev.reviewthor.review.GlobPattern;
import dev.reviewthor.review.InstructionProcessor;
import dev.reviewthor.review.ReviewOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the review pipeline for one pull-request event.
 *
 * <pre>
 *  1. Skip drafts
 *  2. Fetch changed files, filter by type / size / ignored paths, cap the count
 *  3. Load the repository's .reviewthor.md and merge it with defaults
 *  4. Package files under the token budget
 *  5. Ask the review service, validate, filter by severity floor
 *  6. Drop comments on ignored paths, cap the count, post in batches
 * </pre>
 *
 * <p>Every failure in here is normalized, logged with the correlation id and swallowed.
 * The webhook was already accepted; rethrowing would only make GitHub redeliver it.
 */
@Service
public class PullRequestReviewService {

    private static final Logger log = LoggerFactory.getLogger(PullRequestReviewService.class);

    private final GitHubApiClient gitHubClient;
    private final InstructionProcessor instructionProcessor;
    private final ContextAssembler contextAssembler;
    private final ReviewOrchestrator orchestrator;
    private final ReviewCommentSink commentSink;
    private final ReviewProperties reviewProperties;
    private final AiProperties aiProperties;
    private final Timer pipelineTimer;

    public PullRequestReviewService(GitHubApiClient gitHubClient,
                                    InstructionProcessor instructionProcessor,
                                    ContextAssembler contextAssembler,
                                    ReviewOrchestrator orchestrator,
                                    ReviewCommentSink commentSink,
                                    ReviewProperties reviewProperties,
                                    AiProperties aiProperties,
                                    MeterRegistry meterRegistry) {
        this.gitHubClient = gitHubClient;
        this.instructionProcessor = instructionProcessor;
        this.contextAssembler = contextAssembler;
        this.orchestrator = orchestrator;
        this.commentSink = commentSink;
        this.reviewProperties = reviewProperties;
        this.aiProperties = aiProperties;
        this.pipelineTimer = Timer.builder("reviewthor.pipeline.duration")
                .description("End-to-end pull request review time")
                .register(meterRegistry);
    }

    /** Never throws. */
    public void handle(WebhookEvent event, String correlationId) {
        Timer.Sample sample = Timer.start();
        RepositoryRef repo = event.repository();
        JsonNode pullRequest = event.pullRequest();
        int prNumber = pullRequest.path("number").asInt();
        MdcContext.setPullRequest(repo.fullName(), prNumber);

        log.info("Processing pull request: event={}, repository={}, pr={}, correlationId={}",
                event.kind(), repo, prNumber, correlationId);
        try {
            int posted = review(event, repo, pullRequest, prNumber);
            log.info("Pull request processing complete: commentsPosted={}, correlationId={}", posted, correlationId);
        } catch (Exception e) {
            ReviewFailure failure = ReviewFailure.of(e);
            log.error("Error processing pull request: kind={}, error={}, correlationId={}",
                    failure.kind(), failure.message(), correlationId, e);
        } finally {
            sample.stop(pipelineTimer);
        }
    }

    private int review(WebhookEvent event, RepositoryRef repo, JsonNode pullRequest, int prNumber) {
        if (reviewProperties.skipDrafts() && pullRequest.path("draft").asBoolean(false)) {
            log.info("Skipping draft PR {}", prNumber);
            return 0;
        }

        List<ChangedFile> files = selectFiles(gitHubClient.getPullRequestFiles(repo, prNumber, event.installationId()));
        if (files.isEmpty()) {
            log.info("No files to review");
            return 0;
        }

        Optional<CustomInstructions> custom = instructionProcessor
                .fetchCustomInstructions(repo, event.installationId())
                .filter(this::isUsable);
        custom.ifPresent(c -> log.info("Found custom instructions: focusAreas={}, customRules={}",
                c.focusAreas().size(), c.customRules().size()));
        ReviewConfig config = custom.map(instructionProcessor::mergeWithDefaults)
                .orElseGet(instructionProcessor::defaultConfig);
        Severity floor = custom.flatMap(CustomInstructions::severity).orElse(reviewProperties.minimumSeverity());

        ReviewRequest request = buildRequest(event, repo, pullRequest, files, config);
        log.info("Starting AI analysis: filesCount={}, estimatedTokens={}", request.files().size(), request.estimatedTokens());
        ReviewAnalysis analysis = orchestrator.analyze(request);
        log.info("AI analysis complete: issuesFound={}, stats={}", analysis.findings().size(), analysis.stats());

        List<ReviewComment> comments = orchestrator.generateComments(analysis, floor).stream()
                .filter(c -> config.ignorePatterns().stream().noneMatch(p -> GlobPattern.matches(p, c.path())))
                .limit(config.maxCommentsPerPr())
                .toList();

        if (comments.isEmpty()) {
            log.info("No comments to post");
            return 0;
        }
        log.info("Posting review comments: commentsCount={}", comments.size());
        commentSink.post(repo, prNumber, event.installationId(), comments);
        return comments.size();
    }

    List<ChangedFile> selectFiles(List<ChangedFile> changed) {
        List<ChangedFile> eligible = changed.stream()
                .filter(f -> reviewProperties.enabledFileTypes().stream().anyMatch(f::hasExtension))
                .filter(f -> {
                    if (f.changes() > reviewProperties.maxFileSize()) {
                        log.info("Skipping large file {} ({} changes)", f.path(), f.changes());
                        return false;
                    }
                    return true;
                })
                .filter(f -> {
                    boolean ignored = reviewProperties.ignoredPaths().stream().anyMatch(p -> GlobPattern.matches(p, f.path()));
                    if (ignored) log.debug("Ignoring file {} based on pattern", f.path());
                    return !ignored;
                })
                .toList();

        if (eligible.size() > reviewProperties.maxFilesPerReview()) {
            log.warn("File limit exceeded, reviewing subset: totalFiles={}, reviewingFiles={}",
                    eligible.size(), reviewProperties.maxFilesPerReview());
            return eligible.subList(0, reviewProperties.maxFilesPerReview());
        }
        return eligible;
    }

    private boolean isUsable(CustomInstructions instructions) {
        ValidationResult validation = instructionProcessor.validate(instructions);
        if (!validation.isValid()) {
            log.warn("Ignoring invalid {}: {}", reviewProperties.instructionsPath(), validation.errors());
        }
        return validation.isValid();
    }

    private ReviewRequest buildRequest(WebhookEvent event, RepositoryRef repo, JsonNode pullRequest,
                                       List<ChangedFile> files, ReviewConfig config) {
        String headSha = pullRequest.path("head").path("sha").asText("HEAD");
        Map<String, RelatedFiles> related = new LinkedHashMap<>();

        List<FileContext> contexts = files.stream().map(f -> {
            String content = "";
            if (reviewProperties.includeFileContent() && !"removed".equals(f.status())) {
                content = gitHubClient.getRepositoryFile(repo, f.path(), headSha, event.installationId()).orElse("");
                RelatedFiles found = contextAssembler.discoverRelated(f.path(), content);
                if (!found.isEmpty()) related.put(f.path(), found);
            }
            return contextAssembler.buildFileContext(f.path(), content, f.patchOrEmpty());
        }).toList();

        PrContext pr = contextAssembler.buildPrContext(pullRequest);
        PackedContext packed = contextAssembler.pack(contexts, pr, aiProperties.maxInputTokens());
        if (packed.truncated()) {
            log.warn("Context truncated to fit token budget: {} of {} files kept", packed.files().size(), contexts.size());
        }

        return new ReviewRequest(packed.files(), pr.description(), repo.fullName(), packed.tokenCount(),
                config.focusAreas(), config.customRules(), related);
    }
}
