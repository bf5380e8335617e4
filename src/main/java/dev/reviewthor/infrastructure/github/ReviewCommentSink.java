package dev.reviewthor.infrastructure.github;

import dev.reviewthor.domain.valueobject.RepositoryRef;
import dev.reviewthor.domain.valueobject.ReviewComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Posts inline comments in contiguous batches of at most {@value #BATCH_LIMIT}, one review per
 * batch, strictly in order. A failing batch aborts the rest; batches already sent stay posted.
 */
@Component
public class ReviewCommentSink {
    private static final Logger log = LoggerFactory.getLogger(ReviewCommentSink.class);

    public static final int BATCH_LIMIT = 100;

    private final GitHubApiClient gitHubClient;

    public ReviewCommentSink(GitHubApiClient gitHubClient) {
        this.gitHubClient = gitHubClient;
    }

    public void post(RepositoryRef repo, int prNumber, long installationId, List<ReviewComment> comments) {
        if (comments.isEmpty()) return;

        List<List<ReviewComment>> batches = partition(comments);
        for (int i = 0; i < batches.size(); i++) {
            log.debug("Posting batch {}/{} ({} comments) to {}#{}",
                    i + 1, batches.size(), batches.get(i).size(), repo, prNumber);
            gitHubClient.createReview(repo, prNumber, installationId, batches.get(i));
        }
    }

    static List<List<ReviewComment>> partition(List<ReviewComment> comments) {
        int batchCount = (comments.size() + BATCH_LIMIT - 1) / BATCH_LIMIT;
        return IntStream.range(0, batchCount)
                .mapToObj(i -> List.copyOf(comments.subList(i * BATCH_LIMIT,
                        Math.min(comments.size(), (i + 1) * BATCH_LIMIT))))
                .toList();
    }
}
