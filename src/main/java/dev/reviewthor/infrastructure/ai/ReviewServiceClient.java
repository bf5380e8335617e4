package dev.reviewthor.infrastructure.ai;

import dev.reviewthor.config.AiProperties;
import dev.reviewthor.exception.ReviewServiceException;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Black-box access to the language-model review service through Spring AI's {@link ChatModel}.
 * One prompt in, one text answer out. Provider failures surface as {@link ReviewServiceException}.
 */
@Component
public class ReviewServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ReviewServiceClient.class);

    private static final String REASONING_METADATA_KEY = "reasoningContent";

    private final AiProperties aiProperties;
    private final ChatModel chatModel;

    public ReviewServiceClient(AiProperties aiProperties, ChatModel chatModel) {
        this.aiProperties = aiProperties;
        this.chatModel = chatModel;
    }

    @RateLimiter(name = "review-service")
    public AiResponse createMessage(String prompt, MessageOptions options) {
        ChatOptions chatOptions = ChatOptions.builder()
                .model(aiProperties.model())
                .maxTokens(options.maxTokens() != null ? options.maxTokens() : aiProperties.maxOutputTokens())
                .temperature(options.temperature() != null ? options.temperature() : aiProperties.temperature())
                .stopSequences(options.stopSequences().isEmpty() ? null : options.stopSequences())
                .build();

        Instant start = Instant.now();
        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(prompt, chatOptions));
        } catch (RuntimeException e) {
            throw new ReviewServiceException("Review service error: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ReviewServiceException("Review service error: empty response", null);
        }

        AssistantMessage output = response.getResult().getOutput();
        Object reasoning = output.getMetadata().get(REASONING_METADATA_KEY);
        String content = output.getText() != null ? output.getText() : "";
        log.debug("Review service answered {} chars in {} ms", content.length(),
                Duration.between(start, Instant.now()).toMillis());
        return new AiResponse(content, reasoning != null ? reasoning.toString() : "");
    }

    /** Per-call overrides; null fields fall back to {@link AiProperties}. */
    public record MessageOptions(Integer maxTokens, Double temperature, List<String> stopSequences) {
        public MessageOptions {
            stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
        }

        public static MessageOptions of(int maxTokens, double temperature) {
            return new MessageOptions(maxTokens, temperature, List.of());
        }
    }

    public record AiResponse(String content, String reasoning) {}
}
