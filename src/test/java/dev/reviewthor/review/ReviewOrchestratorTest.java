package dev.reviewthor.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewthor.config.AiProperties;
import dev.reviewthor.config.ReviewProperties;
import dev.reviewthor.domain.enums.Severity;
import dev.reviewthor.domain.valueobject.FileContext;
import dev.reviewthor.domain.valueobject.Finding;
import dev.reviewthor.domain.valueobject.ReviewAnalysis;
import dev.reviewthor.domain.valueobject.ReviewComment;
import dev.reviewthor.domain.valueobject.ReviewRequest;
import dev.reviewthor.exception.ErrorKind;
import dev.reviewthor.exception.InvalidResponseFormatException;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient.AiResponse;
import dev.reviewthor.infrastructure.ai.ReviewServiceClient.MessageOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReviewOrchestratorTest {

    private static final String VALID_RESPONSE = """
            {
              "issues": [
                {"file": "src/app.js", "line": 10, "severity": "error", "message": "Unhandled rejection",
                 "category": "bug", "suggestion": "await fetchData().catch(handle);"},
                {"file": "src/app.js", "line": 22, "severity": "warning", "message": "Use const",
                 "category": "code-quality"},
                {"file": "src/util.js", "line": 3, "severity": "info", "message": "Consider JSDoc",
                 "category": "documentation"}
              ],
              "summary": "Three findings",
              "stats": {"total": 3, "byCategory": {"bug": 1, "code-quality": 1, "documentation": 1},
                        "bySeverity": {"error": 1, "warning": 1, "info": 1}}
            }""";

    private ReviewServiceClient reviewService;
    private ReviewOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        reviewService = mock(ReviewServiceClient.class);
        orchestrator = new ReviewOrchestrator(reviewService, AiProperties.defaults(),
                ReviewProperties.defaults(), new ObjectMapper());
    }

    @Test
    @DisplayName("analyze sends one prompt with the configured output limits and parses the answer")
    void analyzeCallsServiceOnce() {
        when(reviewService.createMessage(anyString(), any())).thenReturn(new AiResponse(VALID_RESPONSE, ""));
        var request = ReviewRequest.of(List.of(new FileContext("src/app.js", "", "+x", "javascript")),
                "desc", "o/r", 30);

        ReviewAnalysis analysis = orchestrator.analyze(request);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<MessageOptions> options = ArgumentCaptor.forClass(MessageOptions.class);
        verify(reviewService).createMessage(prompt.capture(), options.capture());
        assertThat(prompt.getValue()).contains("Repository: o/r");
        assertThat(options.getValue().maxTokens()).isEqualTo(4096);
        assertThat(options.getValue().temperature()).isEqualTo(0.3);

        assertThat(analysis.findings()).hasSize(3);
        assertThat(analysis.summary()).isEqualTo("Three findings");
        assertThat(analysis.stats().bySeverity()).containsEntry("error", 1);
        assertThat(analysis.findings().get(0).suggestion()).isEqualTo("await fetchData().catch(handle);");
        assertThat(analysis.findings().get(1).hasSuggestion()).isFalse();
    }

    @Nested
    @DisplayName("response validation")
    class Validation {

        @ParameterizedTest(name = "{1}")
        @CsvSource(delimiter = '|', value = {
                "[]|Analysis must be an object",
                "{\"summary\": \"s\", \"stats\": {}}|Analysis must contain an issues array",
                "{\"issues\": {}, \"summary\": \"s\", \"stats\": {}}|Analysis must contain an issues array",
                "{\"issues\": [], \"stats\": {}}|Analysis must contain a summary string",
                "{\"issues\": [], \"summary\": 5, \"stats\": {}}|Analysis must contain a summary string",
                "{\"issues\": [], \"summary\": \"s\"}|Analysis must contain stats object",
                "{\"issues\": [{\"file\": \"a.js\", \"severity\": \"error\", \"message\": \"m\", \"category\": \"bug\"}], \"summary\": \"s\", \"stats\": {}}|Each issue must have file, line, severity, message, and category",
                "{\"issues\": [{\"file\": \"a.js\", \"line\": 0, \"severity\": \"error\", \"message\": \"m\", \"category\": \"bug\"}], \"summary\": \"s\", \"stats\": {}}|Each issue must have file, line, severity, message, and category",
                "{\"issues\": [{\"file\": \"a.js\", \"line\": 1, \"severity\": \"critical\", \"message\": \"m\", \"category\": \"bug\"}], \"summary\": \"s\", \"stats\": {}}|Issue severity must be error, warning, or info",
                "{\"issues\": [{\"file\": \"a.js\", \"line\": 1, \"severity\": \"Error\", \"message\": \"m\", \"category\": \"bug\"}], \"summary\": \"s\", \"stats\": {}}|Issue severity must be error, warning, or info"
        })
        @DisplayName("schema violations fail the whole response with a specific message")
        void rejectsSchemaViolations(String content, String message) {
            assertThatThrownBy(() -> orchestrator.parseAnalysis(content))
                    .isInstanceOf(InvalidResponseFormatException.class)
                    .hasMessage("Invalid AI response format: " + message)
                    .extracting(e -> ((InvalidResponseFormatException) e).kind())
                    .isEqualTo(ErrorKind.CONTRACT);
        }

        @Test
        @DisplayName("non-JSON answers are a contract failure carrying the parser message")
        void rejectsNonJson() {
            assertThatThrownBy(() -> orchestrator.parseAnalysis("Sure! Here is my review: ..."))
                    .isInstanceOf(InvalidResponseFormatException.class)
                    .hasMessageStartingWith("Invalid AI response format: ")
                    .hasMessageContaining("Unrecognized token 'Sure'")
                    .hasCauseInstanceOf(JsonProcessingException.class);
        }

        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"", "   ", "\n\t"})
        @DisplayName("blank answers are a parse failure with the unknown-error message")
        void rejectsBlankContent(String content) {
            assertThatThrownBy(() -> orchestrator.parseAnalysis(content))
                    .isInstanceOf(InvalidResponseFormatException.class)
                    .hasMessage("Invalid AI response format: Unknown error")
                    .extracting(e -> ((InvalidResponseFormatException) e).kind())
                    .isEqualTo(ErrorKind.CONTRACT);
        }

        @Test
        @DisplayName("a null answer is a parse failure with the unknown-error message")
        void rejectsNullContent() {
            assertThatThrownBy(() -> orchestrator.parseAnalysis(null))
                    .isInstanceOf(InvalidResponseFormatException.class)
                    .hasMessage("Invalid AI response format: Unknown error");
        }

        @Test
        @DisplayName("one bad issue rejects the whole answer")
        void oneBadIssueFailsAll() {
            String content = """
                    {"issues": [
                      {"file": "a.js", "line": 1, "severity": "error", "message": "ok", "category": "bug"},
                      {"file": "b.js", "line": 2, "severity": "warning", "message": "", "category": "bug"}
                    ], "summary": "s", "stats": {}}""";

            assertThatThrownBy(() -> orchestrator.parseAnalysis(content))
                    .isInstanceOf(InvalidResponseFormatException.class);
        }

        @Test
        @DisplayName("an empty issues list is valid")
        void emptyIssuesValid() {
            ReviewAnalysis analysis = orchestrator.parseAnalysis(
                    "{\"issues\": [], \"summary\": \"Looks good\", \"stats\": {\"total\": 0}}");

            assertThat(analysis.findings()).isEmpty();
            assertThat(analysis.stats().total()).isZero();
        }
    }

    @Nested
    @DisplayName("generateComments")
    class GenerateComments {

        private ReviewAnalysis analysis;

        @BeforeEach
        void parse() {
            analysis = orchestrator.parseAnalysis(VALID_RESPONSE);
        }

        @Test
        @DisplayName("a warning floor keeps errors and warnings only, in input order")
        void warningFloor() {
            List<ReviewComment> comments = orchestrator.generateComments(analysis, Severity.WARNING);

            assertThat(comments).extracting(ReviewComment::line).containsExactly(10, 22);
            assertThat(comments.get(0).path()).isEqualTo("src/app.js");
            assertThat(comments.get(0).body()).startsWith("❌ **Bug**: Unhandled rejection");
            assertThat(comments.get(1).body()).isEqualTo("⚠️ **Code Quality**: Use const");
        }

        @Test
        @DisplayName("raising the floor never adds comments")
        void floorIsMonotonic() {
            int info = orchestrator.generateComments(analysis, Severity.INFO).size();
            int warning = orchestrator.generateComments(analysis, Severity.WARNING).size();
            int error = orchestrator.generateComments(analysis, Severity.ERROR).size();

            assertThat(info).isEqualTo(3);
            assertThat(warning).isEqualTo(2);
            assertThat(error).isEqualTo(1);
        }

        @Test
        @DisplayName("without an explicit floor the configured minimum applies")
        void defaultFloor() {
            assertThat(orchestrator.generateComments(analysis)).hasSize(3);
            assertThat(orchestrator.generateComments(analysis, null)).hasSize(3);
        }

        @Test
        @DisplayName("no findings means no comments")
        void noFindings() {
            var empty = new ReviewAnalysis(List.of(), "Nothing", new ReviewAnalysis.Stats(0, Map.of(), Map.of()));

            assertThat(orchestrator.generateComments(empty, Severity.INFO)).isEmpty();
        }
    }

    @Test
    @DisplayName("explain returns the trimmed free-text answer using the explain token limit")
    void explainReturnsText() {
        when(reviewService.createMessage(anyString(), any()))
                .thenReturn(new AiResponse("  Because nulls propagate.\n", ""));
        Finding finding = new Finding("a.js", 4, Severity.ERROR, "Null deref", "bug", null);

        String explanation = orchestrator.explain(finding);

        ArgumentCaptor<MessageOptions> options = ArgumentCaptor.forClass(MessageOptions.class);
        verify(reviewService).createMessage(anyString(), options.capture());
        assertThat(explanation).isEqualTo("Because nulls propagate.");
        assertThat(options.getValue().maxTokens()).isEqualTo(1024);
    }
}
