package dev.reviewthor.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    @Test
    @DisplayName("ranks run from error (most severe) to info")
    void ranks() {
        assertThat(Severity.ERROR.rank()).isLessThan(Severity.WARNING.rank());
        assertThat(Severity.WARNING.rank()).isLessThan(Severity.INFO.rank());
    }

    @Test
    @DisplayName("a floor admits its own level and everything more severe")
    void admission() {
        assertThat(Severity.ERROR.isAdmittedBy(Severity.WARNING)).isTrue();
        assertThat(Severity.WARNING.isAdmittedBy(Severity.WARNING)).isTrue();
        assertThat(Severity.INFO.isAdmittedBy(Severity.WARNING)).isFalse();
        assertThat(Severity.INFO.isAdmittedBy(Severity.INFO)).isTrue();
        assertThat(Severity.WARNING.isAdmittedBy(Severity.ERROR)).isFalse();
    }

    @Test
    @DisplayName("fromValue accepts only the exact lower-case wire values")
    void lookups() {
        assertThat(Severity.fromValue("warning")).contains(Severity.WARNING);
        assertThat(Severity.fromValue("Warning")).isEmpty();
        assertThat(Severity.fromValue(null)).isEmpty();
        assertThat(Severity.fromValue("critical")).isEmpty();
    }

    @Test
    @DisplayName("event kinds render as their GitHub wire names")
    void eventKindWireNames() {
        assertThat(EventKind.PULL_REQUEST_SYNCHRONIZE).hasToString("pull_request.synchronize");
        assertThat(EventKind.PULL_REQUEST_REVIEW_SUBMITTED.wireName()).isEqualTo("pull_request_review.submitted");
        assertThat(EventKind.forPullRequestAction("reopened")).isEqualTo(EventKind.PULL_REQUEST_REOPENED);
        assertThat(EventKind.forPullRequestAction("closed")).isNull();
    }
}
