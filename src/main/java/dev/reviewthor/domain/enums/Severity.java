package dev.reviewthor.domain.enums;

import java.util.Optional;

/**
 * Finding severities ordered from most to least severe.
 *
 * ERROR = 0 | WARNING = 1 | INFO = 2
 */
public enum Severity {
    ERROR(0, "error"), WARNING(1, "warning"), INFO(2, "info");

    private final int rank;
    private final String value;

    Severity(int rank, String value) {
        this.rank = rank;
        this.value = value;
    }

    public int rank() { return rank; }

    public String value() { return value; }

    /**
     * True when this severity is at least as severe as the given floor.
     * A floor of INFO admits everything, a floor of ERROR admits only errors.
     */
    public boolean isAdmittedBy(Severity floor) {
        return this.rank <= floor.rank;
    }

    /** Exact, lower-case wire value lookup. Anything else is empty. */
    public static Optional<Severity> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (Severity s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
