package com.streamfirst.shush.domain;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A (subject, check) pair a silence applies to. The check may be the
 * {@link #ALL_CHECKS} sentinel. Value equality drives deduplication.
 *
 * @param subject the client, subscription or every client
 * @param check a check name or {@link #ALL_CHECKS}
 */
public record Target(Subject subject, String check) implements Comparable<Target> {

    /** Sentinel for "every check on the subject". Also the id placeholder Sensu uses. */
    public static final String ALL_CHECKS = "*";

    private static final Comparator<Target> ORDER =
            Comparator.comparing(Target::subject).thenComparing(Target::check);

    public Target {
        Objects.requireNonNull(subject, "Target subject cannot be null");
        Objects.requireNonNull(check, "Target check cannot be null");
        if (check.isBlank()) {
            throw new ValidationException("Check name cannot be blank");
        }
    }

    public static Target of(Subject subject, String check) {
        return new Target(subject, check);
    }

    public static Target allChecks(Subject subject) {
        return new Target(subject, ALL_CHECKS);
    }

    public boolean coversAllChecks() {
        return ALL_CHECKS.equals(check);
    }

    /** Every client and every check. */
    public boolean isFleetWide() {
        return subject.isAll() && coversAllChecks();
    }

    public Optional<String> checkName() {
        return coversAllChecks() ? Optional.empty() : Optional.of(check);
    }

    /**
     * Registry id for silences of this target, {@code <subscription>:<check>}
     * with {@code *} standing in for either absent part.
     */
    public String silenceId() {
        return subject.subscription().orElse(ALL_CHECKS) + ":" + check;
    }

    @Override
    public int compareTo(Target other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return (coversAllChecks() ? "all checks" : "check " + check) + " on " + subject;
    }
}
