package com.streamfirst.shush.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A silence entry as held by the registry. The id is derived from the target
 * alone, so writing a record for a target that already has one replaces it.
 *
 * <p>An absent {@code expiresAt} means the silence never expires. A record whose
 * expiry is not after the current instant is expired and must be treated as if
 * it were not there.
 */
@Value
@Builder(toBuilder = true)
public class SilenceRecord {

    @NonNull String id;
    @NonNull Target target;
    @NonNull Instant createdAt;
    @NonNull @Builder.Default Optional<Instant> expiresAt = Optional.empty();
    @NonNull @Builder.Default Optional<String> reason = Optional.empty();
    @NonNull String creator;
    boolean expireOnResolve;

    /**
     * Builds a new record for {@code target} starting at {@code now}.
     *
     * @throws ValidationException if the expiration carries a zero or negative ttl
     */
    public static SilenceRecord build(Target target, Expiration expiration, String reason,
                                      String creator, Instant now) {
        expiration.validate();
        return SilenceRecord.builder()
                .id(target.silenceId())
                .target(target)
                .createdAt(now)
                .expiresAt(expiration.ttl().map(now::plus))
                .reason(normalizeReason(reason))
                .creator(creator)
                .expireOnResolve(expiration.expireOnResolve())
                .build();
    }

    public static Optional<String> normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(reason.trim());
    }

    public boolean isIndefinite() {
        return expiresAt.isEmpty();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt.map(at -> !at.isAfter(now)).orElse(false);
    }

    /** Requested lifetime of a timed silence. */
    public Optional<Duration> ttl() {
        return expiresAt.map(at -> Duration.between(createdAt, at));
    }

    /**
     * Whether two records express the same silencing intent: same reason, same
     * expire-on-resolve flag, both indefinite or both timed with ttls no more than
     * {@code tolerance} apart.
     */
    public boolean sameIntent(SilenceRecord other, Duration tolerance) {
        if (!reason.equals(other.reason) || expireOnResolve != other.expireOnResolve) {
            return false;
        }
        if (isIndefinite() || other.isIndefinite()) {
            return isIndefinite() && other.isIndefinite();
        }
        Duration drift = ttl().orElseThrow().minus(other.ttl().orElseThrow()).abs();
        return drift.compareTo(tolerance) <= 0;
    }
}
