package com.streamfirst.shush.adapters.sensu;

import com.fasterxml.jackson.core.type.TypeReference;
import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.domain.ValidationException;
import com.streamfirst.shush.ports.ConflictException;
import com.streamfirst.shush.ports.NotFoundException;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SilenceRegistryPort backed by the Sensu 1.x silenced API.
 *
 * <p>Sensu keys silences by {@code <subscription>:<check>}, so a POST for an existing
 * id overwrites it. Before writing, the current entry is read back and compared so
 * that repeating a request is a no-op and a different silence is never replaced
 * unless asked.
 */
@Slf4j
public class SensuSilenceRegistryAdapter implements SilenceRegistryPort {

    private static final TypeReference<List<SilencedEntry>> ENTRIES = new TypeReference<>() {};
    private static final TypeReference<SilencedEntry> ENTRY = new TypeReference<>() {};

    private final SensuApiClient client;
    private final Clock clock;
    private final Duration ttlTolerance;

    public SensuSilenceRegistryAdapter(SensuApiClient client, Clock clock, Duration ttlTolerance) {
        this.client = client;
        this.clock = clock;
        this.ttlTolerance = ttlTolerance;
    }

    @Override
    public Set<SilenceRecord> list(SilenceFilter filter) {
        Instant now = clock.instant();
        List<SilencedEntry> entries = client.get(SensuEndpoint.SILENCED.path(), ENTRIES);
        log.debug("Sensu reported {} silences", entries.size());
        return entries.stream()
                .flatMap(entry -> readable(entry, now).stream())
                .filter(record -> !record.isExpiredAt(now))
                .filter(filter::matches)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void create(SilenceRecord record, boolean replaceExisting) {
        Instant now = clock.instant();
        Optional<SilenceRecord> existing = client.find(SensuEndpoint.silenceById(record.getId()), ENTRY)
                .map(entry -> toRecord(entry, now))
                .filter(current -> !current.isExpiredAt(now));

        if (existing.isPresent()) {
            if (existing.get().sameIntent(record, ttlTolerance)) {
                log.debug("{} is already silenced with the same settings", record.getTarget());
                return;
            }
            if (!replaceExisting) {
                throw new ConflictException(
                        "Silence " + record.getId() + " already exists with different settings", existing.get());
            }
            log.info("Replacing existing silence {}", record.getId());
        }

        client.post(SensuEndpoint.SILENCED.path(), toPayload(record, now));
    }

    @Override
    public void delete(Target target) {
        try {
            client.post(SensuEndpoint.CLEAR.path(), new ClearPayload(target.silenceId()));
        } catch (NotFoundException e) {
            log.debug("Silence {} was already gone", target.silenceId());
        }
    }

    private static Optional<SilenceRecord> readable(SilencedEntry entry, Instant now) {
        try {
            return Optional.of(toRecord(entry, now));
        } catch (ValidationException e) {
            log.warn("Ignoring unreadable silence {}: {}", entry.id(), e.getMessage());
            return Optional.empty();
        }
    }

    static SilenceRecord toRecord(SilencedEntry entry, Instant now) {
        String check = entry.check() == null || entry.check().isEmpty() ? Target.ALL_CHECKS : entry.check();
        Target target = Target.of(Subject.fromSubscription(entry.subscription()), check);
        Instant createdAt = entry.timestamp() != null ? Instant.ofEpochSecond(entry.timestamp()) : now;
        Optional<Instant> expiresAt = entry.isIndefinite()
                ? Optional.empty()
                : Optional.of(now.plusSeconds(entry.expire()));

        return SilenceRecord.builder()
                .id(Objects.requireNonNullElse(entry.id(), target.silenceId()))
                .target(target)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .reason(SilenceRecord.normalizeReason(entry.reason()))
                .creator(Objects.requireNonNullElse(entry.creator(), "unknown"))
                .expireOnResolve(Boolean.TRUE.equals(entry.expireOnResolve()))
                .build();
    }

    static SilencePayload toPayload(SilenceRecord record, Instant now) {
        Target target = record.getTarget();
        Long expire = record.getExpiresAt()
                .map(at -> Math.max(1L, Duration.between(now, at).toSeconds()))
                .orElse(null);
        return new SilencePayload(
                target.subject().subscription().orElse(null),
                target.checkName().orElse(null),
                expire,
                record.isExpireOnResolve() ? Boolean.TRUE : null,
                record.getReason().orElse(null),
                record.getCreator());
    }
}
