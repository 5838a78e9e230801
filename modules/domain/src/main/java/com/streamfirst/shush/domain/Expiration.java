package com.streamfirst.shush.domain;

import lombok.EqualsAndHashCode;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How long a silence should last: a ttl, or indefinitely, optionally also
 * ending when the silenced check resolves.
 */
@EqualsAndHashCode
public final class Expiration {

    /** Applied when the user does not ask for anything else. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(2);

    private static final String NONE = "none";
    private static final Pattern SPEC = Pattern.compile("(?:\\d+[dhms]?)+");
    private static final Pattern PART = Pattern.compile("(\\d+)([dhms]?)");

    private final Duration ttl;
    private final boolean expireOnResolve;

    private Expiration(Duration ttl, boolean expireOnResolve) {
        this.ttl = ttl;
        this.expireOnResolve = expireOnResolve;
    }

    public static Expiration never(boolean expireOnResolve) {
        return new Expiration(null, expireOnResolve);
    }

    public static Expiration after(Duration ttl, boolean expireOnResolve) {
        if (ttl == null) {
            throw new ValidationException("ttl cannot be null, use Expiration.never for indefinite silences");
        }
        return new Expiration(ttl, expireOnResolve);
    }

    public static Expiration defaultExpiration(boolean expireOnResolve) {
        return after(DEFAULT_TTL, expireOnResolve);
    }

    /**
     * Parses {@code none} or a duration such as {@code 90}, {@code 10m} or
     * {@code 1d2h30m15s}. A bare number counts seconds.
     *
     * @throws ValidationException if the text is not a duration
     */
    public static Expiration parse(String spec, boolean expireOnResolve) {
        if (spec == null || spec.isBlank()) {
            return defaultExpiration(expireOnResolve);
        }
        String text = spec.trim().toLowerCase(Locale.ROOT);
        if (NONE.equals(text)) {
            return never(expireOnResolve);
        }
        if (!SPEC.matcher(text).matches()) {
            throw new ValidationException("Invalid expiration '" + spec
                    + "': expected 'none' or a duration like 1h30m");
        }
        Duration total = Duration.ZERO;
        Matcher part = PART.matcher(text);
        while (part.find()) {
            long amount;
            try {
                amount = Long.parseLong(part.group(1));
            } catch (NumberFormatException e) {
                throw new ValidationException("Expiration amount out of range: " + part.group(1), e);
            }
            total = total.plus(switch (part.group(2)) {
                case "d" -> Duration.ofDays(amount);
                case "h" -> Duration.ofHours(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofSeconds(amount);
            });
        }
        return after(total, expireOnResolve);
    }

    public Optional<Duration> ttl() {
        return Optional.ofNullable(ttl);
    }

    public boolean isIndefinite() {
        return ttl == null;
    }

    public boolean expireOnResolve() {
        return expireOnResolve;
    }

    /**
     * @throws ValidationException if the ttl is zero or negative
     */
    public Expiration validate() {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new ValidationException("Silence ttl must be positive, got " + ttl);
        }
        return this;
    }

    @Override
    public String toString() {
        if (ttl == null) {
            return expireOnResolve ? "not expire until resolution" : "never expire";
        }
        return "expire in " + ttl.toSeconds() + " seconds" + (expireOnResolve ? " or on resolution" : "");
    }
}
