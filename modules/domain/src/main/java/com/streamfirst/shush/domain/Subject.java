package com.streamfirst.shush.domain;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * The "who" side of a silence target: a single Sensu client, a subscription,
 * or every client. Sensu addresses a client through its implicit
 * {@code client:<name>} subscription.
 *
 * @param kind what the name refers to
 * @param name the client or subscription name, empty for {@link Kind#ALL}
 */
public record Subject(Kind kind, String name) implements Comparable<Subject> {

    /** Prefix Sensu uses for the per-client subscription. */
    public static final String CLIENT_PREFIX = "client:";

    /** Every client. Only produced from an explicit selector. */
    public static final Subject ALL = new Subject(Kind.ALL, "");

    private static final Comparator<Subject> ORDER =
            Comparator.comparing(Subject::kind).thenComparing(Subject::name);

    public enum Kind {
        CLIENT,
        SUBSCRIPTION,
        ALL
    }

    public Subject {
        Objects.requireNonNull(kind, "Subject kind cannot be null");
        Objects.requireNonNull(name, "Subject name cannot be null");
        // client:<name> is the client's own subscription
        if (kind == Kind.SUBSCRIPTION && name.startsWith(CLIENT_PREFIX)) {
            kind = Kind.CLIENT;
            name = name.substring(CLIENT_PREFIX.length());
        }
        if (kind == Kind.ALL && !name.isEmpty()) {
            throw new ValidationException("The all-clients subject does not take a name");
        }
        if (kind != Kind.ALL && name.isBlank()) {
            throw new ValidationException(kind.name().toLowerCase() + " name cannot be blank");
        }
    }

    public static Subject client(String name) {
        return new Subject(Kind.CLIENT, name);
    }

    public static Subject subscription(String name) {
        return new Subject(Kind.SUBSCRIPTION, name);
    }

    /**
     * Parses the subscription field of a registry entry. An absent subscription
     * means the silence applies to every client.
     */
    public static Subject fromSubscription(String subscription) {
        if (subscription == null || subscription.isEmpty()) {
            return ALL;
        }
        return subscription(subscription);
    }

    /**
     * Returns the value for the registry's subscription field, empty when the
     * subject covers every client.
     */
    public Optional<String> subscription() {
        return switch (kind) {
            case CLIENT -> Optional.of(CLIENT_PREFIX + name);
            case SUBSCRIPTION -> Optional.of(name);
            case ALL -> Optional.empty();
        };
    }

    public boolean isAll() {
        return kind == Kind.ALL;
    }

    @Override
    public int compareTo(Subject other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return subscription().orElse("all clients");
    }
}
