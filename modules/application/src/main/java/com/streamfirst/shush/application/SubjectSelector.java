package com.streamfirst.shush.application;

import java.util.Objects;

/**
 * Selects subjects by client name, subscription name or cloud instance id.
 *
 * @param kind what the pattern is matched against
 * @param pattern exact name or wildcard
 */
public record SubjectSelector(Kind kind, NamePattern pattern) {

  public enum Kind {
    CLIENT,
    SUBSCRIPTION,
    /** Cloud instance id, mapped to the client reporting it */
    INSTANCE
  }

  public SubjectSelector {
    Objects.requireNonNull(kind, "Selector kind cannot be null");
    Objects.requireNonNull(pattern, "Selector pattern cannot be null");
  }

  public static SubjectSelector client(String pattern) {
    return new SubjectSelector(Kind.CLIENT, NamePattern.of(pattern));
  }

  public static SubjectSelector subscription(String pattern) {
    return new SubjectSelector(Kind.SUBSCRIPTION, NamePattern.of(pattern));
  }

  public static SubjectSelector instance(String pattern) {
    return new SubjectSelector(Kind.INSTANCE, NamePattern.of(pattern));
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + " '" + pattern + "'";
  }
}
