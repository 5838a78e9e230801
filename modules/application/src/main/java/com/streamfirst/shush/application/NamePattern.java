package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.ValidationException;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A user supplied name: either exact, or a glob where {@code *} matches any run of
 * characters and {@code ?} a single character.
 */
@Value
public class NamePattern {

  String text;
  @EqualsAndHashCode.Exclude Pattern glob;

  private NamePattern(String text) {
    Objects.requireNonNull(text, "Name pattern cannot be null");
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      throw new ValidationException("Name pattern cannot be blank");
    }
    this.text = trimmed;
    this.glob = isWildcard(trimmed) ? compile(trimmed) : null;
  }

  public static NamePattern of(String text) {
    return new NamePattern(text);
  }

  public boolean isWildcard() {
    return glob != null;
  }

  public boolean matches(String candidate) {
    return glob != null ? glob.matcher(candidate).matches() : text.equals(candidate);
  }

  private static boolean isWildcard(String text) {
    return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
  }

  private static Pattern compile(String text) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : text.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString());
  }

  @Override
  public String toString() {
    return text;
  }
}
