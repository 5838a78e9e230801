package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.ValidationException;
import java.util.List;

/**
 * Everything a user asked to act on in one invocation.
 *
 * <p>Leaving out the check selectors means every check on the selected subjects;
 * leaving out the subject selectors means the selected checks on every client. A
 * fleet-wide silence (every client and every check) is only ever produced from
 * {@link #fleetWide()}, never from two omitted or wildcarded dimensions.
 *
 * @param subjects client, subscription and instance selectors
 * @param checks check name selectors
 * @param everything explicit request for every client and every check
 */
public record SelectorSet(List<SubjectSelector> subjects, List<NamePattern> checks, boolean everything) {

  public SelectorSet {
    subjects = subjects == null ? List.of() : List.copyOf(subjects);
    checks = checks == null ? List.of() : List.copyOf(checks);
  }

  public static SelectorSet of(List<SubjectSelector> subjects, List<NamePattern> checks) {
    return new SelectorSet(subjects, checks, false);
  }

  public static SelectorSet subjects(SubjectSelector... subjects) {
    return new SelectorSet(List.of(subjects), List.of(), false);
  }

  public static SelectorSet checks(String... checks) {
    return new SelectorSet(List.of(), List.of(checks).stream().map(NamePattern::of).toList(), false);
  }

  public static SelectorSet fleetWide() {
    return new SelectorSet(List.of(), List.of(), true);
  }

  public SelectorSet withChecks(String... checks) {
    return new SelectorSet(subjects, List.of(checks).stream().map(NamePattern::of).toList(), everything);
  }

  /**
   * @throws ValidationException if the combination is empty or ambiguous
   */
  public SelectorSet validate() {
    if (everything && (!subjects.isEmpty() || !checks.isEmpty())) {
      throw new ValidationException(
          "A fleet-wide selection cannot be combined with client, subscription or check selectors");
    }
    if (!everything && subjects.isEmpty() && checks.isEmpty()) {
      throw new ValidationException(
          "No targets specified: select clients, subscriptions, instance ids or checks,"
              + " or explicitly request every client and every check");
    }
    return this;
  }

  /** Whether resolving these selectors has to consult the inventory. */
  public boolean needsInventory(ResolutionOptions options) {
    boolean subjectLookup =
        subjects.stream()
            .anyMatch(
                s ->
                    s.kind() == SubjectSelector.Kind.INSTANCE
                        || s.pattern().isWildcard()
                        || options.verifyExact());
    return subjectLookup || checks.stream().anyMatch(NamePattern::isWildcard);
  }
}
