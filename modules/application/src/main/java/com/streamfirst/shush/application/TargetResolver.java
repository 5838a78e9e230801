package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.ClientInfo;
import com.streamfirst.shush.domain.InventorySnapshot;
import com.streamfirst.shush.domain.ResolutionException;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.domain.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Expands user selectors into concrete silence targets.
 *
 * <p>Exact names pass through untouched unless exact verification is requested, so a
 * client can be silenced before it first registers. Wildcards only ever expand to
 * names present in the inventory snapshot. The result is deduplicated and sorted.
 */
@Slf4j
public class TargetResolver {

  /**
   * Resolves the selectors against an inventory snapshot.
   *
   * @param selectors what the user asked for
   * @param inventory known clients and checks, possibly stale
   * @param options strictness of the expansion
   * @return the deduplicated targets, sorted
   * @throws ValidationException if the selector combination is empty or ambiguous
   * @throws ResolutionException if a selector matched nothing in strict mode
   */
  public SortedSet<Target> resolve(
      SelectorSet selectors, InventorySnapshot inventory, ResolutionOptions options) {
    selectors.validate();
    SortedSet<Target> targets = new TreeSet<>();

    if (selectors.everything()) {
      log.warn("Resolving a fleet-wide selection: every check on every client");
      targets.add(Target.allChecks(Subject.ALL));
      return targets;
    }

    Collection<Subject> subjects =
        selectors.subjects().isEmpty()
            ? List.of(Subject.ALL)
            : expandSubjects(selectors.subjects(), inventory, options);
    Collection<String> checks =
        selectors.checks().isEmpty()
            ? List.of(Target.ALL_CHECKS)
            : expandChecks(selectors.checks(), inventory, options);

    for (Subject subject : subjects) {
      for (String check : checks) {
        targets.add(Target.of(subject, check));
      }
    }

    if (targets.stream().anyMatch(Target::isFleetWide)) {
      throw new ValidationException("Selectors resolved to a fleet-wide silence without requesting one");
    }
    log.debug("Resolved {} targets from {}", targets.size(), selectors);
    return targets;
  }

  private Set<Subject> expandSubjects(
      List<SubjectSelector> selectors, InventorySnapshot inventory, ResolutionOptions options) {
    Set<Subject> subjects = new LinkedHashSet<>();
    for (SubjectSelector selector : selectors) {
      List<Subject> expanded =
          switch (selector.kind()) {
            case CLIENT -> expandNames(selector, inventory.clientNames(), options).stream()
                .map(Subject::client)
                .toList();
            case SUBSCRIPTION -> expandNames(selector, inventory.subscriptions(), options).stream()
                .map(Subject::subscription)
                .toList();
            case INSTANCE -> expandInstances(selector, inventory);
          };
      if (expanded.isEmpty()) {
        unmatched(selector.toString(), options);
      }
      subjects.addAll(expanded);
    }
    return subjects;
  }

  private List<String> expandNames(
      SubjectSelector selector, Set<String> known, ResolutionOptions options) {
    NamePattern pattern = selector.pattern();
    if (!pattern.isWildcard()) {
      if (options.verifyExact() && !known.contains(pattern.getText())) {
        log.debug("{} is not registered with the monitoring system", selector);
        return List.of();
      }
      return List.of(pattern.getText());
    }
    return known.stream().filter(pattern::matches).sorted().toList();
  }

  private List<Subject> expandInstances(SubjectSelector selector, InventorySnapshot inventory) {
    NamePattern pattern = selector.pattern();
    List<String> instanceIds =
        pattern.isWildcard()
            ? inventory.instanceIds().stream().filter(pattern::matches).toList()
            : List.of(pattern.getText());

    List<Subject> subjects = new ArrayList<>();
    for (String instanceId : instanceIds) {
      Optional<ClientInfo> client = inventory.clientForInstance(instanceId);
      if (client.isPresent()) {
        subjects.add(Subject.client(client.get().name()));
      } else {
        log.warn(
            "Instance id '{}' is not associated with a client; a freshly provisioned instance"
                + " may not have registered yet",
            instanceId);
      }
    }
    return subjects;
  }

  private Set<String> expandChecks(
      List<NamePattern> patterns, InventorySnapshot inventory, ResolutionOptions options) {
    Set<String> checks = new LinkedHashSet<>();
    for (NamePattern pattern : patterns) {
      if (!pattern.isWildcard()) {
        checks.add(pattern.getText());
        continue;
      }
      List<String> matched = inventory.checks().stream().filter(pattern::matches).sorted().toList();
      if (matched.isEmpty()) {
        unmatched("check '" + pattern + "'", options);
      }
      checks.addAll(matched);
    }
    return checks;
  }

  private void unmatched(String selector, ResolutionOptions options) {
    if (options.strict()) {
      throw new ResolutionException(selector, "Selector " + selector + " matched nothing in the inventory");
    }
    log.warn("Selector {} matched nothing in the inventory, skipping it", selector);
  }
}
