package com.streamfirst.shush.boot;

import com.streamfirst.shush.application.ConflictPolicy;
import com.streamfirst.shush.application.NamePattern;
import com.streamfirst.shush.application.PlanAction;
import com.streamfirst.shush.application.ResolutionOptions;
import com.streamfirst.shush.application.SelectorSet;
import com.streamfirst.shush.application.SilenceRequest;
import com.streamfirst.shush.application.SubjectSelector;
import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.SilenceFilter;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Command line surface of shush. Parsing only; nothing here talks to Sensu.
 */
@Command(
        name = "shush",
        mixinStandardHelpOptions = true,
        version = "shush 0.1.0",
        description = "Silence, clear or list Sensu check silences for clients, subscriptions or AWS instances",
        sortOptions = false
)
public class ShushCommand {

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    Subjects subjects;

    @Option(names = {"-c", "--checks"}, split = ",", paramLabel = "CHECK",
            description = "Checks to act on, comma separated; wildcards allowed. A regex in list mode.")
    List<String> checks = new ArrayList<>();

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    Mode mode;

    @Option(names = {"-e", "--expire"}, paramLabel = "DURATION", defaultValue = "2h",
            description = "Silence lifetime such as 90m or 1h30m, or 'none' (default: ${DEFAULT-VALUE})")
    String expire;

    @Option(names = {"-o", "--expire-on-resolve"}, description = "Also remove the silence when the check resolves")
    boolean expireOnResolve;

    @Option(names = "--reason", description = "Reason recorded on the silence")
    String reason;

    @Option(names = "--strict", description = "Fail when a selector matches nothing instead of skipping it")
    boolean strict;

    @Option(names = "--verify", description = "Require exact client and subscription names to be known to Sensu")
    boolean verify;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    Conflicts conflicts;

    @Option(names = "--all", description = "Silence or clear every check on every client")
    boolean everything;

    @Option(names = "--dry-run", description = "Print the planned operations without applying them")
    boolean dryRun;

    @Option(names = "--verbose", description = "Log debug output to stderr")
    boolean verbose;

    @Option(names = {"-f", "--config-file"}, paramLabel = "PATH", description = "Additional properties file")
    Path configFile;

    static class Subjects {
        @Option(names = {"-n", "--aws-nodes"}, split = ",", paramLabel = "INSTANCE_ID", required = true,
                description = "AWS instance ids, mapped to their Sensu clients")
        List<String> instanceIds;

        @Option(names = {"-i", "--client-ids"}, split = ",", paramLabel = "CLIENT", required = true,
                description = "Sensu client names")
        List<String> clients;

        @Option(names = {"-s", "--subscriptions"}, split = ",", paramLabel = "SUBSCRIPTION", required = true,
                description = "Sensu subscriptions. A regex in list mode.")
        List<String> subscriptions;
    }

    static class Mode {
        @Option(names = {"-r", "--remove"}, required = true, description = "Clear silences instead of creating them")
        boolean remove;

        @Option(names = {"-l", "--list"}, required = true, description = "List current silences")
        boolean list;
    }

    static class Conflicts {
        @Option(names = "--overwrite", required = true,
                description = "Replace silences that exist with different settings")
        boolean overwrite;

        @Option(names = "--skip-conflicts", required = true,
                description = "Leave silences that exist with different settings alone")
        boolean skip;
    }

    public PlanAction action() {
        if (mode == null) {
            return PlanAction.SILENCE;
        }
        return mode.list ? PlanAction.LIST : PlanAction.CLEAR;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public ResolutionOptions resolutionOptions() {
        return new ResolutionOptions(strict, verify);
    }

    public SelectorSet selectors() {
        List<SubjectSelector> selected = new ArrayList<>();
        if (subjects != null) {
            selected.addAll(map(subjects.instanceIds, SubjectSelector::instance));
            selected.addAll(map(subjects.clients, SubjectSelector::client));
            selected.addAll(map(subjects.subscriptions, SubjectSelector::subscription));
        }
        return new SelectorSet(selected, map(checks, NamePattern::of), everything);
    }

    /**
     * Listing by subscription or check matches regular expressions against the
     * registry entries directly. Listing by client or instance resolves exact
     * targets instead.
     */
    public boolean listsByFilter() {
        return subjects == null || subjects.subscriptions != null;
    }

    public SilenceFilter filter() {
        String subscriptionRegex = subjects != null && subjects.subscriptions != null
                ? String.join("|", subjects.subscriptions)
                : null;
        String checkRegex = checks.isEmpty() ? null : String.join("|", checks);
        return SilenceFilter.of(subscriptionRegex, checkRegex);
    }

    public SilenceRequest request(String creator) {
        ConflictPolicy policy = ConflictPolicy.FAIL;
        if (conflicts != null) {
            policy = conflicts.overwrite ? ConflictPolicy.OVERWRITE : ConflictPolicy.SKIP;
        }
        return SilenceRequest.builder()
                .expiration(Expiration.parse(expire, expireOnResolve))
                .reason(reason)
                .creator(creator)
                .conflictPolicy(policy)
                .build();
    }

    /** Arguments handed to Spring so that -f and --verbose shape the configuration. */
    public List<String> springArguments() {
        List<String> args = new ArrayList<>();
        if (configFile != null) {
            args.add("--spring.config.additional-location=file:" + configFile.toAbsolutePath());
        }
        if (verbose) {
            args.add("--logging.level.com.streamfirst.shush=DEBUG");
        }
        return args;
    }

    private static <T> List<T> map(List<String> values, Function<String, T> factory) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(value -> !value.isBlank()).map(factory).toList();
    }
}
