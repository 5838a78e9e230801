package com.streamfirst.shush.boot;

import com.streamfirst.shush.adapters.InMemoryInventoryAdapter;
import com.streamfirst.shush.adapters.InMemorySilenceRegistryAdapter;
import com.streamfirst.shush.application.PlanExecutor;
import com.streamfirst.shush.application.SilencePlanner;
import com.streamfirst.shush.application.SilenceService;
import com.streamfirst.shush.application.TargetResolver;
import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.RegistryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ShushCommandRunnerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemorySilenceRegistryAdapter registry;
    private ShushCommandRunner runner;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        registry = new InMemorySilenceRegistryAdapter(CLOCK);
        InMemoryInventoryAdapter inventory = new InMemoryInventoryAdapter(CLOCK)
                .client("web-01", "i-0001", "web")
                .client("web-02", "i-0002", "web")
                .checks("disk");
        SilenceService service = new SilenceService(registry, inventory, new TargetResolver(), new SilencePlanner(),
                new PlanExecutor(), CLOCK);
        ShushProperties properties = new ShushProperties();
        properties.setCreator("ops");
        runner = new ShushCommandRunner(service, properties, CLOCK, new ReportPrinter(CLOCK));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        ShushCommand command = new ShushCommand();
        new CommandLine(command).parseArgs(args);
        return runner.run(command, new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void silencesAndReportsSuccess() {
        int exit = run("-i", "web-*", "-c", "disk", "--reason", "maintenance");

        assertThat(exit).isEqualTo(ShushCommandRunner.EXIT_OK);
        assertThat(registry.all()).hasSize(2).allSatisfy(record -> assertThat(record.getCreator()).isEqualTo("ops"));
        assertThat(out.toString()).contains("2 succeeded, 0 skipped, 0 failed");
    }

    @Test
    void anyFailedTargetExitsWithOne() {
        registry.failAlways(Target.of(Subject.client("web-02"), "disk"),
                () -> new RegistryUnavailableException("HTTP 503"));

        int exit = run("-i", "web-01,web-02", "-c", "disk");

        assertThat(exit).isEqualTo(ShushCommandRunner.EXIT_FAILURES);
        assertThat(out.toString()).contains("[UNAVAILABLE]").contains("1 succeeded, 0 skipped, 1 failed");
    }

    @Test
    void invalidInputExitsWithTwoAndWritesNothing() {
        assertThat(run("-i", "web-01", "-e", "0")).isEqualTo(ShushCommandRunner.EXIT_USAGE);
        assertThat(run("-e", "1h")).isEqualTo(ShushCommandRunner.EXIT_USAGE);
        assertThat(run("-i", "cache-*", "--strict")).isEqualTo(ShushCommandRunner.EXIT_USAGE);
        assertThat(err.toString()).contains("error:");
        assertThat(registry.callCount()).isZero();
    }

    @Test
    void dryRunDoesNotWrite() {
        int exit = run("-i", "web-01", "--dry-run");

        assertThat(exit).isEqualTo(ShushCommandRunner.EXIT_OK);
        assertThat(out.toString()).contains("Would silence all checks on client:web-01");
        assertThat(registry.writeCount()).isZero();
    }

    @Test
    void clearAndList() {
        registry.put(SilenceRecord.build(Target.allChecks(Subject.client("web-01")), Expiration.never(false),
                "reboot", "ops", NOW));

        assertThat(run("-l", "-s", "web")).isEqualTo(ShushCommandRunner.EXIT_OK);
        assertThat(out.toString()).contains("subscription:\t\tclient:web-01").contains("Expiration:\t\tnever");

        assertThat(run("-r", "-i", "web-01")).isEqualTo(ShushCommandRunner.EXIT_OK);
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void unreadableRegistryExitsWithOne() {
        registry.failNextListing(new RegistryUnavailableException("connection refused"));

        assertThat(run("-i", "web-01")).isEqualTo(ShushCommandRunner.EXIT_FAILURES);
        assertThat(err.toString()).contains("connection refused");
    }
}
