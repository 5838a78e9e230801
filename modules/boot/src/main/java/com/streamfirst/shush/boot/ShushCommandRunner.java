package com.streamfirst.shush.boot;

import com.streamfirst.shush.application.CancellationSignal;
import com.streamfirst.shush.application.ExecutionReport;
import com.streamfirst.shush.application.OperationPlan;
import com.streamfirst.shush.application.SelectorSet;
import com.streamfirst.shush.application.SilenceRequest;
import com.streamfirst.shush.application.SilenceService;
import com.streamfirst.shush.domain.ResolutionException;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.ValidationException;
import com.streamfirst.shush.ports.RegistryException;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one parsed command against the silence service and maps the outcome to an
 * exit code: 2 for unusable input or configuration, 1 when any target failed or the
 * registry could not be read, 0 otherwise.
 */
@Slf4j
public class ShushCommandRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_USAGE = 2;

    private final SilenceService service;
    private final ShushProperties properties;
    private final Clock clock;
    private final ReportPrinter printer;

    public ShushCommandRunner(SilenceService service, ShushProperties properties, Clock clock, ReportPrinter printer) {
        this.service = service;
        this.properties = properties;
        this.clock = clock;
        this.printer = printer;
    }

    public int run(ShushCommand command, PrintWriter out, PrintWriter err) {
        CancellationSignal signal = CancellationSignal.withDeadline(properties.getExecution().getDeadline(), clock);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> awaitAfterCancel(signal, finished), "shush-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return dispatch(command, signal, out);
        } catch (ValidationException | ResolutionException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RegistryException e) {
            log.debug("Registry call failed", e);
            err.println("error: " + e.getMessage() + " (" + e.kind() + ")");
            return EXIT_FAILURES;
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURES;
        } finally {
            err.flush();
            finished.countDown();
            removeHook(hook);
        }
    }

    private int dispatch(ShushCommand command, CancellationSignal signal, PrintWriter out) {
        return switch (command.action()) {
            case LIST -> list(command, out);
            case SILENCE -> silence(command, signal, out);
            case CLEAR -> clear(command, signal, out);
        };
    }

    private int list(ShushCommand command, PrintWriter out) {
        List<SilenceRecord> records = command.listsByFilter()
                ? service.list(command.filter())
                : service.list(command.selectors(), command.resolutionOptions());
        printer.printSilences(records, out);
        return EXIT_OK;
    }

    private int silence(ShushCommand command, CancellationSignal signal, PrintWriter out) {
        SelectorSet selectors = command.selectors();
        SilenceRequest request = command.request(properties.getCreator()).validate();
        if (command.isDryRun()) {
            OperationPlan plan = service.planSilence(selectors, command.resolutionOptions(), request);
            printer.printPlan(plan, out);
            return EXIT_OK;
        }
        out.println("Silences will " + request.getExpiration());
        return report(service.silence(selectors, command.resolutionOptions(), request, signal), out);
    }

    private int clear(ShushCommand command, CancellationSignal signal, PrintWriter out) {
        SelectorSet selectors = command.selectors();
        if (command.isDryRun()) {
            printer.printPlan(service.planClear(selectors, command.resolutionOptions()), out);
            return EXIT_OK;
        }
        return report(service.clear(selectors, command.resolutionOptions(), signal), out);
    }

    private int report(ExecutionReport report, PrintWriter out) {
        printer.printReport(report, out);
        return report.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    }

    private static void awaitAfterCancel(CancellationSignal signal, CountDownLatch finished) {
        signal.cancel();
        try {
            if (!finished.await(10, TimeUnit.SECONDS)) {
                log.warn("In-flight operations did not finish before shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down, leaving the shutdown hook in place");
        }
    }
}
