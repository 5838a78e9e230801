package com.streamfirst.shush.boot;

import com.streamfirst.shush.application.ExecutionReport;
import com.streamfirst.shush.application.OperationPlan;
import com.streamfirst.shush.application.PlannedOperation;
import com.streamfirst.shush.application.TargetOutcome;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Renders plans, execution reports and silence listings for the terminal.
 */
public class ReportPrinter {

    private final Clock clock;

    public ReportPrinter(Clock clock) {
        this.clock = clock;
    }

    public void printPlan(OperationPlan plan, PrintWriter out) {
        if (plan.isEmpty()) {
            out.println("Nothing to do: no targets resolved");
            return;
        }
        for (PlannedOperation op : plan.operations()) {
            out.println(switch (op.getAction()) {
                case CREATE -> "Would " + (op.isReplaceExisting() ? "replace the silence on " : "silence ")
                        + op.getTarget() + describeExpiry(op.getRecord().orElseThrow());
                case DELETE -> "Would clear the silence on " + op.getTarget();
                case SKIP -> "Would skip " + op.getTarget() + ": " + op.getSkipReason().orElse("skipped");
            });
        }
        out.flush();
    }

    public void printReport(ExecutionReport report, PrintWriter out) {
        for (TargetOutcome outcome : report.getOutcomes()) {
            String line = String.format("%-9s %s", outcome.getStatus(), outcome.getTarget());
            if (outcome.isFailed()) {
                line += " [" + outcome.getFailureKind().map(Enum::name).orElse("UNEXPECTED") + "]";
            }
            out.println(line + ": " + outcome.getDetail());
        }
        out.printf("%d succeeded, %d skipped, %d failed%n", report.succeeded(), report.skipped(), report.failed());
        out.flush();
    }

    public void printSilences(List<SilenceRecord> records, PrintWriter out) {
        if (records.isEmpty()) {
            out.println("No silences found");
        }
        for (SilenceRecord record : records) {
            Target target = record.getTarget();
            out.println("subscription:\t\t" + target.subject().subscription().orElse("all"));
            out.println("Check:\t\t\t" + target.checkName().orElse("all"));
            out.println("Expiration:\t\t" + record.getExpiresAt()
                    .map(at -> String.valueOf(Math.max(0, Duration.between(clock.instant(), at).toSeconds())))
                    .orElse("never"));
            out.println("Expire on resolve:\t" + record.isExpireOnResolve());
            out.println("User:\t\t\t" + record.getCreator());
            record.getReason().ifPresent(reason -> out.println("Reason:\t\t\t" + reason));
            out.println();
        }
        out.flush();
    }

    private static String describeExpiry(SilenceRecord record) {
        String expiry = record.ttl().map(ttl -> " for " + ttl.toSeconds() + " seconds").orElse(" indefinitely");
        return record.isExpireOnResolve() ? expiry + " or until it resolves" : expiry;
    }
}
