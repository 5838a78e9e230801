package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.FailureKind;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.ports.RegistryException;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies an {@link OperationPlan} to a registry. Writes are dispatched independently
 * on a bounded pool, so one target failing never prevents the others from being
 * attempted. A fresh pool is created per plan and always shut down before returning.
 */
@Slf4j
public class PlanExecutor {

  public static final int DEFAULT_MAX_CONCURRENCY = 4;

  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  private final int maxConcurrency;

  public PlanExecutor() {
    this(DEFAULT_MAX_CONCURRENCY);
  }

  public PlanExecutor(int maxConcurrency) {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be at least 1");
    }
    this.maxConcurrency = maxConcurrency;
  }

  /**
   * Executes every operation of the plan and reports one outcome per target.
   *
   * @param plan the plan to apply
   * @param registry the registry to write to
   * @param signal checked before each operation starts; once tripped the remaining
   *     operations are reported as cancelled failures
   * @return per-target outcomes, sorted by target
   */
  public ExecutionReport execute(
      OperationPlan plan, SilenceRegistryPort registry, CancellationSignal signal) {
    List<TargetOutcome> outcomes = new ArrayList<>();
    List<PlannedOperation> writes = new ArrayList<>();

    for (PlannedOperation op : plan.operations()) {
      if (op.isWrite()) {
        writes.add(op);
      } else {
        outcomes.add(TargetOutcome.skipped(op.getTarget(), op.getSkipReason().orElse("skipped")));
      }
    }

    if (writes.isEmpty()) {
      return new ExecutionReport(plan.action(), outcomes);
    }

    log.debug("Dispatching {} registry writes with concurrency {}", writes.size(), maxConcurrency);
    ExecutorService pool = newPool(Math.min(maxConcurrency, writes.size()));
    try {
      List<CompletableFuture<TargetOutcome>> pending = new ArrayList<>();
      for (PlannedOperation op : writes) {
        if (signal.isCancelled()) {
          outcomes.add(TargetOutcome.cancelled(op.getTarget()));
          continue;
        }
        pending.add(CompletableFuture.supplyAsync(() -> apply(op, registry, signal), pool));
      }
      pending.forEach(future -> outcomes.add(future.join()));
    } finally {
      shutdown(pool);
    }

    ExecutionReport report = new ExecutionReport(plan.action(), outcomes);
    if (report.wasCancelled()) {
      log.warn("Execution was cancelled before all operations were attempted");
    }
    return report;
  }

  private TargetOutcome apply(
      PlannedOperation op, SilenceRegistryPort registry, CancellationSignal signal) {
    if (signal.isCancelled()) {
      return TargetOutcome.cancelled(op.getTarget());
    }
    try {
      return switch (op.getAction()) {
        case CREATE -> {
          SilenceRecord record = op.getRecord().orElseThrow();
          registry.create(record, op.isReplaceExisting());
          yield TargetOutcome.succeeded(
              op.getTarget(), op.isReplaceExisting() ? "silence replaced" : "silenced");
        }
        case DELETE -> {
          registry.delete(op.getTarget());
          yield TargetOutcome.succeeded(op.getTarget(), "silence cleared");
        }
        case SKIP -> TargetOutcome.skipped(op.getTarget(), op.getSkipReason().orElse("skipped"));
      };
    } catch (RegistryException e) {
      log.warn("{} failed for {}: {}", op.getAction(), op.getTarget(), e.getMessage());
      return TargetOutcome.failed(op.getTarget(), e.kind(), e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected failure applying {} to {}", op.getAction(), op.getTarget(), e);
      return TargetOutcome.failed(op.getTarget(), FailureKind.UNEXPECTED, String.valueOf(e));
    }
  }

  private static ExecutorService newPool(int threads) {
    int poolId = POOL_SEQUENCE.incrementAndGet();
    AtomicInteger threadSequence = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread =
              new Thread(runnable, "shush-exec-" + poolId + "-" + threadSequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }

  private static void shutdown(ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate in time, forcing shutdown");
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
