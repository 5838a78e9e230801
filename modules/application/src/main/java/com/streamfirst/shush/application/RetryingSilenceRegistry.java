package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * Decorates a registry so that transient unavailability is retried. Conflicts,
 * authorization and not-found failures pass straight through.
 */
@RequiredArgsConstructor
public class RetryingSilenceRegistry implements SilenceRegistryPort {

  private final SilenceRegistryPort delegate;
  private final Retrier retrier;

  public RetryingSilenceRegistry(SilenceRegistryPort delegate, RetryPolicy policy) {
    this(delegate, new Retrier(policy));
  }

  @Override
  public Set<SilenceRecord> list(SilenceFilter filter) {
    return retrier.call("list silences", () -> delegate.list(filter));
  }

  @Override
  public void create(SilenceRecord record, boolean replaceExisting) {
    retrier.run("silence " + record.getTarget(), () -> delegate.create(record, replaceExisting));
  }

  @Override
  public void delete(Target target) {
    retrier.run("clear " + target, () -> delegate.delete(target));
  }
}
