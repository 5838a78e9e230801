package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.InventorySnapshot;
import com.streamfirst.shush.ports.InventoryPort;
import lombok.RequiredArgsConstructor;

/** Retries inventory snapshots the same way {@link RetryingSilenceRegistry} retries writes. */
@RequiredArgsConstructor
public class RetryingInventory implements InventoryPort {

  private final InventoryPort delegate;
  private final Retrier retrier;

  @Override
  public InventorySnapshot snapshot() {
    return retrier.call("inventory snapshot", delegate::snapshot);
  }
}
