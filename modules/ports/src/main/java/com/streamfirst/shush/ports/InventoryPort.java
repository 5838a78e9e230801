package com.streamfirst.shush.ports;

import com.streamfirst.shush.domain.InventorySnapshot;

/**
 * Port for the read-only inventory of clients and checks known to the monitoring system.
 */
public interface InventoryPort {

    /**
     * Takes a snapshot of the current inventory.
     *
     * @return known clients and check names
     * @throws RegistryUnavailableException if the inventory cannot be read
     */
    InventorySnapshot snapshot();
}
