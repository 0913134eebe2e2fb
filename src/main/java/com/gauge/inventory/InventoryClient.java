package com.gauge.inventory;

import java.util.Optional;

/**
 * Physical location bookkeeping owned by the inventory subsystem.
 *
 * The lifecycle engine treats every call as best effort: a failure is logged and
 * never aborts the surrounding lifecycle transaction.
 */
public interface InventoryClient {

    /**
     * Record that an item now lives at newLocation.
     *
     * @param itemRef    external id or serial number of the gauge
     * @param newLocation storage location code
     * @param actorRef   who moved it
     * @param note       free text shown in the movement log
     */
    void relocate(String itemRef, String newLocation, String actorRef, String note);

    Optional<String> currentLocation(String itemRef);
}
