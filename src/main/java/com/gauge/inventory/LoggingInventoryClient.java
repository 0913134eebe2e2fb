package com.gauge.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default inventory collaborator used when no inventory service is wired in.
 * Keeps the last known location per item in memory and logs every movement.
 */
@Component
@Slf4j
public class LoggingInventoryClient implements InventoryClient {

    private final Map<String, String> locations = new ConcurrentHashMap<>();

    @Override
    public void relocate(String itemRef, String newLocation, String actorRef, String note) {
        if (itemRef == null || newLocation == null) {
            throw new IllegalArgumentException("itemRef and newLocation are required");
        }
        String previous = locations.put(itemRef, newLocation);
        log.info("Inventory movement: item={} from={} to={} by={} note={}",
                 itemRef, previous, newLocation, actorRef, note);
    }

    @Override
    public Optional<String> currentLocation(String itemRef) {
        return itemRef == null ? Optional.empty() : Optional.ofNullable(locations.get(itemRef));
    }
}
