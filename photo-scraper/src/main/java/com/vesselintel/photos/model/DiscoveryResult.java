package com.vesselintel.photos.model;

import java.util.Set;

/**
 * Photo ids discovered for one vessel.
 *
 * totalReported: -1 unknown, 0 confirmed empty, positive values are the site's own
 * count and only a hint; the site under-reports pagination so items may hold fewer.
 */
public record DiscoveryResult(Set<String> items, int totalReported) {

    public static final int UNKNOWN_TOTAL = -1;

    public DiscoveryResult {
        items = Set.copyOf(items);
    }

    public static DiscoveryResult empty() {
        return new DiscoveryResult(Set.of(), 0);
    }

    public static DiscoveryResult unavailable() {
        return new DiscoveryResult(Set.of(), UNKNOWN_TOTAL);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
