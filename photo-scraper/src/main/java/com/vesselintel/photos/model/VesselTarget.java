package com.vesselintel.photos.model;

/**
 * A vessel scheduled for scraping together with its display details.
 */
public record VesselTarget(VesselId id, VesselDetails details) {

    public VesselTarget {
        if (details == null) {
            details = VesselDetails.unknown();
        }
    }

    public static VesselTarget of(String id, String name) {
        return new VesselTarget(VesselId.of(id), VesselDetails.builder().name(name).build());
    }

    public String displayName() {
        String name = details.getName();
        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
