package com.vesselintel.photos.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Display-only snapshot of a vessel as reported by the tracking source.
 * Attached to logs and photo metadata; never used as a key.
 */
@Value
@Builder
public class VesselDetails {

    String name;
    String vesselType;
    String mmsi;

    // ── Position ────────────────────────────────────────────────────────────
    Double latitude;
    Double longitude;
    Double speed;
    Double course;
    String destination;

    /** Position timestamp as reported by the source, kept verbatim */
    String positionTimestamp;

    Instant extractedAt;

    public static VesselDetails unknown() {
        return VesselDetails.builder().name("Unknown").vesselType("Unknown").build();
    }
}
