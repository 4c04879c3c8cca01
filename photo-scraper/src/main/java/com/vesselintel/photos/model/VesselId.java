package com.vesselintel.photos.model;

import java.util.regex.Pattern;

/**
 * Canonical 7-digit vessel identifier (IMO number).
 * Every key in storage, the index and the run report is derived from this value.
 */
public record VesselId(String value) implements Comparable<VesselId> {

    public static final Pattern PATTERN = Pattern.compile("^\\d{7}$");

    public VesselId {
        if (value == null || !PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Vessel id must be exactly 7 digits: " + value);
        }
    }

    /** Trims the raw value before validating it. */
    public static VesselId of(String raw) {
        return new VesselId(raw == null ? null : raw.trim());
    }

    public static boolean isValid(String raw) {
        return raw != null && PATTERN.matcher(raw.trim()).matches();
    }

    @Override
    public int compareTo(VesselId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
