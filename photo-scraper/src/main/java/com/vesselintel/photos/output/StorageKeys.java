package com.vesselintel.photos.output;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.model.VesselId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Storage key layout. Keys depend only on vessel and photo id; a re-run
 * overwrites the same objects.
 *
 *   {photoPrefix}/IMO_{vesselId}/{photoId}.jpg
 *   {photoPrefix}/IMO_{vesselId}/{photoId}.json
 */
@Component
@RequiredArgsConstructor
public class StorageKeys {

    private final PhotoScraperProperties properties;

    public String photoRoot() {
        return trimSlashes(properties.getStorage().getPhotoPrefix()) + "/";
    }

    public String vesselFolder(VesselId vesselId) {
        return photoRoot() + "IMO_" + vesselId.value() + "/";
    }

    public String photoKey(VesselId vesselId, String photoId) {
        return vesselFolder(vesselId) + photoId + ".jpg";
    }

    public String metadataKey(VesselId vesselId, String photoId) {
        return vesselFolder(vesselId) + photoId + ".json";
    }

    public String indexKey() {
        return trimSlashes(properties.getStorage().getIndexKey());
    }

    public String reportKey(String day, String runId, String extension) {
        return trimSlashes(properties.getStorage().getReportPrefix()) + "/" + day + "/run_" + runId + "." + extension;
    }

    private static String trimSlashes(String value) {
        return value.replaceAll("^/+|/+$", "");
    }
}
