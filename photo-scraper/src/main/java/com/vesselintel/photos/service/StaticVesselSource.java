package com.vesselintel.photos.service;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.model.VesselDetails;
import com.vesselintel.photos.model.VesselId;
import com.vesselintel.photos.model.VesselTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vessels listed under photo-scraper.source.vessels. Useful for testing without
 * spending tracking-API credits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "photo-scraper.source", name = "mode", havingValue = "STATIC", matchIfMissing = true)
public class StaticVesselSource implements VesselSource {

    private final PhotoScraperProperties properties;

    @Override
    public List<VesselTarget> fetchVessels() {
        Map<VesselId, VesselTarget> vessels = new LinkedHashMap<>();
        for (PhotoScraperProperties.Source.StaticVessel entry : properties.getSource().getVessels()) {
            if (!VesselId.isValid(entry.getId())) {
                log.warn("Skipping configured vessel with invalid id: {}", entry.getId());
                continue;
            }
            VesselId id = VesselId.of(entry.getId());
            vessels.putIfAbsent(id, new VesselTarget(id, VesselDetails.builder()
                    .name(entry.getName() == null ? "Unknown" : entry.getName())
                    .vesselType(entry.getType() == null ? "Unknown" : entry.getType())
                    .extractedAt(Instant.now())
                    .build()));
        }
        log.info("Static source: {} vessels", vessels.size());
        return new ArrayList<>(vessels.values());
    }
}
