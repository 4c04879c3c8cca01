package com.vesselintel.photos.service;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.model.TrackingApiResponse;
import com.vesselintel.photos.model.VesselDetails;
import com.vesselintel.photos.model.VesselId;
import com.vesselintel.photos.model.VesselTarget;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Vessels currently within radius-km of the configured port, from the tracking API
 * (GET /vessel_inradius). Each call spends API credits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "photo-scraper.source", name = "mode", havingValue = "API")
public class TrackingApiVesselSource implements VesselSource {

    private static final Set<String> PLACEHOLDER_IDS = Set.of("null", "n/a", "none", "0");

    private final RestTemplate restTemplate;
    private final PhotoScraperProperties properties;

    @Override
    @Retry(name = "vesselApi", fallbackMethod = "noVessels")
    public List<VesselTarget> fetchVessels() {
        PhotoScraperProperties.Source.TrackingApi api = properties.getSource().getApi();
        String url = UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl() + "/vessel_inradius")
                .queryParam("api-key", api.getApiKey())
                .queryParam("lat", api.getLatitude())
                .queryParam("lon", api.getLongitude())
                .queryParam("radius", api.getRadiusKm())
                .toUriString();

        log.info("Fetching vessels within {} km of ({}, {})", api.getRadiusKm(), api.getLatitude(), api.getLongitude());
        TrackingApiResponse response = restTemplate.getForObject(url, TrackingApiResponse.class);

        if (response == null || response.getMeta() == null || !response.getMeta().isSuccess()) {
            log.warn("Tracking API request was not successful: {}",
                    response == null || response.getMeta() == null ? "no meta" : response.getMeta().getMessage());
            return List.of();
        }
        if (response.getData() == null || response.getData().getVessels() == null) {
            return List.of();
        }
        return toTargets(response.getData().getVessels());
    }

    /** Sorted by id, one entry per id, invalid and placeholder ids dropped. */
    List<VesselTarget> toTargets(List<TrackingApiResponse.Vessel> vessels) {
        Map<VesselId, VesselTarget> unique = new TreeMap<>();
        Instant extractedAt = Instant.now();
        int rejected = 0;

        for (TrackingApiResponse.Vessel v : vessels) {
            String imo = v.getImo() == null ? "" : v.getImo().trim();
            if (imo.isEmpty() || PLACEHOLDER_IDS.contains(imo.toLowerCase(Locale.ROOT)) || !VesselId.isValid(imo)) {
                rejected++;
                continue;
            }
            VesselId id = VesselId.of(imo);
            unique.putIfAbsent(id, new VesselTarget(id, VesselDetails.builder()
                    .name(v.getName() == null ? "Unknown" : v.getName())
                    .vesselType(v.getType() == null ? "Unknown" : v.getType())
                    .mmsi(v.getMmsi())
                    .latitude(v.getLat())
                    .longitude(v.getLon())
                    .speed(v.getSpeed())
                    .course(v.getCourse())
                    .destination(v.getDestination())
                    .positionTimestamp(v.getLastPositionTime())
                    .extractedAt(extractedAt)
                    .build()));
        }

        log.info("Tracking API: {} vessels, {} unique valid ids, {} without usable id",
                vessels.size(), unique.size(), rejected);
        return new ArrayList<>(unique.values());
    }

    @SuppressWarnings("unused")
    private List<VesselTarget> noVessels(Exception e) {
        log.warn("Tracking API unavailable after retries, no vessels this run: {}", e.getMessage());
        return List.of();
    }
}
