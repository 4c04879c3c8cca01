package com.vesselintel.photos.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for the tracking API's vessels-in-radius response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackingApiResponse {

    private Meta meta;
    private Payload data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private boolean success;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private List<Vessel> vessels = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Vessel {
        private String imo;
        private String name;
        private String type;
        private String mmsi;
        private Double lat;
        private Double lon;
        private Double speed;
        private Double course;
        private String destination;

        @JsonProperty("last_position_time")
        private String lastPositionTime;
    }
}
