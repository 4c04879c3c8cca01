package com.vesselintel.photos.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Metadata document stored next to every photo.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PhotoMetadata {

    @JsonProperty("vessel_id")
    private String vesselId;

    @JsonProperty("photo_id")
    private String photoId;

    /** The candidate URL that actually served the image */
    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("page_url")
    private String pageUrl;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("scraped_at")
    private String scrapedAt;

    private VesselDetails vessel;
}
