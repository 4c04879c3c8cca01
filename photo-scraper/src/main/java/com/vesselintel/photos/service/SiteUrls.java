package com.vesselintel.photos.service;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.model.VesselId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * URL layout of the photo site.
 */
@Component
@RequiredArgsConstructor
public class SiteUrls {

    private final PhotoScraperProperties properties;

    public String galleryPage(VesselId vesselId, String sortBy, int page) {
        return UriComponentsBuilder
                .fromHttpUrl(baseUrl() + "/photos/gallery")
                .queryParam("shipName", "")
                .queryParam("shipNameSearchMode", "exact")
                .queryParam("imo", vesselId.value())
                .queryParam("viewType", "normal")
                .queryParam("sortBy", sortBy)
                .queryParam("page", page)
                .toUriString();
    }

    public String photoPage(String photoId) {
        return baseUrl() + "/photos/" + photoId;
    }

    /**
     * Candidate image URLs, most likely first. The primary path nests the photo under
     * its last three digits in reverse order: 1234567 -> /photos/big/7/6/5/1234567.jpg
     */
    public List<String> imageCandidates(String photoId) {
        List<String> urls = new ArrayList<>(3);
        if (photoId.length() >= 3) {
            String lastThree = photoId.substring(photoId.length() - 3);
            String path = lastThree.charAt(2) + "/" + lastThree.charAt(1) + "/" + lastThree.charAt(0);
            urls.add(baseUrl() + "/photos/big/" + path + "/" + photoId + ".jpg");
        }
        urls.add(baseUrl() + "/photos/big/" + photoId + ".jpg");
        urls.add(baseUrl() + "/photos/large/" + photoId + ".jpg");
        return urls;
    }

    private String baseUrl() {
        String base = properties.getSite().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
