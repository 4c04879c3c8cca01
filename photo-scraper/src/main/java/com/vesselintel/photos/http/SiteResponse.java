package com.vesselintel.photos.http;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Fully buffered response from the photo site.
 */
public record SiteResponse(String url, int statusCode, String contentType, byte[] body) {

    public SiteResponse {
        contentType = contentType == null ? "" : contentType;
        body = body == null ? new byte[0] : body;
    }

    public boolean isOk() {
        return statusCode == 200;
    }

    public boolean isImage() {
        return contentType.toLowerCase(Locale.ROOT).contains("image");
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
