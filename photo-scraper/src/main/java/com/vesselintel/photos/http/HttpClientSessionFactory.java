package com.vesselintel.photos.http;

import com.vesselintel.photos.config.PhotoScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds browser-like sessions on java.net.http: a dedicated cookie jar, browser
 * headers, and a warm-up of the landing page plus one gallery probe.
 *
 * A 403 on the probe means the challenge cookies were not issued; the session is
 * discarded and rebuilt once with a clean cookie jar before giving up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HttpClientSessionFactory implements BrowserSessionFactory {

    private final PhotoScraperProperties properties;

    @Override
    public BrowserSession create() throws IOException, InterruptedException {
        PhotoScraperProperties.Site site = properties.getSite();
        log.info("Establishing browser session against {}", site.getBaseUrl());

        HttpClientSession session = newSession(site);
        session.get(site.getBaseUrl());

        String probeUrl = site.getBaseUrl() + "/photos/gallery?imo=" + site.getWarmUpVesselId();
        SiteResponse probe = session.get(probeUrl);

        if (probe.statusCode() == 403) {
            log.warn("Gallery probe returned 403 - rebuilding session with a clean cookie jar");
            session = newSession(site);
            session.get(site.getBaseUrl());
            probe = session.get(probeUrl);
        }

        if (probe.statusCode() == 403) {
            throw new IOException("Challenge not passed: gallery probe still returns 403");
        }

        log.info("Browser session ready (probe status: {})", probe.statusCode());
        return session;
    }

    private HttpClientSession newSession(PhotoScraperProperties.Site site) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(site.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .build();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", site.getUserAgent());
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Referer", site.getBaseUrl() + "/");

        return new HttpClientSession(client, headers, site.getReadTimeout());
    }

    static final class HttpClientSession implements BrowserSession {

        private final HttpClient client;
        private final Map<String, String> headers;
        private final Duration readTimeout;

        HttpClientSession(HttpClient client, Map<String, String> headers, Duration readTimeout) {
            this.client = client;
            this.headers = Map.copyOf(headers);
            this.readTimeout = readTimeout;
        }

        @Override
        public SiteResponse get(String url) throws IOException, InterruptedException {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(readTimeout)
                    .GET();
            headers.forEach(request::header);

            HttpResponse<byte[]> response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
            String contentType = response.headers().firstValue("Content-Type").orElse("");
            return new SiteResponse(url, response.statusCode(), contentType, response.body());
        }
    }
}
