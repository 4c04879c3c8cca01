package com.vesselintel.photos.http;

import java.io.IOException;

/**
 * One browser-like client that has passed the site's anti-automation challenge.
 * Cookies and headers obtained during warm-up are reused for every request,
 * page fetches and image downloads alike.
 */
public interface BrowserSession {

    SiteResponse get(String url) throws IOException, InterruptedException;
}
