package com.vesselintel.photos.http;

import java.io.IOException;

/**
 * Establishes a fresh session, including any warm-up requests needed to obtain
 * valid cookies. Called once per pool slot and again after every challenge failure.
 */
public interface BrowserSessionFactory {

    BrowserSession create() throws IOException, InterruptedException;
}
