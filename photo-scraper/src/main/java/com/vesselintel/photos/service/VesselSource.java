package com.vesselintel.photos.service;

import com.vesselintel.photos.model.VesselTarget;

import java.util.List;

/**
 * Supplies the vessels to scrape: valid ids only, no duplicates, stable order.
 */
public interface VesselSource {

    List<VesselTarget> fetchVessels();
}
