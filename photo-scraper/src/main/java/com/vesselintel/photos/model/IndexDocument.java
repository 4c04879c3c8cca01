package com.vesselintel.photos.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of the scraped-vessel index: {"lastUpdated": "...", "ids": [...]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexDocument {

    private String lastUpdated;
    private List<String> ids = new ArrayList<>();
}
