package com.vesselintel.photos.config;

import com.vesselintel.photos.model.RunSummary;
import com.vesselintel.photos.service.PhotoScrapeService;
import com.vesselintel.photos.service.VesselIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final PhotoScrapeService scrapeService;
    private final VesselIndexService vesselIndex;

    // ── Scrape triggers ───────────────────────────────────────────────────────

    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (scrapeService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("status", "already-running"));
        }
        new Thread(() -> {
            try {
                scrapeService.runIfIdle();
            } catch (Exception e) {
                log.error("Manual scrape failed: {}", e.getMessage(), e);
            }
        }, "manual-scrape").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "vessel-photo-scraper");
        body.put("version", "1.0.0");
        body.put("running", scrapeService.isRunning());
        RunSummary last = scrapeService.lastSummary().orElse(null);
        body.put("lastRun", last);
        return ResponseEntity.ok(body);
    }

    // ── Vessel index ──────────────────────────────────────────────────────────

    @GetMapping("/index")
    public ResponseEntity<Map<String, Object>> index() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vessels", vesselIndex.confirmed().size());
        body.put("pending", vesselIndex.pending().size());
        body.put("lastUpdated", vesselIndex.lastUpdated().orElse(null));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildIndex() {
        if (scrapeService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("error", "scrape run in progress"));
        }
        try {
            Set<String> rebuilt = vesselIndex.rebuild();
            return ResponseEntity.ok(Map.of("status", "rebuilt", "vessels", rebuilt.size()));
        } catch (Exception e) {
            log.error("Index rebuild failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
