package com.vesselintel.photos.service;

import com.vesselintel.photos.model.DiscoveryResult;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls photo ids and the approximate photo count out of a gallery page.
 * Only relies on links of the form /photos/{digits} and on free-text count phrases,
 * not on the site's markup structure.
 */
@Component
@Slf4j
public class GalleryPageParser {

    private static final Pattern PHOTO_LINK = Pattern.compile("/photos/(\\d+)");
    private static final int MIN_PHOTO_ID_LENGTH = 4;

    // First match wins
    private static final List<Pattern> COUNT_PATTERNS = List.of(
            Pattern.compile("(\\d[\\d,]*)\\s+photos?\\s+found", Pattern.CASE_INSENSITIVE),
            Pattern.compile("found\\s+(\\d[\\d,]*)\\s+photos?", Pattern.CASE_INSENSITIVE)
    );

    public record GalleryPage(Set<String> photoIds, int totalReported) {}

    public GalleryPage parse(String html) {
        if (html == null || html.isBlank()) {
            return new GalleryPage(Set.of(), DiscoveryResult.UNKNOWN_TOTAL);
        }
        Document doc = Jsoup.parse(html);
        return new GalleryPage(extractPhotoIds(doc), extractTotal(html));
    }

    Set<String> extractPhotoIds(Document doc) {
        Set<String> ids = new LinkedHashSet<>();
        for (Element link : doc.select("a[href]")) {
            Matcher m = PHOTO_LINK.matcher(link.attr("href"));
            if (m.find() && m.group(1).length() >= MIN_PHOTO_ID_LENGTH) {
                ids.add(m.group(1));
            }
        }
        return ids;
    }

    int extractTotal(String html) {
        for (Pattern pattern : COUNT_PATTERNS) {
            Matcher m = pattern.matcher(html);
            if (m.find()) {
                String digits = m.group(1).replace(",", "");
                try {
                    return Integer.parseInt(digits);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unparseable photo count '{}'", m.group(1));
                }
            }
        }
        return DiscoveryResult.UNKNOWN_TOTAL;
    }
}
