package com.vesselintel.photos.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vesselintel.photos.model.IndexDocument;
import com.vesselintel.photos.model.VesselId;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.StorageException;
import com.vesselintel.photos.output.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persisted set of vessels whose photos are already archived, so a run can skip them
 * without listing the whole photo tree.
 *
 * Two-state write-behind cache: {@code confirmed} mirrors what was last read from or
 * written to storage; {@code pending} collects vessels completed during the current run.
 * {@link #flush()} re-reads the stored document, unions it with both sets and writes
 * the result, so entries are only ever added. Concurrent runs flushing at the same
 * time are not serialised: the last merge wins, and an id written by the other run
 * between our read and our write can be lost until the next flush or rebuild.
 */
@Service
@Slf4j
public class VesselIndexService {

    /** Folder names accepted as vessel folders: IMO_1234567, IMO-1234567 or 1234567. */
    private static final Pattern VESSEL_FOLDER = Pattern.compile("^(?:IMO[_\\-\\s]*)?(\\d{7})$", Pattern.CASE_INSENSITIVE);

    private final ObjectStore objectStore;
    private final StorageKeys keys;
    private final ObjectMapper objectMapper;

    private volatile Set<String> confirmed = Set.of();
    private volatile String lastUpdated;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public VesselIndexService(ObjectStore objectStore, StorageKeys keys, ObjectMapper objectMapper) {
        this.objectStore = objectStore;
        this.keys = keys;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the stored index. A missing or unparseable document yields an empty index
     * with a warning; an unreachable backend propagates as {@link StorageException}.
     */
    public synchronized Set<String> load() {
        IndexDocument document = readPersisted().orElse(null);
        confirmed = document == null ? Set.of() : validIds(document.getIds());
        lastUpdated = document == null ? null : document.getLastUpdated();
        log.info("Loaded vessel index: {} vessels (last updated {})", confirmed.size(),
                lastUpdated == null ? "never" : lastUpdated);
        return confirmed;
    }

    public boolean contains(VesselId vesselId) {
        return confirmed.contains(vesselId.value());
    }

    /** Records a completed vessel in memory; nothing is written until {@link #flush()}. */
    public void markPending(VesselId vesselId) {
        pending.add(vesselId.value());
    }

    public Set<String> pending() {
        return Collections.unmodifiableSet(pending);
    }

    public Set<String> confirmed() {
        return confirmed;
    }

    public Optional<String> lastUpdated() {
        return Optional.ofNullable(lastUpdated);
    }

    /**
     * Merges pending ids into the stored index. Never removes an entry.
     *
     * @return the index as written
     */
    public synchronized Set<String> flush() {
        if (pending.isEmpty()) {
            log.debug("Vessel index flush: nothing pending");
            return confirmed;
        }
        Set<String> flushing = new HashSet<>(pending);

        Set<String> merged = new TreeSet<>(confirmed);
        readPersisted().ifPresent(latest -> merged.addAll(validIds(latest.getIds())));
        merged.addAll(flushing);

        write(merged);
        pending.removeAll(flushing);
        log.info("Vessel index updated: {} new, {} total", flushing.size(), merged.size());
        return confirmed;
    }

    /**
     * Discards the stored index and derives it again from the vessel folders present
     * under the photo prefix. The only operation that may shrink the index.
     */
    public synchronized Set<String> rebuild() {
        log.info("Rebuilding vessel index from {} under {}", objectStore.describe(), keys.photoRoot());
        Set<String> found = new TreeSet<>();
        for (String key : objectStore.list(keys.photoRoot())) {
            String[] parts = key.split("/");
            // last segment is the object name, not a folder
            for (int i = 0; i < parts.length - 1; i++) {
                Matcher m = VESSEL_FOLDER.matcher(parts[i]);
                if (m.matches()) {
                    found.add(m.group(1));
                }
            }
        }
        write(found);
        log.info("Vessel index rebuilt: {} vessels", found.size());
        return confirmed;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<IndexDocument> readPersisted() {
        Optional<byte[]> raw = objectStore.get(keys.indexKey());
        if (raw.isEmpty()) {
            log.debug("No vessel index at {}", keys.indexKey());
            return Optional.empty();
        }
        try {
            IndexDocument document = objectMapper.readValue(raw.get(), IndexDocument.class);
            if (document == null || document.getIds() == null) {
                log.warn("Vessel index at {} has no ids - treating as empty", keys.indexKey());
                return Optional.empty();
            }
            return Optional.of(document);
        } catch (IOException e) {
            log.warn("Vessel index at {} is corrupt - treating as empty: {}", keys.indexKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Set<String> ids) {
        String now = Instant.now().toString();
        IndexDocument document = new IndexDocument(now, new ArrayList<>(new TreeSet<>(ids)));
        try {
            objectStore.put(keys.indexKey(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document),
                    "application/json");
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialise vessel index", e);
        }
        confirmed = Set.copyOf(ids);
        lastUpdated = now;
    }

    private Set<String> validIds(List<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        Set<String> valid = new HashSet<>();
        for (String id : ids) {
            if (VesselId.isValid(id)) {
                valid.add(id.trim());
            } else {
                log.warn("Ignoring malformed vessel id in index: {}", id);
            }
        }
        return Set.copyOf(valid);
    }
}
