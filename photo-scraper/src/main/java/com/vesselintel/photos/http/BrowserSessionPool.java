package com.vesselintel.photos.http;

import com.vesselintel.photos.config.PhotoScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed number of independently established sessions, handed out round-robin.
 *
 * Slots are filled lazily and replaced wholesale after a challenge failure: the new
 * session is built under that slot's lock and swapped in only if the slot still holds
 * the session that failed. Other slots keep serving traffic meanwhile.
 */
@Component
@Slf4j
public class BrowserSessionPool {

    private final BrowserSessionFactory factory;
    private final AtomicReferenceArray<BrowserSession> sessions;
    private final Object[] slotLocks;
    private final AtomicInteger cursor = new AtomicInteger();

    public BrowserSessionPool(BrowserSessionFactory factory, PhotoScraperProperties properties) {
        int size = Math.max(1, properties.getConcurrency().getSessionPoolSize());
        this.factory = factory;
        this.sessions = new AtomicReferenceArray<>(size);
        this.slotLocks = new Object[size];
        for (int i = 0; i < size; i++) {
            slotLocks[i] = new Object();
        }
    }

    public record Lease(int slot, BrowserSession session) {}

    /** Next session in round-robin order, establishing it first if the slot is empty. */
    public Lease acquire() throws IOException, InterruptedException {
        int slot = Math.floorMod(cursor.getAndIncrement(), sessions.length());
        BrowserSession session = sessions.get(slot);
        if (session != null) {
            return new Lease(slot, session);
        }
        synchronized (slotLocks[slot]) {
            session = sessions.get(slot);
            if (session == null) {
                session = factory.create();
                sessions.set(slot, session);
                log.info("Session slot {} established", slot);
            }
            return new Lease(slot, session);
        }
    }

    /**
     * Replaces the session a failed lease used. If another thread already replaced it,
     * the newer session is kept and returned. On failure the slot is left empty so the
     * next acquire tries again.
     */
    public BrowserSession recreate(Lease failed) throws IOException, InterruptedException {
        synchronized (slotLocks[failed.slot()]) {
            BrowserSession current = sessions.get(failed.slot());
            if (current != null && current != failed.session()) {
                return current;
            }
            sessions.set(failed.slot(), null);
            BrowserSession fresh = factory.create();
            sessions.set(failed.slot(), fresh);
            log.info("Session slot {} re-established after challenge", failed.slot());
            return fresh;
        }
    }

    public int size() {
        return sessions.length();
    }

    /** Drops every session; the next acquire on each slot re-establishes it. */
    public void reset() {
        for (int i = 0; i < sessions.length(); i++) {
            synchronized (slotLocks[i]) {
                sessions.set(i, null);
            }
        }
    }
}
