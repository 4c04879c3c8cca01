package com.vesselintel.photos.support;

import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.StorageException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private final AtomicInteger puts = new AtomicInteger();
    private volatile boolean failWrites;
    private volatile boolean unreachable;

    @Override
    public void put(String key, byte[] content, String contentType) {
        if (failWrites || unreachable) {
            throw new StorageException("simulated write failure for " + key);
        }
        puts.incrementAndGet();
        objects.put(key, content.clone());
        contentTypes.put(key, contentType);
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (unreachable) {
            throw new StorageException("simulated outage");
        }
        return Optional.ofNullable(objects.get(key)).map(byte[]::clone);
    }

    @Override
    public List<String> list(String prefix) {
        if (unreachable) {
            throw new StorageException("simulated outage");
        }
        return objects.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public void verifyAccess() {
        if (unreachable) {
            throw new StorageException("simulated outage");
        }
    }

    @Override
    public String describe() {
        return "memory://test";
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void unreachable(boolean down) {
        this.unreachable = down;
    }

    public Map<String, byte[]> objects() {
        return objects;
    }

    public String contentType(String key) {
        return contentTypes.get(key);
    }

    public int putCount() {
        return puts.get();
    }
}
