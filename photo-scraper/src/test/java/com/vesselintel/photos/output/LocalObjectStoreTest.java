package com.vesselintel.photos.output;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalObjectStoreTest {

    @TempDir
    Path root;

    private LocalObjectStore store;

    @BeforeEach
    void setUp() {
        store = new LocalObjectStore(root);
    }

    @Test
    @DisplayName("Put creates parent folders and get reads the bytes back")
    void putThenGet() {
        store.put("vessel-photos/IMO_1234567/1.json", "{}".getBytes(StandardCharsets.UTF_8), "application/json");

        assertThat(Files.isRegularFile(root.resolve("vessel-photos/IMO_1234567/1.json"))).isTrue();
        assertThat(store.get("vessel-photos/IMO_1234567/1.json")).hasValueSatisfying(
                bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{}"));
    }

    @Test
    @DisplayName("Put replaces an existing object")
    void put_overwrites() {
        store.put("a/b.txt", new byte[]{1}, "text/plain");
        store.put("a/b.txt", new byte[]{2, 3}, "text/plain");

        assertThat(store.get("a/b.txt")).hasValueSatisfying(bytes -> assertThat(bytes).containsExactly(2, 3));
    }

    @Test
    @DisplayName("Missing keys read as empty")
    void get_missing() {
        assertThat(store.get("nothing/here.json")).isEmpty();
    }

    @Test
    @DisplayName("List returns keys under the prefix with forward slashes")
    void list_prefix() {
        store.put("vessel-photos/IMO_1234567/1.jpg", new byte[]{1}, "image/jpeg");
        store.put("vessel-photos/IMO_7654321/2.jpg", new byte[]{1}, "image/jpeg");
        store.put("reports/2026-01-01/run_a.json", new byte[]{1}, "application/json");

        assertThat(store.list("vessel-photos/")).containsExactlyInAnyOrder(
                "vessel-photos/IMO_1234567/1.jpg",
                "vessel-photos/IMO_7654321/2.jpg");
    }

    @Test
    @DisplayName("Keys may not escape the root directory")
    void put_rejectsTraversal() {
        assertThatThrownBy(() -> store.put("../outside.txt", new byte[]{1}, "text/plain"))
                .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Verify access creates the root when absent")
    void verifyAccess_createsRoot() {
        LocalObjectStore nested = new LocalObjectStore(root.resolve("gallery"));

        nested.verifyAccess();

        assertThat(Files.isDirectory(root.resolve("gallery"))).isTrue();
        assertThat(nested.describe()).startsWith("file://");
    }
}
