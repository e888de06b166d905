package org.urbanscope.datapipeline.resources.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FileSystemCacheStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemCacheStore cache;

    @BeforeEach
    void setUp() throws IOException {
        cache = newStore();
        cache.load();
    }

    private FileSystemCacheStore newStore() {
        return new FileSystemCacheStore("test-cache", ConfigFactory.parseMap(Map.of("directory", tempDir.toString())));
    }

    private static ObjectNode blob(String title) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("title", title);
        return node;
    }

    @Test
    void neverLookedUp_isDistinctFromTombstone() {
        cache.putTombstone("bioproject", "PRJNA1");

        assertThat(cache.get("bioproject", "PRJNA2")).isEmpty();
        Optional<ICacheStore.CacheEntry> tombstone = cache.get("bioproject", "PRJNA1");
        assertThat(tombstone).isPresent();
        assertThat(tombstone.get().isTombstone()).isTrue();
        assertThat(tombstone.get().blob()).isEmpty();
    }

    @Test
    void tombstoneWithErrorCode_isStillATombstone() {
        cache.putTombstone("biosample", "bogus", "invalid_accession");

        ICacheStore.CacheEntry entry = cache.get("biosample", "bogus").orElseThrow();
        assertThat(entry.isTombstone()).isTrue();
        assertThat(entry.value().path("error").asText()).isEqualTo("invalid_accession");
    }

    @Test
    void flushAndReload_restoresEntriesPerNamespace() throws IOException {
        cache.put("bioproject", "PRJNA1", blob("Subway microbiome"));
        cache.putTombstone("bioproject", "PRJNA2");
        cache.put("bioproject_uid", "12345", blob("x"));
        cache.flush();

        assertThat(tempDir.resolve("bioproject.json")).exists();
        assertThat(tempDir.resolve("bioproject_uid.json")).exists();

        FileSystemCacheStore reloaded = newStore();
        reloaded.load();
        assertThat(reloaded.get("bioproject", "PRJNA1").flatMap(ICacheStore.CacheEntry::blob))
            .map(node -> node.path("title").asText())
            .contains("Subway microbiome");
        assertThat(reloaded.get("bioproject", "PRJNA2").orElseThrow().isTombstone()).isTrue();
        assertThat(reloaded.snapshot("bioproject_uid")).containsOnlyKeys("12345");
    }

    @Test
    void put_storesACopy() {
        ObjectNode value = blob("before");
        cache.put("bioproject", "PRJNA1", value);
        value.put("title", "after");

        JsonNode stored = cache.get("bioproject", "PRJNA1").orElseThrow().value();
        assertThat(stored.path("title").asText()).isEqualTo("before");
    }

    @Test
    void put_rejectsEmptyValue() {
        assertThatThrownBy(() -> cache.put("bioproject", "PRJNA1", JsonNodeFactory.instance.objectNode()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flush_onlyRewritesDirtyNamespaces() throws IOException {
        cache.put("bioproject", "PRJNA1", blob("a"));
        cache.flush();
        Path file = tempDir.resolve("bioproject.json");
        Files.writeString(file, "{\"PRJNA9\": {\"title\": \"edited\"}}");

        cache.put("biosample", "SAMN1", blob("s"));
        cache.flush();

        assertThat(Files.readString(file)).contains("edited");
    }

    @Test
    void load_rejectsNonObjectFile() throws IOException {
        Files.writeString(tempDir.resolve("bioproject.json"), "[1,2]");
        assertThatThrownBy(() -> newStore().load()).isInstanceOf(IOException.class);
    }

    @Test
    void metrics_countHitsTombstonesAndMisses() {
        cache.put("bioproject", "PRJNA1", blob("a"));
        cache.putTombstone("bioproject", "PRJNA2");
        cache.get("bioproject", "PRJNA1");
        cache.get("bioproject", "PRJNA2");
        cache.get("bioproject", "PRJNA3");

        Map<String, Number> metrics = cache.getMetrics();
        assertThat(metrics.get("cache_hits").longValue()).isEqualTo(1);
        assertThat(metrics.get("cache_tombstone_hits").longValue()).isEqualTo(1);
        assertThat(metrics.get("cache_misses").longValue()).isEqualTo(1);
        assertThat(metrics.get("cache_entries").intValue()).isEqualTo(2);
    }
}
