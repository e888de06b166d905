package org.urbanscope.datapipeline.resources.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.resources.AbstractResource;
import org.urbanscope.datapipeline.utils.AtomicFiles;
import org.urbanscope.datapipeline.utils.JsonMapper;
import org.urbanscope.datapipeline.utils.PathExpansion;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * {@link ICacheStore} that keeps one JSON object file per namespace ({@code <namespace>.json}).
 * <p>
 * All namespaces are held in memory after {@link #load()}. {@link #flush()} rewrites each
 * modified namespace file in full through {@link AtomicFiles}, so a crash leaves either the
 * old or the new file on disk.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>directory</b>: cache directory, supports {@code ${VAR}} expansion (required)</li>
 *   <li><b>pretty</b>: indent the files (default: true)</li>
 * </ul>
 */
public class FileSystemCacheStore extends AbstractResource implements ICacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCacheStore.class);
    private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final Path directory;
    private final boolean pretty;
    private final Map<String, Map<String, JsonNode>> namespaces = new LinkedHashMap<>();
    private final Set<String> dirty = new HashSet<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong tombstoneHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();

    public FileSystemCacheStore(String name, Config options) {
        super(name, options);
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for FileSystemCacheStore '" + name + "'");
        }
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of("pretty", true)));
        this.directory = PathExpansion.expandToPath(config.getString("directory"));
        this.pretty = config.getBoolean("pretty");
    }

    @Override
    public synchronized void load() throws IOException {
        namespaces.clear();
        dirty.clear();
        if (!Files.isDirectory(directory)) {
            log.debug("Cache directory {} does not exist yet, starting empty", directory);
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String namespace = fileName.substring(0, fileName.length() - ".json".length());
                if (!NAMESPACE.matcher(namespace).matches()) {
                    continue;
                }
                namespaces.put(namespace, readNamespace(file));
            }
        }
        log.debug("Loaded cache '{}' from {}: {}", resourceName, directory, sizes());
    }

    private Map<String, JsonNode> readNamespace(Path file) throws IOException {
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        if (Files.size(file) == 0) {
            return entries;
        }
        JsonNode root = JsonMapper.mapper().readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Cache file is not a JSON object: " + file);
        }
        root.fields().forEachRemaining(e -> entries.put(e.getKey(), e.getValue()));
        return entries;
    }

    @Override
    public synchronized Optional<CacheEntry> get(String namespace, String key) {
        Map<String, JsonNode> entries = namespaces.get(namespace);
        JsonNode value = entries == null ? null : entries.get(key);
        if (value == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry entry = new CacheEntry(value);
        if (entry.isTombstone()) {
            tombstoneHits.incrementAndGet();
        } else {
            hits.incrementAndGet();
        }
        return Optional.of(entry);
    }

    @Override
    public synchronized void put(String namespace, String key, ObjectNode value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Use putTombstone for empty values: " + namespace + "/" + key);
        }
        store(namespace, key, value.deepCopy());
    }

    @Override
    public synchronized void putTombstone(String namespace, String key, String error) {
        ObjectNode tombstone = JsonNodeFactory.instance.objectNode();
        if (error != null) {
            tombstone.put("error", error);
        }
        store(namespace, key, tombstone);
    }

    private void store(String namespace, String key, JsonNode value) {
        if (!NAMESPACE.matcher(namespace).matches()) {
            throw new IllegalArgumentException("Invalid cache namespace: '" + namespace + "'");
        }
        namespaces.computeIfAbsent(namespace, ns -> new LinkedHashMap<>()).put(key, value);
        dirty.add(namespace);
        writes.incrementAndGet();
    }

    @Override
    public synchronized Map<String, JsonNode> snapshot(String namespace) {
        Map<String, JsonNode> entries = namespaces.get(namespace);
        return entries == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entries);
    }

    @Override
    public synchronized void flush() throws IOException {
        if (dirty.isEmpty()) {
            return;
        }
        for (String namespace : dirty) {
            ObjectNode root = JsonNodeFactory.instance.objectNode();
            namespaces.get(namespace).forEach(root::set);
            byte[] data = pretty
                ? JsonMapper.pretty().writeValueAsBytes(root)
                : JsonMapper.compact().writeValueAsBytes(root);
            AtomicFiles.write(directory.resolve(namespace + ".json"), data);
        }
        log.debug("Flushed cache namespaces {} to {}", dirty, directory);
        dirty.clear();
    }

    public Path getDirectory() {
        return directory;
    }

    private Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        namespaces.forEach((ns, entries) -> sizes.put(ns, entries.size()));
        return sizes;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("cache_hits", hits.get());
        metrics.put("cache_tombstone_hits", tombstoneHits.get());
        metrics.put("cache_misses", misses.get());
        metrics.put("cache_writes", writes.get());
        synchronized (this) {
            metrics.put("cache_entries", namespaces.values().stream().mapToInt(Map::size).sum());
        }
    }
}
