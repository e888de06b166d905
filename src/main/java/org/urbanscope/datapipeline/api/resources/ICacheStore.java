package org.urbanscope.datapipeline.api.resources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent key/value cache for auxiliary metadata, organized in namespaces.
 * <p>
 * An entry is either a metadata blob or a tombstone meaning "looked up, does not exist".
 * A tombstone is an empty object, or an object whose only field is {@code error}. Tombstones prevent repeat lookups for unknown keys.
 * An absent entry means "never looked up, or the last lookup failed transiently".
 */
public interface ICacheStore extends IPersistentResource {

    /**
     * Returns the cached entry for a key.
     *
     * @param namespace cache namespace, e.g. {@code bioproject}
     * @param key       lookup key
     * @return the entry, or empty when the key was never cached
     */
    Optional<CacheEntry> get(String namespace, String key);

    /**
     * Stores a metadata blob. Replaces any previous value, including a tombstone.
     */
    void put(String namespace, String key, ObjectNode value);

    /**
     * Records that the key was looked up and does not exist.
     */
    default void putTombstone(String namespace, String key) {
        putTombstone(namespace, key, null);
    }

    /**
     * Records a permanent lookup failure.
     *
     * @param error short error code such as {@code invalid_accession}, or {@code null} for a bare tombstone
     */
    void putTombstone(String namespace, String key, String error);

    /**
     * Returns a copy of all entries of a namespace, in insertion order.
     */
    Map<String, JsonNode> snapshot(String namespace);

    /**
     * One cached value.
     *
     * @param value the stored object
     */
    record CacheEntry(JsonNode value) {

        public boolean isTombstone() {
            if (value == null || !value.isObject()) {
                return true;
            }
            return value.isEmpty() || (value.size() == 1 && value.has("error"));
        }

        public Optional<ObjectNode> blob() {
            return isTombstone() ? Optional.empty() : Optional.of((ObjectNode) value);
        }
    }
}
