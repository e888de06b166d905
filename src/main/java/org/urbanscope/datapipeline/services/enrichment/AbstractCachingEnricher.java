package org.urbanscope.datapipeline.services.enrichment;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cache-first lookup of auxiliary metadata by accession.
 * <p>
 * Order of checks: blank key (nothing), cache entry (blob or tombstone), accession format
 * (tombstoned as {@code invalid_accession} without a remote call), remote lookup. A lookup that
 * finds nothing is tombstoned with {@link #notFoundCode()}. A failed lookup leaves the cache
 * untouched so a later run asks again; the record is then emitted without this metadata.
 */
public abstract class AbstractCachingEnricher {

    private static final Logger log = LoggerFactory.getLogger(AbstractCachingEnricher.class);

    protected final ICacheStore cache;
    private final String namespace;
    private final Pattern accessionFormat;

    private long remoteLookups;
    private long cacheHits;
    private long failures;

    protected AbstractCachingEnricher(ICacheStore cache, String namespace, Pattern accessionFormat) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace cannot be null");
        this.accessionFormat = Objects.requireNonNull(accessionFormat, "accessionFormat cannot be null");
    }

    /**
     * Returns metadata for an accession.
     *
     * @param accession accession as found on the record, may be blank
     * @return the metadata blob, or empty if unknown, invalid or currently unreachable
     */
    public Optional<ObjectNode> enrich(String accession) {
        String key = normalizeKey(accession);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Optional<ICacheStore.CacheEntry> cached = cache.get(namespace, key);
        if (cached.isPresent()) {
            cacheHits++;
            log.debug("Cache hit in {} for {}{}", namespace, key, cached.get().isTombstone() ? " (tombstone)" : "");
            return cached.get().blob().map(ObjectNode::deepCopy);
        }
        if (!accessionFormat.matcher(key).matches()) {
            cache.putTombstone(namespace, key, "invalid_accession");
            log.debug("Tombstoned invalid accession {} in {}", key, namespace);
            return Optional.empty();
        }
        try {
            remoteLookups++;
            Optional<ObjectNode> fetched = lookup(key);
            if (fetched.isEmpty()) {
                cache.putTombstone(namespace, key, notFoundCode());
                log.debug("No {} metadata for {}", namespace, key);
                return Optional.empty();
            }
            cache.put(namespace, key, fetched.get());
            return Optional.of(fetched.get().deepCopy());
        } catch (SourceUnavailableException | MalformedPayloadException e) {
            failures++;
            log.warn("Could not fetch {} metadata for {}, continuing without it: {}", namespace, key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Performs the remote lookup for a validated key.
     */
    protected abstract Optional<ObjectNode> lookup(String key) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Error code stored in the tombstone when the source does not know the key.
     */
    protected abstract String notFoundCode();

    protected String normalizeKey(String accession) {
        return accession == null ? "" : accession.trim();
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Lookup counters, prefixed with the namespace.
     */
    public Map<String, Long> getCounters() {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put(namespace + "_cache_hits", cacheHits);
        counters.put(namespace + "_remote_lookups", remoteLookups);
        counters.put(namespace + "_lookup_failures", failures);
        return counters;
    }
}
