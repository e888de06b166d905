package org.urbanscope.datapipeline.services.resolver;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.CanonicalProjectId;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.contracts.ResolutionMethod;
import org.urbanscope.datapipeline.api.contracts.ResolutionResult;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a raw record to its canonical project through an ordered fallback chain.
 * <ol>
 *   <li>Embedded field: the source-reported accession, then every structured field in order,
 *       then the title.</li>
 *   <li>Link lookup: linked secondary ids, each resolved to an accession by a summary lookup.
 *       Results are cached per secondary id in {@link #LINK_NAMESPACE}; a secondary id that has
 *       no accession is tombstoned.</li>
 *   <li>Full text: the tier-1 pattern applied to the full detail document. Runs when tier 2 finds
 *       nothing or fails, if enabled.</li>
 * </ol>
 * A record no tier can resolve yields {@link ResolutionResult#unresolved(String)}. Remote failures
 * propagate only when no later tier is left to try.
 */
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    /** Cache namespace: secondary project id to {@code {"accession": ...}}. */
    public static final String LINK_NAMESPACE = "bioproject_uid";

    private final ISourceClient source;
    private final ICacheStore cache;
    private final boolean deepFallback;

    public EntityResolver(ISourceClient source, ICacheStore cache, boolean deepFallback) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.deepFallback = deepFallback;
    }

    /**
     * Resolves one record.
     *
     * @throws SourceUnavailableException if the last tier that was attempted could not reach the source
     * @throws MalformedPayloadException  if the last tier that was attempted got an unparseable answer
     */
    public ResolutionResult resolve(RawRecord record) throws SourceUnavailableException, MalformedPayloadException {
        Optional<CanonicalProjectId> embedded = fromEmbedded(record);
        if (embedded.isPresent()) {
            log.debug("Resolved {} to {} from embedded fields", record.id(), embedded.get());
            return ResolutionResult.resolved(embedded.get(), ResolutionMethod.EMBEDDED_FIELD, false);
        }

        IOException linkFailure = null;
        try {
            Optional<ResolutionResult> linked = fromLinks(record.id());
            if (linked.isPresent()) {
                return linked.get();
            }
        } catch (SourceUnavailableException | MalformedPayloadException e) {
            if (!deepFallback) {
                throw e;
            }
            linkFailure = e;
            log.debug("Link lookup for {} failed, trying full text: {}", record.id(), e.getMessage());
        }

        if (!deepFallback) {
            return unresolved(record, "no accession in fields, title or linked projects");
        }
        String fullText = source.fetchFullText(record.id());
        Optional<CanonicalProjectId> deep = AccessionPattern.firstIn(fullText);
        if (deep.isPresent()) {
            log.debug("Resolved {} to {} from full text", record.id(), deep.get());
            return ResolutionResult.resolved(deep.get(), ResolutionMethod.FULL_TEXT, false);
        }
        return unresolved(record, linkFailure == null
            ? "no accession in fields, title, linked projects or full text"
            : "link lookup failed (" + linkFailure.getMessage() + "), no accession in full text");
    }

    /**
     * Tier 1, without any I/O.
     */
    static Optional<CanonicalProjectId> fromEmbedded(RawRecord record) {
        Optional<CanonicalProjectId> hint = record.embeddedAccessionHint().flatMap(AccessionPattern::firstIn);
        if (hint.isPresent()) {
            return hint;
        }
        for (Map.Entry<String, String> field : record.fields().entrySet()) {
            Optional<CanonicalProjectId> id = AccessionPattern.firstIn(field.getValue());
            if (id.isPresent()) {
                return id;
            }
        }
        return AccessionPattern.firstIn(record.title());
    }

    private Optional<ResolutionResult> fromLinks(String rawId) throws SourceUnavailableException, MalformedPayloadException {
        List<String> secondaryIds = source.fetchLinked(rawId, ISourceClient.TARGET_PROJECT);
        for (String secondaryId : secondaryIds) {
            Optional<ICacheStore.CacheEntry> cached = cache.get(LINK_NAMESPACE, secondaryId);
            if (cached.isPresent()) {
                if (cached.get().isTombstone()) {
                    log.debug("Link cache tombstone for secondary id {}", secondaryId);
                    continue;
                }
                Optional<CanonicalProjectId> id = CanonicalProjectId.parse(cached.get().value().path("accession").asText(null));
                if (id.isPresent()) {
                    log.debug("Resolved {} to {} from link cache (secondary id {})", rawId, id.get(), secondaryId);
                    return Optional.of(ResolutionResult.resolved(id.get(), ResolutionMethod.LINK_LOOKUP, true));
                }
                continue;
            }
            Optional<CanonicalProjectId> id = source.summarizeAccession(ISourceClient.TARGET_PROJECT, secondaryId)
                .flatMap(CanonicalProjectId::parse);
            if (id.isPresent()) {
                ObjectNode entry = JsonNodeFactory.instance.objectNode();
                entry.put("accession", id.get().value());
                cache.put(LINK_NAMESPACE, secondaryId, entry);
                log.debug("Resolved {} to {} via linked secondary id {}", rawId, id.get(), secondaryId);
                return Optional.of(ResolutionResult.resolved(id.get(), ResolutionMethod.LINK_LOOKUP, false));
            }
            cache.putTombstone(LINK_NAMESPACE, secondaryId);
        }
        return Optional.empty();
    }

    private static ResolutionResult unresolved(RawRecord record, String reason) {
        log.debug("Could not resolve {}: {}", record.id(), reason);
        return ResolutionResult.unresolved(reason);
    }
}
