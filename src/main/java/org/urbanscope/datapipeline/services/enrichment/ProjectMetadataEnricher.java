package org.urbanscope.datapipeline.services.enrichment;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.urbanscope.datapipeline.api.contracts.CanonicalProjectId;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;

import java.util.Locale;
import java.util.Optional;

/**
 * Project metadata (title, description, submitter, dates) keyed by project accession.
 */
public class ProjectMetadataEnricher extends AbstractCachingEnricher {

    public static final String NAMESPACE = "bioproject";

    private final ISourceClient source;

    public ProjectMetadataEnricher(ISourceClient source, ICacheStore cache) {
        super(cache, NAMESPACE, CanonicalProjectId.PATTERN);
        this.source = source;
    }

    public Optional<ObjectNode> enrich(CanonicalProjectId projectId) {
        return enrich(projectId.value());
    }

    @Override
    protected Optional<ObjectNode> lookup(String key) throws SourceUnavailableException, MalformedPayloadException {
        return source.fetchProjectMetadata(key);
    }

    @Override
    protected String notFoundCode() {
        return "uid_not_found";
    }

    @Override
    protected String normalizeKey(String accession) {
        return super.normalizeKey(accession).toUpperCase(Locale.ROOT);
    }
}
