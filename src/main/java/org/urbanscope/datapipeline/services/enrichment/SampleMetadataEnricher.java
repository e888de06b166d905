package org.urbanscope.datapipeline.services.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Sample metadata (attributes, organism) keyed by sample accession.
 */
public class SampleMetadataEnricher extends AbstractCachingEnricher {

    public static final String NAMESPACE = "biosample";

    /** Record field carrying the sample accession. */
    public static final String FIELD_SAMPLE = "BioSample";

    private static final Pattern SAMPLE_ACCESSION = Pattern.compile("SAM(?:N|EA|D)\\d+");

    private final ISourceClient source;

    public SampleMetadataEnricher(ISourceClient source, ICacheStore cache) {
        super(cache, NAMESPACE, SAMPLE_ACCESSION);
        this.source = source;
    }

    @Override
    protected Optional<ObjectNode> lookup(String key) throws SourceUnavailableException, MalformedPayloadException {
        return source.fetchSampleMetadata(key);
    }

    @Override
    protected String notFoundCode() {
        return "not_found";
    }

    @Override
    protected String normalizeKey(String accession) {
        return super.normalizeKey(accession).toUpperCase(Locale.ROOT);
    }

    /**
     * Extracts the {@code attributes} object of a sample blob as a string map.
     */
    public static Map<String, String> attributesOf(JsonNode sample) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (sample == null) {
            return attributes;
        }
        JsonNode node = sample.path("attributes");
        if (node.isObject()) {
            node.fields().forEachRemaining(e -> attributes.put(e.getKey(), e.getValue().asText("")));
        }
        return attributes;
    }
}
