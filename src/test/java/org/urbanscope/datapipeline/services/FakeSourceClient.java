package org.urbanscope.datapipeline.services;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory catalog for pipeline tests.
 */
class FakeSourceClient implements ISourceClient {

    final List<String> searchResults = new ArrayList<>();
    final Map<String, RawRecord> records = new HashMap<>();
    final Map<String, ObjectNode> projects = new HashMap<>();
    final Map<String, ObjectNode> samples = new HashMap<>();
    final Set<String> failingIds = new HashSet<>();
    String crashOn;
    boolean searchFails;
    int detailCalls;

    void add(RawRecord record) {
        records.put(record.id(), record);
        searchResults.add(record.id());
    }

    @Override
    public String getResourceName() {
        return "fake-source";
    }

    @Override
    public List<String> search(String query, TimeWindow window, int limit) throws SourceUnavailableException {
        if (searchFails) {
            throw new SourceUnavailableException("HTTP 503 from esearch", 503, null);
        }
        return List.copyOf(searchResults.subList(0, Math.min(limit, searchResults.size())));
    }

    @Override
    public RawRecord fetchDetail(String rawId) throws SourceUnavailableException {
        detailCalls++;
        if (rawId.equals(crashOn)) {
            throw new IllegalStateException("simulated crash at " + rawId);
        }
        if (failingIds.contains(rawId)) {
            throw new SourceUnavailableException("HTTP 500 for " + rawId, 500, null);
        }
        RawRecord record = records.get(rawId);
        if (record == null) {
            throw new SourceUnavailableException("No summary returned for " + rawId);
        }
        return record;
    }

    @Override
    public List<String> fetchLinked(String rawId, String targetKind) {
        return List.of();
    }

    @Override
    public Optional<String> summarizeAccession(String targetKind, String secondaryId) {
        return Optional.empty();
    }

    @Override
    public String fetchFullText(String rawId) {
        return "";
    }

    @Override
    public Optional<ObjectNode> fetchProjectMetadata(String accession) {
        return Optional.ofNullable(projects.get(accession)).map(ObjectNode::deepCopy);
    }

    @Override
    public Optional<ObjectNode> fetchSampleMetadata(String sampleAccession) {
        return Optional.ofNullable(samples.get(sampleAccession)).map(ObjectNode::deepCopy);
    }
}
