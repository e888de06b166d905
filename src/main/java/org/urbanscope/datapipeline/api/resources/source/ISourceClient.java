package org.urbanscope.datapipeline.api.resources.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.resources.IResource;

import java.util.List;
import java.util.Optional;

/**
 * Boundary to the remote catalog.
 * <p>
 * Every method performs blocking external calls. Transport retries happen inside the
 * implementation; a thrown {@link SourceUnavailableException} means the retries are exhausted
 * or the request was rejected outright, and {@link MalformedPayloadException} means the
 * response never parsed. "Not found" is expressed through empty results, never by throwing.
 */
public interface ISourceClient extends IResource {

    /** Link target for the project database. */
    String TARGET_PROJECT = "bioproject";

    /**
     * Lists raw record ids matching a query within a time window.
     *
     * @param query  catalog query string
     * @param window date or paging window
     * @param limit  maximum ids to return
     * @return raw ids in the order the catalog returned them
     */
    List<String> search(String query, TimeWindow window, int limit) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Fetches one raw record.
     *
     * @throws SourceUnavailableException if the catalog has no such record or cannot be reached
     */
    RawRecord fetchDetail(String rawId) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Follows the link service from a raw record to secondary ids in another database.
     *
     * @return secondary numeric ids, empty when nothing is linked
     */
    List<String> fetchLinked(String rawId, String targetKind) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Resolves a secondary numeric id to the accession string of the target database.
     *
     * @return the accession as reported by the catalog (not yet validated), or empty
     */
    Optional<String> summarizeAccession(String targetKind, String secondaryId) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Fetches the full detail document of a raw record as text.
     */
    String fetchFullText(String rawId) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Fetches project metadata by accession.
     *
     * @return the metadata blob, or empty when the catalog does not know the accession
     */
    Optional<ObjectNode> fetchProjectMetadata(String accession) throws SourceUnavailableException, MalformedPayloadException;

    /**
     * Fetches sample metadata by sample accession.
     *
     * @return the metadata blob, or empty when the catalog does not know the accession
     */
    Optional<ObjectNode> fetchSampleMetadata(String sampleAccession) throws SourceUnavailableException, MalformedPayloadException;
}
