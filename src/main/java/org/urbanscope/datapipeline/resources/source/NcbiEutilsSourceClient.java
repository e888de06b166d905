package org.urbanscope.datapipeline.resources.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.resources.AbstractResource;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ISourceClient} over the NCBI E-utilities endpoints.
 * <p>
 * Raw records are SRA entries: {@link #fetchDetail} merges the SRA esummary items with the first
 * runinfo CSV row. Every call goes through one {@link RetryingHttpFetcher}, so retries and polite
 * pacing apply across endpoints.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>ncbi.baseUrl</b>: E-utilities base URL</li>
 *   <li><b>ncbi.apiKey</b>, <b>ncbi.tool</b>, <b>ncbi.email</b>: added to every request when non-empty</li>
 *   <li><b>ncbi.timeoutSeconds</b>: per-request timeout (default: 60)</li>
 *   <li><b>ncbi.database</b>: raw record database (default: sra)</li>
 *   <li><b>ncbi.dateType</b>: date field for windows (default: edat)</li>
 *   <li><b>ncbi.runinfoMaxRows</b>: runinfo rows read per record (default: 1)</li>
 *   <li><b>retry.*</b>: see {@link RetryPolicy#fromConfig(Config)}</li>
 *   <li><b>pacing.minIntervalMs</b>: minimum gap between successful calls (default: 600)</li>
 * </ul>
 */
public class NcbiEutilsSourceClient extends AbstractResource implements ISourceClient {

    private static final Logger log = LoggerFactory.getLogger(NcbiEutilsSourceClient.class);
    private static final DateTimeFormatter NCBI_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    /** Summary items holding escaped XML; too bulky to carry as record fields. */
    private static final Set<String> BULKY_ITEMS = Set.of("ExpXml", "Runs");

    private final String baseUrl;
    private final Map<String, String> identity;
    private final String database;
    private final String dateType;
    private final int runinfoMaxRows;
    private final RetryingHttpFetcher fetcher;

    public NcbiEutilsSourceClient(String name, Config options) {
        this(name, options, null);
    }

    /**
     * Constructor with an explicit fetcher, used by tests.
     *
     * @param fetcher fetcher to use, or {@code null} to build one from {@code options}
     */
    public NcbiEutilsSourceClient(String name, Config options, RetryingHttpFetcher fetcher) {
        super(name, options);
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "ncbi.baseUrl", "https://eutils.ncbi.nlm.nih.gov/entrez/eutils/",
            "ncbi.apiKey", "",
            "ncbi.tool", "urbanscope-harvester",
            "ncbi.email", "",
            "ncbi.timeoutSeconds", 60,
            "ncbi.database", "sra",
            "ncbi.dateType", "edat",
            "ncbi.runinfoMaxRows", 1,
            "pacing.minIntervalMs", 600
        )));
        String base = config.getString("ncbi.baseUrl");
        this.baseUrl = base.endsWith("/") ? base : base + "/";
        this.database = config.getString("ncbi.database");
        this.dateType = config.getString("ncbi.dateType");
        this.runinfoMaxRows = Math.max(1, config.getInt("ncbi.runinfoMaxRows"));

        this.identity = new LinkedHashMap<>();
        putIfPresent(identity, "api_key", config.getString("ncbi.apiKey"));
        putIfPresent(identity, "tool", config.getString("ncbi.tool"));
        putIfPresent(identity, "email", config.getString("ncbi.email"));

        if (fetcher != null) {
            this.fetcher = fetcher;
        } else {
            Duration timeout = Duration.ofSeconds(config.getInt("ncbi.timeoutSeconds"));
            String userAgent = config.getString("ncbi.tool") + "/1.0 ("
                + (config.getString("ncbi.email").isBlank() ? "no-email" : config.getString("ncbi.email")) + ")";
            RetryPolicy policy = RetryPolicy.fromConfig(
                config.hasPath("retry") ? config.getConfig("retry") : ConfigFactory.empty());
            PolitePacer pacer = new PolitePacer(Duration.ofMillis(config.getLong("pacing.minIntervalMs")));
            this.fetcher = new RetryingHttpFetcher(HttpTransport.jdk(timeout, userAgent), policy, pacer);
        }
        log.debug("NCBI source '{}' using {} (database={}, api key {})",
            name, baseUrl, database, identity.containsKey("api_key") ? "set" : "not set");
    }

    @Override
    public List<String> search(String query, TimeWindow window, int limit)
            throws SourceUnavailableException, MalformedPayloadException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("db", database);
        params.put("term", query);
        params.put("retmode", "xml");
        params.put("retmax", String.valueOf(limit));
        if (window instanceof TimeWindow.Recent recent) {
            params.put("reldate", String.valueOf(recent.days()));
            params.put("datetype", dateType);
            params.put("sort", "date");
        } else if (window instanceof TimeWindow.Day day) {
            String date = NCBI_DATE.format(day.date());
            params.put("mindate", date);
            params.put("maxdate", date);
            params.put("datetype", dateType);
        } else if (window instanceof TimeWindow.Page page) {
            params.put("retstart", String.valueOf(page.start()));
            params.put("usehistory", "n");
        }
        return tracked("search", window.tag(),
            () -> fetcher.get(url("esearch.fcgi", params), NcbiResponseParsers::parseSearchIds));
    }

    @Override
    public RawRecord fetchDetail(String rawId) throws SourceUnavailableException, MalformedPayloadException {
        return tracked("fetchDetail", rawId, () -> {
            Map<String, NcbiResponseParsers.SraSummary> summaries = fetcher.get(
                url("esummary.fcgi", Map.of("db", database, "id", rawId, "retmode", "xml")),
                NcbiResponseParsers::parseSraSummaries);
            NcbiResponseParsers.SraSummary summary = summaries.get(rawId);
            if (summary == null) {
                throw new SourceUnavailableException("No summary returned for " + database + " id " + rawId);
            }
            List<Map<String, String>> rows = fetcher.get(
                url("efetch.fcgi", Map.of("db", database, "id", rawId, "rettype", "runinfo", "retmode", "text")),
                body -> NcbiResponseParsers.parseRunInfo(body, runinfoMaxRows));

            Map<String, String> fields = new LinkedHashMap<>();
            summary.items().forEach((k, v) -> {
                if (!BULKY_ITEMS.contains(k) && !v.isEmpty()) {
                    fields.put(k, v);
                }
            });
            if (!rows.isEmpty()) {
                rows.get(0).forEach((k, v) -> {
                    if (!v.isEmpty()) {
                        fields.put(k, v);
                    }
                });
            }
            return new RawRecord(rawId, summary.title(), fields, summary.projectGuess());
        });
    }

    @Override
    public List<String> fetchLinked(String rawId, String targetKind)
            throws SourceUnavailableException, MalformedPayloadException {
        return tracked("fetchLinked", rawId, () -> fetcher.get(
            url("elink.fcgi", Map.of("dbfrom", database, "db", targetKind, "id", rawId, "retmode", "xml")),
            NcbiResponseParsers::parseLinkIds));
    }

    @Override
    public Optional<String> summarizeAccession(String targetKind, String secondaryId)
            throws SourceUnavailableException, MalformedPayloadException {
        if (!TARGET_PROJECT.equals(targetKind)) {
            throw new IllegalArgumentException("Unsupported link target: " + targetKind);
        }
        Optional<ObjectNode> summary = tracked("summarizeAccession", secondaryId, () -> fetcher.get(
            url("esummary.fcgi", Map.of("db", targetKind, "id", secondaryId, "retmode", "xml")),
            body -> NcbiResponseParsers.parseProjectSummary(secondaryId, body)));
        return summary
            .map(node -> node.path("accession").asText(""))
            .filter(acc -> !acc.isBlank());
    }

    @Override
    public String fetchFullText(String rawId) throws SourceUnavailableException, MalformedPayloadException {
        return tracked("fetchFullText", rawId, () -> fetcher.get(
            url("efetch.fcgi", Map.of("db", database, "id", rawId, "retmode", "xml"))));
    }

    @Override
    public Optional<ObjectNode> fetchProjectMetadata(String accession)
            throws SourceUnavailableException, MalformedPayloadException {
        return tracked("fetchProjectMetadata", accession, () -> {
            List<String> uids = fetcher.get(
                url("esearch.fcgi", Map.of("db", TARGET_PROJECT, "term", accession + "[Accession]",
                    "retmode", "xml", "retmax", "5")),
                NcbiResponseParsers::parseSearchIds);
            if (uids.isEmpty()) {
                return Optional.<ObjectNode>empty();
            }
            String uid = uids.get(0);
            Optional<ObjectNode> details = fetcher.get(
                url("esummary.fcgi", Map.of("db", TARGET_PROJECT, "id", uid, "retmode", "xml")),
                body -> NcbiResponseParsers.parseProjectSummary(uid, body));
            details.ifPresent(node -> {
                if (node.path("accession").asText("").isBlank()) {
                    node.put("accession", accession);
                }
            });
            return details;
        });
    }

    @Override
    public Optional<ObjectNode> fetchSampleMetadata(String sampleAccession)
            throws SourceUnavailableException, MalformedPayloadException {
        return tracked("fetchSampleMetadata", sampleAccession, () -> {
            Map<String, String> params = Map.of("db", "biosample", "id", sampleAccession, "retmode", "xml");
            Optional<ObjectNode> details = fetcher.get(url("efetch.fcgi", params),
                NcbiResponseParsers::parseSampleDetail);
            details.ifPresent(node -> {
                node.put("accession", sampleAccession);
                node.put("efetch_url", publicUrl("efetch.fcgi", params));
            });
            return details;
        });
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T call() throws SourceUnavailableException, MalformedPayloadException;
    }

    private <T> T tracked(String operation, String subject, RemoteCall<T> call)
            throws SourceUnavailableException, MalformedPayloadException {
        try {
            return call.call();
        } catch (SourceUnavailableException e) {
            recordError("SOURCE_UNAVAILABLE", operation + " failed", subject + ": " + e.getMessage());
            log.debug("{} for {} failed", operation, subject, e);
            throw e;
        } catch (MalformedPayloadException e) {
            recordError("MALFORMED_PAYLOAD", operation + " returned an unparseable payload", subject + ": " + e.getMessage());
            log.debug("{} for {} returned an unparseable payload", operation, subject, e);
            throw e;
        }
    }

    URI url(String endpoint, Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.putAll(identity);
        return URI.create(baseUrl + endpoint + "?" + encode(all));
    }

    /**
     * URL without credentials, safe to store in exported metadata.
     */
    private String publicUrl(String endpoint, Map<String, String> params) {
        return baseUrl + endpoint + "?" + encode(params);
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.trim());
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("http_requests", fetcher.getRequestCount());
        metrics.put("http_retries", fetcher.getRetryCount());
        metrics.put("http_failures", fetcher.getFailureCount());
        metrics.put("pacing_wait_ms", fetcher.getPacer().getTotalWaitMillis());
    }
}
