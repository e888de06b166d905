package org.urbanscope.datapipeline.resources.source;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for E-utilities payloads: esearch/elink id lists, SRA and BioProject esummary
 * documents, BioSample efetch XML and SRA runinfo CSV.
 * <p>
 * All methods are pure. Unparseable input raises {@link MalformedPayloadException} so the
 * fetcher retries it. Well-formed documents that simply lack the expected elements yield
 * empty results.
 */
public final class NcbiResponseParsers {

    private static final Pattern PROJECT_ACCESSION = Pattern.compile("\\bPRJ(?:NA|EB|DB)\\d+\\b", Pattern.CASE_INSENSITIVE);
    private static final String PROJECT_URL = "https://www.ncbi.nlm.nih.gov/bioproject/";

    private NcbiResponseParsers() {
    }

    /**
     * One SRA esummary document.
     *
     * @param uid          numeric SRA id
     * @param title        experiment title
     * @param items        flattened summary items; list items are joined with {@code "; "}
     * @param projectGuess first project accession found in any item, upper-cased, or {@code null}
     */
    public record SraSummary(String uid, String title, Map<String, String> items, String projectGuess) {
    }

    // ---- id lists ----

    /**
     * Extracts {@code IdList/Id} values from an esearch result.
     */
    public static List<String> parseSearchIds(String xml) throws MalformedPayloadException {
        Document doc = parseXml(xml);
        failOnErrorElement(doc);
        List<String> ids = new ArrayList<>();
        for (Element idList : elements(doc.getDocumentElement(), "IdList")) {
            for (Element id : elements(idList, "Id")) {
                addIfPresent(ids, id.getTextContent());
            }
        }
        return ids;
    }

    /**
     * Extracts linked ids ({@code LinkSetDb/Link/Id}) from an elink result.
     */
    public static List<String> parseLinkIds(String xml) throws MalformedPayloadException {
        Document doc = parseXml(xml);
        failOnErrorElement(doc);
        List<String> ids = new ArrayList<>();
        for (Element linkSetDb : elements(doc.getDocumentElement(), "LinkSetDb")) {
            for (Element link : elements(linkSetDb, "Link")) {
                for (Element id : elements(link, "Id")) {
                    String value = id.getTextContent().trim();
                    if (!value.isEmpty() && !ids.contains(value)) {
                        ids.add(value);
                    }
                }
            }
        }
        return ids;
    }

    // ---- SRA ----

    /**
     * Parses a legacy {@code DocSum} SRA esummary into summaries keyed by uid.
     */
    public static Map<String, SraSummary> parseSraSummaries(String xml) throws MalformedPayloadException {
        Document doc = parseXml(xml);
        failOnErrorElement(doc);
        Map<String, SraSummary> out = new LinkedHashMap<>();
        for (Element docSum : elements(doc.getDocumentElement(), "DocSum")) {
            String uid = childText(docSum, "Id");
            if (uid.isEmpty()) {
                continue;
            }
            Map<String, String> items = docSumItems(docSum);
            String guess = null;
            for (String value : items.values()) {
                Matcher m = PROJECT_ACCESSION.matcher(value);
                if (m.find()) {
                    guess = m.group().toUpperCase(Locale.ROOT);
                    break;
                }
            }
            out.put(uid, new SraSummary(uid, items.getOrDefault("Title", "").trim(), items, guess));
        }
        return out;
    }

    /**
     * Parses runinfo CSV into rows keyed by header. Blank lines are skipped.
     */
    public static List<Map<String, String>> parseRunInfo(String csv, int maxRows) throws MalformedPayloadException {
        List<String[]> lines;
        try (CSVReader reader = new CSVReader(new StringReader(csv))) {
            lines = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new MalformedPayloadException("Unparseable runinfo CSV", e);
        }
        List<Map<String, String>> rows = new ArrayList<>();
        String[] header = null;
        for (String[] line : lines) {
            if (line.length == 0 || (line.length == 1 && line[0].isBlank())) {
                continue;
            }
            if (header == null) {
                header = line;
                if (!List.of(header).contains("Run")) {
                    throw new MalformedPayloadException("runinfo CSV has no 'Run' column");
                }
                continue;
            }
            // runinfo repeats the header between batches
            if (line[0].equals(header[0])) {
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.length && i < line.length; i++) {
                row.put(header[i].trim(), line[i].trim());
            }
            rows.add(row);
            if (rows.size() >= maxRows) {
                break;
            }
        }
        return rows;
    }

    // ---- BioProject ----

    /**
     * Parses a BioProject esummary. Accepts the rich {@code DocumentSummary/Project} layout, the flat
     * {@code DocumentSummary} layout with {@code Project_Acc}, and the legacy {@code DocSum/Item} layout.
     *
     * @param uid numeric BioProject id the summary was requested for
     * @return the metadata blob, or empty if the document contains no summary
     */
    public static Optional<ObjectNode> parseProjectSummary(String uid, String xml) throws MalformedPayloadException {
        Document doc = parseXml(xml);
        failOnErrorElement(doc);
        Element root = doc.getDocumentElement();

        Element summary = first(root, "DocumentSummary");
        if (summary != null && first(summary, "Project") != null) {
            return Optional.of(richProject(uid, summary));
        }
        if (summary != null && first(summary, "Project_Acc") != null) {
            return Optional.of(flatProject(uid, summary));
        }
        Element docSum = first(root, "DocSum");
        if (docSum != null) {
            return Optional.of(legacyProject(uid, docSum));
        }
        return Optional.empty();
    }

    private static ObjectNode richProject(String uid, Element summary) {
        Element project = first(summary, "Project");
        Element archive = path(project, "ProjectID", "ArchiveID");
        Element descr = first(project, "ProjectDescr");
        String dataType = text(path(project, "ProjectType", "ProjectTypeSubmission", "IntendedDataTypeSet", "DataType"));
        if (dataType.isEmpty()) {
            dataType = attr(path(project, "ProjectType", "ProjectTypeSubmission", "Objectives", "Data"), "data_type");
        }
        Element submission = first(summary, "Submission");
        return projectBlob(uid,
            attr(archive, "accession").toUpperCase(Locale.ROOT),
            childText(descr, "Title"),
            childText(descr, "Description"),
            "",
            dataType,
            attr(submission, "submitted"),
            attr(submission, "last_update"),
            text(path(submission, "Description", "Organization", "Name")));
    }

    private static ObjectNode flatProject(String uid, Element summary) {
        String center = childText(summary, "Submitter_Organization");
        if (center.isEmpty()) {
            Element orgs = first(summary, "Submitter_Organization_List");
            if (orgs != null) {
                for (Element org : elements(orgs, "string")) {
                    if (!org.getTextContent().isBlank()) {
                        center = org.getTextContent().trim();
                        break;
                    }
                }
            }
        }
        return projectBlob(uid,
            childText(summary, "Project_Acc").toUpperCase(Locale.ROOT),
            childText(summary, "Project_Title"),
            childText(summary, "Project_Description"),
            childText(summary, "Organism_Name"),
            childText(summary, "Project_Data_Type"),
            childText(summary, "Registration_Date"),
            "",
            center);
    }

    private static ObjectNode legacyProject(String uid, Element docSum) {
        Map<String, String> items = docSumItems(docSum);
        ObjectNode blob = projectBlob(uid,
            firstOf(items, "Project_Acc", "Accession").toUpperCase(Locale.ROOT),
            firstOf(items, "Project_Title", "Title"),
            firstOf(items, "Project_Description", "Description"),
            firstOf(items, "Organism_Name", "Organism"),
            firstOf(items, "Project_Data_Type", "DataType"),
            firstOf(items, "Submission_Date", "CreateDate"),
            firstOf(items, "Last_Update", "UpdateDate"),
            firstOf(items, "Center_Name", "Center", "Submitter"));
        ObjectNode raw = blob.putObject("esummary_items");
        items.forEach(raw::put);
        return blob;
    }

    private static ObjectNode projectBlob(String uid, String accession, String title, String description,
                                          String organism, String dataType, String submitted,
                                          String lastUpdate, String center) {
        ObjectNode blob = JsonNodeFactory.instance.objectNode();
        blob.put("uid", uid);
        blob.put("accession", accession);
        blob.put("title", title);
        blob.put("description", description);
        blob.put("organism", organism);
        blob.put("data_type", dataType);
        blob.put("submission_date", submitted);
        blob.put("last_update", lastUpdate);
        blob.put("center_name", center);
        ObjectNode ncbi = blob.putObject("ncbi");
        ncbi.put("bioproject_uid", uid);
        ncbi.put("bioproject_url", PROJECT_URL + uid);
        return blob;
    }

    // ---- BioSample ----

    /**
     * Parses a BioSample efetch document: attributes (named by {@code attribute_name}, else
     * {@code harmonized_name}), title and organism.
     *
     * @return the metadata blob, or empty if the document holds no {@code BioSample}
     */
    public static Optional<ObjectNode> parseSampleDetail(String xml) throws MalformedPayloadException {
        Document doc = parseXml(xml);
        failOnErrorElement(doc);
        Element root = doc.getDocumentElement();
        Element sample = "BioSample".equals(root.getTagName()) ? root : first(root, "BioSample");
        if (sample == null) {
            return Optional.empty();
        }
        ObjectNode blob = JsonNodeFactory.instance.objectNode();
        ObjectNode attributes = blob.putObject("attributes");
        for (Element attribute : elements(sample, "Attribute")) {
            String key = attribute.getAttribute("attribute_name").trim();
            if (key.isEmpty()) {
                key = attribute.getAttribute("harmonized_name").trim();
            }
            String value = attribute.getTextContent().trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                attributes.put(key, value);
            }
        }
        String title = text(first(sample, "Title"));
        if (!title.isEmpty()) {
            blob.put("title", title);
        }
        String organism = text(first(sample, "OrganismName"));
        if (organism.isEmpty()) {
            organism = attr(first(sample, "Organism"), "taxonomy_name");
        }
        if (!organism.isEmpty()) {
            blob.put("organism", organism);
        }
        return Optional.of(blob);
    }

    // ---- XML helpers ----

    static Document parseXml(String xml) throws MalformedPayloadException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new MalformedPayloadException("Unparseable XML payload: " + abbreviate(xml), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }

    /**
     * E-utilities reports server-side failures as a top-level {@code ERROR} element with status 200.
     */
    private static void failOnErrorElement(Document doc) throws MalformedPayloadException {
        Element root = doc.getDocumentElement();
        Element error = "ERROR".equals(root.getTagName()) ? root : directChild(root, "ERROR");
        if (error != null && !error.getTextContent().isBlank()) {
            throw new MalformedPayloadException("E-utilities error: " + error.getTextContent().trim());
        }
    }

    private static Map<String, String> docSumItems(Element docSum) {
        Map<String, String> items = new LinkedHashMap<>();
        for (Element item : directChildren(docSum, "Item")) {
            String name = item.getAttribute("Name");
            if (name.isEmpty()) {
                continue;
            }
            List<Element> nested = elements(item, "Item");
            if (nested.isEmpty()) {
                items.put(name, item.getTextContent().trim());
            } else {
                List<String> values = new ArrayList<>();
                for (Element sub : nested) {
                    addIfPresent(values, sub.getTextContent());
                }
                items.put(name, String.join("; ", values));
            }
        }
        return items;
    }

    private static List<Element> elements(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        if (parent == null) {
            return out;
        }
        NodeList nodes = parent.getElementsByTagName(tag);
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add((Element) nodes.item(i));
        }
        return out;
    }

    private static List<Element> directChildren(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && tag.equals(element.getTagName())) {
                out.add(element);
            }
        }
        return out;
    }

    private static Element directChild(Element parent, String tag) {
        List<Element> children = directChildren(parent, tag);
        return children.isEmpty() ? null : children.get(0);
    }

    private static Element first(Element parent, String tag) {
        List<Element> all = elements(parent, tag);
        return all.isEmpty() ? null : all.get(0);
    }

    private static Element path(Element start, String... tags) {
        Element current = start;
        for (String tag : tags) {
            if (current == null) {
                return null;
            }
            current = directChild(current, tag);
        }
        return current;
    }

    private static String childText(Element parent, String tag) {
        return parent == null ? "" : text(directChild(parent, tag));
    }

    private static String text(Element element) {
        return element == null ? "" : element.getTextContent().trim();
    }

    private static String attr(Element element, String name) {
        return element == null ? "" : element.getAttribute(name).trim();
    }

    private static String firstOf(Map<String, String> items, String... keys) {
        for (String key : keys) {
            String value = items.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private static void addIfPresent(List<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.trim());
        }
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "<null>";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= 120 ? flat : flat.substring(0, 120) + "...";
    }
}
