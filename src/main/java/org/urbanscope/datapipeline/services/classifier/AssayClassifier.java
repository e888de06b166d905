package org.urbanscope.datapipeline.services.classifier;

import org.urbanscope.datapipeline.api.contracts.AssayCategory;
import org.urbanscope.datapipeline.api.contracts.ClassificationResult;
import org.urbanscope.datapipeline.api.contracts.Confidence;
import org.urbanscope.datapipeline.api.contracts.RawRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule cascade that labels the assay behind a record. Pure and deterministic.
 * <p>
 * Inputs are the library strategy, source and selection fields plus a text blob made of the
 * title and the sample attributes ({@code key:value} pairs). The first matching rule wins:
 * <ol>
 *   <li>amplicon marker: Amplicon, specialized to 16S or ITS (high)</li>
 *   <li>transcriptome strategy or RNA-seq marker: RNA-seq (high)</li>
 *   <li>shotgun strategy or shotgun/metagenomic marker: WGS (high)</li>
 *   <li>PCR or rRNA selection: Amplicon, specialized to 16S or ITS (medium)</li>
 *   <li>otherwise Unknown (low)</li>
 * </ol>
 */
public class AssayClassifier {

    public static final String FIELD_STRATEGY = "LibraryStrategy";
    public static final String FIELD_SOURCE = "LibrarySource";
    public static final String FIELD_SELECTION = "LibrarySelection";

    private static final Set<String> TRANSCRIPTOME_STRATEGIES = Set.of("rna-seq", "transcriptome");
    private static final Set<String> SHOTGUN_STRATEGIES = Set.of("wgs", "metagenomic");

    /**
     * Classifies a record.
     *
     * @param record           the raw record
     * @param sampleAttributes sample attributes from enrichment, empty if none
     */
    public ClassificationResult classify(RawRecord record, Map<String, String> sampleAttributes) {
        String strategy = TextNormalizer.normalize(record.field(FIELD_STRATEGY));
        String source = TextNormalizer.normalize(record.field(FIELD_SOURCE));
        String selection = TextNormalizer.normalize(record.field(FIELD_SELECTION));
        String attributeText = sampleAttributes.entrySet().stream()
            .map(e -> e.getKey() + ":" + e.getValue())
            .collect(Collectors.joining(" "));
        String blob = String.join(" | ",
            TextNormalizer.normalize(record.title()),
            TextNormalizer.normalize(attributeText),
            strategy, source, selection);
        return classify(strategy, selection, blob);
    }

    ClassificationResult classify(String strategy, String selection, String blob) {
        List<String> rationale = new ArrayList<>();
        List<String> tags = new ArrayList<>();

        if (strategy.contains("amplicon") || blob.contains("amplicon")) {
            rationale.add("amplicon");
            tags.add("amplicon");
            return specializeAmplicon(blob, Confidence.HIGH, tags, rationale);
        }
        if (TRANSCRIPTOME_STRATEGIES.contains(strategy) || blob.contains("rna-seq") || blob.contains("metatranscriptom")) {
            rationale.add("rna-seq/metatranscriptome");
            tags.add("RNA");
            return new ClassificationResult(AssayCategory.RNA_SEQ, tags, Confidence.HIGH, rationale);
        }
        if (SHOTGUN_STRATEGIES.contains(strategy) || blob.contains("shotgun") || blob.contains("wgs")
                || blob.contains("metagenom")) {
            rationale.add("wgs/shotgun/metagenomic");
            tags.add("shotgun");
            return new ClassificationResult(AssayCategory.WGS, tags, Confidence.HIGH, rationale);
        }
        if (selection.contains("pcr") || selection.contains("rrna")) {
            rationale.add("PCR/rRNA selection");
            tags.add("targeted");
            return specializeAmplicon(blob, Confidence.MEDIUM, tags, rationale);
        }
        return ClassificationResult.unknown();
    }

    private static ClassificationResult specializeAmplicon(String blob, Confidence confidence,
                                                           List<String> tags, List<String> rationale) {
        if (blob.contains("16s")) {
            rationale.add("16s");
            tags.add("16S");
            return new ClassificationResult(AssayCategory.SIXTEEN_S, tags, confidence, rationale);
        }
        // substring match, so words containing "its" also count
        if (blob.contains("its")) {
            rationale.add("its");
            tags.add("ITS");
            return new ClassificationResult(AssayCategory.ITS, tags, confidence, rationale);
        }
        return new ClassificationResult(AssayCategory.AMPLICON, tags, confidence, rationale);
    }
}
