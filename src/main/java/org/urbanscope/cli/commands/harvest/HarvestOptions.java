package org.urbanscope.cli.commands.harvest;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.urbanscope.datapipeline.services.HarvestSettings;
import picocli.CommandLine.Option;

/**
 * Options shared by all harvest modes. Unset options keep the configured value.
 */
public class HarvestOptions {

    @Option(names = "--query", description = "Catalog query (default: urbanscope.harvest.query)")
    String query;

    @Option(names = "--limit", description = "Maximum ids per search call (default: urbanscope.harvest.limit)")
    Integer limit;

    @Option(names = "--bioproject", negatable = true, description = "Fetch project metadata for kept records")
    Boolean bioproject;

    @Option(names = "--biosample", negatable = true, description = "Fetch sample metadata for kept records")
    Boolean biosample;

    @Option(names = "--deep-fallback", negatable = true, description = "Allow full-text project resolution")
    Boolean deepFallback;

    @Option(names = "--debug", negatable = true, description = "Write per-batch reports and decision logs")
    Boolean debug;

    @Option(names = "--max-part-bytes", description = "Byte budget of export parts and log segments, e.g. 50MB")
    String maxPartBytes;

    /**
     * Returns {@code urbanscope} with the byte budget override applied.
     */
    Config applyTo(Config urbanscope) {
        if (maxPartBytes == null) {
            return urbanscope;
        }
        return urbanscope
            .withValue("export.maxPartBytes", ConfigValueFactory.fromAnyRef(maxPartBytes))
            .withValue("resources.record-log.options.maxSegmentBytes", ConfigValueFactory.fromAnyRef(maxPartBytes));
    }

    HarvestSettings applyTo(HarvestSettings settings) {
        HarvestSettings result = settings;
        if (query != null) {
            result = result.withQuery(query);
        }
        if (limit != null) {
            result = result.withLimit(limit);
        }
        return result.withFlags(
            bioproject != null ? bioproject : result.fetchBioproject(),
            biosample != null ? biosample : result.fetchBiosample(),
            deepFallback != null ? deepFallback : result.deepFallback(),
            debug != null ? debug : result.debug());
    }
}
