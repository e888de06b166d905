package org.urbanscope.cli.commands.harvest;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.services.HarvestPipeline;
import org.urbanscope.datapipeline.services.HarvestSettings;
import org.urbanscope.datapipeline.services.reporting.RunReport;
import org.urbanscope.datapipeline.services.reporting.RunReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(name = "crawl", description = "Pages through the whole result set until a short page or the page limit.")
public class HarvestCrawlCommand extends AbstractHarvestCommand {

    private static final Logger log = LoggerFactory.getLogger(HarvestCrawlCommand.class);

    @Option(names = "--start", defaultValue = "0", description = "Offset of the first page (default: ${DEFAULT-VALUE})")
    private int start;

    @Option(names = "--max-pages", defaultValue = "10", description = "Maximum pages to fetch (default: ${DEFAULT-VALUE})")
    private int maxPages;

    @Override
    protected void runBatches(HarvestPipeline pipeline, HarvestSettings settings, Config urbanscope) throws IOException {
        int offset = start;
        for (int page = 0; page < maxPages; page++) {
            RunReport report = pipeline.runBatch(TimeWindow.page(offset));
            long returned = report.counter(RunReporter.RAW_INPUT);
            if (returned < settings.limit()) {
                log.info("Crawl reached the end of the result set at offset {}", offset + returned);
                return;
            }
            offset += settings.limit();
        }
        log.info("Crawl stopped after {} pages at offset {}", maxPages, offset);
    }
}
