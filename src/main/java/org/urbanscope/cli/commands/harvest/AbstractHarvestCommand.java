package org.urbanscope.cli.commands.harvest;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.cli.PipelineAssembler;
import org.urbanscope.datapipeline.services.HarvestPipeline;
import org.urbanscope.datapipeline.services.HarvestSettings;
import org.urbanscope.datapipeline.services.export.ExportManifest;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Runs the batches of one harvest mode, then publishes. Returns exit code 1 when a batch aborts;
 * batches committed before the abort stay in the catalog and the run report is still written.
 */
abstract class AbstractHarvestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractHarvestCommand.class);

    @ParentCommand
    private HarvestCommand parent;

    @Mixin
    private HarvestOptions options;

    @Override
    public Integer call() {
        Config urbanscope;
        HarvestSettings settings;
        HarvestPipeline pipeline;
        try {
            urbanscope = options.applyTo(parent.getParent().getConfig().getConfig("urbanscope"));
            settings = options.applyTo(HarvestSettings.fromConfig(urbanscope));
            pipeline = PipelineAssembler.harvestPipeline(urbanscope, settings);
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        try {
            pipeline.open();
            runBatches(pipeline, settings, urbanscope);
            ExportManifest manifest = pipeline.publish();
            log.info("Harvest finished: {} batches, {} records in the catalog",
                pipeline.getReports().size(), manifest.totalRecords());
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Harvest aborted: {}", e.getMessage());
            log.debug("Abort cause", e);
            writeReportAfterAbort(pipeline);
            return 1;
        }
    }

    /**
     * Runs the mode's batches against an opened pipeline.
     */
    protected abstract void runBatches(HarvestPipeline pipeline, HarvestSettings settings, Config urbanscope) throws IOException;

    private static void writeReportAfterAbort(HarvestPipeline pipeline) {
        if (pipeline.getReports().isEmpty()) {
            return;
        }
        try {
            pipeline.writeRunReport();
        } catch (IOException e) {
            log.error("Could not write run report: {}", e.getMessage());
        }
    }
}
