package org.urbanscope.cli.commands;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.cli.CommandLineInterface;
import org.urbanscope.cli.PipelineAssembler;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.services.export.ExportManifest;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "export",
    description = "Rebuilds the static exports from the catalog without contacting the source."
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        try {
            Config urbanscope = parent.getConfig().getConfig("urbanscope");
            ICacheStore cache = PipelineAssembler.cache(urbanscope);
            IRecordLog recordLog = PipelineAssembler.recordLog(urbanscope);
            cache.load();
            ExportManifest manifest = PipelineAssembler.exportService(urbanscope).rebuild(recordLog, cache);
            log.info("Export finished: {} records in {} parts", manifest.totalRecords(), manifest.parts().size());
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Export failed: {}", e.getMessage());
            log.debug("Export failure cause", e);
            return 1;
        }
    }
}
