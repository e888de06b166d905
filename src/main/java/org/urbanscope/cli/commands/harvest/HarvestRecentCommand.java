package org.urbanscope.cli.commands.harvest;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.services.HarvestPipeline;
import org.urbanscope.datapipeline.services.HarvestSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(name = "recent", description = "Harvests runs published within the last N days.")
public class HarvestRecentCommand extends AbstractHarvestCommand {

    @Option(names = {"-d", "--days"}, description = "Window size in days (default: urbanscope.harvest.recentDays)")
    private Integer days;

    @Override
    protected void runBatches(HarvestPipeline pipeline, HarvestSettings settings, Config urbanscope) throws IOException {
        int windowDays = days != null ? days : urbanscope.getInt("harvest.recentDays");
        pipeline.runBatch(TimeWindow.recent(windowDays));
    }
}
