package org.urbanscope.cli.commands.harvest;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.services.HarvestPipeline;
import org.urbanscope.datapipeline.services.HarvestSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.time.LocalDate;

@Command(name = "day", description = "Harvests one calendar day, or every day of an inclusive range (backfill).")
public class HarvestDayCommand extends AbstractHarvestCommand {

    private static final Logger log = LoggerFactory.getLogger(HarvestDayCommand.class);

    @Parameters(index = "0", description = "First day, yyyy-MM-dd")
    private LocalDate from;

    @Parameters(index = "1", arity = "0..1", description = "Last day, yyyy-MM-dd (default: same as first)")
    private LocalDate to;

    @Override
    protected void runBatches(HarvestPipeline pipeline, HarvestSettings settings, Config urbanscope) throws IOException {
        LocalDate last = to != null ? to : from;
        if (last.isBefore(from)) {
            throw new IllegalArgumentException("Last day " + last + " is before first day " + from);
        }
        for (LocalDate day = from; !day.isAfter(last); day = day.plusDays(1)) {
            log.info("Harvesting {}", day);
            pipeline.runBatch(TimeWindow.day(day));
        }
    }
}
