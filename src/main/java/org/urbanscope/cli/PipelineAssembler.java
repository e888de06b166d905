package org.urbanscope.cli;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.IDedupLedger;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.services.HarvestPipeline;
import org.urbanscope.datapipeline.services.HarvestSettings;
import org.urbanscope.datapipeline.services.export.ExportService;
import org.urbanscope.datapipeline.services.export.ExportSettings;

import java.time.Clock;

/**
 * Wires configured resources and services together for the commands.
 */
public final class PipelineAssembler {

    private PipelineAssembler() {
    }

    public static HarvestPipeline harvestPipeline(Config urbanscope, HarvestSettings settings) {
        ISourceClient source = ResourceFactory.create("source", ISourceClient.class, urbanscope.getConfig("source"));
        Clock clock = Clock.systemUTC();
        return new HarvestPipeline(settings, source, cache(urbanscope), ledger(urbanscope), recordLog(urbanscope),
            exportService(urbanscope, clock), clock);
    }

    public static ICacheStore cache(Config urbanscope) {
        return ResourceFactory.create("cache", ICacheStore.class, urbanscope.getConfig("resources.cache"));
    }

    public static IDedupLedger ledger(Config urbanscope) {
        return ResourceFactory.create("ledger", IDedupLedger.class, urbanscope.getConfig("resources.ledger"));
    }

    public static IRecordLog recordLog(Config urbanscope) {
        return ResourceFactory.create("record-log", IRecordLog.class, urbanscope.getConfig("resources.record-log"));
    }

    public static ExportService exportService(Config urbanscope) {
        return exportService(urbanscope, Clock.systemUTC());
    }

    private static ExportService exportService(Config urbanscope, Clock clock) {
        return new ExportService(ExportSettings.fromConfig(urbanscope), clock);
    }
}
