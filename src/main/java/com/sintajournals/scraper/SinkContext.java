package com.sintajournals.scraper;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Run-level facts shared by every sink of one run.
 * @param runTimestamp timestamp used in artifact names, the extraction date and the remote date partition
 * @param source describes where the captures came from (portal URL or input folder)
 * @param config run configuration
 */
public record SinkContext(LocalDateTime runTimestamp, String source, RunConfig config) {

    public SinkContext {
        Objects.requireNonNull(runTimestamp, "runTimestamp");
        Objects.requireNonNull(config, "config");
        source = source == null ? "" : source;
    }

    public String csvFileName() {
        return "journals_data_" + Utils.fileTimestamp(runTimestamp) + ".csv";
    }

    public String jsonFileName() {
        return "journals_data_" + Utils.fileTimestamp(runTimestamp) + ".json";
    }

    public String statisticsFileName() {
        return "extraction_stats_" + Utils.fileTimestamp(runTimestamp) + ".json";
    }
}
