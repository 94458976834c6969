package com.sintajournals.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and error log of one run.
 * <p>
 * Owned by the {@link PipelineOrchestrator} and mutated only from its thread. After
 * {@link #finish()} the instance is read-only and every mutator throws.
 * Local sinks and the HDFS sink are counted separately.
 */
public class RunStatistics {
    private int totalPages;
    private int totalCandidates;
    private int successfulExtractions;
    private int failedExtractions;
    private int sinkSuccesses;
    private int sinkFailures;
    private int hdfsSuccesses;
    private int hdfsFailures;
    private final List<String> errors = new ArrayList<>();
    private boolean finished;

    public void addPages(int count) {
        checkOpen();
        totalPages += count;
    }

    public void recordPage(PageReport report) {
        checkOpen();
        totalCandidates += report.candidateCount();
        successfulExtractions += report.successCount();
        failedExtractions += report.failedCount();
        errors.addAll(report.pageErrors());
    }

    public void recordSinkSuccess(boolean remote) {
        checkOpen();
        if (remote) hdfsSuccesses++; else sinkSuccesses++;
    }

    public void recordSinkFailure(boolean remote, String error) {
        checkOpen();
        if (remote) hdfsFailures++; else sinkFailures++;
        errors.add(error);
    }

    public void addError(String error) {
        checkOpen();
        errors.add(error);
    }

    /**
     * Freezes the statistics. Calling it again has no effect.
     */
    public void finish() {
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Run statistics are finalized");
        }
    }

    public int getTotalPages() { return totalPages; }
    public int getTotalCandidates() { return totalCandidates; }
    public int getSuccessfulExtractions() { return successfulExtractions; }
    public int getFailedExtractions() { return failedExtractions; }
    public int getSinkSuccesses() { return sinkSuccesses; }
    public int getSinkFailures() { return sinkFailures; }
    public int getHdfsSuccesses() { return hdfsSuccesses; }
    public int getHdfsFailures() { return hdfsFailures; }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * @return the {@code statistics} object of the statistics artifact, keys in artifact order
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_pages", totalPages);
        map.put("total_candidates", totalCandidates);
        map.put("successful_extractions", successfulExtractions);
        map.put("failed_extractions", failedExtractions);
        map.put("sink_successes", sinkSuccesses);
        map.put("sink_failures", sinkFailures);
        map.put("hdfs_successes", hdfsSuccesses);
        map.put("hdfs_failures", hdfsFailures);
        map.put("errors", List.copyOf(errors));
        return map;
    }
}
