package io.github.drompincen.sprintplanner.runtime.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "planner.sync")
public class SyncProperties {

    /** Epics whose children are fetched concurrently before pausing. */
    private int epicBatchSize = 10;

    private Duration epicBatchPause = Duration.ofMillis(200);

    /** Wall-clock budget for one epics-with-children import. */
    private Duration aggregationTimeout = Duration.ofMinutes(5);

    public int getEpicBatchSize() { return epicBatchSize; }
    public void setEpicBatchSize(int epicBatchSize) { this.epicBatchSize = epicBatchSize; }

    public Duration getEpicBatchPause() { return epicBatchPause; }
    public void setEpicBatchPause(Duration epicBatchPause) { this.epicBatchPause = epicBatchPause; }

    public Duration getAggregationTimeout() { return aggregationTimeout; }
    public void setAggregationTimeout(Duration aggregationTimeout) { this.aggregationTimeout = aggregationTimeout; }
}
