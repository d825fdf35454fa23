package com.youtubestats;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a committed run.
 */
public class PipelineResult {
    
    private final String jobName;
    private final String runId;
    private final JobState state;
    private final long recordsRead;
    private final long recordsWritten;
    private final long recordsQuarantined;
    private final List<String> partitionValues;
    
    public PipelineResult(String jobName, String runId, JobState state, long recordsRead,
                          long recordsWritten, long recordsQuarantined, List<String> partitionValues) {
        this.jobName = jobName;
        this.runId = runId;
        this.state = state;
        this.recordsRead = recordsRead;
        this.recordsWritten = recordsWritten;
        this.recordsQuarantined = recordsQuarantined;
        this.partitionValues = Collections.unmodifiableList(partitionValues);
    }
    
    public String getJobName() {
        return jobName;
    }
    
    public String getRunId() {
        return runId;
    }
    
    public JobState getState() {
        return state;
    }
    
    public long getRecordsRead() {
        return recordsRead;
    }
    
    public long getRecordsWritten() {
        return recordsWritten;
    }
    
    public long getRecordsQuarantined() {
        return recordsQuarantined;
    }
    
    public List<String> getPartitionValues() {
        return partitionValues;
    }
    
    @Override
    public String toString() {
        return "PipelineResult{" +
               "jobName='" + jobName + '\'' +
               ", runId='" + runId + '\'' +
               ", state=" + state +
               ", recordsRead=" + recordsRead +
               ", recordsWritten=" + recordsWritten +
               ", recordsQuarantined=" + recordsQuarantined +
               ", partitionValues=" + partitionValues +
               '}';
    }
}
