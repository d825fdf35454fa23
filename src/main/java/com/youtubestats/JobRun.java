package com.youtubestats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Bookkeeping for a single run: the job name (lineage only), the current stage and the
 * outputs staged so far. {@link #commit()} is the only step that makes output visible.
 */
public class JobRun {
    
    private static final Logger LOG = LoggerFactory.getLogger(JobRun.class);
    
    private final String jobName;
    private final String runId;
    private final List<StagedOutput> stagedOutputs = new ArrayList<>();
    private JobState state = JobState.INITIALIZED;
    private String transformationContext;
    
    private JobRun(String jobName, String runId) {
        this.jobName = jobName;
        this.runId = runId;
    }
    
    public static JobRun init(String jobName) {
        if (jobName == null || jobName.trim().isEmpty()) {
            throw new IllegalArgumentException("Job name is required");
        }
        JobRun run = new JobRun(jobName.trim(), UUID.randomUUID().toString().replace("-", ""));
        LOG.info("Initialized job {} (run {})", run.jobName, run.runId);
        return run;
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
    
    public String getTransformationContext() {
        return transformationContext;
    }
    
    /**
     * Moves to the next stage and records the stage's transformation context label.
     *
     * @throws IllegalStateException if {@code next} does not directly follow the current state
     */
    public void enter(JobState next, String transformationContext) {
        if (next == JobState.COMMITTED || next == JobState.FAILED) {
            throw new IllegalStateException("Use commit() or fail() to finish a run");
        }
        moveTo(next);
        this.transformationContext = transformationContext;
        LOG.info("Job {} entered {} [{}]", jobName, next, transformationContext);
    }
    
    public void stage(StagedOutput output) {
        if (state != JobState.WRITING) {
            throw new IllegalStateException("Output can only be staged while WRITING, job is " + state);
        }
        stagedOutputs.add(output);
    }
    
    /**
     * Publishes every staged output in registration order and finishes the run. The
     * outputs become final together: if one cannot be published, those already published
     * are taken back, everything staged is discarded and the run fails.
     */
    public void commit() {
        if (state != JobState.WRITING) {
            throw new IllegalStateException("Cannot commit job " + jobName + " in state " + state);
        }
        LOG.info("Job {} finished processing, publishing {} staged output(s)", jobName, stagedOutputs.size());
        List<StagedOutput> published = new ArrayList<>();
        try {
            for (StagedOutput output : stagedOutputs) {
                output.publish();
                published.add(output);
            }
        } catch (RuntimeException e) {
            Collections.reverse(published);
            for (StagedOutput output : published) {
                output.rollback();
            }
            fail(e);
            throw e;
        }
        for (StagedOutput output : stagedOutputs) {
            output.finish();
        }
        moveTo(JobState.COMMITTED);
        LOG.info("Job {} committed", jobName);
    }
    
    /**
     * Discards staged output and marks the run failed. A no-op once the run has ended.
     */
    public void fail(Throwable cause) {
        if (state.isTerminal()) {
            return;
        }
        LOG.error("Job {} failed during {}: {}", jobName, state, cause.getMessage());
        for (StagedOutput output : stagedOutputs) {
            output.abort();
        }
        moveTo(JobState.FAILED);
    }
    
    private void moveTo(JobState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        state = next;
    }
}
