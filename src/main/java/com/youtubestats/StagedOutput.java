package com.youtubestats;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Output written to a staging directory beside its destination. Nothing is visible at
 * the destination until it is published with a rename. A published output can be taken
 * back until {@link #finish()}, so several outputs can be published together.
 */
public class StagedOutput {
    
    private static final Logger LOG = LoggerFactory.getLogger(StagedOutput.class);
    
    private enum Phase { STAGED, PUBLISHED, DONE }
    
    private final FileSystem fs;
    private final Path stagingPath;
    private final Path backupPath;
    private final Path destination;
    private final WriteMode mode;
    private Phase phase = Phase.STAGED;
    
    StagedOutput(FileSystem fs, Path stagingPath, Path backupPath, Path destination, WriteMode mode) {
        this.fs = fs;
        this.stagingPath = stagingPath;
        this.backupPath = backupPath;
        this.destination = destination;
        this.mode = mode;
    }
    
    /**
     * Reserves {@code <parent>/_staging_<name>_<runId>} for {@code destination}. Spark and
     * Hive readers skip directories starting with an underscore.
     *
     * @throws WriteException if the destination exists and the mode does not allow replacing it
     */
    public static StagedOutput prepare(Configuration hadoopConf, String destination, String runId, WriteMode mode) {
        try {
            Path target = new Path(destination);
            FileSystem fs = target.getFileSystem(hadoopConf);
            Path qualified = fs.makeQualified(target);
            if (qualified.getParent() == null) {
                throw new WriteException("Destination " + qualified + " has no parent directory to stage in");
            }
            if (mode == WriteMode.ERROR_IF_EXISTS && fs.exists(qualified)) {
                throw new WriteException("Destination " + qualified + " already exists");
            }
            Path staging = new Path(qualified.getParent(), "_staging_" + qualified.getName() + "_" + runId);
            Path backup = new Path(qualified.getParent(), "_previous_" + qualified.getName() + "_" + runId);
            if (fs.exists(staging)) {
                fs.delete(staging, true);
            }
            return new StagedOutput(fs, staging, backup, qualified, mode);
        } catch (IOException e) {
            throw new WriteException("Cannot prepare staging for " + destination + ": " + e.getMessage(), e);
        }
    }
    
    public Path getStagingPath() {
        return stagingPath;
    }
    
    /**
     * Publishes this output on its own and makes it final.
     *
     * @throws WriteException if the destination cannot be replaced or the rename is refused
     */
    public void commit() {
        publish();
        finish();
    }
    
    /**
     * Renames the staged directory to the destination. Output being replaced is moved
     * aside, not deleted, until {@link #finish()}.
     */
    void publish() {
        if (phase != Phase.STAGED) {
            throw new IllegalStateException("Output for " + destination + " was already published or aborted");
        }
        try {
            if (!fs.exists(stagingPath)) {
                throw new WriteException("Nothing staged at " + stagingPath);
            }
            if (fs.exists(destination)) {
                if (mode != WriteMode.OVERWRITE) {
                    throw new WriteException("Destination " + destination + " already exists");
                }
                LOG.warn("Replacing existing output at {}", destination);
                if (fs.exists(backupPath)) {
                    fs.delete(backupPath, true);
                }
                if (!fs.rename(destination, backupPath)) {
                    throw new WriteException("Could not move existing output at " + destination + " aside");
                }
            }
            fs.mkdirs(destination.getParent());
            if (!fs.rename(stagingPath, destination)) {
                restorePrevious();
                throw new WriteException("Rename of " + stagingPath + " to " + destination + " was refused");
            }
            phase = Phase.PUBLISHED;
            LOG.info("Published {}", destination);
        } catch (IOException e) {
            throw new WriteException("Publishing " + destination + " failed: " + e.getMessage(), e);
        }
    }
    
    /**
     * Undoes {@link #publish()}: the output goes back to staging and replaced output is
     * restored. Does nothing unless the output is published.
     */
    void rollback() {
        if (phase != Phase.PUBLISHED) {
            return;
        }
        phase = Phase.STAGED;
        try {
            if (!fs.rename(destination, stagingPath)) {
                LOG.error("Could not take back published output {}", destination);
                return;
            }
            restorePrevious();
            LOG.info("Rolled back {}", destination);
        } catch (IOException e) {
            LOG.error("Could not take back published output {}", destination, e);
        }
    }
    
    private void restorePrevious() throws IOException {
        if (fs.exists(backupPath) && !fs.rename(backupPath, destination)) {
            LOG.error("Could not restore previous output {} from {}", destination, backupPath);
        }
    }
    
    /**
     * Makes a published output final by dropping the output it replaced.
     */
    void finish() {
        if (phase != Phase.PUBLISHED) {
            throw new IllegalStateException("Output for " + destination + " is not published");
        }
        phase = Phase.DONE;
        try {
            if (fs.exists(backupPath)) {
                fs.delete(backupPath, true);
            }
        } catch (IOException e) {
            LOG.warn("Could not delete replaced output {}", backupPath, e);
        }
    }
    
    /**
     * Drops whatever was staged, taking back a publish that was not finished. Safe to
     * call more than once.
     */
    public void abort() {
        if (phase == Phase.DONE) {
            return;
        }
        rollback();
        phase = Phase.DONE;
        try {
            if (fs.exists(stagingPath)) {
                fs.delete(stagingPath, true);
                LOG.info("Discarded staged output {}", stagingPath);
            }
        } catch (IOException e) {
            LOG.error("Could not clean up staged output {}", stagingPath, e);
        }
    }
}
