package com.youtubestats;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.lit;

/**
 * Writes rejected records as JSON lines so they can be inspected and replayed.
 */
public class QuarantineWriter {
    
    private static final Logger LOG = LoggerFactory.getLogger(QuarantineWriter.class);
    
    private final SparkSession spark;
    private final WriteMode mode;
    
    public QuarantineWriter(SparkSession spark, WriteMode mode) {
        this.spark = spark;
        this.mode = mode;
    }
    
    /**
     * Stages {@code rejected} (as produced by {@link SchemaMapper#rejectedRecords}) under
     * the quarantine path.
     */
    public StagedOutput write(Dataset<Row> rejected, String quarantinePath, String jobName, String runId) {
        StagedOutput staged = StagedOutput.prepare(spark.sparkContext().hadoopConfiguration(), quarantinePath, runId, mode);
        LOG.info("Quarantining rejected records to staging {}", staged.getStagingPath());
        try {
            rejected
                .select(
                    col(SchemaMapper.ERROR_TYPE_COLUMN).alias("error_type"),
                    col(SchemaMapper.ERROR_MESSAGE_COLUMN).alias("error_message"),
                    col(SourceReader.SOURCE_FILE_COLUMN).alias("source_file"),
                    col(SourceReader.RAW_RECORD_COLUMN).alias("raw_record"),
                    lit(jobName).alias("job_name"))
                .write()
                .mode(SaveMode.ErrorIfExists)
                .json(staged.getStagingPath().toString());
        } catch (Exception e) {
            staged.abort();
            throw new WriteException("Writing quarantine to " + quarantinePath + " failed: " + e.getMessage(), e);
        }
        return staged;
    }
}
