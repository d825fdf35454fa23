package com.youtubestats;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * Writes typed records as Parquet, one sub-directory per partition key value
 * ({@code <base>/<key>=<value>/part-*.parquet}), through a staging directory.
 */
public class PartitionedWriter {
    
    private static final Logger LOG = LoggerFactory.getLogger(PartitionedWriter.class);
    
    private final SparkSession spark;
    private final String partitionKey;
    private final String compression;
    private final WriteMode mode;
    
    public PartitionedWriter(SparkSession spark, String partitionKey, String compression, WriteMode mode) {
        this.spark = spark;
        this.partitionKey = partitionKey;
        this.compression = compression;
        this.mode = mode;
    }
    
    /**
     * Tags records that are otherwise valid but have a null or blank partition key.
     * Records already tagged keep their first error.
     */
    public static Dataset<Row> partitionKeyViolations(Dataset<Row> tagged, String partitionKey) {
        Column violation = col(SchemaMapper.ERROR_TYPE_COLUMN).isNull().and(blank(col(partitionKey)));
        return tagged
            .withColumn(SchemaMapper.ERROR_MESSAGE_COLUMN,
                when(violation, lit("Partition key '" + partitionKey + "' is null or empty"))
                .otherwise(col(SchemaMapper.ERROR_MESSAGE_COLUMN)))
            .withColumn(SchemaMapper.ERROR_TYPE_COLUMN,
                when(violation, lit(ErrorCategory.MISSING_PARTITION_KEY.getLabel()))
                .otherwise(col(SchemaMapper.ERROR_TYPE_COLUMN)));
    }
    
    private static Column blank(Column column) {
        return column.isNull().or(trim(column).equalTo(""));
    }
    
    /**
     * Writes {@code records} into a staging directory for {@code destination}. The caller
     * publishes it with {@link StagedOutput#commit()} once the whole run has succeeded.
     *
     * @throws MissingPartitionKeyException if any record has a null or blank partition key
     * @throws WriteException if the storage layer rejects the write
     */
    public StagedOutput write(Dataset<Row> records, String destination, String runId) {
        if (!Arrays.asList(records.columns()).contains(partitionKey)) {
            throw new IllegalArgumentException("Partition key '" + partitionKey + "' is not a column of the output");
        }
        List<Row> missing = records.filter(blank(col(partitionKey))).limit(1).collectAsList();
        if (!missing.isEmpty()) {
            throw new MissingPartitionKeyException(
                "Partition key '" + partitionKey + "' is null or empty for record " + missing.get(0));
        }
        
        StagedOutput staged = StagedOutput.prepare(spark.sparkContext().hadoopConfiguration(), destination, runId, mode);
        LOG.info("Writing parquet ({}) partitioned by {} to staging {}", compression, partitionKey, staged.getStagingPath());
        try {
            records.write()
                .mode(SaveMode.ErrorIfExists)
                .partitionBy(partitionKey)
                .option("compression", compression)
                .parquet(staged.getStagingPath().toString());
        } catch (Exception e) {
            staged.abort();
            throw new WriteException("Writing to " + destination + " failed: " + e.getMessage(), e);
        }
        return staged;
    }
    
    /**
     * Distinct partition key values in {@code records}, sorted.
     */
    public List<String> partitionValues(Dataset<Row> records) {
        List<String> values = new ArrayList<>();
        for (Row row : records.select(col(partitionKey)).distinct().orderBy(col(partitionKey)).collectAsList()) {
            values.add(row.isNullAt(0) ? null : row.get(0).toString());
        }
        return values;
    }
}
