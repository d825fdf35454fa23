package com.youtubestats;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main pipeline class for YouTube trending statistics.
 * Reads raw CSV, maps it to the typed schema and publishes region-partitioned Parquet.
 */
public class TrendingStatisticsPipeline {
    
    private static final Logger LOG = LoggerFactory.getLogger(TrendingStatisticsPipeline.class);
    
    static final String READ_CONTEXT = "raw_data_node1";
    static final String MAPPING_CONTEXT = "apply_mapping_node2";
    static final String WRITE_CONTEXT = "transformed_data_node3";
    
    private PipelineConfig config;
    private SourceReader sourceReader;
    private SchemaMapper schemaMapper;
    private PartitionedWriter writer;
    private QuarantineWriter quarantineWriter;
    
    public TrendingStatisticsPipeline(SparkSession spark, PipelineConfig config) {
        this(spark, config, mappingTableFor(config));
    }
    
    public TrendingStatisticsPipeline(SparkSession spark, PipelineConfig config, MappingTable mappingTable) {
        if (!mappingTable.hasDestination(config.getPartitionKey())) {
            throw new IllegalArgumentException(
                "Partition key '" + config.getPartitionKey() + "' is not produced by the mapping table");
        }
        this.config = config;
        this.sourceReader = SourceReader.fromConfig(spark, config);
        this.schemaMapper = new SchemaMapper(mappingTable);
        this.writer = new PartitionedWriter(spark, config.getPartitionKey(), config.getCompression(), config.getWriteMode());
        this.quarantineWriter = new QuarantineWriter(spark, config.getWriteMode());
    }
    
    private static MappingTable mappingTableFor(PipelineConfig config) {
        if (config.getMappingFile() == null) {
            return MappingTable.youtubeStatistics();
        }
        try {
            return MappingTable.load(Paths.get(config.getMappingFile()));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read mapping file " + config.getMappingFile(), e);
        }
    }
    
    /**
     * Runs Reading, Mapping and Writing, then commits. Nothing is published unless every
     * stage succeeds.
     *
     * @throws PipelineException on data-quality errors in strict mode, or on any write error
     */
    public PipelineResult execute() {
        JobRun run = JobRun.init(config.getJobName());
        MDC.put("jobName", run.getJobName());
        Dataset<Row> tagged = null;
        try {
            // Step 1: Reading
            run.enter(JobState.READING, READ_CONTEXT);
            Dataset<Row> raw = sourceReader.read(config.getInputPaths());
            
            // Step 2: Mapping
            run.enter(JobState.MAPPING, MAPPING_CONTEXT);
            tagged = PartitionedWriter.partitionKeyViolations(schemaMapper.apply(raw), config.getPartitionKey());
            tagged.cache();
            Dataset<Row> valid = schemaMapper.validRecords(tagged);
            Dataset<Row> rejected = schemaMapper.rejectedRecords(tagged);
            
            long recordsRead = tagged.count();
            long rejectedCount = rejected.count();
            LOG.info("Read {} records, {} rejected", recordsRead, rejectedCount);
            if (rejectedCount > 0) {
                applyErrorPolicy(rejected, rejectedCount);
            }
            long validCount = recordsRead - rejectedCount;
            
            // Step 3: Writing
            run.enter(JobState.WRITING, WRITE_CONTEXT);
            if (rejectedCount > 0) {
                run.stage(quarantineWriter.write(rejected, config.getQuarantinePath(), run.getJobName(), run.getRunId()));
            }
            run.stage(writer.write(valid, config.getOutputPath(), run.getRunId()));
            List<String> partitions = writer.partitionValues(valid);
            LOG.info("Staged {} records across partitions {}", validCount, partitions);
            
            run.commit();
            PipelineResult result = new PipelineResult(run.getJobName(), run.getRunId(), run.getState(),
                recordsRead, validCount, rejectedCount, partitions);
            LOG.info("Pipeline completed: {}", result);
            return result;
        } catch (RuntimeException e) {
            run.fail(e);
            throw e;
        } finally {
            if (tagged != null) {
                tagged.unpersist();
            }
            MDC.remove("jobName");
        }
    }
    
    private void applyErrorPolicy(Dataset<Row> rejected, long rejectedCount) {
        if (config.getErrorPolicy() == ErrorPolicy.LENIENT) {
            LOG.warn("Quarantining {} rejected records to {}", rejectedCount, config.getQuarantinePath());
            return;
        }
        Row first = rejected.limit(1).collectAsList().get(0);
        ErrorCategory category = ErrorCategory.fromLabel(first.getString(0));
        throw PipelineException.of(category, first.getString(1)
            + " (" + rejectedCount + " rejected record(s); first from " + first.getString(2)
            + ": " + first.getString(3) + ")");
    }
}
