package com.youtubestats;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the YouTube statistics pipeline.
 * 
 * Usage:
 *   spark-submit --class com.youtubestats.Main app.jar --JOB_NAME <name> [--key value ...]
 * 
 * Example:
 *   java -cp target/classes com.youtubestats.Main --JOB_NAME youtube-raw-to-cleansed
 *       --input.paths data/raw_statistics/ --output.path output/raw_statistics/ --spark.master local[*]
 */
public class Main {
    
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);
    
    public static void main(String[] args) {
        PipelineConfig config;
        try {
            config = PipelineConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.err.println("Usage: Main --JOB_NAME <name> [--input.paths <p1,p2>] [--output.path <path>] [--key value ...]");
            System.exit(2);
            return;
        }
        LOG.info("Starting with {}", config);
        
        SparkSession.Builder builder = SparkSession.builder()
            .appName(config.getSparkAppName())
            .config("spark.sql.adaptive.enabled", "true")
            .config("spark.sql.adaptive.coalescePartitions.enabled", "true");
        if (config.getSparkMaster() != null) {
            builder = builder.master(config.getSparkMaster());
        }
        SparkSession spark = builder.getOrCreate();
        
        int exitCode = 0;
        try {
            TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config);
            pipeline.execute();
        } catch (Exception e) {
            LOG.error("Error executing pipeline {}", config.getJobName(), e);
            exitCode = 1;
        } finally {
            spark.stop();
        }
        System.exit(exitCode);
    }
}
