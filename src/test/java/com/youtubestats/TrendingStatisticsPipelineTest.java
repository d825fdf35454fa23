package com.youtubestats;

import org.apache.spark.sql.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TrendingStatisticsPipeline
 */
public class TrendingStatisticsPipelineTest {
    
    private static SparkSession spark;
    
    @TempDir
    Path tempDir;
    
    private Path inputDir;
    private Path outputDir;
    
    @BeforeAll
    public static void setUpSpark() {
        // Disable security for local testing (avoids Java 17+ Subject.getSubject() issues)
        System.setProperty("java.security.auth.login.config", "NONE");
        System.setProperty("hadoop.security.authentication", "simple");
        
        spark = SparkSession.builder()
            .appName("TrendingStatisticsPipelineTest")
            .master("local[2]")
            .config("spark.driver.host", "localhost")
            .config("spark.driver.bindAddress", "127.0.0.1")
            .config("spark.hadoop.fs.defaultFS", "file:///")
            .config("spark.sql.shuffle.partitions", "2")
            .getOrCreate();
    }
    
    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }
    
    @BeforeEach
    public void setUp() throws Exception {
        inputDir = Files.createDirectories(tempDir.resolve("raw_statistics_data"));
        outputDir = tempDir.resolve("raw_statistics");
    }
    
    private static final String REFERENCE_ROW = "\"abc123\",\"18.01.01\",\"Title\",\"Chan\",\"10\",\"2018-01-01T00:00:00Z\","
        + "\"tag1|tag2\",\"1000\",\"50\",\"2\",\"5\",\"http://x\",\"False\",\"False\",\"desc\",\"US\"";
    
    private static String row(String videoId, String views, String commentsDisabled, String region) {
        return String.join(",", videoId, "18.14.01", "\"Title, with comma\"", "Channel", "24",
            "2018-01-13T17:00:00.000Z", "tag", views, "10", "1", "3", "https://i.ytimg.com/vi/" + videoId + "/default.jpg",
            commentsDisabled, "False", "\"Line one, line two\"", region);
    }
    
    private void writeInput(String name, String... rows) throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add(SampleDataGenerator.HEADER);
        lines.addAll(Arrays.asList(rows));
        Files.write(inputDir.resolve(name), lines, StandardCharsets.UTF_8);
    }
    
    private PipelineConfig config(String policy, Path output) {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.JOB_NAME, "youtube-raw-to-cleansed-test");
        props.setProperty(PipelineConfig.INPUT_PATHS, inputDir.toString());
        props.setProperty(PipelineConfig.OUTPUT_PATH, output.toString());
        props.setProperty(PipelineConfig.ERRORS_POLICY, policy);
        return PipelineConfig.fromProperties(props);
    }
    
    private List<String> partitionDirectories(Path output) throws Exception {
        try (Stream<Path> entries = Files.list(output)) {
            return entries.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        }
    }
    
    private List<String> stagingLeftovers() throws Exception {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.map(p -> p.getFileName().toString())
                .filter(name -> name.startsWith("_staging_"))
                .collect(Collectors.toList());
        }
    }
    
    @Test
    public void testExecute_ReferenceRowEndToEnd() throws Exception {
        writeInput("a.csv", REFERENCE_ROW);
        
        PipelineResult result = new TrendingStatisticsPipeline(spark, config("strict", outputDir)).execute();
        
        assertEquals(JobState.COMMITTED, result.getState());
        assertEquals(1, result.getRecordsRead());
        assertEquals(1, result.getRecordsWritten());
        assertEquals(0, result.getRecordsQuarantined());
        assertEquals(Arrays.asList("US"), result.getPartitionValues());
        assertEquals(Arrays.asList("region=US"), partitionDirectories(outputDir));
        
        Row row = spark.read().parquet(outputDir.toString()).first();
        assertEquals("abc123", row.getAs("video_id"));
        assertEquals("18.01.01", row.getAs("trending_date"));
        assertEquals("Title", row.getAs("title"));
        assertEquals("Chan", row.getAs("channel_title"));
        assertEquals(10L, row.getLong(row.fieldIndex("category_id")));
        assertEquals("2018-01-01T00:00:00Z", row.getAs("publish_time"));
        assertEquals("tag1|tag2", row.getAs("tags"));
        assertEquals(1000L, row.getLong(row.fieldIndex("views")));
        assertEquals(50L, row.getLong(row.fieldIndex("likes")));
        assertEquals(2L, row.getLong(row.fieldIndex("dislikes")));
        assertEquals(5L, row.getLong(row.fieldIndex("comment_count")));
        assertEquals("http://x", row.getAs("thumbnail_link"));
        assertFalse(row.getBoolean(row.fieldIndex("comments_disabled")));
        assertFalse(row.getBoolean(row.fieldIndex("ratings_disabled")));
        assertEquals("desc", row.getAs("description"));
        assertEquals("US", row.getAs("region"));
        
        assertTrue(stagingLeftovers().isEmpty());
        assertFalse(Files.exists(tempDir.resolve("raw_statistics_quarantine")));
    }
    
    @Test
    public void testExecute_RoundTripRecoversTypedValues() throws Exception {
        writeInput("a.csv",
            row("v1", "9223372036854775807", "True", "US"),
            row("v2", "0", "false", "GB"),
            row("v3", "42", "FALSE", "US"));
        
        new TrendingStatisticsPipeline(spark, config("strict", outputDir)).execute();
        
        Dataset<Row> back = spark.read().parquet(outputDir.toString());
        assertEquals(MappingTable.youtubeStatistics().outputSchema().apply("views").dataType(),
            back.schema().apply("views").dataType());
        List<Row> rows = back.orderBy("video_id").collectAsList();
        assertEquals(3, rows.size());
        assertEquals(Long.MAX_VALUE, rows.get(0).getLong(rows.get(0).fieldIndex("views")));
        assertTrue(rows.get(0).getBoolean(rows.get(0).fieldIndex("comments_disabled")));
        assertEquals("Title, with comma", rows.get(0).getAs("title"));
        assertEquals("Line one, line two", rows.get(0).getAs("description"));
        assertEquals(0L, rows.get(1).getLong(rows.get(1).fieldIndex("views")));
        assertFalse(rows.get(2).getBoolean(rows.get(2).fieldIndex("comments_disabled")));
    }
    
    @Test
    public void testExecute_PartitionPathMatchesRegion() throws Exception {
        writeInput("a.csv",
            row("v1", "1", "False", "US"),
            row("v2", "2", "False", "GB"),
            row("v3", "3", "False", "US"),
            row("v4", "4", "False", "IN"));
        
        new TrendingStatisticsPipeline(spark, config("strict", outputDir)).execute();
        
        assertEquals(Arrays.asList("region=GB", "region=IN", "region=US"), partitionDirectories(outputDir));
        Dataset<Row> withPath = spark.read().parquet(outputDir.toString())
            .withColumn("file", functions.input_file_name());
        for (Row row : withPath.collectAsList()) {
            String file = row.getAs("file");
            assertTrue(file.contains("/region=" + row.getAs("region") + "/"),
                row.getAs("video_id") + " stored in " + file);
        }
        // no sub-path mixes regions
        assertEquals(2, spark.read().parquet(outputDir.resolve("region=US").toString()).count());
        assertEquals(1, spark.read().parquet(outputDir.resolve("region=GB").toString()).count());
    }
    
    @Test
    public void testExecute_IsDeterministic() throws Exception {
        writeInput("a.csv",
            row("v1", "1", "False", "US"),
            row("v2", "2", "True", "GB"),
            row("v3", "3", "False", "CA"));
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        
        new TrendingStatisticsPipeline(spark, config("strict", first)).execute();
        new TrendingStatisticsPipeline(spark, config("strict", second)).execute();
        
        assertEquals(partitionDirectories(first), partitionDirectories(second));
        List<String> firstRows = spark.read().parquet(first.toString()).orderBy("video_id").collectAsList()
            .stream().map(Row::toString).collect(Collectors.toList());
        List<String> secondRows = spark.read().parquet(second.toString()).orderBy("video_id").collectAsList()
            .stream().map(Row::toString).collect(Collectors.toList());
        assertEquals(firstRows, secondRows);
    }
    
    @Test
    public void testStrict_EmptyViewsAbortsWithoutOutput() throws Exception {
        writeInput("a.csv", row("v1", "1", "False", "US"), row("v2", "", "False", "US"));
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("strict", outputDir));
        
        TypeCoercionException e = assertThrows(TypeCoercionException.class, pipeline::execute);
        
        assertTrue(e.getMessage().contains("views"));
        assertFalse(Files.exists(outputDir));
        assertTrue(stagingLeftovers().isEmpty());
    }
    
    @Test
    public void testStrict_EmptyRegionAbortsWithoutOutput() throws Exception {
        writeInput("a.csv", row("v1", "1", "False", "US"), row("v2", "2", "False", ""));
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("strict", outputDir));
        
        assertThrows(MissingPartitionKeyException.class, pipeline::execute);
        assertFalse(Files.exists(outputDir));
    }
    
    @Test
    public void testStrict_MalformedRowAborts() throws Exception {
        writeInput("a.csv", row("v1", "1", "False", "US"), "v2,18.14.01,short row");
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("strict", outputDir));
        
        ReadParseException e = assertThrows(ReadParseException.class, pipeline::execute);
        assertTrue(e.getMessage().contains("short row"));
        assertFalse(Files.exists(outputDir));
    }
    
    @Test
    public void testStrict_UnterminatedQuoteAborts() throws Exception {
        String openQuote = row("v2", "2", "False", "\"US");
        writeInput("a.csv", row("v1", "1", "False", "US"), openQuote);
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("strict", outputDir));
        
        ReadParseException e = assertThrows(ReadParseException.class, pipeline::execute);
        assertTrue(e.getMessage().contains(openQuote));
        assertFalse(Files.exists(outputDir));
    }
    
    @Test
    public void testHeadersInDifferentOrder_ValuesFollowTheirNames() throws Exception {
        writeInput("a.csv", row("v1", "1", "False", "US"));
        // same columns, title and channel_title swapped
        String swappedHeader = SampleDataGenerator.HEADER.replace("title,channel_title", "channel_title,title");
        Files.write(inputDir.resolve("b.csv"), Arrays.asList(swappedHeader,
            String.join(",", "v2", "18.14.01", "ChannelB", "TitleB", "24", "2018-01-13T17:00:00.000Z", "tag",
                "2", "10", "1", "3", "http://x", "False", "False", "desc", "GB")), StandardCharsets.UTF_8);
        
        new TrendingStatisticsPipeline(spark, config("strict", outputDir)).execute();
        
        List<Row> rows = spark.read().parquet(outputDir.toString())
            .select("video_id", "title", "channel_title").orderBy("video_id").collectAsList();
        assertEquals(2, rows.size());
        assertEquals("Title, with comma", rows.get(0).getString(1));
        assertEquals("Channel", rows.get(0).getString(2));
        assertEquals("TitleB", rows.get(1).getString(1));
        assertEquals("ChannelB", rows.get(1).getString(2));
    }
    
    @Test
    public void testStrict_MissingColumnAborts() throws Exception {
        Files.write(inputDir.resolve("a.csv"), Arrays.asList("video_id,views", "v1,10"), StandardCharsets.UTF_8);
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("strict", outputDir));
        
        assertThrows(MissingFieldException.class, pipeline::execute);
        assertFalse(Files.exists(outputDir));
    }
    
    @Test
    public void testLenient_QuarantinesRejectsAndPublishesTheRest() throws Exception {
        writeInput("a.csv",
            row("v1", "1", "False", "US"),
            row("v2", "", "False", "US"),
            row("v3", "3", "maybe", "GB"),
            row("v4", "4", "True", ""),
            row("v5", "5", "True", "GB"));
        
        PipelineResult result = new TrendingStatisticsPipeline(spark, config("lenient", outputDir)).execute();
        
        assertEquals(5, result.getRecordsRead());
        assertEquals(2, result.getRecordsWritten());
        assertEquals(3, result.getRecordsQuarantined());
        assertEquals(Arrays.asList("GB", "US"), result.getPartitionValues());
        assertEquals(2, spark.read().parquet(outputDir.toString()).count());
        // no catch-all bucket for the record without a region
        assertEquals(Arrays.asList("region=GB", "region=US"), partitionDirectories(outputDir));
        
        Dataset<Row> quarantine = spark.read().json(tempDir.resolve("raw_statistics_quarantine").toString());
        List<Row> rejects = quarantine.orderBy("raw_record").collectAsList();
        assertEquals(3, rejects.size());
        assertEquals("TypeCoercionError", rejects.get(0).getAs("error_type"));
        // the source line exactly as read, quoting included
        assertEquals(row("v2", "", "False", "US"), rejects.get(0).getAs("raw_record"));
        assertEquals("TypeCoercionError", rejects.get(1).getAs("error_type"));
        assertTrue(rejects.get(1).<String>getAs("raw_record").startsWith("v3,"));
        assertEquals("MissingPartitionKey", rejects.get(2).getAs("error_type"));
        assertEquals(row("v4", "4", "True", ""), rejects.get(2).getAs("raw_record"));
        assertEquals("youtube-raw-to-cleansed-test", rejects.get(2).getAs("job_name"));
        assertTrue(rejects.get(2).<String>getAs("source_file").endsWith("a.csv"));
    }
    
    @Test
    public void testWriteError_LeavesNothingBehind() throws Exception {
        writeInput("a.csv", row("v1", "1", "False", "US"), row("v2", "", "False", "US"));
        Files.createDirectories(outputDir.resolve("region=US"));
        TrendingStatisticsPipeline pipeline = new TrendingStatisticsPipeline(spark, config("lenient", outputDir));
        
        assertThrows(WriteException.class, pipeline::execute);
        
        // the quarantine was staged before the write failed and must be gone as well
        assertFalse(Files.exists(tempDir.resolve("raw_statistics_quarantine")));
        assertTrue(stagingLeftovers().isEmpty());
        try (Stream<Path> entries = Files.list(outputDir.resolve("region=US"))) {
            assertEquals(0, entries.count(), "existing destination is untouched");
        }
    }
    
    @Test
    public void testPartitionKeyMustBeMapped() {
        MappingTable noRegion = MappingTable.of(FieldMapping.of("video_id", "string", "video_id", "string"));
        assertThrows(IllegalArgumentException.class,
            () -> new TrendingStatisticsPipeline(spark, config("strict", outputDir), noRegion));
    }
}
