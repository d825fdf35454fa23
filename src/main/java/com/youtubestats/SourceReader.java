package com.youtubestats;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.CompressionCodecFactory;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.DataFrameReader;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Encoders;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.apache.spark.sql.functions.*;

/**
 * Reads delimited text files into string-only records. Field names come from each
 * file's own header row, so files may order their columns differently. Malformed rows
 * are kept and flagged in {@link #CORRUPT_RECORD_COLUMN} so the caller decides whether
 * they abort the run; every row also carries its source line in {@link #RAW_RECORD_COLUMN}.
 */
public class SourceReader {
    
    public static final String CORRUPT_RECORD_COLUMN = "_corrupt_record";
    public static final String SOURCE_FILE_COLUMN = "_source_file";
    public static final String RAW_RECORD_COLUMN = "_raw_record";
    
    private static final Logger LOG = LoggerFactory.getLogger(SourceReader.class);
    
    private static final String LINE_COLUMN = "value";
    private static final String PARSED_COLUMN = "_parsed";
    
    private final SparkSession spark;
    private final char separator;
    private final char quoteChar;
    private final char escapeChar;
    private final boolean withHeader;
    private final boolean recurse;
    private final boolean multiLine;
    
    public SourceReader(SparkSession spark, char separator, char quoteChar, char escapeChar,
                        boolean withHeader, boolean recurse, boolean multiLine) {
        this.spark = spark;
        this.separator = separator;
        this.quoteChar = quoteChar;
        this.escapeChar = escapeChar;
        this.withHeader = withHeader;
        this.recurse = recurse;
        this.multiLine = multiLine;
    }
    
    public static SourceReader fromConfig(SparkSession spark, PipelineConfig config) {
        return new SourceReader(spark, config.getSeparator(), config.getQuoteChar(), config.getEscapeChar(),
            config.isWithHeader(), config.isRecurse(), config.isMultiLine());
    }
    
    /**
     * Builds the lazy record set for every file under {@code paths}. Each action on the
     * returned dataset re-reads the input, so it can be evaluated more than once.
     *
     * @throws ReadParseException if the paths cannot be listed, have no readable header,
     *         or hold files whose headers name different columns
     */
    public Dataset<Row> read(List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new ReadParseException("No input paths configured");
        }
        Map<String, List<String>> filesByFirstLine = groupByFirstLine(listFiles(paths));
    
        String[] columns = null;
        String columnsFrom = null;
        Dataset<Row> records = null;
        for (Map.Entry<String, List<String>> group : filesByFirstLine.entrySet()) {
            List<String> files = group.getValue();
            String[] groupColumns = columnsOf(group.getKey());
            if (columns == null) {
                columns = groupColumns;
                columnsFrom = files.get(0);
            } else if (!new HashSet<>(Arrays.asList(columns)).equals(new HashSet<>(Arrays.asList(groupColumns)))) {
                throw new ReadParseException("Header of " + files.get(0) + " has columns " + Arrays.toString(groupColumns)
                    + " but " + columnsFrom + " has " + Arrays.toString(columns));
            }
            Dataset<Row> part;
            try {
                part = multiLine ? readMultiLine(files, groupColumns) : readLines(files, group.getKey(), groupColumns);
            } catch (Exception e) {
                throw new ReadParseException("Cannot read source " + files + ": " + e.getMessage(), e);
            }
            part = part.select(outputColumns(columns));
            records = records == null ? part : records.union(part);
        }
        LOG.info("Reading {} ({} header variant(s)) with columns {}",
            paths, filesByFirstLine.size(), Arrays.toString(columns));
        return records;
    }
    
    private List<String> listFiles(List<String> paths) {
        Configuration conf = spark.sparkContext().hadoopConfiguration();
        List<String> files = new ArrayList<>();
        try {
            for (String location : paths) {
                Path path = new Path(location);
                FileSystem fs = path.getFileSystem(conf);
                FileStatus[] matches = fs.globStatus(path);
                if (matches == null || matches.length == 0) {
                    throw new ReadParseException("Input path does not exist: " + location);
                }
                for (FileStatus match : matches) {
                    collectFiles(fs, match, true, files);
                }
            }
        } catch (IOException e) {
            throw new ReadParseException("Cannot list input " + paths + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) {
            throw new ReadParseException("No input files found under " + paths);
        }
        Collections.sort(files);
        return files;
    }
    
    private void collectFiles(FileSystem fs, FileStatus status, boolean top, List<String> files) throws IOException {
        if (!top && isHidden(status.getPath())) {
            return;
        }
        if (status.isFile()) {
            files.add(status.getPath().toString());
        } else if (top || recurse) {
            for (FileStatus child : fs.listStatus(status.getPath())) {
                if (child.isFile() || recurse) {
                    collectFiles(fs, child, false, files);
                }
            }
        }
    }
    
    // same rule Spark uses for staging and metadata files
    private static boolean isHidden(Path path) {
        String name = path.getName();
        return name.startsWith("_") || name.startsWith(".");
    }
    
    /**
     * Files keyed by their first line. With a header that line is the header, so each
     * key is one column layout; without a header all files share one key.
     */
    private Map<String, List<String>> groupByFirstLine(List<String> files) {
        Configuration conf = spark.sparkContext().hadoopConfiguration();
        CompressionCodecFactory codecs = new CompressionCodecFactory(conf);
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String file : files) {
            String firstLine = firstLine(conf, codecs, new Path(file));
            if (firstLine == null) {
                LOG.warn("Skipping empty input file {}", file);
                continue;
            }
            String key = withHeader || groups.isEmpty() ? firstLine : groups.keySet().iterator().next();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(file);
        }
        if (groups.isEmpty()) {
            throw new ReadParseException("Input " + files + " has no readable header");
        }
        return groups;
    }
    
    private static String firstLine(Configuration conf, CompressionCodecFactory codecs, Path path) {
        CompressionCodec codec = codecs.getCodec(path);
        try {
            FileSystem fs = path.getFileSystem(conf);
            try (InputStream in = codec == null ? fs.open(path) : codec.createInputStream(fs.open(path));
                 BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return reader.readLine();
            }
        } catch (IOException e) {
            throw new ReadParseException("Cannot read header of " + path + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Column names as {@code firstLine} declares them (or Spark's positional
     * {@code _c0, _c1, ...} names when the files carry no header).
     */
    private String[] columnsOf(String firstLine) {
        String[] columns;
        try {
            Dataset<String> line = spark.createDataset(Collections.singletonList(firstLine), Encoders.STRING());
            columns = baseReader().csv(line).columns();
        } catch (Exception e) {
            throw new ReadParseException("Cannot parse header '" + firstLine + "': " + e.getMessage(), e);
        }
        if (columns.length == 0) {
            throw new ReadParseException("Header '" + firstLine + "' has no columns");
        }
        return columns;
    }
    
    /**
     * One record per line. Each line is parsed on its own, so quoting that is still open
     * at the end of the line is reported instead of being closed silently.
     */
    private Dataset<Row> readLines(List<String> files, String headerLine, String[] columns) {
        Column line = col(LINE_COLUMN);
        Dataset<Row> lines = spark.read().text(files.toArray(new String[0]))
            .withColumn(SOURCE_FILE_COLUMN, input_file_name())
            .filter(length(trim(line)).gt(0));
        if (withHeader) {
            lines = lines.filter(line.notEqual(lit(headerLine)));
        }
    
        Map<String, String> options = formatOptions();
        options.put("mode", "PERMISSIVE");
        options.put("columnNameOfCorruptRecord", CORRUPT_RECORD_COLUMN);
        Dataset<Row> parsed = lines.select(
            from_csv(line, withCorruptRecord(columns),
                scala.collection.JavaConverters.mapAsScalaMap(options)
                    .toMap(scala.Predef.<scala.Tuple2<String, String>>$conforms())).alias(PARSED_COLUMN),
            col(SOURCE_FILE_COLUMN),
            line.alias(RAW_RECORD_COLUMN));
    
        List<Column> selected = new ArrayList<>();
        for (String column : columns) {
            selected.add(col(PARSED_COLUMN).getField(column).alias(column));
        }
        selected.add(when(unbalancedQuotes(col(RAW_RECORD_COLUMN)), col(RAW_RECORD_COLUMN))
            .otherwise(col(PARSED_COLUMN).getField(CORRUPT_RECORD_COLUMN))
            .alias(CORRUPT_RECORD_COLUMN));
        selected.add(col(SOURCE_FILE_COLUMN));
        selected.add(col(RAW_RECORD_COLUMN));
        return parsed.select(selected.toArray(new Column[0]));
    }
    
    /**
     * Odd number of quote characters once escaped quotes are removed.
     */
    private Column unbalancedQuotes(Column line) {
        String quote = String.valueOf(quoteChar);
        Column unescaped = escapeChar == quoteChar
            ? line
            : regexp_replace(line, Pattern.quote(escapeChar + quote), "");
        Column quotes = length(unescaped).minus(length(regexp_replace(unescaped, Pattern.quote(quote), "")));
        return quotes.mod(2).equalTo(1);
    }
    
    /**
     * Records may span lines inside quotes. The raw record is the parsed row written
     * back with the same separator and quoting.
     */
    private Dataset<Row> readMultiLine(List<String> files, String[] columns) {
        Dataset<Row> parsed = baseReader()
            .schema(withCorruptRecord(columns))
            .option("mode", "PERMISSIVE")
            .option("columnNameOfCorruptRecord", CORRUPT_RECORD_COLUMN)
            .csv(files.toArray(new String[0]))
            .withColumn(SOURCE_FILE_COLUMN, input_file_name());
        Column rendered = to_csv(struct(dataColumns(columns)), formatOptions());
        return parsed.withColumn(RAW_RECORD_COLUMN, coalesce(col(CORRUPT_RECORD_COLUMN), rendered));
    }
    
    private static StructType withCorruptRecord(String[] columns) {
        StructType schema = new StructType();
        for (String column : columns) {
            schema = schema.add(column, DataTypes.StringType, true);
        }
        return schema.add(CORRUPT_RECORD_COLUMN, DataTypes.StringType, true);
    }
    
    private static Column[] dataColumns(String[] columns) {
        Column[] selected = new Column[columns.length];
        for (int i = 0; i < columns.length; i++) {
            selected[i] = col(columns[i]);
        }
        return selected;
    }
    
    private static Column[] outputColumns(String[] columns) {
        List<Column> selected = new ArrayList<>(Arrays.asList(dataColumns(columns)));
        selected.add(col(CORRUPT_RECORD_COLUMN));
        selected.add(col(SOURCE_FILE_COLUMN));
        selected.add(col(RAW_RECORD_COLUMN));
        return selected.toArray(new Column[0]);
    }
    
    private Map<String, String> formatOptions() {
        Map<String, String> options = new HashMap<>();
        options.put("sep", String.valueOf(separator));
        options.put("quote", String.valueOf(quoteChar));
        options.put("escape", String.valueOf(escapeChar));
        return options;
    }
    
    private DataFrameReader baseReader() {
        return spark.read()
            .options(formatOptions())
            .option("header", String.valueOf(withHeader))
            .option("inferSchema", "false")
            .option("multiLine", String.valueOf(multiLine));
    }
}
