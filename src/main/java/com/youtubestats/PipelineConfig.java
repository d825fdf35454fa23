package com.youtubestats;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Job settings. Defaults come from {@code pipeline.properties} on the classpath and
 * command line arguments ({@code --key value} or {@code --key=value}) override them.
 */
public class PipelineConfig {
    
    public static final String DEFAULTS_RESOURCE = "pipeline.properties";
    
    public static final String JOB_NAME = "JOB_NAME";
    public static final String INPUT_PATHS = "input.paths";
    public static final String INPUT_SEPARATOR = "input.separator";
    public static final String INPUT_QUOTE_CHAR = "input.quoteChar";
    public static final String INPUT_ESCAPE_CHAR = "input.escapeChar";
    public static final String INPUT_WITH_HEADER = "input.withHeader";
    public static final String INPUT_RECURSE = "input.recurse";
    public static final String INPUT_MULTI_LINE = "input.multiLine";
    public static final String OUTPUT_PATH = "output.path";
    public static final String OUTPUT_PARTITION_KEY = "output.partitionKey";
    public static final String OUTPUT_COMPRESSION = "output.compression";
    public static final String OUTPUT_WRITE_MODE = "output.writeMode";
    public static final String ERRORS_POLICY = "errors.policy";
    public static final String ERRORS_QUARANTINE_PATH = "errors.quarantinePath";
    public static final String MAPPING_FILE = "mapping.file";
    public static final String SPARK_MASTER = "spark.master";
    public static final String SPARK_APP_NAME = "spark.appName";
    
    private final String jobName;
    private final List<String> inputPaths;
    private final char separator;
    private final char quoteChar;
    private final char escapeChar;
    private final boolean withHeader;
    private final boolean recurse;
    private final boolean multiLine;
    private final String outputPath;
    private final String partitionKey;
    private final String compression;
    private final WriteMode writeMode;
    private final ErrorPolicy errorPolicy;
    private final String quarantinePath;
    private final String mappingFile;
    private final String sparkMaster;
    private final String sparkAppName;
    
    private PipelineConfig(Properties props) {
        this.jobName = required(props, JOB_NAME);
        this.inputPaths = splitPaths(required(props, INPUT_PATHS));
        this.separator = singleChar(props, INPUT_SEPARATOR, ',');
        this.quoteChar = singleChar(props, INPUT_QUOTE_CHAR, '"');
        this.escapeChar = singleChar(props, INPUT_ESCAPE_CHAR, quoteChar);
        this.withHeader = bool(props, INPUT_WITH_HEADER, true);
        this.recurse = bool(props, INPUT_RECURSE, true);
        this.multiLine = bool(props, INPUT_MULTI_LINE, false);
        this.outputPath = required(props, OUTPUT_PATH);
        this.partitionKey = optional(props, OUTPUT_PARTITION_KEY, "region");
        this.compression = optional(props, OUTPUT_COMPRESSION, "snappy");
        this.writeMode = WriteMode.fromName(optional(props, OUTPUT_WRITE_MODE, "errorifexists"));
        // no fallback: strict vs lenient is always an explicit choice
        this.errorPolicy = ErrorPolicy.fromName(props.getProperty(ERRORS_POLICY));
        this.quarantinePath = optional(props, ERRORS_QUARANTINE_PATH, stripTrailingSlash(outputPath) + "_quarantine");
        this.mappingFile = optional(props, MAPPING_FILE, null);
        this.sparkMaster = optional(props, SPARK_MASTER, null);
        this.sparkAppName = optional(props, SPARK_APP_NAME, jobName);
        
        if (stripTrailingSlash(quarantinePath).equals(stripTrailingSlash(outputPath))) {
            throw new IllegalArgumentException("Quarantine path must differ from the output path");
        }
    }
    
    /**
     * Loads classpath defaults and applies {@code args} on top.
     *
     * @throws IllegalArgumentException if an argument is malformed or a required key is missing
     */
    public static PipelineConfig fromArgs(String[] args) {
        Properties props = loadDefaults();
        props.putAll(parseArgs(args));
        return new PipelineConfig(props);
    }
    
    public static PipelineConfig fromProperties(Properties props) {
        return new PipelineConfig(props);
    }
    
    public static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }
    
    static Properties parseArgs(String[] args) {
        Properties props = new Properties();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "', expected --key value");
            }
            String key = arg.substring(2);
            int eq = key.indexOf('=');
            if (eq > 0) {
                props.setProperty(key.substring(0, eq), key.substring(eq + 1));
            } else if (i + 1 < args.length) {
                props.setProperty(key, args[++i]);
            } else {
                throw new IllegalArgumentException("Missing value for --" + key);
            }
        }
        return props;
    }
    
    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing required setting: " + key);
        }
        return value.trim();
    }
    
    private static String optional(Properties props, String key, String fallback) {
        String value = props.getProperty(key);
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }
    
    private static char singleChar(Properties props, String key, char fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        if ("\\t".equals(value)) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException(key + " must be a single character, got '" + value + "'");
        }
        return value.charAt(0);
    }
    
    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = optional(props, key, null);
        if (value == null) {
            return fallback;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }
    
    private static List<String> splitPaths(String value) {
        List<String> paths = new ArrayList<>();
        for (String path : value.split(",")) {
            if (!path.trim().isEmpty()) {
                paths.add(path.trim());
            }
        }
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("Missing required setting: " + INPUT_PATHS);
        }
        return Collections.unmodifiableList(paths);
    }
    
    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
    }
    
    public String getJobName() {
        return jobName;
    }
    
    public List<String> getInputPaths() {
        return inputPaths;
    }
    
    public char getSeparator() {
        return separator;
    }
    
    public char getQuoteChar() {
        return quoteChar;
    }
    
    public char getEscapeChar() {
        return escapeChar;
    }
    
    public boolean isWithHeader() {
        return withHeader;
    }
    
    public boolean isRecurse() {
        return recurse;
    }
    
    public boolean isMultiLine() {
        return multiLine;
    }
    
    public String getOutputPath() {
        return outputPath;
    }
    
    public String getPartitionKey() {
        return partitionKey;
    }
    
    public String getCompression() {
        return compression;
    }
    
    public WriteMode getWriteMode() {
        return writeMode;
    }
    
    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }
    
    public String getQuarantinePath() {
        return quarantinePath;
    }
    
    public String getMappingFile() {
        return mappingFile;
    }
    
    public String getSparkMaster() {
        return sparkMaster;
    }
    
    public String getSparkAppName() {
        return sparkAppName;
    }
    
    @Override
    public String toString() {
        return "PipelineConfig{" +
               "jobName='" + jobName + '\'' +
               ", inputPaths=" + inputPaths +
               ", outputPath='" + outputPath + '\'' +
               ", partitionKey='" + partitionKey + '\'' +
               ", compression='" + compression + '\'' +
               ", writeMode=" + writeMode +
               ", errorPolicy=" + errorPolicy +
               ", quarantinePath='" + quarantinePath + '\'' +
               '}';
    }
}
