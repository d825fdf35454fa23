package com.youtubestats;

import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of field mappings. Order fixes the column order of the output schema.
 */
public final class MappingTable implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    // source:type -> destination:type
    private static final Pattern LINE = Pattern.compile(
        "^\\s*([^:\\s]+)\\s*:\\s*(\\w+)\\s*->\\s*([^:\\s]+)\\s*:\\s*(\\w+)\\s*$");
    
    private final List<FieldMapping> mappings;
    
    private MappingTable(List<FieldMapping> mappings) {
        if (mappings.isEmpty()) {
            throw new IllegalArgumentException("Mapping table must have at least one entry");
        }
        Set<String> destinations = new HashSet<>();
        for (FieldMapping mapping : mappings) {
            if (!destinations.add(mapping.getDestinationField())) {
                throw new IllegalArgumentException(
                    "Duplicate destination field in mapping table: " + mapping.getDestinationField());
            }
        }
        this.mappings = Collections.unmodifiableList(new ArrayList<>(mappings));
    }
    
    public static MappingTable of(List<FieldMapping> mappings) {
        return new MappingTable(mappings);
    }
    
    public static MappingTable of(FieldMapping... mappings) {
        return new MappingTable(Arrays.asList(mappings));
    }
    
    /**
     * The trending statistics table: names are kept, counters become bigint and
     * the two flags become boolean.
     */
    public static MappingTable youtubeStatistics() {
        return of(
            FieldMapping.of("video_id", "string", "video_id", "string"),
            FieldMapping.of("trending_date", "string", "trending_date", "string"),
            FieldMapping.of("title", "string", "title", "string"),
            FieldMapping.of("channel_title", "string", "channel_title", "string"),
            FieldMapping.of("category_id", "string", "category_id", "bigint"),
            FieldMapping.of("publish_time", "string", "publish_time", "string"),
            FieldMapping.of("tags", "string", "tags", "string"),
            FieldMapping.of("views", "string", "views", "bigint"),
            FieldMapping.of("likes", "string", "likes", "bigint"),
            FieldMapping.of("dislikes", "string", "dislikes", "bigint"),
            FieldMapping.of("comment_count", "string", "comment_count", "bigint"),
            FieldMapping.of("thumbnail_link", "string", "thumbnail_link", "string"),
            FieldMapping.of("comments_disabled", "string", "comments_disabled", "boolean"),
            FieldMapping.of("ratings_disabled", "string", "ratings_disabled", "boolean"),
            FieldMapping.of("description", "string", "description", "string"),
            FieldMapping.of("region", "string", "region", "string")
        );
    }
    
    /**
     * Parses lines of the form {@code views:string -> views:bigint}. Blank lines and
     * lines starting with {@code #} are skipped.
     */
    public static MappingTable parse(List<String> lines) {
        List<FieldMapping> mappings = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = LINE.matcher(trimmed);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid mapping on line " + lineNumber + ": " + line);
            }
            mappings.add(FieldMapping.of(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)));
        }
        return of(mappings);
    }
    
    public static MappingTable load(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }
    
    public List<FieldMapping> getMappings() {
        return mappings;
    }
    
    public int size() {
        return mappings.size();
    }
    
    public List<String> sourceFields() {
        List<String> fields = new ArrayList<>(mappings.size());
        for (FieldMapping mapping : mappings) {
            fields.add(mapping.getSourceField());
        }
        return fields;
    }
    
    public List<String> destinationFields() {
        List<String> fields = new ArrayList<>(mappings.size());
        for (FieldMapping mapping : mappings) {
            fields.add(mapping.getDestinationField());
        }
        return fields;
    }
    
    public boolean hasDestination(String field) {
        return destinationFields().contains(field);
    }
    
    /**
     * Schema of mapped records. Columns are nullable since string passthrough keeps nulls.
     */
    public StructType outputSchema() {
        StructField[] fields = new StructField[mappings.size()];
        for (int i = 0; i < fields.length; i++) {
            FieldMapping mapping = mappings.get(i);
            fields[i] = DataTypes.createStructField(
                mapping.getDestinationField(), mapping.getDestinationType().getSparkType(), true);
        }
        return DataTypes.createStructType(fields);
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof MappingTable && mappings.equals(((MappingTable) o).mappings);
    }
    
    @Override
    public int hashCode() {
        return mappings.hashCode();
    }
    
    @Override
    public String toString() {
        return "MappingTable" + mappings;
    }
}
