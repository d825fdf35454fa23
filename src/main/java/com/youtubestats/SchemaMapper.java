package com.youtubestats;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.catalyst.expressions.GenericRowWithSchema;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.apache.spark.sql.functions.col;

/**
 * Renames and casts text records according to a {@link MappingTable}.
 */
public class SchemaMapper implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    public static final String ERROR_TYPE_COLUMN = "_error_type";
    public static final String ERROR_MESSAGE_COLUMN = "_error_message";
    
    private final MappingTable mappingTable;
    private final StructType outputSchema;
    
    public SchemaMapper(MappingTable mappingTable) {
        this.mappingTable = mappingTable;
        this.outputSchema = mappingTable.outputSchema();
    }
    
    public StructType getOutputSchema() {
        return outputSchema;
    }
    
    /**
     * Maps one record. Either every destination field is produced or an exception is thrown.
     *
     * @param record source field name to raw text
     * @return row in {@link #getOutputSchema()}
     * @throws MissingFieldException if a mapped source field is absent from the record
     * @throws TypeCoercionException if a value does not parse as its destination type
     */
    public Row map(Map<String, String> record) {
        return new GenericRowWithSchema(coerce(record), outputSchema);
    }
    
    private Object[] coerce(Map<String, String> record) {
        List<FieldMapping> mappings = mappingTable.getMappings();
        Object[] values = new Object[mappings.size()];
        for (int i = 0; i < values.length; i++) {
            FieldMapping mapping = mappings.get(i);
            String source = mapping.getSourceField();
            if (!record.containsKey(source)) {
                throw new MissingFieldException("Source record has no field '" + source + "'");
            }
            values[i] = mapping.getDestinationType().coerce(source, record.get(source));
        }
        return values;
    }
    
    /**
     * Output columns followed by the error tag columns.
     */
    public StructType taggedSchema() {
        return outputSchema
            .add(ERROR_TYPE_COLUMN, DataTypes.StringType, true)
            .add(ERROR_MESSAGE_COLUMN, DataTypes.StringType, true)
            .add(SourceReader.SOURCE_FILE_COLUMN, DataTypes.StringType, true)
            .add(SourceReader.RAW_RECORD_COLUMN, DataTypes.StringType, true);
    }
    
    /**
     * Maps every row of {@code raw}. Rows that fail keep only their error tag, source file
     * and source line; rows that succeed have null error columns.
     *
     * @throws MissingFieldException if the source has no column for a mapped field at all
     */
    public Dataset<Row> apply(Dataset<Row> raw) {
        String[] columnNames = raw.columns();
        List<String> available = Arrays.asList(columnNames);
        for (String field : mappingTable.sourceFields()) {
            if (!available.contains(field)) {
                throw new MissingFieldException("Source has no column '" + field + "', found " + available);
            }
        }
        
        JavaRDD<Row> tagged = raw.javaRDD().map(row -> tag(row, columnNames));
        return raw.sparkSession().createDataFrame(tagged, taggedSchema());
    }
    
    Row tag(Row row, String[] columnNames) {
        Map<String, String> record = new LinkedHashMap<>();
        String corrupt = null;
        String sourceFile = null;
        String rawRecord = null;
        for (int i = 0; i < columnNames.length; i++) {
            String value = row.isNullAt(i) ? null : row.get(i).toString();
            if (SourceReader.CORRUPT_RECORD_COLUMN.equals(columnNames[i])) {
                corrupt = value;
            } else if (SourceReader.SOURCE_FILE_COLUMN.equals(columnNames[i])) {
                sourceFile = value;
            } else if (SourceReader.RAW_RECORD_COLUMN.equals(columnNames[i])) {
                rawRecord = value;
            } else {
                record.put(columnNames[i], value);
            }
        }
        
        if (corrupt != null) {
            return rejected(ErrorCategory.READ_PARSE_ERROR, "Malformed source row", sourceFile,
                rawRecord != null ? rawRecord : corrupt);
        }
        try {
            Object[] values = Arrays.copyOf(coerce(record), mappingTable.size() + 4);
            // kept for records that are rejected later on, e.g. for a blank partition key
            values[values.length - 2] = sourceFile;
            values[values.length - 1] = rawRecord;
            return RowFactory.create(values);
        } catch (PipelineException e) {
            return rejected(e.getCategory(), e.getMessage(), sourceFile, rawRecord);
        }
    }
    
    private Row rejected(ErrorCategory category, String message, String sourceFile, String rawRecord) {
        Object[] values = new Object[mappingTable.size() + 4];
        values[values.length - 4] = category.getLabel();
        values[values.length - 3] = message;
        values[values.length - 2] = sourceFile;
        values[values.length - 1] = rawRecord;
        return RowFactory.create(values);
    }
    
    /**
     * Mapped records that passed every check, in the output schema.
     */
    public Dataset<Row> validRecords(Dataset<Row> tagged) {
        return tagged.filter(col(ERROR_TYPE_COLUMN).isNull()).select(outputColumns());
    }
    
    public Dataset<Row> rejectedRecords(Dataset<Row> tagged) {
        return tagged.filter(col(ERROR_TYPE_COLUMN).isNotNull())
            .select(col(ERROR_TYPE_COLUMN), col(ERROR_MESSAGE_COLUMN), col(SourceReader.SOURCE_FILE_COLUMN), col(SourceReader.RAW_RECORD_COLUMN));
    }
    
    private Column[] outputColumns() {
        List<String> fields = mappingTable.destinationFields();
        Column[] columns = new Column[fields.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = col(fields.get(i));
        }
        return columns;
    }
}
