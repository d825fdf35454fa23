package com.youtubestats;

/**
 * Categories of pipeline failures. The label is what ends up in the
 * {@code _error_type} column of tagged and quarantined records.
 */
public enum ErrorCategory {
    READ_PARSE_ERROR("ReadParseError"),
    MISSING_FIELD("MissingField"),
    TYPE_COERCION_ERROR("TypeCoercionError"),
    MISSING_PARTITION_KEY("MissingPartitionKey"),
    WRITE_ERROR("WriteError");
    
    private final String label;
    
    ErrorCategory(String label) {
        this.label = label;
    }
    
    public String getLabel() {
        return label;
    }
    
    public static ErrorCategory fromLabel(String label) {
        for (ErrorCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + label);
    }
}
