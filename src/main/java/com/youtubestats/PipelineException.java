package com.youtubestats;

/**
 * Base class of every failure raised by the pipeline. Instances are serializable
 * so they survive the trip from a Spark task back to the driver.
 */
public class PipelineException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final ErrorCategory category;
    
    public PipelineException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }
    
    public PipelineException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    /**
     * Rebuilds the typed exception for a record that was tagged on an executor.
     */
    public static PipelineException of(ErrorCategory category, String message) {
        switch (category) {
            case READ_PARSE_ERROR:
                return new ReadParseException(message);
            case MISSING_FIELD:
                return new MissingFieldException(message);
            case TYPE_COERCION_ERROR:
                return new TypeCoercionException(message);
            case MISSING_PARTITION_KEY:
                return new MissingPartitionKeyException(message);
            case WRITE_ERROR:
                return new WriteException(message);
            default:
                return new PipelineException(category, message);
        }
    }
}
