package com.youtubestats;

/**
 * A record that is otherwise valid has a null or blank partition key.
 */
public class MissingPartitionKeyException extends PipelineException {
    
    private static final long serialVersionUID = 1L;
    
    public MissingPartitionKeyException(String message) {
        super(ErrorCategory.MISSING_PARTITION_KEY, message);
    }
    
    public MissingPartitionKeyException(String message, Throwable cause) {
        super(ErrorCategory.MISSING_PARTITION_KEY, message, cause);
    }
}
