package com.youtubestats;

/**
 * The mapping table references a field the source record does not have.
 */
public class MissingFieldException extends PipelineException {
    
    private static final long serialVersionUID = 1L;
    
    public MissingFieldException(String message) {
        super(ErrorCategory.MISSING_FIELD, message);
    }
    
    public MissingFieldException(String message, Throwable cause) {
        super(ErrorCategory.MISSING_FIELD, message, cause);
    }
}
