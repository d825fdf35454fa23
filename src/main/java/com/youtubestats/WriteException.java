package com.youtubestats;

/**
 * The destination rejected a write, or staged output could not be published.
 */
public class WriteException extends PipelineException {
    
    private static final long serialVersionUID = 1L;
    
    public WriteException(String message) {
        super(ErrorCategory.WRITE_ERROR, message);
    }
    
    public WriteException(String message, Throwable cause) {
        super(ErrorCategory.WRITE_ERROR, message, cause);
    }
}
