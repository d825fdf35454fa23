package com.youtubestats;

/**
 * A source row could not be parsed, or the source itself could not be read.
 */
public class ReadParseException extends PipelineException {
    
    private static final long serialVersionUID = 1L;
    
    public ReadParseException(String message) {
        super(ErrorCategory.READ_PARSE_ERROR, message);
    }
    
    public ReadParseException(String message, Throwable cause) {
        super(ErrorCategory.READ_PARSE_ERROR, message, cause);
    }
}
