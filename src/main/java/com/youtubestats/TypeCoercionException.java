package com.youtubestats;

public class TypeCoercionException extends PipelineException {
    
    private static final long serialVersionUID = 1L;
    
    public TypeCoercionException(String message) {
        super(ErrorCategory.TYPE_COERCION_ERROR, message);
    }
    
    public TypeCoercionException(String message, Throwable cause) {
        super(ErrorCategory.TYPE_COERCION_ERROR, message, cause);
    }
}
