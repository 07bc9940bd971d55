package com.aqlcomposer.query;

/**
 * Exception thrown when a query descriptor cannot be built or compiled into AQL.
 * Carries the error category and, when known, the scope variable being rendered.
 */
public class AqlCompilationException extends RuntimeException {

    private final CompilationErrorType errorType;
    private final String scope;

    public AqlCompilationException(String message, CompilationErrorType errorType) {
        super(message);
        this.errorType = errorType;
        this.scope = null;
    }

    public AqlCompilationException(String message, CompilationErrorType errorType, String scope) {
        super(message);
        this.errorType = errorType;
        this.scope = scope;
    }

    public AqlCompilationException(String message, CompilationErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.scope = null;
    }

    public AqlCompilationException(String message, CompilationErrorType errorType, String scope, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.scope = scope;
    }

    public CompilationErrorType getErrorType() {
        return errorType;
    }

    public String getScope() {
        return scope;
    }

    /**
     * Message without the type and scope details
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (errorType != null) {
            sb.append(" [Type: ").append(errorType).append("]");
        }
        if (scope != null) {
            sb.append(" [Scope: ").append(scope).append("]");
        }
        return sb.toString();
    }
}
