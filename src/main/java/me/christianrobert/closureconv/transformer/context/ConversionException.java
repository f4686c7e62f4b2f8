package me.christianrobert.closureconv.transformer.context;

/**
 * Exception thrown when a function cannot be closure-converted.
 * Captures the function and variable involved in the failure.
 */
public class ConversionException extends RuntimeException {

    public enum ErrorKind {
        UNSUPPORTED_CAPTURE,  // captured variable has no single-representation type
        INVALID_FRAGMENT,     // malformed input fragment
        SCOPE_VIOLATION       // scope stack used out of order
    }

    private final ErrorKind kind;
    private final String functionName;
    private final String variableName;

    public ConversionException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ConversionException(ErrorKind kind, String message, String functionName, String variableName) {
        super(message);
        this.kind = kind;
        this.functionName = functionName;
        this.variableName = variableName;
    }

    public ConversionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.functionName = null;
        this.variableName = null;
    }

    public static ConversionException unsupportedCapture(String functionName, String variableName, String detail) {
        return new ConversionException(ErrorKind.UNSUPPORTED_CAPTURE,
                "Cannot capture '" + variableName + "' in closure '" + functionName + "': " + detail,
                functionName, variableName);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getVariableName() {
        return variableName;
    }

    /**
     * Gets a detailed error message including function and variable.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        sb.append("\nKind: ").append(kind);
        if (functionName != null) {
            sb.append("\nFunction: ").append(functionName);
        }
        if (variableName != null) {
            sb.append("\nVariable: ").append(variableName);
        }
        return sb.toString();
    }
}
