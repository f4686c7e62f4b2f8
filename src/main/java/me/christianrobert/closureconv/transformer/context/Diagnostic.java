package me.christianrobert.closureconv.transformer.context;

import java.util.Objects;

/**
 * Non-fatal finding recorded during conversion.
 */
public class Diagnostic {

    public enum Severity {
        INFO,
        WARNING
    }

    public enum Kind {
        ANALYSIS_LIMITATION,  // return type could not be inferred
        NAME_COLLISION        // wrapper identifier disambiguated
    }

    private final Severity severity;
    private final Kind kind;
    private final String functionName;
    private final String message;

    public Diagnostic(Severity severity, Kind kind, String functionName, String message) {
        this.severity = severity;
        this.kind = kind;
        this.functionName = functionName;
        this.message = message;
    }

    public static Diagnostic analysisLimitation(String functionName, String message) {
        return new Diagnostic(Severity.WARNING, Kind.ANALYSIS_LIMITATION, functionName, message);
    }

    public static Diagnostic nameCollision(String functionName, String message) {
        return new Diagnostic(Severity.INFO, Kind.NAME_COLLISION, functionName, message);
    }

    public Severity getSeverity() {
        return severity;
    }

    public Kind getKind() {
        return kind;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity &&
                kind == that.kind &&
                Objects.equals(functionName, that.functionName) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, kind, functionName, message);
    }

    @Override
    public String toString() {
        return severity + " " + kind + " [" + functionName + "]: " + message;
    }
}
