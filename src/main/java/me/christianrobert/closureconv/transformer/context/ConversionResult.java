package me.christianrobert.closureconv.transformer.context;

import me.christianrobert.closureconv.transformer.closure.ClosureShape;
import me.christianrobert.closureconv.transformer.closure.RenameTableDelta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a conversion operation.
 * Contains either the emitted code or an error message, plus the diagnostics collected on the way.
 * Optionally includes the source tree representation for debugging.
 */
public class ConversionResult {

    private final boolean success;
    private final String code;
    private final String errorMessage;
    private final String functionName;
    private final RenameTableDelta renameDelta;
    private final ClosureShape shape;         // null for top-level functions and failures
    private final List<Diagnostic> diagnostics;
    private final String astTree;             // Optional tree representation (null by default)

    private ConversionResult(boolean success,
                             String code,
                             String errorMessage,
                             String functionName,
                             RenameTableDelta renameDelta,
                             ClosureShape shape,
                             List<Diagnostic> diagnostics,
                             String astTree) {
        this.success = success;
        this.code = code;
        this.errorMessage = errorMessage;
        this.functionName = functionName;
        this.renameDelta = renameDelta != null ? renameDelta : RenameTableDelta.EMPTY;
        this.shape = shape;
        this.diagnostics = diagnostics != null
                ? Collections.unmodifiableList(new ArrayList<>(diagnostics))
                : Collections.emptyList();
        this.astTree = astTree;
    }

    /**
     * Creates a successful result.
     */
    public static ConversionResult success(String functionName,
                                           String code,
                                           RenameTableDelta renameDelta,
                                           ClosureShape shape,
                                           List<Diagnostic> diagnostics) {
        return new ConversionResult(true, code, null, functionName, renameDelta, shape, diagnostics, null);
    }

    /**
     * Creates a successful result with the source tree.
     */
    public static ConversionResult successWithAst(String functionName,
                                                  String code,
                                                  RenameTableDelta renameDelta,
                                                  ClosureShape shape,
                                                  List<Diagnostic> diagnostics,
                                                  String astTree) {
        return new ConversionResult(true, code, null, functionName, renameDelta, shape, diagnostics, astTree);
    }

    /**
     * Creates a failed result.
     */
    public static ConversionResult failure(String functionName, String errorMessage) {
        return new ConversionResult(false, null, errorMessage, functionName, null, null, null, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static ConversionResult failure(String functionName, ConversionException exception) {
        return new ConversionResult(false, null, exception.getDetailedMessage(), functionName, null, null, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFunctionName() {
        return functionName;
    }

    public RenameTableDelta getRenameDelta() {
        return renameDelta;
    }

    public ClosureShape getShape() {
        return shape;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "ConversionResult{success=true, function='" + functionName + "'" +
                   (shape != null ? ", shape=" + shape : "") +
                   ", diagnostics=" + diagnostics.size() +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "ConversionResult{success=false, function='" + functionName + "', error='" + errorMessage + "'}";
        }
    }
}
