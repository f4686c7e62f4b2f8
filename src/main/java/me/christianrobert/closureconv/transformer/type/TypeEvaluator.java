package me.christianrobert.closureconv.transformer.type;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.context.ConversionContext;

import java.util.Optional;

/**
 * Type inference oracle consulted during closure conversion.
 * <p>
 * The closure converter never infers types itself; it asks this interface for the return type
 * of a function and for the type of an expression in the current scope.
 * </p>
 * <ul>
 *   <li><strong>Simple:</strong> {@link SimpleTypeEvaluator} - local rules over a
 *       {@link TypeInferenceTable} and the variables declared in the context</li>
 *   <li><strong>External:</strong> a whole-program inference pass can plug in here without
 *       changing any conversion code</li>
 * </ul>
 *
 * @see SimpleTypeEvaluator
 */
public interface TypeEvaluator {

    /**
     * Returns the inferred return type of the named function, or empty if inference failed.
     * A function that never returns a value yields {@link TypeInfo#NONE}.
     *
     * @param functionName Source name of the function
     * @return Inferred return type, empty when unknown
     */
    Optional<TypeInfo> inferredReturnType(String functionName);

    /**
     * Evaluates the type of an expression in the given conversion context.
     *
     * @param expr    Expression to evaluate
     * @param context Current scope state (declared variables and their types)
     * @return The type of the expression, or {@link TypeInfo#UNKNOWN} if it cannot be determined
     */
    TypeInfo inferredExpressionType(Expr expr, ConversionContext context);
}
