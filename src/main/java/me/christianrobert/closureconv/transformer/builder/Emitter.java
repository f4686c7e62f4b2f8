package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.Stmt;

import java.util.List;

/**
 * Text emission surface used by the closure synthesizer.
 *
 * <p>Raw and indented text goes through {@link #emit}/{@link #emitLine}; nested statements
 * and expressions of a closure body are handed back to the implementation, which applies the
 * current renames of the conversion context.</p>
 *
 * <pre>
 * int start = emitter.mark();
 * emitter.emitLine("const x = 1;");
 * String written = emitter.since(start);   // "const x = 1;\n" plus indentation
 * </pre>
 */
public interface Emitter {

    void emit(String text);

    void emitIndent();

    /**
     * Emits indentation, the text and a newline.
     */
    void emitLine(String text);

    void indent();

    void dedent();

    /**
     * Renders an expression under the active renames. Nothing is written.
     */
    String emitExpression(Expr expr);

    /**
     * Writes one statement, including any closures it defines.
     */
    void emitStatement(Stmt stmt);

    default void emitStatements(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            emitStatement(stmt);
        }
    }

    /**
     * Returns the current output position.
     */
    int mark();

    /**
     * Returns everything written since the given mark.
     */
    String since(int mark);
}
