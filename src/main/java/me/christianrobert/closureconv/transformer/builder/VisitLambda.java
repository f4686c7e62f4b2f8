package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.closure.SynthesizedClosure;

import java.util.Collections;

/**
 * Static helper for converting lambdas.
 *
 * <p>A lambda is a one-statement function: {@code lambda x: x + k} is converted exactly like
 * {@code def <name>(x): return x + k}. Its value in the surrounding expression is the wrapper.</p>
 * <pre>
 * scale = lambda x: x * factor     → closure named scale, no further assignment
 * apply(lambda x: x + 1, xs)       → closure named lambda_&lt;n&gt;, passed as lambda_&lt;n&gt;
 * </pre>
 */
public class VisitLambda {

    public static String v(String name, Expr.Lambda node, NativeCodeBuilder b) {
        FunctionFragment fragment = new FunctionFragment(name, node.getParams(),
                Collections.singletonList(new Stmt.Return(node.getBody())));
        SynthesizedClosure closure = b.getSynthesizer().synthesize(fragment, b.getContext(), b);
        return closure.getWrapperId();
    }
}
