package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.analysis.EffectAnalyzer;
import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.closure.ClosureSynthesizer;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Static helper for emitting calls.
 *
 * <h3>Call shapes:</h3>
 * <pre>
 * adder(1)        → adder.call(1)               converted closure (any shape)
 * fact(n - 1)     → try call((__p_n_0 - 1))      self-call inside a recursive closure
 * fact(k)         → try fact.call(__p_k_2)       same call from a function nested in fact
 * Point(1, 2)     → Point.init(1, 2)             class constructor
 * len(items)      → runtime.len(items)           builtin not shadowed by a local
 * f(a, k=1)       → f(a, .{ .k = 1 })            keywords as a trailing struct literal
 * obj.method(a)   → obj.method(a)
 * </pre>
 *
 * <p>{@code try} is added when the called closure can fail. A method that mutates its
 * receiver ({@code items.append(x)}) marks the receiver's binding mutable.</p>
 */
public class VisitCall {

    private static final Set<String> BUILTINS = Set.of(
            "print", "len", "range", "str", "int", "float", "bool", "abs", "min", "max",
            "sum", "sorted", "reversed", "enumerate", "zip", "list", "dict", "set", "tuple",
            "isinstance", "repr", "ord", "chr", "any", "all", "map", "filter", "hash");

    public static String v(Expr.Call node, NativeCodeBuilder b) {
        ConversionContext context = b.getContext();
        String args = arguments(node, b);
        String callee = node.getCalleeName();

        if (callee == null) {
            if (node.getFunc() instanceof Expr.Attribute) {
                Expr.Attribute method = (Expr.Attribute) node.getFunc();
                if (EffectAnalyzer.isMutatingMethod(method.getAttr())) {
                    b.markMutated(method.getValue());
                }
            }
            return b.emitExpression(node.getFunc()) + "(" + args + ")";
        }

        VariableBinding closure = b.closureBinding(callee);
        if (closure != null) {
            String prefix = closure.isFallible() ? "try " : "";
            String resolved = context.resolveName(callee);
            if (ClosureSynthesizer.SELF_HANDLE.equals(resolved)) {
                return prefix + resolved + "(" + args + ")";
            }
            return prefix + resolved + ".call(" + args + ")";
        }

        if (!context.isDeclared(callee)) {
            TypeInfo type = context.getTypeEvaluator().inferredExpressionType(node, context);
            if (type.isClassInstance() && callee.equals(type.getClassName())) {
                return callee + ".init(" + args + ")";
            }
            if (BUILTINS.contains(callee)) {
                return "runtime." + callee + "(" + args + ")";
            }
        }

        return context.resolveName(callee) + "(" + args + ")";
    }

    private static String arguments(Expr.Call node, NativeCodeBuilder b) {
        List<String> args = b.emitExpressions(node.getArgs());
        if (!node.getKeywords().isEmpty()) {
            List<String> fields = new ArrayList<>();
            for (Expr.Keyword keyword : node.getKeywords()) {
                String value = b.emitExpression(keyword.getValue());
                if (keyword.getName() == null) {
                    fields.add("runtime.spread(" + value + ")");
                } else {
                    fields.add("." + keyword.getName() + " = " + value);
                }
            }
            args.add(".{ " + String.join(", ", fields) + " }");
        }
        return String.join(", ", args);
    }
}
