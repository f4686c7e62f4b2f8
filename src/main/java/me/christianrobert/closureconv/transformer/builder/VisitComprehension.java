package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ScopeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for emitting comprehensions as labeled block expressions.
 *
 * <pre>
 * [x * 2 for x in xs if x]
 *   → comp_3: { var __comp_3 = runtime.PyList.init(); for (xs) |x| { if (x) { try __comp_3.append((x * 2)); } } break :comp_3 __comp_3; }
 * </pre>
 *
 * <p>Generator targets live in their own frame. Destructuring targets bind each name to an
 * element of the loop item.</p>
 */
public class VisitComprehension {

    public static String v(Expr.Comprehension node, NativeCodeBuilder b) {
        ConversionContext context = b.getContext();
        int id = context.nextUniqueId();
        String label = "comp_" + id;
        String acc = "__comp_" + id;

        StringBuilder out = new StringBuilder();
        out.append(label).append(": { var ").append(acc).append(" = ").append(initializer(node.getKind())).append("; ");

        List<Expr.Generator> generators = node.getGenerators();
        int opened = 0;

        // The first iterable is evaluated outside the comprehension's frame
        String firstIter = generators.isEmpty() ? "" : b.emitExpression(generators.get(0).getIter());

        context.pushScope(ScopeKind.BLOCK, "comprehension:" + id);
        try {
            for (int i = 0; i < generators.size(); i++) {
                Expr.Generator generator = generators.get(i);
                String iter = i == 0 ? firstIter : b.emitExpression(generator.getIter());
                out.append("for (").append(iter).append(") |").append(bindTarget(generator.getTarget(), context)).append("| { ");
                opened++;
                if (!generator.getIfs().isEmpty()) {
                    out.append("if (").append(String.join(" and ", b.emitExpressions(generator.getIfs()))).append(") { ");
                    opened++;
                }
            }

            String element = b.emitExpression(node.getElement());
            if (node.getKind() == Expr.Comprehension.Kind.DICT) {
                out.append("try ").append(acc).append(".put(").append(element).append(", ")
                        .append(b.emitExpression(node.getValue())).append("); ");
            } else if (node.getKind() == Expr.Comprehension.Kind.SET) {
                out.append("try ").append(acc).append(".add(").append(element).append("); ");
            } else {
                out.append("try ").append(acc).append(".append(").append(element).append("); ");
            }
        } finally {
            context.popScope();
        }

        for (int i = 0; i < opened; i++) {
            out.append("} ");
        }
        out.append("break :").append(label).append(" ").append(acc).append("; }");
        return out.toString();
    }

    private static String initializer(Expr.Comprehension.Kind kind) {
        switch (kind) {
            case DICT:
                return "runtime.PyDict.init()";
            case SET:
                return "runtime.PySet.init()";
            default:
                return "runtime.PyList.init()";
        }
    }

    /**
     * Declares the target's names in the comprehension frame and returns the capture name.
     */
    private static String bindTarget(Expr target, ConversionContext context) {
        if (target instanceof Expr.Name) {
            String name = ((Expr.Name) target).getId();
            context.declareVar(name);
            context.getRenameTable().put(name, name);
            return name;
        }

        String item = "__item_" + context.nextUniqueId();
        List<Expr> elts = new ArrayList<>();
        if (target instanceof Expr.TupleExpr) {
            elts.addAll(((Expr.TupleExpr) target).getElts());
        } else if (target instanceof Expr.ListExpr) {
            elts.addAll(((Expr.ListExpr) target).getElts());
        }
        for (int i = 0; i < elts.size(); i++) {
            if (elts.get(i) instanceof Expr.Name) {
                String name = ((Expr.Name) elts.get(i)).getId();
                context.declareVar(name);
                context.getRenameTable().put(name, item + "[" + i + "]");
            }
        }
        return item;
    }
}
