package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.context.ConversionContext;

/**
 * Static helper for emitting for loops.
 *
 * <pre>
 * for x in xs:              → for (xs) |x| {
 *     total += x                total += x;
 *                             }
 * for k, v in pairs:        → for (pairs) |__item_3| {
 *                                 const __unpack_4 = __item_3;
 *                                 const k = __unpack_4[0];
 *                                 const v = __unpack_4[1];
 * </pre>
 *
 * <p>The loop variable belongs to the enclosing function, as in the source language, and
 * hides any outer rename of the same name. An {@code else} branch maps to the loop's own
 * {@code else}.</p>
 */
public class VisitFor {

    public static void v(Stmt.For node, NativeCodeBuilder b) {
        ConversionContext context = b.getContext();
        String iter = b.emitExpression(node.getIter());

        if (node.getTarget() instanceof Expr.Name) {
            String name = ((Expr.Name) node.getTarget()).getId();
            if (!context.isDeclaredInCurrentFunction(name)) {
                context.declareVar(name);
            }
            b.maskOuterRename(name);
            b.emitLine("for (" + iter + ") |" + name + "| {");
            b.emitBlock(node.getBody());
        } else {
            String item = "__item_" + context.nextUniqueId();
            b.emitLine("for (" + iter + ") |" + item + "| {");
            b.indent();
            VisitAssign.unpack(node.getTarget(), item, b);
            b.emitStatements(node.getBody());
            b.dedent();
        }
        b.emitLoopElse(node.getOrElse());
    }
}
