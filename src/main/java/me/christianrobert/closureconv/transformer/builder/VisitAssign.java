package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.Declaration;
import me.christianrobert.closureconv.transformer.shadow.ShadowAliasResolver;
import me.christianrobert.closureconv.transformer.shadow.ShadowDecision;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.List;

/**
 * Static helper for emitting assignments.
 *
 * <h3>Plain name targets</h3>
 * <pre>
 * total = 0                 → var total = 0;                         FRESH
 * total = total + 1         → total = (total + 1);                   REUSE
 * total = Record(total)     → const total__4 = Record.init(total);  SHADOW_RENAME
 * view = items              → const view = &amp;items;                   alias of a list
 * view = other              → view = &amp;other;                         alias retargeted
 * scale = lambda x: x * k   → closure named scale
 * </pre>
 *
 * <p>The right-hand side is always rendered before the decision is committed, so a
 * shadowing assignment still reads the previous binding. A declaration is {@code const}
 * unless the same binding is later reassigned or mutated in place; a shadow starts a new
 * binding, so {@code total__4} above stays {@code const}.</p>
 *
 * <h3>Other targets</h3>
 * <pre>
 * d[k] = v                  → d[k] = v;
 * a, b = pair               → const __unpack_5 = pair;
 *                             const a = __unpack_5[0];
 *                             const b = __unpack_5[1];
 * </pre>
 */
public class VisitAssign {

    public static void v(Stmt.Assign node, NativeCodeBuilder b) {
        List<Expr> targets = node.getTargets();
        Expr first = targets.get(0);
        assignTo(first, node.getValue(), b);

        // a = b = value: the remaining targets take the first target's value
        for (int i = 1; i < targets.size(); i++) {
            assignTo(targets.get(i), first, b);
        }
    }

    private static void assignTo(Expr target, Expr value, NativeCodeBuilder b) {
        if (target instanceof Expr.Name) {
            assignName(((Expr.Name) target).getId(), value, b);
        } else if (target instanceof Expr.TupleExpr || target instanceof Expr.ListExpr) {
            unpack(target, b.emitExpression(value), b);
        } else {
            String rhs = b.emitExpression(value);
            b.markMutated(target);
            b.emitLine(b.emitExpression(target) + " = " + rhs + ";");
        }
    }

    private static void assignName(String name, Expr value, NativeCodeBuilder b) {
        ConversionContext context = b.getContext();

        if (value instanceof Expr.Lambda) {
            VisitLambda.v(name, (Expr.Lambda) value, b);
            return;
        }

        TypeInfo type = context.getTypeEvaluator().inferredExpressionType(value, context);
        String aliasTarget = aliasTarget(name, value, context);

        ShadowAliasResolver resolver = b.getShadowResolver();
        ShadowDecision decision = resolver.resolveShadowOrReuse(name, type, aliasTarget, context);

        // STEP 1: right-hand side under the current bindings
        String rhs;
        if (aliasTarget != null) {
            String owner = context.getAliasTable().rootOf(aliasTarget);
            rhs = "&" + context.resolveName(owner);
        } else {
            rhs = b.emitExpression(value);
        }

        // STEP 2: renames and aliases take effect for the following statements
        resolver.commit(decision, context);

        // STEP 3: the assignment itself
        emitDecision(decision, rhs, b);
    }

    /**
     * Writes a committed decision. A declaration takes its keyword from the binding, so it
     * becomes {@code var} only if a later statement reassigns or mutates that binding.
     */
    private static void emitDecision(ShadowDecision decision, String rhs, NativeCodeBuilder b) {
        if (decision.declares()) {
            Declaration declaration = b.getContext().lookupVariable(decision.getName()).getDeclaration();
            b.emitDeclaration(declaration, decision.getIdentifier() + " = " + rhs + ";");
        } else {
            b.emitLine(decision.getIdentifier() + " = " + rhs + ";");
        }
    }

    /**
     * {@code b = a} aliases {@code a} when {@code a} is a declared list, dict or set.
     */
    private static String aliasTarget(String name, Expr value, ConversionContext context) {
        if (!(value instanceof Expr.Name)) {
            return null;
        }
        String source = ((Expr.Name) value).getId();
        if (source.equals(name) || !context.isDeclared(source)) {
            return null;
        }
        if (context.getAliasTable().rootOf(source).equals(name)) {
            // a = b where b already refers to a's container
            return null;
        }
        return context.getVariableType(source).isReferenceContainer() ? source : null;
    }

    static void unpack(Expr target, String rhs, NativeCodeBuilder b) {
        ConversionContext context = b.getContext();
        String temp = "__unpack_" + context.nextUniqueId();
        b.emitLine("const " + temp + " = " + rhs + ";");

        List<Expr> elts = target instanceof Expr.TupleExpr
                ? ((Expr.TupleExpr) target).getElts()
                : ((Expr.ListExpr) target).getElts();

        for (int i = 0; i < elts.size(); i++) {
            Expr elt = elts.get(i);
            String element = temp + "[" + i + "]";
            if (elt instanceof Expr.Starred) {
                element = temp + "[" + i + "..]";
                elt = ((Expr.Starred) elt).getValue();
            }

            if (elt instanceof Expr.Name) {
                String name = ((Expr.Name) elt).getId();
                ShadowDecision decision = b.getShadowResolver().resolveShadowOrReuse(name, TypeInfo.UNKNOWN, context);
                b.getShadowResolver().commit(decision, context);
                emitDecision(decision, element, b);
            } else if (elt instanceof Expr.TupleExpr || elt instanceof Expr.ListExpr) {
                unpack(elt, element, b);
            } else {
                b.markMutated(elt);
                b.emitLine(b.emitExpression(elt) + " = " + element + ";");
            }
        }
    }
}
