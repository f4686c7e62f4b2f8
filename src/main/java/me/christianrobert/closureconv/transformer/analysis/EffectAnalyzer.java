package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.ast.AstVisitor;
import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.Stmt;

import java.util.List;
import java.util.Set;

/**
 * Answers effect questions about a function body that decide how it is emitted:
 * <ul>
 *   <li>{@link #canProduceErrors} - the return type is wrapped in the fallible form {@code !T}</li>
 *   <li>{@link #isMutatingMethod} - a call that makes its receiver's declaration {@code var}</li>
 *   <li>{@link #hasReturnWithValue} / {@link #endsWithReturn} - default return handling</li>
 * </ul>
 * Nested function and lambda bodies are not part of the enclosing body's effects.
 */
public class EffectAnalyzer {

    private static final Set<String> MUTATING_METHODS = Set.of(
            "append", "extend", "insert", "pop", "remove", "clear", "sort", "reverse",
            "update", "add", "discard", "setdefault", "popitem");

    /**
     * A body can fail if it calls anything, indexes, reads attributes, builds a comprehension
     * or raises.
     */
    public boolean canProduceErrors(List<Stmt> body) {
        Boolean result = new FallibilityVisitor().visitStatements(body);
        return result != null && result;
    }

    public boolean canProduceErrors(Expr expr) {
        Boolean result = expr.accept(new FallibilityVisitor());
        return result != null && result;
    }

    /**
     * True for the list, dict and set methods that change their receiver in place.
     */
    public static boolean isMutatingMethod(String method) {
        return MUTATING_METHODS.contains(method);
    }

    /**
     * True if any return statement in the body (not in nested functions) carries a value.
     */
    public boolean hasReturnWithValue(List<Stmt> body) {
        Boolean result = new ReturnVisitor().visitStatements(body);
        return result != null && result;
    }

    /**
     * True if the last top-level statement is a return or raise.
     */
    public boolean endsWithReturn(List<Stmt> body) {
        if (body.isEmpty()) {
            return false;
        }
        Stmt last = body.get(body.size() - 1);
        return last instanceof Stmt.Return || last instanceof Stmt.Raise;
    }

    // ========== Visitors ==========

    /**
     * Base for boolean "does any node match" visitors that stop at the first match.
     */
    private abstract static class AnyVisitor extends AstVisitor<Boolean> {

        @Override
        protected Boolean defaultResult() {
            return Boolean.FALSE;
        }

        @Override
        protected Boolean aggregateResult(Boolean aggregate, Boolean nextResult) {
            return aggregate || (nextResult != null && nextResult);
        }

        @Override
        protected boolean shouldVisitNextChild(Boolean currentResult) {
            return !currentResult;
        }

        @Override
        public Boolean visitFunctionDef(Stmt.FunctionDef node) {
            return Boolean.FALSE;
        }

        @Override
        public Boolean visitLambda(Expr.Lambda node) {
            return Boolean.FALSE;
        }

        @Override
        public Boolean visitClassDef(Stmt.ClassDef node) {
            return Boolean.FALSE;
        }
    }

    private static final class FallibilityVisitor extends AnyVisitor {

        @Override
        public Boolean visitCall(Expr.Call node) {
            return Boolean.TRUE;
        }

        @Override
        public Boolean visitAttribute(Expr.Attribute node) {
            return Boolean.TRUE;
        }

        @Override
        public Boolean visitSubscript(Expr.Subscript node) {
            return Boolean.TRUE;
        }

        @Override
        public Boolean visitRaise(Stmt.Raise node) {
            return Boolean.TRUE;
        }

        @Override
        public Boolean visitTry(Stmt.Try node) {
            return Boolean.TRUE;
        }

        // accumulator inserts can fail
        @Override
        public Boolean visitComprehension(Expr.Comprehension node) {
            return Boolean.TRUE;
        }
    }

    private static final class ReturnVisitor extends AnyVisitor {

        @Override
        public Boolean visitReturn(Stmt.Return node) {
            return node.getValue() != null;
        }
    }
}
