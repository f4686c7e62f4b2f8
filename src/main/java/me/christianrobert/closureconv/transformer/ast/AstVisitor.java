package me.christianrobert.closureconv.transformer.ast;

import java.util.List;

/**
 * Base visitor that walks every child of every node and aggregates the child results.
 *
 * <p>Subclasses override the node kinds they care about and call {@code super.visitXxx(node)}
 * (or {@link #visitChildren}) to keep descending. Results are combined with
 * {@link #aggregateResult(Object, Object)}; the default keeps the last non-default result.</p>
 *
 * <p>Nested {@code def}s and lambdas are walked like any other child. Analyses that treat
 * them as separate scopes override {@link #visitFunctionDef} / {@link #visitLambda}.</p>
 */
public abstract class AstVisitor<T> implements Expr.Visitor<T>, Stmt.Visitor<T> {

    protected T defaultResult() {
        return null;
    }

    protected T aggregateResult(T aggregate, T nextResult) {
        return nextResult == null ? aggregate : nextResult;
    }

    /**
     * Returns true to stop visiting the remaining children once a result is known.
     */
    protected boolean shouldVisitNextChild(T currentResult) {
        return true;
    }

    protected T visitChildren(Object... children) {
        T result = defaultResult();
        for (Object child : children) {
            if (!shouldVisitNextChild(result)) {
                break;
            }
            result = aggregateResult(result, visitAny(child));
        }
        return result;
    }

    public T visitStatements(List<Stmt> statements) {
        T result = defaultResult();
        for (Stmt stmt : statements) {
            if (!shouldVisitNextChild(result)) {
                break;
            }
            result = aggregateResult(result, stmt.accept(this));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private T visitAny(Object child) {
        if (child == null) {
            return defaultResult();
        }
        if (child instanceof Expr) {
            return ((Expr) child).accept(this);
        }
        if (child instanceof Stmt) {
            return ((Stmt) child).accept(this);
        }
        if (child instanceof Expr.Keyword) {
            return visitAny(((Expr.Keyword) child).getValue());
        }
        if (child instanceof Expr.Generator) {
            Expr.Generator gen = (Expr.Generator) child;
            return visitChildren(gen.getIter(), gen.getTarget(), gen.getIfs());
        }
        if (child instanceof Stmt.ExceptHandler) {
            Stmt.ExceptHandler handler = (Stmt.ExceptHandler) child;
            return visitChildren(handler.getType(), handler.getBody());
        }
        if (child instanceof List) {
            T result = defaultResult();
            for (Object element : (List<Object>) child) {
                if (!shouldVisitNextChild(result)) {
                    break;
                }
                result = aggregateResult(result, visitAny(element));
            }
            return result;
        }
        return defaultResult();
    }

    // ========== Expressions ==========

    @Override
    public T visitName(Expr.Name node) {
        return defaultResult();
    }

    @Override
    public T visitConstant(Expr.Constant node) {
        return defaultResult();
    }

    @Override
    public T visitBinOp(Expr.BinOp node) {
        return visitChildren(node.getLeft(), node.getRight());
    }

    @Override
    public T visitUnaryOp(Expr.UnaryOp node) {
        return visitChildren(node.getOperand());
    }

    @Override
    public T visitCompare(Expr.Compare node) {
        return visitChildren(node.getLeft(), node.getComparators());
    }

    @Override
    public T visitBoolOp(Expr.BoolOp node) {
        return visitChildren(node.getValues());
    }

    @Override
    public T visitCall(Expr.Call node) {
        return visitChildren(node.getFunc(), node.getArgs(), node.getKeywords());
    }

    @Override
    public T visitStarred(Expr.Starred node) {
        return visitChildren(node.getValue());
    }

    @Override
    public T visitAttribute(Expr.Attribute node) {
        return visitChildren(node.getValue());
    }

    @Override
    public T visitSubscript(Expr.Subscript node) {
        return visitChildren(node.getValue(), node.getIndex());
    }

    @Override
    public T visitSlice(Expr.Slice node) {
        return visitChildren(node.getLower(), node.getUpper(), node.getStep());
    }

    @Override
    public T visitIfExpr(Expr.IfExpr node) {
        return visitChildren(node.getTest(), node.getBody(), node.getOrElse());
    }

    @Override
    public T visitList(Expr.ListExpr node) {
        return visitChildren(node.getElts());
    }

    @Override
    public T visitTuple(Expr.TupleExpr node) {
        return visitChildren(node.getElts());
    }

    @Override
    public T visitSet(Expr.SetExpr node) {
        return visitChildren(node.getElts());
    }

    @Override
    public T visitDict(Expr.DictExpr node) {
        return visitChildren(node.getKeys(), node.getValues());
    }

    @Override
    public T visitLambda(Expr.Lambda node) {
        return visitChildren(node.getBody());
    }

    @Override
    public T visitComprehension(Expr.Comprehension node) {
        return visitChildren(node.getGenerators(), node.getElement(), node.getValue());
    }

    @Override
    public T visitFString(Expr.FString node) {
        return visitChildren(node.getParts());
    }

    // ========== Statements ==========

    @Override
    public T visitExprStmt(Stmt.ExprStmt node) {
        return visitChildren(node.getValue());
    }

    @Override
    public T visitAssign(Stmt.Assign node) {
        return visitChildren(node.getValue(), node.getTargets());
    }

    @Override
    public T visitAugAssign(Stmt.AugAssign node) {
        return visitChildren(node.getTarget(), node.getValue());
    }

    @Override
    public T visitReturn(Stmt.Return node) {
        return visitChildren(node.getValue());
    }

    @Override
    public T visitIf(Stmt.If node) {
        return visitChildren(node.getTest(), node.getBody(), node.getOrElse());
    }

    @Override
    public T visitWhile(Stmt.While node) {
        return visitChildren(node.getTest(), node.getBody(), node.getOrElse());
    }

    @Override
    public T visitFor(Stmt.For node) {
        return visitChildren(node.getIter(), node.getTarget(), node.getBody(), node.getOrElse());
    }

    @Override
    public T visitTry(Stmt.Try node) {
        return visitChildren(node.getBody(), node.getHandlers(), node.getOrElse(), node.getFinalBody());
    }

    @Override
    public T visitWith(Stmt.With node) {
        return visitChildren(node.getContextExpr(), node.getOptionalVars(), node.getBody());
    }

    @Override
    public T visitRaise(Stmt.Raise node) {
        return visitChildren(node.getExc());
    }

    @Override
    public T visitFunctionDef(Stmt.FunctionDef node) {
        return visitChildren(node.getFunction().getBody());
    }

    @Override
    public T visitClassDef(Stmt.ClassDef node) {
        return visitChildren(node.getBody());
    }

    @Override
    public T visitPass(Stmt.Pass node) {
        return defaultResult();
    }

    @Override
    public T visitBreak(Stmt.Break node) {
        return defaultResult();
    }

    @Override
    public T visitContinue(Stmt.Continue node) {
        return defaultResult();
    }
}
