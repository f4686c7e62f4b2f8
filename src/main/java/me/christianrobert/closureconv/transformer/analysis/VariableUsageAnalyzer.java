package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.ast.AstVisitor;
import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.context.ConversionException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes which names a function body reads and binds.
 *
 * <p><strong>Reads</strong> are collected transitively through nested functions, lambdas,
 * comprehensions and f-string parts. A read inside a nested construct is dropped when that
 * construct binds the same name itself:</p>
 * <pre>
 * def outer_fn():
 *     def inner(x):      # x is inner's parameter: not a read of outer_fn
 *         return x + y   # y is a read of outer_fn
 *     return [y for y in ys]   # comprehension target y shadows; ys is a read
 * </pre>
 *
 * <p>Pure write targets are not reads, but {@code d[k] = v} reads {@code d} and {@code k},
 * {@code obj.f = v} reads {@code obj} and {@code x += 1} reads {@code x}.</p>
 *
 * <p><strong>Locals</strong> are the names the body binds at its own level: assignment targets
 * (including destructuring), augmented-assignment targets, loop, exception and {@code with}
 * targets and nested {@code def}/{@code class} names.</p>
 */
public class VariableUsageAnalyzer {

    /**
     * Analyzes one function body.
     *
     * @param fragment Function to analyze
     * @return Reads, locals and the self-recursion flag
     */
    public UsageAnalysis analyze(FunctionFragment fragment) {
        if (fragment == null) {
            throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                    "Cannot analyze a null function fragment");
        }

        Set<String> locals = collectLocallyAssigned(fragment.getBody());

        ReadCollector reads = new ReadCollector(fragment.getName());
        reads.visitStatements(fragment.getBody());

        return new UsageAnalysis(fragment.getName(), reads.reads, locals, reads.selfRecursive);
    }

    /**
     * Names bound at the level of the given statements, without descending into nested
     * function or class bodies.
     */
    public Set<String> collectLocallyAssigned(List<Stmt> body) {
        LocalsCollector collector = new LocalsCollector();
        collector.visitStatements(body);
        return collector.locals;
    }

    /**
     * Checks if a parameter is read anywhere in the function body.
     */
    public boolean isParameterUsed(FunctionFragment fragment, Parameter param) {
        return analyze(fragment).isParameterUsed(param);
    }

    /**
     * Checks if a parameter is assigned anywhere in the function body.
     */
    public boolean isParameterReassigned(FunctionFragment fragment, Parameter param) {
        return analyze(fragment).isParameterReassigned(param);
    }

    /**
     * Checks if any of the given captured names is read in the function body.
     */
    public boolean areCapturesUsed(FunctionFragment fragment, Collection<String> captureNames) {
        return analyze(fragment).areCapturesUsed(captureNames);
    }

    /**
     * Adds every plain name bound by an assignment target.
     * {@code (a, [b, *c])} binds a, b and c; {@code d[k]} and {@code o.f} bind nothing.
     */
    public static void collectTargetNames(Expr target, Set<String> names) {
        if (target instanceof Expr.Name) {
            names.add(((Expr.Name) target).getId());
        } else if (target instanceof Expr.TupleExpr) {
            for (Expr elt : ((Expr.TupleExpr) target).getElts()) {
                collectTargetNames(elt, names);
            }
        } else if (target instanceof Expr.ListExpr) {
            for (Expr elt : ((Expr.ListExpr) target).getElts()) {
                collectTargetNames(elt, names);
            }
        } else if (target instanceof Expr.Starred) {
            collectTargetNames(((Expr.Starred) target).getValue(), names);
        }
    }

    // ========== Locals ==========

    private static final class LocalsCollector extends AstVisitor<Void> {

        private final Set<String> locals = new LinkedHashSet<>();

        @Override
        public Void visitAssign(Stmt.Assign node) {
            for (Expr target : node.getTargets()) {
                collectTargetNames(target, locals);
            }
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            collectTargetNames(node.getTarget(), locals);
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node) {
            collectTargetNames(node.getTarget(), locals);
            visitStatements(node.getBody());
            visitStatements(node.getOrElse());
            return null;
        }

        @Override
        public Void visitTry(Stmt.Try node) {
            visitStatements(node.getBody());
            for (Stmt.ExceptHandler handler : node.getHandlers()) {
                if (handler.getName() != null) {
                    locals.add(handler.getName());
                }
                visitStatements(handler.getBody());
            }
            visitStatements(node.getOrElse());
            visitStatements(node.getFinalBody());
            return null;
        }

        @Override
        public Void visitWith(Stmt.With node) {
            if (node.getOptionalVars() != null) {
                collectTargetNames(node.getOptionalVars(), locals);
            }
            visitStatements(node.getBody());
            return null;
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node) {
            locals.add(node.getName());
            return null;
        }

        @Override
        public Void visitClassDef(Stmt.ClassDef node) {
            locals.add(node.getName());
            return null;
        }

        // Expressions bind nothing at statement level
        @Override
        public Void visitExprStmt(Stmt.ExprStmt node) {
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            return null;
        }

        @Override
        public Void visitIf(Stmt.If node) {
            visitStatements(node.getBody());
            visitStatements(node.getOrElse());
            return null;
        }

        @Override
        public Void visitWhile(Stmt.While node) {
            visitStatements(node.getBody());
            visitStatements(node.getOrElse());
            return null;
        }
    }

    // ========== Reads ==========

    private final class ReadCollector extends AstVisitor<Void> {

        private final String functionName;
        private final Set<String> reads = new LinkedHashSet<>();
        private final Deque<Set<String>> shadows = new ArrayDeque<>();
        private boolean selfRecursive = false;

        ReadCollector(String functionName) {
            this.functionName = functionName;
        }

        private boolean isShadowed(String name) {
            for (Set<String> shadow : shadows) {
                if (shadow.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        private void read(String name) {
            if (!isShadowed(name)) {
                reads.add(name);
            }
        }

        /**
         * Visits an assignment target: plain names are writes, anything they index into is read.
         */
        private void visitTarget(Expr target) {
            if (target == null || target instanceof Expr.Name) {
                return;
            }
            if (target instanceof Expr.TupleExpr) {
                for (Expr elt : ((Expr.TupleExpr) target).getElts()) {
                    visitTarget(elt);
                }
            } else if (target instanceof Expr.ListExpr) {
                for (Expr elt : ((Expr.ListExpr) target).getElts()) {
                    visitTarget(elt);
                }
            } else if (target instanceof Expr.Starred) {
                visitTarget(((Expr.Starred) target).getValue());
            } else {
                target.accept(this);
            }
        }

        @Override
        public Void visitName(Expr.Name node) {
            read(node.getId());
            return null;
        }

        @Override
        public Void visitCall(Expr.Call node) {
            String callee = node.getCalleeName();
            if (callee != null && callee.equals(functionName) && !isShadowed(callee)) {
                selfRecursive = true;
            }
            return super.visitCall(node);
        }

        @Override
        public Void visitAssign(Stmt.Assign node) {
            if (node.getValue() != null) {
                node.getValue().accept(this);
            }
            for (Expr target : node.getTargets()) {
                visitTarget(target);
            }
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            // x += 1 reads x
            node.getTarget().accept(this);
            node.getValue().accept(this);
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node) {
            node.getIter().accept(this);
            visitTarget(node.getTarget());
            visitStatements(node.getBody());
            visitStatements(node.getOrElse());
            return null;
        }

        @Override
        public Void visitWith(Stmt.With node) {
            node.getContextExpr().accept(this);
            visitTarget(node.getOptionalVars());
            visitStatements(node.getBody());
            return null;
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node) {
            FunctionFragment nested = node.getFunction();
            Set<String> bound = new HashSet<>(nested.getFormalNames());
            bound.addAll(collectLocallyAssigned(nested.getBody()));
            shadows.push(bound);
            try {
                visitStatements(nested.getBody());
            } finally {
                shadows.pop();
            }
            return null;
        }

        @Override
        public Void visitLambda(Expr.Lambda node) {
            Set<String> bound = new HashSet<>();
            for (Parameter param : node.getParams()) {
                bound.add(param.getName());
            }
            shadows.push(bound);
            try {
                node.getBody().accept(this);
            } finally {
                shadows.pop();
            }
            return null;
        }

        @Override
        public Void visitComprehension(Expr.Comprehension node) {
            List<Expr.Generator> generators = node.getGenerators();
            if (generators.isEmpty()) {
                return super.visitComprehension(node);
            }

            // The first iterable is evaluated in the enclosing scope
            generators.get(0).getIter().accept(this);

            Set<String> bound = new HashSet<>();
            for (Expr.Generator generator : generators) {
                collectTargetNames(generator.getTarget(), bound);
            }
            shadows.push(bound);
            try {
                for (int i = 0; i < generators.size(); i++) {
                    Expr.Generator generator = generators.get(i);
                    if (i > 0) {
                        generator.getIter().accept(this);
                    }
                    for (Expr condition : generator.getIfs()) {
                        condition.accept(this);
                    }
                }
                node.getElement().accept(this);
                if (node.getValue() != null) {
                    node.getValue().accept(this);
                }
            } finally {
                shadows.pop();
            }
            return null;
        }
    }
}
