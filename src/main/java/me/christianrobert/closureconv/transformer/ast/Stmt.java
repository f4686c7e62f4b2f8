package me.christianrobert.closureconv.transformer.ast;

import java.util.Collections;
import java.util.List;

/**
 * Statement nodes of the source AST.
 *
 * <p>Function bodies are ordered lists of statements. Nested {@code def}s appear as
 * {@link FunctionDef} and carry a complete {@link FunctionFragment}.</p>
 */
public abstract class Stmt {

    public abstract <T> T accept(Visitor<T> visitor);

    public interface Visitor<T> {
        T visitExprStmt(ExprStmt node);

        T visitAssign(Assign node);

        T visitAugAssign(AugAssign node);

        T visitReturn(Return node);

        T visitIf(If node);

        T visitWhile(While node);

        T visitFor(For node);

        T visitTry(Try node);

        T visitWith(With node);

        T visitRaise(Raise node);

        T visitFunctionDef(FunctionDef node);

        T visitClassDef(ClassDef node);

        T visitPass(Pass node);

        T visitBreak(Break node);

        T visitContinue(Continue node);
    }

    private static <E> List<E> immutable(List<E> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public static final class ExprStmt extends Stmt {
        private final Expr value;

        public ExprStmt(Expr value) {
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    /**
     * {@code a = b = value}. Targets may be names, tuples/lists (destructuring), starred,
     * subscripts or attributes.
     */
    public static final class Assign extends Stmt {
        private final List<Expr> targets;
        private final Expr value;

        public Assign(List<Expr> targets, Expr value) {
            if (targets == null || targets.isEmpty()) {
                throw new IllegalArgumentException("Assignment needs at least one target");
            }
            this.targets = immutable(targets);
            this.value = value;
        }

        public List<Expr> getTargets() {
            return targets;
        }

        public Expr getValue() {
            return value;
        }

        /**
         * Returns the single plain name target, or null for any other target shape.
         */
        public String getSimpleTargetName() {
            if (targets.size() == 1 && targets.get(0) instanceof Expr.Name) {
                return ((Expr.Name) targets.get(0)).getId();
            }
            return null;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitAssign(this);
        }
    }

    public static final class AugAssign extends Stmt {
        private final Expr target;
        private final String op;
        private final Expr value;

        public AugAssign(Expr target, String op, Expr value) {
            this.target = target;
            this.op = op;
            this.value = value;
        }

        public Expr getTarget() {
            return target;
        }

        public String getOp() {
            return op;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitAugAssign(this);
        }
    }

    public static final class Return extends Stmt {
        private final Expr value;  // null for bare return

        public Return(Expr value) {
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitReturn(this);
        }
    }

    public static final class If extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orElse;

        public If(Expr test, List<Stmt> body, List<Stmt> orElse) {
            this.test = test;
            this.body = immutable(body);
            this.orElse = immutable(orElse);
        }

        public Expr getTest() {
            return test;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrElse() {
            return orElse;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitIf(this);
        }
    }

    public static final class While extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orElse;

        public While(Expr test, List<Stmt> body, List<Stmt> orElse) {
            this.test = test;
            this.body = immutable(body);
            this.orElse = immutable(orElse);
        }

        public Expr getTest() {
            return test;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrElse() {
            return orElse;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitWhile(this);
        }
    }

    public static final class For extends Stmt {
        private final Expr target;
        private final Expr iter;
        private final List<Stmt> body;
        private final List<Stmt> orElse;

        public For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse) {
            this.target = target;
            this.iter = iter;
            this.body = immutable(body);
            this.orElse = immutable(orElse);
        }

        public Expr getTarget() {
            return target;
        }

        public Expr getIter() {
            return iter;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrElse() {
            return orElse;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitFor(this);
        }
    }

    public static final class Try extends Stmt {
        private final List<Stmt> body;
        private final List<ExceptHandler> handlers;
        private final List<Stmt> orElse;
        private final List<Stmt> finalBody;

        public Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody) {
            this.body = immutable(body);
            this.handlers = immutable(handlers);
            this.orElse = immutable(orElse);
            this.finalBody = immutable(finalBody);
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<ExceptHandler> getHandlers() {
            return handlers;
        }

        public List<Stmt> getOrElse() {
            return orElse;
        }

        public List<Stmt> getFinalBody() {
            return finalBody;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitTry(this);
        }
    }

    /**
     * {@code except Type as name:} clause. Type and name are both optional.
     */
    public static final class ExceptHandler {
        private final Expr type;
        private final String name;
        private final List<Stmt> body;

        public ExceptHandler(Expr type, String name, List<Stmt> body) {
            this.type = type;
            this.name = name;
            this.body = immutable(body);
        }

        public Expr getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        public List<Stmt> getBody() {
            return body;
        }
    }

    public static final class With extends Stmt {
        private final Expr contextExpr;
        private final Expr optionalVars;  // the "as" target, may be null
        private final List<Stmt> body;

        public With(Expr contextExpr, Expr optionalVars, List<Stmt> body) {
            this.contextExpr = contextExpr;
            this.optionalVars = optionalVars;
            this.body = immutable(body);
        }

        public Expr getContextExpr() {
            return contextExpr;
        }

        public Expr getOptionalVars() {
            return optionalVars;
        }

        public List<Stmt> getBody() {
            return body;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitWith(this);
        }
    }

    public static final class Raise extends Stmt {
        private final Expr exc;

        public Raise(Expr exc) {
            this.exc = exc;
        }

        public Expr getExc() {
            return exc;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitRaise(this);
        }
    }

    public static final class FunctionDef extends Stmt {
        private final FunctionFragment function;

        public FunctionDef(FunctionFragment function) {
            if (function == null) {
                throw new IllegalArgumentException("Function fragment cannot be null");
            }
            this.function = function;
        }

        public FunctionFragment getFunction() {
            return function;
        }

        public String getName() {
            return function.getName();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    public static final class ClassDef extends Stmt {
        private final String name;
        private final List<Stmt> body;

        public ClassDef(String name, List<Stmt> body) {
            this.name = name;
            this.body = immutable(body);
        }

        public String getName() {
            return name;
        }

        public List<Stmt> getBody() {
            return body;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    public static final class Pass extends Stmt {
        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitPass(this);
        }
    }

    public static final class Break extends Stmt {
        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBreak(this);
        }
    }

    public static final class Continue extends Stmt {
        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitContinue(this);
        }
    }
}
