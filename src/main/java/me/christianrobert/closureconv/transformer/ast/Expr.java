package me.christianrobert.closureconv.transformer.ast;

import java.util.Collections;
import java.util.List;

/**
 * Expression nodes of the source AST.
 *
 * <p>The tree is produced by the parser (outside this module) and is read-only for the
 * closure converter. Every node accepts an {@link Visitor}; traversals that only care about
 * a few node kinds extend {@link AstVisitor}, which walks all children by default.</p>
 *
 * <p><strong>Node overview:</strong></p>
 * <pre>
 * Name         x
 * Constant     42, 3.5, 'text', True, None
 * BinOp        a + b
 * UnaryOp      -a, not a
 * Compare      a &lt; b &lt;= c
 * BoolOp       a and b
 * Call         f(a, *rest, key=v, **kw)
 * Starred      *rest / **kw (inside calls and targets)
 * Attribute    obj.field
 * Subscript    seq[i]
 * Slice        lower:upper:step (only as a Subscript index)
 * IfExpr       a if cond else b
 * ListExpr     [a, b]
 * TupleExpr    (a, b)
 * SetExpr      {a, b}
 * DictExpr     {k: v}
 * Lambda       lambda x: x + 1
 * Comprehension [x for x in xs if x], {k: v for ...}, (x for ...)
 * FString      f"{name} = {value}"
 * </pre>
 */
public abstract class Expr {

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * Visitor over all expression node kinds.
     */
    public interface Visitor<T> {
        T visitName(Name node);

        T visitConstant(Constant node);

        T visitBinOp(BinOp node);

        T visitUnaryOp(UnaryOp node);

        T visitCompare(Compare node);

        T visitBoolOp(BoolOp node);

        T visitCall(Call node);

        T visitStarred(Starred node);

        T visitAttribute(Attribute node);

        T visitSubscript(Subscript node);

        T visitSlice(Slice node);

        T visitIfExpr(IfExpr node);

        T visitList(ListExpr node);

        T visitTuple(TupleExpr node);

        T visitSet(SetExpr node);

        T visitDict(DictExpr node);

        T visitLambda(Lambda node);

        T visitComprehension(Comprehension node);

        T visitFString(FString node);
    }

    private static <E> List<E> immutable(List<E> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    // ========== Leaves ==========

    public static final class Name extends Expr {
        private final String id;

        public Name(String id) {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("Name id cannot be null or empty");
            }
            this.id = id;
        }

        public String getId() {
            return id;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitName(this);
        }

        @Override
        public String toString() {
            return "Name{" + id + "}";
        }
    }

    public static final class Constant extends Expr {

        /**
         * Literal kinds the parser distinguishes.
         */
        public enum Kind {
            INT,
            FLOAT,
            STRING,
            BYTES,
            BOOL,
            NONE
        }

        private final Kind kind;
        private final Object value;

        public Constant(Kind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }

        public Kind getKind() {
            return kind;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public String toString() {
            return "Constant{" + kind + ", " + value + "}";
        }
    }

    // ========== Operators ==========

    public static final class BinOp extends Expr {
        private final Expr left;
        private final String op;
        private final Expr right;

        public BinOp(Expr left, String op, Expr right) {
            this.left = left;
            this.op = op;
            this.right = right;
        }

        public Expr getLeft() {
            return left;
        }

        public String getOp() {
            return op;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    public static final class UnaryOp extends Expr {
        private final String op;
        private final Expr operand;

        public UnaryOp(String op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        public String getOp() {
            return op;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    public static final class Compare extends Expr {
        private final Expr left;
        private final List<String> ops;
        private final List<Expr> comparators;

        public Compare(Expr left, List<String> ops, List<Expr> comparators) {
            if (ops == null || comparators == null || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("Compare needs one operator per comparator");
            }
            this.left = left;
            this.ops = immutable(ops);
            this.comparators = immutable(comparators);
        }

        public Expr getLeft() {
            return left;
        }

        public List<String> getOps() {
            return ops;
        }

        public List<Expr> getComparators() {
            return comparators;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitCompare(this);
        }
    }

    public static final class BoolOp extends Expr {
        private final String op;
        private final List<Expr> values;

        public BoolOp(String op, List<Expr> values) {
            this.op = op;
            this.values = immutable(values);
        }

        public String getOp() {
            return op;
        }

        public List<Expr> getValues() {
            return values;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    // ========== Calls and access ==========

    public static final class Call extends Expr {
        private final Expr func;
        private final List<Expr> args;
        private final List<Keyword> keywords;

        public Call(Expr func, List<Expr> args, List<Keyword> keywords) {
            this.func = func;
            this.args = immutable(args);
            this.keywords = immutable(keywords);
        }

        public Expr getFunc() {
            return func;
        }

        public List<Expr> getArgs() {
            return args;
        }

        public List<Keyword> getKeywords() {
            return keywords;
        }

        /**
         * Returns the callee name for direct calls ({@code f(...)}), or null.
         */
        public String getCalleeName() {
            return func instanceof Name ? ((Name) func).getId() : null;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * Keyword argument of a call. A null name marks a {@code **mapping} argument.
     */
    public static final class Keyword {
        private final String name;
        private final Expr value;

        public Keyword(String name, Expr value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expr getValue() {
            return value;
        }
    }

    public static final class Starred extends Expr {
        private final Expr value;
        private final boolean doubleStar;

        public Starred(Expr value, boolean doubleStar) {
            this.value = value;
            this.doubleStar = doubleStar;
        }

        public Expr getValue() {
            return value;
        }

        public boolean isDoubleStar() {
            return doubleStar;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitStarred(this);
        }
    }

    public static final class Attribute extends Expr {
        private final Expr value;
        private final String attr;

        public Attribute(Expr value, String attr) {
            this.value = value;
            this.attr = attr;
        }

        public Expr getValue() {
            return value;
        }

        public String getAttr() {
            return attr;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    public static final class Subscript extends Expr {
        private final Expr value;
        private final Expr index;

        public Subscript(Expr value, Expr index) {
            this.value = value;
            this.index = index;
        }

        public Expr getValue() {
            return value;
        }

        public Expr getIndex() {
            return index;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    public static final class Slice extends Expr {
        private final Expr lower;
        private final Expr upper;
        private final Expr step;

        public Slice(Expr lower, Expr upper, Expr step) {
            this.lower = lower;
            this.upper = upper;
            this.step = step;
        }

        public Expr getLower() {
            return lower;
        }

        public Expr getUpper() {
            return upper;
        }

        public Expr getStep() {
            return step;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitSlice(this);
        }
    }

    public static final class IfExpr extends Expr {
        private final Expr test;
        private final Expr body;
        private final Expr orElse;

        public IfExpr(Expr test, Expr body, Expr orElse) {
            this.test = test;
            this.body = body;
            this.orElse = orElse;
        }

        public Expr getTest() {
            return test;
        }

        public Expr getBody() {
            return body;
        }

        public Expr getOrElse() {
            return orElse;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitIfExpr(this);
        }
    }

    // ========== Displays ==========

    public static final class ListExpr extends Expr {
        private final List<Expr> elts;

        public ListExpr(List<Expr> elts) {
            this.elts = immutable(elts);
        }

        public List<Expr> getElts() {
            return elts;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitList(this);
        }
    }

    public static final class TupleExpr extends Expr {
        private final List<Expr> elts;

        public TupleExpr(List<Expr> elts) {
            this.elts = immutable(elts);
        }

        public List<Expr> getElts() {
            return elts;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitTuple(this);
        }
    }

    public static final class SetExpr extends Expr {
        private final List<Expr> elts;

        public SetExpr(List<Expr> elts) {
            this.elts = immutable(elts);
        }

        public List<Expr> getElts() {
            return elts;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitSet(this);
        }
    }

    public static final class DictExpr extends Expr {
        private final List<Expr> keys;
        private final List<Expr> values;

        public DictExpr(List<Expr> keys, List<Expr> values) {
            if (keys == null || values == null || keys.size() != values.size()) {
                throw new IllegalArgumentException("Dict display needs one value per key");
            }
            this.keys = immutable(keys);
            this.values = immutable(values);
        }

        public List<Expr> getKeys() {
            return keys;
        }

        public List<Expr> getValues() {
            return values;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDict(this);
        }
    }

    // ========== Scoped expressions ==========

    public static final class Lambda extends Expr {
        private final List<Parameter> params;
        private final Expr body;

        public Lambda(List<Parameter> params, Expr body) {
            this.params = immutable(params);
            this.body = body;
        }

        public List<Parameter> getParams() {
            return params;
        }

        public Expr getBody() {
            return body;
        }

        public boolean hasParameter(String name) {
            for (Parameter param : params) {
                if (param.getName().equals(name)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitLambda(this);
        }
    }

    public static final class Comprehension extends Expr {

        public enum Kind {
            LIST,
            SET,
            DICT,
            GENERATOR
        }

        private final Kind kind;
        private final Expr element;
        private final Expr value;  // only for DICT: element is the key
        private final List<Generator> generators;

        public Comprehension(Kind kind, Expr element, Expr value, List<Generator> generators) {
            this.kind = kind;
            this.element = element;
            this.value = value;
            this.generators = immutable(generators);
        }

        public Kind getKind() {
            return kind;
        }

        public Expr getElement() {
            return element;
        }

        public Expr getValue() {
            return value;
        }

        public List<Generator> getGenerators() {
            return generators;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitComprehension(this);
        }
    }

    /**
     * One {@code for target in iter if cond...} clause of a comprehension.
     */
    public static final class Generator {
        private final Expr target;
        private final Expr iter;
        private final List<Expr> ifs;

        public Generator(Expr target, Expr iter, List<Expr> ifs) {
            this.target = target;
            this.iter = iter;
            this.ifs = immutable(ifs);
        }

        public Expr getTarget() {
            return target;
        }

        public Expr getIter() {
            return iter;
        }

        public List<Expr> getIfs() {
            return ifs;
        }
    }

    /**
     * Formatted string. Literal parts are STRING constants, interpolated parts are any
     * other expression.
     */
    public static final class FString extends Expr {
        private final List<Expr> parts;

        public FString(List<Expr> parts) {
            this.parts = immutable(parts);
        }

        public List<Expr> getParts() {
            return parts;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitFString(this);
        }
    }
}
