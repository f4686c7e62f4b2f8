package me.christianrobert.closureconv.transformer.type;

import me.christianrobert.closureconv.transformer.ast.AstVisitor;
import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple type evaluator with lazy evaluation and local type rules.
 * <p>
 * This implementation:
 * <ul>
 *   <li>Types literals and displays directly</li>
 *   <li>Looks up names in the conversion context (declared type of the innermost binding)</li>
 *   <li>Types calls to known classes (or capitalized names) as class instances</li>
 *   <li>Types a handful of builtins (len, int, str, ...) and functions listed in the table</li>
 *   <li>Returns UNKNOWN for everything else</li>
 * </ul>
 * <p>
 * UNKNOWN is always safe: capture types fall back to {@code @TypeOf(...)} and shadow decisions
 * treat unknown as compatible.
 * </p>
 */
public class SimpleTypeEvaluator implements TypeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SimpleTypeEvaluator.class);

    private final TypeInferenceTable table;

    public SimpleTypeEvaluator(TypeInferenceTable table) {
        this.table = table != null ? table : TypeInferenceTable.EMPTY;
    }

    @Override
    public Optional<TypeInfo> inferredReturnType(String functionName) {
        Optional<TypeInfo> type = table.getReturnType(functionName);
        if (type.isEmpty()) {
            log.trace("No inferred return type for '{}'", functionName);
        }
        return type;
    }

    @Override
    public TypeInfo inferredExpressionType(Expr expr, ConversionContext context) {
        if (expr == null) {
            return TypeInfo.UNKNOWN;
        }
        return expr.accept(new ExpressionTyper(context));
    }

    private static TypeInfo builtinReturnType(String name) {
        switch (name) {
            case "len":
            case "int":
            case "ord":
            case "hash":
                return TypeInfo.INT;
            case "float":
                return TypeInfo.FLOAT;
            case "str":
            case "repr":
            case "chr":
                return TypeInfo.STRING;
            case "bool":
            case "isinstance":
                return TypeInfo.BOOL;
            case "list":
            case "sorted":
                return TypeInfo.LIST;
            case "dict":
                return TypeInfo.DICT;
            case "set":
                return TypeInfo.SET;
            case "tuple":
                return TypeInfo.TUPLE;
            case "bytes":
                return TypeInfo.BYTES;
            case "print":
                return TypeInfo.NONE;
            default:
                return null;
        }
    }

    private final class ExpressionTyper extends AstVisitor<TypeInfo> {

        private final ConversionContext context;

        ExpressionTyper(ConversionContext context) {
            this.context = context;
        }

        @Override
        protected TypeInfo defaultResult() {
            return TypeInfo.UNKNOWN;
        }

        private TypeInfo type(Expr expr) {
            return expr == null ? TypeInfo.UNKNOWN : expr.accept(this);
        }

        @Override
        public TypeInfo visitName(Expr.Name node) {
            if (context == null) {
                return TypeInfo.UNKNOWN;
            }
            return context.getVariableType(node.getId());
        }

        @Override
        public TypeInfo visitConstant(Expr.Constant node) {
            switch (node.getKind()) {
                case INT:
                    return TypeInfo.INT;
                case FLOAT:
                    return TypeInfo.FLOAT;
                case STRING:
                    return TypeInfo.STRING;
                case BYTES:
                    return TypeInfo.BYTES;
                case BOOL:
                    return TypeInfo.BOOL;
                default:
                    return TypeInfo.NONE;
            }
        }

        @Override
        public TypeInfo visitBinOp(Expr.BinOp node) {
            TypeInfo left = type(node.getLeft());
            TypeInfo right = type(node.getRight());
            String op = node.getOp();

            if ("/".equals(op) && isNumeric(left) && isNumeric(right)) {
                return TypeInfo.FLOAT;
            }
            if (left.equals(TypeInfo.INT) && right.equals(TypeInfo.INT)) {
                return TypeInfo.INT;
            }
            if (isNumeric(left) && isNumeric(right)) {
                return TypeInfo.FLOAT;
            }
            if ("+".equals(op) && left.equals(TypeInfo.STRING) && right.equals(TypeInfo.STRING)) {
                return TypeInfo.STRING;
            }
            if ("%".equals(op) && left.equals(TypeInfo.STRING)) {
                return TypeInfo.STRING;
            }
            if (("+".equals(op) || "*".equals(op)) && left.equals(TypeInfo.LIST)) {
                return TypeInfo.LIST;
            }
            return TypeInfo.UNKNOWN;
        }

        private boolean isNumeric(TypeInfo type) {
            return type.equals(TypeInfo.INT) || type.equals(TypeInfo.FLOAT) || type.equals(TypeInfo.BOOL);
        }

        @Override
        public TypeInfo visitUnaryOp(Expr.UnaryOp node) {
            if ("not".equals(node.getOp())) {
                return TypeInfo.BOOL;
            }
            return type(node.getOperand());
        }

        @Override
        public TypeInfo visitCompare(Expr.Compare node) {
            return TypeInfo.BOOL;
        }

        @Override
        public TypeInfo visitBoolOp(Expr.BoolOp node) {
            List<TypeInfo> types = new ArrayList<>();
            for (Expr value : node.getValues()) {
                types.add(type(value));
            }
            return TypeInfo.union(types);
        }

        @Override
        public TypeInfo visitCall(Expr.Call node) {
            String callee = node.getCalleeName();
            if (callee == null) {
                return TypeInfo.UNKNOWN;
            }
            if (table.isClass(callee)) {
                return TypeInfo.classInstance(callee);
            }
            Optional<TypeInfo> declared = table.getReturnType(callee);
            if (declared.isPresent()) {
                return declared.get();
            }
            TypeInfo builtin = builtinReturnType(callee);
            if (builtin != null) {
                return builtin;
            }
            if (Character.isUpperCase(callee.charAt(0))) {
                // Capitalized callee without a table entry: a class constructor by convention
                return TypeInfo.classInstance(callee);
            }
            return TypeInfo.UNKNOWN;
        }

        @Override
        public TypeInfo visitIfExpr(Expr.IfExpr node) {
            List<TypeInfo> branches = new ArrayList<>();
            branches.add(type(node.getBody()));
            branches.add(type(node.getOrElse()));
            return TypeInfo.union(branches);
        }

        @Override
        public TypeInfo visitList(Expr.ListExpr node) {
            return TypeInfo.LIST;
        }

        @Override
        public TypeInfo visitTuple(Expr.TupleExpr node) {
            return TypeInfo.TUPLE;
        }

        @Override
        public TypeInfo visitSet(Expr.SetExpr node) {
            return TypeInfo.SET;
        }

        @Override
        public TypeInfo visitDict(Expr.DictExpr node) {
            return TypeInfo.DICT;
        }

        @Override
        public TypeInfo visitLambda(Expr.Lambda node) {
            return TypeInfo.CLOSURE;
        }

        @Override
        public TypeInfo visitComprehension(Expr.Comprehension node) {
            switch (node.getKind()) {
                case LIST:
                    return TypeInfo.LIST;
                case SET:
                    return TypeInfo.SET;
                case DICT:
                    return TypeInfo.DICT;
                default:
                    return TypeInfo.UNKNOWN;
            }
        }

        @Override
        public TypeInfo visitFString(Expr.FString node) {
            return TypeInfo.STRING;
        }

        @Override
        public TypeInfo visitAttribute(Expr.Attribute node) {
            return TypeInfo.UNKNOWN;
        }

        @Override
        public TypeInfo visitSubscript(Expr.Subscript node) {
            TypeInfo container = type(node.getValue());
            if (node.getIndex() instanceof Expr.Slice && (container.isSequence() || container.equals(TypeInfo.STRING))) {
                return container;
            }
            if (container.equals(TypeInfo.STRING)) {
                return TypeInfo.STRING;
            }
            return TypeInfo.UNKNOWN;
        }

        @Override
        public TypeInfo visitStarred(Expr.Starred node) {
            return TypeInfo.UNKNOWN;
        }

        @Override
        public TypeInfo visitSlice(Expr.Slice node) {
            return TypeInfo.UNKNOWN;
        }
    }
}
