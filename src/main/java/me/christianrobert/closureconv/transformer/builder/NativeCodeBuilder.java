package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.closure.ClosureSynthesizer;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.context.ConversionContext.VariableBinding;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import me.christianrobert.closureconv.transformer.context.Declaration;
import me.christianrobert.closureconv.transformer.shadow.ShadowAliasResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference emitter: renders source statements and expressions as target code under the
 * renames of a {@link ConversionContext}.
 *
 * <p>Nested {@code def}s and lambdas are handed to the {@link ClosureSynthesizer}; plain
 * assignments go through the {@link ShadowAliasResolver}. Calls to converted closures are
 * emitted uniformly as {@code <wrapper>.call(args)}, prefixed with {@code try} when the closure
 * can fail.</p>
 *
 * <p>try/except and class definitions are lowered by other passes and rejected here.</p>
 */
public class NativeCodeBuilder implements Emitter, Expr.Visitor<String>, Stmt.Visitor<Void> {

    // no logging is desired, the synthesizer and resolver log their decisions

    private final ConversionContext context;
    private final ClosureSynthesizer synthesizer;
    private final ShadowAliasResolver shadowResolver;
    private final CodeWriter writer = new CodeWriter();

    public NativeCodeBuilder(ConversionContext context) {
        this(context, new ClosureSynthesizer(), new ShadowAliasResolver());
    }

    public NativeCodeBuilder(ConversionContext context, ClosureSynthesizer synthesizer, ShadowAliasResolver shadowResolver) {
        if (context == null) {
            throw new IllegalArgumentException("ConversionContext cannot be null");
        }
        this.context = context;
        this.synthesizer = synthesizer;
        this.shadowResolver = shadowResolver;
    }

    public ConversionContext getContext() {
        return context;
    }

    public ClosureSynthesizer getSynthesizer() {
        return synthesizer;
    }

    public ShadowAliasResolver getShadowResolver() {
        return shadowResolver;
    }

    /**
     * Emits a module-level function with all nested closures converted.
     */
    public String buildFunction(FunctionFragment fragment) {
        return synthesizer.emitFunction(fragment, context, this);
    }

    public String getCode() {
        return writer.toString();
    }

    // ========== Emitter ==========

    @Override
    public void emit(String text) {
        writer.write(text);
    }

    @Override
    public void emitIndent() {
        writer.writeIndent();
    }

    @Override
    public void emitLine(String text) {
        writer.writeLine(text);
    }

    @Override
    public void indent() {
        writer.indent();
    }

    @Override
    public void dedent() {
        writer.dedent();
    }

    @Override
    public String emitExpression(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public void emitStatement(Stmt stmt) {
        stmt.accept(this);
    }

    @Override
    public int mark() {
        return writer.position();
    }

    @Override
    public String since(int mark) {
        return writer.since(mark);
    }

    /**
     * Emits statements one level deeper.
     */
    void emitBlock(List<Stmt> body) {
        indent();
        emitStatements(body);
        dedent();
    }

    List<String> emitExpressions(List<Expr> exprs) {
        List<String> rendered = new ArrayList<>();
        for (Expr expr : exprs) {
            rendered.add(emitExpression(expr));
        }
        return rendered;
    }

    // ========== Expressions ==========

    @Override
    public String visitName(Expr.Name node) {
        return context.resolveName(node.getId());
    }

    @Override
    public String visitConstant(Expr.Constant node) {
        switch (node.getKind()) {
            case INT:
            case FLOAT:
                return String.valueOf(node.getValue());
            case STRING:
            case BYTES:
                return quote(String.valueOf(node.getValue()));
            case BOOL:
                return Boolean.TRUE.equals(node.getValue()) ? "true" : "false";
            default:
                return "null";
        }
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }

    @Override
    public String visitBinOp(Expr.BinOp node) {
        String left = emitExpression(node.getLeft());
        String right = emitExpression(node.getRight());
        switch (node.getOp()) {
            case "//":
                return "@divFloor(" + left + ", " + right + ")";
            case "%":
                return "@mod(" + left + ", " + right + ")";
            case "**":
                return "runtime.pow(" + left + ", " + right + ")";
            default:
                return "(" + left + " " + node.getOp() + " " + right + ")";
        }
    }

    @Override
    public String visitUnaryOp(Expr.UnaryOp node) {
        String operand = emitExpression(node.getOperand());
        if ("not".equals(node.getOp())) {
            return "!" + operand;
        }
        return node.getOp() + operand;
    }

    @Override
    public String visitCompare(Expr.Compare node) {
        List<String> parts = new ArrayList<>();
        String left = emitExpression(node.getLeft());
        for (int i = 0; i < node.getOps().size(); i++) {
            String right = emitExpression(node.getComparators().get(i));
            parts.add(comparison(left, node.getOps().get(i), right));
            left = right;
        }
        return parts.size() == 1 ? parts.get(0) : "(" + String.join(" and ", parts) + ")";
    }

    private String comparison(String left, String op, String right) {
        switch (op) {
            case "in":
                return "runtime.contains(" + right + ", " + left + ")";
            case "not in":
                return "!runtime.contains(" + right + ", " + left + ")";
            case "is":
                return "(" + left + " == " + right + ")";
            case "is not":
                return "(" + left + " != " + right + ")";
            default:
                return "(" + left + " " + op + " " + right + ")";
        }
    }

    @Override
    public String visitBoolOp(Expr.BoolOp node) {
        return "(" + String.join(" " + node.getOp() + " ", emitExpressions(node.getValues())) + ")";
    }

    @Override
    public String visitCall(Expr.Call node) {
        return VisitCall.v(node, this);
    }

    @Override
    public String visitStarred(Expr.Starred node) {
        return "runtime.spread(" + emitExpression(node.getValue()) + ")";
    }

    @Override
    public String visitAttribute(Expr.Attribute node) {
        return emitExpression(node.getValue()) + "." + node.getAttr();
    }

    @Override
    public String visitSubscript(Expr.Subscript node) {
        String value = emitExpression(node.getValue());
        if (node.getIndex() instanceof Expr.Slice) {
            Expr.Slice slice = (Expr.Slice) node.getIndex();
            String lower = slice.getLower() != null ? emitExpression(slice.getLower()) : "0";
            String upper = slice.getUpper() != null ? emitExpression(slice.getUpper()) : "";
            return value + "[" + lower + ".." + upper + "]";
        }
        return value + "[" + emitExpression(node.getIndex()) + "]";
    }

    @Override
    public String visitSlice(Expr.Slice node) {
        throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                "Slice outside of a subscript");
    }

    @Override
    public String visitIfExpr(Expr.IfExpr node) {
        return "(if (" + emitExpression(node.getTest()) + ") " + emitExpression(node.getBody())
                + " else " + emitExpression(node.getOrElse()) + ")";
    }

    @Override
    public String visitList(Expr.ListExpr node) {
        return "runtime.PyList.from(.{ " + String.join(", ", emitExpressions(node.getElts())) + " })";
    }

    @Override
    public String visitTuple(Expr.TupleExpr node) {
        return ".{ " + String.join(", ", emitExpressions(node.getElts())) + " }";
    }

    @Override
    public String visitSet(Expr.SetExpr node) {
        return "runtime.PySet.from(.{ " + String.join(", ", emitExpressions(node.getElts())) + " })";
    }

    @Override
    public String visitDict(Expr.DictExpr node) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < node.getKeys().size(); i++) {
            entries.add(".{ " + emitExpression(node.getKeys().get(i)) + ", " + emitExpression(node.getValues().get(i)) + " }");
        }
        return "runtime.PyDict.from(.{ " + String.join(", ", entries) + " })";
    }

    @Override
    public String visitLambda(Expr.Lambda node) {
        // Anonymous lambda: converted under a synthetic name, the expression is its wrapper
        String name = "lambda_" + context.nextUniqueId();
        return VisitLambda.v(name, node, this);
    }

    @Override
    public String visitComprehension(Expr.Comprehension node) {
        return VisitComprehension.v(node, this);
    }

    @Override
    public String visitFString(Expr.FString node) {
        StringBuilder format = new StringBuilder();
        List<String> args = new ArrayList<>();
        for (Expr part : node.getParts()) {
            if (part instanceof Expr.Constant && ((Expr.Constant) part).getKind() == Expr.Constant.Kind.STRING) {
                format.append(String.valueOf(((Expr.Constant) part).getValue())
                        .replace("{", "{{").replace("}", "}}"));
            } else {
                format.append("{any}");
                args.add(emitExpression(part));
            }
        }
        return "runtime.format(" + quote(format.toString()) + ", .{ " + String.join(", ", args) + " })";
    }

    // ========== Statements ==========

    @Override
    public Void visitExprStmt(Stmt.ExprStmt node) {
        String value = emitExpression(node.getValue());
        if (node.getValue() instanceof Expr.Call) {
            emitLine(value + ";");
        } else {
            emitLine("_ = " + value + ";");
        }
        return null;
    }

    @Override
    public Void visitAssign(Stmt.Assign node) {
        VisitAssign.v(node, this);
        return null;
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign node) {
        markMutated(node.getTarget());
        String target = emitExpression(node.getTarget());
        String value = emitExpression(node.getValue());
        switch (node.getOp()) {
            case "+":
            case "-":
            case "*":
                emitLine(target + " " + node.getOp() + "= " + value + ";");
                break;
            case "//":
                emitLine(target + " = @divFloor(" + target + ", " + value + ");");
                break;
            case "%":
                emitLine(target + " = @mod(" + target + ", " + value + ");");
                break;
            default:
                emitLine(target + " = (" + target + " " + node.getOp() + " " + value + ");");
        }
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return node) {
        if (node.getValue() == null) {
            emitLine("return;");
        } else {
            emitLine("return " + emitExpression(node.getValue()) + ";");
        }
        return null;
    }

    @Override
    public Void visitIf(Stmt.If node) {
        emitLine("if (" + emitExpression(node.getTest()) + ") {");
        emitBlock(node.getBody());
        if (node.getOrElse().isEmpty()) {
            emitLine("}");
        } else {
            emitLine("} else {");
            emitBlock(node.getOrElse());
            emitLine("}");
        }
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While node) {
        emitLine("while (" + emitExpression(node.getTest()) + ") {");
        emitBlock(node.getBody());
        emitLoopElse(node.getOrElse());
        return null;
    }

    @Override
    public Void visitFor(Stmt.For node) {
        VisitFor.v(node, this);
        return null;
    }

    void emitLoopElse(List<Stmt> orElse) {
        if (orElse.isEmpty()) {
            emitLine("}");
        } else {
            emitLine("} else {");
            emitBlock(orElse);
            emitLine("}");
        }
    }

    @Override
    public Void visitTry(Stmt.Try node) {
        throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                "try statements must be lowered to error unions before closure conversion");
    }

    @Override
    public Void visitWith(Stmt.With node) {
        String resource;
        if (node.getOptionalVars() instanceof Expr.Name) {
            String name = ((Expr.Name) node.getOptionalVars()).getId();
            context.declareVar(name);
            maskOuterRename(name);
            resource = name;
        } else {
            resource = "__with_" + context.nextUniqueId();
        }
        emitLine("{");
        indent();
        emitLine("const " + resource + " = " + emitExpression(node.getContextExpr()) + ";");
        emitLine("defer " + resource + ".close();");
        emitStatements(node.getBody());
        dedent();
        emitLine("}");
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise node) {
        String error = "Exception";
        Expr exc = node.getExc();
        if (exc instanceof Expr.Call && ((Expr.Call) exc).getCalleeName() != null) {
            error = ((Expr.Call) exc).getCalleeName();
        } else if (exc instanceof Expr.Name) {
            error = ((Expr.Name) exc).getId();
        }
        emitLine("return error." + error + ";");
        return null;
    }

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef node) {
        synthesizer.synthesize(node.getFunction(), context, this);
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef node) {
        throw new ConversionException(ConversionException.ErrorKind.INVALID_FRAGMENT,
                "class '" + node.getName() + "' must be lowered before closure conversion");
    }

    @Override
    public Void visitPass(Stmt.Pass node) {
        return null;
    }

    @Override
    public Void visitBreak(Stmt.Break node) {
        emitLine("break;");
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue node) {
        emitLine("continue;");
        return null;
    }

    // ========== Helpers for the Visit* classes ==========

    /**
     * Writes a declaration line whose keyword follows the binding's declaration.
     */
    void emitDeclaration(Declaration declaration, String text) {
        writer.writeDeclaration(declaration, text);
    }

    /**
     * Marks the binding an in-place write goes through: {@code x} for {@code x += 1},
     * {@code d} for {@code d[k] = v} and {@code o.f.g = v}.
     */
    void markMutated(Expr target) {
        if (target instanceof Expr.Name) {
            context.markMutated(((Expr.Name) target).getId());
        } else if (target instanceof Expr.Subscript) {
            markMutated(((Expr.Subscript) target).getValue());
        } else if (target instanceof Expr.Attribute) {
            markMutated(((Expr.Attribute) target).getValue());
        }
    }

    /**
     * A name bound locally hides any rename of the same name from an enclosing scope.
     */
    void maskOuterRename(String name) {
        if (context.getRenameTable().isRenamed(name)) {
            context.getRenameTable().put(name, name);
        }
    }

    /**
     * Returns the closure binding the name resolves to, or null.
     */
    VariableBinding closureBinding(String name) {
        return context.lookupClosure(name);
    }
}
