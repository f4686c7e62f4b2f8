package me.christianrobert.closureconv.transformer.util;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Formats function fragments into human-readable, indented text representation.
 *
 * <p>Useful for debugging how a fragment was handed to the converter.</p>
 *
 * <p>Example output (without type information):</p>
 * <pre>
 * FunctionDef make_counter(start)
 *   Assign
 *     Name "total"
 *     Name "start"
 *   FunctionDef increment(step)
 *     AugAssign "+"
 *       Name "total"
 *       Name "step"
 * </pre>
 *
 * <p>Example output (with type information):</p>
 * <pre>
 *   Assign
 *     Name "total" [TYPE: INT]
 *     Constant "0" [TYPE: INT]
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a fragment into human-readable text.
   *
   * @param fragment Root function
   * @return Formatted string representation
   */
  public static String format(FunctionFragment fragment) {
    return format(fragment, null);
  }

  /**
   * Formats a fragment with optional type information.
   *
   * <p>If a context is provided, every expression is annotated with the type its evaluator
   * infers under the context's current bindings: [TYPE: category]</p>
   *
   * @param fragment Root function
   * @param context Optional conversion context, may be null
   * @return Formatted string representation with type annotations
   */
  public static String format(FunctionFragment fragment, ConversionContext context) {
    if (fragment == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatFunction(fragment, 0, sb, context);
    return sb.toString();
  }

  private static void formatFunction(FunctionFragment fragment, int depth, StringBuilder sb, ConversionContext context) {
    indent(depth, sb);
    List<String> params = new ArrayList<>();
    for (Parameter param : fragment.getParams()) {
      params.add(param.hasDeclaredType()
          ? param.getName() + ": " + param.getDeclaredType().getCategory()
          : param.getName());
    }
    if (fragment.getVarArg() != null) {
      params.add("*" + fragment.getVarArg());
    }
    if (fragment.getKwArg() != null) {
      params.add("**" + fragment.getKwArg());
    }
    sb.append("FunctionDef ").append(fragment.getName())
        .append("(").append(String.join(", ", params)).append(")");
    if (fragment.getReturnAnnotation() != null) {
      sb.append(" -> ").append(fragment.getReturnAnnotation().getCategory());
    }
    sb.append("\n");

    for (Stmt stmt : fragment.getBody()) {
      formatNode(stmt, depth + 1, sb, context);
    }
  }

  /**
   * Recursively formats a node.
   */
  private static void formatNode(Object node, int depth, StringBuilder sb, ConversionContext context) {
    if (node == null) {
      return;
    }
    if (node instanceof Stmt.FunctionDef) {
      formatFunction(((Stmt.FunctionDef) node).getFunction(), depth, sb, context);
      return;
    }
    if (node instanceof List) {
      for (Object element : (List<?>) node) {
        formatNode(element, depth, sb, context);
      }
      return;
    }

    indent(depth, sb);
    sb.append(label(node));

    String detail = detail(node);
    if (detail != null) {
      sb.append(" \"").append(escapeAndTruncate(detail)).append("\"");
    }

    // Show type information if available
    if (context != null && node instanceof Expr) {
      TypeInfo type = context.getTypeEvaluator().inferredExpressionType((Expr) node, context);
      sb.append(" [TYPE: ").append(type.getCategory()).append("]");
    }
    sb.append("\n");

    for (Object child : children(node)) {
      formatNode(child, depth + 1, sb, context);
    }
  }

  private static String label(Object node) {
    String className = node.getClass().getSimpleName();
    // ListExpr, TupleExpr, ... read better without the suffix
    if (className.endsWith("Expr") && !className.equals("IfExpr")) {
      className = className.substring(0, className.length() - "Expr".length());
    }
    return className;
  }

  /**
   * Text shown next to leaf-like nodes.
   */
  private static String detail(Object node) {
    if (node instanceof Expr.Name) {
      return ((Expr.Name) node).getId();
    }
    if (node instanceof Expr.Constant) {
      return String.valueOf(((Expr.Constant) node).getValue());
    }
    if (node instanceof Expr.BinOp) {
      return ((Expr.BinOp) node).getOp();
    }
    if (node instanceof Expr.UnaryOp) {
      return ((Expr.UnaryOp) node).getOp();
    }
    if (node instanceof Expr.BoolOp) {
      return ((Expr.BoolOp) node).getOp();
    }
    if (node instanceof Expr.Compare) {
      return String.join(" ", ((Expr.Compare) node).getOps());
    }
    if (node instanceof Expr.Attribute) {
      return ((Expr.Attribute) node).getAttr();
    }
    if (node instanceof Expr.Keyword) {
      String name = ((Expr.Keyword) node).getName();
      return name != null ? name : "**";
    }
    if (node instanceof Expr.Comprehension) {
      return ((Expr.Comprehension) node).getKind().name();
    }
    if (node instanceof Stmt.AugAssign) {
      return ((Stmt.AugAssign) node).getOp();
    }
    if (node instanceof Stmt.ClassDef) {
      return ((Stmt.ClassDef) node).getName();
    }
    if (node instanceof Stmt.ExceptHandler) {
      return ((Stmt.ExceptHandler) node).getName();
    }
    return null;
  }

  private static List<Object> children(Object node) {
    if (node instanceof Expr.BinOp) {
      Expr.BinOp binOp = (Expr.BinOp) node;
      return Arrays.asList(binOp.getLeft(), binOp.getRight());
    }
    if (node instanceof Expr.UnaryOp) {
      return Arrays.asList(((Expr.UnaryOp) node).getOperand());
    }
    if (node instanceof Expr.Compare) {
      Expr.Compare compare = (Expr.Compare) node;
      return Arrays.asList(compare.getLeft(), compare.getComparators());
    }
    if (node instanceof Expr.BoolOp) {
      return Arrays.asList(((Expr.BoolOp) node).getValues());
    }
    if (node instanceof Expr.Call) {
      Expr.Call call = (Expr.Call) node;
      return Arrays.asList(call.getFunc(), call.getArgs(), call.getKeywords());
    }
    if (node instanceof Expr.Keyword) {
      return Arrays.asList(((Expr.Keyword) node).getValue());
    }
    if (node instanceof Expr.Starred) {
      return Arrays.asList(((Expr.Starred) node).getValue());
    }
    if (node instanceof Expr.Attribute) {
      return Arrays.asList(((Expr.Attribute) node).getValue());
    }
    if (node instanceof Expr.Subscript) {
      Expr.Subscript subscript = (Expr.Subscript) node;
      return Arrays.asList(subscript.getValue(), subscript.getIndex());
    }
    if (node instanceof Expr.Slice) {
      Expr.Slice slice = (Expr.Slice) node;
      return Arrays.asList(slice.getLower(), slice.getUpper(), slice.getStep());
    }
    if (node instanceof Expr.IfExpr) {
      Expr.IfExpr ifExpr = (Expr.IfExpr) node;
      return Arrays.asList(ifExpr.getTest(), ifExpr.getBody(), ifExpr.getOrElse());
    }
    if (node instanceof Expr.ListExpr) {
      return Arrays.asList(((Expr.ListExpr) node).getElts());
    }
    if (node instanceof Expr.TupleExpr) {
      return Arrays.asList(((Expr.TupleExpr) node).getElts());
    }
    if (node instanceof Expr.SetExpr) {
      return Arrays.asList(((Expr.SetExpr) node).getElts());
    }
    if (node instanceof Expr.DictExpr) {
      Expr.DictExpr dict = (Expr.DictExpr) node;
      return Arrays.asList(dict.getKeys(), dict.getValues());
    }
    if (node instanceof Expr.Lambda) {
      return Arrays.asList(((Expr.Lambda) node).getBody());
    }
    if (node instanceof Expr.Comprehension) {
      Expr.Comprehension comp = (Expr.Comprehension) node;
      return Arrays.asList(comp.getElement(), comp.getValue(), comp.getGenerators());
    }
    if (node instanceof Expr.Generator) {
      Expr.Generator gen = (Expr.Generator) node;
      return Arrays.asList(gen.getTarget(), gen.getIter(), gen.getIfs());
    }
    if (node instanceof Expr.FString) {
      return Arrays.asList(((Expr.FString) node).getParts());
    }
    if (node instanceof Stmt.ExprStmt) {
      return Arrays.asList(((Stmt.ExprStmt) node).getValue());
    }
    if (node instanceof Stmt.Assign) {
      Stmt.Assign assign = (Stmt.Assign) node;
      return Arrays.asList(assign.getTargets(), assign.getValue());
    }
    if (node instanceof Stmt.AugAssign) {
      Stmt.AugAssign aug = (Stmt.AugAssign) node;
      return Arrays.asList(aug.getTarget(), aug.getValue());
    }
    if (node instanceof Stmt.Return) {
      return Arrays.asList(((Stmt.Return) node).getValue());
    }
    if (node instanceof Stmt.If) {
      Stmt.If ifStmt = (Stmt.If) node;
      return Arrays.asList(ifStmt.getTest(), ifStmt.getBody(), ifStmt.getOrElse());
    }
    if (node instanceof Stmt.While) {
      Stmt.While whileStmt = (Stmt.While) node;
      return Arrays.asList(whileStmt.getTest(), whileStmt.getBody(), whileStmt.getOrElse());
    }
    if (node instanceof Stmt.For) {
      Stmt.For forStmt = (Stmt.For) node;
      return Arrays.asList(forStmt.getTarget(), forStmt.getIter(), forStmt.getBody(), forStmt.getOrElse());
    }
    if (node instanceof Stmt.Try) {
      Stmt.Try tryStmt = (Stmt.Try) node;
      return Arrays.asList(tryStmt.getBody(), tryStmt.getHandlers(), tryStmt.getOrElse(), tryStmt.getFinalBody());
    }
    if (node instanceof Stmt.ExceptHandler) {
      Stmt.ExceptHandler handler = (Stmt.ExceptHandler) node;
      return Arrays.asList(handler.getType(), handler.getBody());
    }
    if (node instanceof Stmt.With) {
      Stmt.With with = (Stmt.With) node;
      return Arrays.asList(with.getContextExpr(), with.getOptionalVars(), with.getBody());
    }
    if (node instanceof Stmt.Raise) {
      return Arrays.asList(((Stmt.Raise) node).getExc());
    }
    if (node instanceof Stmt.ClassDef) {
      return Arrays.asList(((Stmt.ClassDef) node).getBody());
    }
    return new ArrayList<>();
  }

  private static void indent(int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
