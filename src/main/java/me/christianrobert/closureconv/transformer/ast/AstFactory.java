package me.christianrobert.closureconv.transformer.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static shorthand for building AST fragments.
 *
 * <pre>
 * // def adder(x): return x + outer
 * FunctionFragment f = def("adder", params("x"),
 *         ret(binOp(name("x"), "+", name("outer"))));
 * </pre>
 */
public final class AstFactory {

    private AstFactory() {
    }

    // ========== Expressions ==========

    public static Expr.Name name(String id) {
        return new Expr.Name(id);
    }

    public static Expr.Constant intConst(long value) {
        return new Expr.Constant(Expr.Constant.Kind.INT, value);
    }

    public static Expr.Constant floatConst(double value) {
        return new Expr.Constant(Expr.Constant.Kind.FLOAT, value);
    }

    public static Expr.Constant str(String value) {
        return new Expr.Constant(Expr.Constant.Kind.STRING, value);
    }

    public static Expr.Constant bool(boolean value) {
        return new Expr.Constant(Expr.Constant.Kind.BOOL, value);
    }

    public static Expr.Constant none() {
        return new Expr.Constant(Expr.Constant.Kind.NONE, null);
    }

    public static Expr.BinOp binOp(Expr left, String op, Expr right) {
        return new Expr.BinOp(left, op, right);
    }

    public static Expr.Compare compare(Expr left, String op, Expr right) {
        return new Expr.Compare(left, Collections.singletonList(op), Collections.singletonList(right));
    }

    public static Expr.Call call(String func, Expr... args) {
        return new Expr.Call(name(func), Arrays.asList(args), null);
    }

    public static Expr.Call call(Expr func, List<Expr> args, List<Expr.Keyword> keywords) {
        return new Expr.Call(func, args, keywords);
    }

    public static Expr.Keyword keyword(String name, Expr value) {
        return new Expr.Keyword(name, value);
    }

    public static Expr.Attribute attr(Expr value, String attr) {
        return new Expr.Attribute(value, attr);
    }

    public static Expr.Subscript subscript(Expr value, Expr index) {
        return new Expr.Subscript(value, index);
    }

    public static Expr.IfExpr ifExpr(Expr test, Expr body, Expr orElse) {
        return new Expr.IfExpr(test, body, orElse);
    }

    public static Expr.ListExpr list(Expr... elts) {
        return new Expr.ListExpr(Arrays.asList(elts));
    }

    public static Expr.TupleExpr tuple(Expr... elts) {
        return new Expr.TupleExpr(Arrays.asList(elts));
    }

    public static Expr.SetExpr set(Expr... elts) {
        return new Expr.SetExpr(Arrays.asList(elts));
    }

    public static Expr.DictExpr dict() {
        return new Expr.DictExpr(Collections.emptyList(), Collections.emptyList());
    }

    public static Expr.Lambda lambda(List<Parameter> params, Expr body) {
        return new Expr.Lambda(params, body);
    }

    public static Expr.Comprehension listComp(Expr element, Expr target, Expr iter, Expr... ifs) {
        Expr.Generator generator = new Expr.Generator(target, iter, Arrays.asList(ifs));
        return new Expr.Comprehension(Expr.Comprehension.Kind.LIST, element, null,
                Collections.singletonList(generator));
    }

    public static Expr.FString fstring(Expr... parts) {
        return new Expr.FString(Arrays.asList(parts));
    }

    // ========== Statements ==========

    public static Stmt.Assign assign(String target, Expr value) {
        return new Stmt.Assign(Collections.singletonList(name(target)), value);
    }

    public static Stmt.Assign assign(Expr target, Expr value) {
        return new Stmt.Assign(Collections.singletonList(target), value);
    }

    public static Stmt.AugAssign augAssign(String target, String op, Expr value) {
        return new Stmt.AugAssign(name(target), op, value);
    }

    public static Stmt.Return ret(Expr value) {
        return new Stmt.Return(value);
    }

    public static Stmt.ExprStmt expr(Expr value) {
        return new Stmt.ExprStmt(value);
    }

    public static Stmt.If ifStmt(Expr test, List<Stmt> body, List<Stmt> orElse) {
        return new Stmt.If(test, body, orElse);
    }

    public static Stmt.For forStmt(String target, Expr iter, Stmt... body) {
        return new Stmt.For(name(target), iter, Arrays.asList(body), null);
    }

    public static Stmt.FunctionDef defStmt(FunctionFragment function) {
        return new Stmt.FunctionDef(function);
    }

    // ========== Functions ==========

    public static List<Parameter> params(String... names) {
        List<Parameter> result = new ArrayList<>();
        for (String n : names) {
            result.add(new Parameter(n));
        }
        return result;
    }

    public static FunctionFragment def(String name, List<Parameter> params, Stmt... body) {
        return new FunctionFragment(name, params, Arrays.asList(body));
    }

    public static List<Stmt> block(Stmt... body) {
        return Arrays.asList(body);
    }
}
