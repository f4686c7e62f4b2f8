package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.ast.Expr;
import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.ast.Stmt;
import me.christianrobert.closureconv.transformer.context.ConversionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static me.christianrobert.closureconv.transformer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class VariableUsageAnalyzerTest {

    private VariableUsageAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new VariableUsageAnalyzer();
    }

    // ========== Reads ==========

    @Test
    void readsAreOrderedByFirstOccurrence() {
        // def f(x): return y + x + y + z
        FunctionFragment f = def("f", params("x"),
                ret(binOp(binOp(binOp(name("y"), "+", name("x")), "+", name("y")), "+", name("z"))));

        UsageAnalysis usage = analyzer.analyze(f);

        assertEquals(Arrays.asList("y", "x", "z"), usage.getReferencedNames());
    }

    @Test
    void pureWriteIsNotARead() {
        // def f(): total = 0
        UsageAnalysis usage = analyzer.analyze(def("f", params(), assign("total", intConst(0))));

        assertFalse(usage.isReferenced("total"));
        assertTrue(usage.isLocallyAssigned("total"));
    }

    @Test
    void subscriptAssignmentReadsContainerAndKey() {
        // def f(v): d[k] = v
        UsageAnalysis usage = analyzer.analyze(def("f", params("v"),
                assign(subscript(name("d"), name("k")), name("v"))));

        assertTrue(usage.isReferenced("d"));
        assertTrue(usage.isReferenced("k"));
        assertFalse(usage.isLocallyAssigned("d"));
    }

    @Test
    void augmentedAssignmentReadsAndAssigns() {
        // def bump(n): n += 1; return n
        FunctionFragment bump = def("bump", params("n"), augAssign("n", "+", intConst(1)), ret(name("n")));

        UsageAnalysis usage = analyzer.analyze(bump);

        assertTrue(usage.isParameterUsed("n"));
        assertTrue(usage.isParameterReassigned("n"));
        assertTrue(analyzer.isParameterReassigned(bump, new Parameter("n")));
    }

    @Test
    void forLoopIterableIsReadAndTargetIsLocal() {
        // def f(): for x in items: print(x)
        UsageAnalysis usage = analyzer.analyze(def("f", params(),
                forStmt("x", name("items"), expr(call("print", name("x"))))));

        assertTrue(usage.isReferenced("items"));
        assertTrue(usage.isLocallyAssigned("x"));
        assertFalse(usage.isLocallyAssigned("items"));
    }

    @Test
    void formatStringInterpolationsAreRead() {
        // def f(): return f"{label}: {count}"
        UsageAnalysis usage = analyzer.analyze(def("f", params(),
                ret(fstring(name("label"), str(": "), name("count")))));

        assertEquals(Arrays.asList("label", "count"), usage.getReferencedNames());
    }

    @Test
    void withContextExpressionIsRead() {
        // def f(): with open(path) as handle: handle.read()
        UsageAnalysis usage = analyzer.analyze(def("f", params(),
                new Stmt.With(call("open", name("path")), name("handle"),
                        block(expr(call(attr(name("handle"), "read"), Collections.emptyList(), Collections.emptyList()))))));

        assertTrue(usage.isReferenced("path"));
        assertTrue(usage.isLocallyAssigned("handle"));
    }

    @Test
    void exceptHandlerBodyIsReadButBindingIsNot() {
        // def f(): try: work() except Error as err: log(fallback)
        Stmt.Try attempt = new Stmt.Try(
                block(expr(call("work"))),
                Collections.singletonList(new Stmt.ExceptHandler(name("Error"), "err",
                        block(expr(call("log", name("fallback")))))),
                block(), block());

        UsageAnalysis usage = analyzer.analyze(def("f", params(), attempt));

        assertTrue(usage.isReferenced("fallback"));
        assertTrue(usage.isReferenced("Error"));
        assertFalse(usage.isReferenced("err"));
        assertTrue(usage.isLocallyAssigned("err"));
    }

    // ========== Parameters ==========

    @Test
    void unusedParameterIsDetected() {
        // def pick(a, b, c): return c
        FunctionFragment pick = def("pick", params("a", "b", "c"), ret(name("c")));

        assertFalse(analyzer.isParameterUsed(pick, new Parameter("a")));
        assertFalse(analyzer.isParameterUsed(pick, new Parameter("b")));
        assertTrue(analyzer.isParameterUsed(pick, new Parameter("c")));
    }

    @Test
    void areCapturesUsed() {
        FunctionFragment f = def("f", params(), ret(name("outer")));

        assertTrue(analyzer.areCapturesUsed(f, Arrays.asList("other", "outer")));
        assertFalse(analyzer.areCapturesUsed(f, Collections.singletonList("other")));
    }

    // ========== Nested scopes ==========

    @Test
    void nestedFunctionReadsOfFreeNamesCount() {
        // def outer(): def inner(c): return a + c
        FunctionFragment inner = def("inner", params("c"), ret(binOp(name("a"), "+", name("c"))));
        FunctionFragment outer = def("outer", params(), defStmt(inner));

        UsageAnalysis usage = analyzer.analyze(outer);

        assertTrue(usage.isReferenced("a"));
        assertFalse(usage.isReferenced("c"));
        assertTrue(usage.isLocallyAssigned("inner"));
    }

    @Test
    void nestedFunctionLocalsShadowOuterNames() {
        // def outer(): def inner(): x = 1; return x
        FunctionFragment inner = def("inner", params(), assign("x", intConst(1)), ret(name("x")));
        UsageAnalysis usage = analyzer.analyze(def("outer", params(), defStmt(inner)));

        assertFalse(usage.isReferenced("x"));
        assertFalse(usage.isLocallyAssigned("x"));
    }

    @Test
    void lambdaParametersAreShadowed() {
        // def f(): return lambda x: x + k
        UsageAnalysis usage = analyzer.analyze(def("f", params(),
                ret(lambda(params("x"), binOp(name("x"), "+", name("k"))))));

        assertFalse(usage.isReferenced("x"));
        assertTrue(usage.isReferenced("k"));
    }

    @Test
    void comprehensionTargetsAreShadowedButFirstIterableIsRead() {
        // def f(): return [x * factor for x in xs if x]
        UsageAnalysis usage = analyzer.analyze(def("f", params(),
                ret(listComp(binOp(name("x"), "*", name("factor")), name("x"), name("xs"), name("x")))));

        assertEquals(Arrays.asList("xs", "factor"), usage.getReferencedNames());
    }

    // ========== Self recursion ==========

    @Test
    void directSelfCallIsRecursive() {
        // def fact(n): return n * fact(n - 1)
        FunctionFragment fact = def("fact", params("n"),
                ret(binOp(name("n"), "*", call("fact", binOp(name("n"), "-", intConst(1))))));

        assertTrue(analyzer.analyze(fact).isSelfRecursive());
    }

    @Test
    void callToShadowedNameIsNotRecursive() {
        // def f(g): def g2(f): return f(1)   the call targets the parameter of g2
        FunctionFragment f = def("f", params("g"),
                defStmt(def("g2", params("f"), ret(call("f", intConst(1))))));

        assertFalse(analyzer.analyze(f).isSelfRecursive());
    }

    // ========== Locals ==========

    @Test
    void localsCoverAllBindingForms() {
        List<Stmt> body = block(
                assign(tuple(name("a"), name("b")), name("pair")),
                forStmt("i", name("xs"), assign("last", name("i"))),
                new Stmt.With(call("open", str("f")), name("handle"), block(new Stmt.Pass())),
                new Stmt.Try(block(new Stmt.Pass()),
                        Collections.singletonList(new Stmt.ExceptHandler(name("Error"), "err", block(new Stmt.Pass()))),
                        block(), block()),
                new Stmt.ClassDef("Local", block(new Stmt.Pass())),
                defStmt(def("helper", params(), assign("hidden", intConst(0)))));

        Set<String> locals = analyzer.collectLocallyAssigned(body);

        assertEquals(new LinkedHashSet<>(Arrays.asList("a", "b", "i", "last", "handle", "err", "Local", "helper")), locals);
    }

    @Test
    void collectTargetNamesHandlesNestedDestructuring() {
        Set<String> names = new LinkedHashSet<>();
        Expr target = tuple(name("a"), list(name("b"), new Expr.Starred(name("c"), false)), subscript(name("d"), intConst(0)));

        VariableUsageAnalyzer.collectTargetNames(target, names);

        assertEquals(new LinkedHashSet<>(Arrays.asList("a", "b", "c")), names);
    }

    @Test
    void nullFragmentIsRejected() {
        ConversionException e = assertThrows(ConversionException.class, () -> analyzer.analyze(null));
        assertEquals(ConversionException.ErrorKind.INVALID_FRAGMENT, e.getKind());
    }
}
