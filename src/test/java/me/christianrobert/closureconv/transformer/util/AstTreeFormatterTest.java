package me.christianrobert.closureconv.transformer.util;

import me.christianrobert.closureconv.transformer.ast.FunctionFragment;
import me.christianrobert.closureconv.transformer.ast.Parameter;
import me.christianrobert.closureconv.transformer.context.ConversionContext;
import me.christianrobert.closureconv.transformer.type.SimpleTypeEvaluator;
import me.christianrobert.closureconv.transformer.type.TypeInferenceTable;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static me.christianrobert.closureconv.transformer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class AstTreeFormatterTest {

    @Test
    void formatsNestedFunctions() {
        FunctionFragment fragment = def("make_counter", params("start"),
                assign("total", name("start")),
                defStmt(def("increment", params("step"), augAssign("total", "+", name("step")))),
                ret(name("increment")));

        String tree = AstTreeFormatter.format(fragment);

        assertEquals("FunctionDef make_counter(start)\n"
                + "  Assign\n"
                + "    Name \"total\"\n"
                + "    Name \"start\"\n"
                + "  FunctionDef increment(step)\n"
                + "    AugAssign \"+\"\n"
                + "      Name \"total\"\n"
                + "      Name \"step\"\n"
                + "  Return\n"
                + "    Name \"increment\"\n", tree);
    }

    @Test
    void showsDeclaredTypesAndCollectors() {
        FunctionFragment fragment = new FunctionFragment("f",
                Arrays.asList(new Parameter("n", TypeInfo.INT)), "args", "kwargs",
                block(ret(name("n"))), TypeInfo.BOOL);

        String tree = AstTreeFormatter.format(fragment);

        assertTrue(tree.startsWith("FunctionDef f(n: INT, *args, **kwargs) -> BOOL\n"));
    }

    @Test
    void annotatesExpressionTypesWithContext() {
        ConversionContext context = new ConversionContext(new SimpleTypeEvaluator(TypeInferenceTable.EMPTY));
        context.declareVarWithType("items", TypeInfo.LIST);

        String tree = AstTreeFormatter.format(def("f", params(), ret(name("items")), expr(intConst(3))), context);

        assertTrue(tree.contains("    Name \"items\" [TYPE: LIST]\n"));
        assertTrue(tree.contains("    Constant \"3\" [TYPE: INT]\n"));
    }

    @Test
    void truncatesLongText() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            text.append('a');
        }

        String tree = AstTreeFormatter.format(def("f", params(), expr(str(text + "\nb"))));

        assertTrue(tree.contains("Constant \"" + text.substring(0, 50) + "...\""));
    }

    @Test
    void nullFragment() {
        assertEquals("(null tree)", AstTreeFormatter.format(null));
    }
}
