package me.christianrobert.closureconv.transformer.closure;

import me.christianrobert.closureconv.transformer.analysis.CaptureSet;
import me.christianrobert.closureconv.transformer.analysis.CapturedVariable;
import me.christianrobert.closureconv.transformer.context.BindingKind;
import me.christianrobert.closureconv.transformer.type.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class RepresentationSelectorTest {

    private RepresentationSelector selector;
    private CaptureSet oneCapture;

    @BeforeEach
    void setUp() {
        selector = new RepresentationSelector();
        oneCapture = new CaptureSet(Collections.singletonList(
                new CapturedVariable("base", BindingKind.PARAMETER, TypeInfo.INT, null)));
    }

    @Test
    void noCapturesNoRecursionIsZeroCapture() {
        assertEquals(ClosureShape.ZERO_CAPTURE, selector.select(CaptureSet.EMPTY, false).getShape());
        assertEquals(ClosureShape.ZERO_CAPTURE, selector.select(null, false).getShape());
    }

    @Test
    void capturesWithoutRecursionIsStructCapture() {
        ClosureRepresentation representation = selector.select(oneCapture, false);

        assertEquals(ClosureShape.STRUCT_CAPTURE, representation.getShape());
        assertEquals(oneCapture, representation.getCaptures());
    }

    @Test
    void recursionWinsRegardlessOfCaptures() {
        assertEquals(ClosureShape.RECURSIVE_SELF_CAPTURE, selector.select(CaptureSet.EMPTY, true).getShape());
        assertEquals(ClosureShape.RECURSIVE_SELF_CAPTURE, selector.select(oneCapture, true).getShape());
    }

    @Test
    void selectionIsDeterministic() {
        assertEquals(selector.select(oneCapture, false), selector.select(oneCapture, false));
        assertEquals(selector.select(oneCapture, true), selector.select(oneCapture, true));
    }

    @Test
    void structCaptureRequiresCaptures() {
        assertThrows(IllegalArgumentException.class, () -> ClosureRepresentation.structCapture(CaptureSet.EMPTY));
    }
}
