package me.christianrobert.closureconv.transformer.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RenameTableTest {

    private RenameTable renames;

    @BeforeEach
    void setUp() {
        renames = new RenameTable();
    }

    @Test
    void unknownNameResolvesToItself() {
        assertEquals("total", renames.resolve("total"));
        assertFalse(renames.isRenamed("total"));
        assertTrue(renames.lookup("total").isEmpty());
    }

    @Test
    void innerFrameWinsOverOuterFrame() {
        renames.put("x", "__p_x_0");
        renames.push();
        renames.put("x", "__p_x_1");

        assertEquals("__p_x_1", renames.resolve("x"));

        renames.pop();
        assertEquals("__p_x_0", renames.resolve("x"));
    }

    @Test
    void poppedFrameDoesNotLeakIntoSibling() {
        // Given: first closure frame renames its parameter
        renames.push();
        renames.put("n", "__p_n_1");
        Map<String, String> popped = renames.pop();

        // When: sibling closure frame is entered
        renames.push();

        // Then
        assertEquals("__p_n_1", popped.get("n"));
        assertEquals("n", renames.resolve("n"));
    }

    @Test
    void identityEntryMasksOuterRename() {
        renames.put("count", "__cap_inc_0.count");
        renames.push();
        renames.put("count", "count");

        assertEquals("count", renames.resolve("count"));
        assertFalse(renames.isRenamed("count"));
    }

    @Test
    void popOfRootFrameFails() {
        assertThrows(IllegalStateException.class, () -> renames.pop());
        assertEquals(1, renames.depth());
    }

    @Test
    void removeOnlyAffectsInnermostFrame() {
        renames.put("y", "outer_y");
        renames.push();
        renames.put("y", "inner_y");
        renames.remove("y");

        assertEquals("outer_y", renames.resolve("y"));
        assertTrue(renames.currentFrame().isEmpty());
    }
}
