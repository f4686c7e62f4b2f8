package me.christianrobert.closureconv.transformer.context;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scoped mapping from source names to the identifiers emitted for them.
 *
 * <p>A frame is pushed when a closure body is entered and popped when it is left, so renames
 * made for one closure (parameters, captured fields) never leak into a sibling closure.</p>
 *
 * <pre>
 * module frame:   counter -&gt; __closure_counter_0
 *   closure frame: n -&gt; __p_n_1, total -&gt; __cap_counter_0.total
 *
 * resolve("n")       -&gt; __p_n_1 (inside the closure)
 * resolve("counter") -&gt; __closure_counter_0
 * resolve("other")   -&gt; other
 * </pre>
 *
 * <p>Mapping a name to itself masks any outer rename of that name.</p>
 */
public class RenameTable {

    private final Deque<Map<String, String>> frames = new ArrayDeque<>();

    public RenameTable() {
        frames.push(new LinkedHashMap<>());
    }

    public void push() {
        frames.push(new LinkedHashMap<>());
    }

    /**
     * Pops the innermost frame and returns its entries.
     *
     * @throws IllegalStateException if only the root frame is left
     */
    public Map<String, String> pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop rename frame: only the root frame is left");
        }
        return Collections.unmodifiableMap(frames.pop());
    }

    public void put(String name, String identifier) {
        frames.peek().put(name, identifier);
    }

    /**
     * Removes a rename from the innermost frame only.
     */
    public void remove(String name) {
        frames.peek().remove(name);
    }

    public Optional<String> lookup(String name) {
        for (Map<String, String> frame : frames) {
            String identifier = frame.get(name);
            if (identifier != null) {
                return Optional.of(identifier);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the active identifier for a name, or the name itself when it is not renamed.
     */
    public String resolve(String name) {
        return lookup(name).orElse(name);
    }

    public boolean isRenamed(String name) {
        return !resolve(name).equals(name);
    }

    public Map<String, String> currentFrame() {
        return Collections.unmodifiableMap(frames.peek());
    }

    public int depth() {
        return frames.size();
    }

    @Override
    public String toString() {
        return "RenameTable{depth=" + frames.size() + ", current=" + frames.peek() + "}";
    }
}
