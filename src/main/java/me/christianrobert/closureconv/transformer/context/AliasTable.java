package me.christianrobert.closureconv.transformer.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scoped record of which names refer to the same reference-semantics container.
 *
 * <pre>
 * a = [1, 2]
 * b = a        # b -&gt; a
 * c = b        # c -&gt; a
 * b = other    # b -&gt; other, c still reaches a
 * </pre>
 *
 * Frames follow function scopes: aliases made inside a function do not outlive it.
 */
public class AliasTable {

    private final Deque<Map<String, String>> frames = new ArrayDeque<>();

    public AliasTable() {
        frames.push(new LinkedHashMap<>());
    }

    public void push() {
        frames.push(new LinkedHashMap<>());
    }

    public void pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop alias frame: only the root frame is left");
        }
        frames.pop();
    }

    /**
     * Records that {@code alias} refers to the container owned by {@code target}'s root,
     * replacing any earlier target of the alias. Aliasing a name back to its own container
     * records nothing.
     */
    public void put(String alias, String target) {
        if (alias.equals(target)) {
            throw new IllegalArgumentException("A name cannot alias itself: " + alias);
        }
        String owner = rootOf(target);
        if (owner.equals(alias)) {
            return;
        }
        frames.peek().put(alias, owner);
    }

    public void remove(String alias) {
        frames.peek().remove(alias);
    }

    public String getTarget(String alias) {
        for (Map<String, String> frame : frames) {
            String target = frame.get(alias);
            if (target != null) {
                return target;
            }
        }
        return null;
    }

    public boolean isAlias(String name) {
        return getTarget(name) != null;
    }

    /**
     * Follows alias links to the name that owns the container.
     */
    public String rootOf(String name) {
        Set<String> seen = new HashSet<>();
        String current = name;
        String target = getTarget(current);
        while (target != null && seen.add(current)) {
            current = target;
            target = getTarget(current);
        }
        return current;
    }

    public boolean sameContainer(String a, String b) {
        return rootOf(a).equals(rootOf(b));
    }
}
