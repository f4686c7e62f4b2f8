package me.christianrobert.closureconv.transformer.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, duplicate-free set of captured variables. Order is first use in the body.
 */
public class CaptureSet implements Iterable<CapturedVariable> {

    public static final CaptureSet EMPTY = new CaptureSet(Collections.emptyList());

    private final List<CapturedVariable> variables;

    public CaptureSet(List<CapturedVariable> variables) {
        List<CapturedVariable> unique = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (CapturedVariable variable : variables) {
            if (!seen.contains(variable.getName())) {
                seen.add(variable.getName());
                unique.add(variable);
            }
        }
        this.variables = Collections.unmodifiableList(unique);
    }

    public List<CapturedVariable> getVariables() {
        return variables;
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>();
        for (CapturedVariable variable : variables) {
            names.add(variable.getName());
        }
        return names;
    }

    /**
     * Captured aliases, held by reference and not owned by the environment.
     */
    public List<CapturedVariable> getBorrowed() {
        List<CapturedVariable> borrowed = new ArrayList<>();
        for (CapturedVariable variable : variables) {
            if (variable.isAlias()) {
                borrowed.add(variable);
            }
        }
        return borrowed;
    }

    public CapturedVariable get(String name) {
        for (CapturedVariable variable : variables) {
            if (variable.getName().equals(name)) {
                return variable;
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public int size() {
        return variables.size();
    }

    @Override
    public Iterator<CapturedVariable> iterator() {
        return variables.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return variables.equals(((CaptureSet) o).variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "CaptureSet" + variables;
    }
}
