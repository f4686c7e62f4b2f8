package me.christianrobert.closureconv.transformer.analysis;

import me.christianrobert.closureconv.transformer.ast.Parameter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ArrayList;
import java.util.Set;

/**
 * Result of {@link VariableUsageAnalyzer#analyze}: which names a function body reads, which
 * it binds locally, and whether it calls itself.
 */
public class UsageAnalysis {

    private final String functionName;
    private final List<String> referencedNames;
    private final Set<String> locallyAssigned;
    private final boolean selfRecursive;

    public UsageAnalysis(String functionName,
                         Collection<String> referencedNames,
                         Collection<String> locallyAssigned,
                         boolean selfRecursive) {
        this.functionName = functionName;
        this.referencedNames = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(referencedNames)));
        this.locallyAssigned = Collections.unmodifiableSet(new LinkedHashSet<>(locallyAssigned));
        this.selfRecursive = selfRecursive;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Names read in the body, in first-seen order, without duplicates.
     */
    public List<String> getReferencedNames() {
        return referencedNames;
    }

    /**
     * Names bound by the body itself (assignments, loop and exception targets, nested defs).
     */
    public Set<String> getLocallyAssigned() {
        return locallyAssigned;
    }

    public boolean isSelfRecursive() {
        return selfRecursive;
    }

    public boolean isReferenced(String name) {
        return referencedNames.contains(name);
    }

    public boolean isLocallyAssigned(String name) {
        return locallyAssigned.contains(name);
    }

    public boolean isParameterUsed(Parameter param) {
        return isParameterUsed(param.getName());
    }

    public boolean isParameterUsed(String paramName) {
        return referencedNames.contains(paramName);
    }

    /**
     * A formal that is also an assignment target needs a private mutable copy.
     */
    public boolean isParameterReassigned(Parameter param) {
        return isParameterReassigned(param.getName());
    }

    public boolean isParameterReassigned(String paramName) {
        return locallyAssigned.contains(paramName);
    }

    /**
     * True if at least one of the given captured names is read in the body.
     */
    public boolean areCapturesUsed(Collection<String> captureNames) {
        for (String name : captureNames) {
            if (referencedNames.contains(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "UsageAnalysis{" +
                "function=" + functionName +
                ", reads=" + referencedNames +
                ", locals=" + locallyAssigned +
                ", selfRecursive=" + selfRecursive +
                '}';
    }
}
