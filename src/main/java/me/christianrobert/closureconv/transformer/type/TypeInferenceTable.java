package me.christianrobert.closureconv.transformer.type;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only results of a prior type inference pass: function return types and the set of
 * user-defined class names.
 * <p>
 * Immutable after {@link Builder#build()}, so one table can be shared by concurrent
 * conversions.
 * </p>
 */
public final class TypeInferenceTable {

    public static final TypeInferenceTable EMPTY = builder().build();

    private final Map<String, TypeInfo> returnTypes;
    private final Set<String> classNames;

    private TypeInferenceTable(Map<String, TypeInfo> returnTypes, Set<String> classNames) {
        this.returnTypes = Collections.unmodifiableMap(new HashMap<>(returnTypes));
        this.classNames = Collections.unmodifiableSet(new HashSet<>(classNames));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<TypeInfo> getReturnType(String functionName) {
        return Optional.ofNullable(returnTypes.get(functionName));
    }

    public boolean isClass(String name) {
        return classNames.contains(name);
    }

    public int size() {
        return returnTypes.size();
    }

    public static final class Builder {
        private final Map<String, TypeInfo> returnTypes = new HashMap<>();
        private final Set<String> classNames = new HashSet<>();

        private Builder() {
        }

        public Builder returnType(String functionName, TypeInfo type) {
            returnTypes.put(functionName, type);
            return this;
        }

        public Builder className(String name) {
            classNames.add(name);
            return this;
        }

        public TypeInferenceTable build() {
            return new TypeInferenceTable(returnTypes, classNames);
        }
    }
}
