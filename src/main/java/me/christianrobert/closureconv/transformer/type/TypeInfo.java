package me.christianrobert.closureconv.transformer.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Represents the inferred type of a source variable or expression.
 * <p>
 * Used by capture analysis (to record a captured variable's type at capture time), by the
 * shadow resolver (to decide whether a reassignment is compatible) and by the code builder
 * (to render parameter, field and return types in the target language).
 * </p>
 * <p>
 * LIST, DICT and SET have reference semantics: two names bound to the same container observe
 * each other's mutations. Everything else is a value.
 * </p>
 */
public class TypeInfo {

    // Pre-defined common types for convenience
    public static final TypeInfo UNKNOWN = new TypeInfo(TypeCategory.UNKNOWN, null, null);
    public static final TypeInfo INT = new TypeInfo(TypeCategory.INT, null, null);
    public static final TypeInfo FLOAT = new TypeInfo(TypeCategory.FLOAT, null, null);
    public static final TypeInfo BOOL = new TypeInfo(TypeCategory.BOOL, null, null);
    public static final TypeInfo STRING = new TypeInfo(TypeCategory.STRING, null, null);
    public static final TypeInfo BYTES = new TypeInfo(TypeCategory.BYTES, null, null);
    public static final TypeInfo NONE = new TypeInfo(TypeCategory.NONE, null, null);
    public static final TypeInfo LIST = new TypeInfo(TypeCategory.LIST, null, null);
    public static final TypeInfo DICT = new TypeInfo(TypeCategory.DICT, null, null);
    public static final TypeInfo SET = new TypeInfo(TypeCategory.SET, null, null);
    public static final TypeInfo TUPLE = new TypeInfo(TypeCategory.TUPLE, null, null);
    public static final TypeInfo CLOSURE = new TypeInfo(TypeCategory.CLOSURE, null, null);

    private final TypeCategory category;
    private final String className;
    private final List<TypeInfo> members;

    private TypeInfo(TypeCategory category, String className, List<TypeInfo> members) {
        this.category = category;
        this.className = className;
        this.members = members == null ? Collections.emptyList() : Collections.unmodifiableList(members);
    }

    /**
     * Creates an instance type of a user-defined class.
     */
    public static TypeInfo classInstance(String className) {
        if (className == null || className.isEmpty()) {
            throw new IllegalArgumentException("Class name cannot be null or empty");
        }
        return new TypeInfo(TypeCategory.CLASS_INSTANCE, className, null);
    }

    /**
     * Creates a union of the given types. Nested unions are flattened and duplicates dropped;
     * a union of a single distinct type collapses to that type.
     */
    public static TypeInfo union(List<TypeInfo> types) {
        Set<TypeInfo> flat = new LinkedHashSet<>();
        for (TypeInfo type : types) {
            if (type.isUnion()) {
                flat.addAll(type.members);
            } else {
                flat.add(type);
            }
        }
        if (flat.isEmpty()) {
            return UNKNOWN;
        }
        if (flat.size() == 1) {
            return flat.iterator().next();
        }
        return new TypeInfo(TypeCategory.UNION, null, new ArrayList<>(flat));
    }

    // Category checks
    public boolean isUnknown() {
        return category == TypeCategory.UNKNOWN;
    }

    public boolean isUnion() {
        return category == TypeCategory.UNION;
    }

    public boolean isClassInstance() {
        return category == TypeCategory.CLASS_INSTANCE;
    }

    public boolean isNone() {
        return category == TypeCategory.NONE;
    }

    /**
     * int, float, bool and str.
     */
    public boolean isPrimitive() {
        return category == TypeCategory.INT
                || category == TypeCategory.FLOAT
                || category == TypeCategory.BOOL
                || category == TypeCategory.STRING;
    }

    /**
     * LIST, DICT and SET: containers shared by reference.
     */
    public boolean isReferenceContainer() {
        return category == TypeCategory.LIST
                || category == TypeCategory.DICT
                || category == TypeCategory.SET;
    }

    /**
     * LIST and TUPLE.
     */
    public boolean isSequence() {
        return category == TypeCategory.LIST || category == TypeCategory.TUPLE;
    }

    /**
     * DICT and SET.
     */
    public boolean isHashed() {
        return category == TypeCategory.DICT || category == TypeCategory.SET;
    }

    /**
     * A union whose members are all primitives or None can be carried as a tagged value.
     */
    public boolean isPrimitiveUnion() {
        if (!isUnion()) {
            return false;
        }
        for (TypeInfo member : members) {
            if (!member.isPrimitive() && !member.isNone()) {
                return false;
            }
        }
        return true;
    }

    // Getters
    public TypeCategory getCategory() {
        return category;
    }

    public String getClassName() {
        return className;
    }

    public List<TypeInfo> getMembers() {
        return members;
    }

    /**
     * Returns the type as written in the generated code.
     */
    public String toNativeType() {
        switch (category) {
            case INT:
                return "i64";
            case FLOAT:
                return "f64";
            case BOOL:
                return "bool";
            case STRING:
            case BYTES:
                return "[]const u8";
            case NONE:
                return "void";
            case LIST:
                return "runtime.PyList";
            case DICT:
                return "runtime.PyDict";
            case SET:
                return "runtime.PySet";
            case TUPLE:
                return "runtime.PyTuple";
            case CLASS_INSTANCE:
                return "*" + className;
            case CLOSURE:
                return "runtime.PyCallable";
            case UNION:
                return "runtime.PyValue";
            default:
                return "runtime.Unknown";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeInfo typeInfo = (TypeInfo) o;
        return category == typeInfo.category &&
                Objects.equals(className, typeInfo.className) &&
                Objects.equals(members, typeInfo.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, className, members);
    }

    @Override
    public String toString() {
        if (category == TypeCategory.CLASS_INSTANCE) {
            return "TypeInfo{" + className + ", category=" + category + "}";
        }
        if (category == TypeCategory.UNION) {
            return "TypeInfo{" + members + ", category=" + category + "}";
        }
        return "TypeInfo{" + category + "}";
    }

    /**
     * Broad category of source types.
     */
    public enum TypeCategory {
        UNKNOWN,         // Type could not be determined
        INT,
        FLOAT,
        BOOL,
        STRING,
        BYTES,
        NONE,
        LIST,            // reference semantics
        DICT,            // reference semantics
        SET,             // reference semantics
        TUPLE,
        CLASS_INSTANCE,  // instance of a user-defined class
        CLOSURE,         // lambda or converted nested function
        UNION            // more than one type reaches this point
    }
}
