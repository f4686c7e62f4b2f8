package me.christianrobert.closureconv.transformer.context;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-conversion settings, usually filled from the configuration service.
 */
public class ConversionOptions {

    /**
     * What to emit as the return type of a closure whose return type could not be inferred.
     */
    public enum UnknownReturnPolicy {
        UNKNOWN,      // explicit runtime.Unknown, fails the later type check
        PLACEHOLDER   // configured placeholder type
    }

    private UnknownReturnPolicy unknownReturnPolicy = UnknownReturnPolicy.UNKNOWN;
    private String placeholderType = "i64";
    private String defaultParamType = "i64";
    private boolean fallibleReturns = true;
    private boolean defaultReturn = true;
    private Set<String> importedModules = new LinkedHashSet<>();

    public static ConversionOptions defaults() {
        return new ConversionOptions();
    }

    public UnknownReturnPolicy getUnknownReturnPolicy() {
        return unknownReturnPolicy;
    }

    public ConversionOptions setUnknownReturnPolicy(UnknownReturnPolicy unknownReturnPolicy) {
        this.unknownReturnPolicy = unknownReturnPolicy;
        return this;
    }

    public String getPlaceholderType() {
        return placeholderType;
    }

    public ConversionOptions setPlaceholderType(String placeholderType) {
        this.placeholderType = placeholderType;
        return this;
    }

    public String getDefaultParamType() {
        return defaultParamType;
    }

    public ConversionOptions setDefaultParamType(String defaultParamType) {
        this.defaultParamType = defaultParamType;
        return this;
    }

    public boolean isFallibleReturns() {
        return fallibleReturns;
    }

    public ConversionOptions setFallibleReturns(boolean fallibleReturns) {
        this.fallibleReturns = fallibleReturns;
        return this;
    }

    public boolean isDefaultReturn() {
        return defaultReturn;
    }

    public ConversionOptions setDefaultReturn(boolean defaultReturn) {
        this.defaultReturn = defaultReturn;
        return this;
    }

    public Set<String> getImportedModules() {
        return Collections.unmodifiableSet(importedModules);
    }

    public ConversionOptions setImportedModules(Set<String> importedModules) {
        this.importedModules = new LinkedHashSet<>(importedModules);
        return this;
    }
}
