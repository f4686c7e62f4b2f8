package me.christianrobert.closureconv.transformer.ast;

import me.christianrobert.closureconv.transformer.type.TypeInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function definition as handed to the closure converter: name, ordered formals, optional
 * {@code *args}/{@code **kwargs} collectors and the ordered body.
 */
public class FunctionFragment {

    private final String name;
    private final List<Parameter> params;
    private final String varArg;
    private final String kwArg;
    private final List<Stmt> body;
    private final TypeInfo returnAnnotation;

    public FunctionFragment(String name, List<Parameter> params, List<Stmt> body) {
        this(name, params, null, null, body, null);
    }

    public FunctionFragment(String name,
                            List<Parameter> params,
                            String varArg,
                            String kwArg,
                            List<Stmt> body,
                            TypeInfo returnAnnotation) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        this.name = name;
        this.params = params == null ? Collections.emptyList() : Collections.unmodifiableList(params);
        this.varArg = varArg;
        this.kwArg = kwArg;
        this.body = body == null ? Collections.emptyList() : Collections.unmodifiableList(body);
        this.returnAnnotation = returnAnnotation;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public String getVarArg() {
        return varArg;
    }

    public String getKwArg() {
        return kwArg;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public TypeInfo getReturnAnnotation() {
        return returnAnnotation;
    }

    /**
     * All names bound by the call itself: formals plus the variadic and keyword collectors.
     */
    public List<String> getFormalNames() {
        List<String> names = new ArrayList<>();
        for (Parameter param : params) {
            names.add(param.getName());
        }
        if (varArg != null) {
            names.add(varArg);
        }
        if (kwArg != null) {
            names.add(kwArg);
        }
        return names;
    }

    public boolean hasFormal(String candidate) {
        return getFormalNames().contains(candidate);
    }

    @Override
    public String toString() {
        return "FunctionFragment{" + name + "(" + getFormalNames() + "), " + body.size() + " statements}";
    }
}
