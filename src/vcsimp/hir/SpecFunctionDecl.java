package vcsimp.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Declaration of a spec function. Only non-native, interpreted functions
* with a body can be unfolded.
*/
public final class SpecFunctionDecl {

    private final String name;

    private final List<Symbol> params;

    private final List<Type> param_types;

    private final Type result_type;

    private final Expression body;

    private final boolean is_native;

    private final boolean uninterpreted;

    public SpecFunctionDecl(String name, List<Symbol> params,
            List<Type> param_types, Type result_type, Expression body,
            boolean is_native, boolean uninterpreted) {
        if (params.size() != param_types.size()) {
            throw new IllegalArgumentException(
                    "parameter and type lists differ in " + name);
        }
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<Symbol>(params));
        this.param_types =
                Collections.unmodifiableList(new ArrayList<Type>(param_types));
        this.result_type = result_type;
        this.body = body;
        this.is_native = is_native;
        this.uninterpreted = uninterpreted;
    }

    public String getName() {
        return name;
    }

    public List<Symbol> getParameters() {
        return params;
    }

    public List<Type> getParameterTypes() {
        return param_types;
    }

    public Type getResultType() {
        return result_type;
    }

    /** Returns the defining expression, or null if there is none. */
    public Expression getBody() {
        return body;
    }

    public boolean isNative() {
        return is_native;
    }

    public boolean isUninterpreted() {
        return uninterpreted;
    }

    /** Checks if calls of this function may be replaced by its body. */
    public boolean isUnfoldable() {
        return !is_native && !uninterpreted && body != null;
    }

}
