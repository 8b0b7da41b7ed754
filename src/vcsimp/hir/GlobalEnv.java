package vcsimp.hir;

import java.util.LinkedHashMap;
import java.util.Map;

/**
* Read-only oracle for declarations referenced by expressions: struct
* layouts and spec functions. Types of expressions are carried by the nodes
* themselves; integer bounds come from {@link PrimitiveType}.
*/
public class GlobalEnv {

    private final Map<String, StructDecl> structs;

    private final Map<String, SpecFunctionDecl> spec_functions;

    public GlobalEnv() {
        structs = new LinkedHashMap<String, StructDecl>();
        spec_functions = new LinkedHashMap<String, SpecFunctionDecl>();
    }

    /** Registers a struct declaration, replacing one of the same name. */
    public void addStruct(StructDecl decl) {
        structs.put(decl.getName(), decl);
    }

    /** Registers a spec function, replacing one of the same name. */
    public void addSpecFunction(SpecFunctionDecl decl) {
        spec_functions.put(decl.getName(), decl);
    }

    /**
    * Returns the declaration of the named struct.
    *
    * @throws IllegalArgumentException if no such struct is declared.
    */
    public StructDecl getStruct(String name) {
        StructDecl decl = structs.get(name);
        if (decl == null) {
            throw new IllegalArgumentException("undeclared struct " + name);
        }
        return decl;
    }

    /**
    * Returns the declaration of a struct type, or null if the type is not a
    * struct type.
    */
    public StructDecl getStruct(Type type) {
        if (type instanceof StructType) {
            return getStruct(((StructType)type).getName());
        }
        return null;
    }

    /**
    * Returns the declaration of the named spec function.
    *
    * @throws IllegalArgumentException if no such function is declared.
    */
    public SpecFunctionDecl getSpecFunction(String name) {
        SpecFunctionDecl decl = spec_functions.get(name);
        if (decl == null) {
            throw new IllegalArgumentException(
                    "undeclared spec function " + name);
        }
        return decl;
    }

    /** Returns the offset of a field in the layout of its struct. */
    public int getFieldOffset(String struct_name, String field_name) {
        return getStruct(struct_name).getField(field_name).getOffset();
    }

}
