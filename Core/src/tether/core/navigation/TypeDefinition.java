package tether.core.navigation;

import java.util.Collections;
import java.util.List;

/**
 * A type as declared in compiled metadata: its binary name, the binary name of its super type (null for the root
 * type) and its declared methods in declaration order.
 */
public final class TypeDefinition {
    public final String name;
    public final String superName;
    public final List<MethodDefinition> methods;

    public TypeDefinition(String name, String superName, List<MethodDefinition> methods) {
        if (name == null) {
            throw new NullPointerException("name must be non-null.");
        }
        if (methods == null) {
            throw new NullPointerException("methods must be non-null.");
        }
        this.name = name;
        this.superName = superName;
        this.methods = Collections.unmodifiableList(methods);
    }

    /**
     * Returns the first declared, non-bridge method with the given name, or null if there is none.
     *
     * @param methodName The method name.
     * @return the method or null.
     */
    public MethodDefinition findDeclaredMethod(String methodName) {
        for (MethodDefinition method : this.methods) {
            if (!method.isBridge && method.name.equals(methodName)) {
                return method;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", super: " + this.superName + ", methods: " + this.methods.size() + " }";
    }
}
