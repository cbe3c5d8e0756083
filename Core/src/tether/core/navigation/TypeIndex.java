package tether.core.navigation;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * All the types defined in one compiled assembly, keyed by binary name ("pkg.Outer$Inner").
 *
 * Names handed to {@link TypeIndex#find(String)} are standardized first, so callers may use "+" as the nested
 * type separator or "/" as the package separator.
 */
public final class TypeIndex {
    private final Map<String, TypeDefinition> types;

    private TypeIndex(Map<String, TypeDefinition> types) {
        this.types = types;
    }

    /**
     * Indexes the given types. A later type with the same name replaces an earlier one.
     *
     * @param types The types to index.
     * @return the index.
     */
    public static TypeIndex of(Collection<TypeDefinition> types) {
        if (types == null) {
            throw new NullPointerException("types must be non-null.");
        }
        Map<String, TypeDefinition> typesByName = new HashMap<>();
        for (TypeDefinition type : types) {
            typesByName.put(type.name, type);
        }
        return new TypeIndex(Collections.unmodifiableMap(typesByName));
    }

    public TypeDefinition find(String typeName) {
        if (typeName == null) {
            return null;
        }
        return this.types.get(standardizeTypeName(typeName));
    }

    public int size() {
        return this.types.size();
    }

    /**
     * Converts a type name to the binary-name convention the index is keyed by: "+" separates nested types and
     * "/" separates packages in some callers' conventions, while the index uses "$" and "." respectively.
     *
     * @param typeName The type name.
     * @return the standardized name.
     */
    public static String standardizeTypeName(String typeName) {
        return typeName.replace('+', '$').replace('/', '.');
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { types: " + this.types.size() + " }";
    }
}
