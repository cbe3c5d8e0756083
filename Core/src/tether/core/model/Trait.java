package tether.core.model;

import com.google.gson.JsonObject;
import tether.core.util.ObjectChecker;

import java.util.Objects;

/**
 * A name/value pair attached to a test case, which the external runner can group and filter tests by.
 */
public final class Trait {
    public static final String CATEGORY = "Category";
    public final String name;
    public final String value;

    private Trait(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public static Trait of(String name, String value) {
        ObjectChecker.assertNonNull(name, value);
        return new Trait(name, value);
    }

    /**
     * Returns the trait of a JUnit category, named {@link Trait#CATEGORY} and valued with the category's class name.
     */
    public static Trait category(Class<?> categoryClass) {
        ObjectChecker.assertNonNull(categoryClass);
        return new Trait(CATEGORY, categoryClass.getName());
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", this.name);
        json.addProperty("value", this.value);
        return json;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Trait)) {
            return false;
        }
        Trait that = (Trait) other;
        return this.name.equals(that.name) && this.value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.value);
    }

    @Override
    public String toString() {
        return this.name + "=" + this.value;
    }
}
