package org.scssonjava.runtime;

/**
 * Deprecated language features the parser can warn about.
 * <p>
 * Each deprecation has a stable id, used on the command line and in the options
 * file to silence it or make it fatal.
 */
public enum Deprecation {
    ELSEIF("elseif", "@elseif.", "1.3.2");

    private final String id;
    private final String description;
    private final String deprecatedIn;

    Deprecation(String id, String description, String deprecatedIn) {
        this.id = id;
        this.description = description;
        this.deprecatedIn = deprecatedIn;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    // Release that first deprecated this feature
    public String getDeprecatedIn() {
        return deprecatedIn;
    }

    /**
     * Looks up a deprecation by id.
     *
     * @throws IllegalArgumentException if there is no deprecation with that id
     */
    public static Deprecation fromId(String id) {
        for (Deprecation deprecation : values()) {
            if (deprecation.id.equals(id)) {
                return deprecation;
            }
        }
        throw new IllegalArgumentException("Invalid deprecation \"" + id + "\".");
    }

    @Override
    public String toString() {
        return id;
    }
}
