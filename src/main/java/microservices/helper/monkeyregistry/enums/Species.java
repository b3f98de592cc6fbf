package microservices.helper.monkeyregistry.enums;

import java.util.Locale;

import microservices.helper.monkeyregistry.exception.ValidationException;

public enum Species {
    CAPUCHIN("capuchin"),
    MACAQUE("macaque"),
    MARMOSET("marmoset"),
    HOWLER("howler");

    public static final int MAX_AGE = 45;
    private static final int MARMOSET_MAX_AGE = 22;

    private final String value;

    Species(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Oldest age in years accepted for this species.
     */
    public int getMaxAge() {
        return this == MARMOSET ? MARMOSET_MAX_AGE : MAX_AGE;
    }

    public static Species fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Species species : values()) {
                if (species.value.equals(normalized)) {
                    return species;
                }
            }
        }
        throw new ValidationException("species", "species must be one of: capuchin, macaque, marmoset, howler");
    }
}
