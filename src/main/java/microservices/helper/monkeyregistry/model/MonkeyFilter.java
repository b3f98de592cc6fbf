package microservices.helper.monkeyregistry.model;

import java.util.Locale;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional list filters. Blank values are treated as absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonkeyFilter {

    private String name;

    private String species;

    public static MonkeyFilter none() {
        return new MonkeyFilter();
    }

    public static MonkeyFilter of(String name, String species) {
        return new MonkeyFilter(name, species);
    }

    /** Trimmed lowercase name filter, empty when absent. */
    public String normalizedName() {
        return normalize(name);
    }

    /** Trimmed lowercase species filter, empty when absent. */
    public String normalizedSpecies() {
        return normalize(species);
    }

    public boolean hasName() {
        return !normalizedName().isEmpty();
    }

    public boolean hasSpecies() {
        return !normalizedSpecies().isEmpty();
    }

    public boolean isEmpty() {
        return !hasName() && !hasSpecies();
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
