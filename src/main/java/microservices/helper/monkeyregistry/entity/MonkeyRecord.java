package microservices.helper.monkeyregistry.entity;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat, persisted form of a monkey. This is the shape written to the JSON file,
 * stored as a DynamoDB item, exchanged over HTTP, and used for import and export.
 * <p>
 * The same type carries partial updates: a {@code null} field means "not provided".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"monkey_id", "name", "species", "age_years", "favourite_fruit",
        "last_checkup_at", "created_at", "updated_at"})
public class MonkeyRecord {

    private String monkeyId;

    private String name;

    private String species;

    private Integer ageYears;

    private String favouriteFruit;

    private String lastCheckupAt; // ISO-8601, stored as given

    private String createdAt;

    private String updatedAt;

    /**
     * Returns a copy of this record with every non-null field of {@code updates} applied.
     * The identifier is never replaced.
     */
    public MonkeyRecord mergedWith(MonkeyRecord updates) {
        MonkeyRecord merged = toBuilder().build();
        if (updates == null) {
            return merged;
        }
        if (updates.getName() != null) {
            merged.setName(updates.getName());
        }
        if (updates.getSpecies() != null) {
            merged.setSpecies(updates.getSpecies());
        }
        if (updates.getAgeYears() != null) {
            merged.setAgeYears(updates.getAgeYears());
        }
        if (updates.getFavouriteFruit() != null) {
            merged.setFavouriteFruit(updates.getFavouriteFruit());
        }
        if (updates.getLastCheckupAt() != null) {
            merged.setLastCheckupAt(updates.getLastCheckupAt());
        }
        if (updates.getCreatedAt() != null) {
            merged.setCreatedAt(updates.getCreatedAt());
        }
        if (updates.getUpdatedAt() != null) {
            merged.setUpdatedAt(updates.getUpdatedAt());
        }
        return merged;
    }
}
