package microservices.helper.monkeyregistry.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.enums.Species;
import microservices.helper.monkeyregistry.exception.ValidationException;

/**
 * Validated monkey. Instances are transient: they are built to validate and
 * normalize input and to produce the {@link MonkeyRecord} handed to a repository,
 * never kept as the source of truth.
 * <p>
 * Every factory runs the full rule set, so an instance is always well formed:
 * <ul>
 *   <li>name is present and 2-40 characters after trimming</li>
 *   <li>species is one of {@link Species}, matched case-insensitively</li>
 *   <li>age is 0-45, or 0-22 for marmosets</li>
 *   <li>last checkup, when present, parses as ISO-8601</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Monkey {

    public static final int MIN_NAME_LENGTH = 2;
    public static final int MAX_NAME_LENGTH = 40;
    public static final int MIN_AGE = 0;

    private static final String ID_PREFIX = "monkey_";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final String monkeyId;
    private final String name;
    private final Species species;
    private final int ageYears;
    private final String favouriteFruit;
    private final String lastCheckupAt;
    private final String createdAt;
    private final String updatedAt;

    private Monkey(String monkeyId, String name, String species, Integer ageYears, String favouriteFruit,
                   String lastCheckupAt, String createdAt, String updatedAt) {
        this.name = validateName(name);
        this.species = Species.fromValue(species);
        this.ageYears = validateAge(ageYears, this.species);
        this.lastCheckupAt = validateLastCheckup(lastCheckupAt);
        this.favouriteFruit = favouriteFruit == null ? "" : favouriteFruit;
        this.monkeyId = monkeyId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Validates a new monkey. Identifier and timestamps are generated unless the
     * input already carries them, as an exported record being re-imported does.
     */
    public static Monkey create(MonkeyRecord fields, Clock clock) {
        String now = timestamp(clock);
        return new Monkey(
                isBlank(fields.getMonkeyId()) ? newId() : fields.getMonkeyId(),
                fields.getName(),
                fields.getSpecies(),
                fields.getAgeYears(),
                fields.getFavouriteFruit(),
                fields.getLastCheckupAt(),
                isBlank(fields.getCreatedAt()) ? now : fields.getCreatedAt(),
                isBlank(fields.getUpdatedAt()) ? now : fields.getUpdatedAt());
    }

    /**
     * Rebuilds a monkey from its persisted form, re-running validation.
     */
    public static Monkey fromRecord(MonkeyRecord record) {
        if (isBlank(record.getMonkeyId())) {
            throw new ValidationException("monkey_id", "monkey_id is required");
        }
        return new Monkey(
                record.getMonkeyId(),
                record.getName(),
                record.getSpecies(),
                record.getAgeYears(),
                record.getFavouriteFruit(),
                record.getLastCheckupAt(),
                record.getCreatedAt(),
                record.getUpdatedAt());
    }

    /**
     * Returns a new, fully re-validated monkey with the provided fields merged in.
     * Null or empty values in {@code updates} keep the current value; the
     * identifier and creation time are carried over and the update time is refreshed.
     */
    public Monkey applyUpdates(MonkeyRecord updates, Clock clock) {
        String now = timestamp(clock);
        // never move updated_at backwards, even if the clock does
        String refreshed = updatedAt != null && updatedAt.compareTo(now) > 0 ? updatedAt : now;
        return new Monkey(
                monkeyId,
                pick(updates.getName(), name),
                pick(updates.getSpecies(), species.getValue()),
                updates.getAgeYears() != null ? updates.getAgeYears() : Integer.valueOf(ageYears),
                pick(updates.getFavouriteFruit(), favouriteFruit),
                pick(updates.getLastCheckupAt(), lastCheckupAt),
                createdAt,
                refreshed);
    }

    public MonkeyRecord toRecord() {
        return MonkeyRecord.builder()
                .monkeyId(monkeyId)
                .name(name)
                .species(species.getValue())
                .ageYears(ageYears)
                .favouriteFruit(favouriteFruit)
                .lastCheckupAt(lastCheckupAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public static String newId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public static String timestamp(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP_FORMAT);
    }

    private static String validateName(String name) {
        if (name == null) {
            throw new ValidationException("name", "name is required");
        }
        String cleaned = name.trim();
        if (cleaned.length() < MIN_NAME_LENGTH || cleaned.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name", "name must be 2-40 characters");
        }
        return cleaned;
    }

    private static int validateAge(Integer ageYears, Species species) {
        if (ageYears == null) {
            throw new ValidationException("age_years", "age_years must be an integer");
        }
        if (ageYears < MIN_AGE || ageYears > Species.MAX_AGE) {
            throw new ValidationException("age_years", "age_years must be between 0 and 45");
        }
        if (ageYears > species.getMaxAge()) {
            throw new ValidationException("age_years",
                    species.getValue() + " age must be <= " + species.getMaxAge());
        }
        return ageYears;
    }

    private static String validateLastCheckup(String lastCheckupAt) {
        if (isBlank(lastCheckupAt)) {
            return null;
        }
        String candidate = lastCheckupAt.trim();
        if (isIsoDateTime(candidate)) {
            return lastCheckupAt;
        }
        // a plain calendar date is also valid ISO-8601
        try {
            LocalDate.parse(candidate);
            return lastCheckupAt;
        } catch (DateTimeParseException e) {
            throw new ValidationException("last_checkup_at", "last_checkup_at must be iso8601", e);
        }
    }

    private static boolean isIsoDateTime(String candidate) {
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(candidate);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String pick(String update, String current) {
        return isBlank(update) ? current : update;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
