package microservices.helper.monkeyregistry.repository;

import java.util.List;
import java.util.Optional;

import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.model.MonkeyFilter;

/**
 * Storage contract shared by every backend.
 * <p>
 * Implementations persist {@link MonkeyRecord}s as given; model validation and the
 * (name, species) uniqueness rule are enforced by the registry service before a record
 * reaches a repository. A missing record is reported as an empty result, never as an
 * exception.
 *
 * @see JsonFileMonkeyRepository
 * @see DynamoDbMonkeyRepository
 */
public interface MonkeyRepository {

    /**
     * Persists a new record.
     *
     * @throws microservices.helper.monkeyregistry.exception.ConflictException if the identifier already exists
     */
    MonkeyRecord create(MonkeyRecord record);

    Optional<MonkeyRecord> findById(String monkeyId);

    /**
     * Overwrites the stored values with every non-null field of {@code updates}.
     * No model validation happens here.
     *
     * @return the updated record, or empty if no record has this identifier
     */
    Optional<MonkeyRecord> update(String monkeyId, MonkeyRecord updates);

    /**
     * @return {@code true} if a record was removed, {@code false} if none existed
     */
    boolean deleteById(String monkeyId);

    /**
     * Lists records matching the filter: species is an exact case-insensitive match,
     * name a case-insensitive substring. An empty filter returns every record.
     */
    List<MonkeyRecord> findAll(MonkeyFilter filter);

    /**
     * Case-insensitive substring search over name or species.
     * A blank query returns an empty list.
     */
    List<MonkeyRecord> search(String query);

    /**
     * Exact case-insensitive lookup on both fields, used for uniqueness checks.
     */
    Optional<MonkeyRecord> findByNameAndSpecies(String name, String species);
}
