package microservices.helper.monkeyregistry.repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.exception.ConflictException;
import microservices.helper.monkeyregistry.exception.StorageException;
import microservices.helper.monkeyregistry.model.MonkeyFilter;

/**
 * Stores the whole dataset as one JSON array.
 * <p>
 * Every call reads the complete snapshot and every mutation writes the complete
 * snapshot back. Suitable for small datasets only, and not safe with more than one
 * writer: two processes racing a read-modify-write cycle silently lose one update.
 * A syntactically broken document is read as an empty dataset; a well-formed document
 * whose rows do not bind to records fails with {@link StorageException} instead.
 */
@Slf4j
public class JsonFileMonkeyRepository implements MonkeyRepository {

    private static final TypeReference<List<MonkeyRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileMonkeyRepository(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        initialize();
    }

    private void initialize() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.notExists(path)) {
                Files.writeString(path, "[]");
                log.info("Created empty monkey database at {}", path);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize monkey database at " + path, e);
        }
    }

    private List<MonkeyRecord> loadAll() {
        try {
            if (Files.notExists(path)) {
                return new ArrayList<>();
            }
            String content = Files.readString(path);
            if (content.isBlank()) {
                return new ArrayList<>();
            }
            List<MonkeyRecord> records = objectMapper.readValue(content, RECORD_LIST);
            if (records == null) {
                return new ArrayList<>();
            }
            return records.stream().filter(Objects::nonNull).collect(Collectors.toCollection(ArrayList::new));
        } catch (JsonParseException e) {
            log.debug("Monkey database at {} is not readable JSON, treating it as empty", path, e);
            return new ArrayList<>();
        } catch (JsonMappingException e) {
            // well-formed JSON that does not bind is never overwritten
            log.error("Monkey database at {} holds records that do not map to monkeys", path, e);
            throw new StorageException("Monkey database at " + path + " holds invalid records: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StorageException("Failed to read monkey database at " + path, e);
        }
    }

    private void saveAll(List<MonkeyRecord> records) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), records);
        } catch (IOException e) {
            throw new StorageException("Failed to write monkey database at " + path, e);
        }
    }

    @Override
    public MonkeyRecord create(MonkeyRecord record) {
        List<MonkeyRecord> records = loadAll();
        boolean exists = records.stream().anyMatch(it -> Objects.equals(it.getMonkeyId(), record.getMonkeyId()));
        if (exists) {
            throw ConflictException.duplicateId(record.getMonkeyId());
        }
        records.add(record);
        saveAll(records);
        log.info("Created monkey {} in {}", record.getMonkeyId(), path);
        return record;
    }

    @Override
    public Optional<MonkeyRecord> findById(String monkeyId) {
        return loadAll().stream()
                .filter(it -> Objects.equals(it.getMonkeyId(), monkeyId))
                .findFirst();
    }

    @Override
    public Optional<MonkeyRecord> update(String monkeyId, MonkeyRecord updates) {
        List<MonkeyRecord> records = loadAll();
        for (int i = 0; i < records.size(); i++) {
            MonkeyRecord current = records.get(i);
            if (Objects.equals(current.getMonkeyId(), monkeyId)) {
                MonkeyRecord merged = current.mergedWith(updates);
                records.set(i, merged);
                saveAll(records);
                log.info("Updated monkey {} in {}", monkeyId, path);
                return Optional.of(merged);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean deleteById(String monkeyId) {
        List<MonkeyRecord> records = loadAll();
        boolean removed = records.removeIf(it -> Objects.equals(it.getMonkeyId(), monkeyId));
        if (removed) {
            saveAll(records);
            log.info("Deleted monkey {} from {}", monkeyId, path);
        }
        return removed;
    }

    @Override
    public List<MonkeyRecord> findAll(MonkeyFilter filter) {
        List<MonkeyRecord> records = loadAll();
        if (filter == null || filter.isEmpty()) {
            return records;
        }
        String name = filter.normalizedName();
        String species = filter.normalizedSpecies();
        return records.stream()
                .filter(it -> name.isEmpty() || lower(it.getName()).contains(name))
                .filter(it -> species.isEmpty() || lower(it.getSpecies()).equals(species))
                .collect(Collectors.toList());
    }

    @Override
    public List<MonkeyRecord> search(String query) {
        String q = MonkeyFilter.normalize(query);
        if (q.isEmpty()) {
            return List.of();
        }
        return loadAll().stream()
                .filter(it -> lower(it.getName()).contains(q) || lower(it.getSpecies()).contains(q))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<MonkeyRecord> findByNameAndSpecies(String name, String species) {
        String n = MonkeyFilter.normalize(name);
        String s = MonkeyFilter.normalize(species);
        return loadAll().stream()
                .filter(it -> MonkeyFilter.normalize(it.getName()).equals(n)
                        && MonkeyFilter.normalize(it.getSpecies()).equals(s))
                .findFirst();
    }

    private static String lower(String value) {
        return MonkeyFilter.normalize(value);
    }
}
