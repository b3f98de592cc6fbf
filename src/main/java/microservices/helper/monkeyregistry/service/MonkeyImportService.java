package microservices.helper.monkeyregistry.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.dto.ImportResult;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.enums.ErrorCode;
import microservices.helper.monkeyregistry.enums.ImportMode;
import microservices.helper.monkeyregistry.enums.StorageBackend;
import microservices.helper.monkeyregistry.exception.ConflictException;
import microservices.helper.monkeyregistry.exception.MonkeyRegistryException;
import microservices.helper.monkeyregistry.exception.ValidationException;
import microservices.helper.monkeyregistry.model.Monkey;

/**
 * Bulk-loads monkeys from a JSON array file through the registry service.
 * <p>
 * In {@link ImportMode#CREATE} mode rows whose (name, species) already exists are
 * skipped. In {@link ImportMode#UPSERT} mode such a row updates the existing monkey.
 * A dry run validates every row without writing anything.
 */
@Service
@AllArgsConstructor
@Slf4j
public class MonkeyImportService {

    private final MonkeyRegistryService monkeyRegistryService;
    private final ObjectMapper objectMapper;
    private final StorageBackend storageBackend;
    private final Clock clock;

    private enum Outcome { CREATED, UPDATED, SKIPPED }

    public ImportResult importFile(Path file, ImportMode mode, boolean dryRun) {
        log.info("Importing monkeys from {} mode: {}, dryRun: {}", file, mode, dryRun);
        JsonNode rows = readRows(file);

        int created = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;

        for (JsonNode row : rows) {
            try {
                MonkeyRecord record = toRecord(row);
                Monkey.create(record, clock);

                if (dryRun) {
                    created++;
                    continue;
                }

                Outcome outcome = mode == ImportMode.UPSERT ? upsert(record) : insert(record);
                switch (outcome) {
                    case CREATED -> created++;
                    case UPDATED -> updated++;
                    default -> skipped++;
                }
            } catch (ConflictException e) {
                if (e.isDuplicateName()) {
                    skipped++;
                } else {
                    failed++;
                }
                logSkippedRow(row, e);
            } catch (MonkeyRegistryException e) {
                failed++;
                logSkippedRow(row, e);
            }
        }

        ImportResult result = ImportResult.builder()
                .backend(storageBackend.getValue())
                .created(created)
                .updated(updated)
                .skipped(skipped)
                .failed(failed)
                .total(rows.size())
                .dryRun(dryRun)
                .build();
        log.info("Import done on backend={}. created={}, updated={}, skipped={}, failed={}, total={}",
                result.getBackend(), created, updated, skipped, failed, result.getTotal());
        return result;
    }

    private JsonNode readRows(Path file) {
        JsonNode rows;
        try {
            rows = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.error("Failed to read import file {}", file, e);
            throw new MonkeyRegistryException("error reading " + file.getFileName() + ": not a readable json file", e,
                    ErrorCode.INVALID_IMPORT_FILE);
        }
        if (rows == null || !rows.isArray()) {
            throw new MonkeyRegistryException("json must be an array of objects", ErrorCode.INVALID_IMPORT_FILE);
        }
        return rows;
    }

    private MonkeyRecord toRecord(JsonNode row) {
        if (!row.isObject()) {
            throw new ValidationException("row", "row must be a json object");
        }
        try {
            return objectMapper.treeToValue(row, MonkeyRecord.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("row", "row does not match the monkey record format: " + e.getOriginalMessage(), e);
        }
    }

    private Outcome insert(MonkeyRecord record) {
        monkeyRegistryService.create(record);
        return Outcome.CREATED;
    }

    private Outcome upsert(MonkeyRecord record) {
        try {
            monkeyRegistryService.create(record);
            return Outcome.CREATED;
        } catch (ConflictException e) {
            if (!e.isDuplicateName()) {
                throw e;
            }
        }
        // Name already taken within the species: update that monkey instead
        Optional<MonkeyRecord> existing = monkeyRegistryService.findByNameAndSpecies(record.getName(), record.getSpecies());
        if (existing.isEmpty()) {
            return Outcome.SKIPPED;
        }
        return monkeyRegistryService.update(existing.get().getMonkeyId(), record).isPresent()
                ? Outcome.UPDATED
                : Outcome.SKIPPED;
    }

    private void logSkippedRow(JsonNode row, Exception e) {
        log.warn("skip: {} for row name={} species={}", e.getMessage(), row.path("name").asText(null),
                row.path("species").asText(null));
    }
}
