package microservices.helper.monkeyregistry.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.dto.ExportResult;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.enums.ErrorCode;
import microservices.helper.monkeyregistry.enums.StorageBackend;
import microservices.helper.monkeyregistry.exception.MonkeyRegistryException;
import microservices.helper.monkeyregistry.exception.StorageException;
import microservices.helper.monkeyregistry.model.MonkeyFilter;

/**
 * Writes monkeys to a JSON array file, sorted by species then name.
 * Numbers are already plain integers or doubles here; the DynamoDB repository
 * normalizes them when it reads items.
 */
@Service
@AllArgsConstructor
@Slf4j
public class MonkeyExportService {

    private static final Comparator<MonkeyRecord> EXPORT_ORDER = Comparator
            .comparing((MonkeyRecord record) -> Objects.toString(record.getSpecies(), ""))
            .thenComparing(record -> Objects.toString(record.getName(), ""));

    private final MonkeyRegistryService monkeyRegistryService;
    private final ObjectMapper objectMapper;
    private final StorageBackend storageBackend;

    public ExportResult export(Path file, MonkeyFilter filter, boolean pretty, boolean force) {
        log.info("Exporting monkeys to {} filter: {}", file, filter);
        List<MonkeyRecord> rows = monkeyRegistryService.list(filter).stream()
                .sorted(EXPORT_ORDER)
                .collect(Collectors.toList());

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(file) && !force) {
                throw new MonkeyRegistryException(file + " already exists. use force to overwrite.",
                        ErrorCode.EXPORT_TARGET_EXISTS);
            }
            ObjectWriter writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
            writer.writeValue(file.toFile(), rows);
        } catch (IOException e) {
            log.error("Failed to write export file {}", file, e);
            throw new StorageException("error writing " + file, e);
        }

        log.info("Exported {} record(s) to {} from backend={}", rows.size(), file, storageBackend.getValue());
        return ExportResult.builder()
                .backend(storageBackend.getValue())
                .file(file.toString())
                .exported(rows.size())
                .build();
    }
}
