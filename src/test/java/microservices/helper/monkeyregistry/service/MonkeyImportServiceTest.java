package microservices.helper.monkeyregistry.service;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import microservices.helper.monkeyregistry.config.MonkeyRegistryConfig;
import microservices.helper.monkeyregistry.dto.ImportResult;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.enums.ErrorCode;
import microservices.helper.monkeyregistry.enums.ImportMode;
import microservices.helper.monkeyregistry.enums.StorageBackend;
import microservices.helper.monkeyregistry.exception.MonkeyRegistryException;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import microservices.helper.monkeyregistry.repository.JsonFileMonkeyRepository;

class MonkeyImportServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-04-02T14:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private MonkeyRegistryService monkeyRegistryService;
    private MonkeyImportService monkeyImportService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new MonkeyRegistryConfig().objectMapper();
        JsonFileMonkeyRepository repository = new JsonFileMonkeyRepository(tempDir.resolve("monkeys.json"), objectMapper);
        monkeyRegistryService = new MonkeyRegistryServiceImpl(repository, CLOCK);
        monkeyImportService = new MonkeyImportService(monkeyRegistryService, objectMapper, StorageBackend.JSON, CLOCK);
    }

    private Path importFile(String json) throws IOException {
        Path file = tempDir.resolve("import.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void importFile_WhenCreateMode_ShouldCountCreatedSkippedAndFailedRows() throws IOException {
        // Arrange
        Path file = importFile("""
                [
                  {"name": "Luna", "species": "marmoset", "age_years": 2},
                  {"name": "Bongo", "species": "howler", "age_years": 9, "favourite_fruit": "fig"},
                  {"name": "Kiki", "species": "capuchin", "age_years": 7},
                  {"name": "luna", "species": "MARMOSET", "age_years": 3},
                  {"name": "Zed", "species": "macaque", "age_years": 99},
                  {"name": "Half", "species": "macaque", "age_years": 2.5},
                  42
                ]
                """);

        // Act
        ImportResult result = monkeyImportService.importFile(file, ImportMode.CREATE, false);

        // Assert
        assertEquals("json", result.getBackend());
        assertEquals(3, result.getCreated());
        assertEquals(0, result.getUpdated());
        assertEquals(1, result.getSkipped());
        assertEquals(3, result.getFailed());
        assertEquals(7, result.getTotal());
        assertFalse(result.isDryRun());
        assertEquals(3, monkeyRegistryService.list(MonkeyFilter.none()).size());
        assertEquals(2, monkeyRegistryService.findByNameAndSpecies("Luna", "marmoset")
                .map(MonkeyRecord::getAgeYears).orElse(null));
    }

    @Test
    void importFile_WhenUpsertMode_ShouldUpdateExistingNameWithinSpecies() throws IOException {
        // Arrange
        MonkeyRecord existing = monkeyRegistryService.create(MonkeyRecord.builder()
                .name("Luna").species("marmoset").ageYears(2).build());
        Path file = importFile("""
                [
                  {"name": "LUNA", "species": "marmoset", "age_years": 4, "favourite_fruit": "fig"},
                  {"name": "Pip", "species": "capuchin", "age_years": 1}
                ]
                """);

        // Act
        ImportResult result = monkeyImportService.importFile(file, ImportMode.UPSERT, false);

        // Assert
        assertEquals(1, result.getCreated());
        assertEquals(1, result.getUpdated());
        assertEquals(0, result.getSkipped());
        assertEquals(0, result.getFailed());

        MonkeyRecord luna = monkeyRegistryService.get(existing.getMonkeyId()).orElseThrow();
        assertEquals(4, luna.getAgeYears());
        assertEquals("fig", luna.getFavouriteFruit());
        assertEquals(existing.getCreatedAt(), luna.getCreatedAt());
        assertEquals(2, monkeyRegistryService.list(null).size());
    }

    @Test
    void importFile_WhenDryRun_ShouldValidateWithoutWriting() throws IOException {
        // Arrange
        Path file = importFile("""
                [
                  {"name": "Luna", "species": "marmoset", "age_years": 2},
                  {"name": "Bongo", "species": "howler", "age_years": 9},
                  {"name": "X", "species": "howler", "age_years": 9}
                ]
                """);

        // Act
        ImportResult result = monkeyImportService.importFile(file, ImportMode.CREATE, true);

        // Assert
        assertTrue(result.isDryRun());
        assertEquals(2, result.getCreated());
        assertEquals(1, result.getFailed());
        assertEquals(3, result.getTotal());
        assertTrue(monkeyRegistryService.list(null).isEmpty());
    }

    @Test
    void importFile_WhenAgeIsString_ShouldFailRowInsteadOfCoercing() throws IOException {
        Path file = importFile("""
                [
                  {"name": "Pip", "species": "capuchin", "age_years": "3"},
                  {"name": "Momo", "species": "capuchin", "age_years": 3}
                ]
                """);

        ImportResult result = monkeyImportService.importFile(file, ImportMode.CREATE, false);

        assertEquals(1, result.getCreated());
        assertEquals(1, result.getFailed());
        assertTrue(monkeyRegistryService.findByNameAndSpecies("Pip", "capuchin").isEmpty());
    }

    @Test
    void importFile_WhenRowCarriesIdAndTimestamps_ShouldKeepThem() throws IOException {
        Path file = importFile("""
                [{"monkey_id": "monkey_cafe0001", "name": "Kiki", "species": "capuchin", "age_years": 7,
                  "created_at": "2025-11-01T09:00:00", "updated_at": "2025-12-01T09:00:00"}]
                """);

        monkeyImportService.importFile(file, ImportMode.CREATE, false);

        MonkeyRecord kiki = monkeyRegistryService.get("monkey_cafe0001").orElseThrow();
        assertEquals("2025-11-01T09:00:00", kiki.getCreatedAt());
        assertEquals("2025-12-01T09:00:00", kiki.getUpdatedAt());
    }

    @Test
    void importFile_WhenSameIdImportedTwice_ShouldFailSecondRow() throws IOException {
        Path file = importFile("""
                [
                  {"monkey_id": "monkey_cafe0001", "name": "Kiki", "species": "capuchin", "age_years": 7},
                  {"monkey_id": "monkey_cafe0001", "name": "Momo", "species": "capuchin", "age_years": 3}
                ]
                """);

        ImportResult result = monkeyImportService.importFile(file, ImportMode.UPSERT, false);

        assertEquals(1, result.getCreated());
        assertEquals(1, result.getFailed());
    }

    @Test
    void importFile_WhenDocumentIsNotArray_ShouldThrowInvalidImportFile() throws IOException {
        Path file = importFile("{\"name\": \"Luna\"}");

        MonkeyRegistryException exception = assertThrows(MonkeyRegistryException.class,
                () -> monkeyImportService.importFile(file, ImportMode.CREATE, false));
        assertEquals(ErrorCode.INVALID_IMPORT_FILE, exception.getErrorCode());
        assertEquals("json must be an array of objects", exception.getMessage());
    }

    @Test
    void importFile_WhenDocumentIsMalformed_ShouldThrowInvalidImportFile() throws IOException {
        Path file = importFile("[{\"name\": ");

        MonkeyRegistryException exception = assertThrows(MonkeyRegistryException.class,
                () -> monkeyImportService.importFile(file, ImportMode.CREATE, false));
        assertEquals(ErrorCode.INVALID_IMPORT_FILE, exception.getErrorCode());
    }

    @Test
    void importFile_WhenFileMissing_ShouldThrowInvalidImportFile() {
        MonkeyRegistryException exception = assertThrows(MonkeyRegistryException.class,
                () -> monkeyImportService.importFile(tempDir.resolve("absent.json"), ImportMode.CREATE, false));
        assertEquals(ErrorCode.INVALID_IMPORT_FILE, exception.getErrorCode());
    }
}
