package microservices.helper.monkeyregistry.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import microservices.helper.monkeyregistry.config.MonkeyRegistryConfig;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.exception.ConflictException;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import microservices.helper.monkeyregistry.repository.JsonFileMonkeyRepository;

/**
 * Full registry lifecycle against the JSON file repository.
 */
class MonkeyRegistryScenarioTest {

    @TempDir
    Path tempDir;

    private MonkeyRegistryService monkeyRegistryService;

    @BeforeEach
    void setUp() {
        JsonFileMonkeyRepository repository = new JsonFileMonkeyRepository(tempDir.resolve("db/monkeys.json"),
                new MonkeyRegistryConfig().objectMapper());
        monkeyRegistryService = new MonkeyRegistryServiceImpl(repository, Clock.systemDefaultZone());
    }

    private MonkeyRecord monkey(String name, String species, int age) {
        return MonkeyRecord.builder().name(name).species(species).ageYears(age).build();
    }

    @Test
    void sameNameIsAllowedAcrossSpeciesButNotWithinOne() {
        MonkeyRecord marmoset = monkeyRegistryService.create(monkey("Luna", "marmoset", 2));
        MonkeyRecord macaque = monkeyRegistryService.create(monkey("Luna", "macaque", 10));

        assertNotEquals(marmoset.getMonkeyId(), macaque.getMonkeyId());
        assertThrows(ConflictException.class, () -> monkeyRegistryService.create(monkey("  luna ", "Marmoset", 4)));
        assertEquals(2, monkeyRegistryService.list(MonkeyFilter.none()).size());
    }

    @Test
    void searchListAndDeleteLifecycle() {
        // Arrange
        MonkeyRecord luna = monkeyRegistryService.create(monkey("Luna", "marmoset", 2));
        monkeyRegistryService.create(monkey("Luna", "macaque", 10));
        monkeyRegistryService.create(monkey("Bongo", "howler", 9));

        // Act & Assert
        List<MonkeyRecord> marmosets = monkeyRegistryService.search("marmo");
        assertEquals(List.of(luna.getMonkeyId()), marmosets.stream().map(MonkeyRecord::getMonkeyId).toList());

        assertEquals(1, monkeyRegistryService.list(MonkeyFilter.of(null, "macaque")).size());
        assertEquals(2, monkeyRegistryService.list(MonkeyFilter.of("LUN", null)).size());
        assertEquals(2, monkeyRegistryService.search("luna").size());

        assertTrue(monkeyRegistryService.delete(luna.getMonkeyId()));
        assertTrue(monkeyRegistryService.get(luna.getMonkeyId()).isEmpty());
        assertFalse(monkeyRegistryService.delete(luna.getMonkeyId()));
        assertTrue(monkeyRegistryService.search("marmo").isEmpty());
    }

    @Test
    void renamingIntoFreedNameSucceedsAfterDelete() {
        MonkeyRecord luna = monkeyRegistryService.create(monkey("Luna", "marmoset", 2));
        MonkeyRecord pip = monkeyRegistryService.create(monkey("Pip", "marmoset", 3));

        assertThrows(ConflictException.class,
                () -> monkeyRegistryService.update(pip.getMonkeyId(), MonkeyRecord.builder().name("Luna").build()));

        monkeyRegistryService.delete(luna.getMonkeyId());
        MonkeyRecord renamed = monkeyRegistryService.update(pip.getMonkeyId(), MonkeyRecord.builder().name("Luna").build())
                .orElseThrow();

        assertEquals("Luna", renamed.getName());
        assertEquals(pip.getCreatedAt(), renamed.getCreatedAt());
        assertTrue(renamed.getUpdatedAt().compareTo(pip.getUpdatedAt()) >= 0);
    }
}
