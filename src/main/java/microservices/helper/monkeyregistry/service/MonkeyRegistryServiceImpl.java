package microservices.helper.monkeyregistry.service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.exception.ConflictException;
import microservices.helper.monkeyregistry.model.Monkey;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import microservices.helper.monkeyregistry.repository.MonkeyRepository;

/**
 * Applies the rules that hold whichever repository is configured: model validation
 * before any write, and the (name, species) uniqueness invariant.
 */
@Service
@AllArgsConstructor
@Slf4j
public class MonkeyRegistryServiceImpl implements MonkeyRegistryService {

    private final MonkeyRepository monkeyRepository;
    private final Clock clock;

    @Override
    public MonkeyRecord create(MonkeyRecord input) {
        log.info("Creating monkey name: {}, species: {}", input.getName(), input.getSpecies());

        // STEP 1: validate and normalize, nothing invalid reaches the repository
        Monkey monkey = Monkey.create(input, clock);

        // STEP 2: enforce (name, species) uniqueness
        ensureUniqueNameAndSpecies(monkey, null);

        // STEP 3: persist; the repository still rejects a duplicate identifier
        return monkeyRepository.create(monkey.toRecord());
    }

    @Override
    public Optional<MonkeyRecord> get(String monkeyId) {
        return monkeyRepository.findById(monkeyId);
    }

    @Override
    public Optional<MonkeyRecord> update(String monkeyId, MonkeyRecord updates) {
        log.info("Updating monkey {}", monkeyId);

        Optional<MonkeyRecord> current = monkeyRepository.findById(monkeyId);
        if (current.isEmpty()) {
            log.info("Monkey {} not found, nothing to update", monkeyId);
            return Optional.empty();
        }

        // Re-run the full rule set on the merged result, not only the changed fields
        Monkey updated = Monkey.fromRecord(current.get()).applyUpdates(updates, clock);
        ensureUniqueNameAndSpecies(updated, monkeyId);

        // Persist the complete record so timestamps stay consistent
        return monkeyRepository.update(monkeyId, updated.toRecord());
    }

    @Override
    public boolean delete(String monkeyId) {
        boolean deleted = monkeyRepository.deleteById(monkeyId);
        log.info("Delete monkey {}: {}", monkeyId, deleted ? "deleted" : "not found");
        return deleted;
    }

    @Override
    public List<MonkeyRecord> list(MonkeyFilter filter) {
        return monkeyRepository.findAll(filter == null ? MonkeyFilter.none() : filter);
    }

    @Override
    public List<MonkeyRecord> search(String query) {
        return monkeyRepository.search(query);
    }

    @Override
    public Optional<MonkeyRecord> findByNameAndSpecies(String name, String species) {
        return monkeyRepository.findByNameAndSpecies(name, species);
    }

    private void ensureUniqueNameAndSpecies(Monkey monkey, String excludeId) {
        Optional<MonkeyRecord> existing = monkeyRepository.findByNameAndSpecies(monkey.getName(), monkey.getSpecies().getValue());
        if (existing.isPresent() && !Objects.equals(existing.get().getMonkeyId(), excludeId)) {
            log.warn("Duplicate monkey name: {}, species: {}", monkey.getName(), monkey.getSpecies().getValue());
            throw ConflictException.duplicateName();
        }
    }
}
