package microservices.helper.monkeyregistry.service;

import java.util.List;
import java.util.Optional;

import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.model.MonkeyFilter;

public interface MonkeyRegistryService {

    MonkeyRecord create(MonkeyRecord input);

    Optional<MonkeyRecord> get(String monkeyId);

    Optional<MonkeyRecord> update(String monkeyId, MonkeyRecord updates);

    boolean delete(String monkeyId);

    List<MonkeyRecord> list(MonkeyFilter filter);

    List<MonkeyRecord> search(String query);

    Optional<MonkeyRecord> findByNameAndSpecies(String name, String species);

}
