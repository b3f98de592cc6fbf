package microservices.helper.monkeyregistry.config;

import java.nio.file.Path;
import java.time.Clock;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.enums.StorageBackend;
import microservices.helper.monkeyregistry.repository.DynamoDbItemConverter;
import microservices.helper.monkeyregistry.repository.DynamoDbMonkeyRepository;
import microservices.helper.monkeyregistry.repository.JsonFileMonkeyRepository;
import microservices.helper.monkeyregistry.repository.MonkeyRepository;
import microservices.helper.monkeyregistry.service.TransferPathResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Wires the repository selected by {@code monkey-registry.backend}.
 * <p>
 * Each setting is resolved from a command-line argument first, then its
 * environment variable, then the default in {@code application.yml}.
 */
@Configuration
@Slf4j
public class MonkeyRegistryConfig {

    @Value("${monkey-registry.backend:json}")
    private String backend;

    @Value("${monkey-registry.json.path:data/monkeys.json}")
    private String jsonPath;

    @Value("${monkey-registry.dynamodb.table:assessment-users}")
    private String tableName;

    @Value("${monkey-registry.dynamodb.region:eu-west-1}")
    private String region;

    @Value("${monkey-registry.dynamodb.species-index:GSI_Species}")
    private String speciesIndexName;

    @Value("${monkey-registry.transfer-dir:data/transfer}")
    private String transferDir;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // integer fields bind from JSON integers only: no 2.5 -> 2, no "3" -> 3
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public StorageBackend storageBackend() {
        return StorageBackend.fromValue(backend);
    }

    @Bean
    public TransferPathResolver transferPathResolver() {
        return new TransferPathResolver(Path.of(transferDir));
    }

    @Bean
    public MonkeyRepository monkeyRepository(StorageBackend storageBackend, ObjectMapper objectMapper, Clock clock) {
        log.info("Using {} storage backend", storageBackend.getValue());
        return switch (storageBackend) {
            case DYNAMODB -> new DynamoDbMonkeyRepository(
                    DynamoDbClient.builder().region(Region.of(region)).build(),
                    tableName,
                    speciesIndexName,
                    new DynamoDbItemConverter(objectMapper),
                    clock);
            case JSON -> new JsonFileMonkeyRepository(Path.of(jsonPath), objectMapper);
        };
    }

}
