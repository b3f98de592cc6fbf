package microservices.helper.monkeyregistry.repository;

import static microservices.helper.monkeyregistry.repository.DynamoDbItemConverter.ENTITY;
import static microservices.helper.monkeyregistry.repository.DynamoDbItemConverter.ENTITY_TYPE;
import static microservices.helper.monkeyregistry.repository.DynamoDbItemConverter.NAME_LC;
import static microservices.helper.monkeyregistry.repository.DynamoDbItemConverter.PARTITION_KEY;
import static microservices.helper.monkeyregistry.repository.DynamoDbItemConverter.SPECIES_LC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.enums.ErrorCode;
import microservices.helper.monkeyregistry.exception.ConflictException;
import microservices.helper.monkeyregistry.exception.StorageException;
import microservices.helper.monkeyregistry.model.Monkey;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

/**
 * DynamoDB-backed repository. One item per monkey, keyed by {@code MONKEY#<id>} in both
 * {@code PK} and {@code SK}; a global secondary index keyed by {@code species_lc} /
 * {@code name_lc} serves species lookups.
 * <p>
 * Index queries are an optimization only: if the index is missing or a query fails,
 * list, search and lookup fall back to a filtered full-table scan. Updates are
 * read-modify-write with an unconditional put, so concurrent writers to the same monkey
 * can lose updates; only {@link #create} is guarded by a conditional write. An update never
 * moves {@code updated_at} backwards, even when this host's clock is behind the stored value.
 */
@Slf4j
public class DynamoDbMonkeyRepository implements MonkeyRepository, AutoCloseable {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final String speciesIndexName;
    private final DynamoDbItemConverter itemConverter;
    private final Clock clock;

    public DynamoDbMonkeyRepository(DynamoDbClient dynamoDbClient, String tableName, String speciesIndexName,
                                    DynamoDbItemConverter itemConverter, Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
        this.speciesIndexName = speciesIndexName;
        this.itemConverter = itemConverter;
        this.clock = clock;
    }

    @Override
    public MonkeyRecord create(MonkeyRecord record) {
        Map<String, AttributeValue> item = itemConverter.toItem(record);
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(item)
                    .conditionExpression("attribute_not_exists(#pk)")
                    .expressionAttributeNames(Map.of("#pk", PARTITION_KEY))
                    .build());
            log.info("Created monkey {} in table {}", record.getMonkeyId(), tableName);
            return itemConverter.toRecord(item);
        } catch (ConditionalCheckFailedException e) {
            log.warn("Monkey {} already exists in table {}", record.getMonkeyId(), tableName);
            throw new ConflictException("monkey_id already exists: " + record.getMonkeyId(), e, ErrorCode.DUPLICATE_ID);
        } catch (SdkException e) {
            log.error("Failed to create monkey {}", record.getMonkeyId(), e);
            throw new StorageException("Failed to create monkey " + record.getMonkeyId(), e);
        }
    }

    @Override
    public Optional<MonkeyRecord> findById(String monkeyId) {
        try {
            GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(DynamoDbItemConverter.primaryKey(monkeyId))
                    .consistentRead(true)
                    .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(itemConverter.toRecord(response.item()));
        } catch (SdkException e) {
            log.error("Failed to read monkey {}", monkeyId, e);
            throw new StorageException("Failed to read monkey " + monkeyId, e);
        }
    }

    @Override
    public Optional<MonkeyRecord> update(String monkeyId, MonkeyRecord updates) {
        Optional<MonkeyRecord> current = findById(monkeyId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        MonkeyRecord merged = current.get().mergedWith(updates);
        merged.setUpdatedAt(latest(merged.getUpdatedAt(), Monkey.timestamp(clock)));
        Map<String, AttributeValue> item = itemConverter.toItem(merged);
        try {
            // last writer wins
            dynamoDbClient.putItem(PutItemRequest.builder().tableName(tableName).item(item).build());
            log.info("Updated monkey {} in table {}", monkeyId, tableName);
            return Optional.of(itemConverter.toRecord(item));
        } catch (SdkException e) {
            log.error("Failed to update monkey {}", monkeyId, e);
            throw new StorageException("Failed to update monkey " + monkeyId, e);
        }
    }

    @Override
    public boolean deleteById(String monkeyId) {
        try {
            DeleteItemResponse response = dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(DynamoDbItemConverter.primaryKey(monkeyId))
                    .returnValues(ReturnValue.ALL_OLD)
                    .build());
            boolean removed = response.hasAttributes() && !response.attributes().isEmpty();
            if (removed) {
                log.info("Deleted monkey {} from table {}", monkeyId, tableName);
            }
            return removed;
        } catch (SdkException e) {
            log.error("Failed to delete monkey {}", monkeyId, e);
            throw new StorageException("Failed to delete monkey " + monkeyId, e);
        }
    }

    @Override
    public List<MonkeyRecord> findAll(MonkeyFilter filter) {
        MonkeyFilter effective = filter == null ? MonkeyFilter.none() : filter;
        String name = effective.normalizedName();
        String species = effective.normalizedSpecies();

        if (!species.isEmpty()) {
            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":species", DynamoDbItemConverter.string(species));
            String keyCondition = SPECIES_LC + " = :species";
            if (!name.isEmpty()) {
                keyCondition += " AND begins_with(" + NAME_LC + ", :name)";
                values.put(":name", DynamoDbItemConverter.string(name));
            }
            QueryRequest request = QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(speciesIndexName)
                    .keyConditionExpression(keyCondition)
                    .expressionAttributeValues(values)
                    .build();
            try {
                return toRecords(queryAll(request));
            } catch (SdkException e) {
                log.warn("Species index query failed on {}, falling back to scan: {}", speciesIndexName, e.getMessage());
            }
        }

        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":entity", DynamoDbItemConverter.string(ENTITY_TYPE));
        StringBuilder filterExpression = new StringBuilder("#entity = :entity");
        if (!species.isEmpty()) {
            filterExpression.append(" AND ").append(SPECIES_LC).append(" = :species");
            values.put(":species", DynamoDbItemConverter.string(species));
        }
        if (!name.isEmpty()) {
            filterExpression.append(" AND contains(").append(NAME_LC).append(", :name)");
            values.put(":name", DynamoDbItemConverter.string(name));
        }
        return toRecords(scanAll(scanRequest(filterExpression.toString(), values)));
    }

    @Override
    public List<MonkeyRecord> search(String query) {
        String q = MonkeyFilter.normalize(query);
        if (q.isEmpty()) {
            return List.of();
        }

        // the query may be an exact species name, which the index answers directly
        QueryRequest request = QueryRequest.builder()
                .tableName(tableName)
                .indexName(speciesIndexName)
                .keyConditionExpression(SPECIES_LC + " = :species")
                .expressionAttributeValues(Map.of(":species", DynamoDbItemConverter.string(q)))
                .build();
        try {
            List<Map<String, AttributeValue>> items = queryAll(request);
            if (!items.isEmpty()) {
                return toRecords(items);
            }
        } catch (SdkException e) {
            log.warn("Species index query failed on {}, falling back to scan: {}", speciesIndexName, e.getMessage());
        }

        String filterExpression = "#entity = :entity AND (contains(" + NAME_LC + ", :q) OR contains(" + SPECIES_LC + ", :q))";
        Map<String, AttributeValue> values = Map.of(
                ":entity", DynamoDbItemConverter.string(ENTITY_TYPE),
                ":q", DynamoDbItemConverter.string(q));
        return toRecords(scanAll(scanRequest(filterExpression, values)));
    }

    @Override
    public Optional<MonkeyRecord> findByNameAndSpecies(String name, String species) {
        Map<String, AttributeValue> values = Map.of(
                ":species", DynamoDbItemConverter.string(MonkeyFilter.normalize(species)),
                ":name", DynamoDbItemConverter.string(MonkeyFilter.normalize(name)));
        try {
            QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(speciesIndexName)
                    .keyConditionExpression(SPECIES_LC + " = :species AND " + NAME_LC + " = :name")
                    .expressionAttributeValues(values)
                    .limit(1)
                    .build());
            return response.items().stream().findFirst().map(itemConverter::toRecord);
        } catch (SdkException e) {
            log.warn("Species index lookup failed on {}, falling back to scan: {}", speciesIndexName, e.getMessage());
        }

        Map<String, AttributeValue> scanValues = new HashMap<>(values);
        scanValues.put(":entity", DynamoDbItemConverter.string(ENTITY_TYPE));
        String filterExpression = "#entity = :entity AND " + SPECIES_LC + " = :species AND " + NAME_LC + " = :name";
        return scanAll(scanRequest(filterExpression, scanValues)).stream()
                .findFirst()
                .map(itemConverter::toRecord);
    }

    @Override
    public void close() {
        dynamoDbClient.close();
    }

    private ScanRequest scanRequest(String filterExpression, Map<String, AttributeValue> values) {
        return ScanRequest.builder()
                .tableName(tableName)
                .filterExpression(filterExpression)
                .expressionAttributeNames(Map.of("#entity", ENTITY))
                .expressionAttributeValues(values)
                .build();
    }

    private List<Map<String, AttributeValue>> queryAll(QueryRequest request) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
            QueryResponse response = dynamoDbClient.query(page);
            items.addAll(response.items());
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey() : null;
        } while (startKey != null);
        return items;
    }

    private List<Map<String, AttributeValue>> scanAll(ScanRequest request) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        try {
            do {
                ScanRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
                ScanResponse response = dynamoDbClient.scan(page);
                items.addAll(response.items());
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
            } while (startKey != null);
        } catch (SdkException e) {
            log.error("Scan of table {} failed", tableName, e);
            throw new StorageException("Failed to scan table " + tableName, e);
        }
        return items;
    }

    private static String latest(String updatedAt, String now) {
        return updatedAt != null && updatedAt.compareTo(now) > 0 ? updatedAt : now;
    }

    private List<MonkeyRecord> toRecords(List<Map<String, AttributeValue>> items) {
        return items.stream().map(itemConverter::toRecord).collect(Collectors.toList());
    }
}
