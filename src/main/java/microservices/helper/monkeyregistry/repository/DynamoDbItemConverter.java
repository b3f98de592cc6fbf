package microservices.helper.monkeyregistry.repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.exception.StorageException;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Maps {@link MonkeyRecord}s to DynamoDB items and back.
 * <p>
 * Items carry a composite key ({@code PK} = {@code SK} = {@code MONKEY#<id>}), an
 * {@code entity} marker, the record's non-null fields, and lowercase copies of name
 * and species used by the species index and by scan filters.
 */
public class DynamoDbItemConverter {

    public static final String PARTITION_KEY = "PK";
    public static final String SORT_KEY = "SK";
    public static final String ENTITY = "entity";
    public static final String ENTITY_TYPE = "MONKEY";
    public static final String NAME_LC = "name_lc";
    public static final String SPECIES_LC = "species_lc";

    private static final String KEY_PREFIX = "MONKEY#";
    private static final Set<String> STORAGE_ONLY_ATTRIBUTES = Set.of(PARTITION_KEY, SORT_KEY, ENTITY, NAME_LC, SPECIES_LC);
    private static final TypeReference<LinkedHashMap<String, Object>> PLAIN_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DynamoDbItemConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String keyOf(String monkeyId) {
        return KEY_PREFIX + monkeyId;
    }

    public static Map<String, AttributeValue> primaryKey(String monkeyId) {
        AttributeValue key = AttributeValue.builder().s(keyOf(monkeyId)).build();
        return Map.of(PARTITION_KEY, key, SORT_KEY, key);
    }

    public Map<String, AttributeValue> toItem(MonkeyRecord record) {
        Map<String, AttributeValue> item = new LinkedHashMap<>(primaryKey(record.getMonkeyId()));
        item.put(ENTITY, string(ENTITY_TYPE));
        Map<String, Object> plain = objectMapper.convertValue(record, PLAIN_MAP);
        plain.forEach((name, value) -> {
            if (value != null) {
                item.put(name, toAttributeValue(value));
            }
        });
        item.put(NAME_LC, string(MonkeyFilter.normalize(record.getName())));
        item.put(SPECIES_LC, string(MonkeyFilter.normalize(record.getSpecies())));
        return item;
    }

    public MonkeyRecord toRecord(Map<String, AttributeValue> item) {
        Map<String, Object> plain = new LinkedHashMap<>();
        item.forEach((name, value) -> {
            if (!STORAGE_ONLY_ATTRIBUTES.contains(name)) {
                plain.put(name, toPlain(value));
            }
        });
        try {
            return objectMapper.convertValue(plain, MonkeyRecord.class);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Stored item " + item.get(PARTITION_KEY) + " does not map to a monkey record", e);
        }
    }

    /**
     * Converts an attribute value into plain Java types, normalizing numbers.
     */
    public static Object toPlain(AttributeValue value) {
        if (value.s() != null) {
            return value.s();
        }
        if (value.n() != null) {
            return NumericValues.normalize(value.n());
        }
        if (value.bool() != null) {
            return value.bool();
        }
        if (Boolean.TRUE.equals(value.nul())) {
            return null;
        }
        if (value.hasL()) {
            List<Object> list = new ArrayList<>();
            value.l().forEach(element -> list.add(toPlain(element)));
            return list;
        }
        if (value.hasM()) {
            Map<String, Object> map = new LinkedHashMap<>();
            value.m().forEach((name, element) -> map.put(name, toPlain(element)));
            return map;
        }
        if (value.hasSs()) {
            return new ArrayList<>(value.ss());
        }
        if (value.hasNs()) {
            List<Object> numbers = new ArrayList<>();
            value.ns().forEach(n -> numbers.add(NumericValues.normalize(n)));
            return numbers;
        }
        if (value.b() != null) {
            return value.b().asByteArray();
        }
        return null;
    }

    static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return AttributeValue.builder().nul(true).build();
        }
        if (value instanceof String) {
            return string((String) value);
        }
        if (value instanceof Number) {
            return AttributeValue.builder().n(value.toString()).build();
        }
        if (value instanceof Boolean) {
            return AttributeValue.builder().bool((Boolean) value).build();
        }
        if (value instanceof byte[]) {
            return AttributeValue.builder().b(SdkBytes.fromByteArray((byte[]) value)).build();
        }
        if (value instanceof List) {
            List<AttributeValue> list = new ArrayList<>();
            ((List<?>) value).forEach(element -> list.add(toAttributeValue(element)));
            return AttributeValue.builder().l(list).build();
        }
        if (value instanceof Map) {
            Map<String, AttributeValue> map = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((name, element) -> map.put(String.valueOf(name), toAttributeValue(element)));
            return AttributeValue.builder().m(map).build();
        }
        return string(value.toString());
    }

    static AttributeValue string(String value) {
        return AttributeValue.builder().s(value).build();
    }
}
