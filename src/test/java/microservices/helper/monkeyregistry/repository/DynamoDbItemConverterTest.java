package microservices.helper.monkeyregistry.repository;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import microservices.helper.monkeyregistry.config.MonkeyRegistryConfig;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.exception.StorageException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class DynamoDbItemConverterTest {

    private DynamoDbItemConverter itemConverter;

    @BeforeEach
    void setUp() {
        itemConverter = new DynamoDbItemConverter(new MonkeyRegistryConfig().objectMapper());
    }

    private static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    private static AttributeValue n(String value) {
        return AttributeValue.builder().n(value).build();
    }

    @Test
    void toRecord_WhenAgeStoredAsWholeDecimal_ShouldReadInteger() {
        Map<String, AttributeValue> item = Map.of(
                "PK", s("MONKEY#monkey_0000abcd"),
                "SK", s("MONKEY#monkey_0000abcd"),
                "entity", s("MONKEY"),
                "monkey_id", s("monkey_0000abcd"),
                "name", s("Kiki"),
                "species", s("capuchin"),
                "age_years", n("3.0"),
                "name_lc", s("kiki"),
                "species_lc", s("capuchin"));

        MonkeyRecord record = itemConverter.toRecord(item);

        assertEquals("monkey_0000abcd", record.getMonkeyId());
        assertEquals("Kiki", record.getName());
        assertEquals(3, record.getAgeYears());
        assertNull(record.getFavouriteFruit());
    }

    @Test
    void toRecord_WhenItemHasUnknownAttributes_ShouldIgnoreThem() {
        Map<String, AttributeValue> item = Map.of(
                "monkey_id", s("monkey_0000abcd"),
                "name", s("Kiki"),
                "legacy_tags", AttributeValue.builder().ss("old", "import").build());

        assertEquals("Kiki", itemConverter.toRecord(item).getName());
    }

    @Test
    void toRecord_WhenAgeIsFractional_ShouldThrowStorageException() {
        Map<String, AttributeValue> item = Map.of(
                "monkey_id", s("monkey_0000abcd"),
                "age_years", n("2.5"));

        assertThrows(StorageException.class, () -> itemConverter.toRecord(item));
    }

    @Test
    void toItem_ShouldOmitNullFieldsAndAddLowercaseCopies() {
        MonkeyRecord record = MonkeyRecord.builder()
                .monkeyId("monkey_0000abcd")
                .name("  KiKi ")
                .species("Capuchin")
                .ageYears(7)
                .build();

        Map<String, AttributeValue> item = itemConverter.toItem(record);

        assertEquals("kiki", item.get("name_lc").s());
        assertEquals("capuchin", item.get("species_lc").s());
        assertEquals("7", item.get("age_years").n());
        assertFalse(item.containsKey("favourite_fruit"));
        assertFalse(item.containsKey("created_at"));
        assertEquals("MONKEY#monkey_0000abcd", item.get("PK").s());
    }

    @Test
    void toPlain_ShouldConvertNestedValues() {
        AttributeValue nested = AttributeValue.builder().m(Map.of(
                "scores", AttributeValue.builder().l(n("1"), n("1.5"), AttributeValue.builder().nul(true).build()).build(),
                "active", AttributeValue.builder().bool(true).build(),
                "tags", AttributeValue.builder().ss("a").build())).build();

        Object plain = DynamoDbItemConverter.toPlain(nested);

        assertInstanceOf(Map.class, plain);
        Map<?, ?> map = (Map<?, ?>) plain;
        assertEquals(Boolean.TRUE, map.get("active"));
        assertEquals(List.of("a"), map.get("tags"));
        List<?> scores = (List<?>) map.get("scores");
        assertEquals(1, scores.get(0));
        assertEquals(1.5, scores.get(1));
        assertNull(scores.get(2));
    }

    @ParameterizedTest
    @CsvSource({
            "2, 2",
            "2.0, 2",
            "-7, -7",
            "1E+2, 100"
    })
    void normalize_WhenWholeNumberFitsInt_ShouldReturnInteger(String stored, int expected) {
        Number value = NumericValues.normalize(stored);

        assertInstanceOf(Integer.class, value);
        assertEquals(expected, value.intValue());
    }

    @Test
    void normalize_WhenFractional_ShouldReturnDouble() {
        assertEquals(2.5, NumericValues.normalize("2.5"));
    }

    @Test
    void normalize_WhenBeyondInt_ShouldWiden() {
        assertEquals(4_000_000_000L, NumericValues.normalize("4000000000"));
        assertEquals(new BigInteger("123456789012345678901234567890"),
                NumericValues.normalize("123456789012345678901234567890"));
    }
}
