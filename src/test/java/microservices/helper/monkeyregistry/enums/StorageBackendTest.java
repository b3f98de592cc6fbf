package microservices.helper.monkeyregistry.enums;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StorageBackendTest {

    @Test
    void fromValue_WhenBlank_ShouldDefaultToJson() {
        assertEquals(StorageBackend.JSON, StorageBackend.fromValue(null));
        assertEquals(StorageBackend.JSON, StorageBackend.fromValue("  "));
    }

    @Test
    void fromValue_WhenKnownName_ShouldResolveCaseInsensitively() {
        assertEquals(StorageBackend.JSON, StorageBackend.fromValue("JSON"));
        assertEquals(StorageBackend.DYNAMODB, StorageBackend.fromValue("ddb"));
        assertEquals(StorageBackend.DYNAMODB, StorageBackend.fromValue("DynamoDB"));
    }

    @Test
    void fromValue_WhenUnknown_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> StorageBackend.fromValue("postgres"));
    }
}
