package warden.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.spi.StorageProviderException;

@ExtendWith(MockitoExtension.class)
@DisplayName("MicroProfileStorageAdapterConfig")
class MicroProfileStorageAdapterConfigTest {

    @Mock
    private Config config;

    private MicroProfileStorageAdapterConfig adapterConfig;

    @BeforeEach
    void setUp() {
        lenient().when(config.getOptionalValue("present", String.class)).thenReturn(Optional.of("42"));
        lenient().when(config.getOptionalValue("blank", String.class)).thenReturn(Optional.of("  "));
        lenient().when(config.getOptionalValue("word", String.class)).thenReturn(Optional.of("many"));
        lenient().when(config.getOptionalValue("absent", String.class)).thenReturn(Optional.empty());
        adapterConfig = new MicroProfileStorageAdapterConfig(config);
    }

    @Test
    @DisplayName("should read values and integers from MicroProfile Config")
    void shouldReadValues() {
        assertEquals(Optional.of("42"), adapterConfig.get("present"));
        assertEquals(Optional.of(42), adapterConfig.getInt("present"));
    }

    @Test
    @DisplayName("should treat absent and blank values as unset")
    void shouldTreatBlankAsUnset() {
        assertEquals(Optional.empty(), adapterConfig.get("absent"));
        assertEquals(Optional.empty(), adapterConfig.getInt("blank"));
    }

    @Test
    @DisplayName("should reject a value that is not an integer")
    void shouldRejectNonInteger() {
        assertThrows(StorageProviderException.class, () -> adapterConfig.getInt("word"));
    }
}
