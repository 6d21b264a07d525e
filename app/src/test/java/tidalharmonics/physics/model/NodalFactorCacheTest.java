package tidalharmonics.physics.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tidalharmonics.physics.astronomy.AstronomicalAngles;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.NodalCorrectionModel;
import tidalharmonics.physics.astronomy.NodalCorrectionTable;
import tidalharmonics.physics.astronomy.NodalFactors;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NodalFactorCacheTest {

    private static final Instant BUCKET_START = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private NodalCorrectionModel model;

    private final AstronomicalEphemeris ephemeris = new AstronomicalEphemeris();

    @BeforeEach
    void setUp() {
        lenient().when(model.getFactors(anyString(), any(AstronomicalAngles.class))).thenReturn(new NodalFactors(1.1, -2.0));
    }

    @Test
    @DisplayName("Mismo cubo: el modelo se evalúa una sola vez, en el inicio del cubo")
    void sameBucket_shouldEvaluateOnce() {
        NodalFactorCache cache = new NodalFactorCache(model, ephemeris, 3600L, 100);

        NodalFactors first = cache.factorsAt("M2", BUCKET_START.plusSeconds(10));
        NodalFactors second = cache.factorsAt("M2", BUCKET_START.plusSeconds(3599));

        assertEquals(first, second);
        assertEquals(1, cache.size());
        verify(model, times(1)).getFactors(eq("M2"), eq(ephemeris.getParameters(BUCKET_START)));
    }

    @Test
    @DisplayName("Cubos o símbolos distintos: entradas distintas")
    void differentKeys_shouldBeCachedSeparately() {
        NodalFactorCache cache = new NodalFactorCache(model, ephemeris, 3600L, 100);

        cache.factorsAt("M2", BUCKET_START);
        cache.factorsAt("M2", BUCKET_START.plusSeconds(3600));
        cache.factorsAt("K1", BUCKET_START);
        // Instantes anteriores a 1970 caen en cubos negativos
        cache.factorsAt("M2", Instant.parse("1960-01-01T00:30:00Z"));

        assertEquals(4, cache.size());
        verify(model, times(4)).getFactors(anyString(), any(AstronomicalAngles.class));
    }

    @Test
    @DisplayName("Capacidad máxima: la caché se vacía y sigue devolviendo valores correctos")
    void fullCache_shouldBeCleared() {
        NodalFactorCache cache = new NodalFactorCache(model, ephemeris, 60L, 3);

        for (int i = 0; i < 3; i++) {
            cache.factorsAt("M2", BUCKET_START.plusSeconds(60L * i));
        }
        assertEquals(3, cache.size());

        NodalFactors factors = cache.factorsAt("M2", BUCKET_START.plusSeconds(600));

        assertEquals(1, cache.size());
        assertEquals(new NodalFactors(1.1, -2.0), factors);
    }

    @Test
    @DisplayName("Con la tabla real: el valor coincide con el modelo en el inicio del cubo")
    void realTable_shouldMatchModelAtBucketStart() {
        NodalCorrectionTable table = new NodalCorrectionTable();
        NodalFactorCache cache = new NodalFactorCache(table, ephemeris, 86_400L, 100);

        NodalFactors cached = cache.factorsAt("O1", BUCKET_START.plusSeconds(40_000));

        assertEquals(table.getFactors("O1", ephemeris.getParameters(BUCKET_START)), cached);
    }

    @Test
    @DisplayName("Parámetros no positivos: IllegalArgumentException")
    void invalidParameters_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new NodalFactorCache(model, ephemeris, 0L, 10));
        assertThrows(IllegalArgumentException.class, () -> new NodalFactorCache(model, ephemeris, 60L, 0));
    }
}
