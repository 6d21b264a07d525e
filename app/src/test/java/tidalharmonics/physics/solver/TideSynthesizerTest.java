package tidalharmonics.physics.solver;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import tidalharmonics.config.PredictionConfig;
import tidalharmonics.domain.constituent.ConstituentDefinition;
import tidalharmonics.domain.prediction.DataIntegrityReport;
import tidalharmonics.domain.station.StationConstituent;
import tidalharmonics.domain.station.TideStation;
import tidalharmonics.physics.impl.ContributionDecomposer;
import tidalharmonics.physics.astronomy.AstronomicalAngles;
import tidalharmonics.physics.astronomy.AstronomicalEphemeris;
import tidalharmonics.physics.astronomy.EquilibriumArgumentCalculator;
import tidalharmonics.physics.astronomy.NodalCorrectionModel;
import tidalharmonics.physics.astronomy.NodalFactors;
import tidalharmonics.support.TestStations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Pruebas unitarias para {@link TideSynthesizer}.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class TideSynthesizerTest {

    private static final Instant REFERENCE = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private NodalCorrectionModel nodalModel;

    @Test
    @DisplayName("Onda pura: altura 1 donde V0(M2) = 0 y −1 medio periodo después")
    void pureM2_shouldPeakWhereEquilibriumArgumentIsZero() {
        // --- 1. Arrange ---
        TideSynthesizer synthesizer = TestStations.identitySynthesizer();
        TideStation station = TestStations.synthetic("M2-PURE", new StationConstituent("M2", 1.0, 0.0));
        ConstituentDefinition m2 = synthesizer.getCatalog().find("M2").orElseThrow();

        double v0 = EquilibriumArgumentCalculator.computeV0(m2.doodson(), synthesizer.getEphemeris().getParameters(REFERENCE));
        double hoursToZero = (360.0 - v0) / m2.speed();
        Instant peak = REFERENCE.plusNanos(Math.round(hoursToZero * 3600e9));
        Instant trough = peak.plusNanos(Math.round(m2.period() / 2.0 * 3600e9));

        // --- 2. Act ---
        double peakHeight = synthesizer.height(station, peak);
        double troughHeight = synthesizer.height(station, trough);

        // --- 3. Assert ---
        assertEquals(1.0, peakHeight, 1e-6, "En V0 = 0 la onda pura debe valer su amplitud.");
        assertEquals(-1.0, troughHeight, 1e-6, "Medio periodo después debe valer menos su amplitud.");
    }

    @Test
    @DisplayName("Constituyente aislado: h = cos(Σ dᵢ·ángulosᵢ − κ) para diurnos, semidiurnos y L2")
    void singleConstituent_shouldFollowDoodsonDotProduct() {
        // --- 1. Arrange ---
        TideSynthesizer synthesizer = TestStations.identitySynthesizer();
        Instant instant = Instant.parse("2024-01-01T03:00:00Z");
        AstronomicalAngles angles = synthesizer.getEphemeris().getParameters(instant);
        double kappa = 25.0;

        for (String symbol : List.of("K1", "O1", "P1", "Q1", "L2", "M2", "MK3")) {
            ConstituentDefinition definition = synthesizer.getCatalog().find(symbol).orElseThrow();
            double dot = 0.0;
            for (int i = 0; i < 6; i++) {
                dot += definition.doodson().get(i) * angles.asArray()[i];
            }
            TideStation station = TestStations.synthetic(symbol, new StationConstituent(symbol, 1.0, kappa));

            // --- 2. Act ---
            double height = synthesizer.height(station, instant);

            // --- 3. Assert ---
            assertEquals(Math.cos(Math.toRadians(dot - kappa)), height, 1e-9, "Altura de " + symbol);
        }
    }

    @Test
    @DisplayName("Determinismo: la misma entrada produce exactamente la misma altura")
    void height_shouldBeDeterministic() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation station = TestStations.byId(TestStations.SAN_FRANCISCO);
        Instant instant = Instant.parse("2025-07-04T15:23:11Z");

        double first = synthesizer.height(station, instant);
        double second = TestStations.defaultSynthesizer().height(station, instant);

        assertEquals(first, synthesizer.height(station, instant), 0.0);
        assertEquals(first, second, 0.0);
    }

    @Test
    @DisplayName("Periodicidad: S2 sola repite exactamente cada 12 h; M2 sola cada 12,4206 h")
    void singleConstituent_shouldBePeriodic() {
        TideSynthesizer synthesizer = TestStations.identitySynthesizer();
        TideStation s2 = TestStations.synthetic("S2", new StationConstituent("S2", 0.8, 37.0));
        TideStation m2 = TestStations.synthetic("M2", new StationConstituent("M2", 1.2, 123.0));
        double m2PeriodHours = synthesizer.getCatalog().find("M2").orElseThrow().period();

        for (int k = 0; k < 20; k++) {
            Instant t = REFERENCE.plus(Duration.ofMinutes(37L * k));
            assertEquals(synthesizer.height(s2, t), synthesizer.height(s2, t.plus(Duration.ofHours(12))), 1e-9);
            assertEquals(synthesizer.height(m2, t),
                    synthesizer.height(m2, t.plusNanos(Math.round(m2PeriodHours * 3600e9))), 1e-6);
        }
    }

    @Test
    @DisplayName("Acotación: |h − Z0| ≤ Σ f·A en todo instante")
    void height_shouldBeBoundedByAmplitudeSum() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation station = TestStations.byId(TestStations.BOSTON);

        for (int k = 0; k < 500; k++) {
            Instant t = REFERENCE.plus(Duration.ofMinutes(97L * k));
            double deviation = Math.abs(synthesizer.height(station, t) - station.meanLevelOffset());
            assertTrue(deviation <= synthesizer.amplitudeBound(station, t) + 1e-12,
                    "Altura fuera de la cota en " + t);
        }
    }

    @Test
    @DisplayName("Z0: el nivel medio desplaza la curva sin deformarla")
    void meanLevelOffset_shouldShiftHeights() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation boston = TestStations.byId(TestStations.BOSTON);
        TideStation withoutOffset = boston.withMeanLevelOffset(0.0);
        Instant instant = Instant.parse("2024-05-20T08:00:00Z");

        assertEquals(1.58, synthesizer.height(boston, instant) - synthesizer.height(withoutOffset, instant), 1e-12);
    }

    @Test
    @DisplayName("Constituyentes desconocidos: se excluyen de la suma y se informan en la inspección")
    void unknownSymbols_shouldBeExcludedAndReported() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation station = TestStations.byId(TestStations.UNKNOWN_SYMBOLS);
        TideStation knownOnly = station.withConstituents(List.of(station.findConstituent("M2").orElseThrow()));
        Instant instant = Instant.parse("2024-02-29T12:00:00Z");

        // El símbolo desconocido tiene amplitud 5 m: si se sumara, la diferencia sería evidente
        assertEquals(synthesizer.height(knownOnly, instant), synthesizer.height(station, instant), 0.0);

        DataIntegrityReport report = synthesizer.inspect(station);
        assertFalse(report.isClean());
        assertEquals(List.of("XX9"), report.unknownSymbols());
        assertTrue(synthesizer.inspect(TestStations.byId(TestStations.SAN_FRANCISCO)).isClean());
    }

    @Test
    @DisplayName("Constituyentes desconocidos en consultas puntuales: un único aviso por estación y símbolo")
    void unknownSymbols_shouldWarnOnceOnPointQueries() {
        // --- 1. Arrange ---
        Logger logger = (Logger) LoggerFactory.getLogger(TideSynthesizer.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation station = TestStations.byId(TestStations.UNKNOWN_SYMBOLS);

        try {
            // --- 2. Act ---
            for (int k = 0; k < 3; k++) {
                synthesizer.height(station, REFERENCE.plus(Duration.ofHours(k)));
            }
            new ContributionDecomposer(synthesizer).contributions(station, REFERENCE);

            // --- 3. Assert ---
            List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .toList();
            assertEquals(1, warnings.size(), "Se esperaba un único aviso: " + warnings);
            assertTrue(warnings.get(0).getFormattedMessage().contains("XX9"));
            assertTrue(warnings.get(0).getFormattedMessage().contains(TestStations.UNKNOWN_SYMBOLS));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("Amplitud cero: la altura es exactamente Z0")
    void zeroAmplitude_shouldContributeNothing() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        TideStation station = TestStations.synthetic("ZERO", new StationConstituent("M2", 0.0, 90.0))
                .withMeanLevelOffset(0.42);

        assertEquals(0.42, synthesizer.height(station, REFERENCE), 0.0);
        assertEquals(0.0, synthesizer.height(TestStations.synthetic("EMPTY"), REFERENCE), 0.0);
    }

    @Test
    @DisplayName("Corrección nodal: el factor f escala la amplitud y u desplaza la fase")
    void nodalFactors_shouldScaleAndShift() {
        // --- 1. Arrange ---
        when(nodalModel.getFactors(anyString(), any(AstronomicalAngles.class))).thenReturn(new NodalFactors(2.0, 0.0));
        TideSynthesizer scaled = new TideSynthesizer(TestStations.catalog(), new AstronomicalEphemeris(), nodalModel, PredictionConfig.defaults());
        TideSynthesizer identity = TestStations.identitySynthesizer();
        TideStation station = TestStations.byId(TestStations.SAN_FRANCISCO).withMeanLevelOffset(0.0);
        Instant instant = Instant.parse("2024-08-15T06:30:00Z");

        // --- 2. Act ---
        double scaledHeight = scaled.height(station, instant);
        double identityHeight = identity.height(station, instant);

        // --- 3. Assert ---
        assertEquals(2.0 * identityHeight, scaledHeight, 1e-12);
        verify(nodalModel, times(station.constituents().size())).getFactors(anyString(), any(AstronomicalAngles.class));
    }

    @Test
    @DisplayName("Caché nodal por cubo: resultados casi idénticos y deterministas sin importar el orden")
    void nodalCache_shouldBeOrderIndependent() {
        PredictionConfig cached = PredictionConfig.builder().nodalCacheBucketSeconds(3600L).build();
        TideStation station = TestStations.byId(TestStations.SAN_FRANCISCO);
        Instant t1 = Instant.parse("2024-03-01T00:17:00Z");
        Instant t2 = Instant.parse("2024-03-01T00:43:00Z");

        TideSynthesizer forward = new TideSynthesizer(TestStations.catalog(), cached);
        double f1 = forward.height(station, t1);
        double f2 = forward.height(station, t2);

        TideSynthesizer backward = new TideSynthesizer(TestStations.catalog(), cached);
        double b2 = backward.height(station, t2);
        double b1 = backward.height(station, t1);

        assertEquals(f1, b1, 0.0);
        assertEquals(f2, b2, 0.0);
        assertEquals(TestStations.defaultSynthesizer().height(station, t1), f1, 1e-4);
    }

    @Test
    @DisplayName("Argumentos nulos: violación de contrato")
    void nullArguments_shouldThrow() {
        TideSynthesizer synthesizer = TestStations.defaultSynthesizer();
        assertThrows(NullPointerException.class, () -> synthesizer.height(null, REFERENCE));
        assertThrows(NullPointerException.class,
                () -> synthesizer.height(TestStations.byId(TestStations.BOSTON), null));
    }
}
