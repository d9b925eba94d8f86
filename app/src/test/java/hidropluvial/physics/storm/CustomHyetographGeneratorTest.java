package hidropluvial.physics.storm;

import hidropluvial.domain.storm.CustomDistribution;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.io.ReferenceCurveRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CustomHyetographGeneratorTest {

    private static ReferenceCurveRegistry registry;

    @BeforeAll
    static void load() {
        registry = ReferenceCurveRegistry.fromClasspath();
    }

    @ParameterizedTest
    @EnumSource(CustomDistribution.class)
    @DisplayName("Toda distribución conserva la lámina indicada")
    void everyDistributionKeepsTotal(CustomDistribution distribution) {
        HyetographResult storm = CustomHyetographGenerator.distribute(registry, 45.0, 3.0, 10.0, distribution);

        assertEquals(45.0, storm.totalDepthMm(), 1e-9, distribution.getCode());
        assertTrue(storm.method().startsWith("custom_"));
    }

    @Test
    @DisplayName("Uniforme: la misma lámina en cada intervalo")
    void uniform() {
        HyetographResult storm = CustomHyetographGenerator.distribute(registry, 30.0, 1.0, 10.0, CustomDistribution.UNIFORM);

        assertArrayEquals(new double[]{5, 5, 5, 5, 5, 5}, storm.depthMm(), 1e-12);
        assertEquals("custom_uniform", storm.method());
    }

    @Test
    @DisplayName("Triangular: el máximo queda en el centro")
    void triangularPeaksInTheMiddle() {
        HyetographResult storm = CustomHyetographGenerator.distribute(registry, 30.0, 1.0, 6.0, CustomDistribution.TRIANGULAR);

        double[] depths = storm.depthMm();
        for (int i = 0; i < depths.length; i++) {
            assertTrue(depths[i] <= depths[5], "intervalo " + i);
        }
    }

    @Test
    @DisplayName("Evento observado: el paso sale de los dos primeros tiempos")
    void observedEvent() {
        // ACT
        HyetographResult storm = CustomHyetographGenerator.fromEvent(List.of(5.0, 15.0, 25.0), List.of(2.0, 5.0, 1.0));

        // ASSERT
        assertEquals(10.0, storm.dtMin(), 1e-12);
        assertEquals(8.0, storm.totalDepthMm(), 1e-12);
        assertEquals(30.0, storm.peakIntensityMmHr(), 1e-12);
        assertEquals("custom_event", storm.method());
    }

    @Test
    @DisplayName("Evento mal formado o lámina no positiva deben lanzar excepción")
    void invalidInputsThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> CustomHyetographGenerator.fromEvent(List.of(5.0, 15.0), List.of(1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHyetographGenerator.fromEvent(List.of(5.0), List.of(1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHyetographGenerator.fromEvent(List.of(15.0, 5.0), List.of(1.0, 2.0)));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHyetographGenerator.fromEvent(List.of(5.0, 15.0), List.of(1.0, -2.0)));
        assertThrows(IllegalArgumentException.class,
                () -> CustomHyetographGenerator.distribute(registry, 0.0, 1.0, 10.0, CustomDistribution.UNIFORM));
    }
}
