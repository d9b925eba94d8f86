package hidropluvial.physics.storm;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.io.ReferenceCurveRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Generadores basados en curvas de masa tabuladas: SCS 24 h y Huff.
 */
class ReferenceCurveGeneratorsTest {

    private static ReferenceCurveRegistry registry;

    @BeforeAll
    static void load() {
        registry = ReferenceCurveRegistry.fromClasspath();
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    @Test
    @DisplayName("SCS tipo II: 100 mm en 24 h con dt 60 min conserva el total y concentra el pico cerca de las 12 h")
    void scsTypeII() {
        // ACT
        HyetographResult storm = ScsDistributionGenerator.generate(registry, StormType.SCS_II, 100.0, 24.0, 60.0);

        // ASSERT
        assertEquals(24, storm.intervalCount());
        assertEquals(100.0, storm.totalDepthMm(), 1e-9);
        int peak = argMax(storm.depthMm());
        assertThat(peak).isBetween(11, 13);
        assertThat(storm.depthMm()[peak]).isGreaterThan(30.0);
        assertEquals("scs_type_ii", storm.method());
    }

    @Test
    @DisplayName("SCS sobre una duración distinta de 24 h escala el eje de tiempos")
    void scsScaledDuration() {
        HyetographResult storm = ScsDistributionGenerator.generate(registry, StormType.SCS_II, 50.0, 6.0, 15.0);

        assertEquals(24, storm.intervalCount());
        assertEquals(50.0, storm.totalDepthMm(), 1e-9);
        assertThat(argMax(storm.depthMm())).isBetween(11, 13);
    }

    @Test
    @DisplayName("Si dt no divide la duración la malla se ensancha y el total se conserva")
    void gridWidensWhenDtDoesNotDivide() {
        HyetographResult storm = ScsDistributionGenerator.generate(registry, StormType.SCS_I, 80.0, 24.0, 25.0);

        assertEquals(57, storm.intervalCount());
        assertEquals(24.0 * 60.0 / 57, storm.dtMin(), 1e-12);
        assertEquals(80.0, storm.totalDepthMm(), 1e-9);
    }

    @Test
    @DisplayName("Un tipo no SCS se rechaza")
    void nonScsTypeThrows() {
        assertThrows(IllegalArgumentException.class,
                () -> ScsDistributionGenerator.generate(registry, StormType.HUFF_Q1, 10, 24, 60));
        assertThrows(IllegalArgumentException.class,
                () -> ScsDistributionGenerator.generate(registry, StormType.SCS_II, -1, 24, 60));
    }

    @Test
    @DisplayName("Huff: el primer cuartil adelanta la lluvia respecto del cuarto")
    void huffQuartilesShiftTheMass() {
        // ARRANGE
        HyetographResult q1 = HuffCurveGenerator.generate(registry, 60.0, 2.0, 10.0, 1, 50);
        HyetographResult q4 = HuffCurveGenerator.generate(registry, 60.0, 2.0, 10.0, 4, 50);

        // ASSERT
        assertEquals(60.0, q1.totalDepthMm(), 1e-9);
        assertEquals(60.0, q4.totalDepthMm(), 1e-9);
        int half = q1.intervalCount() / 2;
        assertThat(q1.cumulativeMm()[half - 1]).isGreaterThan(q4.cumulativeMm()[half - 1]);
        assertEquals("huff_q1_p50", q1.method());
    }

    @Test
    @DisplayName("Huff rechaza cuartil o probabilidad inválidos")
    void huffInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> HuffCurveGenerator.generate(registry, 60, 2, 10, 0, 50));
        assertThrows(IllegalArgumentException.class, () -> HuffCurveGenerator.generate(registry, 60, 2, 10, 2, 40));
    }
}
