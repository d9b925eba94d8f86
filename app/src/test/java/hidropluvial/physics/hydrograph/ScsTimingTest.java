package hidropluvial.physics.hydrograph;

import hidropluvial.domain.storm.StormType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScsTimingTest {

    @Test
    @DisplayName("Tc = 2 h y Δt = 0.5 h: tlag 1.2 h, Tp 1.45 h, Tb ≈ 3.87 h")
    void referenceTiming() {
        double tp = ScsTiming.timeToPeak(2.0, 0.5);

        assertEquals(1.2, ScsTiming.lagTime(2.0), 1e-12);
        assertEquals(1.45, tp, 1e-12);
        assertEquals(3.8715, ScsTiming.timeBase(tp), 1e-9);
    }

    @Test
    @DisplayName("Paso recomendado 0.133·Tc con mínimos de 5 y 15 min")
    void recommendedStep() {
        assertEquals(5.0 / 60.0, ScsTiming.recommendedDtHr(0.5, null), 1e-12);
        assertEquals(0.133 * 3.0, ScsTiming.recommendedDtHr(3.0, StormType.GZ), 1e-12);
        assertEquals(0.25, ScsTiming.recommendedDtHr(1.0, StormType.SCS_II), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> ScsTiming.recommendedDtHr(0, null));
    }
}
