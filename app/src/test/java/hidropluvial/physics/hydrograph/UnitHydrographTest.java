package hidropluvial.physics.hydrograph;

import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.physics.i.IUnitHydrograph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Hidrogramas unitarios triangulares: volumen de 1 mm, geometría y validaciones.
 */
class UnitHydrographTest {

    // Tc elegido para que Tp = 1.1 h caiga sobre la malla de 0.1 h.
    private static final double TC_HR = 1.75;
    private static final double DT_HR = 0.1;
    private static final double AREA_HA = 100.0;

    @ParameterizedTest
    @ValueSource(doubles = {1.0, 1.25, 1.67, 2.25, 5.5})
    @DisplayName("El triangular X encierra el volumen de 1 mm sobre la cuenca")
    void triangularVolumeIsOneMillimetre(double x) {
        UnitHydrograph uh = new TriangularUnitHydrograph(x).build(AREA_HA, TC_HR, DT_HR);

        double volume = ConvolutionSolver.volumeM3(uh.flowM3s(), DT_HR);

        assertEquals(AREA_HA * 10.0, volume, AREA_HA * 10.0 * 0.01);
    }

    @Test
    @DisplayName("El triangular SCS también encierra 1 mm")
    void scsVolumeIsOneMillimetre() {
        UnitHydrograph uh = new ScsTriangularUnitHydrograph().build(AREA_HA, TC_HR, DT_HR);

        assertEquals(AREA_HA * 10.0, ConvolutionSolver.volumeM3(uh.flowM3s(), DT_HR), AREA_HA * 10.0 * 0.01);
        assertEquals(ScsTriangularUnitHydrograph.EQUIVALENT_X_FACTOR, uh.xFactor(), 0.0);
        assertEquals(ScsTiming.BASE_RATIO * uh.tpHr(), uh.tbHr(), 1e-12);
        assertEquals("scs_triangular", new ScsTriangularUnitHydrograph().name());
    }

    @Test
    @DisplayName("Un X mayor baja el pico y alarga la base")
    void largerXFlattensTheHydrograph() {
        // ARRANGE
        IUnitHydrograph compact = new TriangularUnitHydrograph(1.0);
        IUnitHydrograph elongated = new TriangularUnitHydrograph(2.25);

        // ACT
        UnitHydrograph a = compact.build(AREA_HA, TC_HR, DT_HR);
        UnitHydrograph b = elongated.build(AREA_HA, TC_HR, DT_HR);

        // ASSERT
        assertThat(b.qpM3s()).isLessThan(a.qpM3s());
        assertThat(b.tbHr()).isGreaterThan(a.tbHr());
        assertEquals(a.tpHr(), b.tpHr(), 1e-12);
        assertThat(b.size()).isGreaterThan(a.size());
    }

    @Test
    @DisplayName("Muestreo en k·Δt: empieza en 0, termina en 0 y cubre la base")
    void samplingGrid() {
        UnitHydrograph uh = new TriangularUnitHydrograph(1.25).build(AREA_HA, TC_HR, DT_HR);

        assertEquals(0.0, uh.timeHr()[0], 0.0);
        assertEquals(0.0, uh.flowM3s()[0], 0.0);
        assertEquals(0.0, uh.flowM3s()[uh.size() - 1], 1e-12);
        assertThat(uh.timeHr()[uh.size() - 1]).isGreaterThanOrEqualTo(uh.tbHr() - 1e-9);
        assertEquals(DT_HR, uh.timeHr()[1] - uh.timeHr()[0], 1e-12);
        for (double q : uh.flowM3s()) {
            assertThat(q).isBetween(0.0, uh.qpM3s() + 1e-12);
        }
    }

    @Test
    @DisplayName("Caudal pico del triangular X: 0.278·A/Tp·2/(1+X)")
    void triangularPeakFormula() {
        UnitHydrograph uh = new TriangularUnitHydrograph(1.0).build(AREA_HA, TC_HR, DT_HR);

        assertEquals(0.278 * 1.0 / 1.1, uh.qpM3s(), 1e-9);
        assertEquals(1.1, uh.tpHr(), 1e-12);
        assertEquals(2.2, uh.tbHr(), 1e-12);
    }

    @Test
    @DisplayName("X < 1, área, Tc o dt no positivos deben lanzar excepción")
    void invalidArgumentsThrow() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new TriangularUnitHydrograph(0.9));
        assertThat(e.getMessage()).contains("Factor X");
        TriangularUnitHydrograph uh = new TriangularUnitHydrograph(1.0);
        assertThrows(IllegalArgumentException.class, () -> uh.build(0, 1, 0.1));
        assertThrows(IllegalArgumentException.class, () -> uh.build(10, 0, 0.1));
        assertThrows(IllegalArgumentException.class, () -> uh.build(10, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> ScsTriangularUnitHydrograph.peakFlow(1, 10, 0));
    }
}
