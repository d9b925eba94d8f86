package hidropluvial.physics.tc;

import hidropluvial.physics.i.IIdfCurve;
import hidropluvial.physics.idf.DinaguaIdf;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KinematicWaveSolverTest {

    private static final double L = 60.0;
    private static final double N = 0.05;
    private static final double S = 0.01;

    private static double closedForm(double intensity) {
        return 6.99 * Math.pow(N * L, 0.6) / (Math.pow(intensity, 0.4) * Math.pow(S, 0.3)) / 60.0;
    }

    @Test
    @DisplayName("Con intensidad fija el resultado es la fórmula cerrada")
    void fixedIntensityMatchesClosedForm() {
        assertEquals(closedForm(60.0), KinematicWaveSolver.solve(L, N, S, 60.0), 1e-12);
    }

    @Test
    @DisplayName("Acoplado a una IDF el Tc es punto fijo de tc = f(i(tc))")
    void coupledSolutionIsFixedPoint() {
        // ARRANGE
        IIdfCurve idf = new DinaguaIdf(80.0);

        // ACT
        double tc = KinematicWaveSolver.solve(L, N, S, 50.0, idf, 10);

        // ASSERT
        double implied = closedForm(idf.intensity(tc * 60.0, 10));
        assertEquals(implied, tc, KinematicWaveSolver.TOLERANCE_HR);
    }

    @Test
    @DisplayName("Sin convergencia devuelve la última estimación en vez de lanzar")
    void nonConvergenceReturnsBestEstimate() {
        double tc = KinematicWaveSolver.solve(L, N, S, 60.0, new DinaguaIdf(80.0), 10, 1, 1e-12);

        assertEquals(closedForm(60.0), tc, 1e-12);
    }

    @Test
    @DisplayName("Parámetros no positivos deben lanzar excepción")
    void invalidInputsThrow() {
        assertThrows(IllegalArgumentException.class, () -> KinematicWaveSolver.solve(0, N, S, 60));
        assertThrows(IllegalArgumentException.class, () -> KinematicWaveSolver.solve(L, 0, S, 60));
        assertThrows(IllegalArgumentException.class, () -> KinematicWaveSolver.solve(L, N, S, 0));
        assertThrows(IllegalArgumentException.class, () -> KinematicWaveSolver.solve(L, N, S, 60, null, 0, 0, 0.01));
    }
}
