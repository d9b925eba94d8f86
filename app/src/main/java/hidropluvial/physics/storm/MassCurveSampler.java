package hidropluvial.physics.storm;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.factory.HyetographResultFactory;

/**
 * Muestreo de una curva de masa en una malla uniforme que cubre toda la duración.
 * <p>
 * La malla tiene {@code n = floor(D/dt)} intervalos de ancho {@code D/n}; cuando dt divide
 * a la duración coincide con dt, y en otro caso se ensancha lo justo para que el último
 * intervalo termine en D y la lámina total se conserve.
 */
final class MassCurveSampler {

    private MassCurveSampler() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param curve      Curva con abscisa en horas.
     * @param depthScale Factor que convierte la ordenada de la curva a mm.
     * @return Lámina incremental de cada intervalo (mm).
     */
    static double[] sample(CumulativeCurve curve, double durationHr, double dtMin, double depthScale) {
        int n = HyetographResultFactory.intervalCount(durationHr, dtMin);
        double stepHr = durationHr / n;

        double[] depths = new double[n];
        double previous = curve.interpolate(0.0) * depthScale;
        for (int i = 1; i <= n; i++) {
            double current = curve.interpolate(i * stepHr) * depthScale;
            depths[i - 1] = current - previous;
            previous = current;
        }
        return depths;
    }

    static HyetographResult toResult(double[] depths, double durationHr, String method) {
        double stepMin = durationHr * 60.0 / depths.length;
        return HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(depths.length, stepMin), depths, stepMin, method);
    }
}
