package hidropluvial.physics.hydrograph;

import java.util.Objects;

/**
 * Convolución discreta del exceso de lluvia con el hidrograma unitario y métricas del
 * hidrograma resultante.
 * <pre>
 *     Q[n] = Σ P[m] · U[n − m]
 * </pre>
 * <p>
 * Stateless y Thread-Safe.
 */
public final class ConvolutionSolver {

    private ConvolutionSolver() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param excessMm        Exceso por intervalo (mm).
     * @param unitOrdinateM3s Ordenadas del hidrograma unitario (m³/s por mm).
     * @return Caudales, de longitud {@code n + m − 1}.
     */
    public static double[] convolve(double[] excessMm, double[] unitOrdinateM3s) {
        Objects.requireNonNull(excessMm, "La serie de exceso no puede ser nula.");
        Objects.requireNonNull(unitOrdinateM3s, "El hidrograma unitario no puede ser nulo.");
        if (excessMm.length == 0 || unitOrdinateM3s.length == 0) {
            throw new IllegalArgumentException("Las series a convolucionar no pueden estar vacías.");
        }

        double[] flow = new double[excessMm.length + unitOrdinateM3s.length - 1];
        for (int m = 0; m < excessMm.length; m++) {
            double p = excessMm[m];
            if (p == 0.0) {
                continue;
            }
            for (int k = 0; k < unitOrdinateM3s.length; k++) {
                flow[m + k] += p * unitOrdinateM3s[k];
            }
        }
        return flow;
    }

    /**
     * Índice del primer máximo.
     */
    public static int peakIndex(double[] flow) {
        if (flow.length == 0) {
            throw new IllegalArgumentException("La serie de caudales no puede estar vacía.");
        }
        int peak = 0;
        for (int i = 1; i < flow.length; i++) {
            if (flow[i] > flow[peak]) {
                peak = i;
            }
        }
        return peak;
    }

    public static double[] timeAxisHr(int length, double dtHr) {
        double[] time = new double[length];
        for (int i = 0; i < length; i++) {
            time[i] = i * dtHr;
        }
        return time;
    }

    /**
     * Volumen (m³) por regla del trapecio con el tiempo en segundos.
     */
    public static double volumeM3(double[] flowM3s, double dtHr) {
        double dtSeconds = dtHr * 3600.0;
        double volume = 0.0;
        for (int i = 1; i < flowM3s.length; i++) {
            volume += 0.5 * (flowM3s[i - 1] + flowM3s[i]) * dtSeconds;
        }
        return volume;
    }
}
