package hidropluvial.factory;

import hidropluvial.domain.storm.HyetographResult;

import java.util.Objects;

/**
 * Ensambla {@link HyetographResult} a partir de las láminas por intervalo, derivando
 * intensidades, acumulado, total y pico de una sola forma para todos los generadores.
 */
public final class HyetographResultFactory {

    /**
     * Ruido numérico negativo admitido en una lámina (mm); por debajo se considera error.
     */
    private static final double NEGATIVE_NOISE_MM = 1e-9;

    private HyetographResultFactory() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    /**
     * @param timeMin Tiempo central de cada intervalo (min).
     * @param depthMm Lámina de cada intervalo (mm). No se modifica.
     * @param dtMin   Paso de tiempo (min).
     * @param method  Etiqueta del generador.
     * @throws IllegalArgumentException si alguna lámina es negativa más allá del ruido de redondeo.
     */
    public static HyetographResult createFromDepths(double[] timeMin, double[] depthMm, double dtMin, String method) {
        Objects.requireNonNull(timeMin, "El array de tiempos no puede ser nulo.");
        Objects.requireNonNull(depthMm, "El array de láminas no puede ser nulo.");
        if (dtMin <= 0) {
            throw new IllegalArgumentException("dt debe ser > 0");
        }

        int n = depthMm.length;
        double[] depths = new double[n];
        double[] intensities = new double[n];
        double[] cumulative = new double[n];

        double total = 0.0;
        double peak = 0.0;
        for (int i = 0; i < n; i++) {
            double depth = depthMm[i];
            if (depth < 0) {
                if (depth < -NEGATIVE_NOISE_MM) {
                    throw new IllegalArgumentException("Lámina negativa en el intervalo " + i + ": " + depth);
                }
                depth = 0.0;
            }
            depths[i] = depth;
            intensities[i] = depth * 60.0 / dtMin;
            total += depth;
            cumulative[i] = total;
            peak = Math.max(peak, intensities[i]);
        }

        return new HyetographResult(timeMin, depths, intensities, cumulative, dtMin, total, peak, method);
    }

    /**
     * Tiempos centrales {@code i·dt + dt/2} de {@code n} intervalos.
     */
    public static double[] centeredTimes(int n, double dtMin) {
        double[] times = new double[n];
        for (int i = 0; i < n; i++) {
            times[i] = i * dtMin + dtMin / 2.0;
        }
        return times;
    }

    /**
     * Número de intervalos completos de {@code dtMin} en la duración; al menos 1.
     */
    public static int intervalCount(double durationHr, double dtMin) {
        if (durationHr <= 0) {
            throw new IllegalArgumentException("Duración debe ser > 0");
        }
        if (dtMin <= 0) {
            throw new IllegalArgumentException("dt debe ser > 0");
        }
        // Tolerancia para que 6 h / 5 min no quede en 71 por redondeo binario.
        int n = (int) Math.floor(durationHr * 60.0 / dtMin + 1e-9);
        if (n < 1) {
            throw new IllegalArgumentException("dt (" + dtMin + " min) mayor que la duración (" + durationHr * 60.0 + " min)");
        }
        return n;
    }
}
