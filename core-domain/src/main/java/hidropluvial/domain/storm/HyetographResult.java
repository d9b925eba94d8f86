package hidropluvial.domain.storm;

import java.util.Objects;

/**
 * Hietograma de diseño con paso de tiempo uniforme.
 * <p>
 * Invariantes: todas las láminas son >= 0, el acumulado es no decreciente y
 * {@code intensity[i] == depth[i]·60/dtMin}.
 *
 * @param timeMin           Tiempo central de cada intervalo (min).
 * @param depthMm           Lámina incremental de cada intervalo (mm).
 * @param intensityMmHr     Intensidad de cada intervalo (mm/h).
 * @param cumulativeMm      Lámina acumulada al final de cada intervalo (mm).
 * @param dtMin             Paso de tiempo (min).
 * @param totalDepthMm      Lámina total (mm).
 * @param peakIntensityMmHr Intensidad máxima (mm/h).
 * @param method            Etiqueta del generador que produjo la serie.
 */
public record HyetographResult(
        double[] timeMin,
        double[] depthMm,
        double[] intensityMmHr,
        double[] cumulativeMm,
        double dtMin,
        double totalDepthMm,
        double peakIntensityMmHr,
        String method
) {

    public HyetographResult {
        Objects.requireNonNull(timeMin, "El array de tiempos no puede ser nulo.");
        Objects.requireNonNull(depthMm, "El array de láminas no puede ser nulo.");
        Objects.requireNonNull(intensityMmHr, "El array de intensidades no puede ser nulo.");
        Objects.requireNonNull(cumulativeMm, "El array de acumulados no puede ser nulo.");

        int length = timeMin.length;
        if (depthMm.length != length || intensityMmHr.length != length || cumulativeMm.length != length) {
            throw new IllegalArgumentException("Todas las series del hietograma deben tener la misma longitud.");
        }
        if (length == 0) {
            throw new IllegalArgumentException("El hietograma debe tener al menos un intervalo.");
        }
        if (dtMin <= 0) {
            throw new IllegalArgumentException("dt debe ser > 0");
        }
        for (double depth : depthMm) {
            if (depth < 0 || Double.isNaN(depth)) {
                throw new IllegalArgumentException("Las láminas del hietograma deben ser >= 0 (recibido " + depth + ")");
            }
        }

        timeMin = timeMin.clone();
        depthMm = depthMm.clone();
        intensityMmHr = intensityMmHr.clone();
        cumulativeMm = cumulativeMm.clone();
    }

    public int intervalCount() {
        return depthMm.length;
    }

    /**
     * Devuelve una copia con otra etiqueta de método; las series no cambian.
     */
    public HyetographResult relabel(String newMethod) {
        return new HyetographResult(timeMin, depthMm, intensityMmHr, cumulativeMm,
                dtMin, totalDepthMm, peakIntensityMmHr, newMethod);
    }
}
