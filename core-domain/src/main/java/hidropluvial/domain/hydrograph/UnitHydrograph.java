package hidropluvial.domain.hydrograph;

import java.util.Objects;

/**
 * Hidrograma unitario (1 mm de exceso sobre la cuenca) muestreado cada {@code dtHr}.
 *
 * @param timeHr  Tiempos de las ordenadas (h), {@code k·dtHr}.
 * @param flowM3s Ordenadas (m³/s por mm).
 * @param tpHr    Tiempo al pico (h).
 * @param tbHr    Tiempo base (h).
 * @param qpM3s   Caudal pico por mm (m³/s).
 * @param xFactor Factor morfológico X.
 * @param dtHr    Paso de muestreo (h).
 */
public record UnitHydrograph(
        double[] timeHr,
        double[] flowM3s,
        double tpHr,
        double tbHr,
        double qpM3s,
        double xFactor,
        double dtHr
) {

    public UnitHydrograph {
        Objects.requireNonNull(timeHr, "El array de tiempos no puede ser nulo.");
        Objects.requireNonNull(flowM3s, "El array de caudales no puede ser nulo.");
        if (timeHr.length != flowM3s.length) {
            throw new IllegalArgumentException("Tiempos y caudales del hidrograma unitario deben tener la misma longitud.");
        }
        timeHr = timeHr.clone();
        flowM3s = flowM3s.clone();
    }

    public int size() {
        return flowM3s.length;
    }
}
