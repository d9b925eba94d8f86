package hidropluvial.domain.hydrograph;

import lombok.Builder;

import java.util.Objects;

/**
 * Hidrograma de crecida resultante de convolucionar el exceso con el hidrograma unitario.
 * Todos los campos son números, cadenas o listas planas para poder exportarlo a JSON.
 *
 * @param tcMethod      Método de Tc que originó el análisis.
 * @param tcMin         Tc utilizado (min), ya recalculado si correspondía.
 * @param stormType     Código de la tormenta.
 * @param returnPeriod  Período de retorno (años).
 * @param runoffMethod  Transformación lluvia-escorrentía.
 * @param unitHydrograph Hidrograma unitario usado.
 * @param xFactor       Factor X del hidrograma unitario (para formas no triangulares, {@code Tb/Tp − 1}).
 * @param peakFlowM3s   Caudal pico (m³/s).
 * @param timeToPeakHr  Tiempo al pico del hidrograma (h).
 * @param tpUnitHr      Tiempo al pico del hidrograma unitario (h).
 * @param tbHr          Tiempo base del hidrograma unitario (h).
 * @param volumeM3      Volumen escurrido (m³).
 * @param totalDepthMm  Lámina total de lluvia (mm).
 * @param runoffMm      Lámina de escorrentía (mm).
 * @param timeHr        Serie de tiempos (h).
 * @param flowM3s       Serie de caudales (m³/s).
 */
@Builder
public record HydrographResult(
        String tcMethod,
        double tcMin,
        String stormType,
        int returnPeriod,
        String runoffMethod,
        String unitHydrograph,
        double xFactor,
        double peakFlowM3s,
        double timeToPeakHr,
        double tpUnitHr,
        double tbHr,
        double volumeM3,
        double totalDepthMm,
        double runoffMm,
        double[] timeHr,
        double[] flowM3s
) {

    public HydrographResult {
        Objects.requireNonNull(timeHr, "El array de tiempos no puede ser nulo.");
        Objects.requireNonNull(flowM3s, "El array de caudales no puede ser nulo.");
        if (timeHr.length != flowM3s.length) {
            throw new IllegalArgumentException("Tiempos y caudales del hidrograma deben tener la misma longitud.");
        }
        timeHr = timeHr.clone();
        flowM3s = flowM3s.clone();
    }
}
