package hidropluvial.config;

import hidropluvial.domain.basin.AntecedentMoisture;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.hydrograph.UnitHydrographMethod;
import hidropluvial.domain.idf.ShermanCoefficients;
import hidropluvial.domain.storm.CustomDistribution;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Contenedor de todas las opciones de un lote de análisis de crecidas.
 * <p>
 * Define el producto cartesiano que se evaluará (métodos de Tc × tormentas × Tr ×
 * factores X × métodos de escorrentía) y los parámetros de cada generador.
 */
@Value
@Builder
@With
public class AnalysisConfig {

    @Builder.Default
    List<TcMethod> tcMethods = List.of(TcMethod.KIRPICH, TcMethod.DESBORDES);

    @Builder.Default
    List<StormType> stormTypes = List.of(StormType.GZ);

    @Builder.Default
    List<Integer> returnPeriods = List.of(2, 10, 25);

    /**
     * Factores morfológicos X. Sólo se recorren para la tormenta {@code gz};
     * el resto de tormentas usa X = 1.0.
     */
    @Builder.Default
    List<Double> xFactors = List.of(1.0, 1.25);

    @Builder.Default
    List<RunoffMethod> runoffMethods = List.of(RunoffMethod.RATIONAL, RunoffMethod.SCS_CN);

    /**
     * Paso de tiempo del hietograma (min).
     */
    @Builder.Default
    double dtMin = 5.0;

    @Builder.Default
    AntecedentMoisture amc = AntecedentMoisture.AVERAGE;

    /**
     * Coeficiente de abstracción inicial λ (Ia = λ·S).
     */
    @Builder.Default
    double lambda = 0.2;

    /**
     * Tiempo de entrada de Desbordes (min).
     */
    @Builder.Default
    double t0Min = 5.0;

    /**
     * Aplica la reducción areal DINAGUA con el área de la cuenca. Por defecto la lluvia es puntual.
     */
    @Builder.Default
    boolean areaReduction = false;

    // --- Tormenta bimodal ---
    @Builder.Default
    double bimodalDurationHr = 6.0;
    @Builder.Default
    double bimodalPeak1 = 0.25;
    @Builder.Default
    double bimodalPeak2 = 0.75;
    @Builder.Default
    double bimodalVolumeSplit = 0.5;
    @Builder.Default
    double bimodalPeakWidth = 0.15;

    // --- Tormenta personalizada ---
    @Builder.Default
    double customDurationHr = 6.0;
    /**
     * Lámina total conocida (mm). Si es nula y no hay evento observado se usa DINAGUA.
     */
    Double customDepthMm;
    @Builder.Default
    CustomDistribution customDistribution = CustomDistribution.ALTERNATING_BLOCKS;
    /**
     * Evento observado: tiempos centrales (min) y láminas (mm) por intervalo.
     */
    List<Double> customEventTimeMin;
    List<Double> customEventDepthMm;

    // --- Otras tormentas ---
    @Builder.Default
    int huffProbability = 50;

    /**
     * Coeficientes Sherman para la tormenta Chicago (requeridos sólo si se pide {@code chicago}).
     */
    ShermanCoefficients shermanCoefficients;

    @Builder.Default
    double chicagoAdvancement = 0.375;

    // --- Hidrograma unitario ---
    /**
     * Hidrograma unitario de los análisis SCS-CN fuera de {@code gz}. Racional y {@code gz}
     * usan siempre el triangular con X.
     */
    @Builder.Default
    UnitHydrographMethod unitHydrographMethod = UnitHydrographMethod.SCS_TRIANGULAR;
    @Builder.Default
    double peakRateFactor = 484.0;
    @Builder.Default
    double gammaShape = 3.7;
    /**
     * Constante R de Clark (h). Nula: {@code 2·Tc}.
     */
    Double clarkStorageHr;
    /**
     * Distancia de la salida al centroide sobre el cauce (km), requerida por Snyder.
     */
    Double snyderCentroidLengthKm;
    @Builder.Default
    double snyderCt = 2.0;
    @Builder.Default
    double snyderCp = 0.6;

    /**
     * Número de hilos del procesador por lotes.
     */
    @Builder.Default
    int cpuProcessorCount = Runtime.getRuntime().availableProcessors();

    public boolean hasCustomEvent() {
        return customEventTimeMin != null && customEventDepthMm != null
                && !customEventTimeMin.isEmpty() && !customEventDepthMm.isEmpty();
    }

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
