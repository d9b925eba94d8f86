package hidropluvial.physics.hydrograph;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros propios de cada hidrograma unitario. Cada método lee sólo los suyos.
 */
@Value
@Builder
@With
public class UnitHydrographRequest {

    @Builder.Default
    double xFactor = 1.0;

    /**
     * Peak Rate Factor del curvilíneo SCS.
     */
    @Builder.Default
    double peakRateFactor = ScsCurvilinearUnitHydrograph.STANDARD_PEAK_RATE_FACTOR;

    @Builder.Default
    double gammaShape = GammaUnitHydrograph.DEFAULT_SHAPE;

    /**
     * Constante R de Clark (h); nula para {@code 2·Tc}.
     */
    Double clarkStorageHr;

    // --- Snyder ---
    Double lengthKm;
    Double centroidLengthKm;
    @Builder.Default
    double snyderCt = SnyderUnitHydrograph.DEFAULT_CT;
    @Builder.Default
    double snyderCp = SnyderUnitHydrograph.DEFAULT_CP;
}
