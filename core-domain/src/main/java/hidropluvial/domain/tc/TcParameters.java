package hidropluvial.domain.tc;

import hidropluvial.domain.basin.BasinParameters;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Bolsa de parámetros para el despachador de tiempo de concentración.
 * <p>
 * Todos los campos son opcionales; cada método exige su propio subconjunto. Las
 * longitudes y pendientes pueden llegar en cualquiera de sus dos unidades
 * ({@code lengthM}/{@code lengthKm}, {@code slope}/{@code slopePct}).
 */
@Value
@Builder
@With
public class TcParameters {

    Double lengthM;
    Double lengthKm;

    /**
     * Pendiente en m/m.
     */
    Double slope;

    /**
     * Pendiente en porcentaje.
     */
    Double slopePct;

    Double elevationDropM;

    @Builder.Default
    KirpichSurface surface = KirpichSurface.NATURAL;

    List<FlowSegment> segments;

    /**
     * Lluvia de 2 años y 24 h (mm) para flujo laminar NRCS.
     */
    @Builder.Default
    double p2Mm = 50.0;

    Double runoffCoefficient;
    Double manningN;
    Double intensityMmHr;
    Double areaHa;

    /**
     * Tiempo de entrada para Desbordes (min). Nulo equivale a 5 min.
     */
    Double t0Min;

    /**
     * Prepara la bolsa con los datos que la cuenca ya conoce: longitud, desnivel,
     * pendiente, área y C.
     */
    public static TcParameters fromBasin(BasinParameters basin) {
        return TcParameters.builder()
                .lengthM(basin.lengthM())
                .elevationDropM(basin.elevationDropM())
                .slopePct(basin.slopePct())
                .areaHa(basin.areaHa())
                .runoffCoefficient(basin.hasRunoffCoefficient() ? basin.runoffCoefficient().value() : null)
                .build();
    }
}
