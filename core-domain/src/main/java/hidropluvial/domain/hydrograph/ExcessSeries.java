package hidropluvial.domain.hydrograph;

import java.util.Objects;

/**
 * Serie de lluvia efectiva (exceso) por intervalo.
 *
 * @param excessMm             Exceso incremental por intervalo (mm).
 * @param method               Transformación que la produjo.
 * @param runoffMm             Escorrentía total (mm).
 * @param runoffCoefficient    C efectivo (sólo racional).
 * @param curveNumber          CN tras el ajuste por AMC (sólo SCS-CN).
 * @param retentionMm          Retención potencial S (sólo SCS-CN).
 * @param initialAbstractionMm Abstracción inicial Ia (sólo SCS-CN).
 */
public record ExcessSeries(
        double[] excessMm,
        RunoffMethod method,
        double runoffMm,
        Double runoffCoefficient,
        Double curveNumber,
        Double retentionMm,
        Double initialAbstractionMm
) {

    public ExcessSeries {
        Objects.requireNonNull(excessMm, "La serie de exceso no puede ser nula.");
        Objects.requireNonNull(method, "El método de escorrentía no puede ser nulo.");
        excessMm = excessMm.clone();
    }

    public static ExcessSeries rational(double[] excessMm, double runoffMm, double c) {
        return new ExcessSeries(excessMm, RunoffMethod.RATIONAL, runoffMm, c, null, null, null);
    }

    public static ExcessSeries scs(double[] excessMm, double runoffMm, double cn, double s, double ia) {
        return new ExcessSeries(excessMm, RunoffMethod.SCS_CN, runoffMm, null, cn, s, ia);
    }
}
