package hidropluvial.physics.tc;

import hidropluvial.domain.MissingParameterException;
import hidropluvial.domain.tc.KirpichSurface;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcParameters;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.physics.i.IIdfCurve;
import hidropluvial.physics.i.ITcEstimator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Despachador de tiempo de concentración.
 * <p>
 * Normaliza unidades antes de despachar: {@code lengthKm} completa {@code lengthM}
 * (y viceversa para Témez y California) y {@code slopePct} completa {@code slope}.
 * El {@link TcResult} guarda los parámetros efectivamente usados.
 */
@Slf4j
public class TcCalculator implements ITcEstimator {

    private final IIdfCurve kinematicIdf;
    private final double kinematicReturnPeriodYr;

    /**
     * Onda cinemática con intensidad fija.
     */
    public TcCalculator() {
        this(null, 0);
    }

    /**
     * Onda cinemática acoplada a una curva IDF en el período de retorno dado.
     */
    public TcCalculator(IIdfCurve kinematicIdf, double kinematicReturnPeriodYr) {
        this.kinematicIdf = kinematicIdf;
        this.kinematicReturnPeriodYr = kinematicReturnPeriodYr;
    }

    @Override
    public TcResult estimate(TcMethod method, TcParameters parameters) {
        Objects.requireNonNull(method, "El método de Tc no puede ser nulo.");
        Objects.requireNonNull(parameters, "Los parámetros de Tc no pueden ser nulos.");

        Double lengthM = parameters.getLengthM();
        Double lengthKm = parameters.getLengthKm();
        Double slope = parameters.getSlope();
        Double slopePct = parameters.getSlopePct();

        if (lengthKm != null && lengthM == null) {
            lengthM = lengthKm * 1000.0;
        }
        if (slopePct != null && slope == null) {
            slope = slopePct / 100.0;
        }

        Map<String, Object> used = new LinkedHashMap<>();
        double tcHr;

        switch (method) {
            case KIRPICH -> {
                require("Kirpich", List.of("length_m", "slope"), lengthM, slope);
                KirpichSurface surface = parameters.getSurface() != null ? parameters.getSurface() : KirpichSurface.NATURAL;
                tcHr = EmpiricalTcSolver.kirpich(lengthM, slope, surface);
                used.put("length_m", lengthM);
                used.put("slope", slope);
                used.put("surface_type", surface.getCode());
            }
            case NRCS -> {
                if (parameters.getSegments() == null) {
                    throw new MissingParameterException("NRCS", List.of("segments"));
                }
                tcHr = NrcsVelocitySolver.totalTime(parameters.getSegments(), parameters.getP2Mm());
                used.put("segments", parameters.getSegments().size());
                used.put("p2_mm", parameters.getP2Mm());
            }
            case TEMEZ -> {
                Double km = lengthKm != null ? lengthKm : (lengthM != null ? lengthM / 1000.0 : null);
                if (km == null) {
                    throw new MissingParameterException("Témez", List.of("length_km"));
                }
                if (slope == null) {
                    throw new MissingParameterException("Témez", List.of("slope"));
                }
                tcHr = EmpiricalTcSolver.temez(km, slope);
                used.put("length_km", km);
                used.put("slope", slope);
            }
            case CALIFORNIA -> {
                Double km = lengthKm != null ? lengthKm : (lengthM != null ? lengthM / 1000.0 : null);
                if (km == null) {
                    throw new MissingParameterException("California", List.of("length_km"));
                }
                if (parameters.getElevationDropM() == null) {
                    throw new MissingParameterException("California", List.of("elevation_diff_m"));
                }
                tcHr = EmpiricalTcSolver.california(km, parameters.getElevationDropM());
                used.put("length_km", km);
                used.put("elevation_diff_m", parameters.getElevationDropM());
            }
            case FAA -> {
                require("FAA", List.of("length_m", "slope_pct", "c"),
                        lengthM, slopePct, parameters.getRunoffCoefficient());
                tcHr = EmpiricalTcSolver.faa(lengthM, slopePct, parameters.getRunoffCoefficient());
                used.put("length_m", lengthM);
                used.put("slope_pct", slopePct);
                used.put("c", parameters.getRunoffCoefficient());
            }
            case KINEMATIC -> {
                require("Kinematic", List.of("length_m", "n", "slope", "intensity_mmhr"),
                        lengthM, parameters.getManningN(), slope, parameters.getIntensityMmHr());
                tcHr = KinematicWaveSolver.solve(lengthM, parameters.getManningN(), slope,
                        parameters.getIntensityMmHr(), kinematicIdf, kinematicReturnPeriodYr);
                used.put("length_m", lengthM);
                used.put("n", parameters.getManningN());
                used.put("slope", slope);
                used.put("intensity_mmhr", parameters.getIntensityMmHr());
            }
            case DESBORDES -> {
                require("Desbordes", List.of("area_ha", "slope_pct", "c"),
                        parameters.getAreaHa(), slopePct, parameters.getRunoffCoefficient());
                double t0 = parameters.getT0Min() != null ? parameters.getT0Min() : EmpiricalTcSolver.DEFAULT_T0_MIN;
                tcHr = EmpiricalTcSolver.desbordes(parameters.getAreaHa(), slopePct, parameters.getRunoffCoefficient(), t0);
                used.put("area_ha", parameters.getAreaHa());
                used.put("slope_pct", slopePct);
                used.put("c", parameters.getRunoffCoefficient());
                used.put("t0_min", t0);
            }
            default -> throw new IllegalArgumentException("Método desconocido: " + method.getCode());
        }

        log.debug("Tc {} = {} min", method.getCode(), tcHr * 60.0);
        return new TcResult(method, tcHr, used);
    }

    /**
     * Lanza {@link MissingParameterException} con todos los nombres cuyo valor es nulo.
     * Los nombres y los valores se emparejan por posición.
     */
    private static void require(String method, List<String> names, Object... values) {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                missing.add(names.get(i));
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingParameterException(method, missing);
        }
    }
}
