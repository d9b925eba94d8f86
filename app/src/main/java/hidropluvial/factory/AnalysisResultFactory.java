package hidropluvial.factory;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.hydrograph.ExcessSeries;
import hidropluvial.domain.hydrograph.HydrographResult;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.physics.hydrograph.ConvolutionSolver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fábrica centralizada de los resultados de un análisis.
 * <p>
 * Arma el {@link TcResult} efectivo (con los parámetros de escorrentía añadidos) y el
 * {@link HydrographResult} a partir de la convolución ya calculada.
 */
public class AnalysisResultFactory {

    /**
     * Tc tal como se usó en el análisis. {@code tc} ya es el resultado efectivo (el del
     * recálculo bajo Desbordes), por lo que sus parámetros bastan para volver a derivarlo;
     * aquí sólo se añaden los datos de escorrentía, con claves propias.
     */
    public static TcResult createTcResult(TcResult tc, Double cRunoff, ExcessSeries excess, AnalysisConfig config) {
        Map<String, Object> params = new LinkedHashMap<>(tc.parameters());

        params.put("runoff_method", excess.method().getCode());
        if (excess.method() == RunoffMethod.RATIONAL && cRunoff != null) {
            params.put("c_runoff", round(cRunoff, 3));
        } else if (excess.method() == RunoffMethod.SCS_CN && excess.curveNumber() != null) {
            params.put("cn_adjusted", round(excess.curveNumber(), 1));
            params.put("amc", config.getAmc().getCode());
            params.put("lambda", config.getLambda());
        }
        return new TcResult(tc.method(), tc.tcHr(), params);
    }

    public static HydrographResult createHydrograph(TcResult tc, StormType stormType, int returnPeriod,
                                                    HyetographResult storm, ExcessSeries excess,
                                                    String unitHydrographName, UnitHydrograph unitHydrograph,
                                                    double[] flowM3s) {
        double dtHr = storm.dtMin() / 60.0;
        double[] time = ConvolutionSolver.timeAxisHr(flowM3s.length, dtHr);
        int peak = ConvolutionSolver.peakIndex(flowM3s);

        return HydrographResult.builder()
                .tcMethod(tc.method().getCode())
                .tcMin(tc.tcMin())
                .stormType(stormType.getCode())
                .returnPeriod(returnPeriod)
                .runoffMethod(excess.method().getCode())
                .unitHydrograph(unitHydrographName)
                .xFactor(unitHydrograph.xFactor())
                .peakFlowM3s(flowM3s[peak])
                .timeToPeakHr(time[peak])
                .tpUnitHr(unitHydrograph.tpHr())
                .tbHr(unitHydrograph.tbHr())
                .volumeM3(ConvolutionSolver.volumeM3(flowM3s, dtHr))
                .totalDepthMm(storm.totalDepthMm())
                .runoffMm(excess.runoffMm())
                .timeHr(time)
                .flowM3s(flowM3s)
                .build();
    }

    public static AnalysisRun createRun(TcResult tc, HyetographResult storm, HydrographResult hydrograph) {
        return new AnalysisRun(tc, storm, hydrograph);
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
