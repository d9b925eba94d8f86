package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.ExcessOutcome;
import hidropluvial.domain.hydrograph.ExcessSeries;
import hidropluvial.domain.hydrograph.HydrographResult;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.hydrograph.UnitHydrograph;
import hidropluvial.domain.hydrograph.UnitHydrographMethod;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcParameters;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.factory.AnalysisResultFactory;
import hidropluvial.physics.coefficients.ReturnPeriodAdjuster;
import hidropluvial.physics.hydrograph.ConvolutionSolver;
import hidropluvial.physics.hydrograph.UnitHydrographFactory;
import hidropluvial.physics.hydrograph.UnitHydrographRequest;
import hidropluvial.physics.i.IHyetographGenerator;
import hidropluvial.physics.i.ITcEstimator;
import hidropluvial.physics.i.IUnitHydrograph;
import hidropluvial.physics.runoff.RainfallExcessCalculator;
import hidropluvial.physics.storm.StormRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Ejecuta un análisis individual: tormenta → lluvia efectiva → hidrograma unitario → convolución.
 * <p>
 * Flujo:
 * 1. Con escorrentía racional se ajusta C al Tr (exacto desde tabla si es posible).
 * 2. Bajo Desbordes el Tc se recalcula con ese C.
 * 3. Se genera la tormenta y el exceso; si el método no es aplicable el análisis se omite.
 * 4. Racional o gz usan el triangular con X; el resto, el hidrograma unitario configurado
 *    (triangular SCS por defecto).
 * <p>
 * No guarda estado entre llamadas: una misma instancia puede usarse desde varios hilos.
 */
@Slf4j
@RequiredArgsConstructor
public class FloodAnalysisRunner {

    private final ITcEstimator tcEstimator;
    private final IHyetographGenerator hyetographGenerator;
    private final UnitHydrographFactory unitHydrographFactory;

    /**
     * Sin registro de curvas: el hidrograma curvilíneo SCS no estará disponible.
     */
    public FloodAnalysisRunner(ITcEstimator tcEstimator, IHyetographGenerator hyetographGenerator) {
        this(tcEstimator, hyetographGenerator, new UnitHydrographFactory());
    }

    /**
     * @return El análisis, o vacío si la cuenca no tiene el dato que exige el método de escorrentía.
     */
    public Optional<AnalysisRun> run(BasinParameters basin, TcResult tcResult, StormType stormType,
                                     int returnPeriod, double xFactor, RunoffMethod runoffMethod,
                                     AnalysisConfig config) {
        Objects.requireNonNull(basin, "La cuenca no puede ser nula.");
        Objects.requireNonNull(tcResult, "El resultado de Tc no puede ser nulo.");
        Objects.requireNonNull(stormType, "El tipo de tormenta no puede ser nulo.");
        Objects.requireNonNull(runoffMethod, "El método de escorrentía no puede ser nulo.");
        Objects.requireNonNull(config, "La configuración no puede ser nula.");

        Double cAdjusted = null;
        if (runoffMethod == RunoffMethod.RATIONAL && basin.hasRunoffCoefficient()) {
            cAdjusted = ReturnPeriodAdjuster.cForTr(basin.runoffCoefficient(), returnPeriod);
        }

        TcResult effectiveTc = tcResult;
        if (tcResult.method() == TcMethod.DESBORDES && cAdjusted != null) {
            TcParameters desbordes = TcParameters.builder()
                    .areaHa(basin.areaHa())
                    .slopePct(basin.slopePct())
                    .runoffCoefficient(cAdjusted)
                    .t0Min(config.getT0Min())
                    .build();
            effectiveTc = tcEstimator.estimate(TcMethod.DESBORDES, desbordes);
        }
        double tcHr = effectiveTc.tcHr();

        StormRequest request = StormRequest.builder()
                .p310Mm(basin.p310Mm())
                .returnPeriodYr(returnPeriod)
                .tcHr(tcHr)
                .areaKm2(config.isAreaReduction() ? basin.areaKm2() : null)
                .config(config)
                .build();
        HyetographResult storm = hyetographGenerator.generate(stormType, request);

        ExcessOutcome outcome = RainfallExcessCalculator.compute(runoffMethod, storm, cAdjusted,
                basin.curveNumber(), config.getAmc(), config.getLambda());
        if (!outcome.isAvailable()) {
            log.debug("Análisis omitido ({}/{}/Tr{}): {}", tcResult.method().getCode(), stormType.getCode(),
                    returnPeriod, outcome.reason());
            return Optional.empty();
        }
        ExcessSeries excess = outcome.series();

        double dtHr = storm.dtMin() / 60.0;
        boolean gz = stormType == StormType.GZ;
        UnitHydrographMethod unitMethod = runoffMethod == RunoffMethod.RATIONAL || gz
                ? UnitHydrographMethod.TRIANGULAR_X
                : config.getUnitHydrographMethod();
        IUnitHydrograph unitModel = unitHydrographFactory.create(unitMethod,
                unitHydrographRequest(basin, gz ? xFactor : 1.0, config));
        UnitHydrograph unitHydrograph = unitModel.build(basin.areaHa(), tcHr, dtHr);
        double[] flow = ConvolutionSolver.convolve(excess.excessMm(), unitHydrograph.flowM3s());

        TcResult runTc = AnalysisResultFactory.createTcResult(effectiveTc, cAdjusted, excess, config);
        HydrographResult hydrograph = AnalysisResultFactory.createHydrograph(runTc, stormType, returnPeriod,
                storm, excess, unitModel.name(), unitHydrograph, flow);

        log.debug("Análisis {}/{}/Tr{}/{}: Qp={} m3/s", tcResult.method().getCode(), stormType.getCode(),
                returnPeriod, runoffMethod.getCode(), hydrograph.peakFlowM3s());
        return Optional.of(AnalysisResultFactory.createRun(runTc, storm, hydrograph));
    }

    private static UnitHydrographRequest unitHydrographRequest(BasinParameters basin, double xFactor,
                                                               AnalysisConfig config) {
        return UnitHydrographRequest.builder()
                .xFactor(xFactor)
                .peakRateFactor(config.getPeakRateFactor())
                .gammaShape(config.getGammaShape())
                .clarkStorageHr(config.getClarkStorageHr())
                .lengthKm(basin.lengthM() != null ? basin.lengthM() / 1000.0 : null)
                .centroidLengthKm(config.getSnyderCentroidLengthKm())
                .snyderCt(config.getSnyderCt())
                .snyderCp(config.getSnyderCp())
                .build();
    }
}
