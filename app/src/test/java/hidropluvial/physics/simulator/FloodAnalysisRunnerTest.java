package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.AntecedentMoisture;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.HydrographResult;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.hydrograph.UnitHydrographMethod;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcParameters;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.factory.HyetographResultFactory;
import hidropluvial.physics.hydrograph.ScsTiming;
import hidropluvial.physics.hydrograph.ScsTriangularUnitHydrograph;
import hidropluvial.physics.hydrograph.SnyderUnitHydrograph;
import hidropluvial.physics.i.IHyetographGenerator;
import hidropluvial.physics.i.ITcEstimator;
import hidropluvial.physics.storm.StormRequest;
import hidropluvial.physics.tc.TcCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Test del análisis individual con el cálculo de Tc y la generación de tormentas simulados.
 */
class FloodAnalysisRunnerTest {

    private ITcEstimator tcEstimator;
    private IHyetographGenerator hyetographGenerator;
    private FloodAnalysisRunner runner;

    private BasinParameters basin;
    private HyetographResult storm;
    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        tcEstimator = mock(ITcEstimator.class);
        hyetographGenerator = mock(IHyetographGenerator.class);
        runner = new FloodAnalysisRunner(tcEstimator, hyetographGenerator);

        basin = BasinParameters.getTestingBasin();
        double[] depths = {2, 5, 20, 30, 10, 3};
        storm = HyetographResultFactory.createFromDepths(
                HyetographResultFactory.centeredTimes(depths.length, 10), depths, 10, "test");
        config = AnalysisConfig.defaults();

        when(hyetographGenerator.generate(any(), any())).thenReturn(storm);
    }

    private static TcResult kirpich(double tcHr) {
        return new TcResult(TcMethod.KIRPICH, tcHr, Map.of("length_m", 800.0, "slope", 0.02));
    }

    @Test
    @DisplayName("SCS-CN sin Curva Número omite el análisis en vez de devolver ceros")
    void missingCurveNumberSkipsRun() {
        // ARRANGE
        BasinParameters noCn = basin.withCurveNumber(null);

        // ACT
        Optional<AnalysisRun> run = runner.run(noCn, kirpich(0.3), StormType.GZ, 10, 1.0, RunoffMethod.SCS_CN, config);

        // ASSERT
        assertTrue(run.isEmpty());
        verifyNoInteractions(tcEstimator);
    }

    @Test
    @DisplayName("Racional sin C omite el análisis")
    void missingCoefficientSkipsRun() {
        Optional<AnalysisRun> run = runner.run(basin.withRunoffCoefficient(null), kirpich(0.3), StormType.GZ,
                10, 1.0, RunoffMethod.RATIONAL, config);

        assertTrue(run.isEmpty());
    }

    @Test
    @DisplayName("Desbordes con racional recalcula el Tc con el C ajustado al Tr")
    void desbordesIsRecomputedWithAdjustedC() {
        // --- 1. Arrange ---
        TcResult original = new TcResult(TcMethod.DESBORDES, 0.30, Map.of("c", 0.55));
        when(tcEstimator.estimate(eq(TcMethod.DESBORDES), any()))
                .thenReturn(new TcResult(TcMethod.DESBORDES, 0.25, Map.of("t0_min", 5.0)));

        // --- 2. Act ---
        AnalysisRun run = runner.run(basin, original, StormType.GZ, 10, 1.0, RunoffMethod.RATIONAL, config)
                .orElseThrow();

        // --- 3. Assert ---
        ArgumentCaptor<TcParameters> parameters = ArgumentCaptor.forClass(TcParameters.class);
        verify(tcEstimator).estimate(eq(TcMethod.DESBORDES), parameters.capture());
        assertEquals(0.55 * 1.33, parameters.getValue().getRunoffCoefficient(), 1e-9);
        assertEquals(50.0, parameters.getValue().getAreaHa(), 0.0);
        assertEquals(5.0, parameters.getValue().getT0Min(), 0.0);

        ArgumentCaptor<StormRequest> request = ArgumentCaptor.forClass(StormRequest.class);
        verify(hyetographGenerator).generate(eq(StormType.GZ), request.capture());
        assertEquals(0.25, request.getValue().getTcHr(), 0.0);
        assertNull(request.getValue().getAreaKm2());

        assertEquals(0.25, run.tc().tcHr(), 0.0);
        assertEquals(15.0, run.hydrograph().tcMin(), 1e-9);
        assertThat(run.tc().parameters()).containsEntry("runoff_method", "racional").containsEntry("t0_min", 5.0);
    }

    @Test
    @DisplayName("Desbordes: los parámetros guardados reproducen el Tc del análisis")
    void desbordesParametersReproduceTc() {
        // ARRANGE
        TcCalculator calculator = new TcCalculator();
        FloodAnalysisRunner realTcRunner = new FloodAnalysisRunner(calculator, hyetographGenerator);
        TcResult original = calculator.estimate(TcMethod.DESBORDES, TcParameters.fromBasin(basin));

        // ACT
        AnalysisRun run = realTcRunner.run(basin, original, StormType.GZ, 25, 1.0, RunoffMethod.RATIONAL, config)
                .orElseThrow();

        // ASSERT
        Map<String, Object> stored = run.tc().parameters();
        TcParameters replay = TcParameters.builder()
                .areaHa((Double) stored.get("area_ha"))
                .slopePct((Double) stored.get("slope_pct"))
                .runoffCoefficient((Double) stored.get("c"))
                .t0Min((Double) stored.get("t0_min"))
                .build();
        assertEquals(run.tc().tcHr(), calculator.estimate(TcMethod.DESBORDES, replay).tcHr(), 1e-12);
        assertEquals(0.55 * 1.50, (Double) stored.get("c"), 1e-12);
        assertEquals(2.0, (Double) stored.get("slope_pct"), 0.0);
        assertThat(run.tc().tcHr()).isLessThan(original.tcHr());
    }

    @Test
    @DisplayName("Otros métodos de Tc no se recalculan")
    void otherMethodsAreNotRecomputed() {
        runner.run(basin, kirpich(0.3), StormType.GZ, 25, 1.0, RunoffMethod.RATIONAL, config).orElseThrow();

        verifyNoInteractions(tcEstimator);
    }

    @Test
    @DisplayName("Racional: exceso C·P y triangular con X = 1 fuera de gz")
    void rationalOutsideGzUsesUnitX() {
        // ACT
        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.BLOCKS, 2, 2.25, RunoffMethod.RATIONAL, config)
                .orElseThrow();

        // ASSERT
        HydrographResult hydrograph = run.hydrograph();
        assertEquals(1.0, hydrograph.xFactor(), 0.0);
        assertEquals(0.55 * 70.0, hydrograph.runoffMm(), 1e-9);
        assertEquals(70.0, hydrograph.totalDepthMm(), 1e-9);
        assertEquals("racional", hydrograph.runoffMethod());
        assertThat(hydrograph.peakFlowM3s()).isPositive();
        assertEquals(0.55, (Double) run.tc().parameters().get("c_runoff"), 0.0);
    }

    @Test
    @DisplayName("gz conserva el X pedido")
    void gzHonorsXFactor() {
        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.GZ, 2, 1.25, RunoffMethod.SCS_CN, config)
                .orElseThrow();

        assertEquals(1.25, run.hydrograph().xFactor(), 0.0);
        assertEquals(2.25 * run.hydrograph().tpUnitHr(), run.hydrograph().tbHr(), 1e-9);
    }

    @Test
    @DisplayName("SCS-CN fuera de gz usa el triangular SCS y registra el CN ajustado")
    void scsOutsideGzUsesScsUnitHydrograph() {
        // ACT
        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.BLOCKS, 10, 1.0, RunoffMethod.SCS_CN,
                config.withAmc(AntecedentMoisture.WET)).orElseThrow();

        // ASSERT
        HydrographResult hydrograph = run.hydrograph();
        assertEquals(ScsTriangularUnitHydrograph.EQUIVALENT_X_FACTOR, hydrograph.xFactor(), 0.0);
        assertEquals(ScsTiming.BASE_RATIO * hydrograph.tpUnitHr(), hydrograph.tbHr(), 1e-9);
        assertEquals(ScsTiming.timeToPeak(0.3, 10.0 / 60.0), hydrograph.tpUnitHr(), 1e-12);
        assertEquals("scs_triangular", hydrograph.unitHydrograph());
        assertThat(run.tc().parameters())
                .containsEntry("runoff_method", "scs-cn")
                .containsEntry("amc", "III")
                .containsKey("cn_adjusted")
                .containsEntry("length_m", 800.0);
    }

    @Test
    @DisplayName("SCS-CN fuera de gz usa el hidrograma unitario configurado")
    void scsOutsideGzUsesConfiguredUnitHydrograph() {
        // ACT
        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.BLOCKS, 10, 1.0, RunoffMethod.SCS_CN,
                config.withUnitHydrographMethod(UnitHydrographMethod.GAMMA)).orElseThrow();

        // ASSERT
        HydrographResult hydrograph = run.hydrograph();
        assertEquals("gamma", hydrograph.unitHydrograph());
        assertEquals(4.0, hydrograph.xFactor(), 1e-9);
        assertEquals(5.0 * hydrograph.tpUnitHr(), hydrograph.tbHr(), 1e-9);
    }

    @Test
    @DisplayName("El racional ignora el hidrograma configurado y sigue con el triangular X")
    void rationalIgnoresConfiguredUnitHydrograph() {
        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.BLOCKS, 10, 1.0, RunoffMethod.RATIONAL,
                config.withUnitHydrographMethod(UnitHydrographMethod.CLARK)).orElseThrow();

        assertEquals("triangular_x", run.hydrograph().unitHydrograph());
        assertEquals(1.0, run.hydrograph().xFactor(), 0.0);
    }

    @Test
    @DisplayName("Snyder toma L de la cuenca y Lc de la configuración")
    void snyderUsesBasinLength() {
        AnalysisConfig snyder = config.withUnitHydrographMethod(UnitHydrographMethod.SNYDER)
                .withSnyderCentroidLengthKm(0.4);

        AnalysisRun run = runner.run(basin, kirpich(0.3), StormType.BLOCKS, 10, 1.0, RunoffMethod.SCS_CN, snyder)
                .orElseThrow();

        assertEquals("snyder", run.hydrograph().unitHydrograph());
        assertEquals(new SnyderUnitHydrograph(0.8, 0.4).lagTimeHr(), run.hydrograph().tpUnitHr(), 1e-12);
    }

    @Test
    @DisplayName("Con reducción areal activada la tormenta recibe el área en km²")
    void areaReductionPassesArea() {
        runner.run(basin, kirpich(0.3), StormType.GZ, 10, 1.0, RunoffMethod.RATIONAL,
                config.withAreaReduction(true)).orElseThrow();

        ArgumentCaptor<StormRequest> request = ArgumentCaptor.forClass(StormRequest.class);
        verify(hyetographGenerator).generate(eq(StormType.GZ), request.capture());
        assertEquals(0.5, request.getValue().getAreaKm2(), 1e-12);
        assertEquals(78.0, request.getValue().getP310Mm(), 0.0);
        assertEquals(10.0, request.getValue().getReturnPeriodYr(), 0.0);
    }

    @Test
    @DisplayName("El tiempo al pico corresponde al máximo del hidrograma")
    void peakIsConsistentWithSeries() {
        HydrographResult hydrograph = runner.run(basin, kirpich(0.3), StormType.GZ, 10, 1.0,
                RunoffMethod.RATIONAL, config).orElseThrow().hydrograph();

        double max = 0.0;
        int index = 0;
        for (int i = 0; i < hydrograph.flowM3s().length; i++) {
            if (hydrograph.flowM3s()[i] > max) {
                max = hydrograph.flowM3s()[i];
                index = i;
            }
        }
        assertEquals(max, hydrograph.peakFlowM3s(), 0.0);
        assertEquals(hydrograph.timeHr()[index], hydrograph.timeToPeakHr(), 0.0);
        assertEquals(hydrograph.timeHr().length, hydrograph.flowM3s().length);
    }
}
