package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.io.ReferenceCurveRegistry;
import hidropluvial.physics.storm.HyetographFactory;
import hidropluvial.physics.tc.TcCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Test de integración del lote: cálculo de Tc, recorrido de combinaciones y ejecución en el pool.
 */
class AnalysisBatchProcessorTest {

    private AnalysisConfig config;
    private AnalysisBatchProcessor processor;
    private BasinParameters basin;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.builder()
                .tcMethods(List.of(TcMethod.KIRPICH, TcMethod.DESBORDES, TcMethod.NRCS))
                .stormTypes(List.of(StormType.GZ, StormType.BLOCKS))
                .returnPeriods(List.of(2, 10))
                .xFactors(List.of(1.0, 1.25))
                .runoffMethods(List.of(RunoffMethod.RATIONAL, RunoffMethod.SCS_CN))
                .cpuProcessorCount(2)
                .build();
        TcCalculator tcCalculator = new TcCalculator();
        FloodAnalysisRunner runner = new FloodAnalysisRunner(tcCalculator,
                new HyetographFactory(ReferenceCurveRegistry.fromClasspath()));
        processor = new AnalysisBatchProcessor(tcCalculator, runner, config);
        basin = BasinParameters.getTestingBasin();
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    @Test
    @DisplayName("Los métodos de Tc sin datos se omiten")
    void computeTcSkipsMethodsWithoutData() {
        List<TcResult> tcs = processor.computeTc(basin);

        assertEquals(2, tcs.size());
        assertEquals(TcMethod.KIRPICH, tcs.get(0).method());
        assertEquals(TcMethod.DESBORDES, tcs.get(1).method());
    }

    @Test
    @DisplayName("Número de análisis: Tc × (gz: Tr × escorrentía × X + blocks: Tr × escorrentía)")
    void producesEveryCombination() {
        // ACT
        List<AnalysisRun> runs = processor.process(basin);

        // ASSERT
        assertEquals(2 * (2 * 2 * 2 + 2 * 2), runs.size());
        for (AnalysisRun run : runs) {
            assertThat(run.hydrograph().peakFlowM3s()).isPositive();
            assertThat(run.hydrograph().volumeM3()).isPositive();
        }
    }

    @Test
    @DisplayName("Los resultados siguen el orden Tc → tormenta → Tr → escorrentía → X")
    void resultsFollowTraversalOrder() {
        List<AnalysisRun> runs = processor.process(basin);

        assertEquals("kirpich/gz/Tr2/X1.00/racional", runs.get(0).label());
        assertEquals("kirpich/gz/Tr2/X1.25/racional", runs.get(1).label());
        assertEquals("kirpich/gz/Tr2/X1.00/scs-cn", runs.get(2).label());
        assertEquals("kirpich/blocks/Tr2/X1.00/racional", runs.get(8).label());
        assertEquals("desbordes/gz/Tr2/X1.00/racional", runs.get(12).label());
    }

    @Test
    @DisplayName("Dos ejecuciones del mismo lote dan los mismos caudales")
    void processingIsDeterministic() {
        List<AnalysisRun> first = processor.process(basin);
        List<AnalysisRun> second = processor.process(basin);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(first.get(i).hydrograph().flowM3s(), second.get(i).hydrograph().flowM3s(), 0.0);
        }
    }

    @Test
    @DisplayName("Sin CN sólo quedan los análisis racionales")
    void basinWithoutCurveNumberKeepsRationalRuns() {
        List<AnalysisRun> runs = processor.process(basin.withCurveNumber(null));

        assertEquals(12, runs.size());
        assertThat(runs).allMatch(run -> run.hydrograph().runoffMethod().equals("racional"));
    }

    @Test
    @DisplayName("Un X mayor en gz reduce el caudal pico")
    void largerXLowersPeak() {
        List<AnalysisRun> runs = processor.process(basin);

        assertThat(runs.get(1).hydrograph().peakFlowM3s()).isLessThan(runs.get(0).hydrograph().peakFlowM3s());
    }

    @Test
    @DisplayName("Un error de una combinación se propaga con su tipo original")
    void runtimeErrorsArePropagated() {
        // ARRANGE
        FloodAnalysisRunner failing = mock(FloodAnalysisRunner.class);
        when(failing.run(any(), any(), any(), anyInt(), anyDouble(), any(), any()))
                .thenThrow(new IllegalArgumentException("dt mayor que la duración"));

        // ACT & ASSERT
        try (AnalysisBatchProcessor broken = new AnalysisBatchProcessor(new TcCalculator(), failing, config)) {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> broken.process(basin));
            assertEquals("dt mayor que la duración", e.getMessage());
        }
    }
}
