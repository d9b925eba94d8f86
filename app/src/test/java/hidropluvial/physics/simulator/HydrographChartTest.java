package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.io.ReferenceCurveRegistry;
import hidropluvial.physics.storm.HyetographFactory;
import hidropluvial.physics.tc.TcCalculator;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.style.Styler;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Renderiza los hidrogramas de un lote a PNG, sin ventana, para revisarlos a ojo si hace falta.
 */
@Slf4j
class HydrographChartTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void headless() {
        System.setProperty("java.awt.headless", "true");
    }

    @Test
    @DisplayName("Los hidrogramas gz de cada factor X se exportan a una imagen PNG")
    void rendersHydrographsToPng() throws IOException {
        // --- 1. Configuración ---
        AnalysisConfig config = AnalysisConfig.builder()
                .tcMethods(List.of(TcMethod.KIRPICH))
                .stormTypes(List.of(StormType.GZ))
                .returnPeriods(List.of(25))
                .xFactors(List.of(1.0, 1.25, 1.67, 2.25))
                .runoffMethods(List.of(RunoffMethod.RATIONAL))
                .build();
        TcCalculator tcCalculator = new TcCalculator();
        FloodAnalysisRunner runner = new FloodAnalysisRunner(tcCalculator,
                new HyetographFactory(ReferenceCurveRegistry.fromClasspath()));

        // --- 2. Simulación ---
        List<AnalysisRun> runs;
        try (AnalysisBatchProcessor processor = new AnalysisBatchProcessor(tcCalculator, runner, config)) {
            runs = processor.process(BasinParameters.getTestingBasin());
        }
        assertEquals(4, runs.size());

        // --- 3. Gráfico ---
        XYChart chart = new XYChartBuilder()
                .width(1000).height(600)
                .title("Hidrogramas de crecida - Cuenca de prueba")
                .xAxisTitle("Tiempo (h)")
                .yAxisTitle("Caudal (m³/s)")
                .build();
        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNE);
        chart.getStyler().setMarkerSize(0);

        for (AnalysisRun run : runs) {
            log.info("{}: Qp={} m3/s", run.label(), run.hydrograph().peakFlowM3s());
            chart.addSeries(String.format("X=%.2f", run.hydrograph().xFactor()),
                    run.hydrograph().timeHr(), run.hydrograph().flowM3s());
        }

        Path png = tempDir.resolve("hidrogramas.png");
        BitmapEncoder.saveBitmap(chart, png.toString(), BitmapEncoder.BitmapFormat.PNG);

        // --- 4. Verificación ---
        assertTrue(Files.exists(png));
        BufferedImage image = ImageIO.read(png.toFile());
        assertNotNull(image);
        assertEquals(1000, image.getWidth());
        assertEquals(600, image.getHeight());
        assertEquals(4, chart.getSeriesMap().size());
    }
}
