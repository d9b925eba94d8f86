package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.MissingParameterException;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcParameters;
import hidropluvial.domain.tc.TcResult;
import hidropluvial.physics.i.ITcEstimator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orquestador del lote de análisis de una cuenca.
 * <p>
 * Responsabilidades:
 * 1. Calcular el Tc de cada método configurado (los que no tienen datos se omiten).
 * 2. Recorrer el producto Tc × tormenta × Tr × escorrentía × X (X sólo para gz).
 * 3. Ejecutar cada combinación en el pool y devolver los resultados en el orden del recorrido.
 */
@Slf4j
public class AnalysisBatchProcessor implements AutoCloseable {

    private final ITcEstimator tcEstimator;
    private final FloodAnalysisRunner runner;
    private final AnalysisConfig config;
    private final ExecutorService threadPool;

    public AnalysisBatchProcessor(ITcEstimator tcEstimator, FloodAnalysisRunner runner, AnalysisConfig config) {
        this.tcEstimator = tcEstimator;
        this.runner = runner;
        this.config = config;
        int processorCount = config.getCpuProcessorCount();
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("AnalysisBatchProcessor inicializado. (Hilos: {})", Math.max(processorCount, 1));
    }

    /**
     * Tc de cada método configurado con los datos de la cuenca. Un método al que le faltan
     * parámetros se registra y se omite.
     */
    public List<TcResult> computeTc(BasinParameters basin) {
        TcParameters parameters = TcParameters.fromBasin(basin).withT0Min(config.getT0Min());
        List<TcResult> results = new ArrayList<>();
        for (TcMethod method : config.getTcMethods()) {
            try {
                results.add(tcEstimator.estimate(method, parameters));
            } catch (MissingParameterException e) {
                log.warn("Tc {} omitido: {}", method.getCode(), e.getMessage());
            }
        }
        return results;
    }

    public List<AnalysisRun> process(BasinParameters basin) {
        return process(basin, computeTc(basin));
    }

    public List<AnalysisRun> process(BasinParameters basin, List<TcResult> tcResults) {
        long startTime = System.currentTimeMillis();
        List<AnalysisTask> tasks = createTasks(basin, tcResults);
        log.info("Lote de {} combinaciones para la cuenca '{}'", tasks.size(), basin.name());

        List<Future<Optional<AnalysisRun>>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Lote de análisis interrumpido.", e);
        }

        List<AnalysisRun> runs = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            AnalysisTask task = tasks.get(i);
            try {
                futures.get(i).get().ifPresentOrElse(runs::add,
                        () -> log.warn("Combinación omitida: {}", task.label()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Lote de análisis interrumpido.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw new IllegalStateException("Error en el análisis " + task.label(), e.getCause());
            }
        }

        log.info("Lote completado: {} análisis en {} ms", runs.size(), System.currentTimeMillis() - startTime);
        return Collections.unmodifiableList(runs);
    }

    private List<AnalysisTask> createTasks(BasinParameters basin, List<TcResult> tcResults) {
        List<AnalysisTask> tasks = new ArrayList<>();
        for (TcResult tc : tcResults) {
            for (StormType storm : config.getStormTypes()) {
                for (int tr : config.getReturnPeriods()) {
                    for (RunoffMethod runoff : config.getRunoffMethods()) {
                        if (storm == StormType.GZ) {
                            for (double x : config.getXFactors()) {
                                tasks.add(new AnalysisTask(runner, basin, tc, storm, tr, x, runoff, config));
                            }
                        } else {
                            tasks.add(new AnalysisTask(runner, basin, tc, storm, tr, 1.0, runoff, config));
                        }
                    }
                }
            }
        }
        return tasks;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("AnalysisBatchProcessor cerrado.");
    }
}
