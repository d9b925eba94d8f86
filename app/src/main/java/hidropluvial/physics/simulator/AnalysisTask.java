package hidropluvial.physics.simulator;

import hidropluvial.config.AnalysisConfig;
import hidropluvial.domain.analysis.AnalysisRun;
import hidropluvial.domain.basin.BasinParameters;
import hidropluvial.domain.hydrograph.RunoffMethod;
import hidropluvial.domain.storm.StormType;
import hidropluvial.domain.tc.TcResult;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Una combinación del producto cartesiano, lista para ejecutarse en el pool de hilos.
 */
@Getter
@RequiredArgsConstructor
public class AnalysisTask implements Callable<Optional<AnalysisRun>> {

    private final FloodAnalysisRunner runner;
    private final BasinParameters basin;
    private final TcResult tcResult;
    private final StormType stormType;
    private final int returnPeriod;
    private final double xFactor;
    private final RunoffMethod runoffMethod;
    private final AnalysisConfig config;

    @Override
    public Optional<AnalysisRun> call() {
        return runner.run(basin, tcResult, stormType, returnPeriod, xFactor, runoffMethod, config);
    }

    public String label() {
        return String.format(Locale.ROOT, "%s/%s/Tr%d/X%.2f/%s", tcResult.method().getCode(),
                stormType.getCode(), returnPeriod, xFactor, runoffMethod.getCode());
    }
}
