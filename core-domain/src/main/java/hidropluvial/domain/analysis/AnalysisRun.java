package hidropluvial.domain.analysis;

import hidropluvial.domain.hydrograph.HydrographResult;
import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.tc.TcResult;

import java.util.Locale;
import java.util.Objects;

/**
 * Unidad de salida del motor: un Tc, el hietograma generado y el hidrograma resultante
 * para una combinación (método Tc × tormenta × Tr × X × escorrentía).
 */
public record AnalysisRun(TcResult tc, HyetographResult storm, HydrographResult hydrograph) {

    public AnalysisRun {
        Objects.requireNonNull(tc, "El resultado de Tc no puede ser nulo.");
        Objects.requireNonNull(storm, "El hietograma no puede ser nulo.");
        Objects.requireNonNull(hydrograph, "El hidrograma no puede ser nulo.");
    }

    /**
     * Identificador legible de la combinación, p. ej. {@code kirpich/gz/Tr25/X1.25/racional}.
     */
    public String label() {
        return String.format(Locale.ROOT, "%s/%s/Tr%d/X%.2f/%s",
                tc.method().getCode(), hydrograph.stormType(), hydrograph.returnPeriod(),
                hydrograph.xFactor(), hydrograph.runoffMethod());
    }
}
