package hidropluvial.domain.hydrograph;

import java.util.Objects;
import java.util.Optional;

/**
 * Resultado explícito del cálculo de lluvia efectiva: o bien una serie calculada, o
 * bien la indicación de que el método no es aplicable a la combinación pedida
 * (p. ej. SCS-CN sin CN). Una combinación no disponible nunca debe tratarse como
 * escorrentía nula; el llamador la omite.
 */
public final class ExcessOutcome {

    private final ExcessSeries series;
    private final RunoffMethod method;
    private final String reason;

    private ExcessOutcome(ExcessSeries series, RunoffMethod method, String reason) {
        this.series = series;
        this.method = method;
        this.reason = reason;
    }

    public static ExcessOutcome computed(ExcessSeries series) {
        Objects.requireNonNull(series, "La serie calculada no puede ser nula.");
        return new ExcessOutcome(series, series.method(), null);
    }

    public static ExcessOutcome unavailable(RunoffMethod method, String reason) {
        return new ExcessOutcome(null, method, reason);
    }

    public boolean isAvailable() {
        return series != null;
    }

    public RunoffMethod method() {
        return method;
    }

    /**
     * @throws IllegalStateException si el método no estaba disponible.
     */
    public ExcessSeries series() {
        if (series == null) {
            throw new IllegalStateException("Escorrentía no disponible para " + method.getCode() + ": " + reason);
        }
        return series;
    }

    public Optional<ExcessSeries> toOptional() {
        return Optional.ofNullable(series);
    }

    /**
     * @return El motivo de la indisponibilidad, o {@code null} si la serie se calculó.
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return isAvailable()
                ? "ExcessOutcome[computed " + method.getCode() + "]"
                : "ExcessOutcome[unavailable " + method.getCode() + ": " + reason + "]";
    }
}
