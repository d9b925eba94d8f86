package hidropluvial.domain.tc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resultado de un cálculo de tiempo de concentración.
 * <p>
 * Guarda los parámetros realmente usados para que el valor pueda volver a derivarse.
 * Nunca se modifica: un C distinto bajo Desbordes produce un {@code TcResult} nuevo.
 *
 * @param method     Método utilizado.
 * @param tcHr       Tiempo de concentración en horas.
 * @param parameters Parámetros empleados, en orden de inserción.
 */
public record TcResult(TcMethod method, double tcHr, Map<String, Object> parameters) {

    public TcResult {
        Objects.requireNonNull(method, "El método de Tc no puede ser nulo.");
        if (tcHr < 0 || Double.isNaN(tcHr)) {
            throw new IllegalArgumentException("Tc debe ser >= 0 (recibido " + tcHr + ")");
        }
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public double tcMin() {
        return tcHr * 60.0;
    }
}
