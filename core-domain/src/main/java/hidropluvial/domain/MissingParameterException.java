package hidropluvial.domain;

import lombok.Getter;

import java.util.List;

/**
 * Error de despacho: un método reconocido fue invocado sin el subconjunto de
 * parámetros que necesita.
 * <p>
 * El mensaje sigue el formato "{@code <Método> requiere a, b y c}" para que el
 * orquestador pueda mostrarlo tal cual al usuario.
 */
@Getter
public class MissingParameterException extends IllegalArgumentException {

    private final String method;
    private final List<String> missingParameters;

    public MissingParameterException(String method, List<String> missingParameters) {
        super(buildMessage(method, missingParameters));
        this.method = method;
        this.missingParameters = List.copyOf(missingParameters);
    }

    private static String buildMessage(String method, List<String> missing) {
        if (missing.isEmpty()) {
            return method + " requiere parámetros adicionales";
        }
        if (missing.size() == 1) {
            return method + " requiere " + missing.get(0);
        }
        String head = String.join(", ", missing.subList(0, missing.size() - 1));
        return method + " requiere " + head + " y " + missing.get(missing.size() - 1);
    }
}
