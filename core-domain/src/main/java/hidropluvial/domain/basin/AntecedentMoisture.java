package hidropluvial.domain.basin;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Condición de humedad antecedente (AMC) utilizada para ajustar la Curva Número.
 */
@Getter
@RequiredArgsConstructor
public enum AntecedentMoisture {

    DRY("I"),
    AVERAGE("II"),
    WET("III");

    private final String code;

    private static final Map<String, AntecedentMoisture> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(amc -> amc.code, amc -> amc))
    );

    /**
     * Busca la condición por su número romano ("I", "II", "III").
     *
     * @throws IllegalArgumentException si el código no corresponde a ninguna condición.
     */
    public static AntecedentMoisture fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("La condición AMC no puede ser nula.");
        }
        AntecedentMoisture amc = BY_CODE.get(code.trim().toUpperCase());
        if (amc == null) {
            throw new IllegalArgumentException("Condición AMC desconocida: " + code + " (use I, II o III)");
        }
        return amc;
    }
}
