package hidropluvial.physics.idf;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Valores orientativos de P3,10 (mm) por departamento. Para proyectos debe leerse el
 * valor exacto del mapa de isoyetas de DINAGUA.
 */
@Getter
@RequiredArgsConstructor
public enum UruguayDepartment {

    MONTEVIDEO("montevideo", 78),
    CANELONES("canelones", 75),
    MALDONADO("maldonado", 76),
    ROCHA("rocha", 77),
    COLONIA("colonia", 73),
    SAN_JOSE("san_jose", 74),
    FLORIDA("florida", 76),
    LAVALLEJA("lavalleja", 78),
    TREINTA_Y_TRES("treinta_y_tres", 80),
    CERRO_LARGO("cerro_largo", 82),
    RIVERA("rivera", 84),
    TACUAREMBO("tacuarembo", 82),
    DURAZNO("durazno", 78),
    FLORES("flores", 75),
    SORIANO("soriano", 74),
    RIO_NEGRO("rio_negro", 76),
    PAYSANDU("paysandu", 79),
    SALTO("salto", 81),
    ARTIGAS("artigas", 83);

    private final String code;
    private final double p310Mm;

    private static final Map<String, UruguayDepartment> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(department -> department.code, department -> department))
    );

    /**
     * Acepta el nombre en minúsculas o mayúsculas, con espacios o guiones bajos (sin tildes).
     *
     * @throws IllegalArgumentException listando los departamentos disponibles.
     */
    public static UruguayDepartment fromName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase().replace(' ', '_');
        UruguayDepartment department = BY_CODE.get(key);
        if (department == null) {
            String available = Arrays.stream(values())
                    .map(UruguayDepartment::getCode)
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Departamento '" + name + "' no encontrado. Disponibles: " + available);
        }
        return department;
    }
}
