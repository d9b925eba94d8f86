package hidropluvial.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import hidropluvial.domain.storm.StormType;
import hidropluvial.physics.hydrograph.DimensionlessUnitHydrograph;
import hidropluvial.physics.storm.CumulativeCurve;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Curvas de referencia leídas de los JSON incluidos en el jar: masas SCS 24 h y Huff,
 * e hidrograma unitario adimensional SCS.
 * <p>
 * Se construye una vez y se pasa por referencia a los generadores de hietogramas.
 * Es inmutable y Thread-Safe.
 */
@Slf4j
public final class ReferenceCurveRegistry {

    public static final String SCS_RESOURCE = "/data/scs_distributions.json";
    public static final String HUFF_RESOURCE = "/data/huff_curves.json";
    public static final String UNIT_HYDROGRAPH_RESOURCE = "/data/unit_hydrographs.json";

    private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final Map<String, CumulativeCurve> scsCurves;
    private final Map<String, CumulativeCurve> huffCurves;
    private final DimensionlessUnitHydrograph scsUnitHydrograph;

    // Formas del JSON.
    record ScsJson(@JsonProperty("time_hr") double[] timeHr, @JsonProperty("ratio") double[] ratio) {
    }

    record HuffJson(@JsonProperty("time_pct") double[] timePct, @JsonProperty("rain_pct") double[] rainPct) {
    }

    record UnitHydrographJson(@JsonProperty("t_Tp") double[] timeRatio, @JsonProperty("q_qp") double[] flowRatio) {
    }

    private ReferenceCurveRegistry(Map<String, CumulativeCurve> scsCurves, Map<String, CumulativeCurve> huffCurves,
                                   DimensionlessUnitHydrograph scsUnitHydrograph) {
        this.scsCurves = Collections.unmodifiableMap(scsCurves);
        this.huffCurves = Collections.unmodifiableMap(huffCurves);
        this.scsUnitHydrograph = scsUnitHydrograph;
    }

    /**
     * Carga las curvas incluidas en el classpath.
     *
     * @throws UncheckedIOException si algún recurso falta o no puede leerse.
     */
    public static ReferenceCurveRegistry fromClasspath() {
        try (InputStream scs = open(SCS_RESOURCE); InputStream huff = open(HUFF_RESOURCE);
             InputStream unitHydrographs = open(UNIT_HYDROGRAPH_RESOURCE)) {
            return load(scs, huff, unitHydrographs);
        } catch (IOException e) {
            log.error("No se pudieron cargar las curvas de referencia del classpath", e);
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Carga sólo las curvas de masa; el hidrograma unitario adimensional queda sin cargar.
     */
    public static ReferenceCurveRegistry load(InputStream scsJson, InputStream huffJson) throws IOException {
        return load(scsJson, huffJson, null);
    }

    /**
     * Carga las curvas desde flujos JSON con el formato de los recursos incluidos.
     *
     * @param unitHydrographJson Tabla de hidrogramas unitarios adimensionales, o {@code null}.
     */
    public static ReferenceCurveRegistry load(InputStream scsJson, InputStream huffJson,
                                              InputStream unitHydrographJson) throws IOException {
        Objects.requireNonNull(scsJson, "El flujo de distribuciones SCS no puede ser nulo.");
        Objects.requireNonNull(huffJson, "El flujo de curvas Huff no puede ser nulo.");

        Map<String, ScsJson> scsRaw = objectMapper.readValue(scsJson, new TypeReference<LinkedHashMap<String, ScsJson>>() {});
        Map<String, Map<String, HuffJson>> huffRaw = objectMapper.readValue(huffJson,
                new TypeReference<Map<String, Map<String, HuffJson>>>() {});

        Map<String, CumulativeCurve> scs = new LinkedHashMap<>();
        scsRaw.forEach((key, value) -> scs.put(key, new CumulativeCurve(value.timeHr(), value.ratio())));

        Map<String, CumulativeCurve> huff = new LinkedHashMap<>();
        huffRaw.forEach((quartile, byProbability) -> byProbability.forEach((probability, value) ->
                huff.put(quartile + "/" + probability, new CumulativeCurve(value.timePct(), value.rainPct()))));

        DimensionlessUnitHydrograph scsUnit = null;
        if (unitHydrographJson != null) {
            Map<String, UnitHydrographJson> unitRaw = objectMapper.readValue(unitHydrographJson,
                    new TypeReference<Map<String, UnitHydrographJson>>() {});
            UnitHydrographJson curvilinear = unitRaw.get("scs_curvilinear");
            if (curvilinear == null) {
                throw new IOException("Falta el hidrograma adimensional 'scs_curvilinear'");
            }
            scsUnit = new DimensionlessUnitHydrograph(curvilinear.timeRatio(), curvilinear.flowRatio());
        }

        log.info("Curvas de referencia cargadas: {} SCS, {} Huff, HU adimensional {}", scs.size(), huff.size(),
                scsUnit != null ? "sí" : "no");
        return new ReferenceCurveRegistry(scs, huff, scsUnit);
    }

    /**
     * Curva SCS adimensional (tiempo en horas sobre 24 h, fracción acumulada).
     *
     * @throws IllegalArgumentException si el tipo no es SCS o la curva no está cargada.
     */
    public CumulativeCurve scsCurve(StormType type) {
        if (type == null || !type.isScs()) {
            throw new IllegalArgumentException("Tipo de tormenta inválido: " + type);
        }
        String key = switch (type) {
            case SCS_I -> "scs_type_i";
            case SCS_IA -> "scs_type_ia";
            case SCS_II -> "scs_type_ii";
            default -> "scs_type_iii";
        };
        CumulativeCurve curve = scsCurves.get(key);
        if (curve == null) {
            throw new IllegalArgumentException("Distribución SCS '" + key + "' no disponible");
        }
        return curve;
    }

    /**
     * Curva Huff (tiempo en %, lluvia acumulada en %).
     *
     * @param quartile    Cuartil 1-4.
     * @param probability Nivel de probabilidad: 10, 50 o 90.
     */
    public CumulativeCurve huffCurve(int quartile, int probability) {
        if (quartile < 1 || quartile > 4) {
            throw new IllegalArgumentException("Cuartil debe ser 1, 2, 3 o 4");
        }
        if (probability != 10 && probability != 50 && probability != 90) {
            throw new IllegalArgumentException("Probabilidad debe ser 10, 50 o 90");
        }
        String key = "huff_q" + quartile + "/probability_" + probability;
        CumulativeCurve curve = huffCurves.get(key);
        if (curve == null) {
            throw new IllegalArgumentException("Curva Huff '" + key + "' no disponible");
        }
        return curve;
    }

    /**
     * Hidrograma unitario adimensional SCS ({@code q/qp} frente a {@code t/Tp}).
     *
     * @throws IllegalStateException si el registro se cargó sin la tabla de hidrogramas unitarios.
     */
    public DimensionlessUnitHydrograph scsDimensionlessUnitHydrograph() {
        if (scsUnitHydrograph == null) {
            throw new IllegalStateException("Hidrograma unitario adimensional SCS no disponible");
        }
        return scsUnitHydrograph;
    }

    private static InputStream open(String resource) throws IOException {
        InputStream stream = ReferenceCurveRegistry.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new IOException("Recurso no encontrado en el classpath: " + resource);
        }
        return stream;
    }
}
