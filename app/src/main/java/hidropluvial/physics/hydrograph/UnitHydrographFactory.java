package hidropluvial.physics.hydrograph;

import hidropluvial.domain.MissingParameterException;
import hidropluvial.domain.hydrograph.UnitHydrographMethod;
import hidropluvial.io.ReferenceCurveRegistry;
import hidropluvial.physics.i.IUnitHydrograph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Despachador de hidrogramas unitarios: un {@link UnitHydrographMethod} y sus parámetros
 * producen la implementación correspondiente.
 * <p>
 * El curvilíneo SCS necesita la tabla adimensional del registro de curvas; el resto no.
 */
public class UnitHydrographFactory {

    private final ReferenceCurveRegistry registry;

    public UnitHydrographFactory() {
        this(null);
    }

    public UnitHydrographFactory(ReferenceCurveRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws MissingParameterException si Snyder no recibe L o Lc.
     * @throws IllegalStateException     si se pide el curvilíneo sin registro de curvas.
     */
    public IUnitHydrograph create(UnitHydrographMethod method, UnitHydrographRequest request) {
        Objects.requireNonNull(method, "El método de hidrograma unitario no puede ser nulo.");
        Objects.requireNonNull(request, "La solicitud de hidrograma unitario no puede ser nula.");

        return switch (method) {
            case TRIANGULAR_X -> new TriangularUnitHydrograph(request.getXFactor());
            case SCS_TRIANGULAR -> new ScsTriangularUnitHydrograph();
            case SCS_CURVILINEAR -> {
                if (registry == null) {
                    throw new IllegalStateException("El hidrograma curvilíneo SCS requiere el registro de curvas de referencia");
                }
                yield new ScsCurvilinearUnitHydrograph(registry.scsDimensionlessUnitHydrograph(), request.getPeakRateFactor());
            }
            case GAMMA -> new GammaUnitHydrograph(request.getGammaShape());
            case CLARK -> new ClarkUnitHydrograph(request.getClarkStorageHr());
            case SNYDER -> {
                List<String> missing = new ArrayList<>();
                if (request.getLengthKm() == null) {
                    missing.add("length_km");
                }
                if (request.getCentroidLengthKm() == null) {
                    missing.add("lc_km");
                }
                if (!missing.isEmpty()) {
                    throw new MissingParameterException("Snyder", missing);
                }
                yield new SnyderUnitHydrograph(request.getLengthKm(), request.getCentroidLengthKm(),
                        request.getSnyderCt(), request.getSnyderCp());
            }
        };
    }
}
