package hidropluvial.physics.i;

import hidropluvial.domain.hydrograph.UnitHydrograph;

/**
 * Hidrograma unitario sintético: respuesta de la cuenca a 1 mm de lluvia efectiva.
 */
public interface IUnitHydrograph {

    /**
     * @param areaHa Área de la cuenca (ha).
     * @param tcHr   Tiempo de concentración (h).
     * @param dtHr   Paso del exceso de lluvia, que es también el paso de muestreo (h).
     */
    UnitHydrograph build(double areaHa, double tcHr, double dtHr);

    String name();
}
