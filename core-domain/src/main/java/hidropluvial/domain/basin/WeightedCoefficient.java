package hidropluvial.domain.basin;

/**
 * Coeficiente de escorrentía C ponderado por área.
 * <p>
 * Existen dos variantes y la diferencia es una capacidad, no un detalle:
 * <ul>
 *     <li>{@link TableCoefficient}: conserva las coberturas y sus índices de tabla, por lo que el
 *     valor exacto para otro período de retorno puede volver a derivarse desde la tabla.</li>
 *     <li>{@link OpaqueCoefficient}: sólo se conoce el escalar; cualquier cambio de Tr debe
 *     pasar por el factor de ajuste genérico.</li>
 * </ul>
 */
public interface WeightedCoefficient {

    /**
     * Valor ponderado de C para el período de retorno base de la tabla (o el introducido).
     */
    double value();

    /**
     * @return {@code true} si el valor puede re-derivarse exactamente para otro Tr.
     */
    boolean supportsExactReturnPeriod();

    /**
     * Comprueba que la suma de áreas de las coberturas no exceda el área de la cuenca.
     *
     * @param basinAreaHa Área total de la cuenca en hectáreas.
     * @throws IllegalArgumentException si las coberturas suman más que la cuenca.
     */
    void validateAgainstBasin(double basinAreaHa);

    static WeightedCoefficient opaque(double value) {
        return new OpaqueCoefficient(value);
    }
}
