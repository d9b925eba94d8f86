package hidropluvial.domain.basin;

/**
 * Coeficiente C conocido sólo como escalar (introducido a mano o heredado de otro estudio).
 *
 * @param value C en el rango (0, 1].
 */
public record OpaqueCoefficient(double value) implements WeightedCoefficient {

    public OpaqueCoefficient {
        if (value <= 0 || value > 1) {
            throw new IllegalArgumentException("Coeficiente C debe estar entre 0 y 1 (recibido " + value + ")");
        }
    }

    @Override
    public boolean supportsExactReturnPeriod() {
        return false;
    }

    @Override
    public void validateAgainstBasin(double basinAreaHa) {
        // Sin coberturas no hay áreas que comprobar.
    }
}
