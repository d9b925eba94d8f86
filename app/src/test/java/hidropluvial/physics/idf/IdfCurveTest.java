package hidropluvial.physics.idf;

import hidropluvial.domain.idf.ShermanCoefficients;
import hidropluvial.physics.i.IIdfCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contrato común de las curvas IDF paramétricas y de la tabla estándar.
 */
class IdfCurveTest {

    private static final ShermanCoefficients SHERMAN = new ShermanCoefficients(1200.0, 0.18, 10.0, 0.75);

    private final List<IIdfCurve> curves = List.of(
            new ShermanIdf(SHERMAN),
            new BernardIdf(450.0, 0.2, 0.6),
            new KoutsoyiannisIdf(800.0, 250.0, 8.0, 0.8),
            new DinaguaIdf(78.0)
    );

    @Test
    @DisplayName("Sherman: i = k·Tr^m / (t + c)^n")
    void shermanFormula() {
        double expected = 1200.0 * Math.pow(25, 0.18) / Math.pow(30 + 10.0, 0.75);
        assertEquals(expected, new ShermanIdf(SHERMAN).intensity(30, 25), 1e-9);
    }

    @Test
    @DisplayName("Todas las curvas: depth == intensity·d/60, la intensidad decrece con d y crece con Tr")
    void curvesShareContract() {
        for (IIdfCurve curve : curves) {
            assertEquals(curve.intensity(45, 10) * 45 / 60.0, curve.depth(45, 10), 1e-9, curve.name());
            assertThat(curve.intensity(15, 10)).as(curve.name()).isGreaterThan(curve.intensity(120, 10));
            assertThat(curve.intensity(60, 50)).as(curve.name()).isGreaterThan(curve.intensity(60, 5));
        }
    }

    @Test
    @DisplayName("Duración o período de retorno no positivos deben lanzar excepción")
    void invalidArgumentsThrow() {
        for (IIdfCurve curve : curves) {
            assertThrows(IllegalArgumentException.class, () -> curve.intensity(0, 10), curve.name());
            assertThrows(IllegalArgumentException.class, () -> curve.intensity(30, 0), curve.name());
        }
    }

    @Test
    @DisplayName("Coeficientes Sherman fuera de rango deben rechazarse")
    void shermanCoefficientsValidate() {
        assertThrows(IllegalArgumentException.class, () -> new ShermanCoefficients(0, 0.2, 10, 0.7));
        assertThrows(IllegalArgumentException.class, () -> new ShermanCoefficients(1000, 1.2, 10, 0.7));
        assertThrows(IllegalArgumentException.class, () -> new ShermanCoefficients(1000, 0.2, 75, 0.7));
        assertThrows(IllegalArgumentException.class, () -> new ShermanCoefficients(1000, 0.2, 10, 2.0));
    }

    @Test
    @DisplayName("La tabla estándar cubre 14 duraciones × 6 períodos de retorno")
    void standardTableShape() {
        IdfTable table = IdfTable.of(new ShermanIdf(SHERMAN));

        assertEquals("sherman", table.method());
        assertEquals(14, table.intensityMmHr().length);
        assertEquals(6, table.intensityMmHr()[0].length);
        assertEquals(table.intensityMmHr()[6][2] * 60 / 60.0, table.depthMm()[6][2], 1e-9);
    }

    @Test
    @DisplayName("Departamentos: búsqueda insensible a mayúsculas")
    void departmentLookup() {
        assertEquals(78.0, UruguayDepartment.fromName("Montevideo").getP310Mm());
        assertEquals(UruguayDepartment.SAN_JOSE, UruguayDepartment.fromName("San Jose"));
        assertThrows(IllegalArgumentException.class, () -> UruguayDepartment.fromName("Buenos Aires"));
    }
}
