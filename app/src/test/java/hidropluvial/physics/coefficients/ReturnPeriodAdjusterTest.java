package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.CoverageItem;
import hidropluvial.domain.basin.OpaqueCoefficient;
import hidropluvial.domain.basin.RationalTable;
import hidropluvial.domain.basin.TableCoefficient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del ajuste de C por período de retorno, en sus dos caminos.
 */
class ReturnPeriodAdjusterTest {

    private static final List<CoverageItem> CHOW_ITEMS = List.of(
            CoverageItem.fromTable(10, 0.25, 2),  // Unifamiliar: 0.25 (Tr2) / 0.35 (Tr10)
            CoverageItem.fromTable(10, 0.70, 9)); // Pavimento asfáltico: 0.70 / 0.80

    @Test
    @DisplayName("Camino genérico: C escalado por la razón de factores promedio")
    void genericFactorPath() {
        assertEquals(0.5 * 1.33, ReturnPeriodAdjuster.adjustCForTr(0.5, 10), 1e-12);
        assertEquals(0.5 * 1.50 / 1.17, ReturnPeriodAdjuster.adjustCForTr(0.5, 25, 5), 1e-12);
    }

    @Test
    @DisplayName("Tr igual al base devuelve el mismo C")
    void sameReturnPeriodIsIdentity() {
        assertEquals(0.42, ReturnPeriodAdjuster.adjustCForTr(0.42, 2), 0.0);
    }

    @Test
    @DisplayName("Entre períodos publicados el factor se interpola linealmente")
    void factorIsInterpolated() {
        assertEquals(1.415, ReturnPeriodAdjuster.averageFactor(17.5), 1e-12);
        assertEquals(1.84, ReturnPeriodAdjuster.averageFactor(500), 0.0);
    }

    @Test
    @DisplayName("El C ajustado nunca supera 1.0")
    void adjustedCIsCapped() {
        assertEquals(1.0, ReturnPeriodAdjuster.adjustCForTr(0.9, 100), 0.0);
    }

    @Test
    @DisplayName("Camino exacto: cada cobertura se relee de la tabla de Chow")
    void exactChowPath() {
        // ARRANGE
        TableCoefficient coefficient = CoefficientWeighting.fromTable(RationalTable.CHOW, CHOW_ITEMS);
        assertTrue(coefficient.supportsExactReturnPeriod());

        // ACT
        double c10 = ReturnPeriodAdjuster.cForTr(coefficient, 10);

        // ASSERT
        assertEquals((10 * 0.35 + 10 * 0.80) / 20.0, c10, 1e-12);
        assertNotEquals(ReturnPeriodAdjuster.adjustCForTr(coefficient.value(), 10), c10, 1e-6);
    }

    @Test
    @DisplayName("Las coberturas sin índice conservan su valor en el camino exacto")
    void manualItemsKeepTheirValue() {
        List<CoverageItem> items = List.of(CoverageItem.fromTable(10, 0.25, 2), CoverageItem.manual(10, 0.5));

        double c = ReturnPeriodAdjuster.recalculateWeightedCForTr(items, 10, RationalTable.CHOW);

        assertEquals((0.35 + 0.5) / 2.0, c, 1e-12);
    }

    @Test
    @DisplayName("Un C opaco o de la tabla regional usa el camino genérico")
    void opaqueAndRegionalUseFactors() {
        assertEquals(0.55 * 1.33, ReturnPeriodAdjuster.cForTr(new OpaqueCoefficient(0.55), 10), 1e-12);

        TableCoefficient regional = CoefficientWeighting.fromTable(RationalTable.URUGUAY,
                List.of(CoverageItem.fromTable(5, 0.40, 4)));
        assertFalse(regional.supportsExactReturnPeriod());
        assertEquals(0.40 * 1.33, ReturnPeriodAdjuster.cForTr(regional, 10), 1e-12);
    }
}
