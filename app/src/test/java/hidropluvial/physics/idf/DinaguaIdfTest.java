package hidropluvial.physics.idf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas de la IDF regional DINAGUA.
 */
class DinaguaIdfTest {

    private static final double P310 = 83.0;

    @Test
    @DisplayName("Ct(10) y Cd(3 h) valen 1: P(3 h, Tr 10) reproduce P3,10")
    void referenceStormReproducesP310() {
        assertEquals(1.0, DinaguaIdf.returnPeriodFactor(10), 0.01);
        assertEquals(1.0, DinaguaIdf.durationFactor(3.0), 0.01);
        assertEquals(P310, DinaguaIdf.depthMm(P310, 10, 3.0, null), P310 * 0.01);
    }

    @Test
    @DisplayName("Ct crece con el período de retorno")
    void returnPeriodFactorIncreasesWithTr() {
        assertThat(DinaguaIdf.returnPeriodFactor(10))
                .isLessThan(DinaguaIdf.returnPeriodFactor(50))
                .isLessThan(DinaguaIdf.returnPeriodFactor(100));
        assertEquals(1.44, DinaguaIdf.returnPeriodFactor(100), 0.015);
    }

    @Test
    @DisplayName("Factor de área: 1 hasta 1 km², decreciente con el área y nunca mayor que 1")
    void areaFactorIsMonotone() {
        assertEquals(1.0, DinaguaIdf.areaFactor(0.5, 1.0));
        assertEquals(1.0, DinaguaIdf.areaFactor(1.0, 1.0));

        double ca10 = DinaguaIdf.areaFactor(10, 2.0);
        double ca50 = DinaguaIdf.areaFactor(50, 2.0);
        double ca100 = DinaguaIdf.areaFactor(100, 2.0);
        assertThat(ca10).isGreaterThan(ca50);
        assertThat(ca50).isGreaterThan(ca100);
        assertThat(ca10).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("La lámina crece con la duración y la intensidad decrece")
    void depthGrowsIntensityDecays() {
        DinaguaIdf idf = new DinaguaIdf(P310);

        assertThat(idf.depth(60, 25)).isLessThan(idf.depth(180, 25)).isLessThan(idf.depth(360, 25));
        assertThat(idf.intensity(60, 25)).isGreaterThan(idf.intensity(180, 25)).isGreaterThan(idf.intensity(360, 25));
    }

    @Test
    @DisplayName("depth == intensity · duración / 60")
    void depthAndIntensityAreConsistent() {
        DinaguaIdf idf = new DinaguaIdf(P310, 5.0);
        double durationMin = 90;

        assertEquals(idf.intensity(durationMin, 25) * durationMin / 60.0, idf.depth(durationMin, 25), 1e-9);
    }

    @Test
    @DisplayName("El resultado detallado expone los factores usados")
    void calculateExposesFactors() {
        DinaguaIdfResult result = DinaguaIdf.calculate(P310, 25, 6.0, 20.0);

        assertEquals(result.depthMm() / 6.0, result.intensityMmHr(), 1e-9);
        assertEquals(P310 * result.cd() * result.ct() * result.ca(), result.depthMm(), 1e-9);
        assertThat(result.ca()).isLessThan(1.0);
    }

    @Test
    @DisplayName("Duración no positiva o Tr < 2 deben lanzar excepción")
    void invalidArgumentsThrow() {
        assertThrows(IllegalArgumentException.class, () -> DinaguaIdf.depthMm(P310, 10, 0, null));
        assertThrows(IllegalArgumentException.class, () -> DinaguaIdf.depthMm(P310, 1.5, 2, null));
        assertThrows(IllegalArgumentException.class, () -> new DinaguaIdf(P310).intensity(-5, 10));
    }
}
