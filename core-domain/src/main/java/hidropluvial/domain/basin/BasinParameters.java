package hidropluvial.domain.basin;

import lombok.Builder;
import lombok.With;

/**
 * Descriptores de la cuenca que alimentan un análisis de crecida.
 * <p>
 * Es un objeto de valor inmutable propiedad del orquestador; el motor sólo lo lee.
 *
 * @param name              Nombre identificativo (opcional).
 * @param areaHa            Área de la cuenca en hectáreas.
 * @param slopePct          Pendiente media en porcentaje.
 * @param lengthM           Longitud del cauce principal en metros (opcional).
 * @param elevationDropM    Desnivel del cauce principal en metros (opcional, para California Culverts).
 * @param p310Mm            Precipitación de referencia P3,10 (3 h, Tr 10 años) en mm.
 * @param runoffCoefficient Coeficiente C ponderado (opcional; requerido por el método racional).
 * @param curveNumber       Curva Número ponderada en AMC II (opcional; requerida por SCS-CN).
 */
@Builder
@With
public record BasinParameters(
        String name,
        double areaHa,
        double slopePct,
        Double lengthM,
        Double elevationDropM,
        double p310Mm,
        WeightedCoefficient runoffCoefficient,
        Double curveNumber
) {

    public BasinParameters {
        if (areaHa <= 0) {
            throw new IllegalArgumentException("Área debe ser > 0");
        }
        if (slopePct <= 0) {
            throw new IllegalArgumentException("Pendiente debe ser > 0");
        }
        if (p310Mm <= 0) {
            throw new IllegalArgumentException("P3,10 debe ser > 0");
        }
        if (lengthM != null && lengthM <= 0) {
            throw new IllegalArgumentException("Longitud debe ser > 0");
        }
        if (elevationDropM != null && elevationDropM <= 0) {
            throw new IllegalArgumentException("Diferencia de elevación debe ser > 0");
        }
        if (curveNumber != null && (curveNumber < 30 || curveNumber > 100)) {
            throw new IllegalArgumentException("CN debe estar entre 30 y 100 (recibido " + curveNumber + ")");
        }
        if (runoffCoefficient != null) {
            runoffCoefficient.validateAgainstBasin(areaHa);
        }
    }

    public double areaKm2() {
        return areaHa / 100.0;
    }

    public double slope() {
        return slopePct / 100.0;
    }

    public boolean hasRunoffCoefficient() {
        return runoffCoefficient != null;
    }

    public boolean hasCurveNumber() {
        return curveNumber != null;
    }

    /**
     * Cuenca urbana pequeña de referencia (Montevideo) utilizada en pruebas y ejemplos.
     */
    public static BasinParameters getTestingBasin() {
        return BasinParameters.builder()
                .name("Cuenca de prueba")
                .areaHa(50.0)
                .slopePct(2.0)
                .lengthM(800.0)
                .elevationDropM(16.0)
                .p310Mm(78.0)
                .runoffCoefficient(WeightedCoefficient.opaque(0.55))
                .curveNumber(75.0)
                .build();
    }
}
