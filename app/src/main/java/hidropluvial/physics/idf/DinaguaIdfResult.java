package hidropluvial.physics.idf;

/**
 * Desglose de un cálculo DINAGUA.
 *
 * @param depthMm         Lámina acumulada P(d, Tr, A) (mm).
 * @param intensityMmHr   Intensidad media P/d (mm/h).
 * @param cd              Factor de duración.
 * @param ct              Factor de período de retorno.
 * @param ca              Factor de área.
 * @param p310Mm          P3,10 de entrada (mm).
 * @param returnPeriodYr  Período de retorno (años).
 * @param durationHr      Duración (h).
 * @param areaKm2         Área utilizada, o {@code null}.
 */
public record DinaguaIdfResult(
        double depthMm,
        double intensityMmHr,
        double cd,
        double ct,
        double ca,
        double p310Mm,
        double returnPeriodYr,
        double durationHr,
        Double areaKm2
) {
}
