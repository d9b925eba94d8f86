package hidropluvial.physics.coefficients;

import hidropluvial.domain.basin.RationalTable;
import hidropluvial.physics.coefficients.entry.ChowEntry;
import hidropluvial.physics.coefficients.entry.CoefficientEntry;
import hidropluvial.physics.coefficients.entry.FhwaEntry;
import hidropluvial.physics.coefficients.entry.RegionalEntry;

import java.util.List;

/**
 * Tablas publicadas de coeficiente de escorrentía C para el método racional.
 * <p>
 * El orden de las filas es estable: los índices que guardan las coberturas apuntan a él.
 */
public final class RationalCoefficientTables {

    public static final List<ChowEntry> CHOW = List.of(
            // Comercial
            new ChowEntry("Comercial", "Centro comercial denso", 0.75, 0.80, 0.85, 0.88, 0.90, 0.95),
            new ChowEntry("Comercial", "Vecindario comercial", 0.50, 0.55, 0.60, 0.65, 0.70, 0.75),
            // Residencial
            new ChowEntry("Residencial", "Unifamiliar", 0.25, 0.30, 0.35, 0.40, 0.45, 0.50),
            new ChowEntry("Residencial", "Multifamiliar separado", 0.35, 0.40, 0.45, 0.50, 0.55, 0.60),
            new ChowEntry("Residencial", "Multifamiliar adosado", 0.45, 0.50, 0.55, 0.60, 0.65, 0.70),
            new ChowEntry("Residencial", "Suburbano", 0.20, 0.25, 0.30, 0.35, 0.40, 0.45),
            new ChowEntry("Residencial", "Apartamentos", 0.50, 0.55, 0.60, 0.65, 0.70, 0.75),
            // Industrial
            new ChowEntry("Industrial", "Liviana", 0.50, 0.55, 0.60, 0.65, 0.70, 0.80),
            new ChowEntry("Industrial", "Pesada", 0.60, 0.65, 0.70, 0.75, 0.80, 0.85),
            // Superficies
            new ChowEntry("Superficies", "Pavimento asfaltico", 0.70, 0.75, 0.80, 0.85, 0.90, 0.95),
            new ChowEntry("Superficies", "Pavimento concreto", 0.75, 0.80, 0.85, 0.90, 0.92, 0.95),
            new ChowEntry("Superficies", "Techos", 0.75, 0.80, 0.85, 0.90, 0.92, 0.95),
            new ChowEntry("Superficies", "Adoquin con juntas", 0.50, 0.55, 0.60, 0.65, 0.70, 0.75),
            new ChowEntry("Superficies", "Grava/Macadam", 0.25, 0.30, 0.35, 0.40, 0.45, 0.50),
            // Césped
            new ChowEntry("Cesped arenoso", "Plano (<2%)", 0.05, 0.08, 0.10, 0.13, 0.15, 0.18),
            new ChowEntry("Cesped arenoso", "Medio (2-7%)", 0.10, 0.13, 0.16, 0.19, 0.22, 0.25),
            new ChowEntry("Cesped arenoso", "Fuerte (>7%)", 0.15, 0.18, 0.21, 0.25, 0.29, 0.32),
            new ChowEntry("Cesped arcilloso", "Plano (<2%)", 0.13, 0.16, 0.19, 0.23, 0.26, 0.29),
            new ChowEntry("Cesped arcilloso", "Medio (2-7%)", 0.18, 0.21, 0.25, 0.29, 0.34, 0.37),
            new ChowEntry("Cesped arcilloso", "Fuerte (>7%)", 0.25, 0.29, 0.34, 0.40, 0.44, 0.50)
    );

    public static final List<FhwaEntry> FHWA = List.of(
            new FhwaEntry("Comercial", "Centro comercial/negocios", 0.85),
            new FhwaEntry("Comercial", "Vecindario comercial", 0.60),
            new FhwaEntry("Industrial", "Industria liviana", 0.65),
            new FhwaEntry("Industrial", "Industria pesada", 0.75),
            new FhwaEntry("Residencial", "Unifamiliar (lotes >1000 m2)", 0.40),
            new FhwaEntry("Residencial", "Unifamiliar (lotes 500-1000 m2)", 0.50),
            new FhwaEntry("Residencial", "Unifamiliar (lotes <500 m2)", 0.60),
            new FhwaEntry("Residencial", "Multifamiliar/Apartamentos", 0.70),
            new FhwaEntry("Residencial", "Condominios/Townhouse", 0.60),
            new FhwaEntry("Superficies", "Asfalto/Concreto", 0.85),
            new FhwaEntry("Superficies", "Adoquin/Ladrillo", 0.78),
            new FhwaEntry("Superficies", "Techos", 0.85),
            new FhwaEntry("Superficies", "Grava/Ripio", 0.32),
            new FhwaEntry("Cesped arenoso", "Pendiente plana <2%", 0.08),
            new FhwaEntry("Cesped arenoso", "Pendiente media 2-7%", 0.12),
            new FhwaEntry("Cesped arenoso", "Pendiente alta >7%", 0.18),
            new FhwaEntry("Cesped arcilloso", "Pendiente plana <2%", 0.15),
            new FhwaEntry("Cesped arcilloso", "Pendiente media 2-7%", 0.20),
            new FhwaEntry("Cesped arcilloso", "Pendiente alta >7%", 0.28)
    );

    public static final List<RegionalEntry> URUGUAY = List.of(
            new RegionalEntry("Urbano", "Centro ciudad (muy denso)", 0.70, 0.90, 0.80),
            new RegionalEntry("Urbano", "Comercial/Mixto", 0.60, 0.80, 0.70),
            new RegionalEntry("Urbano", "Residencial alta densidad", 0.50, 0.70, 0.60),
            new RegionalEntry("Urbano", "Residencial media densidad", 0.40, 0.60, 0.50),
            new RegionalEntry("Urbano", "Residencial baja densidad", 0.30, 0.50, 0.40),
            new RegionalEntry("Urbano", "Industrial", 0.60, 0.85, 0.72),
            new RegionalEntry("Superficies", "Calles pavimentadas", 0.80, 0.95, 0.88),
            new RegionalEntry("Superficies", "Veredas/Patios", 0.75, 0.90, 0.82),
            new RegionalEntry("Superficies", "Techos", 0.80, 0.95, 0.88),
            new RegionalEntry("Superficies", "Estacionamientos", 0.75, 0.90, 0.82),
            new RegionalEntry("Superficies", "Tierra/Tosca compactada", 0.30, 0.50, 0.40),
            new RegionalEntry("Areas verdes", "Plazas/Parques", 0.10, 0.25, 0.18),
            new RegionalEntry("Areas verdes", "Jardines/Cesped", 0.08, 0.18, 0.12),
            new RegionalEntry("Areas verdes", "Baldios con vegetacion", 0.15, 0.35, 0.25)
    );

    private RationalCoefficientTables() {
        throw new IllegalStateException("Prohibido construir esta clase utilidad");
    }

    public static List<? extends CoefficientEntry> table(RationalTable table) {
        return switch (table) {
            case CHOW -> CHOW;
            case FHWA -> FHWA;
            case URUGUAY -> URUGUAY;
        };
    }

    /**
     * C de una fila de la tabla para el período de retorno dado. La tabla regional
     * devuelve siempre su valor recomendado.
     *
     * @throws IllegalArgumentException si el índice no existe en la tabla.
     */
    public static double cForReturnPeriod(RationalTable table, int index, double returnPeriodYr) {
        List<? extends CoefficientEntry> entries = table(table);
        if (index < 0 || index >= entries.size()) {
            throw new IllegalArgumentException("Índice " + index + " fuera de rango para tabla " + table.getCode());
        }
        return entries.get(index).cForReturnPeriod(returnPeriodYr);
    }
}
