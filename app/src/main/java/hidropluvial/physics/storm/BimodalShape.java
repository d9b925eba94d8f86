package hidropluvial.physics.storm;

import hidropluvial.config.AnalysisConfig;

/**
 * Forma de una tormenta de doble pico.
 *
 * @param peak1Position Posición relativa del primer pico en (0, 1).
 * @param peak2Position Posición relativa del segundo pico en (0, 1).
 * @param volumeSplit   Fracción de la lámina asignada al primer pico, en [0, 1].
 * @param peakWidth     Semiancho de cada pico como fracción de la duración (> 0).
 */
public record BimodalShape(double peak1Position, double peak2Position, double volumeSplit, double peakWidth) {

    public BimodalShape {
        if (peak1Position <= 0 || peak1Position >= 1 || peak2Position <= 0 || peak2Position >= 1) {
            throw new IllegalArgumentException("Las posiciones de los picos deben estar en (0, 1)");
        }
        if (volumeSplit < 0 || volumeSplit > 1) {
            throw new IllegalArgumentException("La fracción de volumen debe estar entre 0 y 1");
        }
        if (peakWidth <= 0) {
            throw new IllegalArgumentException("El ancho de pico debe ser > 0");
        }
    }

    public static BimodalShape defaults() {
        return new BimodalShape(0.25, 0.75, 0.5, 0.15);
    }

    public static BimodalShape fromConfig(AnalysisConfig config) {
        return new BimodalShape(config.getBimodalPeak1(), config.getBimodalPeak2(),
                config.getBimodalVolumeSplit(), config.getBimodalPeakWidth());
    }
}
