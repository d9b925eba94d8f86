package hidropluvial.physics.storm;

import java.util.Objects;

/**
 * Curva de masa de referencia: abscisa creciente (tiempo en horas o en % de la duración)
 * y ordenada acumulada no decreciente (fracción o % de la lámina total).
 *
 * @param x Abscisas, estrictamente crecientes.
 * @param y Ordenadas acumuladas, no decrecientes.
 */
public record CumulativeCurve(double[] x, double[] y) {

    public CumulativeCurve {
        Objects.requireNonNull(x, "Las abscisas de la curva no pueden ser nulas.");
        Objects.requireNonNull(y, "Las ordenadas de la curva no pueden ser nulas.");
        if (x.length != y.length || x.length < 2) {
            throw new IllegalArgumentException("La curva de referencia necesita al menos 2 puntos con igual número de abscisas y ordenadas");
        }
        for (int i = 1; i < x.length; i++) {
            if (x[i] <= x[i - 1]) {
                throw new IllegalArgumentException("Las abscisas de la curva deben ser crecientes");
            }
            if (y[i] < y[i - 1]) {
                throw new IllegalArgumentException("La curva de referencia debe ser acumulada (no decreciente)");
            }
        }
        x = x.clone();
        y = y.clone();
    }

    /**
     * Interpolación lineal; fuera del rango devuelve el extremo más cercano.
     */
    public double interpolate(double at) {
        if (at <= x[0]) {
            return y[0];
        }
        int last = x.length - 1;
        if (at >= x[last]) {
            return y[last];
        }
        int hi = 1;
        while (x[hi] < at) {
            hi++;
        }
        int lo = hi - 1;
        return y[lo] + (y[hi] - y[lo]) * (at - x[lo]) / (x[hi] - x[lo]);
    }

    /**
     * Copia con las abscisas multiplicadas por {@code factor} (p. ej. para llevar una curva
     * de 24 h a otra duración).
     */
    public CumulativeCurve scaleX(double factor) {
        double[] scaled = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scaled[i] = x[i] * factor;
        }
        return new CumulativeCurve(scaled, y);
    }

    public double lastX() {
        return x[x.length - 1];
    }

    public double lastY() {
        return y[y.length - 1];
    }
}
