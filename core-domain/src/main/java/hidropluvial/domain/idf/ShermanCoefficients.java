package hidropluvial.domain.idf;

import lombok.Builder;

/**
 * Coeficientes de la curva IDF tipo Sherman: {@code i = k·Tr^m / (t + c)^n} (t en min, i en mm/h).
 *
 * @param k Coeficiente de escala (> 0).
 * @param m Exponente del período de retorno, en (0, 1).
 * @param c Constante de tiempo en minutos, en [0, 60].
 * @param n Exponente de la duración, en (0, 2).
 */
@Builder
public record ShermanCoefficients(double k, double m, double c, double n) {

    public ShermanCoefficients {
        if (k <= 0) {
            throw new IllegalArgumentException("Coeficiente k debe ser > 0");
        }
        if (m <= 0 || m >= 1) {
            throw new IllegalArgumentException("Exponente m debe estar en (0, 1)");
        }
        if (c < 0 || c > 60) {
            throw new IllegalArgumentException("Constante c debe estar en [0, 60] min");
        }
        if (n <= 0 || n >= 2) {
            throw new IllegalArgumentException("Exponente n debe estar en (0, 2)");
        }
    }
}
