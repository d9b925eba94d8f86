package hidropluvial.physics.i;

import hidropluvial.domain.tc.TcMethod;
import hidropluvial.domain.tc.TcParameters;
import hidropluvial.domain.tc.TcResult;

/**
 * Estimador de tiempo de concentración por método.
 */
public interface ITcEstimator {

    /**
     * @throws hidropluvial.domain.MissingParameterException si faltan parámetros que el método necesita.
     * @throws IllegalArgumentException si algún parámetro está fuera de rango.
     */
    TcResult estimate(TcMethod method, TcParameters parameters);
}
