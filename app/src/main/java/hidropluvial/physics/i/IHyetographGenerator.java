package hidropluvial.physics.i;

import hidropluvial.domain.storm.HyetographResult;
import hidropluvial.domain.storm.StormType;
import hidropluvial.physics.storm.StormRequest;

/**
 * Generador de hietogramas de diseño por código de tormenta.
 */
public interface IHyetographGenerator {

    HyetographResult generate(StormType type, StormRequest request);
}
