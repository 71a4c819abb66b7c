package dtm.strata.prototypes;

import dtm.strata.core.Layer;

/**
 * Cria layers parametrizados, por exemplo a partir de variáveis de ambiente
 * já carregadas, mantendo o mesmo manifesto para qualquer parâmetro.
 *
 * @param <P> tipo do parâmetro
 */
@FunctionalInterface
public interface LayerFactory<P> {
    Layer create(P params);
}
