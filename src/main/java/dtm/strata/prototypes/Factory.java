package dtm.strata.prototypes;

import dtm.strata.core.DependencyContainerGetter;

/**
 * Função síncrona que cria a instância de um tag.
 * <p>
 * As dependências do serviço são resolvidas através do {@code container} recebido;
 * cada chamada a {@code get} feita aqui é uma aresta do grafo de dependências.
 *
 * @param <T> tipo da instância criada
 */
@FunctionalInterface
public interface Factory<T> {
    T create(DependencyContainerGetter container) throws Exception;
}
