package dtm.strata.prototypes;

import dtm.strata.core.DependencyContainer;

/**
 * Função de aplicação de um layer: recebe um contêiner que satisfaz os requisitos
 * do layer e devolve um contêiner que, adicionalmente, fornece os tags declarados.
 */
@FunctionalInterface
public interface LayerFunction {
    DependencyContainer apply(DependencyContainer container);
}
