package dtm.strata.core;

import dtm.strata.exceptions.UnsatisfiedLayerException;
import dtm.strata.prototypes.Tag;

import java.util.List;
import java.util.Set;

/**
 * Descrição imutável e reutilizável de um conjunto de registros.
 * <p>
 * Um layer declara os tags que exige ({@link #getRequires()}) e os tags que fornece
 * ({@link #getProvides()}), e sabe aplicar a si mesmo em um contêiner.
 * Compor layers cria um novo layer, sem alterar os operandos.
 */
public interface Layer {

    Set<Tag<?>> getRequires();

    Set<Tag<?>> getProvides();

    String getName();

    /**
     * Aplica os registros do layer no contêiner.
     *
     * @throws UnsatisfiedLayerException se algum tag exigido não puder ser resolvido pelo contêiner,
     * ou se algum tag declarado como fornecido não tiver sido registrado
     */
    DependencyContainer apply(DependencyContainer container);

    /**
     * Sequenciamento: aplica este layer e, em seguida, o {@code target}.
     * Os requisitos do {@code target} fornecidos por este layer deixam de ser requisitos do resultado.
     */
    Layer to(Layer target);

    /**
     * Mesmo que {@code provider.to(this)}.
     */
    default Layer using(Layer provider){
        return provider.to(this);
    }

    /**
     * União paralela: os requisitos e os tags fornecidos são a união dos dois layers.
     */
    Layer and(Layer other);

    /**
     * Verifica estaticamente o manifesto dos serviços fornecidos pelo layer e devolve
     * os tags agrupados por profundidade no grafo de dependências.
     */
    List<Set<Tag<?>>> verify();

    default boolean isComplete(){
        return getRequires().isEmpty();
    }
}
