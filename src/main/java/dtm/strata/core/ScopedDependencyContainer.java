package dtm.strata.core;

import dtm.strata.prototypes.AsyncFactory;
import dtm.strata.prototypes.AsyncFinalizer;
import dtm.strata.prototypes.Dependency;
import dtm.strata.prototypes.Factory;
import dtm.strata.prototypes.Finalizer;
import dtm.strata.prototypes.Tag;

import java.util.Optional;

/**
 * Contêiner pertencente a uma hierarquia de escopos (por exemplo "runtime" e "request").
 * <p>
 * A resolução verifica primeiro o registro do próprio escopo e, só se ele não existir,
 * delega ao escopo pai. Um registro no filho sobrepõe, tag a tag, o registro do pai.
 * Uma instância é sempre criada no escopo que a declarou e compartilhada com todos os
 * descendentes que delegam até ela.
 * <p>
 * O destroy de um escopo destrói antes todos os filhos ainda vivos.
 */
public interface ScopedDependencyContainer extends DependencyContainer {

    String getScope();

    Optional<ScopedDependencyContainer> getParent();

    /**
     * Cria um escopo filho deste contêiner.
     *
     * @param scope rótulo informativo do novo escopo
     * @return o escopo filho, sem nenhum registro próprio
     */
    ScopedDependencyContainer child(String scope);

    @Override
    <T> ScopedDependencyContainer register(Dependency<T> dependency);

    @Override
    <T> ScopedDependencyContainer register(Tag<T> tag, Factory<T> factory);

    @Override
    <T> ScopedDependencyContainer register(Tag<T> tag, Factory<T> factory, Finalizer<T> finalizer);

    @Override
    <T> ScopedDependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory);

    @Override
    <T> ScopedDependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory, AsyncFinalizer<T> finalizer);

    @Override
    ScopedDependencyContainer merge(DependencyContainer other);
}
