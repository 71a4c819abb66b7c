package dtm.strata.core;

import dtm.strata.exceptions.ContainerDestroyedException;
import dtm.strata.exceptions.InvalidRegistrationException;
import dtm.strata.prototypes.AsyncFactory;
import dtm.strata.prototypes.AsyncFinalizer;
import dtm.strata.prototypes.Dependency;
import dtm.strata.prototypes.Factory;
import dtm.strata.prototypes.Finalizer;
import dtm.strata.prototypes.Tag;

/**
 * Interface para registro de dependências no contêiner.
 * <p>
 * Registrar novamente um tag substitui o registro anterior, desde que a instância
 * ainda não tenha sido criada neste contêiner; caso contrário é lançada
 * {@link InvalidRegistrationException}. Registrar em um contêiner destruído lança
 * {@link ContainerDestroyedException}.
 * <p>
 * Todos os métodos devolvem o próprio contêiner para encadeamento.
 */
public interface DependencyContainerRegistor {

    <T> DependencyContainer register(Dependency<T> dependency);

    <T> DependencyContainer register(Tag<T> tag, Factory<T> factory);

    <T> DependencyContainer register(Tag<T> tag, Factory<T> factory, Finalizer<T> finalizer);

    <T> DependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory);

    <T> DependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory, AsyncFinalizer<T> finalizer);
}
