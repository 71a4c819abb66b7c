package dtm.strata.core;

import dtm.strata.exceptions.ContainerDestroyedException;
import dtm.strata.exceptions.DependencyFinalizationException;
import dtm.strata.prototypes.Dependency;
import dtm.strata.prototypes.Tag;
import dtm.strata.utils.FutureUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Interface principal para um contêiner de dependências.
 * <p>
 * Define operações para registrar, obter e destruir dependências identificadas por {@link Tag}.
 * <p>
 * Estende as interfaces:
 * <ul>
 *   <li>{@link DependencyContainerGetter} - para obtenção de dependências;</li>
 *   <li>{@link DependencyContainerRegistor} - para registro de dependências;</li>
 *   <li>{@link DependencyContainerConfigurator} - para configuração do contêiner.</li>
 * </ul>
 * O contêiner é {@link AutoCloseable}: {@link #close()} equivale a {@link #destroy()},
 * o que permite destruir um escopo de trabalho com try-with-resources.
 */
public interface DependencyContainer extends
        DependencyContainerGetter,
        DependencyContainerRegistor,
        DependencyContainerConfigurator,
        AutoCloseable
{
    /**
     * Executa os finalizers de todas as instâncias criadas, de forma concorrente,
     * e marca o contêiner como destruído. Todas as falhas são reunidas em uma única
     * {@link DependencyFinalizationException}, entregue somente depois que todos
     * os finalizers foram executados. Chamadas repetidas não fazem nada.
     */
    CompletableFuture<Void> destroyAsync();

    default void destroy(){
        FutureUtils.await(destroyAsync());
    }

    @Override
    default void close() {
        destroy();
    }

    boolean isDestroyed();

    /**
     * Cria um novo contêiner com a união dos registros dos dois contêineres.
     * Em caso de colisão prevalece o registro deste contêiner. Instâncias não são copiadas.
     *
     * @throws ContainerDestroyedException se algum dos contêineres já foi destruído
     */
    DependencyContainer merge(DependencyContainer other);

    /**
     * Retorna os registros deste contêiner, na ordem em que foram feitos.
     */
    List<Dependency<?>> getRegisteredDependencies();

    List<Tag<?>> getRegisteredTags();
}
