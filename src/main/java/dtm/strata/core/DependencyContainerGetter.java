package dtm.strata.core;

import dtm.strata.exceptions.CircularDependencyException;
import dtm.strata.exceptions.ContainerDestroyedException;
import dtm.strata.exceptions.DependencyContainerException;
import dtm.strata.exceptions.DependencyCreationException;
import dtm.strata.exceptions.UnknownDependencyException;
import dtm.strata.prototypes.Tag;
import dtm.strata.utils.FutureUtils;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Interface responsável por fornecer acesso às dependências registradas no contêiner.
 * <p>
 * É também a visão do contêiner recebida pelas factories: toda dependência de um serviço
 * é obtida por aqui, e é através dela que o contêiner acompanha a cadeia de criação
 * para detectar dependências circulares.
 */
public interface DependencyContainerGetter {

    /**
     * Obtém a instância associada ao tag, criando-a na primeira solicitação.
     * <p>
     * A factory de um tag é executada no máximo uma vez por contêiner; chamadas concorrentes
     * aguardam a mesma criação e observam a mesma instância (ou a mesma falha).
     *
     * @param tag identificador da dependência
     * @param <T> tipo da dependência
     * @return future completado com a instância, ou com uma das falhas abaixo:
     * {@link UnknownDependencyException}, {@link CircularDependencyException},
     * {@link DependencyCreationException}, {@link ContainerDestroyedException}
     */
    <T> CompletableFuture<T> getAsync(Tag<T> tag);

    /**
     * Versão bloqueante de {@link #getAsync(Tag)}. A falha é relançada sem o
     * {@link java.util.concurrent.CompletionException} que a envolve.
     * <p>
     * Aguarda sem limite de tempo. Um ciclo real entre dois tags iniciado ao mesmo tempo por duas
     * threads (uma começando por A, outra por B) não é detectado pela cadeia de resolução e
     * bloqueia as duas threads; use {@link #get(Tag, Duration)} quando esse cenário for possível.
     */
    default <T> T get(Tag<T> tag){
        return FutureUtils.await(getAsync(tag));
    }

    /**
     * Versão bloqueante com limite de espera. A criação em andamento não é cancelada:
     * apenas esta chamada desiste de aguardar.
     *
     * @throws DependencyContainerException com causa {@link TimeoutException} se o tempo esgotar
     */
    default <T> T get(Tag<T> tag, Duration timeout){
        return FutureUtils.await(getAsync(tag).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Indica se existe um registro para o tag. Nenhuma instância é criada.
     */
    boolean has(Tag<?> tag);

    /**
     * Indica se a instância do tag já foi criada com sucesso e está em cache. Nenhuma instância é criada.
     */
    boolean exists(Tag<?> tag);
}
