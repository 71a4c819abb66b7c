package dtm.strata.prototypes;

import dtm.strata.core.DependencyContainerGetter;
import lombok.NonNull;

import java.util.concurrent.CompletableFuture;

/**
 * Função que cria a instância de um tag de forma assíncrona.
 * <p>
 * É a forma usada internamente pelo contêiner; factories síncronas são adaptadas
 * com {@link #of(Factory)}.
 *
 * @param <T> tipo da instância criada
 */
@FunctionalInterface
public interface AsyncFactory<T> {

    CompletableFuture<T> create(DependencyContainerGetter container) throws Exception;

    /**
     * Adapta uma factory síncrona. A factory é executada na thread que disparou a criação.
     */
    static <T> AsyncFactory<T> of(@NonNull Factory<T> factory){
        return container -> CompletableFuture.completedFuture(factory.create(container));
    }

    /**
     * Factory que sempre devolve o mesmo valor já existente.
     */
    static <T> AsyncFactory<T> constant(T value){
        return container -> CompletableFuture.completedFuture(value);
    }
}
