package dtm.strata.storage;

import dtm.strata.core.DependencyContainerGetter;
import dtm.strata.prototypes.Tag;
import lombok.NonNull;

import java.util.concurrent.CompletableFuture;

/**
 * Visão do contêiner entregue a uma factory, presa à cadeia de resolução da criação em andamento.
 */
public final class ChainedDependencyGetter implements DependencyContainerGetter {

    private final ChainResolver resolver;
    private final ResolutionChain chain;

    public ChainedDependencyGetter(@NonNull ChainResolver resolver, @NonNull ResolutionChain chain) {
        this.resolver = resolver;
        this.chain = chain;
    }

    @Override
    public <T> CompletableFuture<T> getAsync(Tag<T> tag) {
        return resolver.resolve(tag, chain);
    }

    @Override
    public boolean has(Tag<?> tag) {
        return resolver.has(tag);
    }

    @Override
    public boolean exists(Tag<?> tag) {
        return resolver.exists(tag);
    }

    /**
     * Contêiner capaz de resolver um tag a partir de uma cadeia já iniciada.
     */
    public interface ChainResolver {
        <T> CompletableFuture<T> resolve(Tag<T> tag, ResolutionChain chain);
        boolean has(Tag<?> tag);
        boolean exists(Tag<?> tag);
    }
}
