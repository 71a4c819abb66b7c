package dtm.strata.prototypes;

import lombok.NonNull;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface AsyncFinalizer<T> {

    CompletableFuture<Void> destroy(T instance) throws Exception;

    static <T> AsyncFinalizer<T> of(@NonNull Finalizer<T> finalizer){
        return instance -> {
            finalizer.destroy(instance);
            return CompletableFuture.completedFuture(null);
        };
    }
}
