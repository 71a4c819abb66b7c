package dtm.strata.utils;

import dtm.strata.exceptions.DependencyContainerException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class FutureUtils {

    private FutureUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Aguarda o future e relança a falha original, sem o invólucro do {@link CompletableFuture}.
     * Falhas verificadas são envolvidas em {@link DependencyContainerException}.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new DependencyContainerException(cause);
        }
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Aguarda todos os futures, sem interromper na primeira falha, e devolve as falhas
     * na mesma ordem dos futures que falharam.
     */
    public static CompletableFuture<List<Throwable>> settle(List<? extends CompletableFuture<?>> futures) {
        List<CompletableFuture<Throwable>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<?> future : futures) {
            outcomes.add(future.handle((result, error) -> error == null ? null : unwrap(error)));
        }

        return CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<Throwable> failures = new ArrayList<>();
                    for (CompletableFuture<Throwable> outcome : outcomes) {
                        Throwable failure = outcome.join();
                        if (failure != null) {
                            failures.add(failure);
                        }
                    }
                    return failures;
                });
    }

    public static <T> CompletableFuture<T> invokeSafely(ThrowingSupplier<CompletableFuture<T>> action) {
        try {
            CompletableFuture<T> result = action.get();
            return (result != null) ? result : CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
