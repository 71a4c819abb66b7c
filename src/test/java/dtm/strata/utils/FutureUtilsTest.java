package dtm.strata.utils;

import dtm.strata.exceptions.DependencyContainerException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class FutureUtilsTest {

    @Test
    void awaitRethrowsTheOriginalRuntimeFailure() {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> FutureUtils.await(CompletableFuture.failedFuture(failure)));

        assertSame(failure, thrown);
    }

    @Test
    void awaitWrapsCheckedFailures() {
        IOException failure = new IOException("disk");

        DependencyContainerException thrown = assertThrows(DependencyContainerException.class,
                () -> FutureUtils.await(CompletableFuture.failedFuture(failure)));

        assertSame(failure, thrown.getCause());
    }

    @Test
    void unwrapRemovesNestedWrappers() {
        IllegalArgumentException root = new IllegalArgumentException("root");

        Throwable unwrapped = FutureUtils.unwrap(new CompletionException(new ExecutionException(root)));

        assertSame(root, unwrapped);
    }

    @Test
    void settleWaitsForEveryFutureAndKeepsFailureOrder() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        IllegalStateException first = new IllegalStateException("first");
        IllegalArgumentException second = new IllegalArgumentException("second");

        List<CompletableFuture<?>> futures = List.of(
                CompletableFuture.failedFuture(first),
                CompletableFuture.completedFuture("ok"),
                pending
        );

        CompletableFuture<List<Throwable>> settled = FutureUtils.settle(futures);

        assertFalse(settled.isDone());
        pending.completeExceptionally(second);

        assertEquals(List.of(first, second), settled.join());
    }

    @Test
    void invokeSafelyTurnsThrownExceptionsIntoFailedFutures() {
        CompletableFuture<String> result = FutureUtils.invokeSafely(() -> {
            throw new IOException("io");
        });

        assertTrue(result.isCompletedExceptionally());
        assertNull(FutureUtils.invokeSafely(() -> null).join());
    }
}
