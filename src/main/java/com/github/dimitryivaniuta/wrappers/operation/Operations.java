package com.github.dimitryivaniuta.wrappers.operation;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for the sync/async duality of wrapped operations.
 */
public final class Operations {

    private Operations() {
    }

    public static boolean isPending(Object result) {
        return result instanceof CompletionStage<?>;
    }

    @SuppressWarnings("unchecked")
    public static CompletableFuture<Object> toFuture(Object result) {
        if (result instanceof CompletionStage<?> stage) {
            return (CompletableFuture<Object>) stage.toCompletableFuture();
        }
        return CompletableFuture.completedFuture(result);
    }

    /**
     * Invokes {@code op} and always returns a future; a synchronous throw becomes a failed future.
     */
    public static CompletableFuture<Object> invokeAsync(Operation op, Object[] args) {
        try {
            return toFuture(op.invoke(args));
        } catch (Throwable ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Blocks until {@code result} settles if it is pending; rethrows the original failure.
     */
    public static Object await(Object result) throws Throwable {
        if (!(result instanceof CompletionStage<?> stage)) return result;
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ex;
        }
    }

    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Copies the outcome of {@code source} into {@code target}, unwrapping completion wrappers.
     */
    public static void relay(CompletableFuture<Object> source, CompletableFuture<Object> target) {
        source.whenComplete((value, ex) -> {
            if (ex != null) {
                target.completeExceptionally(unwrap(ex));
            } else {
                target.complete(value);
            }
        });
    }
}
