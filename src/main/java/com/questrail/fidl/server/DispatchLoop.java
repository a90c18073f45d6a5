package com.questrail.fidl.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Repeats an asynchronous step until it reports {@code false} or fails.
 *
 * <p>Steps that complete synchronously are run in a loop rather than by
 * chaining futures, so a long run of ready messages does not grow the
 * stack.</p>
 */
public final class DispatchLoop
{
    private DispatchLoop() {
    }

    /**
     * @param step one iteration; {@code true} to continue
     * @return completes normally when a step reports {@code false}, or
     *         exceptionally with the unwrapped cause of the first failed step
     */
    public static CompletableFuture<Void> run(Supplier<CompletableFuture<Boolean>> step) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        pump(step, done);
        return done;
    }

    private static void pump(Supplier<CompletableFuture<Boolean>> step, CompletableFuture<Void> done) {
        while (true) {
            CompletableFuture<Boolean> next = step.get();
            if (!next.isDone() || next.isCompletedExceptionally()) {
                next.whenComplete((more, error) -> {
                    if (error != null) {
                        done.completeExceptionally(unwrap(error));
                    }
                    else if (more) {
                        pump(step, done);
                    }
                    else {
                        done.complete(null);
                    }
                });
                return;
            }
            if (!next.join()) {
                done.complete(null);
                return;
            }
        }
    }

    /**
     * Strips {@link CompletionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
