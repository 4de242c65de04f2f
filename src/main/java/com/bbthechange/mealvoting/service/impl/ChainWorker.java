package com.bbthechange.mealvoting.service.impl;

import com.bbthechange.mealvoting.model.ChainId;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Mailbox of a single chain. Tasks run one after another on a shared
 * executor, never two at once for the same chain.
 */
class ChainWorker {

    static final String MDC_CHAIN_ID = "chainId";

    private final ChainId chainId;
    private final Executor executor;
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;

    ChainWorker(ChainId chainId, Executor executor) {
        this.chainId = chainId;
        this.executor = executor;
    }

    ChainId getChainId() {
        return chainId;
    }

    <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        enqueue(() -> {
            MDC.put(MDC_CHAIN_ID, chainId.value());
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            } finally {
                MDC.remove(MDC_CHAIN_ID);
            }
        });
        return future;
    }

    private synchronized void enqueue(Runnable task) {
        tasks.add(() -> {
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            executor.execute(active);
        }
    }
}
