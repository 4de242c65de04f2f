package com.bbthechange.mealvoting.service.impl;

import com.bbthechange.mealvoting.config.PollProperties;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.dto.operation.PollOperation;
import com.bbthechange.mealvoting.exception.ChainExecutionException;
import com.bbthechange.mealvoting.exception.ChainNotFoundException;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;
import com.bbthechange.mealvoting.repository.ChainRepository;
import com.bbthechange.mealvoting.repository.PollStateRepository;
import com.bbthechange.mealvoting.service.ChainRuntime;
import com.bbthechange.mealvoting.service.ExecutionOutcome;
import com.bbthechange.mealvoting.service.PollChainRuntime;
import com.bbthechange.mealvoting.service.PollContract;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-process host for poll chains.
 *
 * Each call loads a private copy of the chain's state, runs the contract on it
 * and, only if the contract returns normally, saves the copy, registers any
 * chains it opened and releases the messages it sent. A rejected call leaves
 * no trace besides logs and metrics.
 */
@Service
public class LocalPollChainRuntime implements PollChainRuntime {

    private static final Logger logger = LoggerFactory.getLogger(LocalPollChainRuntime.class);

    private final ChainRepository chainRepository;
    private final PollStateRepository stateRepository;
    private final PollContract pollContract;
    private final MeterRegistry meterRegistry;
    private final Duration callTimeout;
    private final ExecutorService executor;
    private final Map<ChainId, ChainWorker> workers = new ConcurrentHashMap<>();
    private final ChainId rootChainId;

    @Autowired
    public LocalPollChainRuntime(
            ChainRepository chainRepository,
            PollStateRepository stateRepository,
            PollContract pollContract,
            MeterRegistry meterRegistry,
            PollProperties pollProperties) {
        this.chainRepository = chainRepository;
        this.stateRepository = stateRepository;
        this.pollContract = pollContract;
        this.meterRegistry = meterRegistry;
        this.callTimeout = pollProperties.getRuntime().getCallTimeout();

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(pollProperties.getRuntime().getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "chain-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        PollProperties.Chain chainSettings = pollProperties.getChain();
        ChainDescription root = new ChainDescription(ChainId.generate(), chainSettings.getRootOwner(),
            chainSettings.getInitialBalance(), null, Instant.now());
        registerChain(root);
        this.rootChainId = root.getChainId();
        logger.info("Opened root chain {} owned by {}", rootChainId, root.getOwner());
    }

    @Override
    public ChainId getRootChainId() {
        return rootChainId;
    }

    @Override
    public ExecutionOutcome execute(ChainId chainId, String signer, PollOperation operation) {
        ChainWorker worker = requireWorker(chainId);
        return await(chainId, worker.submit(() -> runOperation(chainId, signer, operation)));
    }

    @Override
    public void deliver(ChainId chainId, PollMessage message) {
        ChainWorker worker = requireWorker(chainId);
        if (message.getMessageId() == null) {
            message.setMessageId(UUID.randomUUID().toString());
        }
        logger.debug("Queued {} for chain {}", message.getType(), chainId);
        worker.submit(() -> {
            runMessage(chainId, message);
            return null;
        });
    }

    @Override
    public void awaitIdle(ChainId chainId) {
        await(chainId, requireWorker(chainId).submit(() -> null));
    }

    @Override
    public PollState getState(ChainId chainId) {
        return stateRepository.load(chainId)
            .orElseThrow(() -> new ChainNotFoundException("Chain not found: " + chainId));
    }

    @Override
    public ChainDescription getChain(ChainId chainId) {
        return chainRepository.findById(chainId)
            .orElseThrow(() -> new ChainNotFoundException("Chain not found: " + chainId));
    }

    @Override
    public List<ChainDescription> getChainsOwnedBy(String owner) {
        return chainRepository.findByOwner(owner);
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down chain runtime with {} chains", workers.size());
        executor.shutdown();
    }

    // Runs on the chain's worker

    private ExecutionOutcome runOperation(ChainId chainId, String signer, PollOperation operation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CallContext context = new CallContext(chainId, signer);
            PollState working = getState(chainId);

            pollContract.executeOperation(working, context, operation);
            commit(context, working);

            meterRegistry.counter("poll_operation_total", "type", operation.getType(), "status", "success").increment();
            return ExecutionOutcome.success(context.openedChainIds());

        } catch (PollOperationException e) {
            logger.warn("Rejected {} on chain {}: {}", operation.getType(), chainId, e.getMessage());
            meterRegistry.counter("poll_operation_total", "type", operation.getType(), "status", e.getError().metricTag()).increment();
            return ExecutionOutcome.failure(e.getError(), e.getMessage());

        } finally {
            sample.stop(Timer.builder("poll.chain.call.duration")
                .tag("kind", "operation")
                .tag("type", operation.getType())
                .register(meterRegistry));
        }
    }

    private void runMessage(ChainId chainId, PollMessage message) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CallContext context = new CallContext(chainId, null);
            PollState working = getState(chainId);

            pollContract.executeMessage(working, context, message);
            commit(context, working);

            meterRegistry.counter("poll_message_total", "type", message.getType(), "status", "success").increment();

        } catch (PollOperationException e) {
            // No reply channel: the sender never learns about the rejection
            logger.warn("Rejected message {} ({}) on chain {}: {}", message.getMessageId(), message.getType(), chainId, e.getMessage());
            meterRegistry.counter("poll_message_total", "type", message.getType(), "status", e.getError().metricTag()).increment();

        } catch (RuntimeException e) {
            logger.error("Error executing message {} on chain {}: {}", message.getMessageId(), chainId, message, e);
            meterRegistry.counter("poll_message_total", "type", message.getType(), "status", "error").increment();

        } finally {
            sample.stop(Timer.builder("poll.chain.call.duration")
                .tag("kind", "message")
                .tag("type", message.getType())
                .register(meterRegistry));
        }
    }

    private void commit(CallContext context, PollState working) {
        stateRepository.save(context.chainId(), working);
        context.openedChains.forEach(this::registerChain);
        context.outbox.forEach(outgoing -> {
            try {
                deliver(outgoing.target(), outgoing.message());
            } catch (ChainNotFoundException e) {
                logger.error("Dropping {} from chain {}: {}", outgoing.message().getType(), context.chainId(), e.getMessage());
            }
        });
    }

    private void registerChain(ChainDescription description) {
        chainRepository.save(description);
        stateRepository.save(description.getChainId(), new PollState());
        workers.put(description.getChainId(), new ChainWorker(description.getChainId(), executor));
        logger.debug("Registered chain {} owned by {} with balance {}",
            description.getChainId(), description.getOwner(), description.getBalance());
    }

    private ChainWorker requireWorker(ChainId chainId) {
        ChainWorker worker = workers.get(chainId);
        if (worker == null) {
            throw new ChainNotFoundException("Chain not found: " + chainId);
        }
        return worker;
    }

    private <T> T await(ChainId chainId, CompletableFuture<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new ChainExecutionException("Call on chain " + chainId + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainExecutionException("Interrupted while waiting for chain " + chainId, e);
        } catch (TimeoutException e) {
            throw new ChainExecutionException("Call on chain " + chainId + " timed out after " + callTimeout, e);
        }
    }

    private record OutgoingMessage(ChainId target, PollMessage message) {}

    /**
     * Effects requested by the contract during one call, held back until commit.
     */
    private static final class CallContext implements ChainRuntime {

        private final ChainId chainId;
        private final String signer;
        private final List<ChainDescription> openedChains = new ArrayList<>();
        private final List<OutgoingMessage> outbox = new ArrayList<>();

        private CallContext(ChainId chainId, String signer) {
            this.chainId = chainId;
            this.signer = signer;
        }

        @Override
        public ChainId chainId() {
            return chainId;
        }

        @Override
        public Optional<String> authenticatedSigner() {
            return Optional.ofNullable(signer);
        }

        @Override
        public ChainId openChain(String owner, BigDecimal initialBalance) {
            ChainId newChainId = ChainId.generate();
            openedChains.add(new ChainDescription(newChainId, owner, initialBalance, chainId, Instant.now()));
            return newChainId;
        }

        @Override
        public void sendMessage(ChainId target, PollMessage message) {
            outbox.add(new OutgoingMessage(target, message));
        }

        private List<ChainId> openedChainIds() {
            return openedChains.stream().map(ChainDescription::getChainId).collect(Collectors.toList());
        }
    }
}
