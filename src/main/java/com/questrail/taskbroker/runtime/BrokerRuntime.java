package com.questrail.taskbroker.runtime;

import com.questrail.taskbroker.broker.MessageWriter;
import com.questrail.taskbroker.broker.dispatch.DispatchEngine;
import com.questrail.taskbroker.broker.ledger.PendingWorkLedger;
import com.questrail.taskbroker.broker.registry.ExecutorRegistry;
import com.questrail.taskbroker.broker.session.ExecutorSession;
import com.questrail.taskbroker.broker.session.ProducerSession;
import com.questrail.taskbroker.config.BrokerConfig;
import com.questrail.taskbroker.internal.time.MonotonicClock;
import com.questrail.taskbroker.internal.time.MonotonicScheduler;
import com.questrail.taskbroker.internal.time.ScheduledExecutorScheduler;
import com.questrail.taskbroker.internal.time.SystemMonotonicClock;
import com.questrail.taskbroker.internal.time.SystemWallClock;
import com.questrail.taskbroker.internal.time.WallClock;
import com.questrail.taskbroker.observability.BrokerObservabilitySink;
import com.questrail.taskbroker.observability.Slf4jBrokerObservabilitySink;
import com.questrail.taskbroker.protocol.LineCodec;
import com.questrail.taskbroker.transport.SessionTransportAdapter;
import com.questrail.taskbroker.transport.tcp.netty.NettyLineEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BrokerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the broker.
 *
 * <pre>
 *   producer port ─► NettyLineEndpoint ─► SessionTransportAdapter ─► ProducerSession ─┐
 *                                                                                      ├─► PendingWorkLedger
 *   executor port ─► NettyLineEndpoint ─► SessionTransportAdapter ─► ExecutorSession ─┘        │
 *                                                                        ▲                     ▼
 *                                                                        └── ExecutorRegistry ◄─ DispatchEngine
 * </pre>
 *
 * <p>A runtime is started once. After {@link #stop()} its event loops and
 * thread pools are gone; build a new runtime to serve again.</p>
 */
public final class BrokerRuntime {
    private static final Logger log = LoggerFactory.getLogger(BrokerRuntime.class);

    private final BrokerConfig config;
    private final ExecutorRegistry registry;
    private final PendingWorkLedger ledger;
    private final DispatchEngine dispatchEngine;
    private final SessionTransportAdapter producerTransport;
    private final SessionTransportAdapter executorTransport;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService dispatchExecutor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private BrokerRuntime(
            BrokerConfig config,
            ExecutorRegistry registry,
            PendingWorkLedger ledger,
            DispatchEngine dispatchEngine,
            SessionTransportAdapter producerTransport,
            SessionTransportAdapter executorTransport,
            ScheduledExecutorService schedulerExecutor,
            ExecutorService dispatchExecutor) {
        this.config = config;
        this.registry = registry;
        this.ledger = ledger;
        this.dispatchEngine = dispatchEngine;
        this.producerTransport = producerTransport;
        this.executorTransport = executorTransport;
        this.schedulerExecutor = schedulerExecutor;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Bind the executor endpoint, then the producer endpoint.
     *
     * @throws IllegalStateException if either port cannot be bound, or the
     *         runtime was already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("BrokerRuntime can only be started once");
        }

        try {
            executorTransport.start();
            producerTransport.start();
        } catch (RuntimeException e) {
            stop();
            throw e;
        }

        log.info("Broker listening: producers on {}, executors on {}",
                producerAddress().orElse(null), executorAddress().orElse(null));
    }

    /**
     * Cancel retries, close both endpoints and every open connection, then
     * shut the scheduler and the dispatch pool down. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        // Stop dispatching first so that sessions closing below do not redeliver.
        dispatchEngine.shutdown();

        producerTransport.stop();
        executorTransport.stop();

        shutdown(schedulerExecutor);
        // Dispatch threads may be parked in acquire(); interrupt them.
        dispatchExecutor.shutdownNow();
        awaitTermination(dispatchExecutor);

        log.info("Broker stopped");
    }

    public BrokerConfig config() {
        return config;
    }

    public Optional<InetSocketAddress> producerAddress() {
        return producerTransport.endpoint().localAddress();
    }

    public Optional<InetSocketAddress> executorAddress() {
        return executorTransport.endpoint().localAddress();
    }

    public ExecutorRegistry registry() {
        return registry;
    }

    public PendingWorkLedger ledger() {
        return ledger;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        awaitTermination(executor);
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BrokerConfig config = BrokerConfig.defaults();
        private BrokerObservabilitySink observabilitySink = new Slf4jBrokerObservabilitySink();

        public Builder withConfig(BrokerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(BrokerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public BrokerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Clocks, scheduler and the dispatch pool
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newSingleThreadScheduledExecutor(daemonThreads("taskbroker-retry"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            ExecutorService dispatchExec =
                    Executors.newFixedThreadPool(config.dispatchThreads(), daemonThreads("taskbroker-dispatch"));

            // 2. Broker state
            ExecutorRegistry registry = new ExecutorRegistry();
            PendingWorkLedger ledger = new PendingWorkLedger();

            // 3. Codec and outbound path
            LineCodec codec = LineCodec.standard();
            MessageWriter writer = new MessageWriter(codec, observabilitySink, wallClock);

            // 4. Dispatch
            DispatchEngine dispatchEngine = new DispatchEngine(
                registry,
                ledger,
                writer,
                dispatchExec,
                scheduler,
                clock,
                config.dispatchPolicy(),
                observabilitySink,
                wallClock
            );

            // 5. Endpoints, one session per accepted connection
            SessionTransportAdapter executorTransport = new SessionTransportAdapter(
                ExecutorSession.ENDPOINT,
                new NettyLineEndpoint(
                    ExecutorSession.ENDPOINT,
                    new InetSocketAddress(config.host(), config.executorPort()),
                    config.maxLineLength()),
                connection -> new ExecutorSession(
                    connection, codec, registry, ledger, dispatchEngine, writer, observabilitySink, wallClock),
                observabilitySink,
                wallClock
            );

            SessionTransportAdapter producerTransport = new SessionTransportAdapter(
                ProducerSession.ENDPOINT,
                new NettyLineEndpoint(
                    ProducerSession.ENDPOINT,
                    new InetSocketAddress(config.host(), config.producerPort()),
                    config.maxLineLength()),
                connection -> new ProducerSession(
                    connection, codec, ledger, dispatchEngine, writer, observabilitySink, wallClock),
                observabilitySink,
                wallClock
            );

            return new BrokerRuntime(
                config,
                registry,
                ledger,
                dispatchEngine,
                producerTransport,
                executorTransport,
                schedulerExec,
                dispatchExec
            );
        }

        private static ThreadFactory daemonThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
