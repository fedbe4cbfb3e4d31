package io.x402.autopay.agent;

import io.x402.autopay.config.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Message channel between interception contexts and the {@link PaymentAgent}. Commands run one
 * at a time on a dedicated thread; each request gets an id and a reply future that fails with
 * a {@link java.util.concurrent.TimeoutException} after the bus timeout.
 */
public final class AgentBus implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AgentBus.class);

    private final PaymentAgent agent;
    private final Duration timeout;
    private final ScheduledExecutorService executor;
    private final AtomicLong requestIds = new AtomicLong();

    public AgentBus(PaymentAgent agent, Duration timeout) {
        this.agent = agent;
        this.timeout = timeout;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "x402-agent");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts a bus with the configured timeout. When the agent has a balance provider, balances
     * are refreshed on the configured interval.
     */
    public static AgentBus start(PaymentAgent agent) {
        AgentConfig config = agent.getConfig();
        AgentBus bus = new AgentBus(agent, config.getBusTimeout());
        if (agent.hasBalanceProvider()) {
            long interval = config.getBalanceRefreshInterval().toMillis();
            bus.executor.scheduleAtFixedRate(bus::refreshBalancesQuietly, 0, interval, TimeUnit.MILLISECONDS);
        }
        return bus;
    }

    public Connection connect() {
        return new Connection();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private void refreshBalancesQuietly() {
        try {
            agent.refreshBalances(new AgentCommand.RefreshBalances(null, false));
        } catch (RuntimeException e) {
            LOG.warn("Scheduled balance refresh failed", e);
        }
    }

    /** One client of the bus. {@link #disconnect()} cancels everything still in flight. */
    public final class Connection implements AutoCloseable {

        private final Map<Long, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();
        private final List<ResolutionListener> listeners = new CopyOnWriteArrayList<>();
        private volatile boolean connected = true;

        private Connection() {
        }

        /**
         * Sends a command to the agent.
         *
         * @return the reply; fails with a {@link java.util.concurrent.TimeoutException} after the bus
         *     timeout, or a {@link CancellationException} when the connection is closed
         */
        public <R> CompletableFuture<R> send(AgentCommand<R> command) {
            CompletableFuture<R> reply = new CompletableFuture<>();
            if (!connected) {
                reply.completeExceptionally(new CancellationException("Connection closed"));
                return reply;
            }
            long requestId = requestIds.incrementAndGet();
            inFlight.put(requestId, reply);
            reply.whenComplete((result, error) -> inFlight.remove(requestId));
            try {
                executor.execute(() -> dispatch(requestId, command, reply));
            } catch (RejectedExecutionException e) {
                reply.completeExceptionally(e);
                return reply;
            }
            return reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        /**
         * Ties a wait that lives outside the bus to this connection, so {@link #disconnect()}
         * cancels it like any in-flight request.
         */
        public <R> CompletableFuture<R> track(CompletableFuture<R> future) {
            if (!connected) {
                future.cancel(true);
                return future;
            }
            long requestId = requestIds.incrementAndGet();
            inFlight.put(requestId, future);
            future.whenComplete((result, error) -> inFlight.remove(requestId));
            if (!connected) {
                future.cancel(true);
            }
            return future;
        }

        /** Registers a listener for challenges resolved at the prompt. */
        public void onResolution(ResolutionListener listener) {
            listeners.add(listener);
            agent.addResolutionListener(listener);
        }

        public void removeResolutionListener(ResolutionListener listener) {
            listeners.remove(listener);
            agent.removeResolutionListener(listener);
        }

        public boolean isConnected() {
            return connected;
        }

        public void disconnect() {
            connected = false;
            for (ResolutionListener listener : listeners) {
                agent.removeResolutionListener(listener);
            }
            listeners.clear();
            for (CompletableFuture<?> pending : inFlight.values()) {
                pending.cancel(true);
            }
            inFlight.clear();
        }

        @Override
        public void close() {
            disconnect();
        }

        private <R> void dispatch(long requestId, AgentCommand<R> command, CompletableFuture<R> reply) {
            if (reply.isDone()) {
                LOG.debug("Request {} dropped before dispatch ({})", requestId, command.getClass().getSimpleName());
                return;
            }
            try {
                reply.complete(command.dispatch(agent));
            } catch (RuntimeException e) {
                LOG.warn("Request {} ({}) failed", requestId, command.getClass().getSimpleName(), e);
                reply.completeExceptionally(e);
            }
        }
    }
}
