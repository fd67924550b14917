/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testbridge.reporter;

import io.testbridge.common.CancellationToken;
import io.testbridge.common.PathUtils;
import io.testbridge.transport.ProtocolMessage;
import io.testbridge.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Interprets reporter frames as run events and enforces cancellation.
 * <p>
 * States: {@code IDLE -> LISTENING -> (COMPLETED | CANCELING -> CLOSED)}, and
 * {@code LISTENING -> CLOSED} when the channel drops without {@code onEnd}.
 * <p>
 * Once the token is canceled a {@code stop} request goes to the runner and a
 * grace timer is armed; if the runner has not closed the channel when it
 * fires, the channel is closed from this side. From the moment of cancellation
 * every frame except {@code onEnd} is dropped, so results of tests that were
 * in flight never reach the listener.
 */
public class ReporterProtocol {

    private static final Logger logger = LoggerFactory.getLogger(ReporterProtocol.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(30);

    public static final String STOP = "stop";

    public enum State {
        IDLE,
        LISTENING,
        CANCELING,
        COMPLETED,
        CLOSED
    }

    private static volatile ScheduledExecutorService defaultScheduler;

    private final Transport transport;
    private final TestListener listener;
    private final CancellationToken token;
    private final Duration gracePeriod;
    private final ScheduledExecutorService scheduler;
    private final UnaryOperator<String> paths;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final CompletableFuture<RunOutcome> completion = new CompletableFuture<>();

    private volatile boolean ended;
    private volatile ScheduledFuture<?> forceClose;
    private volatile CancellationToken.Registration registration;

    public ReporterProtocol(Transport transport, TestListener listener, CancellationToken token) {
        this(transport, listener, token, DEFAULT_GRACE_PERIOD, defaultScheduler());
    }

    public ReporterProtocol(Transport transport, TestListener listener, CancellationToken token,
                            Duration gracePeriod, ScheduledExecutorService scheduler) {
        this.transport = transport;
        this.listener = listener;
        this.token = token != null ? token : CancellationToken.NONE;
        this.gracePeriod = gracePeriod;
        this.scheduler = scheduler;
        this.paths = PathUtils::canonicalize;
    }

    /**
     * Shared daemon timer for grace periods, created on first use.
     */
    public static ScheduledExecutorService defaultScheduler() {
        if (defaultScheduler == null) {
            synchronized (ReporterProtocol.class) {
                if (defaultScheduler == null) {
                    defaultScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                        Thread t = new Thread(r, "reporter-grace-timer");
                        t.setDaemon(true);
                        return t;
                    });
                }
            }
        }
        return defaultScheduler;
    }

    /**
     * Wire the transport and start listening. The returned future completes
     * exactly once, after the transport has closed.
     */
    public CompletableFuture<RunOutcome> start() {
        if (!state.compareAndSet(State.IDLE, State.LISTENING)) {
            throw new IllegalStateException("already started: " + state.get());
        }
        transport.onMessage(this::handleMessage);
        transport.onClose(this::handleClose);
        registration = token.onCancellationRequested(this::requestStop);
        return completion;
    }

    public State getState() {
        return state.get();
    }

    public CompletableFuture<RunOutcome> getCompletion() {
        return completion;
    }

    // ========== Inbound ==========

    private void handleMessage(ProtocolMessage message) {
        String method = message.method();
        if (method == null) {
            logger.debug("ignoring frame without method, id: {}", message.id());
            return;
        }
        if (token.isCancellationRequested() && !"onEnd".equals(method)) {
            logger.trace("dropped after cancellation: {}", method);
            return;
        }
        Map<String, Object> params = message.params() != null ? message.params() : Map.of();
        try {
            switch (method) {
                case "onBegin" -> listener.onBegin(BeginParams.fromMap(params, paths));
                case "onTestBegin" -> listener.onTestBegin(TestBeginParams.fromMap(params, paths));
                case "onTestEnd" -> listener.onTestEnd(TestEndParams.fromMap(params, paths));
                case "onStepBegin" -> listener.onStepBegin(StepBeginParams.fromMap(params, paths));
                case "onStepEnd" -> listener.onStepEnd(StepEndParams.fromMap(params, paths));
                case "onError" -> listener.onError(ErrorParams.fromMap(params, paths));
                case "onEnd" -> handleEnd();
                default -> logger.debug("ignoring unknown method: {}", method);
            }
        } catch (Exception e) {
            logger.error("listener failed on {}: {}", method, e.getMessage(), e);
        }
    }

    private void handleEnd() {
        if (ended) {
            return;
        }
        ended = true;
        try {
            listener.onEnd();
        } finally {
            state.set(State.COMPLETED);
            transport.close();
        }
    }

    private void handleClose() {
        ScheduledFuture<?> timer = forceClose;
        if (timer != null) {
            timer.cancel(false);
        }
        CancellationToken.Registration reg = registration;
        if (reg != null) {
            reg.close();
        }
        if (!ended) {
            state.set(State.CLOSED);
            try {
                listener.onTerminated();
            } catch (Exception e) {
                logger.error("listener failed on termination: {}", e.getMessage(), e);
            }
        }
        RunOutcome outcome;
        if (token.isCancellationRequested()) {
            outcome = RunOutcome.CANCELED;
        } else {
            outcome = ended ? RunOutcome.COMPLETED : RunOutcome.TERMINATED;
        }
        logger.debug("reporter channel closed, outcome: {}", outcome);
        completion.complete(outcome);
    }

    // ========== Cancellation ==========

    private void requestStop() {
        if (transport.isClosed() || ended) {
            return;
        }
        state.compareAndSet(State.LISTENING, State.CANCELING);
        try {
            transport.send(ProtocolMessage.notification(STOP, Map.of()));
            forceClose = scheduler.schedule(() -> {
                if (!transport.isClosed()) {
                    logger.warn("runner did not stop within {}ms, closing channel", gracePeriod.toMillis());
                }
                transport.close();
            }, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            logger.debug("stop request failed, closing: {}", e.getMessage());
            transport.close();
        }
    }

}
