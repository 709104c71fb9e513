package com.sandkev.holdings.loop;

import com.sandkev.holdings.config.HoldingsProperties;
import com.sandkev.holdings.exchange.ExchangeClient;
import com.sandkev.holdings.exchange.ExchangeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives the periodic hook of every exchange client that has one, one client after the other,
 * then waits for the sync interval. Cancellation is checked once at the top of each cycle; a
 * pass already running always finishes. The timed wait is the only suspension point and
 * returns early once cancelled.
 */
@Slf4j
@Component
public class ExchangeSyncLoop implements SmartLifecycle {

    private final ExchangeRegistry registry;
    private final Duration interval;
    private final boolean enabled;

    private volatile CountDownLatch cancelled = new CountDownLatch(0);
    private volatile Thread worker;

    public ExchangeSyncLoop(ExchangeRegistry registry, HoldingsProperties props) {
        this.registry = registry;
        this.interval = props.syncInterval();
        this.enabled = props.syncEnabled();
    }

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("Exchange sync loop disabled");
            return;
        }
        if (isRunning()) return;
        Thread previous = worker;
        if (previous != null && previous.isAlive()) {
            // a cancelled worker may still be inside its last pass; passes never overlap
            log.info("Waiting for the previous exchange sync pass to finish");
            try {
                previous.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the previous exchange sync pass; not restarting");
                return;
            }
        }
        cancelled = new CountDownLatch(1);
        Thread t = new Thread(this::run, "exchange-sync");
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("Exchange sync loop started, interval {}", interval);
    }

    /** Signals cancellation; the worker exits at the top of its next cycle. */
    @Override
    public void stop() {
        cancelled.countDown();
    }

    @Override
    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive() && cancelled.getCount() > 0;
    }

    void run() {
        CountDownLatch token = cancelled;
        try {
            while (token.getCount() > 0) {
                runCycle();
                if (token.await(interval.toMillis(), TimeUnit.MILLISECONDS)) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Exchange sync loop stopped");
    }

    /** One sequential pass over the periodic clients. Returns how many were driven. */
    public int runCycle() {
        log.debug("Main loop start");
        int driven = 0;
        for (ExchangeClient client : registry.periodicClients()) {
            try {
                client.mainLogic();
            } catch (RuntimeException e) {
                log.warn("Periodic sync of {} failed: {}", client.name(), e.getMessage(), e);
            }
            driven++;
        }
        log.debug("Main loop end");
        return driven;
    }

    /** Blocks until the worker thread has exited or the timeout passes. */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread t = worker;
        if (t == null) return true;
        t.join(timeout.toMillis());
        return !t.isAlive();
    }
}
