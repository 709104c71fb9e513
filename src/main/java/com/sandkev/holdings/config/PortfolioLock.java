package com.sandkev.holdings.config;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The one lock guarding credential contents, the active exchange set and derived settings.
 * Mutations take the write side; balance queries and snapshot computation take the read side,
 * so a registration never interleaves with a valuation in progress.
 */
@Component
public class PortfolioLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public <T> T inReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T inWriteLock(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void runInWriteLock(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
