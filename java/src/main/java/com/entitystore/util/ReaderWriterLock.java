package com.entitystore.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Non-blocking reader-writer lock for reactive pipelines.
 *
 * Any number of readers may hold the lock together; a writer excludes everyone else.
 * Waiting subscriptions are parked, never threads. Waiters are served in arrival order,
 * so a queued writer holds back readers that arrive after it.
 *
 * The permit is released when the guarded publisher completes, errors or is cancelled.
 */
public final class ReaderWriterLock {

    private final Object monitor = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int activeReaders;
    private boolean writerActive;

    /**
     * Run {@code body} while holding the shared side of the lock.
     */
    public <T> Mono<T> read(Supplier<? extends Mono<T>> body) {
        return Mono.usingWhen(acquire(false), permit -> body.get(), this::release);
    }

    /**
     * Run {@code body} while holding the exclusive side of the lock.
     */
    public <T> Mono<T> write(Supplier<? extends Mono<T>> body) {
        return Mono.usingWhen(acquire(true), permit -> body.get(), this::release);
    }

    public <T> Flux<T> readMany(Supplier<? extends Flux<T>> body) {
        return Flux.usingWhen(acquire(false), permit -> body.get(), this::release);
    }

    public <T> Flux<T> writeMany(Supplier<? extends Flux<T>> body) {
        return Flux.usingWhen(acquire(true), permit -> body.get(), this::release);
    }

    public int getActiveReaders() {
        synchronized (monitor) {
            return activeReaders;
        }
    }

    public boolean isWriterActive() {
        synchronized (monitor) {
            return writerActive;
        }
    }

    public int getQueueLength() {
        synchronized (monitor) {
            return waiters.size();
        }
    }

    private Mono<Permit> acquire(boolean exclusive) {
        return Mono.create(sink -> {
            Waiter waiter = new Waiter(new Permit(exclusive), sink);
            sink.onCancel(() -> abandon(waiter));

            boolean grantedNow;
            synchronized (monitor) {
                if (waiter.cancelled) {
                    return;
                }
                grantedNow = waiters.isEmpty() && canGrant(exclusive);
                if (grantedNow) {
                    take(waiter);
                } else {
                    waiters.addLast(waiter);
                }
            }
            if (grantedNow) {
                deliver(waiter);
            }
        });
    }

    private Mono<Void> release(Permit permit) {
        return Mono.fromRunnable(() -> releaseNow(permit));
    }

    private void releaseNow(Permit permit) {
        if (!permit.released.compareAndSet(false, true)) {
            return;
        }
        List<Waiter> granted;
        synchronized (monitor) {
            if (permit.exclusive) {
                writerActive = false;
            } else {
                activeReaders--;
            }
            granted = drain();
        }
        granted.forEach(this::deliver);
    }

    /**
     * Cancelled before delivery: either still queued, or granted but never handed over.
     */
    private void abandon(Waiter waiter) {
        List<Waiter> granted = null;
        synchronized (monitor) {
            waiter.cancelled = true;
            if (waiters.remove(waiter)) {
                // a writer leaving the head of the queue may unblock readers behind it
                granted = drain();
            }
        }
        if (granted != null) {
            granted.forEach(this::deliver);
        } else if (waiter.granted) {
            releaseNow(waiter.permit);
        }
    }

    private void deliver(Waiter waiter) {
        waiter.sink.success(waiter.permit);
        if (waiter.cancelled) {
            releaseNow(waiter.permit);
        }
    }

    // must hold monitor
    private List<Waiter> drain() {
        List<Waiter> granted = new ArrayList<>();
        while (!waiters.isEmpty()) {
            Waiter next = waiters.peekFirst();
            if (!canGrant(next.permit.exclusive)) {
                break;
            }
            waiters.pollFirst();
            take(next);
            granted.add(next);
            if (next.permit.exclusive) {
                break;
            }
        }
        return granted;
    }

    // must hold monitor
    private boolean canGrant(boolean exclusive) {
        if (exclusive) {
            return !writerActive && activeReaders == 0;
        }
        return !writerActive;
    }

    // must hold monitor
    private void take(Waiter waiter) {
        if (waiter.permit.exclusive) {
            writerActive = true;
        } else {
            activeReaders++;
        }
        waiter.granted = true;
    }

    private static final class Permit {
        private final boolean exclusive;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(boolean exclusive) {
            this.exclusive = exclusive;
        }
    }

    private static final class Waiter {
        private final Permit permit;
        private final MonoSink<Permit> sink;
        private volatile boolean granted;
        private volatile boolean cancelled;

        private Waiter(Permit permit, MonoSink<Permit> sink) {
            this.permit = permit;
            this.sink = sink;
        }
    }
}
