package com.netmeasure.worker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot latch shared between workers.
 *
 * <p>A signal can be set exactly once and observed by any number of threads. Once set, every
 * wait returns immediately. Listeners registered with {@link #onSet(Runnable)} run exactly once,
 * either on the thread that sets the signal or immediately if it is already set.
 */
public class Signal {
    private final String name;
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public Signal(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets the signal. Calling this more than once has no further effect.
     *
     * @return true if this call set the signal
     */
    public boolean set() {
        synchronized (latch) {
            if (latch.getCount() == 0) {
                return false;
            }
            latch.countDown();
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Waits for the signal for at most the given time.
     *
     * @return true if the signal is set
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    /**
     * Registers a callback that runs once the signal is set.
     *
     * @param listener callback
     */
    public void onSet(Runnable listener) {
        synchronized (latch) {
            if (latch.getCount() != 0) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    @Override
    public String toString() {
        return "Signal(" + name + (isSet() ? ", set)" : ")");
    }
}
