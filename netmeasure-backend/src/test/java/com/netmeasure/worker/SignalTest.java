package com.netmeasure.worker;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SignalTest {

    @Test
    void setIsOneShot() {
        Signal signal = new Signal("a:finish");
        AtomicInteger calls = new AtomicInteger();
        signal.onSet(calls::incrementAndGet);

        assertThat(signal.isSet()).isFalse();
        assertThat(signal.set()).isTrue();
        assertThat(signal.set()).isFalse();
        assertThat(signal.isSet()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void listenerRegisteredAfterSetRunsImmediately() {
        Signal signal = new Signal("a:finish");
        signal.set();
        AtomicInteger calls = new AtomicInteger();

        signal.onSet(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void awaitReturnsOnceSetFromAnotherThread() throws Exception {
        Signal signal = new Signal("a:finish");
        assertThat(signal.await(10, TimeUnit.MILLISECONDS)).isFalse();

        Thread setter = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.set();
        });
        setter.start();

        assertThat(signal.await(5, TimeUnit.SECONDS)).isTrue();
        setter.join();
    }
}
