package com.studioscout.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ShutdownCancelTest {

    @Test
    void hook_raises_flag_and_holds_until_batch_closes() throws Exception {
        ShutdownCancel sc = new ShutdownCancel(Duration.ofSeconds(10));
        Thread hook = new Thread(sc::onShutdown, "test-hook");
        hook.start();

        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        while (!sc.flag().get() && System.nanoTime() < deadline) Thread.sleep(5);
        assertThat(sc.flag().get()).isTrue();

        hook.join(200);
        assertThat(hook.isAlive()).isTrue();

        sc.close();
        hook.join(2000);
        assertThat(hook.isAlive()).isFalse();
    }

    @Test
    void hook_gives_up_after_grace() throws Exception {
        ShutdownCancel sc = new ShutdownCancel(Duration.ofMillis(50));
        Thread hook = new Thread(sc::onShutdown, "test-hook");
        hook.start();
        hook.join(2000);
        assertThat(hook.isAlive()).isFalse();
        assertThat(sc.flag().get()).isTrue();
    }

    @Test
    void close_without_install_is_harmless() {
        ShutdownCancel sc = new ShutdownCancel(Duration.ofSeconds(1));
        sc.close();
        assertThat(sc.flag().get()).isFalse();
    }
}
