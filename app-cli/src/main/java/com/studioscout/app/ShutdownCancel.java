package com.studioscout.app;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Ctrl+C/SIGTERM → 배치 취소 플래그.
 * 훅은 플래그를 세운 뒤 배치가 정리되고 close()가 불릴 때까지(최대 grace) JVM 종료를 붙잡는다.
 * 이때 프로세스 종료 코드는 시그널이 정한다(SIGINT면 130).
 */
final class ShutdownCancel implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ShutdownCancel.class.getName());

    private final AtomicBoolean flag = new AtomicBoolean(false);
    private final CountDownLatch settled = new CountDownLatch(1);
    private final Duration grace;
    private final Thread hook;

    ShutdownCancel(Duration grace) {
        this.grace = grace;
        this.hook = new Thread(this::onShutdown, "shutdown-cancel");
    }

    ShutdownCancel install() {
        Runtime.getRuntime().addShutdownHook(hook);
        return this;
    }

    AtomicBoolean flag() { return flag; }

    /** 훅 본문 */
    void onShutdown() {
        flag.set(true);
        LOG.info("Shutdown requested; cancelling batch.");
        try {
            if (!settled.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warning(() -> "Batch did not stop within " + grace.toMillis() + "ms; exiting anyway.");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /** 배치가 끝난 뒤(정상/취소) 호출: 대기 중인 훅을 풀고 등록 해제 */
    @Override
    public void close() {
        settled.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException alreadyShuttingDown) {
            LOG.fine("Shutdown in progress; hook stays registered.");
        }
    }
}
