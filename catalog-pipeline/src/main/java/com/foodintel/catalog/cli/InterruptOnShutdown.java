package com.foodintel.catalog.cli;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * JVM shutdown hook for a one-shot run: when the JVM is asked to stop (Ctrl-C, SIGTERM)
 * while the pipeline is still running, interrupt the pipeline thread, give it
 * {@code grace} to record its run as cancelled, then halt with {@code exitCode}.
 *
 * After {@link #finished()} the hook does nothing, so a normal {@code System.exit}
 * keeps its status.
 */
@Slf4j
class InterruptOnShutdown implements Runnable {

    private final Thread pipelineThread;
    private final Duration grace;
    private final int exitCode;
    private final IntConsumer halt;

    private final CountDownLatch done = new CountDownLatch(1);

    InterruptOnShutdown(Thread pipelineThread, Duration grace, int exitCode, IntConsumer halt) {
        this.pipelineThread = pipelineThread;
        this.grace = grace;
        this.exitCode = exitCode;
        this.halt = halt;
    }

    static InterruptOnShutdown forCurrentThread(Duration grace, int exitCode) {
        return new InterruptOnShutdown(Thread.currentThread(), grace, exitCode, Runtime.getRuntime()::halt);
    }

    /** Called by the pipeline thread once the run has returned or thrown. */
    void finished() {
        done.countDown();
    }

    boolean isFinished() {
        return done.getCount() == 0;
    }

    @Override
    public void run() {
        if (isFinished()) {
            return;
        }
        log.warn("Shutdown requested, interrupting pipeline");
        pipelineThread.interrupt();
        try {
            if (!done.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline did not stop within {} seconds", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        halt.accept(exitCode);
    }
}
