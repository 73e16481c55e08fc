package com.primemath.backend.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * 커밋 이후 비동기로 처리되는 알림 결과를 기다린다.
 */
public final class Eventually {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Eventually() {
    }

    public static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + DEFAULT_TIMEOUT);
            }
            Thread.sleep(50);
        }
    }
}
