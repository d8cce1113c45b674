package com.svsbrowser.springboot.service;

import java.time.Duration;

/**
 * Blocks the calling thread between retries. Swapped out in tests to record delays.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
