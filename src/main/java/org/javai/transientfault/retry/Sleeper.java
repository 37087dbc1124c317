package org.javai.transientfault.retry;

/**
 * Blocks the calling thread between synchronous attempts. Replaced in tests.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
