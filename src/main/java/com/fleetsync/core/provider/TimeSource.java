package com.fleetsync.core.provider;

/**
 * Часы и сон для лимитера и повторов; в тестах подменяются.
 */
public interface TimeSource {

    long millis();

    void sleep(long ms) throws InterruptedException;

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long millis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long ms) throws InterruptedException {
            if (ms > 0) Thread.sleep(ms);
        }
    };
}
