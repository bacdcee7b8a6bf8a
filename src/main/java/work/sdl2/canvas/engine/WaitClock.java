package work.sdl2.canvas.engine;

import java.time.Duration;

/**
 * Time source and suspension point of the completion waiter.
 */
public interface WaitClock {
    WaitClock SYSTEM = new WaitClock() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        }
    };

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;
}
