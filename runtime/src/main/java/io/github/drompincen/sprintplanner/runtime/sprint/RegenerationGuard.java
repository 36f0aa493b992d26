package io.github.drompincen.sprintplanner.runtime.sprint;

import io.github.drompincen.sprintplanner.runtime.error.ConflictException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide gate for sprint regeneration: one run at a time, and a cooldown
 * after each successful run. State lives in memory only and is lost on restart;
 * several gateway instances each keep their own gate.
 */
@Component
public class RegenerationGuard {

    private final Object monitor = new Object();
    private final Clock clock;
    private final Duration cooldown;

    private boolean running;
    private Instant lastSuccess;

    public RegenerationGuard(RegenerationProperties properties, Clock clock) {
        this.clock = clock;
        this.cooldown = properties.getCooldown();
    }

    /**
     * @throws ConflictException when a regeneration is in flight or the cooldown has not elapsed
     */
    public void acquire() {
        synchronized (monitor) {
            if (running) {
                throw new ConflictException("A sprint regeneration is already in progress",
                        "Wait for the running regeneration to finish, then retry");
            }
            if (lastSuccess != null) {
                Instant readyAt = lastSuccess.plus(cooldown);
                if (clock.instant().isBefore(readyAt)) {
                    throw new ConflictException("Sprint regeneration is cooling down until " + readyAt,
                            "Retry after " + readyAt);
                }
            }
            running = true;
        }
    }

    public void release(boolean success) {
        synchronized (monitor) {
            running = false;
            if (success) {
                lastSuccess = clock.instant();
            }
        }
    }
}
