package io.github.drompincen.sprintplanner.runtime.sprint;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "planner.regeneration")
public class RegenerationProperties {

    /** Minimum gap between the end of one successful regeneration and the start of the next. */
    private Duration cooldown = Duration.ofSeconds(10);

    public Duration getCooldown() { return cooldown; }
    public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
}
