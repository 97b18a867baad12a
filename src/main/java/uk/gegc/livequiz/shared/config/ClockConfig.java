package uk.gegc.livequiz.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for question windows, answer timestamps and snapshot metadata.
 * Everything the engine stores is an {@link java.time.Instant}, so the clock is always UTC.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
