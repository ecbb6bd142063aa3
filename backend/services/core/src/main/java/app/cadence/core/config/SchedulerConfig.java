package app.cadence.core.config;

import app.cadence.core.review.algorithm.FuzzSource;
import app.cadence.core.review.algorithm.ParameterStore;
import app.cadence.core.review.algorithm.RandomFuzzSource;
import app.cadence.core.review.util.JsonConfigMerger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadLocalRandom;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FuzzSource fuzzSource(FsrsProps props) {
        if (props.fuzzSeed() != null) {
            return RandomFuzzSource.seeded(props.fuzzSeed());
        }
        return new RandomFuzzSource(ThreadLocalRandom::current);
    }

    @Bean
    public ParameterStore parameterStore(ObjectMapper om, JsonConfigMerger merger, FsrsProps props) {
        return new ParameterStore(om, merger, props.baseline());
    }

    /**
     * Zone used to read hour-of-day from review timestamps.
     */
    @Bean
    public ZoneId personalizationZone(FsrsProps props) {
        String zone = props.personalizationZone();
        return (zone == null || zone.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(zone.trim());
    }
}
