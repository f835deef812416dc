package games.solitext.config;

import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the process-wide random generator that new deals are shuffled with.
 */
@Configuration
public class ShuffleConfig {
  private static final Logger log = LoggerFactory.getLogger(ShuffleConfig.class);

  @Bean
  public Random shuffleRandom(ShuffleProperties properties) {
    Long seed = properties.getSeed();
    if (seed == null) {
      return new Random();
    }
    log.info("Shuffling with fixed seed {}", seed);
    return new Random(seed);
  }
}
