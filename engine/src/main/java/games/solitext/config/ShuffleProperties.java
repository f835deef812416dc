package games.solitext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for deck shuffling.
 *
 * Setting a seed makes the sequence of deals reproducible across runs. Without one, the
 * generator is seeded from the system at startup.
 */
@Component
@ConfigurationProperties(prefix = "shuffle")
public class ShuffleProperties {
  private Long seed;

  /**
   * Returns the fixed seed, or null for a system-seeded generator.
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
