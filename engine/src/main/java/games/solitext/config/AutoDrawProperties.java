package games.solitext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for automatic drawing.
 *
 * When enabled, the turn pipeline draws a batch from the deck whenever the waste pile is empty
 * and the deck still has cards, so there is always a waste card to play.
 *
 * Usage:
 * {@code java -jar solitext-engine.jar --auto-draw.enabled=false}
 */
@Component
@ConfigurationProperties(prefix = "auto-draw")
public class AutoDrawProperties {
  private boolean enabled = true;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }
}
