package games.solitext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for debug mode.
 *
 * Debug mode lets the cursor select face-down cards, shows the status line, and enables the
 * {@code check} and {@code force} console commands. It can also be toggled in game with
 * {@code debug}; this property only sets the starting value.
 *
 * Usage:
 * {@code java -jar solitext-engine.jar --debug-mode.enabled=true}
 */
@Component
@ConfigurationProperties(prefix = "debug-mode")
public class DebugModeProperties {
  private boolean enabled = false;

  /**
   * Returns whether games start in debug mode.
   * @return true if debug mode is on at start
   */
  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }
}
