package ai.bridge.config;

import ai.bridge.play.Difficulty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the card-play engine.
 *
 * Search depths are counted in single card plays (plies). The solver block configures the
 * external double-dummy service used at {@link Difficulty#EXPERT}.
 *
 * Usage:
 * {@code java -jar bridge-engine.jar --play.difficulty=EXPERT --play.solver.url=http://127.0.0.1:8010}
 */
@Component
@ConfigurationProperties(prefix = "play")
public class PlayProperties {
  private Difficulty difficulty = Difficulty.ADVANCED;
  private final Depth depth = new Depth();
  private final Solver solver = new Solver();

  /**
   * Returns the difficulty used by the command-line runner for every AI seat.
   * @return the configured difficulty
   */
  public Difficulty getDifficulty() {
    return difficulty;
  }

  public void setDifficulty(Difficulty difficulty) {
    this.difficulty = difficulty;
  }

  public Depth getDepth() {
    return depth;
  }

  public Solver getSolver() {
    return solver;
  }

  /**
   * Returns the search depth for a difficulty tier. Expert uses the advanced depth
   * whenever it has to fall back from the solver.
   * @param tier the difficulty
   * @return the depth in plies
   */
  public int depthFor(Difficulty tier) {
    return switch (tier) {
      case BEGINNER -> depth.getBeginner();
      case INTERMEDIATE -> depth.getIntermediate();
      case ADVANCED, EXPERT -> depth.getAdvanced();
    };
  }

  /**
   * Search depth per difficulty tier.
   */
  public static class Depth {
    private int beginner = 1;
    private int intermediate = 4;
    private int advanced = 8;

    public int getBeginner() {
      return beginner;
    }

    public void setBeginner(int beginner) {
      this.beginner = beginner;
    }

    public int getIntermediate() {
      return intermediate;
    }

    public void setIntermediate(int intermediate) {
      this.intermediate = intermediate;
    }

    public int getAdvanced() {
      return advanced;
    }

    public void setAdvanced(int advanced) {
      this.advanced = advanced;
    }
  }

  /**
   * Double-dummy solver endpoint settings.
   */
  public static class Solver {
    private boolean enabled = true;
    private String url = "http://127.0.0.1:8010";
    private int timeoutMillis = 5000;
    private String unsupportedPlatforms = "mac os x/aarch64";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    /**
     * Connect and read timeout for a single solver call.
     * @return the timeout in milliseconds
     */
    public int getTimeoutMillis() {
      return timeoutMillis;
    }

    public void setTimeoutMillis(int timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }

    /**
     * Comma-separated {@code os.name/os.arch} pairs (lower case) on which the solver is never called.
     * @return the platform list
     */
    public String getUnsupportedPlatforms() {
      return unsupportedPlatforms;
    }

    public void setUnsupportedPlatforms(String unsupportedPlatforms) {
      this.unsupportedPlatforms = unsupportedPlatforms;
    }
  }
}
