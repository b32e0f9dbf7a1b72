package ai.bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the auction engine.
 *
 * The slam thresholds are combined partnership points (own points plus the
 * minimum shown by partner) that Blackwood compares against when placing the contract.
 *
 * Usage:
 * {@code java -jar bridge-engine.jar --bidding.slam.grand-slam=38}
 */
@Component
@ConfigurationProperties(prefix = "bidding")
public class BiddingProperties {
  private int maxRepairLevels = 2;
  private final Slam slam = new Slam();

  /**
   * Returns how many levels an illegal suggestion may be raised before the engine passes instead.
   * @return the repair cap in levels
   */
  public int getMaxRepairLevels() {
    return maxRepairLevels;
  }

  public void setMaxRepairLevels(int maxRepairLevels) {
    this.maxRepairLevels = maxRepairLevels;
  }

  public Slam getSlam() {
    return slam;
  }

  /**
   * Combined-strength thresholds used by the ace-asking sequence.
   */
  public static class Slam {
    private int smallSlam = 33;
    private int grandSlam = 37;

    /**
     * Minimum combined points before asking for aces with a small slam in view.
     * @return the threshold
     */
    public int getSmallSlam() {
      return smallSlam;
    }

    public void setSmallSlam(int smallSlam) {
      this.smallSlam = smallSlam;
    }

    /**
     * Minimum combined points for a grand slam (all aces required).
     * @return the threshold
     */
    public int getGrandSlam() {
      return grandSlam;
    }

    public void setGrandSlam(int grandSlam) {
      this.grandSlam = grandSlam;
    }
  }
}
