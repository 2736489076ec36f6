package configscanner;

/**
 * A failed top-level operation, tagged with the phase that failed so callers can decide
 * whether to re-run the whole thing (all phases are safe to re-run).
 */
public class ConfigScanException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public enum Phase {
    UPDATE, SCAN, DELETE, RECONCILE, ROSTER
  }

  private final Phase phase;

  public ConfigScanException(Phase phase, String message, Throwable cause) {
    super(phase + " failed: " + message, cause);
    this.phase = phase;
  }

  public Phase getPhase() {
    return phase;
  }

}
