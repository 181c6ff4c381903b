package backtrack.analysis;

/**
 * A backreference names a capture group which has not been opened yet at the
 * point of the reference.
 *
 * <p>This covers both forward references and references to a group that
 * doesn't exist at all. The pattern is rejected; no partial analysis is
 * produced.
 */
public class InvalidBackrefException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -4021896420786915553L;

  /**
   * Index of the group named by the backreference.
   */
  public final int group;

  /**
   * Number of groups opened before the backreference was reached.
   */
  public final int openedGroups;

  public InvalidBackrefException(int group, int openedGroups) {
    super(
      "Invalid backreference to group " + group + " (only " + openedGroups
        + " group(s) opened before the reference)"
    );
    this.group = group;
    this.openedGroups = openedGroups;
  }
}
