package backtrack.analysis;

/**
 * Case folding policy for the size analysis.
 */
public final class CaseFolding {

  private CaseFolding() { }

  /**
   * Does every match of a literal have the same length as the literal itself?
   *
   * <p>A case sensitive literal trivially does. A case insensitive one does
   * not if some code point folds to a sequence of a different length (eg.
   * {@code ß} matching {@code SS}). The matchers downstream only do simple
   * (one-to-one) case folding, so this currently always holds.
   *
   * TODO: consult full case folding data once a matcher supports it
   *
   * @param value literal text
   * @param casei whether the literal is case insensitive
   * @return whether the literal is constant size
   */
  public static boolean literalConstSize(String value, boolean casei) {
    return true;
  }
}
