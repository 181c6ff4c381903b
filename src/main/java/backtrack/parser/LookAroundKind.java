package backtrack.parser;

/**
 * Direction and polarity of a lookaround assertion.
 */
public enum LookAroundKind {
  /**
   * Positive lookahead {@code (?=...)}
   */
  LOOK_AHEAD("(?="),

  /**
   * Negative lookahead {@code (?!...)}
   */
  LOOK_AHEAD_NEG("(?!"),

  /**
   * Positive lookbehind {@code (?<=...)}
   */
  LOOK_BEHIND("(?<="),

  /**
   * Negative lookbehind {@code (?<!...)}
   */
  LOOK_BEHIND_NEG("(?<!");

  /**
   * Syntax opening the assertion.
   */
  public final String opener;

  LookAroundKind(String opener) {
    this.opener = opener;
  }

  public boolean isBehind() {
    return this == LOOK_BEHIND || this == LOOK_BEHIND_NEG;
  }

  public boolean isNegated() {
    return this == LOOK_AHEAD_NEG || this == LOOK_BEHIND_NEG;
  }
}
