package backtrack.parser;

import java.util.Map;

/**
 * Zero-width boundary matchers.
 */
public enum Boundary {
  /**
   * Beginning of line, or of input outside of multiline mode
   */
  BEGINNING_OF_LINE("^"),

  /**
   * End of line, or of input outside of multiline mode
   */
  END_OF_LINE("$"),

  /**
   * Word boundary
   */
  WORD_BOUNDARY("\\b"),

  /**
   * Non-word boundary
   */
  NON_WORD_BOUNDARY("\\B"),

  /**
   * Beginning of input
   */
  BEGINNING_OF_INPUT("\\A"),

  /**
   * End of input, save for an optional final line terminator
   */
  END_OF_INPUT_OR_TERMINATOR("\\Z"),

  /**
   * End of input
   */
  END_OF_INPUT("\\z");

  /**
   * Pattern source of the boundary.
   */
  public final String source;

  Boundary(String source) {
    this.source = source;
  }

  /**
   * Mapping from the escaped character used to represent the boundary to the boundary.
   */
  public static final Map<Character, Boundary> CHARACTERS = Map.of(
    'b', Boundary.WORD_BOUNDARY,
    'B', Boundary.NON_WORD_BOUNDARY,
    'A', Boundary.BEGINNING_OF_INPUT,
    'Z', Boundary.END_OF_INPUT_OR_TERMINATOR,
    'z', Boundary.END_OF_INPUT
  );
}
