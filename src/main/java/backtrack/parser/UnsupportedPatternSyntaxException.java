package backtrack.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs which are valid regular expressions
 * elsewhere but which this parser rejects.
 *
 * @author Alec Theriault
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 3190462257318465034L;

  /**
   * Categories of rejected syntax.
   */
  public enum Feature {
    POSSESSIVE_QUANTIFIERS("Possessive quantifiers"),
    NAMED_GROUPS("Named capture groups"),
    NAMED_BACKREFERENCES("Named backreferences");

    /**
     * (Capitalized, plural) name of the feature.
     */
    public final String description;

    Feature(String description) {
      this.description = description;
    }
  }

  /**
   * Which unsupported construct was found.
   */
  public final Feature feature;

  public UnsupportedPatternSyntaxException(Feature feature, String regex, int index) {
    super(feature.description + " are not supported", regex, index);
    this.feature = feature;
  }
}
