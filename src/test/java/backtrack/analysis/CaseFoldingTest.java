package backtrack.analysis;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit test the {@link CaseFolding} policy.
 */
public class CaseFoldingTest {

  @Test void caseSensitiveLiteralsAreConstantSize() {
    assertTrue(CaseFolding.literalConstSize("a", false));
    assertTrue(CaseFolding.literalConstSize("ß", false));
  }

  /**
   * The policy only holds while matchers fold case one code point at a time.
   * This fails once the platform engine starts doing full case folding.
   */
  @Test void caseFoldingSafe() {
    final int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    if (Pattern.compile("ß", flags).matcher("SS").matches()) {
      assertFalse(CaseFolding.literalConstSize("ß", true));
    }

    // Armenian small ligature ECH YIWN
    if (Pattern.compile("և", flags).matcher("եւ").matches()) {
      assertFalse(CaseFolding.literalConstSize("և", true));
    }

    assertTrue(CaseFolding.literalConstSize("a", true));
  }
}
