package backtrack;

import backtrack.analysis.AnalyzedExpr;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Regular expression pattern.
   */
  public final String pattern;

  /**
   * Expected output.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    String pattern,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.pattern = pattern;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Construct an output string from the facts about the root of a pattern.
   *
   * @param root analyzed root of the pattern
   * @return output string
   */
  public static String createOutput(AnalyzedExpr root) {
    return root.minSize()
      + " " + root.constSize()
      + " " + root.hard()
      + " " + root.looksLeft()
      + " " + root.groupCount();
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "/" + pattern + "/ (at " + filePath + ":" + lineNumber + ")";
  }
}
