package backtrack;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads test cases from a classpath resource.
 *
 * Skips over comment lines, processes unicode escape sequences.
 */
public class TestFileReader implements AutoCloseable {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public TestFileReader(String resourcePath) throws FileNotFoundException {
    final InputStream stream = TestFileReader.class.getResourceAsStream(resourcePath);
    if (stream == null) {
      throw new FileNotFoundException("Missing test resource " + resourcePath);
    }
    this.reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    this.filePath = resourcePath;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isEmpty()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String pattern = readLine();
    if (pattern == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String outputData = readLine();
    if (outputData == null) {
      throw new IOException("Missing expected output for pattern at " + filePath + ":" + lineNumber);
    }

    return new TestCase(pattern, outputData, filePath, lineNumber);
  }

  /**
   * Read all of the remaining test cases in the file.
   */
  public List<TestCase> readAll() throws IOException {
    final List<TestCase> testCases = new ArrayList<>();
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      testCases.add(testCase);
    }
    return testCases;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  /**
   * Process a line to replace unicode escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {
    return UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Matcher.quoteReplacement(Character.toString((char) Integer.parseInt(result.group(1), 16)))
    );
  }
}
