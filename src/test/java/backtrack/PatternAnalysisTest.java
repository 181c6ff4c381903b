package backtrack;

import backtrack.analysis.InvalidBackrefException;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit test the {@link PatternAnalysis} class.
 */
public class PatternAnalysisTest {

  @Test void literalPatterns() {
    final PatternAnalysis analysis = PatternAnalysis.of("hello");
    assertEquals(ExecutionStrategy.LITERAL, analysis.strategy());
    assertEquals(Optional.of("hello"), analysis.literal());
    assertEquals("hello", analysis.literalPrefix());
    assertEquals(0, analysis.groupCount());
  }

  @Test void literalFlag() {
    final PatternAnalysis analysis = PatternAnalysis.of("a\\Eb|c", Pattern.LITERAL);
    assertEquals(ExecutionStrategy.LITERAL, analysis.strategy());
    assertEquals(Optional.of("a\\Eb|c"), analysis.literal());
    assertTrue(Pattern.compile("a\\Eb|c", Pattern.LITERAL).matcher("a\\Eb|c").matches());
  }

  @Test void regularPatterns() {
    final PatternAnalysis analysis = PatternAnalysis.of("hel+o");
    assertEquals(ExecutionStrategy.AUTOMATON, analysis.strategy());
    assertEquals(Optional.empty(), analysis.literal());
    assertEquals("he", analysis.literalPrefix());
  }

  @Test void caseInsensitivePatternsAreNotLiteral() {
    final PatternAnalysis analysis = PatternAnalysis.of("hello", Pattern.CASE_INSENSITIVE);
    assertEquals(ExecutionStrategy.AUTOMATON, analysis.strategy());
    assertEquals("", analysis.literalPrefix());
  }

  @Test void backtrackingPatterns() {
    final PatternAnalysis backref = PatternAnalysis.of("(a)\\0");
    assertEquals(ExecutionStrategy.BACKTRACKING, backref.strategy());
    assertEquals(1, backref.groupCount());
    assertTrue(backref.backrefs().get(0));

    assertEquals(ExecutionStrategy.BACKTRACKING, PatternAnalysis.of("a(?=b)").strategy());
    assertEquals(ExecutionStrategy.BACKTRACKING, PatternAnalysis.of("(?>a+)b").strategy());
  }

  @Test void wrappingGroup() {
    final PatternAnalysis analysis = PatternAnalysis.of("(a)\\1", 0, true);
    assertEquals(2, analysis.groupCount());
    assertEquals(ExecutionStrategy.BACKTRACKING, analysis.strategy());
    assertEquals(
      ExecutionStrategy.AUTOMATON,
      PatternAnalysis.of("abc", 0, true).strategy(),
      "The wrapping group hides the literal"
    );
  }

  @Test void errorsPropagateUnchanged() {
    final InvalidBackrefException backref = assertThrows(
      InvalidBackrefException.class,
      () -> PatternAnalysis.of(".\\0")
    );
    assertEquals(0, backref.group);

    final PatternSyntaxException syntax = assertThrows(
      PatternSyntaxException.class,
      () -> PatternAnalysis.of("(a")
    );
    assertEquals("(a", syntax.getPattern());
  }

  @Test void accessors() {
    final PatternAnalysis analysis = PatternAnalysis.of("a|b");
    assertEquals("a|b", analysis.pattern());
    assertSame(analysis.expr(), analysis.root().expr());
    assertEquals("PatternAnalysis(a|b)", analysis.toString());
  }
}
