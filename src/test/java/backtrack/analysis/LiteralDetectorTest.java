package backtrack.analysis;

import backtrack.parser.Expr;
import backtrack.parser.ParsedExpr;
import backtrack.parser.RegexParser;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit test the {@link LiteralDetector} class.
 */
public class LiteralDetectorTest {

  private static AnalyzedExpr analyze(String pattern) {
    final ParsedExpr parsed = RegexParser.parseExpr(pattern);
    return Analyzer.analyze(parsed.expr(), parsed.backrefs());
  }

  @Test void plainTextIsLiteral() {
    final AnalyzedExpr analyzed = analyze("abc");
    assertTrue(LiteralDetector.isLiteral(analyzed));

    final var builder = new StringBuilder();
    LiteralDetector.pushLiteral(analyzed, builder);
    assertEquals("abc", builder.toString());
  }

  @Test void pushLiteralAppends() {
    final var builder = new StringBuilder("x");
    LiteralDetector.pushLiteral(analyze("a\\.b"), builder);
    assertEquals("xa.b", builder.toString());
  }

  @Test void repetitionIsNotLiteral() {
    final AnalyzedExpr analyzed = analyze("abc*");
    assertFalse(LiteralDetector.isLiteral(analyzed));
    assertEquals("ab", LiteralDetector.literalPrefix(analyzed), "The prefix before the repetition is");
  }

  @Test void caseInsensitiveIsNotLiteral() {
    assertFalse(LiteralDetector.isLiteral(analyze("(?i)abc")));
    assertFalse(LiteralDetector.isLiteral(analyze("(?i)a")));
    assertEquals("ab", LiteralDetector.literalPrefix(analyze("ab(?i)c")));
  }

  @Test void otherNodesAreNotLiteral() {
    for (String pattern : List.of("a|b", "(abc)", "a.", "[a]", "(?=a)", "(?>a)", "", "^a")) {
      assertFalse(LiteralDetector.isLiteral(analyze(pattern)), "/" + pattern + "/ is not literal");
    }
  }

  @Test void quotedTextIsLiteral() {
    assertEquals(Optional.of("a.b"), LiteralDetector.literal(analyze("\\Qa.b\\E")));
    assertEquals(Optional.of("a"), LiteralDetector.literal(analyze("a")));
    assertEquals(Optional.empty(), LiteralDetector.literal(analyze("a+")));
  }

  @Test void nestedConcatenationsAreLiteral() {
    final Expr a = new Expr.Literal("a", false);
    final Expr b = new Expr.Literal("b", false);
    final Expr nested = new Expr.Concat(List.of(new Expr.Concat(List.of(a, b)), a));
    assertEquals(Optional.of("aba"), LiteralDetector.literal(Analyzer.analyze(nested, new BitSet())));
  }

  @Test void pushLiteralRejectsNonLiterals() {
    assertThrows(
      IllegalStateException.class,
      () -> LiteralDetector.pushLiteral(analyze("a|b"), new StringBuilder())
    );
    assertThrows(
      IllegalStateException.class,
      () -> LiteralDetector.pushLiteral(analyze("(?i)a"), new StringBuilder())
    );
    assertThrows(
      IllegalStateException.class,
      () -> LiteralDetector.pushLiteral(analyze("ab*"), new StringBuilder()),
      "A literal prefix is not enough"
    );
  }

  @Test void prefixOfNonConcatenationIsEmpty() {
    assertEquals("", LiteralDetector.literalPrefix(analyze("a|b")));
    assertEquals("", LiteralDetector.literalPrefix(analyze("(ab)c")));
  }
}
