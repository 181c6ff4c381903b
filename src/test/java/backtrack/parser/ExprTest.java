package backtrack.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test the {@link Expr} records and their rendering back to pattern syntax.
 */
public class ExprTest {

  private static final Expr A = new Expr.Literal("a", false);
  private static final Expr B = new Expr.Literal("b", false);

  @Test void renderingAddsGroupsForPrecedence() {
    assertEquals(
      "(?:a|b)a",
      new Expr.Concat(List.of(new Expr.Alt(List.of(A, B)), A)).toRegex()
    );
    assertEquals(
      "(?:ab)??",
      new Expr.Repeat(new Expr.Concat(List.of(A, B)), 0, 1, false).toRegex()
    );
    assertEquals(
      "(?:a*)+",
      new Expr.Repeat(new Expr.Repeat(A, 0, Expr.Repeat.UNBOUNDED, true), 1, Expr.Repeat.UNBOUNDED, true).toRegex()
    );
  }

  @Test void renderingRepetitions() {
    assertEquals("a{2}", new Expr.Repeat(A, 2, 2, true).toRegex());
    assertEquals("a{2,}", new Expr.Repeat(A, 2, Expr.Repeat.UNBOUNDED, true).toRegex());
    assertEquals("a{2,4}?", new Expr.Repeat(A, 2, 4, false).toRegex());
  }

  @Test void renderingLiterals() {
    assertEquals("\\.", new Expr.Literal(".", false).toRegex());
    assertEquals("(?i:a)", new Expr.Literal("a", true).toRegex());
    assertEquals("(?i:[a-z])", new Expr.Delegate("[a-z]", 1, true).toRegex());
  }

  @Test void renderingKeepsDigitsAfterBackreferencesApart() {
    assertEquals(
      "(a)\\0(?:1)",
      new Expr.Concat(List.of(new Expr.Group(A), new Expr.Backref(0), new Expr.Literal("1", false))).toRegex()
    );
    assertEquals(
      "(a)\\0(?:1*)",
      new Expr.Concat(List.of(
        new Expr.Group(A),
        new Expr.Backref(0),
        new Expr.Repeat(new Expr.Literal("1", false), 0, Expr.Repeat.UNBOUNDED, true)
      )).toRegex()
    );
    assertEquals(
      "(a)\\0(?:1)",
      new Expr.Concat(List.of(new Expr.Group(A), new Expr.Backref(0), new Expr.Empty(), new Expr.Literal("1", false))).toRegex(),
      "Empty nodes in between print nothing"
    );
  }

  @Test void renderingAssertions() {
    assertEquals("(?<!a)", new Expr.LookAround(A, LookAroundKind.LOOK_BEHIND_NEG).toRegex());
    assertEquals("(?>a)", new Expr.AtomicGroup(A).toRegex());
    assertEquals("\\A(?m:^)(?m:$)\\z", new Expr.Concat(List.of(
      new Expr.StartText(),
      new Expr.StartLine(),
      new Expr.EndLine(),
      new Expr.EndText()
    )).toRegex());
  }

  @TestFactory
  Stream<DynamicTest> renderingReparsesToSameTree() {
    return Stream.of(
      "a(b|c)*\\d",
      "(?=x)(?>y+?)\\b[a-z]{2,3}",
      "\\Aa\\z",
      "(a)\\0",
      "(a)\\0(?:1)*",
      "(a)\\0(?:1)+?2",
      "(a)\\0(?:1{2})+",
      "(?<=a|b)c{0,1}?"
    ).map(pattern -> DynamicTest.dynamicTest("should re-parse: " + pattern, () -> {
      final Expr expr = RegexParser.parseExpr(pattern).expr();
      assertEquals(expr, RegexParser.parseExpr(expr.toRegex()).expr(), "Rendered as " + expr.toRegex());
    }));
  }

  @Test void invalidNodesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new Expr.Repeat(A, 3, 2, true));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Repeat(A, -1, 2, true));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Alt(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Backref(-1));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Delegate("\\b", -1, false));
    assertThrows(NullPointerException.class, () -> new Expr.Group(null));
  }

  @Test void childListsAreImmutable() {
    final var children = new ArrayList<Expr>(List.of(A, B));
    final var concat = new Expr.Concat(children);
    children.add(A);
    assertEquals(2, concat.children().size());
    assertThrows(UnsupportedOperationException.class, () -> concat.children().add(A));
  }
}
