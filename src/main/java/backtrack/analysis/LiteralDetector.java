package backtrack.analysis;

import backtrack.parser.Expr;
import java.util.Optional;

/**
 * Detection of subtrees that only ever match one fixed string.
 *
 * <p>Those can be searched for with a plain substring search before (or
 * instead of) running a matcher.
 */
public final class LiteralDetector {

  private LiteralDetector() { }

  /**
   * Is the node a case sensitive literal, or a concatenation of those?
   *
   * @param analyzed node to check
   * @return whether the node only matches one fixed string
   */
  public static boolean isLiteral(AnalyzedExpr analyzed) {
    final Expr expr = analyzed.expr();
    if (expr instanceof Expr.Literal literal) {
      return !literal.casei();
    } else if (expr instanceof Expr.Concat) {
      return analyzed.children().stream().allMatch(LiteralDetector::isLiteral);
    } else {
      return false;
    }
  }

  /**
   * Append the text matched by a literal node.
   *
   * <p>Only call this on nodes for which {@link #isLiteral} holds.
   *
   * @param analyzed literal node
   * @param builder where to append the literal text
   * @throws IllegalStateException if the node is not literal
   */
  public static void pushLiteral(AnalyzedExpr analyzed, StringBuilder builder) {
    final Expr expr = analyzed.expr();
    if (expr instanceof Expr.Literal literal && !literal.casei()) {
      builder.append(literal.value());
    } else if (expr instanceof Expr.Concat) {
      for (AnalyzedExpr child : analyzed.children()) {
        pushLiteral(child, builder);
      }
    } else {
      throw new IllegalStateException("pushLiteral called on non-literal " + expr);
    }
  }

  /**
   * Text of the node, if it is literal.
   *
   * @param analyzed node to check
   * @return literal text, or nothing if the node is not literal
   */
  public static Optional<String> literal(AnalyzedExpr analyzed) {
    if (!isLiteral(analyzed)) {
      return Optional.empty();
    }
    final var builder = new StringBuilder();
    pushLiteral(analyzed, builder);
    return Optional.of(builder.toString());
  }

  /**
   * Longest literal text that every match of the node starts with.
   *
   * <p>For a concatenation, this is the text of its leading literal children.
   * Other non-literal nodes have an empty prefix.
   *
   * @param analyzed node to check
   * @return literal prefix, possibly empty
   */
  public static String literalPrefix(AnalyzedExpr analyzed) {
    final var builder = new StringBuilder();
    if (isLiteral(analyzed)) {
      pushLiteral(analyzed, builder);
    } else if (analyzed.expr() instanceof Expr.Concat) {
      for (AnalyzedExpr child : analyzed.children()) {
        if (!isLiteral(child)) {
          break;
        }
        pushLiteral(child, builder);
      }
    }
    return builder.toString();
  }
}
