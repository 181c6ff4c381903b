package backtrack.analysis;

import backtrack.parser.Expr;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Analysis facts about one node of an {@link Expr} tree.
 *
 * <p>The annotated tree mirrors the shape of the expression tree: there is one
 * child here for every child expression that was analyzed. Instances are
 * immutable and can be shared between threads.
 *
 * @param expr expression this node annotates
 * @param children annotations of the child expressions, in order
 * @param startGroup index of the first capture group opened inside the node
 * @param endGroup one past the index of the last group opened inside the node
 * @param minSize minimum number of characters matched by the node
 * @param constSize does every match of the node have exactly {@code minSize} characters?
 * @param hard does matching the node need backtracking (as opposed to an automaton)?
 * @param looksLeft does matching the node depend on input before the match position?
 */
public record AnalyzedExpr(
  Expr expr,
  List<AnalyzedExpr> children,
  int startGroup,
  int endGroup,
  int minSize,
  boolean constSize,
  boolean hard,
  boolean looksLeft
) {

  public AnalyzedExpr {
    Objects.requireNonNull(expr, "expr");
    children = List.copyOf(children);
    if (startGroup < 0 || endGroup < startGroup) {
      throw new IllegalArgumentException("Invalid group range [" + startGroup + "," + endGroup + ")");
    }
    if (minSize < 0) {
      throw new IllegalArgumentException("Negative minimum size " + minSize);
    }
  }

  /**
   * Number of capture groups opened inside the node.
   */
  public int groupCount() {
    return endGroup - startGroup;
  }

  /**
   * All nodes in the subtree rooted here, in pre-order.
   *
   * @return stream starting with this node
   */
  public Stream<AnalyzedExpr> walk() {
    return Stream.concat(Stream.of(this), children.stream().flatMap(AnalyzedExpr::walk));
  }

  /**
   * Render the tree of facts, one node per line.
   */
  @Override
  public String toString() {
    final var builder = new StringBuilder();
    appendTo(builder, 0);
    return builder.toString();
  }

  private void appendTo(StringBuilder builder, int depth) {
    builder
      .append("  ".repeat(depth))
      .append(expr.getClass().getSimpleName())
      .append(" groups=[").append(startGroup).append(',').append(endGroup).append(')')
      .append(" minSize=").append(minSize)
      .append(constSize ? " const" : "")
      .append(hard ? " hard" : "")
      .append(looksLeft ? " looksLeft" : "")
      .append('\n');
    for (AnalyzedExpr child : children) {
      child.appendTo(builder, depth + 1);
    }
  }
}
