package backtrack.parser;

import java.util.List;
import java.util.Objects;

/**
 * Explicit regular expression AST.
 *
 * <p>Every variant is an immutable record, so trees can be shared freely and
 * compared structurally. Dispatch over the variants goes through
 * {@link #accept}.
 *
 * @author Alec Theriault
 */
public interface Expr {

  <R> R accept(ExprVisitor<R> visitor);

  /**
   * Render the expression back into pattern syntax.
   *
   * <p>The output matches the same strings and numbers its capture groups the
   * same way, but need not be the text the tree was parsed from.
   *
   * @return pattern source
   */
  default String toRegex() {
    final var builder = new StringBuilder();
    accept(new ExprPrinter(builder));
    return builder.toString();
  }

  /**
   * Empty expression, matching only the empty string.
   */
  record Empty() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitEmpty(this);
    }
  }

  /**
   * Any single character.
   *
   * @param newline whether newline characters match too
   */
  record Any(boolean newline) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitAny(this);
    }
  }

  /**
   * Start of the input.
   */
  record StartText() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitStartText(this);
    }
  }

  /**
   * End of the input.
   */
  record EndText() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitEndText(this);
    }
  }

  /**
   * Start of a line (or of the input).
   */
  record StartLine() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitStartLine(this);
    }
  }

  /**
   * End of a line (or of the input).
   */
  record EndLine() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitEndLine(this);
    }
  }

  /**
   * Literal text.
   *
   * <p>The parser emits one node per code point, so multi-character literals
   * show up as a {@link Concat} of literals.
   *
   * @param value text to match
   * @param casei whether the match is case insensitive
   */
  record Literal(String value, boolean casei) implements Expr {
    public Literal {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /**
   * Sequence of expressions, matched one after another.
   *
   * @param children expressions in match order
   */
  record Concat(List<Expr> children) implements Expr {
    public Concat {
      children = List.copyOf(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitConcat(this);
    }
  }

  /**
   * Ordered choice between expressions.
   *
   * <p>Branches are tried left to right, so this is not symmetric: when
   * several branches match, the leftmost one wins.
   *
   * @param children branches in priority order
   */
  record Alt(List<Expr> children) implements Expr {
    public Alt {
      children = List.copyOf(children);
      if (children.isEmpty()) {
        throw new IllegalArgumentException("Alternation needs at least one branch");
      }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitAlt(this);
    }
  }

  /**
   * Capturing group.
   *
   * <p>The group's index is not stored: it is the number of groups opened
   * before this one in a pre-order walk of the whole tree.
   *
   * @param child group body
   */
  record Group(Expr child) implements Expr {
    public Group {
      Objects.requireNonNull(child, "child");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitGroup(this);
    }
  }

  /**
   * Zero-width lookahead or lookbehind assertion.
   *
   * @param child asserted expression
   * @param kind direction and polarity
   */
  record LookAround(Expr child, LookAroundKind kind) implements Expr {
    public LookAround {
      Objects.requireNonNull(child, "child");
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitLookAround(this);
    }
  }

  /**
   * Bounded or unbounded repetition.
   *
   * @param child repeated expression
   * @param lo minimum (inclusive) number of repetitions
   * @param hi maximum (inclusive) number of repetitions, or {@link #UNBOUNDED}
   * @param greedy whether to prioritize a longer vs. shorter match
   */
  record Repeat(Expr child, int lo, int hi, boolean greedy) implements Expr {

    /**
     * Upper bound of a repetition with no upper bound.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public Repeat {
      Objects.requireNonNull(child, "child");
      if (lo < 0 || hi < lo) {
        throw new IllegalArgumentException("Invalid repetition bounds {" + lo + "," + hi + "}");
      }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitRepeat(this);
    }
  }

  /**
   * Opaque atom handed to the underlying engine as-is.
   *
   * <p>Used for character classes and for zero-width assertions that are not
   * otherwise represented.
   *
   * @param inner pattern source of the atom
   * @param size fixed number of characters the atom matches
   * @param casei whether the match is case insensitive
   */
  record Delegate(String inner, int size, boolean casei) implements Expr {
    public Delegate {
      Objects.requireNonNull(inner, "inner");
      if (size < 0) {
        throw new IllegalArgumentException("Negative delegate size " + size);
      }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitDelegate(this);
    }
  }

  /**
   * Backreference to the text captured by a group.
   *
   * @param group index of the referenced group
   */
  record Backref(int group) implements Expr {
    public Backref {
      if (group < 0) {
        throw new IllegalArgumentException("Negative group index " + group);
      }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitBackref(this);
    }
  }

  /**
   * Group that is never re-entered by backtracking once it has matched.
   *
   * @param child group body
   */
  record AtomicGroup(Expr child) implements Expr {
    public AtomicGroup {
      Objects.requireNonNull(child, "child");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitAtomicGroup(this);
    }
  }
}
