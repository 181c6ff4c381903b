package backtrack.parser;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Regex AST visitor which builds up the explicit {@link Expr} tree.
 *
 * <p>Flags are resolved here: case insensitivity is pushed down onto the
 * literals and delegates it applies to, while multiline and dotall mode pick
 * which anchors and wildcards get built.
 *
 * @author Alec Theriault
 */
public class ExprBuilder implements RegexVisitor<Expr> {

  private static boolean caseInsensitive(int flags) {
    return (flags & Pattern.CASE_INSENSITIVE) != 0;
  }

  @Override
  public Expr visitEpsilon() {
    return new Expr.Empty();
  }

  @Override
  public Expr visitCharacter(int codePoint, int flags) {
    return new Expr.Literal(Character.toString(codePoint), caseInsensitive(flags));
  }

  @Override
  public Expr visitAny(int flags) {
    return new Expr.Any((flags & Pattern.DOTALL) != 0);
  }

  @Override
  public Expr visitDelegate(String inner, int size, int flags) {
    return new Expr.Delegate(inner, size, caseInsensitive(flags));
  }

  @Override
  public Expr visitConcatenation(List<Expr> sequence) {
    return new Expr.Concat(sequence);
  }

  @Override
  public Expr visitAlternation(List<Expr> branches) {
    return new Expr.Alt(branches);
  }

  @Override
  public Expr visitKleene(Expr lhs, boolean isLazy) {
    return new Expr.Repeat(lhs, 0, Expr.Repeat.UNBOUNDED, !isLazy);
  }

  @Override
  public Expr visitOptional(Expr lhs, boolean isLazy) {
    return new Expr.Repeat(lhs, 0, 1, !isLazy);
  }

  @Override
  public Expr visitPlus(Expr lhs, boolean isLazy) {
    return new Expr.Repeat(lhs, 1, Expr.Repeat.UNBOUNDED, !isLazy);
  }

  @Override
  public Expr visitRepetition(Expr lhs, int atLeast, OptionalInt atMost, boolean isLazy) {
    return new Expr.Repeat(lhs, atLeast, atMost.orElse(Expr.Repeat.UNBOUNDED), !isLazy);
  }

  @Override
  public Expr visitGroup(Expr arg, OptionalInt groupIndex) {
    // Group indices are implicit in the tree's shape
    return groupIndex.isPresent() ? new Expr.Group(arg) : arg;
  }

  @Override
  public Expr visitLookAround(Expr arg, LookAroundKind kind) {
    return new Expr.LookAround(arg, kind);
  }

  @Override
  public Expr visitAtomicGroup(Expr arg) {
    return new Expr.AtomicGroup(arg);
  }

  @Override
  public Expr visitBackreference(int groupIndex) {
    return new Expr.Backref(groupIndex);
  }

  @Override
  public Expr visitBoundary(Boundary boundary, int flags) {
    final boolean multiline = (flags & Pattern.MULTILINE) != 0;
    switch (boundary) {
      case BEGINNING_OF_LINE:
        return multiline ? new Expr.StartLine() : new Expr.StartText();
      case END_OF_LINE:
        return multiline ? new Expr.EndLine() : new Expr.EndText();
      case BEGINNING_OF_INPUT:
        return new Expr.StartText();
      case END_OF_INPUT:
        return new Expr.EndText();
      default:
        return new Expr.Delegate(boundary.source, 0, false);
    }
  }
}
