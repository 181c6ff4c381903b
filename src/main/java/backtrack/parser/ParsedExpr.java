package backtrack.parser;

import java.util.BitSet;
import java.util.Objects;

/**
 * Output of parsing a pattern into an explicit AST.
 *
 * @param pattern source of the pattern
 * @param expr root of the AST
 * @param backrefs indices of groups that are the target of a backreference
 * @param groupCount number of capture groups opened in the pattern
 */
public record ParsedExpr(
  String pattern,
  Expr expr,
  BitSet backrefs,
  int groupCount
) {

  public ParsedExpr {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(expr, "expr");
    backrefs = (BitSet) backrefs.clone();
  }

  /**
   * Indices of groups that are the target of a backreference.
   *
   * @return fresh copy of the set
   */
  @Override
  public BitSet backrefs() {
    return (BitSet) backrefs.clone();
  }
}
