package backtrack.parser;

/**
 * Top-down traversal of an explicit {@link Expr} tree.
 *
 * <p>Unlike {@link RegexVisitor}, which receives already-visited children,
 * implementations decide for themselves when (and whether) to descend into
 * children. There is one method per variant, so every visitor covers every
 * kind of node.
 *
 * @param <R> output from visiting a node
 */
public interface ExprVisitor<R> {

  R visitEmpty(Expr.Empty empty);

  R visitAny(Expr.Any any);

  R visitStartText(Expr.StartText startText);

  R visitEndText(Expr.EndText endText);

  R visitStartLine(Expr.StartLine startLine);

  R visitEndLine(Expr.EndLine endLine);

  R visitLiteral(Expr.Literal literal);

  R visitConcat(Expr.Concat concat);

  R visitAlt(Expr.Alt alt);

  R visitGroup(Expr.Group group);

  R visitLookAround(Expr.LookAround lookAround);

  R visitRepeat(Expr.Repeat repeat);

  R visitDelegate(Expr.Delegate delegate);

  R visitBackref(Expr.Backref backref);

  R visitAtomicGroup(Expr.AtomicGroup atomicGroup);
}
