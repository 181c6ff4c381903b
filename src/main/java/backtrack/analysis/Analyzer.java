package backtrack.analysis;

import backtrack.parser.Expr;
import backtrack.parser.ExprVisitor;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single pass over an expression tree computing the facts needed to pick an
 * execution strategy.
 *
 * <p>Nodes are visited exactly once, in pre-order from left to right. The
 * only state carried between nodes is the index of the next capture group to
 * be opened: groups are numbered in the order they are entered, which is also
 * the numbering backreferences use.
 *
 * <p>An analyzer is used for a single tree and then discarded, so the
 * traversal never observes state from another analysis.
 *
 * @author Alec Theriault
 */
public final class Analyzer implements ExprVisitor<Analyzer.Facts> {

  private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

  /**
   * Facts about a node, before its group range is known.
   */
  record Facts(
    List<AnalyzedExpr> children,
    int minSize,
    boolean constSize,
    boolean hard,
    boolean looksLeft
  ) {

    static Facts leaf(int minSize, boolean constSize, boolean hard, boolean looksLeft) {
      return new Facts(List.of(), minSize, constSize, hard, looksLeft);
    }
  }

  // Groups that are the target of some backreference
  private final BitSet backrefs;

  // Index of the next group to be opened
  private int groupIx = 0;

  private Analyzer(BitSet backrefs) {
    this.backrefs = backrefs;
  }

  /**
   * Analyze an expression tree.
   *
   * @param expr root of the tree
   * @param backrefs indices of groups that are the target of some backreference
   * @return annotated tree, with the same shape as the expression tree
   * @throws InvalidBackrefException if a backreference precedes its group
   */
  public static AnalyzedExpr analyze(Expr expr, BitSet backrefs) throws InvalidBackrefException {
    final var analyzer = new Analyzer((BitSet) backrefs.clone());
    final AnalyzedExpr analyzed;
    try {
      analyzed = analyzer.visit(expr);
    } catch (InvalidBackrefException err) {
      log.debug("Rejected expression: {}", err.getMessage());
      throw err;
    }

    log.debug(
      "Analyzed expression: groups={} minSize={} constSize={} hard={} looksLeft={}",
      analyzed.endGroup(),
      analyzed.minSize(),
      analyzed.constSize(),
      analyzed.hard(),
      analyzed.looksLeft()
    );
    return analyzed;
  }

  private AnalyzedExpr visit(Expr expr) throws InvalidBackrefException {
    final int startGroup = groupIx;
    final Facts facts = expr.accept(this);
    final var analyzed = new AnalyzedExpr(
      expr,
      facts.children(),
      startGroup,
      groupIx,
      facts.minSize(),
      facts.constSize(),
      facts.hard(),
      facts.looksLeft()
    );
    if (log.isTraceEnabled()) {
      log.trace(
        "{}: groups=[{},{}) minSize={} constSize={} hard={} looksLeft={}",
        expr.getClass().getSimpleName(),
        startGroup,
        groupIx,
        analyzed.minSize(),
        analyzed.constSize(),
        analyzed.hard(),
        analyzed.looksLeft()
      );
    }
    return analyzed;
  }

  @Override
  public Facts visitEmpty(Expr.Empty empty) {
    return Facts.leaf(0, true, false, false);
  }

  @Override
  public Facts visitAny(Expr.Any any) {
    return Facts.leaf(1, true, false, false);
  }

  @Override
  public Facts visitStartText(Expr.StartText startText) {
    return Facts.leaf(0, true, false, true);
  }

  @Override
  public Facts visitEndText(Expr.EndText endText) {
    return Facts.leaf(0, true, false, false);
  }

  @Override
  public Facts visitStartLine(Expr.StartLine startLine) {
    return Facts.leaf(0, true, false, true);
  }

  @Override
  public Facts visitEndLine(Expr.EndLine endLine) {
    return Facts.leaf(0, true, false, false);
  }

  @Override
  public Facts visitLiteral(Expr.Literal literal) {
    // Each character of a literal is currently its own node
    return Facts.leaf(
      1,
      CaseFolding.literalConstSize(literal.value(), literal.casei()),
      false,
      false
    );
  }

  @Override
  public Facts visitConcat(Expr.Concat concat) {
    final var children = new ArrayList<AnalyzedExpr>(concat.children().size());
    int minSize = 0;
    boolean constSize = true;
    boolean hard = false;
    boolean looksLeft = false;

    for (Expr child : concat.children()) {
      final AnalyzedExpr analyzedChild = visit(child);

      // Only looks left if nothing can have been consumed before the child
      looksLeft |= analyzedChild.looksLeft() && minSize == 0;
      minSize = saturatedAdd(minSize, analyzedChild.minSize());
      constSize &= analyzedChild.constSize();
      hard |= analyzedChild.hard();
      children.add(analyzedChild);
    }

    return new Facts(children, minSize, constSize, hard, looksLeft);
  }

  @Override
  public Facts visitAlt(Expr.Alt alt) {
    final var children = new ArrayList<AnalyzedExpr>(alt.children().size());

    final AnalyzedExpr first = visit(alt.children().get(0));
    int minSize = first.minSize();
    boolean constSize = first.constSize();
    boolean hard = first.hard();
    boolean looksLeft = first.looksLeft();
    children.add(first);

    for (Expr child : alt.children().subList(1, alt.children().size())) {
      final AnalyzedExpr analyzedChild = visit(child);

      // Branches of different sizes make the alternation variable size
      constSize &= analyzedChild.constSize() && minSize == analyzedChild.minSize();
      minSize = Math.min(minSize, analyzedChild.minSize());
      hard |= analyzedChild.hard();
      looksLeft |= analyzedChild.looksLeft();
      children.add(analyzedChild);
    }

    return new Facts(children, minSize, constSize, hard, looksLeft);
  }

  @Override
  public Facts visitGroup(Expr.Group group) {
    // Allocated before descending, so nested groups get later indices
    final int groupIndex = groupIx++;
    final AnalyzedExpr child = visit(group.child());
    return new Facts(
      List.of(child),
      child.minSize(),
      child.constSize(),
      child.hard() || backrefs.get(groupIndex),
      child.looksLeft()
    );
  }

  @Override
  public Facts visitLookAround(Expr.LookAround lookAround) {
    final AnalyzedExpr child = visit(lookAround.child());
    return new Facts(List.of(child), 0, true, true, child.looksLeft());
  }

  @Override
  public Facts visitRepeat(Expr.Repeat repeat) {
    final AnalyzedExpr child = visit(repeat.child());
    return new Facts(
      List.of(child),
      saturatedMultiply(child.minSize(), repeat.lo()),
      child.constSize() && repeat.lo() == repeat.hi(),
      child.hard(),
      child.looksLeft()
    );
  }

  @Override
  public Facts visitDelegate(Expr.Delegate delegate) {
    // Conservative, since some zero width delegates (`\Z`) only look right
    return Facts.leaf(delegate.size(), true, false, delegate.size() == 0);
  }

  @Override
  public Facts visitBackref(Expr.Backref backref) throws InvalidBackrefException {
    if (backref.group() >= groupIx) {
      throw new InvalidBackrefException(backref.group(), groupIx);
    }
    return Facts.leaf(0, false, true, false);
  }

  @Override
  public Facts visitAtomicGroup(Expr.AtomicGroup atomicGroup) {
    final AnalyzedExpr child = visit(atomicGroup.child());

    // TODO: only hard if the child is, once the automaton can commit to a match
    return new Facts(List.of(child), child.minSize(), child.constSize(), true, child.looksLeft());
  }

  private static int saturatedAdd(int lhs, int rhs) {
    return (int) Math.min((long) lhs + rhs, Integer.MAX_VALUE);
  }

  private static int saturatedMultiply(int lhs, int rhs) {
    return (int) Math.min((long) lhs * rhs, Integer.MAX_VALUE);
  }
}
