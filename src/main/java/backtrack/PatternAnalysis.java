package backtrack;

import backtrack.analysis.AnalyzedExpr;
import backtrack.analysis.Analyzer;
import backtrack.analysis.InvalidBackrefException;
import backtrack.analysis.LiteralDetector;
import backtrack.parser.Expr;
import backtrack.parser.ParsedExpr;
import backtrack.parser.RegexParser;
import java.util.BitSet;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed and analyzed regular expression pattern.
 *
 * <p>This bundles the expression tree, the facts computed about every one of
 * its nodes, and the execution strategy those facts call for. Instances are
 * immutable.
 *
 * @author Alec Theriault
 */
public final class PatternAnalysis {

  private static final Logger log = LoggerFactory.getLogger(PatternAnalysis.class);

  private final ParsedExpr parsed;
  private final AnalyzedExpr root;
  private final Optional<String> literal;

  private PatternAnalysis(ParsedExpr parsed, AnalyzedExpr root) {
    this.parsed = parsed;
    this.root = root;
    this.literal = LiteralDetector.literal(root);
  }

  /**
   * Parse and analyze a pattern.
   *
   * @param pattern source of the pattern
   * @return analyzed pattern
   * @throws PatternSyntaxException if the pattern does not parse
   * @throws InvalidBackrefException if a backreference precedes its group
   */
  public static PatternAnalysis of(String pattern)
  throws PatternSyntaxException, InvalidBackrefException {
    return of(pattern, 0, false);
  }

  /**
   * Parse and analyze a pattern.
   *
   * @param pattern source of the pattern
   * @param flags bitmask of {@link java.util.regex.Pattern} flags
   * @return analyzed pattern
   * @throws PatternSyntaxException if the pattern does not parse
   * @throws InvalidBackrefException if a backreference precedes its group
   */
  public static PatternAnalysis of(String pattern, int flags)
  throws PatternSyntaxException, InvalidBackrefException {
    return of(pattern, flags, false);
  }

  /**
   * Parse and analyze a pattern.
   *
   * @param pattern source of the pattern
   * @param flags bitmask of {@link java.util.regex.Pattern} flags
   * @param wrappingGroup wrap the whole pattern in an implicit group 0
   * @return analyzed pattern
   * @throws PatternSyntaxException if the pattern does not parse
   * @throws InvalidBackrefException if a backreference precedes its group
   */
  public static PatternAnalysis of(String pattern, int flags, boolean wrappingGroup)
  throws PatternSyntaxException, InvalidBackrefException {
    final ParsedExpr parsed = RegexParser.parseExpr(pattern, flags, wrappingGroup);
    final var analysis = new PatternAnalysis(parsed, Analyzer.analyze(parsed.expr(), parsed.backrefs()));
    log.debug("Pattern /{}/ will use strategy {}", pattern, analysis.strategy());
    return analysis;
  }

  /**
   * Returns initial regular expression from which the analysis was derived.
   *
   * @return source of the pattern
   */
  public String pattern() {
    return parsed.pattern();
  }

  public Expr expr() {
    return parsed.expr();
  }

  /**
   * Facts about the whole pattern (and, through its children, every subtree).
   */
  public AnalyzedExpr root() {
    return root;
  }

  /**
   * Indices of the groups that are the target of some backreference.
   *
   * @return fresh copy of the set
   */
  public BitSet backrefs() {
    return parsed.backrefs();
  }

  /**
   * Compute the number of groups in the pattern.
   *
   * @return number of capture groups in the pattern
   */
  public int groupCount() {
    return root.endGroup();
  }

  /**
   * Whole-pattern literal, if the pattern is one.
   */
  public Optional<String> literal() {
    return literal;
  }

  /**
   * Literal text every match starts with (possibly empty).
   */
  public String literalPrefix() {
    return LiteralDetector.literalPrefix(root);
  }

  public ExecutionStrategy strategy() {
    if (literal.isPresent()) {
      return ExecutionStrategy.LITERAL;
    } else if (root.hard()) {
      return ExecutionStrategy.BACKTRACKING;
    } else {
      return ExecutionStrategy.AUTOMATON;
    }
  }

  @Override
  public String toString() {
    return "PatternAnalysis(" + pattern() + ")";
  }
}
