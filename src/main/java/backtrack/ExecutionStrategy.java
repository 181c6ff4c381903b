package backtrack;

/**
 * How a pattern should be executed, given what the analysis found out.
 */
public enum ExecutionStrategy {
  /**
   * The whole pattern is one case sensitive string: use a substring search.
   */
  LITERAL,

  /**
   * Nothing in the pattern needs backtracking: use a finite automaton.
   */
  AUTOMATON,

  /**
   * Some part of the pattern needs backtracking (backreferences, lookaround,
   * atomic groups, or groups that are backreferenced).
   */
  BACKTRACKING
}
