package backtrack.parser;

import java.util.List;
import java.util.OptionalInt;

/**
 * Bottom-up traversal of the regular expression pattern AST.
 *
 * @param <R> output from traversing the regex pattern AST
 */
public interface RegexVisitor<R> {

  /**
   * Empty expression, matching only the empty string.
   */
  R visitEpsilon();

  /**
   * Matches a single abstract character.
   *
   * @param codePoint unicode code point to match
   * @param flags bitmask of regular expression flags
   */
  R visitCharacter(int codePoint, int flags);

  /**
   * Matches any character ({@code .}).
   *
   * @param flags bitmask of regular expression flags
   */
  R visitAny(int flags);

  /**
   * Matches an atom whose semantics are left to the underlying engine, such
   * as a bracketed character class or {@code \d}.
   *
   * @param inner pattern source of the atom
   * @param size number of characters the atom always matches
   * @param flags bitmask of regular expression flags
   */
  R visitDelegate(String inner, int size, int flags);

  /**
   * Matches a sequence of patterns.
   *
   * @param sequence patterns to match one after another (at least two)
   */
  R visitConcatenation(List<R> sequence);

  /**
   * Matches a union of patterns.
   *
   * This is not a symmetric operation; if several branches match but they
   * have different capture-group effects, those of the leftmost branch will
   * be the ones taken in the match.
   *
   * @param branches patterns to try matching, in order (at least two)
   */
  R visitAlternation(List<R> branches);

  /**
   * Matches a pattern zero or more times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  R visitKleene(R lhs, boolean isLazy);

  /**
   * Matches a pattern zero or one times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize an empty vs. non-empty match
   */
  R visitOptional(R lhs, boolean isLazy);

  /**
   * Matches a pattern one or more times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  R visitPlus(R lhs, boolean isLazy);

  /**
   * Matches a pattern at least a certain number of times and possibly at most
   * another number of times.
   *
   * @param lhs pattern to match
   * @param atLeast minimum (inclusive) of times the pattern must match
   * @param atMost maximum (inclusive) of time the pattern must match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  R visitRepetition(R lhs, int atLeast, OptionalInt atMost, boolean isLazy);

  /**
   * Matches a parenthesized pattern.
   *
   * @param arg parenthesized body
   * @param groupIndex if set, the group is capturing with this capture index
   */
  R visitGroup(R arg, OptionalInt groupIndex);

  /**
   * Asserts (without consuming input) that a pattern does or doesn't match
   * ahead of or behind the current position.
   *
   * @param arg asserted pattern
   * @param kind direction and polarity of the assertion
   */
  R visitLookAround(R arg, LookAroundKind kind);

  /**
   * Matches a pattern, then commits to that match.
   *
   * @param arg body of the atomic group
   */
  R visitAtomicGroup(R arg);

  /**
   * Matches the same text most recently captured by a group.
   *
   * @param groupIndex capture index of the referenced group
   */
  R visitBackreference(int groupIndex);

  /**
   * Matches a (zero-width) boundary pattern
   *
   * @param boundary which boundary to match
   * @param flags bitmask of regular expression flags
   */
  R visitBoundary(Boundary boundary, int flags);
}
