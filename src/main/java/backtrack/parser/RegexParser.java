package backtrack.parser;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for regular expressions with backtracking extensions.
 *
 * This is a fairly standard recursive descent parser. The only more
 * interesting bit is that the results are made available through a visitor
 * instead of as an explicit AST type (use {@link ExprBuilder} to get an
 * explicit {@link Expr} tree).
 *
 * <p>Capture groups are numbered in the order their opening parentheses
 * appear, starting from 0 (or 1 if there is a wrapping group). Backreferences
 * use the same numbering. Character classes and class escapes are not
 * interpreted: their source is handed to the visitor as a delegate.
 *
 * @author Alec Theriault
 */
public final class RegexParser<A> {

  // Used when "visiting" the AST bottom up
  final private RegexVisitor<A> visitor;

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;
  private int groupCount = 0;

  // Groups that are the target of some backreference
  private final BitSet backrefs = new BitSet();

  // Bit-flag of flags
  private int regexFlags = 0;

  /**
   * Parse a regular expression pattern from an input string.
   *
   * The regex visitor can be used to either process the AST incrementally or
   * else build up an explicit AST.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression pattern
   * @param flags bitmask of match flags
   * @param wrappingGroup is there an implicit outer group wrapping the regex
   * @return parsed regular expression
   */
  public static<B> B parse(
    RegexVisitor<B> visitor,
    String input,
    int flags,
    boolean wrappingGroup
  ) throws PatternSyntaxException {
    return new RegexParser<B>(visitor, input, flags).parseTopLevel(wrappingGroup);
  }

  /**
   * Parse a regular expression pattern into an explicit AST.
   *
   * @param input regular expression pattern
   * @param flags bitmask of match flags
   * @param wrappingGroup is there an implicit outer group wrapping the regex
   * @return parsed AST, along with group information
   */
  public static ParsedExpr parseExpr(
    String input,
    int flags,
    boolean wrappingGroup
  ) throws PatternSyntaxException {
    final var parser = new RegexParser<Expr>(new ExprBuilder(), input, flags);
    final Expr expr = parser.parseTopLevel(wrappingGroup);
    return new ParsedExpr(input, expr, parser.backrefs, parser.groupCount);
  }

  /**
   * Parse a regular expression pattern into an explicit AST, without any
   * flags or wrapping group.
   *
   * @param input regular expression pattern
   * @return parsed AST, along with group information
   */
  public static ParsedExpr parseExpr(String input) throws PatternSyntaxException {
    return parseExpr(input, 0, false);
  }

  private RegexParser(RegexVisitor<A> visitor, String input, int regexFlags) {
    this.visitor = visitor;
    this.input = input;
    this.regexFlags = regexFlags;
    this.length = input.length();
  }

  private A parseTopLevel(boolean wrappingGroup) throws PatternSyntaxException {
    final OptionalInt wrappingGroupIdx = wrappingGroup
      ? OptionalInt.of(groupCount++)
      : OptionalInt.empty();

    // Parse the actual expression
    A parsed;
    if (checkFlags(Pattern.LITERAL)) {
      // The whole input is matched as-is, `\E` included
      regexFlags &= ~Pattern.LITERAL;
      parsed = literalSequence(input);
      position = length;
    } else {
      parsed = parseAlternation();
    }
    final int trailing = peekChar();
    if (trailing != -1) {
      throw (trailing == ')')
        ? error("Unmatched closing `)`")
        : error("Expected the end of the regular expression");
    }

    // Add a wrapping group
    if (wrappingGroup) {
      parsed = visitor.visitGroup(parsed, wrappingGroupIdx);
    }
    return parsed;
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private PatternSyntaxException error(String message, int position) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(UnsupportedPatternSyntaxException.Feature feature) {
    return new UnsupportedPatternSyntaxException(feature, input, position);
  }

  /**
   * Check if certain regex flags are enabled.
   *
   * @param flags bit mask of the flags to check
   * @return whether the flags are enabled
   */
  private boolean checkFlags(int flags) {
    return (regexFlags & flags) != 0;
  }

  /**
   * Advance the cursor past any whitespace or comments.
   */
  private void skipSpaceAndComments() {
    if (!checkFlags(Pattern.COMMENTS)) return;
    while (position < length) {
      int codePoint = input.codePointAt(position);
      if (codePoint == '#') {
        position++;
        advancePastComment();
      } else if (!Character.isWhitespace(codePoint)) {
        break;
      } else {
        position += Character.charCount(codePoint);
      }
    }
  }

  /**
   * Advance the cursor past a line comment.
   */
  private void advancePastComment() {
    while (position < length) {
      int ch = input.charAt(position);
      position++;

      if (ch == '\n') {
        return;
      }

      // Unix lines mode means _only_ `\n` is a newline
      if (!checkFlags(Pattern.UNIX_LINES) &&
          (ch == '\r' || ch == '\u2028' || ch == '\u2029' || ch == '\u0085')) {
        return;
      }
    }
  }

  /**
   * Peek the next character in the input without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  int peekChar() {
    skipSpaceAndComments();
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Skip over the next character.
   */
  void skipChar() {
    skipSpaceAndComments();
    position++;
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    skipSpaceAndComments();
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Parse an alternation.
   */
  private A parseAlternation() throws PatternSyntaxException {
    final List<A> branches = new ArrayList<>();
    branches.add(parseConcatenation());
    while (nextCharIf('|')) {
      branches.add(parseConcatenation());
    }
    return (branches.size() == 1) ? branches.get(0) : visitor.visitAlternation(branches);
  }

  /**
   * Parse a concatenation.
   */
  private A parseConcatenation() throws PatternSyntaxException {
    final List<A> sequence = new ArrayList<>();

    // Keep parsing concatenations until a lower priority construct is encountered
    int c;
    while ((c = peekChar()) != -1) {
      if (c == ')' || c == '|') break;

      // A quantifier after `\Q...\E` only applies to the last quoted character
      if (c == '\\' && position + 1 < length && input.charAt(position + 1) == 'Q') {
        position += 2;
        final int[] quoted = parseLiteralString().codePoints().toArray();
        for (int i = 0; i < quoted.length; i++) {
          final A character = visitor.visitCharacter(quoted[i], regexFlags);
          sequence.add(i == quoted.length - 1 ? parseQuantifiers(character) : character);
        }
        continue;
      }

      final A quantified = parseQuantified();
      if (quantified != null) {
        sequence.add(quantified);
      }
    }

    switch (sequence.size()) {
      case 0:
        return visitor.visitEpsilon();
      case 1:
        return sequence.get(0);
      default:
        return visitor.visitConcatenation(sequence);
    }
  }

  /**
   * Parse a quantified repetition.
   *
   * Called on non-empty input.
   *
   * @return quantified atom, or {@code null} for an inline flag directive
   */
  private A parseQuantified() throws PatternSyntaxException {
    final A atom = parseAtom();
    return (atom == null) ? null : parseQuantifiers(atom);
  }

  /**
   * Parse any quantifiers following an atom.
   *
   * @param quantified atom to which the quantifiers apply
   * @return quantified atom
   */
  private A parseQuantifiers(A quantified) throws PatternSyntaxException {

    // Used for repetitions
    int atLeast = 0;
    OptionalInt atMost = OptionalInt.empty();

    int c;
    postfix_parsing:
    while ((c = peekChar()) != -1) {

      // Pass over the quanitifier stem
      switch (c) {
        case '*':
        case '?':
        case '+':
          skipChar();
          break;

        case '{':
          int openBracePosition = position;
          skipChar();
          // Parse `atLeast`
          atLeast = parseDecimalInteger();

          // Parse `atMost`
          if (nextCharIf(',')) {
            if (peekChar() != '}') {
              atMost = OptionalInt.of(parseDecimalInteger());
            } else {
              atMost = OptionalInt.empty();
            }
          } else {
            atMost = OptionalInt.of(atLeast);
          }

          // Close repetition
          if (!nextCharIf('}')) {
            throw error("Expected `}` to close repetition (opened at " + openBracePosition + ")");
          }
          if (atMost.isPresent() && atMost.getAsInt() < atLeast) {
            throw error("Illegal repetition range", openBracePosition);
          }
          break;

        default:
          break postfix_parsing;
      }

      // `?` suffix indicates the quantifier is lazy (reluctant) instead of being greedy
      boolean isLazy = false;
      if (nextCharIf('?')) {
        isLazy = true;
      } else if (peekChar() == '+') {
        throw unsupported(UnsupportedPatternSyntaxException.Feature.POSSESSIVE_QUANTIFIERS);
      }

      // Visit the quantifier corresponding to the initial character
      switch (c) {
        case '*':
          quantified = visitor.visitKleene(quantified, isLazy);
          break;
        case '?':
          quantified = visitor.visitOptional(quantified, isLazy);
          break;
        case '+':
          quantified = visitor.visitPlus(quantified, isLazy);
          break;
        case '{':
          quantified = visitor.visitRepetition(quantified, atLeast, atMost, isLazy);
          break;
      }
    }

    return quantified;
  }

  /**
   * Parse an atom: a group, a character, a class or a zero-width assertion.
   *
   * Called on non-empty input.
   *
   * @return parsed atom, or {@code null} for an inline flag directive
   */
  private A parseAtom() throws PatternSyntaxException {

    switch (peekChar()) {
      case '(':
        return parseGroup();

      case '^':
        skipChar();
        return visitor.visitBoundary(Boundary.BEGINNING_OF_LINE, regexFlags);

      case '$':
        skipChar();
        return visitor.visitBoundary(Boundary.END_OF_LINE, regexFlags);

      case '.':
        skipChar();
        return visitor.visitAny(regexFlags);

      case '[':
        return visitor.visitDelegate(parseBracketClass(), 1, regexFlags);

      case '\\':
        return parseEscape();

      case '*':
      case '+':
      case '?':
        throw error("Dangling meta character `" + input.charAt(position) + "`");

      default:
        final int codePoint = input.codePointAt(position);
        position += Character.charCount(codePoint);
        return visitor.visitCharacter(codePoint, regexFlags);
    }
  }

  /**
   * Parse a parenthesized construct.
   *
   * Called when the next character is an open paren.
   *
   * @return parsed group, or {@code null} for an inline flag directive
   */
  private A parseGroup() throws PatternSyntaxException {

    // Track the open paren so we can use it in the error message
    final int openParenPosition = position;
    skipChar();

    // Flags to set back after the group is parsed
    final int stashedFlags = this.regexFlags;

    // Which construct does this paren open?
    boolean capture = true;
    boolean atomic = false;
    LookAroundKind lookAround = null;

    if (nextCharIf('?')) {
      capture = false;

      // We don't error if we reach the end because we'll anyways error on an unclosed group below
      switch (peekChar()) {
        case -1:
          break;

        case '=':
          skipChar();
          lookAround = LookAroundKind.LOOK_AHEAD;
          break;

        case '!':
          skipChar();
          lookAround = LookAroundKind.LOOK_AHEAD_NEG;
          break;

        case '>':
          skipChar();
          atomic = true;
          break;

        case '<':
          skipChar();
          if (nextCharIf('=')) {
            lookAround = LookAroundKind.LOOK_BEHIND;
          } else if (nextCharIf('!')) {
            lookAround = LookAroundKind.LOOK_BEHIND_NEG;
          } else {
            throw unsupported(UnsupportedPatternSyntaxException.Feature.NAMED_GROUPS);
          }
          break;

        default:
          // Parse out flags
          int flags = this.regexFlags | parseRegexFlags();
          if (nextCharIf('-')) {
            flags &= ~parseRegexFlags();
          }

          final int afterFlags = peekChar();
          if (afterFlags == ':') {
            skipChar();
            this.regexFlags = flags;
          } else if (afterFlags == ')') {
            // Flags stay set until the end of the enclosing group
            skipChar();
            this.regexFlags = flags;
            return null;
          } else if (afterFlags != -1) {
            throw error(
              "Invalid non-capturing group (expected colon or close paren for group opened at " + openParenPosition + ")"
            );
          }
      }
    }

    // If this a capture group, increment the group count
    final var groupIdx = (capture) ? OptionalInt.of(groupCount++) : OptionalInt.empty();

    // Parse the group body and ensure that it is closed
    final A union = parseAlternation();
    if (!nextCharIf(')')) {
      throw error(
        "Unclosed group (expected close paren for group opened at " + openParenPosition + ")"
      );
    }
    this.regexFlags = stashedFlags;

    if (lookAround != null) {
      return visitor.visitLookAround(union, lookAround);
    } else if (atomic) {
      return visitor.visitAtomicGroup(union);
    } else {
      return visitor.visitGroup(union, groupIdx);
    }
  }

  /**
   * Build the sequence of characters in a string, with no special meaning
   * given to any of them.
   *
   * @param literal characters to match
   * @return concatenation of the characters
   */
  private A literalSequence(String literal) {
    final List<A> characters = literal
      .codePoints()
      .mapToObj(cp -> visitor.visitCharacter(cp, regexFlags))
      .toList();

    switch (characters.size()) {
      case 0:
        return visitor.visitEpsilon();
      case 1:
        return characters.get(0);
      default:
        return visitor.visitConcatenation(characters);
    }
  }

  /**
   * Parse an escape outside of a character class.
   *
   * Called when the next character is a backslash.
   */
  private A parseEscape() throws PatternSyntaxException {
    final int escapePosition = position;
    skipChar();

    // NB: not `nextChar` since `\\ ` or `\\#` are escapes even in comment mode
    if (position >= length) {
      throw error("Pattern may not end with backslash");
    }
    final char c = input.charAt(position);

    // Boundaries
    final var boundary = Boundary.CHARACTERS.get(c);
    if (boundary != null) {
      position++;
      return visitor.visitBoundary(boundary, regexFlags);
    }

    switch (c) {
      // Back-references
      case '0':
      case '1':
      case '2':
      case '3':
      case '4':
      case '5':
      case '6':
      case '7':
      case '8':
      case '9':
        final int groupIndex = parseBackreferenceIndex();
        backrefs.set(groupIndex);
        return visitor.visitBackreference(groupIndex);

      case 'k':
        throw unsupported(UnsupportedPatternSyntaxException.Feature.NAMED_BACKREFERENCES);

      // Character classes
      case 'd':
      case 'D':
      case 'h':
      case 'H':
      case 's':
      case 'S':
      case 'v':
      case 'V':
      case 'w':
      case 'W':
        position++;
        return visitor.visitDelegate(input.substring(escapePosition, position), 1, regexFlags);

      // Properties
      case 'p':
      case 'P':
        position++;
        if (position >= length) {
          throw error("Expected property name but got end of regex");
        } else if (input.charAt(position) == '{') {
          final int endProperty = input.indexOf('}', position);
          if (endProperty == -1) {
            throw error("Expected `}` but got end of regex");
          }
          position = endProperty + 1;
        } else {
          position++;
        }
        return visitor.visitDelegate(input.substring(escapePosition, position), 1, regexFlags);

      default:
        return visitor.visitCharacter(parseEscapedCodePoint(), regexFlags);
    }
  }

  /**
   * Parse the decimal index of a backreference.
   *
   * All consecutive digits are consumed. Called when the next character is a
   * decimal digit.
   */
  private int parseBackreferenceIndex() throws PatternSyntaxException {
    final int startPosition = position;
    long index = 0;
    while (position < length) {
      final int d = Character.digit(input.charAt(position), 10);
      if (d < 0) {
        break;
      }
      index = 10 * index + d;
      if (index > Integer.MAX_VALUE) {
        throw error("Backreference group index overflowed", startPosition);
      }
      position++;
    }
    return (int) index;
  }

  /**
   * Parse the code point of an escaped character.
   *
   * Called with the position just after the backslash.
   *
   * @return escaped code point
   */
  private int parseEscapedCodePoint() throws PatternSyntaxException {
    int codePoint;
    final char c = input.charAt(position);

    switch (c) {
      case '\\':
      case '.':
      case '+':
      case '*':
      case '?':
      case '(':
      case ')':
      case '|':
      case '[':
      case ']':
      case '{':
      case '}':
      case '^':
      case '$':
      case '-':
        position++;
        return c;

      // Bell character
      case 'a':
        position++;
        return '\u0007';

      // Escape character
      case 'e':
        position++;
        return '\u001B';

      // Form-feed
      case 'f':
        position++;
        return '\f';

      // Tab
      case 't':
        position++;
        return '\t';

      // Newline
      case 'n':
        position++;
        return '\n';

      // Carriage return
      case 'r':
        position++;
        return '\r';

      // Control character
      case 'c':
        position++;

        if (position >= length) {
          throw error("Expected control character escape but got end of regex");
        }
        final char control = input.charAt(position);
        if (32 <= control && control <= 127) {
          position++;
          return control ^ 64;
        } else {
          throw error("Expected control escape letter in printable ASCII range");
        }

      // Hexadecimal escape `\xhh` or `\x{h...h}`
      case 'x':
        position++;

        if (position >= length) {
          throw error("Expected hexadecimal escape but got end of regex");
        } else if (input.charAt(position) == '{') {
          position++;

          // Loop over hex characters
          codePoint = 0;
          while (position < length) {
            if (input.charAt(position) == '}') {
              position++;
              return codePoint;
            }

            codePoint = (codePoint << 4) | parseHexadecimalCharacter();
            if (codePoint < Character.MIN_CODE_POINT || codePoint > Character.MAX_CODE_POINT) {
              throw error("Hexadecimal escape overflowed max code point");
            }
          }
          throw error("Expected `}` but got end of regex");
        } else {
          codePoint = parseHexadecimalCharacter();
          codePoint = (codePoint << 4) | parseHexadecimalCharacter();
          return codePoint;
        }

      // Hexadecimal escape `\\uhhhh`
      case 'u':
        position++;
        codePoint = parseHexadecimalCharacter();
        codePoint = (codePoint << 4) | parseHexadecimalCharacter();
        codePoint = (codePoint << 4) | parseHexadecimalCharacter();
        codePoint = (codePoint << 4) | parseHexadecimalCharacter();
        return codePoint;

      // Code point by name
      case 'N':
        position++;

        if (position >= length || input.charAt(position) != '{') {
          throw error("Expected `{`");
        }
        position++;

        final int endName = input.indexOf("}", position);
        if (endName == -1) {
          throw error("Expected `}` but got end of regex");
        }
        try {
          codePoint = Character.codePointOf(input.substring(position, endName));
        } catch (IllegalArgumentException err) {
          throw error("Unknown character name: " + input.substring(position, endName));
        }
        position = endName + 1;
        return codePoint;

      default:
        if (Character.isLetter(c) && c < 128) {
          throw error("Unknown escape sequence: " + c);
        } else {
          codePoint = input.codePointAt(position);
          position += Character.charCount(codePoint);
          return codePoint;
        }
    }
  }

  /**
   * Parse a bracket-delimited character class.
   *
   * The class is not interpreted, only delimited: nested classes, escapes and
   * {@code \Q...\E} quoting are skipped over so that the right closing
   * bracket is found.
   *
   * Called when the next character is an open bracket.
   *
   * @return source of the class, brackets included
   */
  private String parseBracketClass() throws PatternSyntaxException {

    // Track the open bracket so we can use it in the error message
    final int openBracketPosition = position;
    position++;

    if (position < length && input.charAt(position) == '^') {
      position++;
    }
    if (position < length && input.charAt(position) == ']') {
      throw error("Empty character class");
    }

    int depth = 1;
    while (position < length) {
      final char c = input.charAt(position);
      switch (c) {
        case '\\':
          if (position + 1 < length && input.charAt(position + 1) == 'Q') {
            final int endQuote = input.indexOf("\\E", position + 2);
            position = (endQuote == -1) ? length : endQuote + 2;
          } else {
            position += 2;
          }
          break;

        case '[':
          depth++;
          position++;
          break;

        case ']':
          depth--;
          position++;
          if (depth == 0) {
            return input.substring(openBracketPosition, position);
          }
          break;

        default:
          position++;
      }
    }

    throw error(
      "Unclosed character class (expected close to bracket opened at " + openBracketPosition + ")",
      openBracketPosition
    );
  }

  /**
   * Parse a literal up to a possible {@code \\E}.
   *
   * @return string inside the literal section
   */
  private String parseLiteralString() {
    final String END_LITERAL = "\\E";

    // Figure out where the literal sequence ends
    final String literal;
    final int endIndex = input.indexOf(END_LITERAL, position);
    if (endIndex == -1) {
      literal = input.substring(position);
      position = input.length();
    } else {
      literal = input.substring(position, endIndex);
      position = endIndex + END_LITERAL.length();
    }

    return literal;
  }

  /**
   * Parse a hexadecimal character from the input.
   */
  private int parseHexadecimalCharacter() throws PatternSyntaxException {
    final int h = (position < length) ? Character.digit(input.charAt(position), 16) : -1;
    if (h < 0) {
      throw error("Expected a hexadecimal character");
    } else {
      position++;
      return h;
    }
  }

  /**
   * Parse a non-empty non-negative decimal integer from the input
   */
  private int parseDecimalInteger() throws PatternSyntaxException {
    long integer = 0;
    int digits = 0;
    int peekedChar;

    while ((peekedChar = peekChar()) != -1) {
      // Try to read another decimal character
      final int d = Character.digit(peekedChar, 10);
      if (d < 0) {
        break;
      }

      // Increment the number
      integer = 10 * integer + d;
      if (integer > Integer.MAX_VALUE) {
        throw error("Decimal integer overflowed");
      }
      digits++;
      skipChar();
    }

    if (digits == 0) {
      throw error("Expected a decimal integer");
    }
    return (int) integer;
  }

  /**
   * Parse (regex) flags from the input.
   */
  private int parseRegexFlags() {
    int flags = 0;

    int peekedChar;
    flag_parsing:
    while ((peekedChar = peekChar()) != -1) {
      switch (peekedChar) {
        case 'i':
          flags |= Pattern.CASE_INSENSITIVE;
          break;

        case 'm':
          flags |= Pattern.MULTILINE;
          break;

        case 's':
          flags |= Pattern.DOTALL;
          break;

        case 'd':
          flags |= Pattern.UNIX_LINES;
          break;

        case 'u':
          flags |= Pattern.UNICODE_CASE;
          break;

        case 'x':
          flags |= Pattern.COMMENTS;
          break;

        case 'U':
          flags |= Pattern.UNICODE_CHARACTER_CLASS;
          flags |= Pattern.UNICODE_CASE;
          break;

        default:
          break flag_parsing;
      }
      skipChar();
    }

    return flags;
  }
}
