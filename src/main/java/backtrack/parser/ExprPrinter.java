package backtrack.parser;

/**
 * Renders an {@link Expr} back into pattern syntax.
 *
 * <p>Non-capturing groups are inserted only where precedence requires them.
 */
final class ExprPrinter implements ExprVisitor<Void> {

  /**
   * Characters which need a backslash to be matched literally.
   */
  private static final String METACHARACTERS = "\\.+*?()|[]{}^$";

  private final StringBuilder builder;

  ExprPrinter(StringBuilder builder) {
    this.builder = builder;
  }

  private void wrapped(Expr expr) {
    builder.append("(?:");
    expr.accept(this);
    builder.append(')');
  }

  private void escapeInto(String value) {
    value.codePoints().forEach(codePoint -> {
      if (codePoint < 128 && METACHARACTERS.indexOf(codePoint) >= 0) {
        builder.append('\\');
      }
      builder.appendCodePoint(codePoint);
    });
  }

  @Override
  public Void visitEmpty(Expr.Empty empty) {
    return null;
  }

  @Override
  public Void visitAny(Expr.Any any) {
    builder.append(any.newline() ? "(?s:.)" : ".");
    return null;
  }

  @Override
  public Void visitStartText(Expr.StartText startText) {
    builder.append("\\A");
    return null;
  }

  @Override
  public Void visitEndText(Expr.EndText endText) {
    builder.append("\\z");
    return null;
  }

  @Override
  public Void visitStartLine(Expr.StartLine startLine) {
    builder.append("(?m:^)");
    return null;
  }

  @Override
  public Void visitEndLine(Expr.EndLine endLine) {
    builder.append("(?m:$)");
    return null;
  }

  @Override
  public Void visitLiteral(Expr.Literal literal) {
    if (literal.casei()) {
      builder.append("(?i:");
      escapeInto(literal.value());
      builder.append(')');
    } else {
      escapeInto(literal.value());
    }
    return null;
  }

  @Override
  public Void visitConcat(Expr.Concat concat) {
    boolean afterBackref = false;
    for (Expr child : concat.children()) {
      final int start = builder.length();
      if (child instanceof Expr.Alt || child instanceof Expr.Concat) {
        wrapped(child);
      } else {
        child.accept(this);
      }

      // `\1` followed by `2` (or `2*`) would otherwise read back as `\12`
      if (afterBackref && builder.length() > start && Character.isDigit(builder.charAt(start))) {
        builder.insert(start, "(?:").append(')');
      }
      if (builder.length() > start) {
        afterBackref = child instanceof Expr.Backref;
      }
    }
    return null;
  }

  @Override
  public Void visitAlt(Expr.Alt alt) {
    boolean first = true;
    for (Expr child : alt.children()) {
      if (!first) {
        builder.append('|');
      }
      child.accept(this);
      first = false;
    }
    return null;
  }

  @Override
  public Void visitGroup(Expr.Group group) {
    builder.append('(');
    group.child().accept(this);
    builder.append(')');
    return null;
  }

  @Override
  public Void visitLookAround(Expr.LookAround lookAround) {
    builder.append(lookAround.kind().opener);
    lookAround.child().accept(this);
    builder.append(')');
    return null;
  }

  @Override
  public Void visitRepeat(Expr.Repeat repeat) {
    final Expr child = repeat.child();
    final boolean multiCharacterLiteral = child instanceof Expr.Literal literal
      && !literal.casei()
      && literal.value().codePointCount(0, literal.value().length()) != 1;
    if (child instanceof Expr.Concat
        || child instanceof Expr.Alt
        || child instanceof Expr.Repeat
        || child instanceof Expr.Empty
        || multiCharacterLiteral) {
      wrapped(child);
    } else {
      child.accept(this);
    }

    final int lo = repeat.lo();
    final int hi = repeat.hi();
    if (lo == 0 && hi == Expr.Repeat.UNBOUNDED) {
      builder.append('*');
    } else if (lo == 1 && hi == Expr.Repeat.UNBOUNDED) {
      builder.append('+');
    } else if (lo == 0 && hi == 1) {
      builder.append('?');
    } else if (lo == hi) {
      builder.append('{').append(lo).append('}');
    } else if (hi == Expr.Repeat.UNBOUNDED) {
      builder.append('{').append(lo).append(",}");
    } else {
      builder.append('{').append(lo).append(',').append(hi).append('}');
    }

    if (!repeat.greedy()) {
      builder.append('?');
    }
    return null;
  }

  @Override
  public Void visitDelegate(Expr.Delegate delegate) {
    if (delegate.casei()) {
      builder.append("(?i:").append(delegate.inner()).append(')');
    } else {
      builder.append(delegate.inner());
    }
    return null;
  }

  @Override
  public Void visitBackref(Expr.Backref backref) {
    builder.append('\\').append(backref.group());
    return null;
  }

  @Override
  public Void visitAtomicGroup(Expr.AtomicGroup atomicGroup) {
    builder.append("(?>");
    atomicGroup.child().accept(this);
    builder.append(')');
    return null;
  }
}
