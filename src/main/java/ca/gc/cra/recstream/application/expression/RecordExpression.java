package ca.gc.cra.recstream.application.expression;

import ca.gc.cra.recstream.application.port.HostFunctionResolver;
import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.function.RegistryToken;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * <strong>What:</strong> Compiled form of the small expression language stages accept as textual arguments.
 * <p><strong>Why:</strong> Filters and evaluators need per-record logic expressed as text; the same language carries
 * the host-function invocation emitted by the bridge.</p>
 * <p><strong>Role:</strong> Application service used by expression-taking stages.</p>
 * <p><strong>Grammar:</strong>
 * <pre>
 *   expression := comment* body
 *   comment    := line whose first non-blank character is '#'
 *   body       := operand [ op operand ]
 *   op         := '==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | '=~'
 *   operand    := host('&lt;token&gt;', $r) | $r | path | 'text' | "text" | number | true | false | null
 *   path       := '$' ( '.' name | '[' index ']' | '[' quoted ']' )*
 * </pre>
 * <p><strong>Thread-safety:</strong> Immutable once compiled; evaluation is side-effect free apart from host
 * functions.</p>
 *
 * @since 0.1.0
 */
public final class RecordExpression {
  /** Name the current record is bound to inside expressions. */
  public static final String CURRENT_RECORD = "$r";

  private static final String HOST_CALL = "host";

  private final String source;
  private final Node root;

  private RecordExpression(String source, Node root) {
    this.source = source;
    this.root = root;
  }

  /**
   * Renders the instruction "invoke host function {@code token} with the current record".
   *
   * @param token registry token
   * @return expression text
   */
  public static String hostInvocation(RegistryToken token) {
    Objects.requireNonNull(token, "token");
    return HOST_CALL + "('" + token.value() + "', " + CURRENT_RECORD + ")";
  }

  /**
   * Compiles expression text.
   *
   * @param text expression, possibly preceded by {@code #} comment lines
   * @return compiled expression
   * @throws ExpressionException when the text is empty or malformed
   */
  public static RecordExpression compile(String text) {
    Objects.requireNonNull(text, "text");
    String body = stripLeadingComments(text);
    if (body.isBlank()) {
      throw new ExpressionException("Empty expression");
    }
    Parser parser = new Parser(body);
    Node root = parser.parseExpression();
    return new RecordExpression(text, root);
  }

  // Only the comment block ahead of the expression is dropped; the body is parsed verbatim.
  private static String stripLeadingComments(String text) {
    int pos = 0;
    while (pos < text.length()) {
      int end = text.indexOf('\n', pos);
      int next = end < 0 ? text.length() : end + 1;
      String line = text.substring(pos, end < 0 ? text.length() : end).strip();
      if (!line.isEmpty() && !line.startsWith("#")) {
        break;
      }
      pos = next;
    }
    return text.substring(pos);
  }

  /**
   * Evaluates the expression against a record.
   *
   * @param record current record
   * @param functions resolver for host-function tokens
   * @return result value (may be {@code null})
   * @throws ExpressionException when a host-function token is unknown
   */
  public Object evaluate(Record record, HostFunctionResolver functions) {
    return root.evaluate(record, functions);
  }

  /**
   * Evaluates the expression and applies truthiness rules.
   *
   * @param record current record
   * @param functions resolver for host-function tokens
   * @return truthiness of the result
   */
  public boolean test(Record record, HostFunctionResolver functions) {
    return isTruthy(evaluate(record, functions));
  }

  /**
   * Truthiness rules: {@code null}, {@code false}, numeric zero, empty strings, and empty collections are false.
   *
   * @param value value to test
   * @return truthiness
   */
  public static boolean isTruthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Number number) {
      return number.doubleValue() != 0.0d;
    }
    if (value instanceof CharSequence text) {
      return text.length() > 0;
    }
    if (value instanceof Collection<?> collection) {
      return !collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return !map.isEmpty();
    }
    return true;
  }

  /**
   * Returns the original text including comments.
   *
   * @return expression source
   */
  public String source() {
    return source;
  }

  @Override
  public String toString() {
    return source;
  }

  private interface Node {
    Object evaluate(Record record, HostFunctionResolver functions);
  }

  private record Constant(Object value) implements Node {
    @Override
    public Object evaluate(Record record, HostFunctionResolver functions) {
      return value;
    }
  }

  private record CurrentRecord() implements Node {
    @Override
    public Object evaluate(Record record, HostFunctionResolver functions) {
      return record;
    }
  }

  private record PathNode(FieldPath path) implements Node {
    @Override
    public Object evaluate(Record record, HostFunctionResolver functions) {
      return path.isRoot() ? record : path.read(record).orElse(null);
    }
  }

  private record HostCall(RegistryToken token) implements Node {
    @Override
    public Object evaluate(Record record, HostFunctionResolver functions) {
      HostFunction function = functions.resolve(token)
          .orElseThrow(() -> new ExpressionException("Unknown host function token: " + token));
      return function.apply(record);
    }
  }

  private record Comparison(Node left, Operator op, Node right, Pattern regex) implements Node {
    @Override
    public Object evaluate(Record record, HostFunctionResolver functions) {
      Object l = left.evaluate(record, functions);
      if (op == Operator.MATCH) {
        if (l == null) {
          return false;
        }
        Pattern pattern = regex;
        if (pattern == null) {
          Object r = right.evaluate(record, functions);
          if (r == null) {
            return false;
          }
          pattern = compileRegex(String.valueOf(r));
        }
        return pattern.matcher(String.valueOf(l)).find();
      }
      Object r = right.evaluate(record, functions);
      return switch (op) {
        case EQ -> valuesEqual(l, r);
        case NE -> !valuesEqual(l, r);
        case LT -> l != null && r != null && compare(l, r) < 0;
        case LE -> l != null && r != null && compare(l, r) <= 0;
        case GT -> l != null && r != null && compare(l, r) > 0;
        case GE -> l != null && r != null && compare(l, r) >= 0;
        case MATCH -> throw new IllegalStateException("unreachable");
      };
    }

    private static boolean valuesEqual(Object l, Object r) {
      if (l == null || r == null) {
        return l == r;
      }
      if (l instanceof Number ln && r instanceof Number rn) {
        return Double.compare(ln.doubleValue(), rn.doubleValue()) == 0;
      }
      return String.valueOf(l).equals(String.valueOf(r));
    }

    private static int compare(Object l, Object r) {
      if (l instanceof Number ln && r instanceof Number rn) {
        return Double.compare(ln.doubleValue(), rn.doubleValue());
      }
      return String.valueOf(l).compareTo(String.valueOf(r));
    }
  }

  private enum Operator {
    EQ("=="), NE("!="), LE("<="), GE(">="), LT("<"), GT(">"), MATCH("=~");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }
  }

  private static Pattern compileRegex(String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new ExpressionException("Invalid regular expression: " + regex, ex);
    }
  }

  private static final class Parser {
    private final String text;
    private int pos;

    Parser(String text) {
      this.text = text;
    }

    Node parseExpression() {
      Node left = parseOperand();
      skipWhitespace();
      if (pos >= text.length()) {
        return left;
      }
      Operator op = parseOperator();
      Node right = parseOperand();
      skipWhitespace();
      if (pos < text.length()) {
        throw error("Unexpected trailing text");
      }
      Pattern regex = null;
      if (op == Operator.MATCH && right instanceof Constant constant && constant.value() != null) {
        regex = compileRegex(String.valueOf(constant.value()));
      }
      return new Comparison(left, op, right, regex);
    }

    private Operator parseOperator() {
      for (Operator op : Operator.values()) {
        if (text.startsWith(op.symbol, pos)) {
          pos += op.symbol.length();
          return op;
        }
      }
      throw error("Expected comparison operator");
    }

    private Node parseOperand() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw error("Expected operand");
      }
      char c = text.charAt(pos);
      if (c == '$') {
        if (text.startsWith(CURRENT_RECORD, pos) && !isWordChar(pos + CURRENT_RECORD.length())) {
          pos += CURRENT_RECORD.length();
          return new CurrentRecord();
        }
        FieldPath.Parsed parsed = FieldPath.parse(text, pos);
        pos = parsed.end();
        return new PathNode(parsed.path());
      }
      if (c == '\'' || c == '"') {
        Literals.Scanned scanned = Literals.scanQuoted(text, pos);
        pos = scanned.end();
        return new Constant(scanned.value());
      }
      if (Character.isDigit(c) || ((c == '-' || c == '+') && pos + 1 < text.length()
          && Character.isDigit(text.charAt(pos + 1)))) {
        Literals.ScannedNumber number = Literals.scanNumber(text, pos);
        pos = number.end();
        return new Constant(number.value());
      }
      if (Character.isLetter(c)) {
        int start = pos;
        while (isWordChar(pos)) {
          pos++;
        }
        String word = text.substring(start, pos);
        switch (word.toLowerCase(Locale.ROOT)) {
          case "true":
            return new Constant(Boolean.TRUE);
          case "false":
            return new Constant(Boolean.FALSE);
          case "null":
            return new Constant(null);
          case HOST_CALL:
            return parseHostCall();
          default:
            throw error("Unknown identifier '" + word + "'");
        }
      }
      throw error("Unexpected character '" + c + "'");
    }

    private Node parseHostCall() {
      expect('(');
      skipWhitespace();
      if (pos >= text.length() || (text.charAt(pos) != '\'' && text.charAt(pos) != '"')) {
        throw error("host() expects a quoted token");
      }
      Literals.Scanned token = Literals.scanQuoted(text, pos);
      pos = token.end();
      expect(',');
      skipWhitespace();
      if (!text.startsWith(CURRENT_RECORD, pos)) {
        throw error("host() must be applied to " + CURRENT_RECORD);
      }
      pos += CURRENT_RECORD.length();
      expect(')');
      try {
        return new HostCall(new RegistryToken(token.value()));
      } catch (IllegalArgumentException ex) {
        throw new ExpressionException(ex.getMessage(), ex);
      }
    }

    private void expect(char c) {
      skipWhitespace();
      if (pos >= text.length() || text.charAt(pos) != c) {
        throw error("Expected '" + c + "'");
      }
      pos++;
    }

    private boolean isWordChar(int index) {
      return index < text.length()
          && (Character.isLetterOrDigit(text.charAt(index)) || text.charAt(index) == '_');
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private ExpressionException error(String message) {
      return new ExpressionException(message + " at offset " + pos + " in expression: " + text);
    }
  }
}
