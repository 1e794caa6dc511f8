package ca.gc.cra.recstream.application.expression;

/**
 * Scanning helpers for quoted strings and numbers shared by the expression and path parsers.
 */
final class Literals {
  private Literals() {}

  static Scanned scanQuoted(String source, int start) {
    char quote = source.charAt(start);
    StringBuilder sb = new StringBuilder();
    int i = start + 1;
    while (i < source.length()) {
      char ch = source.charAt(i);
      if (ch == '\\') {
        if (i + 1 >= source.length()) {
          throw new ExpressionException("Invalid escape in: " + source);
        }
        sb.append(source.charAt(i + 1));
        i += 2;
      } else if (ch == quote) {
        return new Scanned(sb.toString(), i + 1);
      } else {
        sb.append(ch);
        i++;
      }
    }
    throw new ExpressionException("Unterminated string in: " + source);
  }

  static ScannedNumber scanNumber(String source, int start) {
    int i = start;
    if (i < source.length() && (source.charAt(i) == '-' || source.charAt(i) == '+')) {
      i++;
    }
    boolean fractional = false;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (Character.isDigit(c)) {
        i++;
      } else if (c == '.' || c == 'e' || c == 'E') {
        fractional = true;
        i++;
        if ((c == 'e' || c == 'E') && i < source.length()
            && (source.charAt(i) == '-' || source.charAt(i) == '+')) {
          i++;
        }
      } else {
        break;
      }
    }
    String text = source.substring(start, i);
    try {
      Number value = fractional ? (Number) Double.valueOf(text) : (Number) Long.valueOf(text);
      return new ScannedNumber(value, i);
    } catch (NumberFormatException ex) {
      throw new ExpressionException("Invalid number '" + text + "' in: " + source, ex);
    }
  }

  record Scanned(String value, int end) {}

  record ScannedNumber(Number value, int end) {}
}
