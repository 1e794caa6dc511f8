package ca.gc.cra.recstream.domain.function;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque key identifying one registered {@link HostFunction}.
 *
 * <p>Tokens are rendered into stage arguments, so the value is restricted to {@code [A-Za-z0-9._-]} and never
 * needs quoting inside an expression.</p>
 *
 * @param value token text
 * @since 0.1.0
 */
public record RegistryToken(String value) {
  private static final Pattern TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  /**
   * Validates the token text.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} contains unsupported characters
   */
  public RegistryToken {
    Objects.requireNonNull(value, "value");
    if (!TOKEN_PATTERN.matcher(value).matches()) {
      throw new IllegalArgumentException("registry token must match [A-Za-z0-9._-]+: " + value);
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
