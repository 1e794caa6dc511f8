package ca.gc.cra.recstream.application.bridge;

import ca.gc.cra.recstream.application.port.HostFunctionResolver;
import ca.gc.cra.recstream.application.port.MetricsPort;
import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.function.RegistryToken;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Token-to-closure registry backing the host-function bridge.
 * <p><strong>Why:</strong> Stage arguments can only carry text, so closures are parked here and referenced by an
 * opaque token that the stage's evaluator resolves at evaluation time.</p>
 * <p><strong>Role:</strong> Application service owned by one {@code PipelineRunner}; not process-global.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the same token when the same closure instance (by identity) is registered again.</li>
 *   <li>Issue tokens that are unique across every registry in the JVM.</li>
 *   <li>Refuse registration once closed or when the configured capacity is reached.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Runners are single-threaded; embeddings sharing a runner
 * across threads must synchronize around {@code run}.</p>
 * <p><strong>Performance:</strong> O(1) registration and lookup. Entries are never evicted while the registry is
 * open, so a long-lived runner grows with every distinct closure it sees; the capacity bound turns that growth
 * into a {@link RegistrationException} instead of a leak.</p>
 * <p><strong>Observability:</strong> Increments {@code bridge.function.registered} per new closure.</p>
 *
 * @since 0.1.0
 */
public final class HostFunctionRegistry implements HostFunctionResolver, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HostFunctionRegistry.class);
  private static final AtomicLong REGISTRY_IDS = new AtomicLong();

  /** Default maximum number of distinct closures per registry. */
  public static final int DEFAULT_CAPACITY = 10_000;

  private final long registryId = REGISTRY_IDS.incrementAndGet();
  private final Map<HostFunction, RegistryToken> tokensByFunction = new IdentityHashMap<>();
  private final Map<RegistryToken, HostFunction> functionsByToken = new HashMap<>();
  private final int capacity;
  private final MetricsPort metrics;
  private long sequence;
  private boolean closed;

  /**
   * Creates a registry with the default capacity and no metrics.
   */
  public HostFunctionRegistry() {
    this(DEFAULT_CAPACITY, MetricsPort.NO_OP);
  }

  /**
   * Creates a registry.
   *
   * @param capacity maximum number of distinct closures; must be positive
   * @param metrics metrics sink; must not be {@code null}
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public HostFunctionRegistry(int capacity, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a closure, reusing the existing token when the same instance was registered before.
   *
   * @param function closure; must not be {@code null}
   * @return token identifying {@code function}
   * @throws RegistrationException if the registry is closed or full
   */
  public RegistryToken register(HostFunction function) {
    Objects.requireNonNull(function, "function");
    if (closed) {
      throw new RegistrationException("host function registry is closed");
    }
    RegistryToken existing = tokensByFunction.get(function);
    if (existing != null) {
      return existing;
    }
    if (tokensByFunction.size() >= capacity) {
      throw new RegistrationException(
          "host function registry is full (" + capacity + " functions); create a new runner");
    }
    RegistryToken token = new RegistryToken("hf-" + registryId + "-" + (++sequence));
    tokensByFunction.put(function, token);
    functionsByToken.put(token, function);
    metrics.increment("bridge.function.registered");
    log.debug("Registered host function {} as {}", function.getClass().getName(), token);
    return token;
  }

  @Override
  public Optional<HostFunction> resolve(RegistryToken token) {
    if (token == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(functionsByToken.get(token));
  }

  /**
   * Number of registered closures.
   *
   * @return size
   */
  public int size() {
    return tokensByFunction.size();
  }

  /**
   * Indicates whether registration is still possible.
   *
   * @return {@code true} once {@link #close()} was called
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Drops every registration and refuses further ones. Tokens already embedded in compiled chains stop
   * resolving.
   */
  @Override
  public void close() {
    closed = true;
    tokensByFunction.clear();
    functionsByToken.clear();
  }
}
