package ca.gc.cra.recstream.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Constructor capability for one stage name.
 * <p><strong>Role:</strong> Returned by {@link StageCatalog#resolve(String)} and invoked tail-first by the chain
 * compiler, so the downstream always exists before the stage that feeds it.</p>
 * <p><strong>Thread-safety:</strong> Factories are stateless and may be shared; each call returns a fresh stage.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StageFactory {
  /**
   * Creates a stage instance.
   *
   * @param args textual arguments with host functions already bridged into text
   * @param downstream next chain node or terminal sink; never {@code null}
   * @param context per-run context exposing host functions and source attribution
   * @return new stage
   * @throws ca.gc.cra.recstream.application.pipeline.StageConfigurationException if the arguments are invalid
   */
  Stage create(List<String> args, RecordReceiver downstream, StageContext context);
}
