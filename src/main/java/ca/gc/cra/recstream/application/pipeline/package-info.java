/**
 * Pipeline engine: compiles a {@link ca.gc.cra.recstream.domain.pipeline.PipelineSpec} into a chain of stage
 * instances, drives input into it, and shapes the result.
 * <p>Runs are single-threaded and push-based. Each stage pushes synchronously to its downstream, and a
 * {@code false} return travels back to the input loop as a request to stop reading.</p>
 * <p>Failures are reported as {@link ca.gc.cra.recstream.application.pipeline.PipelineException} subclasses; I/O
 * failures surface as {@link java.io.IOException} from {@code PipelineRunner.run}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.application.pipeline;
