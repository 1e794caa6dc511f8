/**
 * JSON adapter implementing {@link ca.gc.cra.recstream.application.port.RecordCodec} with Jackson's streaming
 * parser and generator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.infrastructure.json;
