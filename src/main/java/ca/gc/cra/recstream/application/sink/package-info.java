/**
 * Terminal receivers that end every compiled chain: one collects records, one writes lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.application.sink;
