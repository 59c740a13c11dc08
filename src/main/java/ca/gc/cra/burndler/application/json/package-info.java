/**
 * <strong>Purpose:</strong> JSON reading and writing over plain maps and lists, backed by Jackson streaming.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.burndler.application.json.JsonSupport} is safe to share.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.json;
