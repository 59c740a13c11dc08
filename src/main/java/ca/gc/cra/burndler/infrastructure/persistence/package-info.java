/**
 * <strong>Purpose:</strong> Build catalog adapters implementing
 * {@link ca.gc.cra.burndler.application.port.BuildRecordPort}.
 * <p><strong>Pipeline role:</strong> Source of targets and configurations; sink for build status records.</p>
 * <p><strong>Concurrency:</strong> Record writes are serialized per adapter instance.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.infrastructure.persistence;
