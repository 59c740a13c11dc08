/**
 * <strong>Purpose:</strong> Artifact storage adapters implementing
 * {@link ca.gc.cra.burndler.application.port.ArtifactStorePort}.
 * <p><strong>Pipeline role:</strong> Supplies template sources and embedded assets to builds and receives
 * finished packages.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.infrastructure.storage;
