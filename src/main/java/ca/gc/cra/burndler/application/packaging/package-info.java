/**
 * Offline installer packaging.
 *
 * <p><strong>Purpose:</strong> Writes the gzip-compressed tar bundle (compose document, {@code .env.example},
 * installer scripts, resources, manifest) and hands it to the artifact store.</p>
 * <p><strong>Pipeline role:</strong> Last build stage.</p>
 * <p><strong>Concurrency:</strong> Archives are assembled in memory per call; no shared state.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.packaging;
