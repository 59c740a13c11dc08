package ca.gc.cra.burndler.domain.build;

/**
 * Image referenced by the packaged compose document.
 *
 * @param name repository part of the reference
 * @param tag tag, {@code latest} when the reference names none
 * @param digest {@code sha256:...} digest or empty
 * @param file archive the installer loads the image from
 * @since 0.1.0
 */
public record ImageInfo(String name, String tag, String digest, String file) {}
