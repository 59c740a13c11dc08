package ca.gc.cra.burndler.application.port;

import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Persistence port for build targets, configurations, and build records.
 * <p><strong>Role:</strong> Implemented by {@code YamlBuildCatalog}; relational backends plug in here.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent builds.</p>
 *
 * @since 0.1.0
 */
public interface BuildRecordPort {
  /**
   * Loads a build target with its members.
   *
   * @param targetId target identifier
   * @return target
   * @throws IOException when the target is unknown or the catalog is unreadable
   */
  BuildTarget loadTarget(String targetId) throws IOException;

  /**
   * Loads a named configuration.
   *
   * @param name configuration name
   * @return configuration, or empty when no configuration has that name
   * @throws IOException when the catalog is unreadable
   */
  Optional<Configuration> loadConfiguration(String name) throws IOException;

  /**
   * Persists the current state of a build.
   *
   * @param record build record
   * @throws IOException when the record cannot be written
   */
  void save(BuildRecord record) throws IOException;
}
