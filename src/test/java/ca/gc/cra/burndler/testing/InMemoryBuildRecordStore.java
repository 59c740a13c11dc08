package ca.gc.cra.burndler.testing;

import ca.gc.cra.burndler.application.port.BuildRecordPort;
import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Build catalog held in memory; every saved record is kept in order.
 */
public final class InMemoryBuildRecordStore implements BuildRecordPort {
  private final Map<String, BuildTarget> targets = new LinkedHashMap<>();
  private final Map<String, Configuration> configurations = new LinkedHashMap<>();
  private final List<BuildRecord> saved = new ArrayList<>();

  public InMemoryBuildRecordStore add(BuildTarget target) {
    targets.put(target.id(), target);
    return this;
  }

  public InMemoryBuildRecordStore add(Configuration configuration) {
    configurations.put(configuration.name(), configuration);
    return this;
  }

  public List<BuildRecord> saved() {
    return saved;
  }

  public BuildRecord last() {
    return saved.get(saved.size() - 1);
  }

  @Override
  public synchronized BuildTarget loadTarget(String targetId) throws IOException {
    BuildTarget target = targets.get(targetId);
    if (target == null) {
      throw new IOException("build target not found: " + targetId);
    }
    return target;
  }

  @Override
  public synchronized Optional<Configuration> loadConfiguration(String name) {
    return Optional.ofNullable(configurations.get(name));
  }

  @Override
  public synchronized void save(BuildRecord record) {
    saved.add(record);
  }
}
