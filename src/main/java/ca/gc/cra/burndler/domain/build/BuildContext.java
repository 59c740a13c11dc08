package ca.gc.cra.burndler.domain.build;

import ca.gc.cra.burndler.domain.compose.LintResult;
import ca.gc.cra.burndler.domain.compose.MergeResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Scratchpad threaded through the build stages.
 * <p><strong>Role:</strong> Each stage reads what earlier stages produced and records its own output here.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a context belongs to the single thread running one build.</p>
 *
 * @since 0.1.0
 */
public final class BuildContext {
  private final String buildId;
  private final BuildTarget target;
  private final Map<String, Configuration> configurations = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> resolvedVariables = new LinkedHashMap<>();
  private final Map<String, byte[]> renderedFiles = new LinkedHashMap<>();
  private final Map<String, byte[]> embeddedAssets = new LinkedHashMap<>();
  private final List<DownloadAsset> downloadAssets = new ArrayList<>();
  private MergeResult mergeResult;
  private LintResult lintResult;
  private String packageLocator;
  private String manifestJson;

  public BuildContext(String buildId, BuildTarget target) {
    this.buildId = Objects.requireNonNull(buildId, "buildId");
    this.target = Objects.requireNonNull(target, "target");
  }

  public String buildId() {
    return buildId;
  }

  public BuildTarget target() {
    return target;
  }

  public void putConfiguration(String memberName, Configuration configuration) {
    configurations.put(memberName, configuration);
  }

  /** Loaded configurations keyed by member name; members without one are absent. */
  public Map<String, Configuration> configurations() {
    return Collections.unmodifiableMap(configurations);
  }

  public void putResolvedVariables(String memberName, Map<String, Object> variables) {
    resolvedVariables.put(memberName, variables);
  }

  public Map<String, Object> resolvedVariables(String memberName) {
    return resolvedVariables.getOrDefault(memberName, Map.of());
  }

  public Map<String, Map<String, Object>> resolvedVariables() {
    return Collections.unmodifiableMap(resolvedVariables);
  }

  /**
   * Records a rendered or copied configuration file.
   *
   * @param path namespaced path {@code <target>_<id>/<member>/<file>}
   * @param content file bytes
   */
  public void putRenderedFile(String path, byte[] content) {
    renderedFiles.put(path, content);
  }

  public Map<String, byte[]> renderedFiles() {
    return Collections.unmodifiableMap(renderedFiles);
  }

  public void putEmbeddedAsset(String path, byte[] content) {
    embeddedAssets.put(path, content);
  }

  public Map<String, byte[]> embeddedAssets() {
    return Collections.unmodifiableMap(embeddedAssets);
  }

  public void addDownloadAsset(DownloadAsset asset) {
    downloadAssets.add(asset);
  }

  public List<DownloadAsset> downloadAssets() {
    return Collections.unmodifiableList(downloadAssets);
  }

  public MergeResult mergeResult() {
    return mergeResult;
  }

  public void mergeResult(MergeResult mergeResult) {
    this.mergeResult = mergeResult;
  }

  public LintResult lintResult() {
    return lintResult;
  }

  public void lintResult(LintResult lintResult) {
    this.lintResult = lintResult;
  }

  public String packageLocator() {
    return packageLocator;
  }

  public void packageLocator(String packageLocator) {
    this.packageLocator = packageLocator;
  }

  public String manifestJson() {
    return manifestJson;
  }

  public void manifestJson(String manifestJson) {
    this.manifestJson = manifestJson;
  }
}
