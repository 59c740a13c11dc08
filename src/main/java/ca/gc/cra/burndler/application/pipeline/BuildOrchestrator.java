package ca.gc.cra.burndler.application.pipeline;

import ca.gc.cra.burndler.application.compose.ComposeLinter;
import ca.gc.cra.burndler.application.compose.ComposeMerger;
import ca.gc.cra.burndler.application.compose.ComposeParseException;
import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.packaging.PackageRequest;
import ca.gc.cra.burndler.application.packaging.PackageResult;
import ca.gc.cra.burndler.application.packaging.Packager;
import ca.gc.cra.burndler.application.packaging.PackagingException;
import ca.gc.cra.burndler.application.port.ArtifactStorePort;
import ca.gc.cra.burndler.application.port.BuildRecordPort;
import ca.gc.cra.burndler.application.port.ClockPort;
import ca.gc.cra.burndler.application.port.MetricsPort;
import ca.gc.cra.burndler.application.rules.ConditionException;
import ca.gc.cra.burndler.application.rules.DependencyChecker;
import ca.gc.cra.burndler.application.rules.DependencyRuleParser;
import ca.gc.cra.burndler.application.template.TemplateEngine;
import ca.gc.cra.burndler.application.template.TemplateException;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.build.BuildContext;
import ca.gc.cra.burndler.domain.build.BuildMember;
import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildStage;
import ca.gc.cra.burndler.domain.build.BuildStatus;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import ca.gc.cra.burndler.domain.build.ConfigurationAsset;
import ca.gc.cra.burndler.domain.build.ConfigurationFile;
import ca.gc.cra.burndler.domain.build.DownloadAsset;
import ca.gc.cra.burndler.domain.build.FileKind;
import ca.gc.cra.burndler.domain.build.ResourceFile;
import ca.gc.cra.burndler.domain.compose.LintResult;
import ca.gc.cra.burndler.domain.compose.MergeResult;
import ca.gc.cra.burndler.domain.compose.Module;
import ca.gc.cra.burndler.domain.rules.DependencyRule;
import ca.gc.cra.burndler.domain.rules.ValidationError;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one build of a target through the fixed stage list.
 * <p><strong>Why:</strong> Turns independently authored compose fragments and their configurations into one
 * validated installer package, stopping at the first stage that fails.</p>
 * <p><strong>Role:</strong> Application use case behind the {@code build} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run {@code validation}, {@code configuration}, {@code template_render}, {@code asset_resolution},
 *   {@code compose_merge}, {@code linting}, {@code packaging} in that order.</li>
 *   <li>Persist {@code building:<stage>} before and after each stage, then {@code completed} or {@code failed}.</li>
 *   <li>Record the failing stage's message verbatim; earlier stage effects are kept.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call owns its {@link BuildContext}; concurrent builds are independent
 * as long as the injected ports are thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code build.started}, {@code build.completed}, {@code build.failed},
 * and {@code build.stage.<stage>.durationNanos}; sets MDC {@code buildId} and {@code stage}.</p>
 *
 * @since 0.1.0
 */
public final class BuildOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

  static final String DEFAULT_DOWNLOAD_URL = "/api/v1/assets/download?path=";

  private final BuildRecordPort records;
  private final ArtifactStorePort store;
  private final VariableResolver variables;
  private final DependencyRuleParser ruleParser;
  private final DependencyChecker checker;
  private final TemplateEngine templates;
  private final ComposeMerger merger;
  private final ComposeLinter linter;
  private final Packager packager;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates an orchestrator with the standard rule, template, merge, and lint services.
   *
   * @param records build persistence
   * @param store artifact storage for template sources and assets
   * @param packager package writer
   * @param clock time source for record timestamps
   * @param metrics metrics sink
   */
  public BuildOrchestrator(
      BuildRecordPort records, ArtifactStorePort store, Packager packager, ClockPort clock, MetricsPort metrics) {
    this(records, store, new VariableResolver(), new DependencyRuleParser(new JsonSupport()),
        new DependencyChecker(), new TemplateEngine(), new ComposeMerger(new YamlSupport(), metrics),
        new ComposeLinter(new YamlSupport(), metrics), packager, clock, metrics);
  }

  public BuildOrchestrator(
      BuildRecordPort records,
      ArtifactStorePort store,
      VariableResolver variables,
      DependencyRuleParser ruleParser,
      DependencyChecker checker,
      TemplateEngine templates,
      ComposeMerger merger,
      ComposeLinter linter,
      Packager packager,
      ClockPort clock,
      MetricsPort metrics) {
    this.records = Objects.requireNonNull(records, "records");
    this.store = Objects.requireNonNull(store, "store");
    this.variables = Objects.requireNonNull(variables, "variables");
    this.ruleParser = Objects.requireNonNull(ruleParser, "ruleParser");
    this.checker = Objects.requireNonNull(checker, "checker");
    this.templates = Objects.requireNonNull(templates, "templates");
    this.merger = Objects.requireNonNull(merger, "merger");
    this.linter = Objects.requireNonNull(linter, "linter");
    this.packager = Objects.requireNonNull(packager, "packager");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs a build.
   *
   * @param buildId identifier of the new build
   * @param targetId target to build
   * @return final build record, {@code completed} or {@code failed}
   * @throws IOException when the build record cannot be persisted
   */
  public BuildRecord execute(String buildId, String targetId) throws IOException {
    Objects.requireNonNull(buildId, "buildId");
    Objects.requireNonNull(targetId, "targetId");
    String previousBuild = MDC.get("buildId");
    MDC.put("buildId", buildId);
    try {
      metrics.increment("build.started");
      BuildTarget target;
      try {
        target = records.loadTarget(targetId);
      } catch (IOException ex) {
        BuildRecord failed = BuildRecord.queued(buildId, targetId, targetId, clock.now())
            .failed("failed to load target " + targetId + ": " + ex.getMessage(), clock.now());
        records.save(failed);
        metrics.increment("build.failed");
        log.error("Build {} failed: {}", buildId, failed.error());
        return failed;
      }
      BuildRecord record = BuildRecord.queued(buildId, target.name(), targetId, clock.now());
      records.save(record);
      log.info("Build {} queued for target {} ({} enabled member(s))",
          buildId, target.namespace(), target.enabledMembers().size());
      return run(new BuildContext(buildId, target), record);
    } finally {
      restore("buildId", previousBuild);
    }
  }

  private BuildRecord run(BuildContext ctx, BuildRecord record) throws IOException {
    for (BuildStage stage : BuildStage.values()) {
      record = record.withStatus(BuildStatus.building(stage));
      records.save(record);
      String previousStage = MDC.get("stage");
      MDC.put("stage", stage.id());
      long started = System.nanoTime();
      try {
        runStage(stage, ctx);
      } catch (BuildStageException ex) {
        BuildRecord failed = capture(ctx, record).failed(ex.getMessage(), clock.now());
        records.save(failed);
        metrics.increment("build.failed");
        log.error("Build {} failed at stage {}: {}", ctx.buildId(), stage.id(), ex.getMessage());
        return failed;
      } finally {
        metrics.observe("build.stage." + stage.id() + ".durationNanos", System.nanoTime() - started);
        restore("stage", previousStage);
      }
      record = capture(ctx, record);
      records.save(record);
    }
    BuildRecord completed = record.completed(clock.now());
    records.save(completed);
    metrics.increment("build.completed");
    log.info("Build {} completed: {}", ctx.buildId(), completed.downloadUrl());
    return completed;
  }

  private void runStage(BuildStage stage, BuildContext ctx) throws BuildStageException {
    switch (stage) {
      case VALIDATION -> validate(ctx);
      case CONFIGURATION -> resolveConfiguration(ctx);
      case TEMPLATE_RENDER -> renderTemplates(ctx);
      case ASSET_RESOLUTION -> resolveAssets(ctx);
      case COMPOSE_MERGE -> mergeCompose(ctx);
      case LINTING -> lintCompose(ctx);
      case PACKAGING -> packageInstaller(ctx);
      default -> throw new IllegalStateException("Unhandled stage " + stage);
    }
  }

  private static BuildRecord capture(BuildContext ctx, BuildRecord record) {
    BuildRecord next = record;
    if (ctx.mergeResult() != null) {
      next = next.withCompose(ctx.mergeResult().mergedCompose());
    }
    if (ctx.packageLocator() != null) {
      next = next.withPackage(ctx.manifestJson(), ctx.packageLocator());
    }
    return next;
  }

  private static void validate(BuildContext ctx) throws BuildStageException {
    if (!ctx.target().active()) {
      throw new BuildStageException(BuildStage.VALIDATION, "service is not active");
    }
    if (ctx.target().enabledMembers().isEmpty()) {
      throw new BuildStageException(BuildStage.VALIDATION, "service has no enabled containers");
    }
  }

  private void resolveConfiguration(BuildContext ctx) throws BuildStageException {
    BuildTarget target = ctx.target();
    for (BuildMember member : target.enabledMembers()) {
      Configuration configuration = null;
      if (member.hasConfiguration()) {
        try {
          Optional<Configuration> loaded = records.loadConfiguration(member.configurationName());
          if (loaded.isPresent()) {
            configuration = loaded.get();
            ctx.putConfiguration(member.name(), configuration);
          } else {
            log.debug("Configuration {} of member {} not found; skipping", member.configurationName(),
                member.name());
          }
        } catch (IOException ex) {
          throw new BuildStageException(BuildStage.CONFIGURATION,
              "failed to load configuration for container " + member.name() + ": " + ex.getMessage(), ex);
        }
      }
      Map<String, Object> resolved = variables.resolve(target, configuration, member);
      ctx.putResolvedVariables(member.name(), resolved);
      if (configuration == null || configuration.dependencyRules().isBlank()) {
        continue;
      }
      List<DependencyRule> rules;
      try {
        rules = ruleParser.parse(configuration.dependencyRules());
      } catch (IllegalArgumentException ex) {
        throw new BuildStageException(BuildStage.CONFIGURATION,
            "failed to parse dependency rules for container " + member.name() + ": " + ex.getMessage(), ex);
      }
      List<ValidationError> errors = checker.check(rules, resolved);
      if (!errors.isEmpty()) {
        throw new BuildStageException(BuildStage.CONFIGURATION, "dependency validation failed for container "
            + member.name() + ": " + errors.stream().map(ValidationError::toString)
            .collect(Collectors.joining("; ", "[", "]")));
      }
    }
  }

  private void renderTemplates(BuildContext ctx) throws BuildStageException {
    for (BuildMember member : ctx.target().enabledMembers()) {
      Configuration configuration = ctx.configurations().get(member.name());
      if (configuration == null) {
        continue;
      }
      Map<String, Object> resolved = ctx.resolvedVariables(member.name());
      for (ConfigurationFile file : configuration.files()) {
        if (file.kind() != FileKind.TEMPLATE) {
          continue;
        }
        byte[] source = load(BuildStage.TEMPLATE_RENDER, "template", file.path(), file.storagePath());
        String rendered;
        try {
          rendered = templates.render(new String(source, StandardCharsets.UTF_8), file.templateFormat(), resolved);
        } catch (TemplateException | IllegalArgumentException ex) {
          throw new BuildStageException(BuildStage.TEMPLATE_RENDER,
              "failed to render template " + file.path() + ": " + ex.getMessage(), ex);
        }
        ctx.putRenderedFile(namespaced(ctx.target(), member, file.path()), rendered.getBytes(StandardCharsets.UTF_8));
      }
      for (ConfigurationFile file : configuration.files()) {
        if (file.kind() != FileKind.STATIC) {
          continue;
        }
        byte[] content = load(BuildStage.TEMPLATE_RENDER, "static file", file.path(), file.storagePath());
        ctx.putRenderedFile(namespaced(ctx.target(), member, file.path()), content);
      }
    }
  }

  private void resolveAssets(BuildContext ctx) throws BuildStageException {
    for (BuildMember member : ctx.target().enabledMembers()) {
      Configuration configuration = ctx.configurations().get(member.name());
      if (configuration == null) {
        continue;
      }
      Map<String, Object> resolved = ctx.resolvedVariables(member.name());
      for (ConfigurationAsset asset : configuration.assets()) {
        if (!asset.includeCondition().isBlank()) {
          boolean include;
          try {
            include = checker.evaluateCondition(asset.includeCondition(), resolved);
          } catch (ConditionException ex) {
            throw new BuildStageException(BuildStage.ASSET_RESOLUTION,
                "failed to evaluate asset condition " + asset.includeCondition() + ": " + ex.getMessage(), ex);
          }
          if (!include) {
            log.debug("Skipping asset {} of member {}", asset.path(), member.name());
            continue;
          }
        }
        String path = namespaced(ctx.target(), member, asset.path());
        switch (asset.storage()) {
          case EMBEDDED -> ctx.putEmbeddedAsset(path,
              load(BuildStage.ASSET_RESOLUTION, "embedded asset", asset.path(), asset.storagePath()));
          case DOWNLOAD -> {
            String url = asset.downloadUrl().isBlank()
                ? DEFAULT_DOWNLOAD_URL + asset.storagePath()
                : asset.downloadUrl();
            ctx.addDownloadAsset(new DownloadAsset(path, url, asset.checksum(), asset.size()));
          }
          default -> throw new IllegalStateException("Unhandled asset storage " + asset.storage());
        }
      }
    }
  }

  private void mergeCompose(BuildContext ctx) throws BuildStageException {
    BuildTarget target = ctx.target();
    List<Module> modules = new ArrayList<>();
    for (BuildMember member : target.enabledMembers()) {
      modules.add(new Module(target.namespace() + "__" + member.name(), member.compose(),
          VariableResolver.flatten(ctx.resolvedVariables(member.name()))));
    }
    MergeResult result;
    try {
      result = merger.merge(modules, targetVariables(target, modules));
    } catch (ComposeParseException ex) {
      throw new BuildStageException(BuildStage.COMPOSE_MERGE,
          "failed to merge compose files: " + ex.getMessage(), ex);
    }
    ctx.mergeResult(result);
  }

  /**
   * Target-level variables passed to the merger as global overrides. The merger lets globals beat module
   * values, so a key is only passed when no module resolved it differently.
   */
  private static Map<String, String> targetVariables(BuildTarget target, List<Module> modules) {
    Map<String, String> global = new LinkedHashMap<>();
    VariableResolver.flatten(target.variables()).forEach((key, value) -> {
      boolean agreed = modules.stream()
          .map(m -> m.variables().get(key))
          .allMatch(v -> v == null || v.equals(value));
      if (agreed) {
        global.put(key, value);
      }
    });
    return global;
  }

  private void lintCompose(BuildContext ctx) throws BuildStageException {
    LintResult result;
    try {
      result = linter.lint(ctx.mergeResult().mergedCompose(), true);
    } catch (ComposeParseException ex) {
      throw new BuildStageException(BuildStage.LINTING, "failed to lint compose: " + ex.getMessage(), ex);
    }
    ctx.lintResult(result);
    result.warnings().forEach(w -> log.warn("Lint warning: {}", w));
    if (!result.valid()) {
      throw new BuildStageException(BuildStage.LINTING,
          String.format("compose validation failed with %d errors", result.errors().size()));
    }
  }

  private void packageInstaller(BuildContext ctx) throws BuildStageException {
    List<ResourceFile> resources = new ArrayList<>();
    ctx.renderedFiles().forEach((path, content) -> resources.add(new ResourceFile("resources/" + path, content)));
    ctx.embeddedAssets().forEach((path, content) -> resources.add(new ResourceFile("resources/" + path, content)));
    PackageRequest request = new PackageRequest(ctx.target().name() + "-" + ctx.buildId(),
        ctx.mergeResult().mergedCompose(), resources, ctx.downloadAssets());
    PackageResult result;
    try {
      result = packager.createPackage(request);
    } catch (PackagingException | IllegalArgumentException ex) {
      throw new BuildStageException(BuildStage.PACKAGING, "failed to create package: " + ex.getMessage(), ex);
    }
    ctx.manifestJson(result.manifestJson());
    ctx.packageLocator(result.locator());
  }

  private byte[] load(BuildStage stage, String what, String path, String storagePath) throws BuildStageException {
    try {
      return store.download(storagePath);
    } catch (IOException ex) {
      throw new BuildStageException(stage, "failed to load " + what + " " + path + ": " + ex.getMessage(), ex);
    }
  }

  static String namespaced(BuildTarget target, BuildMember member, String path) {
    String relative = path;
    while (relative.startsWith("/") || relative.startsWith("./")) {
      relative = relative.startsWith("/") ? relative.substring(1) : relative.substring(2);
    }
    return target.namespace() + "/" + member.name() + "/" + relative;
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
