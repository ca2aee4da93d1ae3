package com.buildfarm.pipeline.codegen.generator.gitlab;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.MissingRequiredAttributeException;
import com.buildfarm.pipeline.codegen.exception.PipelineGenerationException;
import com.buildfarm.pipeline.codegen.generator.AnnotatedPipeline;
import com.buildfarm.pipeline.codegen.generator.JobPlanner;
import com.buildfarm.pipeline.codegen.generator.PipelineGenerator;
import com.buildfarm.pipeline.codegen.generator.PlannedJob;
import com.buildfarm.pipeline.codegen.model.config.CiConfig;
import com.buildfarm.pipeline.codegen.model.config.JobAttributePatch;
import com.buildfarm.pipeline.codegen.model.config.JobAttributes;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineOptions;
import com.buildfarm.pipeline.codegen.model.core.context.PipelineType;
import com.buildfarm.pipeline.codegen.model.spec.SpecNode;
import com.buildfarm.pipeline.codegen.util.AtomicFileWriter;
import com.buildfarm.pipeline.codegen.util.YamlScalars;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes a {@code .gitlab-ci.yml} child pipeline.
 *
 * One job per kept node, named {@code name@version /identity}; {@code needs}
 * lists the nearest kept dependencies and stages follow {@link JobPlanner}.
 * Output is fully ordered, so unchanged input gives a byte-identical file.
 */
public class GitlabPipelineGenerator implements PipelineGenerator {
    private static final Logger log = LoggerFactory.getLogger(GitlabPipelineGenerator.class);

    public static final String PLATFORM = "gitlab";

    static final String TEMPLATE = "gitlab-ci.yml.ftl";
    static final int MAX_JOB_NAME_LENGTH = 255;
    static final String REBUILD_INDEX_JOB = "rebuild-index";
    static final String REBUILD_INDEX_STAGE = "stage-rebuild-index";
    static final String SIGNING_JOB = "sign-pkgs";
    static final String SIGNING_STAGE = "stage-sign-pkgs";
    static final String NOOP_JOB = "no-specs-to-rebuild";
    static final String VAR_NEEDS_REBUILD = "PIPELINE_SPEC_NEEDS_REBUILD";

    static final Set<String> RESERVED_TAGS = Set.of("public", "protected", "notary");

    // https://docs.gitlab.com/ee/ci/yaml/#retry
    static final List<String> JOB_RETRY_CONDITIONS = List.of(
            "unknown_failure",
            "script_failure",
            "api_failure",
            "stuck_or_timeout_failure",
            "runner_system_failure",
            "runner_unsupported",
            "stale_schedule",
            "archived_failure",
            "unmet_prerequisites",
            "scheduler_failure",
            "data_integrity_failure");

    static final List<String> SERVICE_JOB_RETRY_CONDITIONS = List.of(
            "runner_system_failure",
            "stuck_or_timeout_failure",
            "script_failure");

    static final List<String> DEFAULT_NOOP_SCRIPT =
            List.of("echo \"All specs already up to date, nothing to rebuild.\"");

    private final Configuration freemarkerConfig;
    private final JobPlanner jobPlanner;

    public GitlabPipelineGenerator() {
        this(new JobPlanner());
    }

    public GitlabPipelineGenerator(JobPlanner jobPlanner) {
        this.jobPlanner = jobPlanner;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setFallbackOnNullLoopVariable(false);
        return cfg;
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    public void generate(AnnotatedPipeline pipeline, CiConfig config, PipelineOptions options) {
        String yaml = render(pipeline, config, options);
        AtomicFileWriter.writeString(options.getOutputPath(), yaml);
        log.info("Wrote GitLab pipeline to {}", options.getOutputPath().toAbsolutePath());
    }

    /**
     * Renders the pipeline without writing it.
     */
    public String render(AnnotatedPipeline pipeline, CiConfig config, PipelineOptions options) {
        List<PlannedJob> planned = jobPlanner.plan(pipeline);

        Map<String, String> jobNames = new HashMap<>();
        for (PlannedJob job : planned) {
            jobNames.put(job.identity(), jobName(job.getNode()));
        }

        Set<String> stageNames = new LinkedHashSet<>();
        List<GitlabJobView> jobs = new ArrayList<>();
        Map<String, Object> model = new HashMap<>();

        if (planned.isEmpty()) {
            log.info("No specs to rebuild, generating no-op job");
            jobs.add(noopJob(config.getNoopJob()));
        } else {
            // stage indexes may skip numbers when stage hints are used
            for (int stage : new TreeSet<>(planned.stream().map(PlannedJob::getStage).toList())) {
                stageNames.add(stageName(stage));
            }
            for (PlannedJob job : planned) {
                jobs.add(buildJob(job, jobNames, pipeline, options));
            }
            log.debug("{} build job(s) generated in {} stage(s)", planned.size(), stageNames.size());

            if (options.getPipelineType() == PipelineType.PROTECTED_BRANCH) {
                GitlabJobView signing = signingJob(config.getSigningJob());
                if (signing != null) {
                    stageNames.add(SIGNING_STAGE);
                    jobs.add(signing);
                }
            }
            if (options.isRebuildIndex()) {
                GitlabJobView reindex = reindexJob(config.getReindexJob());
                if (reindex != null) {
                    stageNames.add(REBUILD_INDEX_STAGE);
                    jobs.add(reindex);
                }
            }
            model.put("variables", globalVariables(options));
        }
        jobs.sort((a, b) -> a.getName().compareTo(b.getName()));

        model.put("stages", stageNames.stream().map(YamlScalars::quote).toList());
        model.putIfAbsent("variables", List.of());
        model.put("jobs", jobs);
        return process(model);
    }

    /**
     * Only the display part is shortened, so the identity suffix keeps long
     * names distinct.
     */
    static String jobName(SpecNode node) {
        String suffix = " /" + node.getIdentity();
        String display = node.displayName();
        int room = MAX_JOB_NAME_LENGTH - suffix.length();
        if (display.length() > room) {
            display = display.substring(0, Math.max(room, 0));
        }
        return display + suffix;
    }

    static String stageName(int stage) {
        return "stage-" + stage;
    }

    private GitlabJobView buildJob(PlannedJob job, Map<String, String> jobNames,
                                   AnnotatedPipeline pipeline, PipelineOptions options) {
        JobAttributes attrs = job.getAttributes();
        SpecNode node = job.getNode();

        if (attrs.getScript().isEmpty()) {
            throw new MissingRequiredAttributeException(node.getIdentity(), node.describe(), List.of("script"));
        }

        Map<String, String> variables = new TreeMap<>(attrs.getVariables());
        // downstream jobs learn whether the spec is missing from the cache even without pruning
        variables.put(VAR_NEEDS_REBUILD, pipeline.isCached(node.getIdentity()) ? "False" : "True");

        GitlabJobView.GitlabJobViewBuilder view = GitlabJobView.builder()
                .name(YamlScalars.quote(jobNames.get(job.identity())))
                .stage(YamlScalars.quote(stageName(job.getStage())))
                .image(attrs.getImage() == null ? null : YamlScalars.quote(attrs.getImage()))
                .tags(quoteAll(effectiveTags(attrs.getTags(), options.getPipelineType())))
                .variables(variables.entrySet().stream().map(e -> YamlEntry.of(e.getKey(), e.getValue())).toList())
                .needs(job.getNeeds().stream().map(jobNames::get).map(YamlScalars::quote).toList())
                .beforeScript(quoteAll(attrs.getBeforeScript()))
                .script(quoteAll(attrs.getScript()))
                .afterScript(quoteAll(attrs.getAfterScript()))
                .artifactPaths(quoteAll(artifactPaths(options)))
                .timeout(attrs.getTimeout() == null ? null : YamlScalars.quote(attrs.getTimeout()))
                .allowFailure(attrs.isAllowFailure())
                .retryMax(2)
                .retryWhen(quoteAll(JOB_RETRY_CONDITIONS))
                .interruptible(true);
        return view.build();
    }

    private GitlabJobView reindexJob(JobAttributePatch patch) {
        if (patch == null || patch.getScript() == null || patch.getScript().isEmpty()) {
            log.warn("rebuild-index requested but no reindex-job script is configured, skipping it");
            return null;
        }
        return serviceJob(REBUILD_INDEX_JOB, patch)
                .stage(YamlScalars.quote(REBUILD_INDEX_STAGE))
                .when(YamlScalars.quote("always"))
                .retryMax(2)
                .retryWhen(quoteAll(SERVICE_JOB_RETRY_CONDITIONS))
                .interruptible(true)
                .clearDependencies(true)
                .build();
    }

    private GitlabJobView signingJob(JobAttributePatch patch) {
        if (patch == null || patch.getScript() == null || patch.getScript().isEmpty()) {
            log.debug("No signing-job script configured, skipping package signing");
            return null;
        }
        return serviceJob(SIGNING_JOB, patch)
                .stage(YamlScalars.quote(SIGNING_STAGE))
                .when(YamlScalars.quote("always"))
                .retryMax(2)
                .retryCondition(YamlScalars.quote("always"))
                .interruptible(true)
                .clearDependencies(true)
                .build();
    }

    private GitlabJobView noopJob(JobAttributePatch patch) {
        JobAttributePatch source = patch == null ? JobAttributePatch.builder().build() : patch;
        GitlabJobView.GitlabJobViewBuilder view = serviceJob(NOOP_JOB, source)
                .allowFailure(true)
                .retryMax(0);
        if (source.getScript() == null || source.getScript().isEmpty()) {
            view.clearScript().script(quoteAll(DEFAULT_NOOP_SCRIPT));
        }
        return view.build();
    }

    private GitlabJobView.GitlabJobViewBuilder serviceJob(String name, JobAttributePatch patch) {
        Map<String, String> variables = patch.getVariables() == null ? Map.of() : new TreeMap<>(patch.getVariables());
        return GitlabJobView.builder()
                .name(YamlScalars.quote(name))
                .image(patch.getImage() == null ? null : YamlScalars.quote(patch.getImage()))
                .tags(quoteAll(patch.getTags() == null ? List.of() : patch.getTags()))
                .variables(variables.entrySet().stream().map(e -> YamlEntry.of(e.getKey(), e.getValue())).toList())
                .beforeScript(quoteAll(patch.getBeforeScript()))
                .script(quoteAll(patch.getScript()))
                .afterScript(quoteAll(patch.getAfterScript()))
                .timeout(patch.getTimeout() == null ? null : YamlScalars.quote(patch.getTimeout()));
    }

    static List<String> effectiveTags(List<String> tags, PipelineType pipelineType) {
        if (pipelineType == null) {
            return tags;
        }
        List<String> result = new ArrayList<>();
        for (String tag : tags) {
            if (!RESERVED_TAGS.contains(tag)) {
                result.add(tag);
            }
        }
        result.add(pipelineType == PipelineType.PROTECTED_BRANCH ? "protected" : "public");
        return result;
    }

    private static List<String> artifactPaths(PipelineOptions options) {
        String root = trimTrailingSlash(options.getArtifactsRoot());
        return List.of(root + "/logs", root + "/reproduction", root + "/tests", root + "/user_data");
    }

    private static List<YamlEntry> globalVariables(PipelineOptions options) {
        String root = trimTrailingSlash(options.getArtifactsRoot());
        Map<String, String> vars = new TreeMap<>();
        vars.put("PIPELINE_ARTIFACTS_ROOT", root);
        vars.put("PIPELINE_JOB_LOG_DIR", root + "/logs");
        vars.put("PIPELINE_JOB_REPRO_DIR", root + "/reproduction");
        vars.put("PIPELINE_JOB_TEST_DIR", root + "/tests");
        vars.put("PIPELINE_TYPE", options.getPipelineType() == null ? "None" : options.getPipelineType().name());
        vars.put("PIPELINE_STACK_NAME", options.getStackName() == null ? "None" : options.getStackName());
        vars.put("PIPELINE_REBUILD_CHECK_UP_TO_DATE", capitalize(options.isPruneUpToDate()));
        vars.put("PIPELINE_REBUILD_EVERYTHING", capitalize(options.isRebuildEverything()));
        return vars.entrySet().stream().map(e -> YamlEntry.of(e.getKey(), e.getValue())).toList();
    }

    private static String capitalize(boolean value) {
        return value ? "True" : "False";
    }

    private static String trimTrailingSlash(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    private static List<String> quoteAll(List<String> values) {
        return values == null ? List.of() : values.stream().map(YamlScalars::quote).toList();
    }

    private String process(Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new PipelineGenerationException("Failed to render " + TEMPLATE + ": " + e.getMessage(), e);
        }
    }
}
