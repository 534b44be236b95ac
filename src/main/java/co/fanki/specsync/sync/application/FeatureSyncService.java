package co.fanki.specsync.sync.application;

import co.fanki.specsync.feature.domain.DataEntity;
import co.fanki.specsync.feature.domain.Feature;
import co.fanki.specsync.feature.domain.FeatureDirectory;
import co.fanki.specsync.feature.domain.FeatureStatus;
import co.fanki.specsync.feature.domain.Plan;
import co.fanki.specsync.feature.domain.Requirement;
import co.fanki.specsync.feature.domain.ResearchDecision;
import co.fanki.specsync.feature.domain.SpecStore;
import co.fanki.specsync.feature.domain.Task;
import co.fanki.specsync.parsing.domain.DataModelParser;
import co.fanki.specsync.parsing.domain.DocumentParser;
import co.fanki.specsync.parsing.domain.ParsedDataModel;
import co.fanki.specsync.parsing.domain.ParsedDataModel.ParsedEntity;
import co.fanki.specsync.parsing.domain.ParsedPlan;
import co.fanki.specsync.parsing.domain.ParsedRequirement;
import co.fanki.specsync.parsing.domain.ParsedResearch;
import co.fanki.specsync.parsing.domain.ParsedResearch.ParsedDecision;
import co.fanki.specsync.parsing.domain.ParsedSpec;
import co.fanki.specsync.parsing.domain.ParsedSpec.UserStory;
import co.fanki.specsync.parsing.domain.ParsedTasks;
import co.fanki.specsync.parsing.domain.ParsedTasks.ParsedTask;
import co.fanki.specsync.parsing.domain.PlanParser;
import co.fanki.specsync.parsing.domain.ResearchParser;
import co.fanki.specsync.parsing.domain.SpecParser;
import co.fanki.specsync.parsing.domain.TasksParser;
import co.fanki.specsync.shared.DomainException;
import co.fanki.specsync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mirrors the feature documents of a project into the {@link SpecStore}.
 *
 * <p>A full sync walks {@code <root>/specs}, syncing every {@code NNN-name}
 * directory in name order. The documents of one feature are applied in a
 * fixed order (spec, tasks, data model, requirements, plan, research) so
 * the feature row exists before any child row is written. Tasks and
 * requirements are replaced as a set; entities, the plan and research
 * decisions are upserted and never removed by a sync.</p>
 *
 * <p>A failure in one feature is recorded in the {@link SyncResult} and
 * the walk goes on with the next feature.</p>
 *
 * <p>An incremental sync takes one changed path, resolves its feature
 * directory and re-applies only the document that changed. A path of a
 * feature the store does not know yet triggers a full sync instead.</p>
 *
 * <p>Features are processed one at a time. Concurrent calls for the same
 * project are not isolated from each other; callers serialize them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FeatureSyncService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FeatureSyncService.class);

    /** Error reported when a project has no specs directory. */
    public static final String SPECS_NOT_FOUND = "specs directory not found";

    private final SpecStore store;
    private final SpecParser specParser;
    private final TasksParser tasksParser;
    private final DataModelParser dataModelParser;
    private final PlanParser planParser;
    private final ResearchParser researchParser;

    /**
     * Creates a new FeatureSyncService.
     *
     * @param theStore the store the documents are mirrored into
     * @param theSpecParser the spec.md parser
     * @param theTasksParser the tasks.md parser
     * @param theDataModelParser the data-model.md parser
     * @param thePlanParser the plan.md parser
     * @param theResearchParser the research.md parser
     */
    public FeatureSyncService(
            final SpecStore theStore,
            final SpecParser theSpecParser,
            final TasksParser theTasksParser,
            final DataModelParser theDataModelParser,
            final PlanParser thePlanParser,
            final ResearchParser theResearchParser) {
        this.store = Preconditions.requireNonNull(theStore,
                "Spec store is required");
        this.specParser = theSpecParser;
        this.tasksParser = theTasksParser;
        this.dataModelParser = theDataModelParser;
        this.planParser = thePlanParser;
        this.researchParser = theResearchParser;
    }

    /**
     * Syncs every feature directory of a project.
     *
     * <p>Stored features whose directory no longer exists are deleted
     * together with their records.</p>
     *
     * @param projectId the project ID
     * @param projectRoot the project root directory
     * @return the number of synced features and the per-feature errors
     */
    public SyncResult syncProject(final String projectId,
            final Path projectRoot) {
        Preconditions.requireNonBlank(projectId, "Project ID is required");
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        final Path specsDir = projectRoot.resolve(FeatureDirectory.SPECS_DIR);
        if (!Files.isDirectory(specsDir)) {
            LOG.warn("No specs directory under {}", projectRoot);
            return new SyncResult(0, List.of(SPECS_NOT_FOUND));
        }

        final List<FeatureDirectory> directories;
        try {
            directories = FeatureDirectory.list(specsDir);
        } catch (final IOException e) {
            LOG.error("Cannot list {}", specsDir, e);
            return new SyncResult(0, List.of("Failed to list "
                    + FeatureDirectory.SPECS_DIR + ": " + e.getMessage()));
        }

        LOG.info("Syncing {} feature directories of project {}",
                directories.size(), projectId);

        int synced = 0;
        final List<String> errors = new ArrayList<>();

        for (final FeatureDirectory directory : directories) {
            try {
                syncFeature(projectId, directory);
                synced++;
            } catch (final IOException | RuntimeException e) {
                LOG.warn("Failed to sync feature {}: {}",
                        directory.directoryName(), e.getMessage(), e);
                errors.add("Failed to sync " + directory.directoryName()
                        + ": " + e.getMessage());
            }
        }

        removeVanishedFeatures(projectId, directories);

        LOG.info("Project {} synced. Features: {}, errors: {}",
                projectId, synced, errors.size());
        return new SyncResult(synced, errors);
    }

    /**
     * Re-applies the document at the given path.
     *
     * <p>Returns false, without touching the store, for paths outside any
     * feature directory, for document names no parser handles and for
     * documents that no longer exist. When the feature directory itself
     * is gone the feature is deleted.</p>
     *
     * @param projectId the project ID
     * @param file the changed file
     * @return true if the change was handled
     * @throws DomainException with code {@code FEATURE_SYNC_FAILED} if the
     *         document cannot be read
     */
    public boolean syncPath(final String projectId, final Path file) {
        Preconditions.requireNonBlank(projectId, "Project ID is required");
        Preconditions.requireNonNull(file, "File is required");

        final Optional<FeatureDirectory> resolved = FeatureDirectory.resolve(
                file);
        if (resolved.isEmpty()) {
            LOG.debug("{} is outside every feature directory", file);
            return false;
        }
        final FeatureDirectory directory = resolved.get();

        final Optional<Feature> known = store.findFeatureByNumber(projectId,
                directory.featureNumber());
        if (known.isEmpty()) {
            LOG.info("Feature {} is not known yet, syncing project {}",
                    directory.directoryName(), projectId);
            syncProject(projectId, directory.projectRoot());
            return true;
        }

        if (!Files.isDirectory(directory.path())) {
            LOG.info("Feature directory {} was removed",
                    directory.directoryName());
            store.deleteFeature(known.get().id());
            return true;
        }

        if (!Files.isRegularFile(file)) {
            LOG.debug("{} no longer exists, nothing to sync", file);
            return false;
        }

        try {
            return syncDocument(projectId, known.get(), directory, file);
        } catch (final IOException e) {
            throw new DomainException("Failed to sync " + file + ": "
                    + e.getMessage(), "FEATURE_SYNC_FAILED", e);
        }
    }

    private void syncFeature(final String projectId,
            final FeatureDirectory directory) throws IOException {
        LOG.debug("Syncing feature {}", directory.directoryName());

        final Optional<ParsedSpec> spec = read(specParser, directory);
        final Feature feature = storeFeature(projectId, directory,
                spec.orElse(null));

        final Optional<ParsedTasks> tasks = read(tasksParser, directory);
        if (tasks.isPresent()) {
            replaceTasks(feature, tasks.get());
        }

        final Optional<ParsedDataModel> dataModel = read(dataModelParser,
                directory);
        if (dataModel.isPresent()) {
            mergeEntities(feature, dataModel.get());
        }

        if (spec.isPresent()) {
            replaceRequirements(feature, spec.get());
        }

        final Optional<ParsedPlan> plan = read(planParser, directory);
        if (plan.isPresent()) {
            storePlan(feature, plan.get());
        }

        final Optional<ParsedResearch> research = read(researchParser,
                directory);
        if (research.isPresent()) {
            mergeDecisions(feature, research.get());
        }
    }

    private boolean syncDocument(final String projectId,
            final Feature feature, final FeatureDirectory directory,
            final Path file) throws IOException {
        final String fileName = file.getFileName().toString();

        if (specParser.accepts(file)) {
            final ParsedSpec spec = specParser.parse(file);
            replaceRequirements(storeFeature(projectId, directory, spec), spec);
        } else if (tasksParser.accepts(file)) {
            replaceTasks(feature, tasksParser.parse(file));
            relinkRequirements(feature);
        } else if (dataModelParser.accepts(file)) {
            mergeEntities(feature, dataModelParser.parse(file));
        } else if (planParser.accepts(file)) {
            storePlan(feature, planParser.parse(file));
        } else if (researchParser.accepts(file)) {
            mergeDecisions(feature, researchParser.parse(file));
        } else {
            LOG.debug("No parser handles {}", file);
            return false;
        }
        LOG.info("Synced {} of feature {}", fileName,
                directory.directoryName());
        return true;
    }

    private static <T> Optional<T> read(final DocumentParser<T> parser,
            final FeatureDirectory directory) throws IOException {
        final Path file = directory.path().resolve(parser.fileName());
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(parser.parse(file));
    }

    private Feature storeFeature(final String projectId,
            final FeatureDirectory directory, final ParsedSpec spec) {
        final String specPath = directory.path()
                .resolve(specParser.fileName()).toString();

        final Feature feature = store.findFeatureByNumber(projectId,
                directory.featureNumber())
                .orElseGet(() -> Feature.create(projectId,
                        directory.featureNumber(), directory.name(), specPath));
        feature.rename(directory.name());
        feature.relocate(specPath);

        if (spec == null) {
            feature.describe(null, FeatureStatus.DRAFT, null, null, null);
        } else {
            feature.describe(spec.title(), FeatureStatus.parse(spec.status()),
                    highestPriority(spec.userStories()), spec.createdDate(),
                    spec.featureBranch());
        }
        return store.upsertFeature(feature);
    }

    private void replaceTasks(final Feature feature, final ParsedTasks tasks) {
        store.deleteTasksByFeature(feature.id());
        for (final ParsedTask task : tasks.tasks()) {
            store.upsertTask(Task.create(
                    feature.id(),
                    task.taskId(),
                    task.description(),
                    task.status(),
                    task.phase(),
                    task.phaseOrder(),
                    task.parallel(),
                    task.dependencies(),
                    task.storyLabel(),
                    task.filePath(),
                    task.lineNumber()));
        }
        final int completion = store.updateTaskCompletion(feature.id());
        LOG.debug("Feature {}: {} tasks, {}% done", feature.directoryName(),
                tasks.tasks().size(), completion);
    }

    private void mergeEntities(final Feature feature,
            final ParsedDataModel dataModel) {
        for (final ParsedEntity entity : dataModel.entities()) {
            if (entity.name().isBlank()) {
                LOG.debug("Skipping unnamed entity of feature {}",
                        feature.directoryName());
                continue;
            }
            final String id = store.findEntityByName(feature.id(),
                    entity.name()).map(DataEntity::id).orElse(null);
            final DataEntity merged = id == null
                    ? DataEntity.create(feature.id(), entity.name(),
                            entity.description(), entity.attributes(),
                            entity.relationships(), entity.validationRules())
                    : DataEntity.reconstitute(id, feature.id(), entity.name(),
                            entity.description(), entity.attributes(),
                            entity.relationships(), entity.validationRules());
            store.upsertEntity(merged);
        }
    }

    private void replaceRequirements(final Feature feature,
            final ParsedSpec spec) {
        final List<Task> tasks = store.findTasksByFeature(feature.id());
        store.deleteRequirementsByFeature(feature.id());
        for (final ParsedRequirement requirement : spec.requirements()) {
            store.upsertRequirement(Requirement.create(
                    feature.id(),
                    requirement.id(),
                    requirement.description(),
                    requirement.priority(),
                    linkedTasks(tasks, requirement.id()),
                    requirement.acceptanceCriteria()));
        }
    }

    private void relinkRequirements(final Feature feature) {
        final List<Task> tasks = store.findTasksByFeature(feature.id());
        for (final Requirement requirement
                : store.findRequirementsByFeature(feature.id())) {
            store.upsertRequirement(requirement.linkTo(
                    linkedTasks(tasks, requirement.requirementId())));
        }
    }

    private void storePlan(final Feature feature, final ParsedPlan plan) {
        final Optional<Plan> existing = store.findPlanByFeature(feature.id());
        store.upsertPlan(existing.isPresent()
                ? Plan.reconstitute(existing.get().id(), feature.id(),
                        plan.summary(), plan.techStack(), plan.phases(),
                        plan.dependencies(), plan.risks())
                : Plan.create(feature.id(), plan.summary(), plan.techStack(),
                        plan.phases(), plan.dependencies(), plan.risks()));
    }

    private void mergeDecisions(final Feature feature,
            final ParsedResearch research) {
        for (final ParsedDecision decision : research.decisions()) {
            if (decision.title().isBlank()) {
                LOG.debug("Skipping untitled decision of feature {}",
                        feature.directoryName());
                continue;
            }
            store.upsertResearchDecision(ResearchDecision.create(
                    feature.id(),
                    decision.title(),
                    decision.decision(),
                    decision.rationale(),
                    decision.alternatives(),
                    decision.context()));
        }
    }

    private void removeVanishedFeatures(final String projectId,
            final List<FeatureDirectory> directories) {
        final Set<String> present = directories.stream()
                .map(FeatureDirectory::featureNumber)
                .collect(Collectors.toSet());
        for (final Feature feature : store.findFeaturesByProject(projectId)) {
            if (!present.contains(feature.featureNumber())) {
                LOG.info("Removing feature {}, its directory is gone",
                        feature.directoryName());
                store.deleteFeature(feature.id());
            }
        }
    }

    private static List<String> linkedTasks(final List<Task> tasks,
            final String requirementId) {
        return tasks.stream()
                .filter(task -> task.mentions(requirementId))
                .map(Task::taskId)
                .toList();
    }

    /**
     * Returns the most urgent story priority, P1 being the highest.
     */
    private static String highestPriority(final List<UserStory> stories) {
        return stories.stream()
                .map(UserStory::priority)
                .min(Comparator.naturalOrder())
                .orElse(null);
    }

}
