package co.fanki.specsync.feature.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL {@link SpecStore} backed by JDBI.
 *
 * <p>Upserts use {@code INSERT ... ON CONFLICT} on each table's natural key,
 * so the surrogate ID of an existing row survives a re-sync. List and map
 * valued fields are stored as JSONB.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class JdbiSpecStore implements SpecStore {

    /** Find feature by natural key. Uses: UNIQUE (project_id, feature_number). */
    public static final String FIND_FEATURE_BY_NUMBER = """
            SELECT * FROM features
            WHERE project_id = :projectId AND feature_number = :featureNumber
            """;

    /** Find feature by ID. Uses: PK index. */
    public static final String FIND_FEATURE_BY_ID =
            "SELECT * FROM features WHERE id = :id";

    /** Find features of a project. Uses: UNIQUE (project_id, feature_number). */
    public static final String FIND_FEATURES_BY_PROJECT = """
            SELECT * FROM features
            WHERE project_id = :projectId
            ORDER BY feature_number
            """;

    /** Find tasks of a feature. Uses: UNIQUE (feature_id, task_id). */
    public static final String FIND_TASKS_BY_FEATURE = """
            SELECT * FROM tasks
            WHERE feature_id = :featureId
            ORDER BY line_number, task_id
            """;

    /** Find entity by natural key. Uses: UNIQUE (feature_id, name). */
    public static final String FIND_ENTITY_BY_NAME = """
            SELECT * FROM entities
            WHERE feature_id = :featureId AND name = :name
            """;

    /** Find entities of a feature. Uses: UNIQUE (feature_id, name). */
    public static final String FIND_ENTITIES_BY_FEATURE = """
            SELECT * FROM entities WHERE feature_id = :featureId ORDER BY name
            """;

    /** Find requirements of a feature. Uses: UNIQUE (feature_id, requirement_id). */
    public static final String FIND_REQUIREMENTS_BY_FEATURE = """
            SELECT * FROM requirements
            WHERE feature_id = :featureId
            ORDER BY requirement_id
            """;

    /** Find the plan of a feature. Uses: UNIQUE (feature_id). */
    public static final String FIND_PLAN_BY_FEATURE =
            "SELECT * FROM plans WHERE feature_id = :featureId";

    /** Find research decisions of a feature. Uses: UNIQUE (feature_id, title). */
    public static final String FIND_DECISIONS_BY_FEATURE = """
            SELECT * FROM research_decisions
            WHERE feature_id = :featureId
            ORDER BY title
            """;

    private static final TypeReference<List<String>> STRING_LIST =
            new TypeReference<>() {};

    private static final TypeReference<List<Attribute>> ATTRIBUTE_LIST =
            new TypeReference<>() {};

    private static final TypeReference<List<Relationship>> RELATIONSHIP_LIST =
            new TypeReference<>() {};

    private static final TypeReference<Map<String, String>> STRING_MAP =
            new TypeReference<>() {};

    private static final TypeReference<List<PlanPhase>> PHASE_LIST =
            new TypeReference<>() {};

    private static final TypeReference<List<Risk>> RISK_LIST =
            new TypeReference<>() {};

    private final Jdbi jdbi;

    private final ObjectMapper objectMapper;

    /**
     * Creates a new JdbiSpecStore.
     *
     * @param theJdbi the JDBI instance
     * @param theObjectMapper the Jackson ObjectMapper for JSONB columns
     */
    public JdbiSpecStore(final Jdbi theJdbi,
            final ObjectMapper theObjectMapper) {
        this.jdbi = theJdbi;
        this.objectMapper = theObjectMapper;
    }

    // -- features --

    @Override
    public Feature upsertFeature(final Feature feature) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                INSERT INTO features (
                    id, project_id, feature_number, name, title, status,
                    spec_path, priority, created_date, feature_branch,
                    task_completion_pct, created_at, updated_at
                ) VALUES (
                    :id, :projectId, :featureNumber, :name, :title, :status,
                    :specPath, :priority, :createdDate, :featureBranch,
                    :taskCompletionPct, :createdAt, :updatedAt
                )
                ON CONFLICT (project_id, feature_number) DO UPDATE SET
                    name = EXCLUDED.name,
                    title = EXCLUDED.title,
                    status = EXCLUDED.status,
                    spec_path = EXCLUDED.spec_path,
                    priority = EXCLUDED.priority,
                    created_date = EXCLUDED.created_date,
                    feature_branch = EXCLUDED.feature_branch,
                    task_completion_pct = EXCLUDED.task_completion_pct,
                    updated_at = EXCLUDED.updated_at
                RETURNING *
                """)
                .bind("id", feature.id())
                .bind("projectId", feature.projectId())
                .bind("featureNumber", feature.featureNumber())
                .bind("name", feature.name())
                .bind("title", feature.title())
                .bind("status", feature.status().value())
                .bind("specPath", feature.specPath())
                .bind("priority", feature.priority())
                .bind("createdDate", feature.createdDate())
                .bind("featureBranch", feature.featureBranch())
                .bind("taskCompletionPct", feature.taskCompletionPct())
                .bind("createdAt", toTimestamp(feature.createdAt()))
                .bind("updatedAt", toTimestamp(feature.updatedAt()))
                .map(new FeatureRowMapper())
                .one());
    }

    @Override
    public Optional<Feature> findFeatureByNumber(final String projectId,
            final String featureNumber) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_FEATURE_BY_NUMBER)
                .bind("projectId", projectId)
                .bind("featureNumber", featureNumber)
                .map(new FeatureRowMapper())
                .findOne());
    }

    @Override
    public Optional<Feature> findFeatureById(final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_FEATURE_BY_ID)
                .bind("id", featureId)
                .map(new FeatureRowMapper())
                .findOne());
    }

    @Override
    public List<Feature> findFeaturesByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_FEATURES_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new FeatureRowMapper())
                .list());
    }

    @Override
    public void deleteFeature(final String featureId) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM features WHERE id = :id")
                .bind("id", featureId)
                .execute());
    }

    @Override
    public int updateTaskCompletion(final String featureId) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                UPDATE features SET
                    task_completion_pct = COALESCE((
                        SELECT CAST(ROUND(100.0
                            * COUNT(*) FILTER (WHERE status = 'done')
                            / NULLIF(COUNT(*), 0)) AS INTEGER)
                        FROM tasks WHERE feature_id = :id), 0),
                    updated_at = :updatedAt
                WHERE id = :id
                RETURNING task_completion_pct
                """)
                .bind("id", featureId)
                .bind("updatedAt", toTimestamp(Instant.now()))
                .mapTo(Integer.class)
                .findOne()
                .orElse(0));
    }

    // -- tasks --

    @Override
    public void deleteTasksByFeature(final String featureId) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM tasks WHERE feature_id = :featureId")
                .bind("featureId", featureId)
                .execute());
    }

    @Override
    public void upsertTask(final Task task) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO tasks (
                    id, feature_id, task_id, description, status, phase,
                    phase_order, is_parallel, dependencies, story_label,
                    file_path, line_number
                ) VALUES (
                    :id, :featureId, :taskId, :description, :status, :phase,
                    :phaseOrder, :parallel, CAST(:dependencies AS JSONB),
                    :storyLabel, :filePath, :lineNumber
                )
                ON CONFLICT (feature_id, task_id) DO UPDATE SET
                    description = EXCLUDED.description,
                    status = EXCLUDED.status,
                    phase = EXCLUDED.phase,
                    phase_order = EXCLUDED.phase_order,
                    is_parallel = EXCLUDED.is_parallel,
                    dependencies = EXCLUDED.dependencies,
                    story_label = EXCLUDED.story_label,
                    file_path = EXCLUDED.file_path,
                    line_number = EXCLUDED.line_number
                """)
                .bind("id", task.id())
                .bind("featureId", task.featureId())
                .bind("taskId", task.taskId())
                .bind("description", task.description())
                .bind("status", task.status().value())
                .bind("phase", task.phase())
                .bind("phaseOrder", task.phaseOrder())
                .bind("parallel", task.isParallel())
                .bind("dependencies", toJson(task.dependencies()))
                .bind("storyLabel", task.storyLabel())
                .bind("filePath", task.filePath())
                .bind("lineNumber", task.lineNumber())
                .execute());
    }

    @Override
    public List<Task> findTasksByFeature(final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_TASKS_BY_FEATURE)
                .bind("featureId", featureId)
                .map(new TaskRowMapper(objectMapper))
                .list());
    }

    // -- entities --

    @Override
    public void upsertEntity(final DataEntity entity) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO entities (
                    id, feature_id, name, description, attributes,
                    relationships, validation_rules
                ) VALUES (
                    :id, :featureId, :name, :description,
                    CAST(:attributes AS JSONB), CAST(:relationships AS JSONB),
                    CAST(:validationRules AS JSONB)
                )
                ON CONFLICT (feature_id, name) DO UPDATE SET
                    description = EXCLUDED.description,
                    attributes = EXCLUDED.attributes,
                    relationships = EXCLUDED.relationships,
                    validation_rules = EXCLUDED.validation_rules
                """)
                .bind("id", entity.id())
                .bind("featureId", entity.featureId())
                .bind("name", entity.name())
                .bind("description", entity.description())
                .bind("attributes", toJson(entity.attributes()))
                .bind("relationships", toJson(entity.relationships()))
                .bind("validationRules", toJson(entity.validationRules()))
                .execute());
    }

    @Override
    public Optional<DataEntity> findEntityByName(final String featureId,
            final String name) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ENTITY_BY_NAME)
                .bind("featureId", featureId)
                .bind("name", name)
                .map(new EntityRowMapper(objectMapper))
                .findOne());
    }

    @Override
    public List<DataEntity> findEntitiesByFeature(final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ENTITIES_BY_FEATURE)
                .bind("featureId", featureId)
                .map(new EntityRowMapper(objectMapper))
                .list());
    }

    // -- requirements --

    @Override
    public void deleteRequirementsByFeature(final String featureId) {
        jdbi.useHandle(handle -> handle
                .createUpdate(
                        "DELETE FROM requirements WHERE feature_id = :featureId")
                .bind("featureId", featureId)
                .execute());
    }

    @Override
    public void upsertRequirement(final Requirement requirement) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO requirements (
                    id, feature_id, requirement_id, type, description,
                    priority, linked_tasks, acceptance_criteria
                ) VALUES (
                    :id, :featureId, :requirementId, :type, :description,
                    :priority, CAST(:linkedTasks AS JSONB),
                    CAST(:acceptanceCriteria AS JSONB)
                )
                ON CONFLICT (feature_id, requirement_id) DO UPDATE SET
                    type = EXCLUDED.type,
                    description = EXCLUDED.description,
                    priority = EXCLUDED.priority,
                    linked_tasks = EXCLUDED.linked_tasks,
                    acceptance_criteria = EXCLUDED.acceptance_criteria
                """)
                .bind("id", requirement.id())
                .bind("featureId", requirement.featureId())
                .bind("requirementId", requirement.requirementId())
                .bind("type", requirement.type().value())
                .bind("description", requirement.description())
                .bind("priority", requirement.priority())
                .bind("linkedTasks", toJson(requirement.linkedTasks()))
                .bind("acceptanceCriteria",
                        toJson(requirement.acceptanceCriteria()))
                .execute());
    }

    @Override
    public List<Requirement> findRequirementsByFeature(final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_REQUIREMENTS_BY_FEATURE)
                .bind("featureId", featureId)
                .map(new RequirementRowMapper(objectMapper))
                .list());
    }

    // -- plan --

    @Override
    public void upsertPlan(final Plan plan) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO plans (
                    id, feature_id, summary, tech_stack, phases,
                    dependencies, risks
                ) VALUES (
                    :id, :featureId, :summary, CAST(:techStack AS JSONB),
                    CAST(:phases AS JSONB), CAST(:dependencies AS JSONB),
                    CAST(:risks AS JSONB)
                )
                ON CONFLICT (feature_id) DO UPDATE SET
                    summary = EXCLUDED.summary,
                    tech_stack = EXCLUDED.tech_stack,
                    phases = EXCLUDED.phases,
                    dependencies = EXCLUDED.dependencies,
                    risks = EXCLUDED.risks
                """)
                .bind("id", plan.id())
                .bind("featureId", plan.featureId())
                .bind("summary", plan.summary())
                .bind("techStack", toJson(plan.techStack()))
                .bind("phases", toJson(plan.phases()))
                .bind("dependencies", toJson(plan.dependencies()))
                .bind("risks", toJson(plan.risks()))
                .execute());
    }

    @Override
    public Optional<Plan> findPlanByFeature(final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_PLAN_BY_FEATURE)
                .bind("featureId", featureId)
                .map(new PlanRowMapper(objectMapper))
                .findOne());
    }

    // -- research decisions --

    @Override
    public void deleteResearchDecisionsByFeature(final String featureId) {
        jdbi.useHandle(handle -> handle
                .createUpdate("""
                        DELETE FROM research_decisions
                        WHERE feature_id = :featureId
                        """)
                .bind("featureId", featureId)
                .execute());
    }

    @Override
    public void upsertResearchDecision(final ResearchDecision decision) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO research_decisions (
                    id, feature_id, title, decision, rationale,
                    alternatives, context
                ) VALUES (
                    :id, :featureId, :title, :decision, :rationale,
                    CAST(:alternatives AS JSONB), :context
                )
                ON CONFLICT (feature_id, title) DO UPDATE SET
                    decision = EXCLUDED.decision,
                    rationale = EXCLUDED.rationale,
                    alternatives = EXCLUDED.alternatives,
                    context = EXCLUDED.context
                """)
                .bind("id", decision.id())
                .bind("featureId", decision.featureId())
                .bind("title", decision.title())
                .bind("decision", decision.decision())
                .bind("rationale", decision.rationale())
                .bind("alternatives", toJson(decision.alternatives()))
                .bind("context", decision.context())
                .execute());
    }

    @Override
    public List<ResearchDecision> findResearchDecisionsByFeature(
            final String featureId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_DECISIONS_BY_FEATURE)
                .bind("featureId", featureId)
                .map(new DecisionRowMapper(objectMapper))
                .list());
    }

    private String toJson(final Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize "
                    + value.getClass().getSimpleName() + " to JSON", e);
        }
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static <T> T fromJson(final ObjectMapper objectMapper,
            final ResultSet rs, final String column,
            final TypeReference<T> type, final T empty) throws SQLException {
        final String json = rs.getString(column);
        if (json == null || json.isBlank()) {
            return empty;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (final JsonProcessingException e) {
            throw new SQLException("Invalid JSON in column " + column, e);
        }
    }

    private static final class FeatureRowMapper implements RowMapper<Feature> {

        @Override
        public Feature map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Feature.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("feature_number"),
                    rs.getString("name"),
                    rs.getString("title"),
                    FeatureStatus.parse(rs.getString("status")),
                    rs.getString("spec_path"),
                    rs.getString("priority"),
                    rs.getString("created_date"),
                    rs.getString("feature_branch"),
                    rs.getInt("task_completion_pct"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

    private static final class TaskRowMapper implements RowMapper<Task> {

        private final ObjectMapper objectMapper;

        TaskRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public Task map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Task.reconstitute(
                    rs.getString("id"),
                    rs.getString("feature_id"),
                    rs.getString("task_id"),
                    rs.getString("description"),
                    TaskStatus.fromValue(rs.getString("status")),
                    rs.getString("phase"),
                    rs.getInt("phase_order"),
                    rs.getBoolean("is_parallel"),
                    fromJson(objectMapper, rs, "dependencies", STRING_LIST,
                            List.of()),
                    rs.getString("story_label"),
                    rs.getString("file_path"),
                    rs.getInt("line_number"));
        }
    }

    private static final class EntityRowMapper implements RowMapper<DataEntity> {

        private final ObjectMapper objectMapper;

        EntityRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public DataEntity map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return DataEntity.reconstitute(
                    rs.getString("id"),
                    rs.getString("feature_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    fromJson(objectMapper, rs, "attributes", ATTRIBUTE_LIST,
                            List.of()),
                    fromJson(objectMapper, rs, "relationships",
                            RELATIONSHIP_LIST, List.of()),
                    fromJson(objectMapper, rs, "validation_rules", STRING_LIST,
                            List.of()));
        }
    }

    private static final class RequirementRowMapper
            implements RowMapper<Requirement> {

        private final ObjectMapper objectMapper;

        RequirementRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public Requirement map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Requirement.reconstitute(
                    rs.getString("id"),
                    rs.getString("feature_id"),
                    rs.getString("requirement_id"),
                    rs.getString("description"),
                    RequirementType.fromValue(rs.getString("type")),
                    rs.getString("priority"),
                    fromJson(objectMapper, rs, "linked_tasks", STRING_LIST,
                            List.of()),
                    fromJson(objectMapper, rs, "acceptance_criteria",
                            STRING_LIST, List.of()));
        }
    }

    private static final class PlanRowMapper implements RowMapper<Plan> {

        private final ObjectMapper objectMapper;

        PlanRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public Plan map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Plan.reconstitute(
                    rs.getString("id"),
                    rs.getString("feature_id"),
                    rs.getString("summary"),
                    fromJson(objectMapper, rs, "tech_stack", STRING_MAP,
                            Map.of()),
                    fromJson(objectMapper, rs, "phases", PHASE_LIST,
                            List.of()),
                    fromJson(objectMapper, rs, "dependencies", STRING_LIST,
                            List.of()),
                    fromJson(objectMapper, rs, "risks", RISK_LIST, List.of()));
        }
    }

    private static final class DecisionRowMapper
            implements RowMapper<ResearchDecision> {

        private final ObjectMapper objectMapper;

        DecisionRowMapper(final ObjectMapper theObjectMapper) {
            this.objectMapper = theObjectMapper;
        }

        @Override
        public ResearchDecision map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return ResearchDecision.reconstitute(
                    rs.getString("id"),
                    rs.getString("feature_id"),
                    rs.getString("title"),
                    rs.getString("decision"),
                    rs.getString("rationale"),
                    fromJson(objectMapper, rs, "alternatives", STRING_LIST,
                            List.of()),
                    rs.getString("context"));
        }
    }

}
