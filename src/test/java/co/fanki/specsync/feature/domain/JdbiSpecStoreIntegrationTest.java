package co.fanki.specsync.feature.domain;

import co.fanki.specsync.project.domain.Project;
import co.fanki.specsync.project.domain.ProjectRepository;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for JdbiSpecStore using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class JdbiSpecStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    @Autowired
    private SpecStore store;

    @Autowired
    private ProjectRepository projectRepository;

    private Project project;

    @BeforeEach
    void setUp() {
        jdbi.useHandle(handle -> handle.execute("DELETE FROM projects"));
        project = Project.create(null, Path.of("/work/billing"));
        projectRepository.save(project);
    }

    @Test
    void whenUpsertingFeature_givenSameNumber_shouldKeepStoredId() {
        final Feature first = store.upsertFeature(feature("001", "login"));
        final Feature again = feature("001", "sign-in");
        again.describe("Sign In", FeatureStatus.APPROVED, "P1", "2025-01-15",
                "001-sign-in");

        final Feature stored = store.upsertFeature(again);

        assertEquals(first.id(), stored.id());
        assertEquals("sign-in", stored.name());
        assertEquals(FeatureStatus.APPROVED, stored.status());
        assertEquals(1, store.findFeaturesByProject(project.id()).size());
    }

    @Test
    void whenFindingFeatures_givenSeveral_shouldOrderByNumber() {
        store.upsertFeature(feature("002", "search"));
        store.upsertFeature(feature("001", "login"));

        assertEquals(List.of("001", "002"), store
                .findFeaturesByProject(project.id()).stream()
                .map(Feature::featureNumber).toList());
    }

    @Test
    void whenUpsertingTasks_givenDoneTasks_shouldComputeCompletion() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertTask(task(feature, "T001", TaskStatus.DONE, 3,
                List.of()));
        store.upsertTask(task(feature, "T002", TaskStatus.NOT_STARTED, 4,
                List.of("T001")));
        store.upsertTask(task(feature, "T003", TaskStatus.DONE, 5,
                List.of()));

        assertEquals(67, store.updateTaskCompletion(feature.id()));
        assertEquals(67, store.findFeatureById(feature.id()).orElseThrow()
                .taskCompletionPct());

        final List<Task> tasks = store.findTasksByFeature(feature.id());
        assertEquals(List.of("T001", "T002", "T003"),
                tasks.stream().map(Task::taskId).toList());
        assertEquals(List.of("T001"), tasks.get(1).dependencies());
    }

    @Test
    void whenDeletingTasks_givenFeature_shouldResetCompletionToZero() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertTask(task(feature, "T001", TaskStatus.DONE, 3,
                List.of()));
        store.updateTaskCompletion(feature.id());

        store.deleteTasksByFeature(feature.id());

        assertEquals(0, store.updateTaskCompletion(feature.id()));
        assertTrue(store.findTasksByFeature(feature.id()).isEmpty());
    }

    @Test
    void whenUpsertingEntity_givenSameName_shouldReplaceContentKeepingId() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        final DataEntity user = DataEntity.create(feature.id(), "User",
                "A person", List.of(new Attribute("id", "UUID",
                        "primary key")),
                List.of(new Relationship("Session",
                        Cardinality.ONE_TO_MANY, null)),
                List.of("email must be unique"));
        store.upsertEntity(user);

        store.upsertEntity(DataEntity.create(feature.id(), "User",
                "A registered person", List.of(), List.of(), List.of()));

        final DataEntity stored = store.findEntityByName(feature.id(), "User")
                .orElseThrow();
        assertEquals(user.id(), stored.id());
        assertEquals("A registered person", stored.description());
        assertTrue(stored.attributes().isEmpty());
    }

    @Test
    void whenUpsertingEntity_givenAttributes_shouldRoundTripJson() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        final Attribute id = new Attribute("id", "UUID", "primary key");
        final Relationship sessions = new Relationship("Session",
                Cardinality.ONE_TO_MANY, "has many Sessions");
        store.upsertEntity(DataEntity.create(feature.id(), "User", null,
                List.of(id), List.of(sessions), List.of()));

        final DataEntity stored = store.findEntitiesByFeature(feature.id())
                .get(0);

        assertEquals(List.of(id), stored.attributes());
        assertEquals(List.of(sessions), stored.relationships());
    }

    @Test
    void whenReplacingRequirements_givenNewSet_shouldDropOldOnes() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertRequirement(Requirement.create(feature.id(), "FR-001",
                "Authenticate", null, List.of(), List.of()));
        store.upsertRequirement(Requirement.create(feature.id(), "NFR-001",
                "Fast", "P1", List.of("T002"), List.of("under 200ms")));

        store.deleteRequirementsByFeature(feature.id());
        store.upsertRequirement(Requirement.create(feature.id(), "FR-001",
                "Authenticate users", null, List.of("T001"), List.of()));

        final List<Requirement> requirements =
                store.findRequirementsByFeature(feature.id());
        assertEquals(1, requirements.size());
        assertEquals("Authenticate users", requirements.get(0).description());
        assertEquals(RequirementType.FUNCTIONAL, requirements.get(0).type());
        assertEquals(List.of("T001"), requirements.get(0).linkedTasks());
    }

    @Test
    void whenUpserting_givenLongParsedText_shouldStoreItWhole() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        final String longName = "Entity " + "x".repeat(400);
        final String longId = "FR-" + "1".repeat(60);

        store.upsertEntity(DataEntity.create(feature.id(), longName, null,
                List.of(), List.of(), List.of()));
        store.upsertRequirement(Requirement.create(feature.id(), longId,
                "Very long identifier", null, List.of(), List.of()));

        assertEquals(longName, store.findEntityByName(feature.id(), longName)
                .orElseThrow().name());
        assertEquals(longId, store.findRequirementsByFeature(feature.id())
                .get(0).requirementId());
    }

    @Test
    void whenUpsertingPlan_givenExistingPlan_shouldReplaceIt() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertPlan(Plan.create(feature.id(), "First", Map.of(),
                List.of(), List.of(), List.of()));
        final Plan second = Plan.create(feature.id(), "Second",
                Map.of("Language", "Java 17"),
                List.of(new PlanPhase("Phase 1", "Build", 1,
                        List.of("Write code"))),
                List.of("Database"),
                List.of(new Risk("Drift", "pin versions")));

        store.upsertPlan(second);

        final Plan stored = store.findPlanByFeature(feature.id())
                .orElseThrow();
        assertEquals("Second", stored.summary());
        assertEquals(Map.of("Language", "Java 17"), stored.techStack());
        assertEquals(second.phases(), stored.phases());
        assertEquals(second.risks(), stored.risks());
    }

    @Test
    void whenUpsertingDecisions_givenSameTitle_shouldMerge() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertResearchDecision(ResearchDecision.create(feature.id(),
                "Hashing", "bcrypt", null, List.of(), null));
        store.upsertResearchDecision(ResearchDecision.create(feature.id(),
                "Storage", "PostgreSQL", null, List.of(), null));
        store.upsertResearchDecision(ResearchDecision.create(feature.id(),
                "Hashing", "argon2", "Stronger", List.of("bcrypt"), null));

        final List<ResearchDecision> decisions =
                store.findResearchDecisionsByFeature(feature.id());

        assertEquals(2, decisions.size());
        assertEquals("argon2", decisions.get(0).decision());
        assertEquals(List.of("bcrypt"), decisions.get(0).alternatives());

        store.deleteResearchDecisionsByFeature(feature.id());
        assertTrue(store.findResearchDecisionsByFeature(feature.id())
                .isEmpty());
    }

    @Test
    void whenDeletingFeature_givenChildren_shouldCascade() {
        final Feature feature = store.upsertFeature(feature("001", "login"));
        store.upsertTask(task(feature, "T001", TaskStatus.DONE, 1,
                List.of()));
        final Feature other = store.upsertFeature(feature("002", "search"));

        store.deleteFeature(feature.id());

        assertTrue(store.findFeatureById(feature.id()).isEmpty());
        assertTrue(store.findTasksByFeature(feature.id()).isEmpty());
        assertNotEquals(feature.id(), other.id());
        assertTrue(store.findFeatureById(other.id()).isPresent());
    }

    private Feature feature(final String number, final String name) {
        return Feature.create(project.id(), number, name,
                "/work/billing/specs/" + number + "-" + name + "/spec.md");
    }

    private static Task task(final Feature feature, final String taskId,
            final TaskStatus status, final int line,
            final List<String> dependencies) {
        return Task.create(feature.id(), taskId, "Do " + taskId, status,
                "Phase 1", 1, false, dependencies, null, null, line);
    }

}
