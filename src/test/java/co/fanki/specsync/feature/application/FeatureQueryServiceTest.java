package co.fanki.specsync.feature.application;

import co.fanki.specsync.feature.application.FeatureQueryService.FeatureDetail;
import co.fanki.specsync.feature.application.FeatureQueryService.ProjectStats;
import co.fanki.specsync.feature.domain.Feature;
import co.fanki.specsync.feature.domain.FeatureStatus;
import co.fanki.specsync.feature.domain.InMemorySpecStore;
import co.fanki.specsync.feature.domain.Plan;
import co.fanki.specsync.feature.domain.Task;
import co.fanki.specsync.feature.domain.TaskStatus;
import co.fanki.specsync.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for FeatureQueryService.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FeatureQueryServiceTest {

    private static final String PROJECT_ID = "project-1";

    private InMemorySpecStore store;
    private FeatureQueryService service;

    private Feature login;
    private Feature search;

    @BeforeEach
    void setUp() {
        store = new InMemorySpecStore();
        service = new FeatureQueryService(store);

        login = feature("001", "login", FeatureStatus.IN_PROGRESS);
        search = feature("002", "search", FeatureStatus.DRAFT);

        store.upsertTask(task(login, "T001", TaskStatus.DONE, 1));
        store.upsertTask(task(login, "T002", TaskStatus.NOT_STARTED, 2));
        store.upsertTask(task(login, "T003", TaskStatus.IN_PROGRESS, 3));
        store.upsertTask(task(search, "T001", TaskStatus.DONE, 1));
        store.updateTaskCompletion(login.id());
        store.updateTaskCompletion(search.id());
    }

    @Test
    void whenListing_givenNoFilter_shouldReturnAllInNumberOrder() {
        assertEquals(List.of("001", "002"), service
                .listFeatures(PROJECT_ID, null).stream()
                .map(Feature::featureNumber).toList());
    }

    @Test
    void whenListing_givenStatusFilter_shouldKeepMatching() {
        assertEquals(List.of("login"), service
                .listFeatures(PROJECT_ID, "in_progress").stream()
                .map(Feature::name).toList());
        assertTrue(service.listFeatures(PROJECT_ID, "complete").isEmpty());
    }

    @Test
    void whenGettingFeature_givenKnownId_shouldReturnRecords() {
        store.upsertPlan(Plan.create(login.id(), "Add login.", Map.of(),
                List.of(), List.of(), List.of()));

        final FeatureDetail detail = service.getFeature(login.id());

        assertEquals(login.id(), detail.feature().id());
        assertEquals(3, detail.tasks().size());
        assertEquals("Add login.", detail.plan().orElseThrow().summary());
        assertTrue(detail.entities().isEmpty());
    }

    @Test
    void whenGettingFeature_givenUnknownId_shouldThrowNotFound() {
        final DomainException e = assertThrows(DomainException.class,
                () -> service.getFeature("missing"));

        assertEquals("FEATURE_NOT_FOUND", e.getErrorCode());
    }

    @Test
    void whenComputingStats_givenFeaturesAndTasks_shouldAggregate() {
        final ProjectStats stats = service.stats(PROJECT_ID);

        assertEquals(2, stats.totalFeatures());
        assertEquals(4, stats.totalTasks());
        // 33% and 100% done
        assertEquals(67, stats.averageTaskCompletion());
        assertEquals(Map.of("draft", 1L, "approved", 0L, "in_progress", 1L,
                "complete", 0L), stats.featuresByStatus());
        assertEquals(Map.of("not_started", 1L, "in_progress", 1L, "done", 2L),
                stats.tasksByStatus());
    }

    @Test
    void whenComputingStats_givenEmptyProject_shouldReturnZeros() {
        final ProjectStats stats = service.stats("other");

        assertEquals(0, stats.totalFeatures());
        assertEquals(0, stats.averageTaskCompletion());
        assertEquals(Long.valueOf(0), stats.featuresByStatus().get("draft"));
    }

    private Feature feature(final String number, final String name,
            final FeatureStatus status) {
        final Feature feature = Feature.create(PROJECT_ID, number, name,
                null);
        feature.describe(name, status, null, null, null);
        return store.upsertFeature(feature);
    }

    private static Task task(final Feature feature, final String taskId,
            final TaskStatus status, final int line) {
        return Task.create(feature.id(), taskId, "Do " + taskId, status,
                null, 0, false, List.of(), null, null, line);
    }

}
