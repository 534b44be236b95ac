package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.FlexmarkBlockParser;
import co.fanki.specsync.feature.domain.PlanPhase;
import co.fanki.specsync.feature.domain.Risk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for PlanParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PlanParserTest {

    private static final String PLAN = """
            # Implementation Plan: User Login

            ## Summary

            Add email and password login backed by the user store.

            Second paragraph is ignored.

            ## Technical Context

            **Language/Version**: Java 17
            **Primary Dependencies**: `Spring Boot` 3.2

            - **Storage**: PostgreSQL

            ## Phase 0: Research

            Pick a password hashing scheme.

            - Compare bcrypt and argon2

            ## Phase 1: Build

            Ship the endpoint.

            - Implement controller
            - Add tests

            ## Dependencies

            - User store migration

            ## Risks

            - Brute force attacks - rate limit sign in
            - Token leakage: short expiry
            - Something without a delimiter
            """;

    private final PlanParser parser = new PlanParser(new FlexmarkBlockParser());

    @Test
    void whenParsing_givenSummarySection_shouldKeepFirstParagraph() {
        assertEquals("Add email and password login backed by the user store.",
                parser.parseContent(PLAN).summary());
    }

    @Test
    void whenParsing_givenTechnicalContext_shouldCollectKeyValuePairs() {
        final Map<String, String> techStack = parser.parseContent(PLAN)
                .techStack();

        assertEquals(Map.of(
                "Language/Version", "Java 17",
                "Primary Dependencies", "Spring Boot 3.2",
                "Storage", "PostgreSQL"), techStack);
    }

    @Test
    void whenParsing_givenPhaseSections_shouldBuildOrderedPhases() {
        final List<PlanPhase> phases = parser.parseContent(PLAN).phases();

        assertEquals(2, phases.size());
        assertEquals(new PlanPhase("Phase 0: Research",
                "Pick a password hashing scheme.", 1,
                List.of("Compare bcrypt and argon2")), phases.get(0));
        assertEquals(new PlanPhase("Phase 1: Build", "Ship the endpoint.", 2,
                List.of("Implement controller", "Add tests")), phases.get(1));
    }

    @Test
    void whenParsing_givenDependencies_shouldListThem() {
        assertEquals(List.of("User store migration"),
                parser.parseContent(PLAN).dependencies());
    }

    @Test
    void whenParsing_givenRisks_shouldSplitOnFirstDelimiter() {
        assertEquals(List.of(
                new Risk("Brute force attacks", "rate limit sign in"),
                new Risk("Token leakage", "short expiry")),
                parser.parseContent(PLAN).risks());
    }

    @Test
    void whenSplittingRisk_givenNoDelimiter_shouldReturnNull() {
        assertNull(PlanParser.risk("Something without a delimiter"));
    }

    @Test
    void whenSplittingRisk_givenEnDash_shouldSplit() {
        assertEquals(new Risk("Drift", "pin versions"),
                PlanParser.risk("Drift – pin versions"));
    }

    @Test
    void whenSplittingRisk_givenUnspacedDash_shouldSplitOnIt() {
        assertEquals(new Risk("Data loss", "Backups nightly"),
                PlanParser.risk("Data loss-Backups nightly"));
    }

    @Test
    void whenSplittingRisk_givenSpacedDashAfterHyphenatedWord_shouldKeepWord() {
        assertEquals(new Risk("Third-party outage", "cache responses"),
                PlanParser.risk("Third-party outage - cache responses"));
    }

    @Test
    void whenParsing_givenUnspacedDashes_shouldKeepRisks() {
        final ParsedPlan plan = parser.parseContent("""
                ## Risks

                - Data loss-Backups nightly
                - Outage–Failover
                """);

        assertEquals(List.of(
                new Risk("Data loss", "Backups nightly"),
                new Risk("Outage", "Failover")),
                plan.risks());
    }

    @Test
    void whenParsing_givenEmptyDocument_shouldReturnEmptyPlan() {
        final ParsedPlan plan = parser.parseContent("");

        assertNull(plan.summary());
        assertTrue(plan.techStack().isEmpty());
        assertTrue(plan.phases().isEmpty());
        assertTrue(plan.dependencies().isEmpty());
        assertTrue(plan.risks().isEmpty());
    }

}
