package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.FlexmarkBlockParser;
import co.fanki.specsync.parsing.domain.ParsedResearch.ParsedDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ResearchParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ResearchParserTest {

    private static final String RESEARCH = """
            # Research: User Login

            ## Overview

            ### Not a decision

            Written outside the research region.

            ## Phase 0: Research

            ### 1. Password hashing

            **Decision**: Use `bcrypt`
            **Rationale**: Mature and available in Spring Security

            #### Alternatives

            - **Argon2**: stronger but needs native bindings
            - PBKDF2

            #### Context

            Configure the strength in one place.

            ```java
            new BCryptPasswordEncoder(12);
            ```

            ### 2. Session storage

            #### Decision

            Store sessions in PostgreSQL.

            #### Rationale

            No new infrastructure.
            """;

    private final ResearchParser parser = new ResearchParser(
            new FlexmarkBlockParser());

    @Test
    void whenParsing_givenResearchRegion_shouldIgnoreHeadingsOutsideIt() {
        final List<ParsedDecision> decisions = parser.parseContent(RESEARCH)
                .decisions();

        assertEquals(List.of("Password hashing", "Session storage"),
                decisions.stream().map(ParsedDecision::title).toList());
    }

    @Test
    void whenParsing_givenBoldLabels_shouldAssignDecisionAndRationale() {
        final ParsedDecision hashing = parser.parseContent(RESEARCH)
                .decisions().get(0);

        assertEquals("Use bcrypt", hashing.decision());
        assertEquals("Mature and available in Spring Security",
                hashing.rationale());
    }

    @Test
    void whenParsing_givenAlternativesList_shouldKeepNamedEntries() {
        final ParsedDecision hashing = parser.parseContent(RESEARCH)
                .decisions().get(0);

        assertEquals(List.of("Argon2: stronger but needs native bindings",
                "PBKDF2"), hashing.alternatives());
    }

    @Test
    void whenParsing_givenContextWithCode_shouldFenceTheCode() {
        final ParsedDecision hashing = parser.parseContent(RESEARCH)
                .decisions().get(0);

        assertEquals("Configure the strength in one place.\n\n"
                + "```java\nnew BCryptPasswordEncoder(12);\n```",
                hashing.context());
    }

    @Test
    void whenParsing_givenSubHeadings_shouldFlushBufferedParagraphs() {
        final ParsedDecision sessions = parser.parseContent(RESEARCH)
                .decisions().get(1);

        assertEquals("Store sessions in PostgreSQL.", sessions.decision());
        assertEquals("No new infrastructure.", sessions.rationale());
        assertTrue(sessions.alternatives().isEmpty());
        assertNull(sessions.context());
    }

    @Test
    void whenParsing_givenAlternativesConsideredLabel_shouldCollectValue() {
        final ParsedDecision decision = parser.parseContent("""
                ## Research

                ### Cache

                **Decision**: No cache
                **Alternatives Considered**: Redis

                - Caffeine
                """).decisions().get(0);

        assertEquals("No cache", decision.decision());
        assertEquals(List.of("Redis", "Caffeine"), decision.alternatives());
        assertNull(decision.rationale());
    }

    @Test
    void whenParsing_givenDecisionWithoutText_shouldDefaultToEmpty() {
        final ParsedDecision decision = parser.parseContent("""
                ## Phase 0

                ### Open item
                """).decisions().get(0);

        assertEquals("Open item", decision.title());
        assertEquals("", decision.decision());
    }

    @Test
    void whenParsing_givenNoResearchRegion_shouldReturnNoDecisions() {
        assertTrue(parser.parseContent("# Notes\n\n### Loose\n\ntext\n")
                .decisions().isEmpty());
    }

}
