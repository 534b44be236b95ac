package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.FlexmarkBlockParser;
import co.fanki.specsync.feature.domain.Attribute;
import co.fanki.specsync.feature.domain.Cardinality;
import co.fanki.specsync.feature.domain.Relationship;
import co.fanki.specsync.parsing.domain.ParsedDataModel.ParsedEntity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DataModelParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DataModelParserTest {

    private static final String DATA_MODEL = """
            # Data Model

            ## Overview

            The login feature stores users and their sessions.

            ## User

            A person who can sign in.

            ### Attributes

            - id (UUID, primary key)
            - email (string): unique, required
            - displayName
            - `createdAt` (timestamp)

            ### Relationships

            - has many Sessions (1:N)

            ### Validation Rules

            - email must be a valid address

            ## Session

            An authenticated browser session.

            ### Fields

            | Name | Type | Constraint |
            |------|------|------------|
            | id | UUID | primary key |
            | expiresAt | timestamp | |

            ## Relationships

            - Session belongs to User (many-to-one)
            """;

    private final DataModelParser parser = new DataModelParser(
            new FlexmarkBlockParser());

    @Test
    void whenParsing_givenOverviewSection_shouldReadOverview() {
        final ParsedDataModel model = parser.parseContent(DATA_MODEL);

        assertEquals("The login feature stores users and their sessions.",
                model.overview());
    }

    @Test
    void whenParsing_givenEntityHeadings_shouldOpenEntities() {
        final List<ParsedEntity> entities = parser.parseContent(DATA_MODEL)
                .entities();

        assertEquals(List.of("User", "Session"),
                entities.stream().map(ParsedEntity::name).toList());
        assertEquals("A person who can sign in.",
                entities.get(0).description());
    }

    @Test
    void whenParsing_givenAttributeList_shouldParseNameTypeConstraint() {
        final ParsedEntity user = parser.parseContent(DATA_MODEL)
                .entities().get(0);

        assertEquals(List.of(
                new Attribute("id", "UUID", "primary key"),
                new Attribute("email", "string", "unique, required"),
                new Attribute("displayName", "string", null),
                new Attribute("createdAt", "timestamp", null)),
                user.attributes());
    }

    @Test
    void whenParsing_givenRelationshipList_shouldInferCardinality() {
        final ParsedEntity user = parser.parseContent(DATA_MODEL)
                .entities().get(0);

        assertEquals(1, user.relationships().size());
        final Relationship relationship = user.relationships().get(0);
        assertEquals("Sessions", relationship.target());
        assertEquals(Cardinality.ONE_TO_MANY, relationship.cardinality());
    }

    @Test
    void whenParsing_givenValidationSection_shouldCollectRules() {
        final ParsedEntity user = parser.parseContent(DATA_MODEL)
                .entities().get(0);

        assertEquals(List.of("email must be a valid address"),
                user.validationRules());
    }

    @Test
    void whenParsing_givenAttributeTable_shouldReadColumnsPositionally() {
        final ParsedEntity session = parser.parseContent(DATA_MODEL)
                .entities().get(1);

        assertEquals(List.of(
                new Attribute("id", "UUID", "primary key"),
                new Attribute("expiresAt", "timestamp", null)),
                session.attributes());
    }

    @Test
    void whenParsing_givenSharedRelationshipsSection_shouldAttachToNamedEntity() {
        final ParsedEntity session = parser.parseContent(DATA_MODEL)
                .entities().get(1);

        assertEquals(1, session.relationships().size());
        assertEquals("User", session.relationships().get(0).target());
        assertEquals(Cardinality.MANY_TO_ONE,
                session.relationships().get(0).cardinality());
    }

    @Test
    void whenParsing_givenBoldMarkers_shouldSwitchSubSections() {
        final ParsedEntity entity = parser.parseContent("""
                ## Project

                **Attributes**:

                - name (string): required

                **Relationships**:

                - has many Features
                """).entities().get(0);

        assertEquals(List.of(new Attribute("name", "string", "required")),
                entity.attributes());
        assertEquals("Features", entity.relationships().get(0).target());
        assertEquals(Cardinality.ONE_TO_ONE,
                entity.relationships().get(0).cardinality());
        assertNull(entity.description());
    }

    @Test
    void whenParsing_givenEntityCategory_shouldTreatDepthThreeAsEntities() {
        final List<ParsedEntity> entities = parser.parseContent("""
                ## Core Entities

                ### Feature

                A numbered feature directory.

                #### Attributes

                - number (string)

                ### Task

                - unparsed list before any sub-section
                """).entities();

        assertEquals(List.of("Feature", "Task"),
                entities.stream().map(ParsedEntity::name).toList());
        assertEquals("A numbered feature directory.",
                entities.get(0).description());
        assertEquals(List.of(new Attribute("number", "string", null)),
                entities.get(0).attributes());
        assertTrue(entities.get(1).attributes().isEmpty());
    }

    @Test
    void whenParsing_givenEmptyHeadings_shouldSkipThem() {
        final List<ParsedEntity> entities = parser.parseContent("""
                ## User

                - id (UUID)

                ##

                text under an empty heading

                ## Core Entities

                ###

                - orphan (string)

                ### Session
                """).entities();

        assertEquals(List.of("User", "Session"),
                entities.stream().map(ParsedEntity::name).toList());
        assertNull(entities.get(0).description());
        assertNull(entities.get(1).description());
    }

    @Test
    void whenParsingAttribute_givenDashDescription_shouldUseItAsConstraint() {
        assertEquals(new Attribute("title", "string", "shown in lists"),
                DataModelParser.attribute("title - shown in lists"));
    }

    @Test
    void whenParsingRelationship_givenNoVerb_shouldReturnNull() {
        assertNull(DataModelParser.relationship("linked somehow"));
    }

    @Test
    void whenParsing_givenEmptyDocument_shouldReturnNoEntities() {
        final ParsedDataModel model = parser.parseContent("");

        assertNull(model.overview());
        assertTrue(model.entities().isEmpty());
    }

}
