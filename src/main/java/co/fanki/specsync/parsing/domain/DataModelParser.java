package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.Block;
import co.fanki.specsync.document.domain.BlockParser;
import co.fanki.specsync.document.domain.ListEntry;
import co.fanki.specsync.feature.domain.Attribute;
import co.fanki.specsync.feature.domain.Cardinality;
import co.fanki.specsync.feature.domain.Relationship;
import co.fanki.specsync.parsing.domain.ParsedDataModel.ParsedEntity;
import co.fanki.specsync.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code data-model.md} documents into entities with attributes and
 * relationships.
 *
 * <p>Each depth-2 heading names an entity, except headings about the
 * overview, the relationships between entities, or a category of entities
 * ("Core Entities"). Under a category the depth-3 headings are the
 * entities. Headings one level below an entity, or bold paragraph markers
 * such as {@code **Attributes**:}, open its sub-sections.</p>
 *
 * <p>Attributes come from list items of the form
 * {@code name (type, constraint): description} or from a table whose
 * columns are name, type and constraint. Relationships come from list items
 * with a verb phrase such as "has many Tasks" or "belongs to Project".</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class DataModelParser extends DocumentParser<ParsedDataModel> {

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "^`?([^`(:]+?)`?\\s*(?:\\(([^)]*)\\))?"
                    + "\\s*(?:(?::|\\s+[-\u2013])\\s*(.*))?$",
            Pattern.DOTALL);

    private static final Pattern RELATIONSHIP_TARGET = Pattern.compile(
            "\\b(?:has|belongs|references)\\s+(?:many|one|to)?\\s*(\\w+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BOLD_MARKER = Pattern.compile(
            "^\\*\\*([^*]+)\\*\\*:?");

    /** The top-level section the scan is in. */
    private enum Section {
        NONE,
        OVERVIEW,
        RELATIONSHIPS,
        CATEGORY,
        ENTITY
    }

    /** The part of an entity the scan is in. */
    private enum SubSection {
        NONE,
        ATTRIBUTES,
        RELATIONSHIPS,
        VALIDATION,
        OTHER;

        static SubSection classify(final String label) {
            final String lower = label.toLowerCase(Locale.ROOT);
            if (lower.contains("attribute") || lower.contains("field")
                    || lower.contains("column")) {
                return ATTRIBUTES;
            }
            if (lower.contains("relationship")
                    || lower.contains("association")) {
                return RELATIONSHIPS;
            }
            if (lower.contains("validation") || lower.contains("rule")) {
                return VALIDATION;
            }
            return OTHER;
        }
    }

    private final BlockParser blockParser;

    /**
     * Creates a new DataModelParser.
     *
     * @param theBlockParser the block parser, never null
     */
    public DataModelParser(final BlockParser theBlockParser) {
        this.blockParser = Preconditions.requireNonNull(theBlockParser,
                "Block parser is required");
    }

    @Override
    public String fileName() {
        return "data-model.md";
    }

    @Override
    public ParsedDataModel parseContent(final String content) {
        final Scan scan = new Scan();
        for (final Block block : blockParser.parse(content)) {
            switch (block.kind()) {
                case HEADING -> scan.onHeading(block);
                case PARAGRAPH -> scan.onParagraph(block);
                case LIST -> scan.onList(block);
                case TABLE -> scan.onTable(block);
                default -> { }
            }
        }
        return new ParsedDataModel(scan.overview,
                scan.entities.stream().map(EntityDraft::build).toList());
    }

    /**
     * Parses one attribute list item.
     *
     * @param item the flattened item text
     * @return the attribute, or null when the item carries no name
     */
    static Attribute attribute(final String item) {
        final Matcher matcher = ATTRIBUTE.matcher(item.trim());
        if (!matcher.matches() || matcher.group(1).isBlank()) {
            return null;
        }
        final String name = matcher.group(1).trim();
        final String description = matcher.group(3);

        if (matcher.group(2) == null) {
            return new Attribute(name, Attribute.DEFAULT_TYPE, description);
        }
        final List<String> typeParts = Arrays.stream(matcher.group(2)
                .split(","))
                .map(String::trim)
                .toList();
        final String constraint = String.join(", ",
                typeParts.subList(1, typeParts.size()));
        return new Attribute(name, typeParts.get(0),
                constraint.isEmpty() ? description : constraint);
    }

    /**
     * Parses one relationship list item.
     *
     * @param item the flattened item text
     * @return the relationship, or null when no target can be found
     */
    static Relationship relationship(final String item) {
        final Matcher matcher = RELATIONSHIP_TARGET.matcher(item);
        if (!matcher.find()) {
            return null;
        }
        return new Relationship(matcher.group(1), Cardinality.infer(item),
                item);
    }

    /** Mutable state of one linear scan. */
    private static final class Scan {

        private Section section = Section.NONE;
        private SubSection subSection = SubSection.NONE;
        private EntityDraft entity;
        private int entityDepth = 2;

        private String overview;
        private final List<EntityDraft> entities = new ArrayList<>();

        void onHeading(final Block block) {
            if (block.isHeading(2)) {
                openSection(block.text());
            } else if (block.isHeading(3) && entityDepth == 3
                    && (section == Section.CATEGORY
                    || section == Section.ENTITY)) {
                openEntity(block.text(), 3);
            } else if (entity != null && block.depth() == entityDepth + 1) {
                subSection = SubSection.classify(block.text());
            }
        }

        void onParagraph(final Block block) {
            if (section == Section.OVERVIEW) {
                if (overview == null) {
                    overview = block.text();
                }
                return;
            }
            if (entity == null) {
                return;
            }
            final Matcher marker = BOLD_MARKER.matcher(block.source());
            if (marker.find()) {
                final SubSection marked = SubSection.classify(marker.group(1));
                if (marked != SubSection.OTHER
                        || marker.group(1).toLowerCase(Locale.ROOT)
                                .contains("lifecycle")) {
                    subSection = marked;
                    return;
                }
            }
            if (entity.description == null
                    && subSection == SubSection.NONE) {
                entity.description = block.text();
            }
        }

        void onList(final Block block) {
            if (entity == null) {
                if (section == Section.RELATIONSHIPS) {
                    block.items().forEach(this::attachToNamedEntity);
                }
                return;
            }
            for (final ListEntry item : block.items()) {
                switch (subSection) {
                    case ATTRIBUTES -> {
                        final Attribute attribute = attribute(item.text());
                        if (attribute != null) {
                            entity.attributes.add(attribute);
                        }
                    }
                    case RELATIONSHIPS -> {
                        final Relationship relationship =
                                relationship(item.text());
                        if (relationship != null) {
                            entity.relationships.add(relationship);
                        }
                    }
                    case VALIDATION -> entity.validationRules.add(item.text());
                    default -> { }
                }
            }
        }

        void onTable(final Block block) {
            if (entity == null || subSection != SubSection.ATTRIBUTES) {
                return;
            }
            final List<List<String>> rows = block.rows();
            for (final List<String> cells : rows.subList(
                    Math.min(1, rows.size()), rows.size())) {
                if (cells.size() >= 2 && !cells.get(0).isBlank()) {
                    entity.attributes.add(new Attribute(cells.get(0),
                            cells.get(1), cells.size() > 2 ? cells.get(2) : null));
                }
            }
        }

        private void openSection(final String heading) {
            final String lower = heading.toLowerCase(Locale.ROOT);
            entity = null;
            subSection = SubSection.NONE;

            if (lower.contains("overview") || lower.contains("summary")) {
                section = Section.OVERVIEW;
            } else if (lower.contains("relationship")) {
                section = Section.RELATIONSHIPS;
            } else if (lower.contains("entities")) {
                section = Section.CATEGORY;
                entityDepth = 3;
            } else {
                section = Section.ENTITY;
                openEntity(heading, 2);
            }
        }

        private void openEntity(final String name, final int depth) {
            entityDepth = depth;
            subSection = SubSection.NONE;
            // An empty heading names nothing; its content is skipped.
            if (name.isBlank()) {
                entity = null;
                return;
            }
            entity = new EntityDraft(name.trim());
            entities.add(entity);
        }

        /**
         * Attaches an item of the shared relationships section to the entity
         * the item starts with, if any.
         */
        private void attachToNamedEntity(final ListEntry item) {
            for (final EntityDraft candidate : entities) {
                if (item.text().startsWith(candidate.name)) {
                    final Relationship relationship =
                            relationship(item.text());
                    if (relationship != null) {
                        candidate.relationships.add(relationship);
                    }
                    return;
                }
            }
        }
    }

    /** An entity being assembled. */
    private static final class EntityDraft {

        private final String name;
        private String description;
        private final List<Attribute> attributes = new ArrayList<>();
        private final List<Relationship> relationships = new ArrayList<>();
        private final List<String> validationRules = new ArrayList<>();

        EntityDraft(final String theName) {
            this.name = theName;
        }

        ParsedEntity build() {
            return new ParsedEntity(name, description, attributes,
                    relationships, validationRules);
        }
    }

}
