package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.feature.domain.Attribute;
import co.fanki.specsync.feature.domain.Relationship;

import java.util.List;

/**
 * The content extracted from a {@code data-model.md} document.
 *
 * @param overview the first paragraph of the overview section, may be null
 * @param entities the entities in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedDataModel(
        String overview,
        List<ParsedEntity> entities
) {

    /**
     * Copies the entities.
     */
    public ParsedDataModel {
        entities = List.copyOf(entities);
    }

    /**
     * One entity of the model.
     *
     * @param name the entity name
     * @param description the first paragraph under the entity, may be null
     * @param attributes the attributes in document order
     * @param relationships the relationships in document order
     * @param validationRules items listed under a validation sub-section
     */
    public record ParsedEntity(
            String name,
            String description,
            List<Attribute> attributes,
            List<Relationship> relationships,
            List<String> validationRules
    ) {

        /**
         * Copies the collections.
         */
        public ParsedEntity {
            attributes = List.copyOf(attributes);
            relationships = List.copyOf(relationships);
            validationRules = List.copyOf(validationRules);
        }
    }

}
