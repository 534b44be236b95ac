package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.List;
import java.util.UUID;

/**
 * An entity described by a feature's {@code data-model.md}.
 *
 * <p>Entities accumulate: a sync upserts them by name and never removes
 * entities the document no longer mentions.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DataEntity {

    private final String id;
    private final String featureId;
    private final String name;
    private final String description;
    private final List<Attribute> attributes;
    private final List<Relationship> relationships;
    private final List<String> validationRules;

    private DataEntity(
            final String theId,
            final String theFeatureId,
            final String theName,
            final String theDescription,
            final List<Attribute> theAttributes,
            final List<Relationship> theRelationships,
            final List<String> theValidationRules) {
        this.id = Preconditions.requireNonBlank(theId, "Entity ID is required");
        this.featureId = Preconditions.requireNonBlank(theFeatureId,
                "Feature ID is required");
        this.name = Preconditions.requireNonBlank(theName,
                "Entity name is required");
        this.description = theDescription;
        this.attributes = theAttributes != null
                ? List.copyOf(theAttributes) : List.of();
        this.relationships = theRelationships != null
                ? List.copyOf(theRelationships) : List.of();
        this.validationRules = theValidationRules != null
                ? List.copyOf(theValidationRules) : List.of();
    }

    /**
     * Creates a new entity.
     *
     * @param featureId the owning feature ID
     * @param name the entity name
     * @param description the description, may be null
     * @param attributes the attributes in document order
     * @param relationships the relationships in document order
     * @param validationRules the validation rules
     * @return a new DataEntity instance
     */
    public static DataEntity create(
            final String featureId,
            final String name,
            final String description,
            final List<Attribute> attributes,
            final List<Relationship> relationships,
            final List<String> validationRules) {
        return new DataEntity(UUID.randomUUID().toString(), featureId, name,
                description, attributes, relationships, validationRules);
    }

    /**
     * Reconstitutes an entity from persistence.
     *
     * @return the reconstituted DataEntity
     */
    public static DataEntity reconstitute(
            final String id,
            final String featureId,
            final String name,
            final String description,
            final List<Attribute> attributes,
            final List<Relationship> relationships,
            final List<String> validationRules) {
        return new DataEntity(id, featureId, name, description, attributes,
                relationships, validationRules);
    }

    public String id() {
        return id;
    }

    public String featureId() {
        return featureId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    public List<String> validationRules() {
        return validationRules;
    }

}
