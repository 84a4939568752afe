package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of every element that can live inside a model or package.
 *
 * <p>Elements are immutable snapshots. Edges (generalizations, associations, ...) refer to
 * their ends by element id only, never by object reference.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OntoPackage.class, name = "package"),
        @JsonSubTypes.Type(value = OntoClass.class, name = "class"),
        @JsonSubTypes.Type(value = OntoInstance.class, name = "instance"),
        @JsonSubTypes.Type(value = OntoGeneralization.class, name = "generalization"),
        @JsonSubTypes.Type(value = OntoAssociation.class, name = "association"),
        @JsonSubTypes.Type(value = OntoDependency.class, name = "dependency"),
        @JsonSubTypes.Type(value = OntoComment.class, name = "comment"),
        @JsonSubTypes.Type(value = OntoCommentLink.class, name = "commentLink")
})
public abstract class OntoElement {

    /** Stable element id, unique within a diagram. */
    public final String id;

    protected OntoElement(String id) {
        this.id = id == null ? "" : id;
    }

    public abstract void accept(OntoElementVisitor visitor);

    static String text(String s) {
        return s == null ? "" : s;
    }
}
