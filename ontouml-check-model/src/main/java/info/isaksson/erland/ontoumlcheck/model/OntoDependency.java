package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Plain UML dependency. Kept in the tree, never validated. */
@JsonPropertyOrder({"id","stereotype","sourceId","targetId","targetArrowOpen","comment"})
public final class OntoDependency extends OntoElement {
    public final String stereotype;
    public final String sourceId;
    public final String targetId;
    public final boolean targetArrowOpen;
    public final String comment;

    @JsonCreator
    public OntoDependency(
            @JsonProperty("id") String id,
            @JsonProperty("stereotype") String stereotype,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("targetArrowOpen") boolean targetArrowOpen,
            @JsonProperty("comment") String comment
    ) {
        super(id);
        this.stereotype = text(stereotype);
        this.sourceId = text(sourceId);
        this.targetId = text(targetId);
        this.targetArrowOpen = targetArrowOpen;
        this.comment = text(comment);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitDependency(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoDependency)) return false;
        OntoDependency that = (OntoDependency) o;
        return targetArrowOpen == that.targetArrowOpen &&
                Objects.equals(id, that.id) &&
                Objects.equals(stereotype, that.stereotype) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetId, that.targetId) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, stereotype, sourceId, targetId, targetArrowOpen, comment);
    }
}
