package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Links a comment ({@code sourceId}) to any other element ({@code targetId}). */
@JsonPropertyOrder({"id","sourceId","targetId"})
public final class OntoCommentLink extends OntoElement {
    public final String sourceId;
    public final String targetId;

    @JsonCreator
    public OntoCommentLink(
            @JsonProperty("id") String id,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId
    ) {
        super(id);
        this.sourceId = text(sourceId);
        this.targetId = text(targetId);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitCommentLink(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoCommentLink)) return false;
        OntoCommentLink that = (OntoCommentLink) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetId, that.targetId);
    }

    @Override public int hashCode() {
        return Objects.hash(id, sourceId, targetId);
    }
}
