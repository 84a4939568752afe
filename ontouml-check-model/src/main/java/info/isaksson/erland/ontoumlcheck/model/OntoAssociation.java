package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Directed association {@code source -> target}. Either end may reference a class or an instance.
 *
 * <p>For part-whole stereotypes the source is the whole, for {@code characterization} the
 * bearer and for {@code mediation} the relator.</p>
 */
@JsonPropertyOrder({"id","stereotype","sourceId","sourceEnd","targetId","targetEnd","comment"})
public final class OntoAssociation extends OntoElement {
    public final String stereotype;
    public final String sourceId;
    public final AssociationEnd sourceEnd;
    public final String targetId;
    public final AssociationEnd targetEnd;
    public final String comment;

    @JsonCreator
    public OntoAssociation(
            @JsonProperty("id") String id,
            @JsonProperty("stereotype") String stereotype,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("sourceEnd") AssociationEnd sourceEnd,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("targetEnd") AssociationEnd targetEnd,
            @JsonProperty("comment") String comment
    ) {
        super(id);
        this.stereotype = text(stereotype);
        this.sourceId = text(sourceId);
        this.sourceEnd = sourceEnd == null ? AssociationEnd.of("") : sourceEnd;
        this.targetId = text(targetId);
        this.targetEnd = targetEnd == null ? AssociationEnd.of("") : targetEnd;
        this.comment = text(comment);
    }

    public OntoAssociation(String id, String stereotype, String sourceId, String sourceMultiplicity,
                           String targetId, String targetMultiplicity) {
        this(id, stereotype, sourceId, AssociationEnd.of(sourceMultiplicity), targetId, AssociationEnd.of(targetMultiplicity), null);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitAssociation(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoAssociation)) return false;
        OntoAssociation that = (OntoAssociation) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(stereotype, that.stereotype) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(sourceEnd, that.sourceEnd) &&
                Objects.equals(targetId, that.targetId) &&
                Objects.equals(targetEnd, that.targetEnd) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, stereotype, sourceId, sourceEnd, targetId, targetEnd, comment);
    }
}
