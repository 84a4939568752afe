package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Generalization (set). Every source specializes every target; {@code isDisjoint} and
 * {@code isCovering} describe how the sources partition the targets.
 *
 * <p>One source, one target and no set flags is a plain binary generalization.</p>
 */
@JsonPropertyOrder({"id","sourceIds","targetIds","setName","isDisjoint","isCovering","comment"})
public final class OntoGeneralization extends OntoElement {
    public final List<String> sourceIds;
    public final List<String> targetIds;
    public final String setName;
    public final boolean isDisjoint;
    public final boolean isCovering;
    public final String comment;

    @JsonCreator
    public OntoGeneralization(
            @JsonProperty("id") String id,
            @JsonProperty("sourceIds") List<String> sourceIds,
            @JsonProperty("targetIds") List<String> targetIds,
            @JsonProperty("setName") String setName,
            @JsonProperty("isDisjoint") boolean isDisjoint,
            @JsonProperty("isCovering") boolean isCovering,
            @JsonProperty("comment") String comment
    ) {
        super(id);
        this.sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
        this.targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
        this.setName = text(setName);
        this.isDisjoint = isDisjoint;
        this.isCovering = isCovering;
        this.comment = text(comment);
    }

    public OntoGeneralization(String id, List<String> sourceIds, List<String> targetIds, boolean isDisjoint, boolean isCovering) {
        this(id, sourceIds, targetIds, null, isDisjoint, isCovering, null);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitGeneralization(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoGeneralization)) return false;
        OntoGeneralization that = (OntoGeneralization) o;
        return isDisjoint == that.isDisjoint &&
                isCovering == that.isCovering &&
                Objects.equals(id, that.id) &&
                Objects.equals(sourceIds, that.sourceIds) &&
                Objects.equals(targetIds, that.targetIds) &&
                Objects.equals(setName, that.setName) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, sourceIds, targetIds, setName, isDisjoint, isCovering, comment);
    }
}
