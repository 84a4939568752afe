package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** An object (instance specification). Opaque to OntoUML checks. */
@JsonPropertyOrder({"id","name","instanceType","slots","comment"})
public final class OntoInstance extends OntoElement {
    public final String name;
    public final String instanceType;
    public final String slots;
    public final String comment;

    @JsonCreator
    public OntoInstance(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("instanceType") String instanceType,
            @JsonProperty("slots") String slots,
            @JsonProperty("comment") String comment
    ) {
        super(id);
        this.name = text(name);
        this.instanceType = text(instanceType);
        this.slots = text(slots);
        this.comment = text(comment);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitInstance(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoInstance)) return false;
        OntoInstance that = (OntoInstance) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(instanceType, that.instanceType) &&
                Objects.equals(slots, that.slots) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, instanceType, slots, comment);
    }
}
