package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A package groups elements and may nest other packages. It carries no ontological meaning.
 */
@JsonPropertyOrder({"id","name","comment","elements"})
public final class OntoPackage extends OntoElement implements ElementContainer {
    public final String name;
    public final String comment;
    public final List<OntoElement> elements;

    @JsonCreator
    public OntoPackage(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("comment") String comment,
            @JsonProperty("elements") List<OntoElement> elements
    ) {
        super(id);
        this.name = text(name);
        this.comment = text(comment);
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public OntoPackage(String id, String name, List<OntoElement> elements) {
        this(id, name, null, elements);
    }

    @JsonIgnore
    @Override
    public List<OntoElement> containedElements() {
        return elements;
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitPackage(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoPackage)) return false;
        OntoPackage that = (OntoPackage) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(comment, that.comment) &&
                Objects.equals(elements, that.elements);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, comment, elements);
    }
}
