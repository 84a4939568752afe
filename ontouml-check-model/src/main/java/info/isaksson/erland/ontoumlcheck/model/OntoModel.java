package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Root of an OntoUML class diagram snapshot.
 */
@JsonPropertyOrder({"schemaVersion","id","name","elements"})
public final class OntoModel implements ElementContainer {
    public final String schemaVersion;
    public final String id;
    public final String name;
    public final List<OntoElement> elements;

    @JsonCreator
    public OntoModel(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("elements") List<OntoElement> elements
    ) {
        this.schemaVersion = schemaVersion == null ? "1.0" : schemaVersion;
        this.id = id == null ? "" : id;
        this.name = name == null ? "" : name;
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public OntoModel(String id, String name, List<OntoElement> elements) {
        this(null, id, name, elements);
    }

    @JsonIgnore
    @Override
    public List<OntoElement> containedElements() {
        return elements;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoModel)) return false;
        OntoModel that = (OntoModel) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(elements, that.elements);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, id, name, elements);
    }
}
