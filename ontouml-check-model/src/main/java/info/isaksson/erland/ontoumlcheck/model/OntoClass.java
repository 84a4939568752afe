package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A class with an ontological stereotype.
 *
 * <p>The stereotype is kept as the literal the user typed; classifying it is the validator's job.
 * Properties and functions are free text, one member per line.</p>
 */
@JsonPropertyOrder({"id","name","stereotype","isAbstract","properties","functions","comment"})
public final class OntoClass extends OntoElement {
    public final String name;
    public final String stereotype;
    public final boolean isAbstract;
    public final String properties;
    public final String functions;
    public final String comment;

    @JsonCreator
    public OntoClass(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("stereotype") String stereotype,
            @JsonProperty("isAbstract") boolean isAbstract,
            @JsonProperty("properties") String properties,
            @JsonProperty("functions") String functions,
            @JsonProperty("comment") String comment
    ) {
        super(id);
        this.name = text(name);
        this.stereotype = text(stereotype);
        this.isAbstract = isAbstract;
        this.properties = text(properties);
        this.functions = text(functions);
        this.comment = text(comment);
    }

    public OntoClass(String id, String name, String stereotype, boolean isAbstract, String properties) {
        this(id, name, stereotype, isAbstract, properties, null, null);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitClass(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoClass)) return false;
        OntoClass that = (OntoClass) o;
        return isAbstract == that.isAbstract &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(stereotype, that.stereotype) &&
                Objects.equals(properties, that.properties) &&
                Objects.equals(functions, that.functions) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, stereotype, isAbstract, properties, functions, comment);
    }

    @Override public String toString() {
        return "«" + stereotype + "» " + name;
    }
}
