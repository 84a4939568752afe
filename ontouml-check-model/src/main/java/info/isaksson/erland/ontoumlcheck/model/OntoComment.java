package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"id","text"})
public final class OntoComment extends OntoElement {
    public final String text;

    @JsonCreator
    public OntoComment(
            @JsonProperty("id") String id,
            @JsonProperty("text") String text
    ) {
        super(id);
        this.text = text(text);
    }

    @Override
    public void accept(OntoElementVisitor visitor) {
        visitor.visitComment(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OntoComment)) return false;
        OntoComment that = (OntoComment) o;
        return Objects.equals(id, that.id) && Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(id, text);
    }
}
