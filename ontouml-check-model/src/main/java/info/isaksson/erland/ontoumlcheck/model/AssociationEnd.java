package info.isaksson.erland.ontoumlcheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Labels and markers shown at one end of an association.
 *
 * <p>{@code multiplicity} is the raw range text ({@code "1"}, {@code "0..*"}, ...). It constrains
 * how many instances of this end's classifier relate to one instance at the other end.</p>
 */
@JsonPropertyOrder({"multiplicity","role","reading","navigability","aggregation"})
public final class AssociationEnd {
    public final String multiplicity;
    public final String role;
    public final String reading;
    public final Navigability navigability;
    public final Aggregation aggregation;

    @JsonCreator
    public AssociationEnd(
            @JsonProperty("multiplicity") String multiplicity,
            @JsonProperty("role") String role,
            @JsonProperty("reading") String reading,
            @JsonProperty("navigability") Navigability navigability,
            @JsonProperty("aggregation") Aggregation aggregation
    ) {
        this.multiplicity = multiplicity == null ? "" : multiplicity;
        this.role = role == null ? "" : role;
        this.reading = reading == null ? "" : reading;
        this.navigability = navigability == null ? Navigability.UNSPECIFIED : navigability;
        this.aggregation = aggregation == null ? Aggregation.NONE : aggregation;
    }

    public static AssociationEnd of(String multiplicity) {
        return new AssociationEnd(multiplicity, null, null, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssociationEnd)) return false;
        AssociationEnd that = (AssociationEnd) o;
        return Objects.equals(multiplicity, that.multiplicity) &&
                Objects.equals(role, that.role) &&
                Objects.equals(reading, that.reading) &&
                navigability == that.navigability &&
                aggregation == that.aggregation;
    }

    @Override public int hashCode() {
        return Objects.hash(multiplicity, role, reading, navigability, aggregation);
    }
}
