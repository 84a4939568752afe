package info.isaksson.erland.ontoumlcheck.validation;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.multiplicity.Multiplicity;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stereotype-specific multiplicity shapes and endpoint stereotypes for associations.
 *
 * <p>The source end is the whole (part-whole relations), the bearer (characterization), the
 * quality (structuration) or the relator (mediation). A multiplicity passed as null was absent
 * or invalid and has already been reported; shape rules on that end are skipped.</p>
 */
final class AssociationRules {

    private static final Set<ClassStereotype> ASPECTS = EnumSet.of(ClassStereotype.QUALITY, ClassStereotype.MODE);
    private static final Set<ClassStereotype> NOT_FUNCTIONAL_COMPLEX = EnumSet.of(
            ClassStereotype.COLLECTIVE, ClassStereotype.QUANTITY, ClassStereotype.QUALITY, ClassStereotype.MODE);
    private static final Set<ClassStereotype> NOT_MEMBER = EnumSet.of(
            ClassStereotype.QUANTITY, ClassStereotype.QUALITY, ClassStereotype.MODE);

    private final ModelIndex index;
    private final ProblemCollector out;

    AssociationRules(ModelIndex index, ProblemCollector out) {
        this.index = index;
        this.out = out;
    }

    void check(AssociationEdge edge, Multiplicity source, Multiplicity target) {
        if (edge.stereotype == null) return;
        ClassNode s = index.classNode(edge.sourceId());
        ClassNode t = index.classNode(edge.targetId());

        switch (edge.stereotype) {
            case NONE:
            case FORMAL:
                break;
            case MEDIATION:
                lowerAtLeastOne(edge, "source", source);
                lowerAtLeastOne(edge, "target", target);
                break;
            case CHARACTERIZATION:
                exactlyOne(edge, "source", source);
                lowerAtLeastOne(edge, "target", target);
                endIn(edge, "target", t, ASPECTS);
                break;
            case STRUCTURATION:
                exactlyOne(edge, "target", target);
                endIn(edge, "source", s, EnumSet.of(ClassStereotype.QUALITY));
                endIn(edge, "target", t, ASPECTS);
                break;
            case COMPONENT_OF:
                lowerAtLeastOne(edge, "target", target);
                endNotIn(edge, "source", s, NOT_FUNCTIONAL_COMPLEX);
                endNotIn(edge, "target", t, NOT_FUNCTIONAL_COMPLEX);
                break;
            case MEMBER_OF:
                lowerAtLeastOne(edge, "target", target);
                endIn(edge, "source", s, EnumSet.of(ClassStereotype.COLLECTIVE));
                endNotIn(edge, "target", t, NOT_MEMBER);
                break;
            case SUBCOLLECTION_OF:
                exactlyOne(edge, "target", target);
                endIn(edge, "source", s, EnumSet.of(ClassStereotype.COLLECTIVE));
                endIn(edge, "target", t, EnumSet.of(ClassStereotype.COLLECTIVE));
                break;
            case CONTAINMENT:
                upperIsOne(edge, "target", target);
                endNotIn(edge, "source", s, EnumSet.of(ClassStereotype.QUANTITY));
                endIn(edge, "target", t, EnumSet.of(ClassStereotype.QUANTITY));
                break;
            case SUBQUANTITY_OF:
                exactlyOne(edge, "source", source);
                exactlyOne(edge, "target", target);
                endIn(edge, "source", s, EnumSet.of(ClassStereotype.QUANTITY));
                endIn(edge, "target", t, EnumSet.of(ClassStereotype.QUANTITY));
                break;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + edge.stereotype);
        }
    }

    private void lowerAtLeastOne(AssociationEdge edge, String end, Multiplicity m) {
        if (m == null) return;
        if (m.lower < 1) {
            multiplicityError(edge, end + " multiplicity lower bound must be at least 1 (found " + m + ")");
        }
    }

    private void exactlyOne(AssociationEdge edge, String end, Multiplicity m) {
        if (m == null) return;
        if (!m.isExactlyOne()) {
            multiplicityError(edge, end + " multiplicity must be exactly 1 (found " + m + ")");
        }
    }

    private void upperIsOne(AssociationEdge edge, String end, Multiplicity m) {
        if (m == null) return;
        if (m.upper != 1) {
            multiplicityError(edge, end + " multiplicity upper bound must be 1 (found " + m + ")");
        }
    }

    private void multiplicityError(AssociationEdge edge, String detail) {
        out.relationError(edge.id(), RelationIssue.MULTIPLICITIES, "«" + edge.stereotype.literal() + "» " + detail);
    }

    private void endIn(AssociationEdge edge, String end, ClassNode node, Set<ClassStereotype> allowed) {
        if (node != null && node.stereotype != null && allowed.contains(node.stereotype)) return;
        out.relationError(edge.id(), RelationIssue.ENDPOINTS,
                "«" + edge.stereotype.literal() + "» " + end + " must be " + describe(allowed) + " (found " + describe(node) + ")");
    }

    private void endNotIn(AssociationEdge edge, String end, ClassNode node, Set<ClassStereotype> forbidden) {
        if (node != null && node.stereotype != null && !forbidden.contains(node.stereotype)) return;
        out.relationError(edge.id(), RelationIssue.ENDPOINTS,
                "«" + edge.stereotype.literal() + "» " + end + " must not be " + describe(forbidden) + " (found " + describe(node) + ")");
    }

    private static String describe(Set<ClassStereotype> stereotypes) {
        StringBuilder sb = new StringBuilder();
        for (ClassStereotype st : stereotypes) {
            if (sb.length() > 0) sb.append(" or ");
            sb.append('«').append(st.literal()).append('»');
        }
        return sb.toString();
    }

    private static String describe(ClassNode node) {
        if (node == null) return "an instance";
        return "«" + node.element.stereotype + "»";
    }
}
