package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

import java.util.LinkedHashSet;
import java.util.Set;

/** Class that depends on more than one relator through mediations. */
public final class MultDepDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.MULT_DEP;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (ClassNode node : index.classes()) {
            Set<String> relators = new LinkedHashSet<>();
            for (AssociationEdge a : index.associationsOf(node.id, AssociationStereotype.MEDIATION)) {
                String other = a.otherEnd(node.id);
                if (index.isClass(other) && queries.anySelfOrAncestor(other, n -> n.is(ClassStereotype.RELATOR))) {
                    relators.add(other);
                }
            }
            if (relators.size() > 1) {
                out.antiPattern(node.id, type());
            }
        }
    }
}
