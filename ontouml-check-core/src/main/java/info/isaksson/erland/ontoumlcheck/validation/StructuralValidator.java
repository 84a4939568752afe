package info.isaksson.erland.ontoumlcheck.validation;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.OntoAssociation;
import info.isaksson.erland.ontoumlcheck.model.OntoClass;
import info.isaksson.erland.ontoumlcheck.model.OntoElement;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.multiplicity.Multiplicity;
import info.isaksson.erland.ontoumlcheck.multiplicity.MultiplicityParser;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.StereotypeTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Well-formedness rules for OntoUML class diagrams.
 *
 * <p>A first pass dispatches on every element in traversal order and accumulates per-class
 * facts (identity interval, mediation bounds, characterizations). A second pass over the
 * classes turns those facts into class-level errors.</p>
 */
public final class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    public void validate(ModelIndex index, ProblemCollector out) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        if (out == null) throw new IllegalArgumentException("out must not be null");
        new Run(index, out).execute();
    }

    /** State of a single validation run; discarded afterwards. */
    private static final class Run {
        private final ModelIndex index;
        private final HierarchyQueries queries;
        private final ProblemCollector out;
        private final AssociationRules associationRules;

        private final Map<String, IdentityInterval> identity = new LinkedHashMap<>();
        private final MediationBounds mediation;
        private final Set<String> characterized = new HashSet<>();

        Run(ModelIndex index, ProblemCollector out) {
            this.index = index;
            this.queries = new HierarchyQueries(index);
            this.out = out;
            this.associationRules = new AssociationRules(index, out);
            this.mediation = new MediationBounds(index);
        }

        void execute() {
            int before = out.size();
            // Generalizations may precede the classes they reference, so seed every class first.
            for (ClassNode node : index.classes()) {
                int own = node.stereotype != null && node.stereotype.isIdentityProvider() ? 1 : 0;
                identity.put(node.id, new IdentityInterval(own, own));
            }
            for (OntoElement e : index.elements()) {
                if (e instanceof OntoClass) {
                    checkClass((OntoClass) e);
                } else if (e instanceof OntoGeneralization) {
                    checkGeneralization((OntoGeneralization) e);
                } else if (e instanceof OntoAssociation) {
                    checkAssociation((OntoAssociation) e);
                }
            }
            for (ClassNode node : index.classes()) {
                checkClassFacts(node);
            }
            log.debug("Structural validation reported {} problem(s)", out.size() - before);
        }

        // ---- first pass ----

        private void checkClass(OntoClass cls) {
            Optional<ClassStereotype> st = ClassStereotype.fromLiteral(cls.stereotype);
            if (st.isEmpty()) {
                String msg = cls.stereotype.isBlank()
                        ? "class has no stereotype"
                        : "«" + cls.stereotype + "» is not an OntoUML class stereotype";
                out.error(cls.id, ErrorKind.INVALID_STEREOTYPE, msg);
            }
        }

        private void checkGeneralization(OntoGeneralization g) {
            if (g.sourceIds.isEmpty()) {
                out.error(g.id, ErrorKind.MISSING_REFERENCE, "generalization has no sources");
            }
            if (g.targetIds.isEmpty()) {
                out.error(g.id, ErrorKind.MISSING_REFERENCE, "generalization has no targets");
            }
            for (String id : endIds(g)) {
                if (!index.isClassifier(id)) {
                    out.error(g.id, ErrorKind.MISSING_REFERENCE, "generalization references missing element '" + id + "'");
                }
            }

            List<ClassNode> sources = classesOf(g.sourceIds);
            List<ClassNode> targets = classesOf(g.targetIds);

            for (String s : new LinkedHashSet<>(g.sourceIds)) {
                for (String t : new LinkedHashSet<>(g.targetIds)) {
                    if (index.isInstance(s) || index.isInstance(t)) {
                        out.error(g.id, ErrorKind.INVALID_SUBTYPING, "instances cannot take part in a generalization");
                        continue;
                    }
                    ClassNode sn = index.classNode(s);
                    ClassNode tn = index.classNode(t);
                    if (sn == null || tn == null) continue;
                    if (!StereotypeTaxonomy.isValidSubtyping(sn.stereotype, tn.stereotype)) {
                        out.error(g.id, ErrorKind.INVALID_SUBTYPING,
                                "«" + sn.element.stereotype + "» cannot be subtype of «" + tn.element.stereotype + "»");
                    }
                }
            }

            if (targets.isEmpty()) return;
            int providers = 0;
            for (ClassNode t : targets) {
                if (t.stereotype != null && (t.stereotype.isIdentityProvider() || t.stereotype.requiresIdentity())) {
                    providers++;
                }
            }
            IdentityInterval weight = IdentityInterval.weightOf(targets.size(), providers, g.isDisjoint, g.isCovering);
            for (ClassNode s : sources) {
                IdentityInterval acc = identity.get(s.id);
                if (acc != null) acc.add(weight.min, weight.max);
            }
        }

        private void checkAssociation(OntoAssociation a) {
            AssociationEdge edge = index.edgeOf(a);
            if (edge.stereotype == null) {
                out.error(a.id, ErrorKind.INVALID_STEREOTYPE, "«" + a.stereotype + "» is not an OntoUML association stereotype");
                return;
            }

            boolean endsPresent = true;
            if (!index.isClassifier(a.sourceId)) {
                out.error(a.id, ErrorKind.MISSING_REFERENCE, "association source references missing element '" + a.sourceId + "'");
                endsPresent = false;
            }
            if (!index.isClassifier(a.targetId)) {
                out.error(a.id, ErrorKind.MISSING_REFERENCE, "association target references missing element '" + a.targetId + "'");
                endsPresent = false;
            }

            boolean required = edge.stereotype != AssociationStereotype.NONE;
            Multiplicity source = multiplicity(a, "source", a.sourceEnd.multiplicity, required);
            Multiplicity target = multiplicity(a, "target", a.targetEnd.multiplicity, required);

            if (!endsPresent) return;
            associationRules.check(edge, source, target);

            if (edge.is(AssociationStereotype.MEDIATION)) {
                if (index.isClass(a.sourceId) && target != null) mediation.accumulate(a.sourceId, target.lower);
                if (index.isClass(a.targetId) && source != null) mediation.accumulate(a.targetId, source.lower);
            } else if (edge.is(AssociationStereotype.CHARACTERIZATION)) {
                characterized.add(a.targetId);
            }
        }

        /** Parsed and consistent multiplicity, or null after reporting why not. */
        private Multiplicity multiplicity(OntoAssociation a, String end, String text, boolean required) {
            if (text.isBlank() && !required) return null;
            Optional<Multiplicity> m = MultiplicityParser.parse(text);
            if (m.isEmpty()) {
                String msg = text.isBlank()
                        ? end + " multiplicity is missing"
                        : end + " multiplicity '" + text + "' is not a valid range";
                out.relationError(a.id, RelationIssue.MULTIPLICITIES, msg);
                return null;
            }
            if (!m.get().isConsistent()) {
                out.relationError(a.id, RelationIssue.MULTIPLICITIES,
                        end + " multiplicity '" + text + "' has an upper bound below its lower bound");
                return null;
            }
            return m.get();
        }

        // ---- second pass ----

        private void checkClassFacts(ClassNode node) {
            ClassStereotype st = node.stereotype;
            if (st == null) return;

            IdentityInterval id = identity.get(node.id);
            if (st.requiresIdentity() && id != null && !id.isExactlyOne()) {
                out.error(node.id, ErrorKind.INVALID_IDENTITY,
                        "element does not have exactly one identity provider (found " + id + ")");
            }

            if (st == ClassStereotype.ROLE && mediation.total(node.id) == 0) {
                out.error(node.id, ErrorKind.INVALID_ROLE, "«role» is not mediated by any relator");
            }

            if (!node.isAbstract() && queries.anySelfOrAncestor(node.id, n -> n.is(ClassStereotype.RELATOR))) {
                int total = mediation.total(node.id);
                if (total < 2) {
                    out.error(node.id, ErrorKind.INVALID_RELATOR,
                            "relator must mediate at least two entities (found " + total + ")");
                }
            }

            if (st == ClassStereotype.PHASE && !inPhasePartition(node)) {
                out.error(node.id, ErrorKind.INVALID_PHASE, "«phase» is not part of a disjoint and complete generalization set");
            }

            if (st.isNonSortal() && !node.isAbstract()) {
                out.error(node.id, ErrorKind.INVALID_NONABSTRACT_MIXIN, "«" + st.literal() + "» must be abstract");
            }

            if (st.isAspect() && !characterized.contains(node.id)) {
                out.error(node.id, ErrorKind.INVALID_MISSING_CHARACTERIZATION,
                        "«" + st.literal() + "» is not the target of any «characterization»");
            }
        }

        private boolean inPhasePartition(ClassNode node) {
            for (OntoGeneralization g : node.parentGeneralizations()) {
                if (g.isDisjoint && g.isCovering) return true;
            }
            return false;
        }

        // ---- helpers ----

        private Set<String> endIds(OntoGeneralization g) {
            Set<String> ids = new LinkedHashSet<>(g.sourceIds);
            ids.addAll(g.targetIds);
            return ids;
        }

        private List<ClassNode> classesOf(List<String> ids) {
            List<ClassNode> out = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) {
                ClassNode n = index.classNode(id);
                if (n != null) out.add(n);
            }
            return out;
        }
    }
}
