package info.isaksson.erland.ontoumlcheck.graph;

import info.isaksson.erland.ontoumlcheck.model.ElementContainer;
import info.isaksson.erland.ontoumlcheck.model.OntoAssociation;
import info.isaksson.erland.ontoumlcheck.model.OntoClass;
import info.isaksson.erland.ontoumlcheck.model.OntoComment;
import info.isaksson.erland.ontoumlcheck.model.OntoCommentLink;
import info.isaksson.erland.ontoumlcheck.model.OntoDependency;
import info.isaksson.erland.ontoumlcheck.model.OntoElement;
import info.isaksson.erland.ontoumlcheck.model.OntoElementVisitor;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.model.OntoInstance;
import info.isaksson.erland.ontoumlcheck.model.OntoPackage;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat, id-keyed view of a model tree.
 *
 * <p>Built in two passes: the first registers every classifier, the second attaches
 * generalizations and associations to their ends, so edges may reference elements declared
 * later in the tree. Iteration orders follow traversal order.</p>
 *
 * <p>The index is a read snapshot: the model is never updated after {@link #build(ElementContainer)}.
 * Direct parent and child id lists are cached on first use, so an index is meant for one thread.</p>
 */
public final class ModelIndex {

    private static final Logger log = LoggerFactory.getLogger(ModelIndex.class);

    private final Map<String, ClassNode> classes = new LinkedHashMap<>();
    private final Map<String, OntoInstance> instances = new LinkedHashMap<>();
    private final List<OntoGeneralization> generalizations = new ArrayList<>();
    private final List<AssociationEdge> associations = new ArrayList<>();
    private final Map<OntoAssociation, AssociationEdge> edgesByElement = new IdentityHashMap<>();
    private final List<OntoElement> elements = new ArrayList<>();
    private final Map<String, List<String>> parentIdCache = new HashMap<>();
    private final Map<String, List<String>> childIdCache = new HashMap<>();

    private ModelIndex() {}

    public static ModelIndex build(ElementContainer root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        ModelIndex index = new ModelIndex();
        ModelWalker.walk(root, index.new ClassifierCollector());
        ModelWalker.walk(root, index.new EdgeCollector());
        log.debug("Indexed {} elements: {} classes, {} instances, {} generalizations, {} associations",
                index.elements.size(), index.classes.size(), index.instances.size(),
                index.generalizations.size(), index.associations.size());
        return index;
    }

    /** Every element of the tree in traversal order (packages included). */
    public List<OntoElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    public Collection<ClassNode> classes() {
        return Collections.unmodifiableCollection(classes.values());
    }

    public List<OntoGeneralization> generalizations() {
        return Collections.unmodifiableList(generalizations);
    }

    public List<AssociationEdge> associations() {
        return Collections.unmodifiableList(associations);
    }

    /** The indexed edge of an association of this model, or null. */
    public AssociationEdge edgeOf(OntoAssociation association) {
        return edgesByElement.get(association);
    }

    /** Null when {@code id} is not a class. */
    public ClassNode classNode(String id) {
        return id == null ? null : classes.get(id);
    }

    public boolean isClass(String id) {
        return id != null && classes.containsKey(id);
    }

    public boolean isInstance(String id) {
        return id != null && instances.containsKey(id);
    }

    /** Whether {@code id} names a classifier (class or instance) of this model. */
    public boolean isClassifier(String id) {
        return isClass(id) || isInstance(id);
    }

    /** Direct supertypes of a class, in generalization declaration order. Non-class targets are skipped. */
    public List<String> parentIds(String classId) {
        ClassNode node = classNode(classId);
        if (node == null) return List.of();
        return parentIdCache.computeIfAbsent(classId, k -> collectParentIds(node));
    }

    private List<String> collectParentIds(ClassNode node) {
        Set<String> out = new LinkedHashSet<>();
        for (OntoGeneralization g : node.parentGeneralizations()) {
            for (String t : g.targetIds) {
                if (isClass(t)) out.add(t);
            }
        }
        return List.copyOf(out);
    }

    /** Direct subtypes of a class, in generalization declaration order. Non-class sources are skipped. */
    public List<String> childIds(String classId) {
        ClassNode node = classNode(classId);
        if (node == null) return List.of();
        return childIdCache.computeIfAbsent(classId, k -> collectChildIds(node));
    }

    private List<String> collectChildIds(ClassNode node) {
        Set<String> out = new LinkedHashSet<>();
        for (OntoGeneralization g : node.childGeneralizations()) {
            for (String s : g.sourceIds) {
                if (isClass(s)) out.add(s);
            }
        }
        return List.copyOf(out);
    }

    /** Associations with the given stereotype that have {@code classId} at either end; a self-loop counts once. */
    public List<AssociationEdge> associationsOf(String classId, AssociationStereotype stereotype) {
        ClassNode node = classNode(classId);
        if (node == null) return List.of();
        List<AssociationEdge> out = new ArrayList<>();
        for (AssociationEdge a : node.outgoing()) {
            if (a.is(stereotype)) out.add(a);
        }
        for (AssociationEdge a : node.incoming()) {
            if (a.is(stereotype) && !a.isSelfLoop()) out.add(a);
        }
        return out;
    }

    /** Associations with the given stereotype whose source is {@code classId}. */
    public List<AssociationEdge> outgoingOf(String classId, AssociationStereotype stereotype) {
        ClassNode node = classNode(classId);
        if (node == null) return List.of();
        List<AssociationEdge> out = new ArrayList<>();
        for (AssociationEdge a : node.outgoing()) {
            if (a.is(stereotype)) out.add(a);
        }
        return out;
    }

    /** Associations with the given stereotype whose target is {@code classId}. */
    public List<AssociationEdge> incomingOf(String classId, AssociationStereotype stereotype) {
        ClassNode node = classNode(classId);
        if (node == null) return List.of();
        List<AssociationEdge> out = new ArrayList<>();
        for (AssociationEdge a : node.incoming()) {
            if (a.is(stereotype)) out.add(a);
        }
        return out;
    }

    private final class ClassifierCollector implements OntoElementVisitor {
        @Override
        public void visitClass(OntoClass cls) {
            if (classes.containsKey(cls.id) || instances.containsKey(cls.id)) {
                log.warn("Duplicate element id '{}'; keeping the first occurrence", cls.id);
                return;
            }
            classes.put(cls.id, new ClassNode(cls));
        }

        @Override
        public void visitInstance(OntoInstance instance) {
            if (classes.containsKey(instance.id) || instances.containsKey(instance.id)) {
                log.warn("Duplicate element id '{}'; keeping the first occurrence", instance.id);
                return;
            }
            instances.put(instance.id, instance);
        }
    }

    private final class EdgeCollector implements OntoElementVisitor {
        @Override
        public void visitPackage(OntoPackage pkg) {
            elements.add(pkg);
        }

        @Override
        public void visitClass(OntoClass cls) {
            elements.add(cls);
        }

        @Override
        public void visitInstance(OntoInstance instance) {
            elements.add(instance);
        }

        @Override
        public void visitGeneralization(OntoGeneralization g) {
            elements.add(g);
            generalizations.add(g);
            for (String s : g.sourceIds) {
                ClassNode node = classNode(s);
                if (node != null) {
                    node.addParentGeneralization(g);
                } else if (!isInstance(s)) {
                    log.warn("Generalization '{}' references missing source '{}'", g.id, s);
                }
            }
            for (String t : g.targetIds) {
                ClassNode node = classNode(t);
                if (node != null) {
                    node.addChildGeneralization(g);
                } else if (!isInstance(t)) {
                    log.warn("Generalization '{}' references missing target '{}'", g.id, t);
                }
            }
        }

        @Override
        public void visitAssociation(OntoAssociation association) {
            elements.add(association);
            AssociationEdge edge = new AssociationEdge(association);
            associations.add(edge);
            edgesByElement.put(association, edge);
            ClassNode source = classNode(association.sourceId);
            if (source != null) {
                source.addOutgoing(edge);
            } else if (!isInstance(association.sourceId)) {
                log.warn("Association '{}' references missing source '{}'", association.id, association.sourceId);
            }
            ClassNode target = classNode(association.targetId);
            if (target != null) {
                target.addIncoming(edge);
            } else if (!isInstance(association.targetId)) {
                log.warn("Association '{}' references missing target '{}'", association.id, association.targetId);
            }
        }

        @Override
        public void visitDependency(OntoDependency dependency) {
            elements.add(dependency);
        }

        @Override
        public void visitComment(OntoComment comment) {
            elements.add(comment);
        }

        @Override
        public void visitCommentLink(OntoCommentLink link) {
            elements.add(link);
        }
    }
}
