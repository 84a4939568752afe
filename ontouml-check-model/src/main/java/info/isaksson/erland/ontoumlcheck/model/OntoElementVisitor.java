package info.isaksson.erland.ontoumlcheck.model;

/**
 * Double-dispatch over the element kinds. All methods default to no-op so a visitor only
 * overrides the kinds it cares about.
 */
public interface OntoElementVisitor {

    default void visitPackage(OntoPackage pkg) {}

    default void visitClass(OntoClass cls) {}

    default void visitInstance(OntoInstance instance) {}

    default void visitGeneralization(OntoGeneralization generalization) {}

    default void visitAssociation(OntoAssociation association) {}

    default void visitDependency(OntoDependency dependency) {}

    default void visitComment(OntoComment comment) {}

    default void visitCommentLink(OntoCommentLink link) {}
}
