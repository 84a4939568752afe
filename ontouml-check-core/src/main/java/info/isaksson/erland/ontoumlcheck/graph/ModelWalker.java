package info.isaksson.erland.ontoumlcheck.graph;

import info.isaksson.erland.ontoumlcheck.model.ElementContainer;
import info.isaksson.erland.ontoumlcheck.model.OntoElement;
import info.isaksson.erland.ontoumlcheck.model.OntoElementVisitor;
import info.isaksson.erland.ontoumlcheck.model.OntoPackage;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-order descent over a package tree. Packages are reported to the visitor and then
 * entered, so nested elements follow their package in traversal order.
 */
public final class ModelWalker {

    private ModelWalker() {}

    public static void walk(ElementContainer root, OntoElementVisitor visitor) {
        if (root == null || visitor == null) return;
        for (OntoElement e : root.containedElements()) {
            if (e == null) continue;
            e.accept(visitor);
            if (e instanceof OntoPackage) {
                walk((OntoPackage) e, visitor);
            }
        }
    }

    /** All elements of the tree in traversal order. */
    public static List<OntoElement> flatten(ElementContainer root) {
        List<OntoElement> out = new ArrayList<>();
        if (root == null) return out;
        for (OntoElement e : root.containedElements()) {
            if (e == null) continue;
            out.add(e);
            if (e instanceof OntoPackage) {
                out.addAll(flatten((OntoPackage) e));
            }
        }
        return out;
    }
}
