package info.isaksson.erland.ontoumlcheck.model;

import java.util.List;

/** Something that owns an ordered list of elements (the model root or a package). */
public interface ElementContainer {

    List<OntoElement> containedElements();
}
