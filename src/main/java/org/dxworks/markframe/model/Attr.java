package org.dxworks.markframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes attached to headings, code, links, images and generic containers:
 * an identifier, a list of classes and ordered key/value pairs.
 */
public class Attr {
    public String identifier = "";
    public List<String> classes = new ArrayList<>();
    public Map<String, String> attributes = new LinkedHashMap<>();

    public Attr() {
    }

    public static Attr empty() {
        return new Attr();
    }

    public static Attr withClass(String className) {
        Attr attr = new Attr();
        attr.classes.add(className);
        return attr;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return identifier.isEmpty() && classes.isEmpty() && attributes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attr other)) return false;
        return identifier.equals(other.identifier)
                && classes.equals(other.classes)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, classes, attributes);
    }

    @Override
    public String toString() {
        return "Attr{" + identifier + ", " + classes + ", " + attributes + "}";
    }
}
