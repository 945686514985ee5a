package org.dxworks.markframe.model;

import java.util.Objects;

/**
 * Destination of a link or image.
 */
public class Target {
    public String url = "";
    public String title = "";

    public Target() {
    }

    public Target(String url, String title) {
        this.url = url;
        this.title = title == null ? "" : title;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Target other)) return false;
        return url.equals(other.url) && title.equals(other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title);
    }

    @Override
    public String toString() {
        return "Target{" + url + ", " + title + "}";
    }
}
