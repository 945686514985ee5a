package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Cite")
public class Cite extends Inline {
    public List<Citation> citations = new ArrayList<>();
    public List<Inline> content = new ArrayList<>();

    public static class Citation {
        public String id = "";
        public List<Inline> prefix = new ArrayList<>();
        public List<Inline> suffix = new ArrayList<>();
        public Mode mode = Mode.NORMAL_CITATION;
        public int noteNum;
        public int hash;

        public enum Mode {
            AUTHOR_IN_TEXT,
            SUPPRESS_AUTHOR,
            NORMAL_CITATION
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Citation other)) return false;
            return noteNum == other.noteNum
                    && hash == other.hash
                    && id.equals(other.id)
                    && prefix.equals(other.prefix)
                    && suffix.equals(other.suffix)
                    && mode == other.mode;
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, prefix, suffix, mode, noteNum, hash);
        }
    }

    @Override
    public String kind() {
        return "Cite";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cite other)) return false;
        return citations.equals(other.citations) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(citations, content);
    }
}
