package org.dxworks.markframe.reader.markdown.block;

/**
 * Outcome of offering one line to the open block of a {@link BlockParser}.
 */
final class Transition {

    enum Type {
        /** The open block consumed the line. */
        UNCHANGED,
        /** The line turned the open block into a different one. */
        REPLACED,
        /** The open block consumed the line and is complete. */
        FINISHED,
        /** The line formed a complete single-line block; the open block stays open. */
        EMITTED,
        /** The open block is complete and the line started a new open block. */
        FINISHED_AND_REPLACED,
        /** The open block is complete and the line formed a complete single-line block. */
        FINISHED_AND_EMITTED
    }

    static final Transition UNCHANGED = new Transition(Type.UNCHANGED, null);
    static final Transition FINISHED = new Transition(Type.FINISHED, null);

    private final Type type;
    private final OpenBlock block;

    private Transition(Type type, OpenBlock block) {
        this.type = type;
        this.block = block;
    }

    static Transition replaced(OpenBlock block) {
        return new Transition(Type.REPLACED, block);
    }

    static Transition emitted(OpenBlock block) {
        return new Transition(Type.EMITTED, block);
    }

    static Transition finishedAndReplaced(OpenBlock block) {
        return new Transition(Type.FINISHED_AND_REPLACED, block);
    }

    static Transition finishedAndEmitted(OpenBlock block) {
        return new Transition(Type.FINISHED_AND_EMITTED, block);
    }

    Type type() {
        return type;
    }

    OpenBlock block() {
        return block;
    }
}
