package org.broadinstitute.repeatresolver.sequence;

import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * Opaque handle for a sequence held by a {@link SequenceStore}.
 * Carries no sequence data, only the name under which the store knows it and whether it is assembled sequence or a
 * raw read.
 */
public final class SequenceId implements Comparable<SequenceId> {

    public enum Kind {
        /** sequence produced by the assembler, e.g. the content of a graph edge */
        ASSEMBLY,
        /** a raw long read */
        READ
    }

    private final Kind kind;
    private final String name;

    public SequenceId( final Kind kind, final String name ) {
        this.kind = Utils.nonNull(kind, "kind");
        this.name = Utils.nonNull(name, "name");
        Utils.validateArg(!name.isEmpty(), "sequence names may not be empty");
    }

    public static SequenceId assembly( final String name ) { return new SequenceId(Kind.ASSEMBLY, name); }
    public static SequenceId read( final String name ) { return new SequenceId(Kind.READ, name); }

    public Kind getKind() { return kind; }
    public String getName() { return name; }
    public boolean isRead() { return kind == Kind.READ; }

    @Override public boolean equals( final Object obj ) {
        if ( this == obj ) return true;
        if ( !(obj instanceof SequenceId) ) return false;
        final SequenceId that = (SequenceId)obj;
        return kind == that.kind && name.equals(that.name);
    }

    @Override public int hashCode() {
        return 47 * kind.hashCode() + name.hashCode();
    }

    @Override public int compareTo( final SequenceId that ) {
        final int result = kind.compareTo(that.kind);
        return result != 0 ? result : name.compareTo(that.name);
    }

    @Override public String toString() {
        return (kind == Kind.READ ? "read:" : "asm:") + name;
    }
}
