package net.littleredcomputer.fudg;

import javax.annotation.Nullable;

/**
 * Labels carried by edges in a graph record. Only PLAIN, TOP and UNSPEC become graph
 * edges; CONJ and ANAPH are bookkeeping for coordination and anaphora.
 */
public enum EdgeLabel {
    PLAIN(null),
    TOP("cbbhead"),
    UNSPEC("unspec"),
    CONJ("Conj"),
    ANAPH("Anaph");

    private final String recordName;

    EdgeLabel(String recordName) { this.recordName = recordName; }

    /** @return the label as written in a graph record (null for PLAIN) */
    @Nullable
    public String recordName() { return recordName; }

    /** Does this label attach a bundle member (as opposed to an ordinary dependent)? */
    boolean isMember() { return this == TOP || this == UNSPEC; }

    public static EdgeLabel fromRecord(@Nullable String label) {
        if (label == null) return PLAIN;
        for (EdgeLabel l : values()) {
            if (label.equals(l.recordName)) return l;
        }
        throw new ConstructionException("unknown edge label: " + label);
    }
}
