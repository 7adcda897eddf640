package org.dxworks.urdf2mjcf.model;

/**
 * A follower joint coupled to a leader joint: {@code follower = multiplier * leader + offset}.
 * Multiplier and offset are kept as the source strings so they reach the output verbatim.
 */
public class MimicRelation {
    public static final String DEFAULT_MULTIPLIER = "1.0";
    public static final String DEFAULT_OFFSET = "0.0";

    public final String joint;
    public final String multiplier;
    public final String offset;

    public MimicRelation(String joint, String multiplier, String offset) {
        this.joint = joint;
        this.multiplier = multiplier != null ? multiplier : DEFAULT_MULTIPLIER;
        this.offset = offset != null ? offset : DEFAULT_OFFSET;
    }

    /** True when the offset parses to a non-zero number. Unparseable offsets count as present. */
    public boolean hasOffset() {
        try {
            return Double.parseDouble(offset.trim()) != 0.0;
        } catch (NumberFormatException e) {
            return true;
        }
    }
}
