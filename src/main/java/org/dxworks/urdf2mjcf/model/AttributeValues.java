package org.dxworks.urdf2mjcf.model;

import java.math.BigDecimal;

/**
 * Formatting of numeric attribute values written into the model.
 */
public final class AttributeValues {

    private AttributeValues() {
        // utility class
    }

    /** Plain decimal notation that always keeps a fraction: {@code 500.0}, {@code 0.0005}, {@code 10000000.0}. */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
}
