package com.sparky.suppress.model;

/**
 * Category of mail a suppression entry applies to.
 */
public enum SuppressionType {
    TRANSACTIONAL("transactional"),
    NON_TRANSACTIONAL("non_transactional");

    private final String wireName;

    SuppressionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null when the value is not one of the wire names
     */
    public static SuppressionType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (SuppressionType t : values()) {
            if (t.wireName.equals(value)) {
                return t;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
