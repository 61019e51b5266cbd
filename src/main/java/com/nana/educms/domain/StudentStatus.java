package com.nana.educms.domain;

/**
 * StudentStatus — Domain Layer Enumeration
 *
 * <p>The enrollment state of a {@link Student}. The enum {@code name()} is the
 * value persisted in the {@code students.status} column (the table's CHECK
 * constraint mirrors these constants); the {@code displayName} is what the
 * CSV export and statistics keys show to people.
 */
public enum StudentStatus {

    /** Currently enrolled and attending. */
    ACTIVE("Active"),

    /** Temporarily not attending (e.g., leave of absence). */
    INACTIVE("Inactive"),

    /** Suspended pending disciplinary or academic review. */
    SUSPENDED("Suspended"),

    /** Completed their programme. */
    GRADUATED("Graduated"),

    /** Moved to another institution. */
    TRANSFERRED("Transferred"),

    /** Left before completing their programme. */
    WITHDRAWN("Withdrawn");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final String displayName;

    StudentStatus(String displayName) {
        this.displayName = displayName;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /**
     * Returns the human-readable label for this status.
     *
     * @return display name (e.g., "Active", "Graduated")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Converts a stored or user-supplied string back to the enum constant,
     * ignoring case and accepting either the constant name or the display name.
     *
     * <p>Unlike {@link #valueOf(String)} this never throws: blank or
     * unrecognised input yields {@code ACTIVE} so a single legacy row cannot
     * break a whole listing.
     *
     * @param value the stored value (e.g., "ACTIVE" or "Active")
     * @return the matching {@code StudentStatus}, or {@code ACTIVE} as default
     */
    public static StudentStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        String trimmed = value.trim();
        for (StudentStatus s : values()) {
            if (s.name().equalsIgnoreCase(trimmed) || s.displayName.equalsIgnoreCase(trimmed)) {
                return s;
            }
        }
        return ACTIVE;
    }

    /**
     * Returns the enum name, which is also the persisted value.
     *
     * @return the enum constant name (e.g., "ACTIVE")
     */
    @Override
    public String toString() {
        return name();
    }
}
