package com.turbosentinel.core.model;

/**
 * Detectors taking part in a tag analysis.
 *
 * <p>
 * Primary detectors generate candidates; verification detectors confirm
 * them. The budget is the number of confidence points a detector contributes
 * under the fixed-budget scoring strategy when it fires for a tag.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    /** Rolling z-score against the tag's own baseline. */
    STATISTICAL(Role.PRIMARY, 40),

    /** Multi-tag reconstruction-error model over the unit's feature tags. */
    RECONSTRUCTION(Role.PRIMARY, 30),

    /** Modified Thompson tau test over a local window. */
    TAU_TEST(Role.VERIFICATION, 20),

    /** Isolation-style random cut forest over engineered sample features. */
    OUTLIER_FOREST(Role.VERIFICATION, 10);

    /** Stage a detector belongs to. */
    public enum Role {
        PRIMARY,
        VERIFICATION
    }

    private final Role role;
    private final int budgetPoints;

    DetectorKind(Role role, int budgetPoints) {
        this.role = role;
        this.budgetPoints = budgetPoints;
    }

    public Role getRole() {
        return role;
    }

    public int getBudgetPoints() {
        return budgetPoints;
    }

    public boolean isPrimary() {
        return role == Role.PRIMARY;
    }

    public boolean isVerification() {
        return role == Role.VERIFICATION;
    }
}
