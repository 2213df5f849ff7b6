package com.civica.model;

/**
 * Dutch parties with their approximate position on each opinion axis (-1..1).
 * Used for rule-based recommendations when the backend cannot be reached.
 */
public enum Party {

    VVD("VVD", 0.6, -0.1, -0.2),
    PVV("PVV", 0.2, -0.8, -0.6),
    CDA("CDA", 0.3, -0.4, 0.1),
    D66("D66", 0.1, 0.6, 0.5),
    SP("SP", -0.7, -0.1, 0.3),
    PVDA("PvdA", -0.5, 0.3, 0.5),
    GL("GL", -0.5, 0.5, 0.9),
    CU("CU", -0.1, -0.5, 0.4),
    SGP("SGP", 0.3, -0.9, -0.1),
    DENK("DENK", -0.3, 0.2, 0.2),
    FVD("FvD", 0.7, -0.7, -0.8),
    VOLT("Volt", 0.0, 0.7, 0.7),
    BBB("BBB", 0.3, -0.5, -0.4);

    private final String displayName;
    private final double economic;
    private final double social;
    private final double environmental;

    Party(String displayName, double economic, double social, double environmental) {
        this.displayName = displayName;
        this.economic = economic;
        this.social = social;
        this.environmental = environmental;
    }

    public String getDisplayName() {
        return displayName;
    }

    public OpinionVector getPosition() {
        return OpinionVector.builder()
                .economic(economic)
                .social(social)
                .environmental(environmental)
                .build();
    }
}
