package info.isaksson.erland.ontoumlcheck.validation;

/**
 * Anti-patterns with a detector, in execution order.
 */
public enum AntiPatternType {
    BIN_OVER("BinOver", "Binary relation with overlapping ends"),
    DEC_INT("DecInt", "Deceiving intersection"),
    DEP_PHASE("DepPhase", "Relationally dependent phase"),
    FREE_ROLE("FreeRole", "Free role specialization"),
    GS_RIG("GSRig", "Generalization set with mixed rigidity"),
    HET_COLL("HetColl", "Heterogeneous collective"),
    HOMO_FUNC("HomoFunc", "Homogeneous functional complex"),
    MIX_RIG("MixRig", "Mixin with same rigidity"),
    MULT_DEP("MultDep", "Multiple relational dependency"),
    REL_RIG("RelRig", "Relator mediating rigid types"),
    UNDEF_FORMAL("UndefFormal", "Undefined formal association"),
    UNDEF_PHASE("UndefPhase", "Undefined phase partition");

    private final String code;
    private final String description;

    AntiPatternType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /** Accepts the code ({@code BinOver}) or the constant name ({@code BIN_OVER}), case-insensitively. */
    public static AntiPatternType parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("Anti-pattern name is blank");
        String v = s.trim();
        for (AntiPatternType t : values()) {
            if (t.code.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        throw new IllegalArgumentException("Unknown anti-pattern: " + s);
    }
}
