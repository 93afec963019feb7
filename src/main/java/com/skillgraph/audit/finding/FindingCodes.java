package com.skillgraph.audit.finding;

public final class FindingCodes {
    public static final String MISSING_REFERENCE = "MISSING_REFERENCE";
    public static final String KIND_MISMATCH = "KIND_MISMATCH";
    public static final String RESOLVES_TO_BOTH = "RESOLVES_TO_BOTH";
    public static final String SELF_DEPENDENCY = "SELF_DEPENDENCY";
    public static final String CYCLIC_SKILL_DEPENDENCY = "CYCLIC_SKILL_DEPENDENCY";
    public static final String DUPLICATE_DECLARATION = "DUPLICATE_DECLARATION";

    private FindingCodes() {}
}
