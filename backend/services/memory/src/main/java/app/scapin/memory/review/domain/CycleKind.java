package app.scapin.memory.review.domain;

public enum CycleKind {
    /** Automated improvement pass. */
    RETOUCHE,
    /** Human reading pass. */
    LECTURE
}
