package net.driftwatch.core.model;

public enum TriggerKind {
    SCHEDULED, MANUAL, RECOVERY;

    public static TriggerKind from(String s) {
        if (s == null) return SCHEDULED;
        try { return TriggerKind.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return SCHEDULED; }
    }
    public String code() { return name(); }
}
