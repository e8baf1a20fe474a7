package com.libragraph.cadence.core.job;

public enum JobStatus {
    ACTIVE(0, "active"),
    ERROR(1, "error"),
    CANCELLED(2, "cancelled"),
    COMPLETED(3, "completed");

    private final int id;
    private final String label;

    JobStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    public static JobStatus fromId(int id) {
        for (JobStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown JobStatus id: " + id);
    }
}
