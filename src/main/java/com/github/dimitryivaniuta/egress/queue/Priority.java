package com.github.dimitryivaniuta.egress.queue;

public enum Priority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    Priority(int weight) { this.weight = weight; }

    public int weight() { return weight; }
}
