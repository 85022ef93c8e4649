package com.github.nlayna.transferengine.model;

/**
 * Scheduling tier of a task. Higher weight is started first.
 */
public enum TransferPriority {
    HIGH(3),
    NORMAL(2),
    LOW(1);

    private final int weight;

    TransferPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Low priority transfers ask the server to deprioritize them.
     */
    public boolean useReducedPriorityHeader() {
        return this == LOW;
    }
}
