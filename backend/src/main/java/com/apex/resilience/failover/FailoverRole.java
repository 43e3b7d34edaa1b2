package com.apex.resilience.failover;

public enum FailoverRole {

    LEADER("leader"),
    FOLLOWER("follower");

    private final String label;

    FailoverRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FailoverRole of(boolean leader) {
        return leader ? LEADER : FOLLOWER;
    }
}
