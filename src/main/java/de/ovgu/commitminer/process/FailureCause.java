package de.ovgu.commitminer.process;

public enum FailureCause {
    CHECKOUT,
    ANALYSIS,
    INTERNAL
}
