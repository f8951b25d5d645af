package com.probgraph.model;

public enum Capability {
    ENUMERATION,
    FACTORS,
    PARAMETER,
    PARAMETERIZED,
    CUSTOM_PROPOSAL,
    SMALL_SUPPORT
}
