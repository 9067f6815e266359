package com.cgraph.forkjoin.structure;

public enum RegionType {
    ATOMIC,
    SEQUENCE,
    PARALLEL
}
