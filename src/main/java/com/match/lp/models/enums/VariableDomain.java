package com.match.lp.models.enums;

public enum VariableDomain {
    CONTINUOUS,
    INTEGER
}
