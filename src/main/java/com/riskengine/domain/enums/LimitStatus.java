package com.riskengine.domain.enums;

public enum LimitStatus {
    PASS,
    FAIL
}
