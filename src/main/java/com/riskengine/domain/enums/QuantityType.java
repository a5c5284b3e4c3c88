package com.riskengine.domain.enums;

/**
 * How a holding's quantity is expressed. Exactly one applies per holding.
 */
public enum QuantityType {
    SHARES,
    DOLLARS
}
