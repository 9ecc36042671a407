package com.brokerage.risk.model;

public enum EntityType {
    CLIENT,
    SYMBOL,
    SYSTEM
}
