package com.largomodo.platelayout.core.domain;

public enum PlacementStatus {
    FULLY_PLACED,
    PARTIALLY_PLACED
}
