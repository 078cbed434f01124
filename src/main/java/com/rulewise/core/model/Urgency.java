package com.rulewise.core.model;

public enum Urgency {
    HIGH,
    NORMAL
}
