package com.rulewise.core.model;

public enum IntentAction {
    IMPLEMENT,
    FIX,
    REFACTOR,
    REVIEW,
    GENERAL
}
