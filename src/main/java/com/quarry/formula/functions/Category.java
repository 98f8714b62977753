package com.quarry.formula.functions;

public enum Category {
    MATH("Math"),
    TEXT("Text"),
    DATETIME("Date & Time"),
    LOGIC("Logic"),
    AGGREGATE("Aggregate"),
    CONTEXTUAL("Contextual");

    private final String displayName;

    Category(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
