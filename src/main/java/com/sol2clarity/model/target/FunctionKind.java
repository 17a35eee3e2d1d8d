package com.sol2clarity.model.target;

public enum FunctionKind {
    PUBLIC("define-public", "Public function"),
    READ_ONLY("define-read-only", "Read-only function"),
    PRIVATE("define-private", "Private function");

    private final String keyword;
    private final String description;

    FunctionKind(String keyword, String description) {
        this.keyword = keyword;
        this.description = description;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getDescription() {
        return description;
    }
}
