package dev.kestrel.object;

public enum ObjectTag {
    STRING("string"),
    RECORD("record"),
    CLOSURE("closure"),
    ARRAY("array"),
    CELL("cell");

    private final String displayName;

    ObjectTag(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
