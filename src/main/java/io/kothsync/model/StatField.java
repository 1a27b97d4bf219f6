package io.kothsync.model;

public enum StatField {
    PLAYTIME_SECONDS("playtime_seconds"),
    KILLS("kills"),
    DEATHS("deaths"),
    CAPTURES("captures");

    private final String column;

    StatField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
