package com.svsbrowser.springboot.model;

/**
 * Which chunk table an embedding row points into.
 */
public enum ChunkType {
    PAGE("page", "page_text_chunk"),
    ASSET("asset", "asset_text_chunk");

    private final String value;
    private final String tableName;

    ChunkType(String value, String tableName) {
        this.value = value;
        this.tableName = tableName;
    }

    public String getValue() {
        return value;
    }

    public String getTableName() {
        return tableName;
    }

    public static ChunkType fromValue(String value) {
        for (ChunkType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown chunk type: " + value);
    }
}
