package com.svsbrowser.springboot.model;

public final class PageStatus {
    public static final String ACTIVE = "active";
    public static final String MISSING = "missing";
    public static final String ARCHIVED = "archived";

    private PageStatus() {}
}
