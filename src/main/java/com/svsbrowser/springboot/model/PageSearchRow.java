package com.svsbrowser.springboot.model;

public record PageSearchRow(long svsId, String title, String description, String summary) {
}
