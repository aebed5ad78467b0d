package com.example.syncengine.entity;

import java.util.Locale;

/**
 * Provider services that can be synchronized.
 */
public enum ServiceType {
    GMAIL("gmail", "Gmail", "emails"),
    CALENDAR("calendar", "Google Calendar", "events"),
    DRIVE("drive", "Google Drive", "files");

    private final String pathValue;
    private final String displayName;
    private final String itemNoun;

    ServiceType(String pathValue, String displayName, String itemNoun) {
        this.pathValue = pathValue;
        this.displayName = displayName;
        this.itemNoun = itemNoun;
    }

    public String getPathValue() {
        return pathValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Plural noun for the items this service imports, used in progress text.
     */
    public String getItemNoun() {
        return itemNoun;
    }

    /**
     * Resolve a URL path segment. Accepts the generic names (mail, file-store) as aliases.
     *
     * @throws IllegalArgumentException for unknown services
     */
    public static ServiceType fromPath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Service must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "gmail", "mail" -> GMAIL;
            case "calendar" -> CALENDAR;
            case "drive", "file-store", "filestore" -> DRIVE;
            default -> throw new IllegalArgumentException("Unsupported service: " + value);
        };
    }
}
