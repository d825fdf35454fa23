package com.youtubestats;

import java.util.Locale;

/**
 * What publishing does when the destination already exists.
 */
public enum WriteMode {
    ERROR_IF_EXISTS,
    OVERWRITE;
    
    public static WriteMode fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace("_", "");
        switch (normalized) {
            case "errorifexists":
            case "error":
                return ERROR_IF_EXISTS;
            case "overwrite":
                return OVERWRITE;
            default:
                throw new IllegalArgumentException("Unknown write mode '" + name + "', expected errorifexists or overwrite");
        }
    }
}
