package dev.pekelund.wastelog.waste;

/**
 * Shared fallback values for fields the vision analysis may omit.
 */
public final class WasteItemDefaults {

    public static final String UNKNOWN = "unknown";
    public static final String UNKNOWN_ITEM_NAME = "Unknown item";

    private WasteItemDefaults() {
    }
}
