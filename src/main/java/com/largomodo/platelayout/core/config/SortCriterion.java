package com.largomodo.platelayout.core.config;

/**
 * One sort key with its direction.
 *
 * @param key   what to sort by
 * @param field metadata field name when {@code key} is {@link Key#FIELD}, otherwise {@code null}
 * @param order direction
 */
public record SortCriterion(Key key, String field, SortOrder order) {

    public static final SortCriterion NONE = new SortCriterion(Key.NONE, null, SortOrder.ASCENDING);

    public enum Key {
        NONE,
        ALPHABETICAL,
        NATURAL_NAME,
        RANDOM,
        FIELD
    }

    public SortCriterion {
        if (key == null) {
            throw new InvalidLayoutConfigException("Sort key is required");
        }
        if (key == Key.FIELD && (field == null || field.isBlank())) {
            throw new InvalidLayoutConfigException("Field sort requires a field name");
        }
        if (key != Key.FIELD) {
            field = null;
        }
        order = order == null ? SortOrder.ASCENDING : order;
    }

    /**
     * Maps an option value to a criterion. Reserved words select the built-in keys, anything
     * else names a metadata field.
     */
    public static SortCriterion parse(String value, SortOrder order) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String v = value.trim();
        return switch (v.toLowerCase()) {
            case "none" -> NONE;
            case "alphabetical" -> new SortCriterion(Key.ALPHABETICAL, null, order);
            case "natural_name", "natural" -> new SortCriterion(Key.NATURAL_NAME, null, order);
            case "random" -> new SortCriterion(Key.RANDOM, null, order);
            default -> new SortCriterion(Key.FIELD, v, order);
        };
    }

    public static SortCriterion field(String field, SortOrder order) {
        return new SortCriterion(Key.FIELD, field, order);
    }

    public boolean isField() {
        return key == Key.FIELD;
    }

    public boolean isNone() {
        return key == Key.NONE;
    }
}
