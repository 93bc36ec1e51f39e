package fr.lapetina.microbatch.domain.model;

/**
 * Fixed label set produced by the classifier.
 *
 * The ordinal is the index of the label in a model's output distribution.
 */
public enum ClassLabel {
    NONE("none"),
    PRODUCT("product"),
    SERIES("series");

    private final String wireName;

    ClassLabel(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in JSON responses.
     */
    public String wireName() {
        return wireName;
    }

    public int index() {
        return ordinal();
    }

    /**
     * Maps a distribution index to a label. Unknown indexes map to {@link #NONE}.
     */
    public static ClassLabel fromIndex(int index) {
        ClassLabel[] labels = values();
        if (index < 0 || index >= labels.length) {
            return NONE;
        }
        return labels[index];
    }

    public static int count() {
        return values().length;
    }
}
