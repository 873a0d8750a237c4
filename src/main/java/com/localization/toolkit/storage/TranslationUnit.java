package com.localization.toolkit.storage;

import java.util.Set;

/**
 * A single translatable (or informational) entry of a store.
 *
 * <p>Monolingual formats keep one text per unit, so {@link #getTarget()} and
 * {@link #getSource()} return the same value unless a subclass says otherwise.
 */
public abstract class TranslationUnit {

    public abstract String getId();

    public abstract void setId(String id);

    public abstract String getSource();

    public abstract void setSource(String source);

    public String getTarget() {
        return getSource();
    }

    public void setTarget(String target) {
        setSource(target);
    }

    /**
     * Translator notes; empty when the unit has none.
     */
    public abstract String getNotes();

    /**
     * Placeholders as they appear in the unit text.
     */
    public abstract Set<String> getPlaceholders();

    /**
     * Header units describe the store or a part of it and are not translated.
     */
    public abstract boolean isHeader();

    public boolean isTranslatable() {
        return !isHeader();
    }

    public boolean isBlank() {
        String source = getSource();
        return source == null || source.isBlank();
    }
}
