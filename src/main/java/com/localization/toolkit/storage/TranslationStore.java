package com.localization.toolkit.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An ordered collection of units read from and written to a single file.
 */
public abstract class TranslationStore<U extends TranslationUnit> {

    protected final List<U> units = new ArrayList<>();
    private String fileName;

    public void addUnit(U unit) {
        units.add(Objects.requireNonNull(unit, "unit"));
    }

    public List<U> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public Optional<U> findUnit(String id) {
        return units.stream()
                .filter(unit -> id != null && id.equals(unit.getId()))
                .findFirst();
    }

    public List<U> getTranslatableUnits() {
        return units.stream()
                .filter(TranslationUnit::isTranslatable)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Replaces the units of this store with the ones read from {@code content}.
     */
    public abstract void parse(byte[] content);

    public abstract byte[] serialize();
}
