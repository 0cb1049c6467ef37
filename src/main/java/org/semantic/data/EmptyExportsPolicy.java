package org.semantic.data;

/**
 * What an importer sees of a module that declared no exports at all.
 * The expected behavior differs between source languages, so it is chosen per run.
 */
public enum EmptyExportsPolicy {
    /** Every top-level binding of the module is visible. */
    EXPORT_ALL,
    /** Nothing is visible. */
    EXPORT_NONE;

    /**
     * Applies this policy to a module environment whose export set is empty.
     */
    public <L> Environment<L> apply(Environment<L> environment) {
        return this == EXPORT_ALL ? environment : Environment.empty();
    }
}
