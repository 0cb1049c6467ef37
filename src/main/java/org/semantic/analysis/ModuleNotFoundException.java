package org.semantic.analysis;

import org.semantic.data.ModuleName;

/**
 * Thrown when a module is loaded that is not in the table of modules available for import.
 * Fatal for the run; loading is not retried.
 */
public class ModuleNotFoundException extends EvaluationException {

    private final ModuleName moduleName;

    public ModuleNotFoundException(ModuleName moduleName) {
        super("Cannot load module: " + moduleName);
        this.moduleName = moduleName;
    }

    public ModuleName getModuleName() {
        return moduleName;
    }
}
