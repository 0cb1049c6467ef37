package org.semantic.analysis;

/**
 * Thrown when a program is evaluated from an empty list of modules.
 */
public class EmptyModuleListException extends EvaluationException {

    public EmptyModuleListException() {
        super("evaluateModules: empty list");
    }
}
