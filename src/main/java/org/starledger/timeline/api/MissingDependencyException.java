package org.starledger.timeline.api;

/**
 * Thrown when a processor asks for the output of a processor that is not among its declared dependencies
 * or has not run for the current snapshot.
 */
public class MissingDependencyException extends RuntimeException {

    private final String dependencyId;

    public MissingDependencyException(String processorId, String dependencyId) {
        super("Processor '" + processorId + "' requested output of '" + dependencyId
                + "', which is undeclared or has not run");
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
