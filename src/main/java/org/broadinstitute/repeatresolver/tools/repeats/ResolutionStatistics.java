package org.broadinstitute.repeatresolver.tools.repeats;

/**
 * Running totals for one resolution run.
 */
public final class ResolutionStatistics {
    private int iterations;
    private int connections;
    private int acceptedPaths;
    private int separatedEdges;
    private int resolvedInPlace;
    private int prunedEdges;
    private int retainedEdges;
    private int inconsistencies;
    private boolean iterationCapReached;

    void addIteration() { iterations += 1; }
    void addConnections( final int count ) { connections += count; }
    void addSeparation() { acceptedPaths += 1; separatedEdges += 1; }
    void addInPlaceResolution() { acceptedPaths += 1; resolvedInPlace += 1; }
    void addPruned( final int count ) { prunedEdges += count; }
    void addRetained() { retainedEdges += 1; }
    void addInconsistency() { inconsistencies += 1; }
    void setIterationCapReached() { iterationCapReached = true; }

    public int getIterations() { return iterations; }
    public int getConnections() { return connections; }
    public int getAcceptedPaths() { return acceptedPaths; }
    public int getSeparatedEdges() { return separatedEdges; }
    public int getResolvedInPlace() { return resolvedInPlace; }
    public int getPrunedEdges() { return prunedEdges; }
    public int getRetainedEdges() { return retainedEdges; }
    public int getInconsistencies() { return inconsistencies; }
    public boolean isIterationCapReached() { return iterationCapReached; }

    @Override public String toString() {
        return iterations + " iterations, " + connections + " connections, " + acceptedPaths + " paths accepted (" +
                separatedEdges + " separated, " + resolvedInPlace + " resolved in place), " + prunedEdges +
                " edges pruned, " + retainedEdges + " retained, " + inconsistencies + " inconsistencies";
    }
}
