package org.broadinstitute.repeatresolver.exceptions;

/**
 * <p/>
 * Class ResolverException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class ResolverException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public ResolverException( String msg ) {
        super(msg);
    }

    public ResolverException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of ResolverException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends ResolverException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
    }

    /**
     * Thrown when a graph operation names a junction or edge handle that has been deleted or never existed.
     */
    public static class MissingGraphElement extends ResolverException {
        private static final long serialVersionUID = 0L;

        public MissingGraphElement( final String elementType, final int handle ) {
            super(String.format("Attempted to access %s %d, but it is not present in the graph", elementType, handle));
        }
    }

    /**
     * Thrown when separating a path would hand out more copies of a repeat edge than it has left.
     * Fatal for the edge concerned, not for the resolution run.
     */
    public static class MultiplicityInconsistencyException extends ResolverException {
        private static final long serialVersionUID = 0L;

        private final int edge;
        private final int remainingCopies;
        private final int requestedCopies;

        public MultiplicityInconsistencyException( final int edge, final int remainingCopies, final int requestedCopies ) {
            super(String.format("Edge %d has %d copies left but a separation requested %d",
                    edge, remainingCopies, requestedCopies));
            this.edge = edge;
            this.remainingCopies = remainingCopies;
            this.requestedCopies = requestedCopies;
        }

        public int getEdge() { return edge; }
        public int getRemainingCopies() { return remainingCopies; }
        public int getRequestedCopies() { return requestedCopies; }
    }
}
