package org.reportforge.compiler.api;

import org.reportforge.compiler.frontend.irgen.TrackAxis;

/**
 * Thrown when a column or row track declaration cannot be normalized.
 */
public class InvalidTrackDefinitionException extends CompilationException {

    private final TrackAxis axis;

    /**
     * @param axis Whether the declaration was for columns or rows.
     * @param declaration The offending declaration.
     * @param sourceInfo Where the declaration was made.
     */
    public InvalidTrackDefinitionException(TrackAxis axis, Object declaration, SourceInfo sourceInfo) {
        super(CompilerErrorCode.INVALID_TRACK_DEFINITION,
                "Invalid " + axis.key() + " track definition: " + declaration,
                declaration, sourceInfo);
        this.axis = axis;
    }

    public TrackAxis axis() {
        return axis;
    }
}
