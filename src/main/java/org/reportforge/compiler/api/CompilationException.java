package org.reportforge.compiler.api;

/**
 * An exception that is thrown when an error occurs while loading or transforming a layout.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The first error aborts the whole transformation; no partial IR is ever produced.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final transient Object offendingValue;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    /**
     * Constructs a new compilation exception carrying the value that caused it.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param offendingValue The value that could not be processed. Can be null.
     * @param sourceInfo Where the value was declared. Can be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Object offendingValue, SourceInfo sourceInfo) {
        this(errorCode, message, offendingValue, sourceInfo, null);
    }

    private CompilationException(CompilerErrorCode errorCode, String message, Object offendingValue,
                                 SourceInfo sourceInfo, Throwable cause) {
        super(format(errorCode, message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.offendingValue = offendingValue;
        this.sourceInfo = sourceInfo;
    }

    public CompilerErrorCode errorCode() {
        return errorCode;
    }

    public Object offendingValue() {
        return offendingValue;
    }

    public SourceInfo sourceInfo() {
        return sourceInfo;
    }

    private static String format(CompilerErrorCode code, String message, SourceInfo sourceInfo) {
        if (sourceInfo == null || sourceInfo.equals(SourceInfo.UNKNOWN)) {
            return String.format("[%s] %s", code.tag(), message);
        }
        return String.format("[%s] %s at %s", code.tag(), message, sourceInfo);
    }
}
