package org.reportforge.compiler.api;

import java.util.Map;

/**
 * Thrown when a content item is neither a label, a field nor a nested layout.
 */
public class UnknownElementTypeException extends CompilationException {

    /**
     * @param attributes The attributes of the offending element.
     * @param sourceInfo Where the element was declared.
     */
    public UnknownElementTypeException(Map<String, Object> attributes, SourceInfo sourceInfo) {
        super(CompilerErrorCode.UNKNOWN_ELEMENT_TYPE,
                "Element is neither a label, a field nor a layout: " + attributes,
                attributes, sourceInfo);
    }
}
