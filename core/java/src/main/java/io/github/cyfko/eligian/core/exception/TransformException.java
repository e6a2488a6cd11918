package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when the AST to IR transformation cannot proceed.
 * <p>
 * For {@link TransformErrorKind#INVALID_ACTION} the offending syntax node is attached in
 * serialized form so that tooling can display what the transformer received.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class TransformException extends CompilationException {

    private final TransformErrorKind kind;
    private final String astNode;
    private final String hint;

    public TransformException(TransformErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null, null);
    }

    public TransformException(TransformErrorKind kind, String message, SourceLocation location, String astNode) {
        this(kind, message, location, astNode, null);
    }

    /**
     * @param kind     the transformation failure
     * @param message  the description of the failure
     * @param location the offending source span
     * @param astNode  serialized form of the offending syntax node, may be {@code null}
     * @param hint     suggestion for fixing the error, may be {@code null}
     */
    public TransformException(TransformErrorKind kind, String message, SourceLocation location,
                              String astNode, String hint) {
        super(ErrorCategory.TRANSFORM, message, location);
        this.kind = kind;
        this.astNode = astNode;
        this.hint = hint;
    }

    public TransformErrorKind getKind() {
        return kind;
    }

    public String getAstNode() {
        return astNode;
    }

    public String getHint() {
        return hint;
    }
}
