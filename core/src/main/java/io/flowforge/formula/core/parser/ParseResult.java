package io.flowforge.formula.core.parser;

import io.flowforge.formula.core.ast.Node;
import java.util.Objects;

/**
 * Outcome of {@link Parser#parse(String)}: either a tree with its size metrics or a single
 * {@link ParseError}.
 */
public final class ParseResult {

    private final Node ast;
    private final ParseError error;
    private final int nodeCount;
    private final int depth;

    private ParseResult(Node ast, ParseError error, int nodeCount, int depth) {
        this.ast = ast;
        this.error = error;
        this.nodeCount = nodeCount;
        this.depth = depth;
    }

    public static ParseResult success(Node ast, int nodeCount, int depth) {
        Objects.requireNonNull(ast, "ast must not be null for success");
        return new ParseResult(ast, null, nodeCount, depth);
    }

    public static ParseResult failure(ParseError error) {
        Objects.requireNonNull(error, "error must not be null for failure");
        return new ParseResult(null, error, 0, 0);
    }

    public boolean isSuccess() {
        return ast != null;
    }

    /** The tree. Only valid when {@link #isSuccess()}. */
    public Node ast() {
        return ast;
    }

    /** The failure. Only valid when not {@link #isSuccess()}. */
    public ParseError error() {
        return error;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult[SUCCESS, nodes=" + nodeCount + ", depth=" + depth + "]"
                : "ParseResult[" + error.kind() + " at " + error.position() + ": " + error.message() + "]";
    }
}
