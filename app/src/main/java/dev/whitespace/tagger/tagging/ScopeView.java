package dev.whitespace.tagger.tagging;

/**
 * Read-only queries over the scope stack available to the transition table.
 */
public interface ScopeView {

    /**
     * Innermost scope, or {@code null} when the stack is empty.
     */
    ScopeKind top();

    int count(ScopeKind kind);

    /**
     * Innermost brace-like scope ({@link ScopeKind#BRACE}, {@link ScopeKind#SWITCH_BODY} or
     * {@link ScopeKind#SHADOWED_BRACE}), or {@code null} when there is none.
     */
    ScopeKind innermostBlock();

    /**
     * Number of open scopes that count towards the expected indentation.
     */
    int indentDepth();
}
