package dev.whitespace.tagger.tagging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stack of open scopes persisted by a tagger from one line to the next. Besides push and pop it remembers
 * the lowest depth reached since {@link #markLine()}, so the end-of-line cleanup can tell which scopes were
 * opened on the current line.
 */
public class ScopeStack implements ScopeView {

    private final List<ScopeKind> scopes = new ArrayList<>();
    private int lowWater;

    public void markLine() {
        lowWater = scopes.size();
    }

    public void push(ScopeKind kind) {
        scopes.add(kind);
    }

    /**
     * Closes a scope of the given kind. Ternaries left open on top are dropped first; then the top is popped
     * when it matches (a brace also matches a switch body), or when it is the shadowed variant of the kind.
     * Nothing happens otherwise.
     *
     * @return whether a scope was removed
     */
    public boolean pop(ScopeKind kind) {
        if (kind != ScopeKind.TERNARY) {
            while (top() == ScopeKind.TERNARY) {
                removeTop();
            }
        }
        ScopeKind top = top();
        if (top == null) {
            return false;
        }
        boolean matches = top == kind
                || (kind == ScopeKind.BRACE && top == ScopeKind.SWITCH_BODY)
                || (kind.shadowed() != null && top == kind.shadowed());
        if (matches) {
            removeTop();
        }
        return matches;
    }

    /**
     * Replaces the top scope when it is of kind {@code from}.
     */
    public boolean promote(ScopeKind from, ScopeKind to) {
        if (top() != from) {
            return false;
        }
        removeTop();
        scopes.add(to);
        return true;
    }

    /**
     * Removes the outermost scope of the given kind together with everything opened after it.
     */
    public void discardFrom(ScopeKind kind) {
        int index = scopes.indexOf(kind);
        if (index >= 0) {
            truncate(index);
        }
    }

    /**
     * Removes everything opened after the outermost scope of the given kind, keeping that scope itself.
     */
    public void truncateAbove(ScopeKind kind) {
        int index = scopes.indexOf(kind);
        if (index >= 0) {
            truncate(index + 1);
        }
    }

    /**
     * Of the scopes opened since the last {@link #markLine()} that are still open, keeps the innermost
     * shadowable one live and replaces the earlier ones with their shadowed variants.
     */
    public void shadowSinceMark() {
        boolean liveFound = false;
        for (int index = scopes.size() - 1; index >= lowWater; index--) {
            ScopeKind shadowed = scopes.get(index).shadowed();
            if (shadowed == null) {
                continue;
            }
            if (liveFound) {
                scopes.set(index, shadowed);
            } else {
                liveFound = true;
            }
        }
    }

    public boolean contains(ScopeKind kind) {
        return scopes.contains(kind);
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    public int size() {
        return scopes.size();
    }

    public List<ScopeKind> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(scopes));
    }

    @Override
    public ScopeKind top() {
        return scopes.isEmpty() ? null : scopes.get(scopes.size() - 1);
    }

    @Override
    public int count(ScopeKind kind) {
        int count = 0;
        for (ScopeKind scope : scopes) {
            if (scope == kind) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ScopeKind innermostBlock() {
        for (int index = scopes.size() - 1; index >= 0; index--) {
            ScopeKind scope = scopes.get(index);
            if (scope == ScopeKind.BRACE || scope == ScopeKind.SWITCH_BODY || scope == ScopeKind.SHADOWED_BRACE) {
                return scope;
            }
        }
        return null;
    }

    @Override
    public int indentDepth() {
        int depth = 0;
        for (ScopeKind scope : scopes) {
            if (scope.countsForIndent()) {
                depth++;
            }
        }
        return depth;
    }

    private void removeTop() {
        scopes.remove(scopes.size() - 1);
        lowWater = Math.min(lowWater, scopes.size());
    }

    private void truncate(int newSize) {
        while (scopes.size() > newSize) {
            removeTop();
        }
    }

    @Override
    public String toString() {
        return scopes.toString();
    }
}
