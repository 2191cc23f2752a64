package org.snippet.cfg;

public enum BlockKind {
    STATEMENT,
    DECISION
}
