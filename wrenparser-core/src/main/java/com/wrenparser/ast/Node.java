package com.wrenparser.ast;

/**
 * Base interface for all AST nodes.
 */
public sealed interface Node permits
    Module,
    Stmt,
    Method,
    Body,
    MapEntry {

    /** The simple name of this node kind, e.g. {@code "CallExpr"}. */
    String type();
}
