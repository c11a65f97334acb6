package com.wrenparser.ast;

import java.util.List;

/**
 * The root of a parsed file: its top-level definitions in source order.
 */
public record Module(List<Stmt> statements) implements Node {
    @Override
    public String type() {
        return "Module";
    }
}
