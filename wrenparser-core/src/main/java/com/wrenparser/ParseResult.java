package com.wrenparser;

import com.wrenparser.ast.Module;

import java.util.List;

/**
 * The tree for one file plus every problem recorded while building it. The
 * tree is always complete, even when problems were found.
 */
public record ParseResult(Module module, List<Problem> problems) {

    public ParseResult {
        problems = List.copyOf(problems);
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }
}
