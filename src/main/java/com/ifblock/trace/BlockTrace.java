package com.ifblock.trace;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Optional;

/**
 * Decision record for one resolved block.
 *
 * @param startLine Line of the opening marker
 * @param endLine   Line of the closing marker
 * @param branches  One record per branch, in written order
 */
@JsonPropertyOrder({"startLine", "endLine", "branches"})
public record BlockTrace(int startLine, int endLine, List<BranchTrace> branches) {

    public BlockTrace {
        branches = List.copyOf(branches);
    }

    /**
     * The branch that was taken, if any.
     */
    @JsonIgnore
    public Optional<BranchTrace> takenBranch() {
        return branches.stream().filter(BranchTrace::taken).findFirst();
    }
}
