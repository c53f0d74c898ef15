package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Output of {@link BlockStructurer}: the preamble plus one block per heading, in file order. */
public final class BlockForest {
    private final RawBlock preamble;
    private final List<RawBlock> headings;

    BlockForest(RawBlock preamble, List<RawBlock> headings) {
        this.preamble = Objects.requireNonNull(preamble, "preamble");
        this.headings = List.copyOf(headings);
    }

    public RawBlock getPreamble() {
        return preamble;
    }

    public List<RawBlock> getHeadings() {
        return headings;
    }

    List<String> describe() {
        List<String> out = new ArrayList<>();
        preamble.describe(out, "");
        for (RawBlock heading : headings) {
            heading.describe(out, "");
        }
        return out;
    }
}
