package com.treegrep.search;

import java.util.List;

public record SearchHit(
        int treeIndex,
        List<Integer> position,
        String label,
        String text
) {
}
