package org.dxworks.surveyreports.analyzer;

import org.dxworks.surveyreports.model.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders the survey's blocks by the survey flow.
 */
public final class BlockOrderResolver {

    private BlockOrderResolver() {}

    /**
     * Returns zero-based block indices in display order. Without a flow the declaration order is used.
     * A flow entry matching no block, or several blocks, is skipped with a warning.
     */
    public static List<Integer> resolve(List<Block> blocks, List<String> flow) {
        List<Integer> ordering = new ArrayList<>();
        if (flow == null) {
            for (int i = 0; i < blocks.size(); i++) {
                ordering.add(i);
            }
            return ordering;
        }

        for (String blockId : flow) {
            int matchIndex = -1;
            int matches = 0;
            for (int i = 0; i < blocks.size(); i++) {
                Block block = blocks.get(i);
                if (block != null && block.id != null && block.id.equals(blockId)) {
                    matchIndex = i;
                    matches++;
                }
            }
            if (matches == 1) {
                ordering.add(matchIndex);
            } else {
                System.err.println("Warning: flow entry '" + blockId + "' matched " + matches
                        + " blocks, skipping it");
            }
        }
        return ordering;
    }
}
