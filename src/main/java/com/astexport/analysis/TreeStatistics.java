package com.astexport.analysis;

import java.util.List;

public record TreeStatistics(
        int nodeCount,
        int interiorCount,
        int terminalCount,
        int maxDepth,
        List<String> distinctTypes,
        List<String> sampleTypes
) {

    /** 空树的统计结果 */
    public static TreeStatistics empty() {
        return new TreeStatistics(0, 0, 0, 0, List.of(), List.of());
    }

    public int distinctTypeCount() {
        return distinctTypes.size();
    }
}
