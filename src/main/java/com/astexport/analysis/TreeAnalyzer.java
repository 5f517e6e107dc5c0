package com.astexport.analysis;

import com.astexport.config.Constants;
import com.astexport.sexp.SexpNode;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

public class TreeAnalyzer {

    /**
     * 统计节点总数：当前节点计 1，再累加全部子树；空树为 0。
     */
    public int countNodes(SexpNode node) {
        if (node == null) {
            return 0;
        }
        int count = 1;
        for (SexpNode child : node.children()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * 收集树中出现过的全部类型标签，结果按字典序排列以保证输出稳定。
     */
    public SortedSet<String> collectTypes(SexpNode node) {
        SortedSet<String> types = new TreeSet<>();
        collectTypes(node, types);
        return Collections.unmodifiableSortedSet(types);
    }

    private void collectTypes(SexpNode node, SortedSet<String> types) {
        if (node == null) {
            return;
        }
        types.add(node.type());
        for (SexpNode child : node.children()) {
            collectTypes(child, types);
        }
    }

    /**
     * 单次遍历同时计算节点数、类型清单与最大深度。
     */
    public TreeStatistics analyze(SexpNode root, int sampleSize) {
        if (root == null) {
            return TreeStatistics.empty();
        }

        Accumulator accumulator = new Accumulator();
        visit(root, 1, accumulator);

        int safeSampleSize = Math.max(0, Math.min(sampleSize, Constants.MAX_SAMPLE_SIZE));
        List<String> distinctTypes = List.copyOf(accumulator.types);
        List<String> sampleTypes = distinctTypes.subList(0, Math.min(safeSampleSize, distinctTypes.size()));

        return new TreeStatistics(
                accumulator.interiorCount + accumulator.terminalCount,
                accumulator.interiorCount,
                accumulator.terminalCount,
                accumulator.maxDepth,
                distinctTypes,
                List.copyOf(sampleTypes)
        );
    }

    private void visit(SexpNode node, int depth, Accumulator accumulator) {
        accumulator.types.add(node.type());
        accumulator.maxDepth = Math.max(accumulator.maxDepth, depth);
        if (node instanceof SexpNode.Terminal) {
            accumulator.terminalCount++;
            return;
        }
        accumulator.interiorCount++;
        for (SexpNode child : node.children()) {
            visit(child, depth + 1, accumulator);
        }
    }

    private static final class Accumulator {
        private final SortedSet<String> types = new TreeSet<>();
        private int interiorCount;
        private int terminalCount;
        private int maxDepth;
    }
}
