package com.astexport.pipeline;

import com.astexport.analysis.TreeStatistics;
import com.astexport.sexp.SexpNode;

import java.util.Map;

public record ExportResult(
        SexpNode root,
        TreeStatistics statistics,
        Map<String, Object> record,
        int tokenCount,
        int recoveredIssues,
        long elapsedMs
) {

    public boolean hasTree() {
        return root != null;
    }
}
