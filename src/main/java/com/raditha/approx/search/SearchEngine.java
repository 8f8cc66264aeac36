package com.raditha.approx.search;

import java.io.IOException;

/**
 * A strategy for exploring the variants of one kernel.
 */
public interface SearchEngine {

    SearchSummary search(SearchContext context)
            throws BaselineEvaluationException, IOException, InterruptedException;

    SearchMode getMode();
}
