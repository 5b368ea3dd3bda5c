package com.leadhunter.enrichment;

import com.leadhunter.search.model.Lead;

/**
 * One step of lead enrichment. A stage mutates the lead it is given and reports whether it did anything; it
 * signals failure by throwing, in which case its changes are discarded.
 */
public interface EnrichmentStage {
    String name();

    StageOutcome apply(Lead lead) throws InterruptedException;
}
