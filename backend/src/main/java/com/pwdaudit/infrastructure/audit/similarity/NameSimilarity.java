package com.pwdaudit.infrastructure.audit.similarity;

import com.pwdaudit.domain.audit.model.WorkRecord;

/**
 * Scores how likely two work names describe the same piece of work.
 * Implementations are swapped without touching the splitting rule.
 */
public interface NameSimilarity {

    /**
     * @return a score in [0, 1]; 1 means the names are the same after normalization
     */
    double score(String a, String b);

    /**
     * Best score over the primary names and, when both records carry one, the local-script names.
     */
    default double score(WorkRecord a, WorkRecord b) {
        double best = score(a.workName(), b.workName());
        if (a.workNameLocal() != null && b.workNameLocal() != null) {
            best = Math.max(best, score(a.workNameLocal(), b.workNameLocal()));
        }
        return best;
    }
}
