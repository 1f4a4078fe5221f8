package com.raditha.magpie.commit;

import com.raditha.magpie.model.CommitFlag;
import com.raditha.magpie.model.CommitRecord;

import java.util.List;

/**
 * Output of the commit analyzer.
 *
 * @param flags            Suspicious commit pairs across repositories
 * @param largeCommits     Commits that changed more lines than the configured limit
 * @param commitsCompared  Commits that survived filtering and took part in comparison
 */
public record CommitAnalysis(List<CommitFlag> flags, List<CommitRecord> largeCommits, int commitsCompared) {

    public CommitAnalysis {
        flags = List.copyOf(flags);
        largeCommits = List.copyOf(largeCommits);
    }

    public static CommitAnalysis empty() {
        return new CommitAnalysis(List.of(), List.of(), 0);
    }
}
