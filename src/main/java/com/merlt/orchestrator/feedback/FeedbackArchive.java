package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.model.AuthorityScore;
import com.merlt.orchestrator.model.FeedbackRecord;

/**
 * Keeps accepted feedback for offline training-example generation.
 */
public interface FeedbackArchive {

    void archive(FeedbackRecord record, AuthorityScore authority);
}
