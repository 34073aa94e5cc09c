package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.model.AuthorityScore;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.FeedbackRecord;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class MongoFeedbackArchive implements FeedbackArchive {
    static final String COLLECTION = "feedback_archive";

    private final MongoTemplate mongoTemplate;

    public MongoFeedbackArchive(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void archive(FeedbackRecord record, AuthorityScore authority) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("_id", record.feedbackId());
        doc.put("traceId", record.traceId());
        doc.put("userId", record.userId());
        doc.put("rating", record.rating());
        doc.put("authority", authority.score());
        doc.put("authorityComponents", authority.components());
        Map<String, Object> correctness = new LinkedHashMap<>();
        record.expertCorrectness().forEach((expert, correct) -> correctness.put(expert.id(), correct));
        doc.put("expertCorrectness", correctness);
        Map<String, Object> usefulness = new LinkedHashMap<>();
        for (Map.Entry<ExpertType, Map<String, Boolean>> entry : record.relationUsefulness().entrySet()) {
            usefulness.put(entry.getKey().id(), new LinkedHashMap<>(entry.getValue()));
        }
        doc.put("relationUsefulness", usefulness);
        doc.put("submittedAt", record.submittedAt().toString());
        this.mongoTemplate.save(doc, COLLECTION);
    }
}
