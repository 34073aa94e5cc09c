package com.merlt.orchestrator.feedback;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/**
 * Uses the feedback id as document {@code _id}, so the unique primary key index rejects a second
 * insert of the same id.
 */
@Repository
public class MongoProcessedFeedbackLedger implements ProcessedFeedbackLedger {
    private static final Logger log = LoggerFactory.getLogger(MongoProcessedFeedbackLedger.class);
    static final String COLLECTION = "processed_feedback";

    private final MongoTemplate mongoTemplate;

    public MongoProcessedFeedbackLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean hasProcessed(String feedbackId) {
        return this.mongoTemplate.exists(new Query(Criteria.where("_id").is(feedbackId)), COLLECTION);
    }

    @Override
    public boolean markProcessed(String feedbackId) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("_id", feedbackId);
        doc.put("processedAt", Instant.now().toString());
        try {
            this.mongoTemplate.insert(doc, COLLECTION);
            return true;
        }
        catch (DuplicateKeyException e) {
            log.debug("Feedback {} already marked processed", feedbackId);
            return false;
        }
    }
}
