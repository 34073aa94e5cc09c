package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.model.UserProfile;
import com.merlt.orchestrator.model.UserRole;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
public class MongoUserProfileStore implements UserProfileStore {
    static final String COLLECTION = "user_profiles";

    private final MongoTemplate mongoTemplate;

    public MongoUserProfileStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<UserProfile> findProfile(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        Map row = this.mongoTemplate.findOne(new Query(Criteria.where("userId").is(userId)), Map.class, COLLECTION);
        if (row == null) {
            return Optional.empty();
        }
        return Optional.of(new UserProfile(userId,
                UserRole.fromValue(row.get("role") == null ? null : String.valueOf(row.get("role"))),
                number(row.get("historicalAccuracy"), 0.5),
                number(row.get("consensusRate"), 0.5),
                number(row.get("reputation"), 0.0)));
    }

    private static double number(Object value, double fallback) {
        return value instanceof Number n ? n.doubleValue() : fallback;
    }
}
