package com.merlt.orchestrator.feedback;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.merlt.orchestrator.model.AuthorityScore;
import com.merlt.orchestrator.model.UserProfile;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Weighs how much a user's feedback should move the model:
 * {@code role * wRole + accuracy * wAccuracy + consensus * wConsensus + reputation * wReputation},
 * clamped to [0, 1]. Profiles are cached read-through; unknown users are not cached.
 */
@Service
public class AuthorityScorer {
    private static final Logger log = LoggerFactory.getLogger(AuthorityScorer.class);

    private final UserProfileStore profileStore;
    private final Cache<String, UserProfile> profileCache;
    private final double roleWeight;
    private final double accuracyWeight;
    private final double consensusWeight;
    private final double reputationWeight;

    public AuthorityScorer(UserProfileStore profileStore,
                           @Value("${merlt.authority.role-weight:0.3}") double roleWeight,
                           @Value("${merlt.authority.accuracy-weight:0.4}") double accuracyWeight,
                           @Value("${merlt.authority.consensus-weight:0.2}") double consensusWeight,
                           @Value("${merlt.authority.reputation-weight:0.1}") double reputationWeight,
                           @Value("${merlt.authority.cache-ttl-seconds:300}") long cacheTtlSeconds) {
        this.profileStore = profileStore;
        this.roleWeight = roleWeight;
        this.accuracyWeight = accuracyWeight;
        this.consensusWeight = consensusWeight;
        this.reputationWeight = reputationWeight;
        this.profileCache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, cacheTtlSeconds)))
                .build();
    }

    public Optional<AuthorityScore> score(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        UserProfile profile = this.profileCache.getIfPresent(userId);
        if (profile == null) {
            Optional<UserProfile> loaded = this.profileStore.findProfile(userId);
            if (loaded.isEmpty()) {
                log.debug("No profile for user {}", userId);
                return Optional.empty();
            }
            profile = loaded.get();
            this.profileCache.put(userId, profile);
        }
        return Optional.of(score(profile));
    }

    public AuthorityScore score(UserProfile profile) {
        Map<String, Double> components = new LinkedHashMap<>();
        components.put("role", profile.role().baseWeight());
        components.put("accuracy", profile.historicalAccuracy());
        components.put("consensus", profile.consensusRate());
        components.put("reputation", profile.reputation());
        double raw = this.roleWeight * profile.role().baseWeight()
                + this.accuracyWeight * profile.historicalAccuracy()
                + this.consensusWeight * profile.consensusRate()
                + this.reputationWeight * profile.reputation();
        return new AuthorityScore(profile.userId(), raw, components);
    }

    public void invalidate(String userId) {
        if (userId != null) {
            this.profileCache.invalidate(userId);
        }
    }
}
