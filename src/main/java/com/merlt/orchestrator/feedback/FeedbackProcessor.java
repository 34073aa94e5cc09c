package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.gating.GatingNetwork;
import com.merlt.orchestrator.model.AuthorityScore;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.FeedbackRecord;
import com.merlt.orchestrator.util.LogSanitizer;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Applies user feedback to the gating network and the traversal weights, at most once per
 * feedback id: the id is claimed in the ledger before any weight moves. Rejections are returned,
 * never thrown, because feedback arrives after the answer it rates has already been delivered.
 */
@Service
public class FeedbackProcessor {
    private static final Logger log = LoggerFactory.getLogger(FeedbackProcessor.class);

    private final AuthorityScorer authorityScorer;
    private final GatingNetwork gatingNetwork;
    private final TraversalWeightStore traversalWeights;
    private final ProcessedFeedbackLedger ledger;
    private final FeedbackArchive archive;
    private final RolloutCoordinator rollout;
    private final AnswerFeatureStore answerFeatures;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Value("${merlt.feedback.smoothing:0.1}")
    private double smoothing = 0.1;
    @Value("${merlt.feedback.min-authority:0.0}")
    private double minAuthority = 0.0;
    @Value("${merlt.traversal.learning-rate:0.1}")
    private double traversalLearningRate = 0.1;

    public FeedbackProcessor(AuthorityScorer authorityScorer, GatingNetwork gatingNetwork,
                             TraversalWeightStore traversalWeights, ProcessedFeedbackLedger ledger,
                             FeedbackArchive archive, RolloutCoordinator rollout, AnswerFeatureStore answerFeatures) {
        this.authorityScorer = authorityScorer;
        this.gatingNetwork = gatingNetwork;
        this.traversalWeights = traversalWeights;
        this.ledger = ledger;
        this.archive = archive;
        this.rollout = rollout;
        this.answerFeatures = answerFeatures;
    }

    public FeedbackOutcome ingest(FeedbackRecord record) {
        String invalid = validate(record);
        if (invalid != null) {
            log.warn("Rejected invalid feedback: {}", invalid);
            return FeedbackOutcome.rejected(FeedbackRejection.INVALID_RECORD, invalid);
        }
        String feedbackId = record.feedbackId();
        if (!this.inFlight.add(feedbackId)) {
            log.info("Feedback {} is already being processed", LogSanitizer.sanitize(feedbackId));
            return FeedbackOutcome.rejected(FeedbackRejection.DUPLICATE_FEEDBACK, "already in progress");
        }
        try {
            if (this.ledger.hasProcessed(feedbackId)) {
                log.info("Duplicate feedback {} ignored", LogSanitizer.sanitize(feedbackId));
                return FeedbackOutcome.rejected(FeedbackRejection.DUPLICATE_FEEDBACK, "already processed");
            }
            Optional<AuthorityScore> scored = this.authorityScorer.score(record.userId());
            if (scored.isEmpty()) {
                log.warn("Feedback {} from unknown user {} ignored", LogSanitizer.sanitize(feedbackId),
                        LogSanitizer.sanitize(record.userId()));
                return FeedbackOutcome.rejected(FeedbackRejection.UNKNOWN_USER, "no profile for user");
            }
            AuthorityScore authority = effectiveAuthority(scored.get(), record.declaredAuthority());
            // nothing is claimed or updated unless the record is stored
            this.archive.archive(record, authority);
            if (!this.ledger.markProcessed(feedbackId)) {
                log.info("Feedback {} claimed by another node", LogSanitizer.sanitize(feedbackId));
                return FeedbackOutcome.rejected(FeedbackRejection.DUPLICATE_FEEDBACK, "already processed");
            }
            return apply(record, authority);
        }
        catch (RuntimeException e) {
            log.error("Feedback {} could not be processed", LogSanitizer.sanitize(feedbackId), e);
            return FeedbackOutcome.rejected(FeedbackRejection.PROCESSING_ERROR, e.getClass().getSimpleName());
        }
        finally {
            this.inFlight.remove(feedbackId);
        }
    }

    private FeedbackOutcome apply(FeedbackRecord record, AuthorityScore authority) {
        boolean gatingUpdated = false;
        int traversalUpdates = 0;
        if (authority.score() >= this.minAuthority && authority.score() > 0.0) {
            gatingUpdated = applyGating(record, authority.score());
            traversalUpdates = applyTraversal(record, authority.score());
        }
        else {
            log.info("Feedback {} below authority threshold ({} < {}); recorded without updates",
                    LogSanitizer.sanitize(record.feedbackId()), authority.score(), this.minAuthority);
        }
        log.info("Feedback {} applied: authority={}, gatingUpdated={}, traversalUpdates={}",
                LogSanitizer.sanitize(record.feedbackId()), String.format("%.3f", authority.score()),
                gatingUpdated, traversalUpdates);
        return FeedbackOutcome.accepted(authority.score(), gatingUpdated, traversalUpdates);
    }

    private boolean applyGating(FeedbackRecord record, double authority) {
        Map<ExpertType, Double> target = gatingTarget(record.expertCorrectness(), this.smoothing);
        if (target.isEmpty()) {
            return false;
        }
        Optional<AnswerFeatures> features = this.answerFeatures.find(record.traceId());
        if (features.isEmpty()) {
            log.info("No cached features for trace {}; gating update skipped", LogSanitizer.sanitize(record.traceId()));
            return false;
        }
        this.gatingNetwork.update(features.get().queryEmbedding(), target, authority);
        this.rollout.recordUpdate(RolloutCoordinator.GATING);
        return true;
    }

    private int applyTraversal(FeedbackRecord record, double authority) {
        int updated = 0;
        double step = this.traversalLearningRate * authority;
        for (Map.Entry<ExpertType, Map<String, Boolean>> entry : record.relationUsefulness().entrySet()) {
            Map<String, Double> deltas = new LinkedHashMap<>();
            entry.getValue().forEach((relation, useful) -> {
                if (relation != null && useful != null) {
                    deltas.put(relation, useful ? step : -step);
                }
            });
            if (deltas.isEmpty()) {
                continue;
            }
            this.traversalWeights.applyLogitDeltas(entry.getKey(), deltas);
            this.rollout.recordUpdate(RolloutCoordinator.TRAVERSAL_PREFIX + entry.getKey().id());
            updated++;
        }
        return updated;
    }

    /**
     * Label-smoothed target: correct experts share {@code 1 - smoothing}, the rest share
     * {@code smoothing}. Empty when no expert is marked correct.
     */
    static Map<ExpertType, Double> gatingTarget(Map<ExpertType, Boolean> correctness, double smoothing) {
        Map<ExpertType, Double> target = new EnumMap<>(ExpertType.class);
        long correct = correctness.values().stream().filter(Boolean.TRUE::equals).count();
        if (correct == 0) {
            return target;
        }
        int total = ExpertType.values().length;
        long others = total - correct;
        double eps = others == 0 ? 0.0 : Math.max(0.0, Math.min(0.5, smoothing));
        for (ExpertType expert : ExpertType.values()) {
            boolean isCorrect = Boolean.TRUE.equals(correctness.get(expert));
            target.put(expert, isCorrect ? (1.0 - eps) / correct : eps / others);
        }
        return target;
    }

    private static AuthorityScore effectiveAuthority(AuthorityScore computed, Double declared) {
        if (declared == null || declared.isNaN()) {
            return computed;
        }
        Map<String, Double> components = new LinkedHashMap<>(computed.components());
        components.put("declared", declared);
        return new AuthorityScore(computed.userId(), declared, components);
    }

    private static String validate(FeedbackRecord record) {
        if (record == null) {
            return "missing record";
        }
        if (record.feedbackId() == null || record.feedbackId().isBlank()) {
            return "missing feedback id";
        }
        if (record.traceId() == null || record.traceId().isBlank()) {
            return "missing trace id";
        }
        if (record.userId() == null || record.userId().isBlank()) {
            return "missing user id";
        }
        if (record.rating() < 1 || record.rating() > 5) {
            return "rating must be between 1 and 5";
        }
        return null;
    }
}
