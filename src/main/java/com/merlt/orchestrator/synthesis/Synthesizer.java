package com.merlt.orchestrator.synthesis;

import com.merlt.orchestrator.exception.InsufficientEvidenceException;
import com.merlt.orchestrator.model.ExpertContribution;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.GatingWeights;
import com.merlt.orchestrator.model.SynthesisMode;
import com.merlt.orchestrator.model.SynthesizedAnswer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns expert opinions into one answer.
 *
 * <p>Mode: CONVERGENT when the lowest pairwise agreement between usable opinions reaches the
 * threshold (a single opinion agrees with itself), DIVERGENT otherwise.</p>
 *
 * <p>Convergent answers stack the opinions in role order, from the textual reading to case law,
 * and take the gating-weighted mean confidence. Divergent answers list every interpretation,
 * name the favoured one and discount the weighted mean by the disagreement spread.</p>
 */
@Service
public class Synthesizer {
    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final AgreementScorer agreementScorer;
    @Value("${merlt.synthesis.agreement-threshold:0.7}")
    private double agreementThreshold = 0.7;
    @Value("${merlt.synthesis.confidence-spread-threshold:0.4}")
    private double confidenceSpreadThreshold = 0.4;
    @Value("${merlt.synthesis.source-overlap-threshold:0.2}")
    private double sourceOverlapThreshold = 0.2;

    public Synthesizer(AgreementScorer agreementScorer) {
        this.agreementScorer = agreementScorer;
    }

    public ModeDecision determineMode(List<ExpertOpinion> opinions) {
        List<ExpertOpinion> usable = usable(opinions);
        return decide(agreementMatrix(usable));
    }

    public SynthesizedAnswer synthesize(List<ExpertOpinion> opinions, GatingWeights gating, String traceId) {
        List<ExpertOpinion> usable = usable(opinions);
        if (usable.isEmpty()) {
            log.warn("Trace {} has no usable expert opinion out of {}", traceId, opinions == null ? 0 : opinions.size());
            throw new InsufficientEvidenceException("No usable expert opinion to synthesize", opinions, traceId);
        }
        GatingWeights weights = gating == null ? GatingWeights.uniform() : gating;
        ModeDecision decision = decide(agreementMatrix(usable));
        Map<ExpertType, Double> renormalized = weights.renormalizedOver(usable.stream().map(ExpertOpinion::expert).toList());
        double weightedConfidence = 0.0;
        for (ExpertOpinion opinion : usable) {
            weightedConfidence += renormalized.getOrDefault(opinion.expert(), 0.0) * opinion.confidence();
        }
        List<String> conflicts = detectConflicts(usable);
        List<ExpertOpinion> unavailable = opinions.stream().filter(o -> !o.usable()).toList();

        SynthesizedAnswer answer;
        if (decision.mode() == SynthesisMode.CONVERGENT) {
            answer = convergent(usable, unavailable, renormalized, weightedConfidence, decision, conflicts, opinions, traceId);
        }
        else {
            answer = divergent(usable, unavailable, renormalized, weightedConfidence, decision, conflicts, opinions, traceId);
        }
        log.info("Trace {} synthesized {} answer from {} of {} experts: minAgreement={}, confidence={}",
                traceId, answer.mode(), usable.size(), opinions.size(),
                String.format(Locale.ROOT, "%.2f", decision.minAgreement()),
                String.format(Locale.ROOT, "%.2f", answer.confidence()));
        return answer;
    }

    private SynthesizedAnswer convergent(List<ExpertOpinion> usable, List<ExpertOpinion> unavailable,
                                         Map<ExpertType, Double> weights, double confidence, ModeDecision decision,
                                         List<String> conflicts, List<ExpertOpinion> all, String traceId) {
        List<ExpertOpinion> ordered = usable.stream()
                .sorted(Comparator.comparingInt(o -> o.expert().ordinal()))
                .toList();
        StringBuilder text = new StringBuilder();
        List<ExpertContribution> contributions = new ArrayList<>();
        for (ExpertOpinion opinion : ordered) {
            double weight = weights.getOrDefault(opinion.expert(), 0.0);
            contributions.add(new ExpertContribution(opinion.expert(), weight, opinion.confidence(), opinion.interpretation()));
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(layerHeading(opinion.expert())).append(": ").append(opinion.interpretation());
        }
        appendUnavailable(text, unavailable);
        ExpertType favoured = favoured(usable, weights);
        return new SynthesizedAnswer(traceId, text.toString(), SynthesisMode.CONVERGENT, contributions, confidence,
                decision.minAgreement(), favoured, conflicts, all, null, 1);
    }

    private SynthesizedAnswer divergent(List<ExpertOpinion> usable, List<ExpertOpinion> unavailable,
                                        Map<ExpertType, Double> weights, double weightedConfidence, ModeDecision decision,
                                        List<String> conflicts, List<ExpertOpinion> all, String traceId) {
        List<ExpertOpinion> ordered = usable.stream()
                .sorted(Comparator.<ExpertOpinion>comparingDouble(o -> weights.getOrDefault(o.expert(), 0.0)).reversed()
                        .thenComparingInt(o -> o.expert().ordinal()))
                .toList();
        ExpertType favoured = favoured(usable, weights);
        ExpertOpinion favouredOpinion = usable.stream().filter(o -> o.expert() == favoured).findFirst().orElse(ordered.get(0));
        double spread = 1.0 - decision.meanAgreement();
        double confidence = weightedConfidence * (1.0 - spread);

        StringBuilder text = new StringBuilder("The experts reach different conclusions.\n");
        List<ExpertContribution> contributions = new ArrayList<>();
        int index = 1;
        for (ExpertOpinion opinion : ordered) {
            double weight = weights.getOrDefault(opinion.expert(), 0.0);
            contributions.add(new ExpertContribution(opinion.expert(), weight, opinion.confidence(), opinion.interpretation()));
            text.append(String.format(Locale.ROOT, "%n%d. %s (weight %.2f, confidence %.2f): %s",
                    index++, layerHeading(opinion.expert()), weight, opinion.confidence(), opinion.interpretation()));
        }
        text.append(String.format(Locale.ROOT,
                "%n%nFavoured reading: %s, which has the highest combined routing weight and confidence (%.2f x %.2f).",
                layerHeading(favoured), weights.getOrDefault(favoured, 0.0), favouredOpinion.confidence()));
        appendUnavailable(text, unavailable);
        return new SynthesizedAnswer(traceId, text.toString(), SynthesisMode.DIVERGENT, contributions, confidence,
                decision.minAgreement(), favoured, conflicts, all, null, 1);
    }

    private ModeDecision decide(double[][] matrix) {
        int n = matrix.length;
        if (n <= 1) {
            return new ModeDecision(SynthesisMode.CONVERGENT, 1.0, 1.0);
        }
        double min = 1.0;
        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                min = Math.min(min, matrix[i][j]);
                sum += matrix[i][j];
                pairs++;
            }
        }
        SynthesisMode mode = min >= this.agreementThreshold ? SynthesisMode.CONVERGENT : SynthesisMode.DIVERGENT;
        return new ModeDecision(mode, min, sum / pairs);
    }

    private double[][] agreementMatrix(List<ExpertOpinion> usable) {
        if (usable.size() <= 1) {
            return new double[usable.size()][usable.size()];
        }
        return this.agreementScorer.pairwise(usable.stream().map(ExpertOpinion::interpretation).toList());
    }

    List<String> detectConflicts(List<ExpertOpinion> usable) {
        List<String> conflicts = new ArrayList<>();
        for (int i = 0; i < usable.size(); i++) {
            for (int j = i + 1; j < usable.size(); j++) {
                ExpertOpinion a = usable.get(i);
                ExpertOpinion b = usable.get(j);
                if (Math.abs(a.confidence() - b.confidence()) > this.confidenceSpreadThreshold) {
                    conflicts.add(String.format(Locale.ROOT, "confidence divergence between %s (%.2f) and %s (%.2f)",
                            a.expert().id(), a.confidence(), b.expert().id(), b.confidence()));
                }
                if (!a.citedSources().isEmpty() && !b.citedSources().isEmpty()
                        && sourceOverlap(a.citedSources(), b.citedSources()) < this.sourceOverlapThreshold) {
                    conflicts.add(String.format(Locale.ROOT, "%s and %s rely on largely different sources",
                            a.expert().id(), b.expert().id()));
                }
            }
        }
        return conflicts;
    }

    private static double sourceOverlap(List<String> a, List<String> b) {
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(new HashSet<>(b));
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return union.isEmpty() ? 1.0 : (double) intersection.size() / union.size();
    }

    private static ExpertType favoured(List<ExpertOpinion> usable, Map<ExpertType, Double> weights) {
        return usable.stream()
                .max(Comparator.<ExpertOpinion>comparingDouble(o -> weights.getOrDefault(o.expert(), 0.0) * o.confidence())
                        .thenComparing(o -> -o.expert().ordinal()))
                .map(ExpertOpinion::expert)
                .orElse(ExpertType.LITERAL);
    }

    private static void appendUnavailable(StringBuilder text, List<ExpertOpinion> unavailable) {
        if (unavailable.isEmpty()) {
            return;
        }
        text.append("\n\nNot considered: ");
        text.append(String.join(", ", unavailable.stream()
                .map(o -> o.expert().id() + " (" + String.join(", ", o.limitations()) + ")")
                .toList()));
    }

    private static String layerHeading(ExpertType expert) {
        switch (expert) {
            case LITERAL:
                return "Textual basis";
            case SYSTEMIC:
                return "Systematic context";
            case PRINCIPLES:
                return "Constitutional framing";
            case PRECEDENT:
                return "Case law";
            default:
                return expert.id();
        }
    }

    private static List<ExpertOpinion> usable(List<ExpertOpinion> opinions) {
        if (opinions == null) {
            return List.of();
        }
        return opinions.stream().filter(ExpertOpinion::usable).toList();
    }

    public double getAgreementThreshold() {
        return this.agreementThreshold;
    }
}
