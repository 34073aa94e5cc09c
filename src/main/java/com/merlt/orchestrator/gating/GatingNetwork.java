package com.merlt.orchestrator.gating;

import com.merlt.orchestrator.model.DetectedIntent;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.GatingWeights;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Linear-softmax mixture-of-experts gate over the four reasoning experts.
 *
 * <p>Routing reads the current {@link GatingParameters} snapshot without locking. Updates are
 * serialised, build a complete new snapshot and publish it with a single reference swap, so a
 * concurrent reader sees either the old or the new parameters and never a mix.</p>
 *
 * <p>Embeddings that are missing, of the wrong dimension or contain non-finite values are routed
 * on the bias alone, which still yields a valid distribution.</p>
 */
@Component
public class GatingNetwork {
    private static final Logger log = LoggerFactory.getLogger(GatingNetwork.class);
    private static final ExpertType[] EXPERTS = ExpertType.values();

    /** Multipliers applied per detected intent, scaled by the intent's confidence. */
    private static final Map<String, Map<ExpertType, Double>> INTENT_MODIFIERS = Map.of(
            "norm_explanation", Map.of(ExpertType.LITERAL, 1.5, ExpertType.SYSTEMIC, 0.8),
            "validità_atto", Map.of(ExpertType.LITERAL, 1.5, ExpertType.SYSTEMIC, 0.8),
            "contract_interpretation", Map.of(ExpertType.PRINCIPLES, 1.3, ExpertType.PRECEDENT, 1.2),
            "bilanciamento_diritti", Map.of(ExpertType.PRINCIPLES, 1.5, ExpertType.PRECEDENT, 1.1),
            "compliance_question", Map.of(ExpertType.PRECEDENT, 1.5, ExpertType.SYSTEMIC, 1.1),
            "precedent_search", Map.of(ExpertType.PRECEDENT, 1.5, ExpertType.LITERAL, 0.9));

    private final AtomicReference<GatingParameters> parameters;
    private final double learningRate;
    private final double gradientClip;

    public GatingNetwork(
            @Value("${merlt.gating.input-dim:768}") int inputDim,
            @Value("${merlt.gating.learning-rate:0.01}") double learningRate,
            @Value("${merlt.gating.gradient-clip:0.1}") double gradientClip,
            @Value("${merlt.gating.prior.literal:0.30}") double literalPrior,
            @Value("${merlt.gating.prior.systemic:0.25}") double systemicPrior,
            @Value("${merlt.gating.prior.principles:0.20}") double principlesPrior,
            @Value("${merlt.gating.prior.precedent:0.25}") double precedentPrior) {
        this.learningRate = learningRate;
        this.gradientClip = Math.abs(gradientClip);
        double[] priors = {literalPrior, systemicPrior, principlesPrior, precedentPrior};
        this.parameters = new AtomicReference<>(GatingParameters.initial(Math.max(1, inputDim), priors));
        log.info("Gating network initialized: dim={}, priors={}, lr={}", inputDim, Arrays.toString(priors), learningRate);
    }

    public GatingWeights route(float[] embedding) {
        GatingParameters snapshot = this.parameters.get();
        return toWeights(softmax(snapshot.logits(usable(embedding, snapshot))), snapshot.version());
    }

    /**
     * Routes the embedding, then scales each expert's weight by the modifiers of the detected
     * intents and renormalises.
     */
    public GatingWeights route(float[] embedding, List<DetectedIntent> intents) {
        GatingWeights base = route(embedding);
        if (intents == null || intents.isEmpty()) {
            return base;
        }
        double[] p = new double[EXPERTS.length];
        for (int k = 0; k < EXPERTS.length; k++) {
            p[k] = base.weight(EXPERTS[k]);
        }
        boolean modified = false;
        for (DetectedIntent intent : intents) {
            Map<ExpertType, Double> modifiers = INTENT_MODIFIERS.get(intent.name().toLowerCase(Locale.ROOT));
            if (modifiers == null) {
                continue;
            }
            modified = true;
            for (int k = 0; k < EXPERTS.length; k++) {
                double m = modifiers.getOrDefault(EXPERTS[k], 1.0);
                p[k] *= 1.0 + (m - 1.0) * intent.confidence();
            }
        }
        return modified ? toWeights(normalize(p), base.version()) : base;
    }

    /**
     * One cross-entropy gradient step towards {@code target}. The step size is the configured
     * learning rate times {@code learningRateScale} (the feedback's authority).
     *
     * @return the version of the published parameters
     */
    public synchronized long update(float[] embedding, Map<ExpertType, Double> target, double learningRateScale) {
        GatingParameters current = this.parameters.get();
        if (target == null || target.isEmpty() || !(learningRateScale > 0.0)) {
            return current.version();
        }
        double[] t = new double[EXPERTS.length];
        for (int k = 0; k < EXPERTS.length; k++) {
            t[k] = Math.max(0.0, target.getOrDefault(EXPERTS[k], 0.0));
        }
        t = normalize(t);
        float[] x = usable(embedding, current);
        double[] p = softmax(current.logits(x));
        double lr = this.learningRate * Math.min(1.0, learningRateScale);
        double[][] w = current.copyWeights();
        double[] b = current.copyBias();
        for (int k = 0; k < EXPERTS.length; k++) {
            double dz = p[k] - t[k];
            b[k] -= lr * clip(dz);
            if (x != null) {
                for (int j = 0; j < w[k].length; j++) {
                    w[k][j] -= lr * clip(dz * x[j]);
                }
            }
        }
        GatingParameters next = new GatingParameters(w, b, current.version() + 1);
        this.parameters.set(next);
        log.debug("Gating parameters updated to version {} (scale={})", next.version(), learningRateScale);
        return next.version();
    }

    public long version() {
        return this.parameters.get().version();
    }

    public int inputDim() {
        return this.parameters.get().inputDim();
    }

    private double clip(double value) {
        if (this.gradientClip <= 0.0) {
            return value;
        }
        return Math.max(-this.gradientClip, Math.min(this.gradientClip, value));
    }

    private static float[] usable(float[] embedding, GatingParameters snapshot) {
        if (embedding == null || embedding.length != snapshot.inputDim()) {
            return null;
        }
        for (float v : embedding) {
            if (!Float.isFinite(v)) {
                return null;
            }
        }
        return embedding;
    }

    static double[] softmax(double[] z) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : z) {
            if (Double.isFinite(v)) {
                max = Math.max(max, v);
            }
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return uniform(z.length);
        }
        double[] e = new double[z.length];
        for (int k = 0; k < z.length; k++) {
            e[k] = Double.isFinite(z[k]) ? Math.exp(z[k] - max) : 0.0;
        }
        return normalize(e);
    }

    private static double[] normalize(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        if (!(sum > 0.0) || !Double.isFinite(sum)) {
            return uniform(values.length);
        }
        double[] out = new double[values.length];
        for (int k = 0; k < values.length; k++) {
            out[k] = values[k] / sum;
        }
        return out;
    }

    private static double[] uniform(int n) {
        double[] out = new double[n];
        Arrays.fill(out, 1.0 / n);
        return out;
    }

    private static GatingWeights toWeights(double[] p, long version) {
        EnumMap<ExpertType, Double> map = new EnumMap<>(ExpertType.class);
        for (int k = 0; k < EXPERTS.length; k++) {
            map.put(EXPERTS[k], p[k]);
        }
        return new GatingWeights(map, version);
    }
}
