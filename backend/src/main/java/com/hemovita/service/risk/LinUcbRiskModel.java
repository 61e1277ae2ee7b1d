package com.hemovita.service.risk;

import com.hemovita.model.risk.RiskContext;
import com.hemovita.model.risk.RiskEstimate;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;

import java.util.*;

/**
 * LinUCB contextual bandit over micronutrient actions.
 *
 * Each action keeps a ridge design matrix A (d x d, starts at identity) and a
 * reward vector b (d, starts at zero); the point estimate is theta = A^-1 b.
 *
 * Instances are immutable. {@link #train} works on copies of the parameters
 * and returns a new model, so a published model can be read from any number
 * of request threads.
 */
@Slf4j
public final class LinUcbRiskModel {

    private static final int PROGRESS_EVERY = 10_000;
    private static final int PROGRESS_WINDOW = 1_000;

    private final ContextEncoder encoder;
    private final List<String> actions;
    private final double alpha;
    private final int trainedSteps;
    private final Map<String, ActionParams> params;

    private LinUcbRiskModel(ContextEncoder encoder,
                            List<String> actions,
                            double alpha,
                            int trainedSteps,
                            Map<String, DMatrixRMaj> designs,
                            Map<String, DMatrixRMaj> rewards) {
        this.encoder = encoder;
        this.actions = List.copyOf(actions);
        this.alpha = alpha;
        this.trainedSteps = trainedSteps;

        Map<String, ActionParams> frozen = new LinkedHashMap<>();
        for (String action : this.actions) {
            frozen.put(action, ActionParams.of(designs.get(action), rewards.get(action)));
        }
        this.params = Collections.unmodifiableMap(frozen);
    }

    /**
     * Untrained model: A = I and b = 0 for every action.
     */
    public static LinUcbRiskModel initial(ContextEncoder encoder, List<String> actions, double alpha) {
        int d = ContextEncoder.DIMENSION;
        Map<String, DMatrixRMaj> designs = new HashMap<>();
        Map<String, DMatrixRMaj> rewards = new HashMap<>();
        for (String action : actions) {
            designs.put(action, CommonOps_DDRM.identity(d));
            rewards.put(action, new DMatrixRMaj(d, 1));
        }
        return new LinUcbRiskModel(encoder, actions, alpha, 0, designs, rewards);
    }

    // ========================================================================
    // Training
    // ========================================================================

    /**
     * Runs the offline training loop against the aggregated risk table.
     *
     * Each step samples a context uniformly, picks the admissible action with
     * the highest UCB score, draws a Bernoulli reward with the table's true
     * risk and updates A += x x^T, b += reward * x for that action.
     *
     * @return a new model; this instance is left unchanged
     */
    public LinUcbRiskModel train(RiskTable table, int steps, long seed) {
        List<RiskContext> contexts = table.contexts();
        if (contexts.isEmpty() || steps <= 0) {
            log.info("No contexts to train on; keeping current parameters");
            return this;
        }

        Map<String, DMatrixRMaj> designs = new HashMap<>();
        Map<String, DMatrixRMaj> rewards = new HashMap<>();
        params.forEach((action, p) -> {
            designs.put(action, p.design().copy());
            rewards.put(action, p.reward().copy());
        });

        Random rng = new Random(seed);
        int[] window = new int[PROGRESS_WINDOW];

        for (int t = 1; t <= steps; t++) {
            RiskContext context = contexts.get(rng.nextInt(contexts.size()));
            DMatrixRMaj x = column(encoder.encode(context));

            String chosen = chooseAction(x, table.availableActions(context), designs, rewards);
            double trueRisk = table.trueRisk(context, chosen);
            int reward = rng.nextDouble() < trueRisk ? 1 : 0;
            window[(t - 1) % PROGRESS_WINDOW] = reward;

            CommonOps_DDRM.multAddTransB(x, x, designs.get(chosen));
            CommonOps_DDRM.addEquals(rewards.get(chosen), reward, x);

            if (t % PROGRESS_EVERY == 0) {
                log.info("Risk model step {}/{} | recent avg reward (last {}): {}",
                    t, steps, PROGRESS_WINDOW, String.format(Locale.ROOT, "%.3f", average(window, t)));
            }
        }

        log.info("Risk model training complete after {} steps", steps);
        return new LinUcbRiskModel(encoder, actions, alpha, trainedSteps + steps, designs, rewards);
    }

    private String chooseAction(DMatrixRMaj x,
                                List<String> allowed,
                                Map<String, DMatrixRMaj> designs,
                                Map<String, DMatrixRMaj> rewards) {
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (String action : allowed) {
            ActionParams p = ActionParams.of(designs.get(action), rewards.get(action));
            double score = p.mean(x) + alpha * Math.sqrt(Math.max(0.0, p.variance(x)));
            if (best == null || score > bestScore) {
                bestScore = score;
                best = action;
            }
        }
        return best;
    }

    private static double average(int[] window, int seen) {
        int n = Math.min(seen, window.length);
        int sum = 0;
        for (int i = 0; i < n; i++) {
            sum += window[i];
        }
        return n == 0 ? 0.0 : (double) sum / n;
    }

    // ========================================================================
    // Inference
    // ========================================================================

    /**
     * Risk estimate for every known action, clamp(theta . x, 0, 1), sorted by
     * risk descending; equal risks keep action order.
     */
    public List<RiskEstimate> predict(RiskContext context) {
        DMatrixRMaj x = column(encoder.encode(context));
        List<RiskEstimate> results = new ArrayList<>(actions.size());
        for (String action : actions) {
            double risk = params.get(action).mean(x);
            results.add(new RiskEstimate(action, Math.max(0.0, Math.min(1.0, risk))));
        }
        results.sort(Comparator.comparingDouble(RiskEstimate::predictedRisk).reversed());
        return results;
    }

    public boolean knowsCountry(String country) {
        return encoder.knowsCountry(country);
    }

    public List<String> actions() {
        return actions;
    }

    public int trainedSteps() {
        return trainedSteps;
    }

    /**
     * Copy of theta for one action, for diagnostics.
     */
    public double[] theta(String action) {
        ActionParams p = params.get(action);
        if (p == null) {
            throw new IllegalArgumentException("Unknown action: " + action);
        }
        return p.theta().getData().clone();
    }

    private static DMatrixRMaj column(double[] values) {
        return new DMatrixRMaj(values.length, 1, true, values);
    }

    /**
     * Snapshot of one action's parameters with A^-1 and theta precomputed.
     */
    private record ActionParams(DMatrixRMaj design, DMatrixRMaj reward, DMatrixRMaj inverse, DMatrixRMaj theta) {

        static ActionParams of(DMatrixRMaj design, DMatrixRMaj reward) {
            int d = design.numRows;
            DMatrixRMaj inverse = new DMatrixRMaj(d, d);
            if (!CommonOps_DDRM.invert(design, inverse)) {
                throw new IllegalStateException("Design matrix is singular");
            }
            DMatrixRMaj theta = new DMatrixRMaj(d, 1);
            CommonOps_DDRM.mult(inverse, reward, theta);
            return new ActionParams(design.copy(), reward.copy(), inverse, theta);
        }

        double mean(DMatrixRMaj x) {
            return CommonOps_DDRM.dot(theta, x);
        }

        double variance(DMatrixRMaj x) {
            return VectorVectorMult_DDRM.innerProdA(x, inverse, x);
        }
    }
}
