package com.triageplatform.common.consensus;

import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Label bookkeeping shared by the consensus strategies. Labels are grouped by
 * {@link AgentOpinion#normalizedLabel()}, in first-seen order.
 */
final class VoteTally {

    static final String UNKNOWN_LABEL = "unknown";

    private final Map<String, List<AgentOpinion>> byLabel = new LinkedHashMap<>();
    private final int total;

    private VoteTally(List<AgentOpinion> opinions) {
        for (AgentOpinion opinion : opinions) {
            byLabel.computeIfAbsent(opinion.normalizedLabel(), k -> new ArrayList<>()).add(opinion);
        }
        this.total = opinions.size();
    }

    static VoteTally of(List<AgentOpinion> opinions) {
        return new VoteTally(opinions);
    }

    int distinctLabels() {
        return byLabel.size();
    }

    int maxCount() {
        return byLabel.values().stream().mapToInt(List::size).max().orElse(0);
    }

    /** Share of opinions backing the most common label; 0 when there are none. */
    double agreementRatio() {
        return total == 0 ? 0.0 : (double) maxCount() / total;
    }

    /**
     * Share of the total role weight backing the heaviest label; 0 when there are none.
     */
    double weightedAgreementRatio(DecisionContext context) {
        double total = 0.0;
        double best = 0.0;
        for (List<AgentOpinion> group : byLabel.values()) {
            double groupWeight = group.stream().mapToDouble(o -> o.role().weightIn(context)).sum();
            total += groupWeight;
            best = Math.max(best, groupWeight);
        }
        return total <= 0.0 ? 0.0 : best / total;
    }

    /**
     * Most common label. Count ties are settled by {@link #resolveByWeight} over the
     * tied labels only.
     */
    String dominantLabel(DecisionContext context) {
        if (byLabel.isEmpty()) {
            return null;
        }
        int max = maxCount();
        List<AgentOpinion> contenders = new ArrayList<>();
        int tiedLabels = 0;
        for (List<AgentOpinion> group : byLabel.values()) {
            if (group.size() == max) {
                contenders.addAll(group);
                tiedLabels++;
            }
        }
        if (tiedLabels == 1) {
            return contenders.get(0).normalizedLabel();
        }
        return resolveByWeight(contenders, context);
    }

    /**
     * Weighted tie-break: group by label, sum role weight per group, highest total wins.
     * Equal totals fall back to the label of the single highest-weight opinion
     * (first one in input order on equal weights).
     */
    static String resolveByWeight(Collection<AgentOpinion> opinions, DecisionContext context) {
        if (opinions == null || opinions.isEmpty()) {
            return UNKNOWN_LABEL;
        }
        Map<String, Double> weightByLabel = new LinkedHashMap<>();
        for (AgentOpinion opinion : opinions) {
            weightByLabel.merge(opinion.normalizedLabel(), opinion.role().weightIn(context), Double::sum);
        }
        double best = weightByLabel.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        List<String> leaders = weightByLabel.entrySet().stream()
            .filter(e -> Math.abs(e.getValue() - best) < 1e-9)
            .map(Map.Entry::getKey)
            .toList();
        if (leaders.size() == 1) {
            return leaders.get(0);
        }
        AgentOpinion heaviest = null;
        for (AgentOpinion opinion : opinions) {
            if (!leaders.contains(opinion.normalizedLabel())) {
                continue;
            }
            if (heaviest == null || opinion.role().weightIn(context) > heaviest.role().weightIn(context)) {
                heaviest = opinion;
            }
        }
        return heaviest != null ? heaviest.normalizedLabel() : leaders.get(0);
    }

    static Map<String, Double> votes(List<AgentOpinion> opinions) {
        Map<String, Double> votes = new LinkedHashMap<>();
        for (AgentOpinion opinion : opinions) {
            votes.put(opinion.agentId(), opinion.confidence());
        }
        return votes;
    }

    static double averageConfidence(List<AgentOpinion> opinions) {
        return opinions.stream().mapToDouble(AgentOpinion::confidence).average().orElse(0.0);
    }
}
