package com.llmorch.orchestrator.placement;

import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeScore;
import com.llmorch.core.model.PlacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Filters nodes by hard constraints and ranks the rest.
 * <p>
 * Ranking is by descending score, then larger available CPU, then fewer
 * workloads, then node name. The result depends only on its inputs.
 * </p>
 */
public class PlacementEngine {
    private static final Logger log = LoggerFactory.getLogger(PlacementEngine.class);

    static final Comparator<NodeScore> RANKING = Comparator
            .comparingDouble(NodeScore::getScore).reversed()
            .thenComparing(Comparator.comparingLong(NodeScore::getAvailableCpuMillis).reversed())
            .thenComparingInt(NodeScore::getWorkloadCount)
            .thenComparing(NodeScore::getNodeName);

    private final ConstraintFilter constraints;
    private final NodeScorer scorer;

    public PlacementEngine() {
        this(new ConstraintFilter(), new NodeScorer());
    }

    public PlacementEngine(ConstraintFilter constraints, NodeScorer scorer) {
        this.constraints = constraints;
        this.scorer = scorer;
    }

    /**
     * @param request       the workload to place
     * @param feasibleNodes nodes with enough headroom for the request
     * @param locality      where the model is already served
     * @return ranked candidates; the first entry is the selection
     */
    public PlacementResult score(PlacementRequest request,
                                 Collection<NodeResourceInfo> feasibleNodes,
                                 ModelLocalityIndex locality) {
        Map<String, String> rejected = new TreeMap<>();
        List<NodeScore> ranking = new ArrayList<>();

        for (NodeResourceInfo node : feasibleNodes) {
            Optional<String> reason = constraints.rejectionReason(node, request);
            if (reason.isPresent()) {
                rejected.put(node.getName(), reason.get());
                continue;
            }
            ranking.add(scorer.score(node, request, locality));
        }
        ranking.sort(RANKING);

        if (log.isDebugEnabled()) {
            for (NodeScore score : ranking) {
                log.debug("Placement {} on {}: {} {}", request.getWorkload(), score.getNodeName(),
                        String.format("%.2f", score.getScore()), score.getReasons());
            }
        }
        return new PlacementResult(Collections.unmodifiableList(ranking), Collections.unmodifiableMap(rejected));
    }
}
