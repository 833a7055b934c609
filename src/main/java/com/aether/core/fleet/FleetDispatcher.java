package com.aether.core.fleet;

import com.aether.core.geo.GeoMath;
import com.aether.core.metrics.AetherMetrics;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.DispatchMatch;
import com.aether.core.model.DispatchQuery;
import com.aether.core.model.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers capability and proximity queries from a point-in-time view of the
 * {@link FleetIndex}. Never talks to the actors themselves.
 * <p>
 * Candidates are ranked by ground distance to the query's reference point; agents
 * without a known position come last and ties go to the lower agent id, so the same
 * index and query always give the same answer.
 */
@Service
public class FleetDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FleetDispatcher.class);

    private static final Comparator<DispatchMatch> RANKING = Comparator
            .comparing(DispatchMatch::distanceMeters, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(DispatchMatch::agentId);

    private final FleetIndex index;
    private final AetherMetrics metrics;

    public FleetDispatcher(FleetIndex index, AetherMetrics metrics) {
        this.index = index;
        this.metrics = metrics;
    }

    /**
     * Best candidate for the query, if any.
     */
    public Optional<DispatchMatch> find(DispatchQuery query) {
        Optional<DispatchMatch> best = rank(query).stream().findFirst();
        metrics.recordDispatchQuery(best.isPresent());
        log.debug("Dispatch query {} -> {}", query, best.map(DispatchMatch::agentId).orElse("no match"));
        return best;
    }

    /**
     * Every candidate matching the query, best first.
     */
    public List<DispatchMatch> rank(DispatchQuery query) {
        Map<String, AgentSnapshot> fleet = index.snapshot();
        return fleet.values().stream()
                .filter(agent -> matches(agent, query))
                .map(agent -> new DispatchMatch(agent.agentId(), distanceTo(agent, query.reference())))
                .sorted(RANKING)
                .toList();
    }

    private boolean matches(AgentSnapshot agent, DispatchQuery query) {
        if (query.excludedAgentIds().contains(agent.agentId())) {
            return false;
        }
        if (agent.lifecycleState() != query.requiredState()) {
            return false;
        }
        AgentAttributes attributes = agent.attributes();
        if (!attributes.hasSensors(query.requiredSensors())) {
            return false;
        }
        if (query.serviceArea() != null && !query.serviceArea().equals(attributes.serviceArea())) {
            return false;
        }
        if (query.minPayloadKg() != null
                && (attributes.payloadCapacityKg() == null || attributes.payloadCapacityKg() < query.minPayloadKg())) {
            return false;
        }
        if (query.minRangeMeters() != null
                && (attributes.maxRangeMeters() == null || attributes.maxRangeMeters() < query.minRangeMeters())) {
            return false;
        }
        Double distance = distanceTo(agent, query.reference());
        return distance == null || attributes.maxRangeMeters() == null || distance <= attributes.maxRangeMeters();
    }

    private static Double distanceTo(AgentSnapshot agent, GeoPoint reference) {
        if (reference == null || agent.position() == null) {
            return null;
        }
        return GeoMath.distanceMeters(agent.position(), reference);
    }
}
