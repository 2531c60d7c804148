package io.docgraph.processing.service.graph;

import io.docgraph.processing.config.GraphConfig;
import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.graph.GraphEdge;
import io.docgraph.processing.dto.graph.GraphNode;
import io.docgraph.processing.dto.graph.GraphStatistics;
import io.docgraph.processing.dto.graph.KnowledgeGraph;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.RelationTriple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assembles the entity graph from canonical entities and relation triples.
 * <p>
 * Nodes are entities that take part in a relation or have at least
 * {@code isolatedNodeMinMentions} mentions. Each pair of related entities gets one edge whose weight
 * is the number of triples between them. Statistics are computed once, after assembly.
 */
@Service
public class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    private final GraphConfig settings;

    public GraphBuilder(ProcessingConfig config) {
        this.settings = config.graph();
    }

    public KnowledgeGraph build(List<CanonicalEntity> entities, List<RelationTriple> triples) {
        Set<String> participants = new HashSet<>();
        for (RelationTriple triple : triples) {
            participants.add(triple.subjectId());
            participants.add(triple.objectId());
        }

        List<CanonicalEntity> eligible = entities.stream()
                .filter(entity -> participants.contains(entity.id())
                        || entity.mentionCount() >= settings.isolatedNodeMinMentions())
                .toList();

        boolean truncated = false;
        if (eligible.size() > settings.maxNodes()) {
            eligible = capNodes(entities, eligible, participants);
            truncated = true;
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        eligible.forEach(entity -> nodeIds.add(entity.id()));

        Map<EdgeKey, EdgeAccumulator> accumulators = new LinkedHashMap<>();
        for (RelationTriple triple : triples) {
            if (!nodeIds.contains(triple.subjectId()) || !nodeIds.contains(triple.objectId())) {
                continue;
            }
            accumulators.computeIfAbsent(edgeKey(triple.subjectId(), triple.objectId()), key -> new EdgeAccumulator())
                    .add(triple.predicate());
        }

        List<GraphEdge> edges = new ArrayList<>();
        accumulators.forEach((key, accumulator) ->
                edges.add(GraphEdge.of(key.source(), key.target(), accumulator.weight, accumulator.predicates)));

        List<GraphEdge> keptEdges = edges;
        if (edges.size() > settings.maxEdges()) {
            keptEdges = capEdges(edges);
            truncated = true;
        }

        KnowledgeGraph graph = assemble(eligible, keptEdges, truncated);

        logger.debug("Built graph with {} nodes, {} edges, density {} (truncated: {})",
                graph.statistics().nodeCount(), graph.statistics().edgeCount(),
                graph.statistics().density(), truncated);

        return graph;
    }

    private KnowledgeGraph assemble(List<CanonicalEntity> nodesEntities, List<GraphEdge> edges, boolean truncated) {
        Map<String, Integer> degrees = new HashMap<>();
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (CanonicalEntity entity : nodesEntities) {
            degrees.put(entity.id(), 0);
            adjacency.put(entity.id(), new HashSet<>());
        }
        for (GraphEdge edge : edges) {
            degrees.merge(edge.source(), 1, Integer::sum);
            degrees.merge(edge.target(), 1, Integer::sum);
            adjacency.get(edge.source()).add(edge.target());
            adjacency.get(edge.target()).add(edge.source());
        }

        int n = nodesEntities.size();
        List<GraphNode> nodes = new ArrayList<>(n);
        for (CanonicalEntity entity : nodesEntities) {
            int degree = degrees.get(entity.id());
            nodes.add(new GraphNode(
                    entity.id(),
                    entity.label(),
                    entity.type(),
                    entity.mentionCount(),
                    degree,
                    n > 1 ? (double) degree / (n - 1) : 0.0
            ));
        }

        int e = edges.size();
        double maxEdges = n < 2 ? 0 : (settings.directed() ? (double) n * (n - 1) : n * (n - 1) / 2.0);
        double density = maxEdges == 0 ? 0.0 : e / maxEdges;
        double averageDegree = n == 0 ? 0.0 : nodes.stream().mapToInt(GraphNode::degree).sum() / (double) n;
        int isolated = (int) nodes.stream().filter(node -> node.degree() == 0).count();

        GraphStatistics statistics = new GraphStatistics(
                n, e, density, averageDegree, countComponents(adjacency), isolated, truncated);

        return new KnowledgeGraph(settings.directed(), nodes, edges, statistics);
    }

    /**
     * Connected components, ignoring edge direction.
     */
    private int countComponents(Map<String, Set<String>> adjacency) {
        Set<String> visited = new HashSet<>();
        int components = 0;
        for (String start : adjacency.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            components++;
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                for (String neighbour : adjacency.get(queue.poll())) {
                    if (visited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
        }
        return components;
    }

    /**
     * Relation participants first, then by mention count, then by entity order. Survivors keep entity order.
     */
    private List<CanonicalEntity> capNodes(List<CanonicalEntity> entities, List<CanonicalEntity> eligible,
                                           Set<String> participants) {
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < entities.size(); i++) {
            order.put(entities.get(i).id(), i);
        }

        Set<String> kept = new HashSet<>();
        eligible.stream()
                .sorted(Comparator.comparing((CanonicalEntity entity) -> !participants.contains(entity.id()))
                        .thenComparing(Comparator.comparingInt(CanonicalEntity::mentionCount).reversed())
                        .thenComparing(entity -> order.get(entity.id())))
                .limit(settings.maxNodes())
                .forEach(entity -> kept.add(entity.id()));

        logger.warn("Graph capped at {} of {} eligible nodes", settings.maxNodes(), eligible.size());
        return eligible.stream().filter(entity -> kept.contains(entity.id())).toList();
    }

    /**
     * Heaviest edges win, ties broken by endpoint ids. Survivors keep their original order.
     */
    private List<GraphEdge> capEdges(List<GraphEdge> edges) {
        Set<GraphEdge> kept = new HashSet<>();
        edges.stream()
                .sorted(Comparator.comparingInt(GraphEdge::weight).reversed()
                        .thenComparing(GraphEdge::source)
                        .thenComparing(GraphEdge::target))
                .limit(settings.maxEdges())
                .forEach(kept::add);

        logger.warn("Graph capped at {} of {} edges", settings.maxEdges(), edges.size());
        return edges.stream().filter(kept::contains).toList();
    }

    private EdgeKey edgeKey(String subjectId, String objectId) {
        if (settings.directed() || subjectId.compareTo(objectId) < 0) {
            return new EdgeKey(subjectId, objectId);
        }
        return new EdgeKey(objectId, subjectId);
    }

    private record EdgeKey(String source, String target) {}

    private static final class EdgeAccumulator {
        private int weight;
        private final Set<String> predicates = new TreeSet<>();

        void add(String predicate) {
            weight++;
            predicates.add(predicate);
        }
    }
}
