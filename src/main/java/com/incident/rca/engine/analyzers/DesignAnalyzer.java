package com.incident.rca.engine.analyzers;

import com.incident.rca.engine.Analyzer;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.exception.InputMalformedException;
import com.incident.rca.model.ConnectionMode;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.ServiceGraph;
import com.incident.rca.model.ServiceGraph.ServiceConnection;
import com.incident.rca.model.ServiceGraph.ServiceNode;
import com.incident.rca.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Structural risk rules over a declarative service graph.
 *
 * Per node, in name order:
 *  - replicas <= 1: spof (critical with at least one inbound sync call, else warning)
 *  - stateful, no read replicas, at least two inbound connections: scalability_risk
 *  - confined to one zone while called synchronously from a node placed elsewhere:
 *    scalability_risk with rule=cross_zone
 * Then, once per strongly connected component of the sync-only subgraph that contains a
 * cycle: spof with rule=sync_cycle (critical).
 *
 * Missing fields take the conservative reading: one replica, one unspecified zone,
 * sync mode, no read replicas. Statefulness defaults from the node type.
 */
@Component
public class DesignAnalyzer implements Analyzer<ServiceGraph> {

    private static final Logger log = LoggerFactory.getLogger(DesignAnalyzer.class);

    private static final Set<String> STATEFUL_TYPES = Set.of("db", "database", "cache");

    private static final String UNSPECIFIED_ZONE = "unspecified";

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.DESIGN;
    }

    @Override
    public void detect(ServiceGraph graph, Consumer<EvidenceRecord> sink) {
        if (graph.getNodes() == null) {
            throw new InputMalformedException("Service graph has no node list");
        }

        Map<String, ServiceNode> nodes = new TreeMap<>();
        for (ServiceNode node : graph.getNodes()) {
            if (node == null || node.getName() == null || node.getName().isBlank()) {
                log.warn("Skipping service graph node without a name");
                continue;
            }
            if (nodes.putIfAbsent(node.getName(), node) != null) {
                log.warn("Duplicate service graph node '{}', keeping the first declaration", node.getName());
            }
        }

        Map<String, Integer> inbound = new HashMap<>();
        Map<String, List<String>> syncCallers = new HashMap<>();
        Map<String, Set<String>> syncEdges = new TreeMap<>();
        List<ServiceConnection> connections = graph.getConnections() == null ? List.of() : graph.getConnections();
        for (ServiceConnection connection : connections) {
            if (connection == null || connection.getFrom() == null || connection.getTo() == null) {
                log.warn("Skipping connection with a missing endpoint: {}", connection);
                continue;
            }
            inbound.merge(connection.getTo(), 1, Integer::sum);
            if (isSync(connection)) {
                syncCallers.computeIfAbsent(connection.getTo(), k -> new ArrayList<>()).add(connection.getFrom());
                syncEdges.computeIfAbsent(connection.getFrom(), k -> new TreeSet<>()).add(connection.getTo());
                syncEdges.computeIfAbsent(connection.getTo(), k -> new TreeSet<>());
            }
        }

        for (ServiceNode node : nodes.values()) {
            String name = node.getName();
            List<String> callers = syncCallers.getOrDefault(name, List.of());
            checkReplicas(node, callers.size(), sink);
            checkReadScaling(node, inbound.getOrDefault(name, 0), sink);
            checkZonePlacement(node, callers, nodes, sink);
        }

        for (List<String> cycle : syncCycles(syncEdges)) {
            sink.accept(cycleRecord(cycle));
        }
    }

    private void checkReplicas(ServiceNode node, int inboundSync, Consumer<EvidenceRecord> sink) {
        int replicas = node.getReplicas() == null ? 1 : node.getReplicas();
        if (replicas > 1) {
            return;
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("node", node.getName());
        attributes.put("rule", "single_replica");
        attributes.put("replicas", replicas);
        attributes.put("inbound_sync", inboundSync);

        sink.accept(record(EvidenceKinds.SPOF, inboundSync > 0 ? Severity.CRITICAL : Severity.WARNING,
                String.format(Locale.ROOT,
                        "Node '%s' runs %d replica(s) and has %d inbound sync connection(s)",
                        node.getName(), replicas, inboundSync),
                attributes));
    }

    private void checkReadScaling(ServiceNode node, int inboundCount, Consumer<EvidenceRecord> sink) {
        int readReplicas = node.getReadReplicas() == null ? 0 : node.getReadReplicas();
        if (!isStateful(node) || readReplicas > 0 || inboundCount < 2) {
            return;
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("node", node.getName());
        attributes.put("rule", "stateful_no_read_replicas");
        attributes.put("read_replicas", readReplicas);
        attributes.put("inbound", inboundCount);

        sink.accept(record(EvidenceKinds.SCALABILITY_RISK, Severity.WARNING,
                String.format(Locale.ROOT,
                        "Stateful node '%s' has no read replicas and %d inbound connections",
                        node.getName(), inboundCount),
                attributes));
    }

    private void checkZonePlacement(ServiceNode node, List<String> syncCallers, Map<String, ServiceNode> nodes,
                                    Consumer<EvidenceRecord> sink) {
        List<String> zones = zonesOf(node);
        if (zones.size() != 1) {
            return;
        }
        String zone = zones.get(0);

        Set<String> offending = new TreeSet<>();
        for (String caller : syncCallers) {
            ServiceNode callerNode = nodes.get(caller);
            if (callerNode == null) {
                continue;
            }
            List<String> callerZones = zonesOf(callerNode);
            if (callerZones.size() > 1 || !callerZones.get(0).equals(zone)) {
                offending.add(caller);
            }
        }
        if (offending.isEmpty()) {
            return;
        }

        String callers = String.join(",", offending);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("node", node.getName());
        attributes.put("rule", "cross_zone");
        attributes.put("zone", zone);
        attributes.put("callers", callers);

        sink.accept(record(EvidenceKinds.SCALABILITY_RISK, Severity.WARNING,
                String.format(Locale.ROOT,
                        "Node '%s' is confined to zone %s but is called synchronously from differently placed %s",
                        node.getName(), zone, callers),
                attributes));
    }

    private EvidenceRecord cycleRecord(List<String> members) {
        String joined = String.join(",", members);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("node", members.get(0));
        attributes.put("rule", "sync_cycle");
        attributes.put("members", joined);
        attributes.put("cycle_size", members.size());

        return record(EvidenceKinds.SPOF, Severity.CRITICAL,
                String.format(Locale.ROOT,
                        "Synchronous call cycle among [%s] risks deadlock and cascading unavailability", joined),
                attributes);
    }

    /**
     * Tarjan's algorithm over the sync subgraph. Returns one sorted member list per component
     * that contains a cycle (more than one member, or a self-call), ordered by first member.
     * Vertices and neighbours are visited in name order so the result does not depend on
     * declaration order. The depth-first walk keeps its own frame stack, so path length is
     * bounded by heap, not by the thread stack.
     */
    static List<List<String>> syncCycles(Map<String, Set<String>> edges) {
        Tarjan tarjan = new Tarjan(edges);
        for (String vertex : edges.keySet()) {
            if (!tarjan.index.containsKey(vertex)) {
                tarjan.connect(vertex);
            }
        }
        tarjan.cycles.sort((a, b) -> a.get(0).compareTo(b.get(0)));
        return tarjan.cycles;
    }

    private static final class Tarjan {
        private final Map<String, Set<String>> edges;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> cycles = new ArrayList<>();
        private int counter;

        Tarjan(Map<String, Set<String>> edges) {
            this.edges = edges;
        }

        /** One vertex on the depth-first path with its remaining neighbours. */
        private record Frame(String vertex, Iterator<String> next) {
        }

        void connect(String root) {
            Deque<Frame> path = new ArrayDeque<>();
            path.push(enter(root));

            while (!path.isEmpty()) {
                Frame frame = path.peek();
                String vertex = frame.vertex();
                if (frame.next().hasNext()) {
                    String next = frame.next().next();
                    if (!index.containsKey(next)) {
                        path.push(enter(next));
                    } else if (onStack.contains(next)) {
                        lowLink.put(vertex, Math.min(lowLink.get(vertex), index.get(next)));
                    }
                    continue;
                }

                path.pop();
                if (!path.isEmpty()) {
                    String parent = path.peek().vertex();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(vertex)));
                }
                if (lowLink.get(vertex).equals(index.get(vertex))) {
                    closeComponent(vertex);
                }
            }
        }

        private Frame enter(String vertex) {
            index.put(vertex, counter);
            lowLink.put(vertex, counter);
            counter++;
            stack.push(vertex);
            onStack.add(vertex);
            return new Frame(vertex, edges.getOrDefault(vertex, Set.of()).iterator());
        }

        private void closeComponent(String vertex) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (!member.equals(vertex));

            boolean selfCall = component.size() == 1
                    && edges.getOrDefault(vertex, Set.of()).contains(vertex);
            if (component.size() > 1 || selfCall) {
                component.sort(null);
                cycles.add(component);
            }
        }
    }

    private static EvidenceRecord record(String kind, Severity severity, String description,
                                         Map<String, Object> attributes) {
        return EvidenceRecord.builder()
                .source(EvidenceSource.DESIGN)
                .kind(kind)
                .severity(severity)
                .description(description)
                .attributes(attributes)
                .confidence(1.0)
                .build();
    }

    private static boolean isSync(ServiceConnection connection) {
        return connection.getMode() != ConnectionMode.ASYNC;
    }

    private static boolean isStateful(ServiceNode node) {
        if (node.getStateful() != null) {
            return node.getStateful();
        }
        return node.getType() != null && STATEFUL_TYPES.contains(node.getType().toLowerCase(Locale.ROOT));
    }

    private static List<String> zonesOf(ServiceNode node) {
        List<String> zones = node.getZones() == null ? List.of() : node.getZones().stream()
                .filter(zone -> zone != null && !zone.isBlank())
                .distinct()
                .toList();
        return zones.isEmpty() ? List.of(UNSPECIFIED_ZONE) : zones;
    }
}
