package com.incident.rca.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Declarative architecture description: services and the calls between them.
 * Missing fields are left null; analyzers apply the conservative defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Service graph: typed nodes and directed connections")
public class ServiceGraph {

    @JsonAlias("services")
    private List<ServiceNode> nodes;

    @JsonAlias("edges")
    private List<ServiceConnection> connections;

    /** Names of all named nodes, in declaration order. */
    public List<String> nodeNames() {
        if (nodes == null) {
            return List.of();
        }
        return nodes.stream()
                .filter(Objects::nonNull)
                .map(ServiceNode::getName)
                .filter(name -> name != null && !name.isBlank())
                .distinct()
                .toList();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "A deployed service or datastore")
    public static class ServiceNode {
        @JsonAlias("id")
        @Schema(example = "orders-db")
        private String name;

        @JsonAlias("role")
        @Schema(example = "db")
        private String type;

        @Schema(description = "Replica count; absent means 1", example = "1")
        private Integer replicas;

        @JsonAlias("az")
        @Schema(description = "Availability zones; absent means a single unspecified zone")
        private List<String> zones;

        @Schema(description = "Holds state; absent means inferred from type (db/database/cache)")
        private Boolean stateful;

        @JsonAlias("read_replicas")
        @Schema(description = "Read replica count; absent means 0", example = "0")
        private Integer readReplicas;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Directed call from one node to another")
    public static class ServiceConnection {
        @JsonAlias("source")
        @Schema(example = "api")
        private String from;

        @JsonAlias("target")
        @Schema(example = "orders-db")
        private String to;

        @JsonAlias("protocol")
        @Schema(description = "SYNC or ASYNC; absent means SYNC", example = "SYNC")
        private ConnectionMode mode;
    }
}
