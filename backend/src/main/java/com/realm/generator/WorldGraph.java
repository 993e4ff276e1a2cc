package com.realm.generator;

import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.LocationSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次生成会话内的地点图（arena）
 *
 * 节点按生成顺序存放，边在节点生成之后单独登记。
 * {@link #link(String, String)} 总是同时写两端，保证连接是双向的。
 */
public class WorldGraph {

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    public void clear() {
        nodes.clear();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    void add(GeneratedLocation location, int depth) {
        nodes.put(location.getId(), new Node(location, depth));
    }

    int depthOf(String id) {
        return node(id).depth;
    }

    String templateOf(String id) {
        return node(id).location.getTemplate();
    }

    boolean hasSlot(String id, String slot) {
        return node(id).connections.containsKey(slot);
    }

    /**
     * 可复用的邻居：模板名等于 slot，且它回连 fromTemplate 的槽位仍空着
     */
    List<String> reusable(String fromId, String slot) {
        String fromTemplate = templateOf(fromId);
        List<String> candidates = new ArrayList<>();
        for (Node node : nodes.values()) {
            String id = node.location.getId();
            if (!id.equals(fromId)
                && slot.equals(node.location.getTemplate())
                && !node.connections.containsKey(fromTemplate)) {
                candidates.add(id);
            }
        }
        return candidates;
    }

    /**
     * 登记双向边：from 的 [to的模板] 槽指向 to，to 的 [from的模板] 槽指向 from
     */
    void link(String fromId, String toId) {
        Node from = node(fromId);
        Node to = node(toId);
        from.connections.put(to.location.getTemplate(), toId);
        to.connections.put(from.location.getTemplate(), fromId);
    }

    public GeneratedLocation get(String id) {
        Node node = node(id);
        return node.location.toBuilder()
            .connections(Collections.unmodifiableMap(new LinkedHashMap<>(node.connections)))
            .build();
    }

    public Map<String, GeneratedLocation> locations() {
        Map<String, GeneratedLocation> result = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            result.put(id, get(id));
        }
        return result;
    }

    public Map<String, LocationSummary> summary() {
        Map<String, LocationSummary> result = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            GeneratedLocation location = node.location;
            result.put(location.getId(), LocationSummary.builder()
                .name(location.getName())
                .type(location.getType())
                .connections(new ArrayList<>(node.connections.values()))
                .npcCount(location.getNpcs().size())
                .itemCount(location.getItems().size())
                .build());
        }
        return result;
    }

    private Node node(String id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalStateException("地点不在当前会话图中: " + id);
        }
        return node;
    }

    private static final class Node {

        final GeneratedLocation location;
        final int depth;
        final Map<String, String> connections = new LinkedHashMap<>();

        Node(GeneratedLocation location, int depth) {
            this.location = location;
            this.depth = depth;
        }
    }
}
