package dev.pagestack.engine;

import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.engine.model.SectionRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the flat section rows of a page into a tree ordered by position.
 * <p>
 * Rows whose parent is not among the loaded rows become roots, and so does the first section
 * (by position) of every parent cycle that no root reaches, so no section is ever lost between
 * the draft and a snapshot. {@code data_config} and {@code condition} are decoded here,
 * once per load.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionTreeBuilder {

    private static final Comparator<SectionRow> BY_POSITION =
            Comparator.comparingInt(SectionRow::position).thenComparing(SectionRow::id);

    private static final Comparator<SectionNode> NODES_BY_POSITION =
            Comparator.comparingInt(SectionNode::position).thenComparing(SectionNode::id);

    private final DataConfigParser dataConfigParser;

    public List<SectionNode> build(List<SectionRow> rows) {
        Map<Long, SectionRow> byId = new LinkedHashMap<>();
        for (SectionRow row : rows) {
            if (byId.putIfAbsent(row.id(), row) != null) {
                log.warn("Section {} is placed more than once on the page, keeping its first placement", row.id());
            }
        }

        Map<Long, List<SectionRow>> childrenByParent = new LinkedHashMap<>();
        List<SectionRow> roots = new ArrayList<>();
        for (SectionRow row : byId.values()) {
            if (row.parentId() == null) {
                roots.add(row);
            } else if (!byId.containsKey(row.parentId())) {
                log.warn("Section {} references missing parent {}, promoting it to root", row.id(), row.parentId());
                roots.add(row);
            } else {
                childrenByParent.computeIfAbsent(row.parentId(), id -> new ArrayList<>()).add(row);
            }
        }

        roots.sort(BY_POSITION);
        Set<Long> visited = new HashSet<>();
        List<SectionNode> tree = new ArrayList<>(roots.size());
        for (SectionRow root : roots) {
            tree.add(toNode(root, childrenByParent, visited));
        }

        List<SectionRow> unreached = new ArrayList<>();
        for (SectionRow row : byId.values()) {
            if (!visited.contains(row.id())) {
                unreached.add(row);
            }
        }
        if (!unreached.isEmpty()) {
            unreached.sort(BY_POSITION);
            for (SectionRow row : unreached) {
                if (!visited.contains(row.id())) {
                    log.warn("Section {} is part of a parent cycle not reachable from the page, promoting it to root", row.id());
                    tree.add(toNode(row, childrenByParent, visited));
                }
            }
            tree.sort(NODES_BY_POSITION);
        }
        return tree;
    }

    private SectionNode toNode(SectionRow row, Map<Long, List<SectionRow>> childrenByParent, Set<Long> visited) {
        visited.add(row.id());
        List<SectionRow> childRows = new ArrayList<>(childrenByParent.getOrDefault(row.id(), List.of()));
        childRows.sort(BY_POSITION);

        List<SectionNode> children = new ArrayList<>(childRows.size());
        for (SectionRow child : childRows) {
            if (visited.contains(child.id())) {
                log.warn("Section {} appears in a cycle below section {}, skipping the repeated link", child.id(), row.id());
                continue;
            }
            children.add(toNode(child, childrenByParent, visited));
        }

        List<DataSourceDeclaration> dataSources = List.of();
        boolean malformed = false;
        try {
            dataSources = dataConfigParser.parse(row.dataConfig());
        } catch (DataConfigParser.MalformedDataConfigException e) {
            log.warn("Ignoring data_config of section {} ({}): {}", row.id(), row.name(), e.getMessage());
            malformed = true;
        }

        return SectionNode.builder()
                .id(row.id())
                .name(row.name())
                .styleName(row.styleName())
                .position(row.position())
                .condition(ConditionDecoder.normalize(row.condition()))
                .dataConfig(row.dataConfig())
                .dataSources(dataSources)
                .dataConfigMalformed(malformed)
                .css(row.css())
                .cssMobile(row.cssMobile())
                .debug(row.debug())
                .children(children)
                .build();
    }
}
