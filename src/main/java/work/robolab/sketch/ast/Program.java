package work.robolab.sketch.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Program AST stored as an arena of {@link BlockInstance}s keyed by instance id.
 *
 * <p>Containers hold child ids, never instance references, and the arena tracks each child's
 * parent. This keeps three invariants cheap to enforce: ids are unique, a block has at most one
 * parent, and attaching never creates a cycle. The root is optional; a program without one is
 * incomplete. Instances that are not reachable from the root may stay in the arena (the editor
 * keeps unconnected blocks around) and are skipped by traversal.
 */
public final class Program {
    private final String boardId;
    private final Map<String, BlockInstance> instances = new LinkedHashMap<>();
    private final Map<String, String> parents = new HashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String rootId;

    public Program(String boardId) {
        this.boardId = boardId;
    }

    public String boardId() {
        return boardId;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public BlockInstance create(String instanceId, String definitionId) {
        return add(new BlockInstance(instanceId, definitionId));
    }

    /**
     * Creates a block and appends it to {@code container} of {@code parentId}.
     */
    public BlockInstance createChild(String parentId, String container, String instanceId, String definitionId) {
        requireInstance(parentId);
        var child = create(instanceId, definitionId);
        attach(parentId, container, instanceId);
        return child;
    }

    public BlockInstance add(BlockInstance instance) {
        Objects.requireNonNull(instance, "instance");
        if (instances.containsKey(instance.id())) {
            throw new IllegalArgumentException("Duplicate block instance id: " + instance.id());
        }
        instances.put(instance.id(), instance);
        return instance;
    }

    public Program setRoot(String instanceId) {
        requireInstance(instanceId);
        if (parents.containsKey(instanceId)) {
            throw new IllegalStateException("Block " + instanceId + " is nested in " + parents.get(instanceId) + " and cannot be the root");
        }
        this.rootId = instanceId;
        return this;
    }

    public Program clearRoot() {
        this.rootId = null;
        return this;
    }

    public Optional<BlockInstance> root() {
        return rootId == null ? Optional.empty() : Optional.ofNullable(instances.get(rootId));
    }

    public boolean hasRoot() {
        return rootId != null;
    }

    public BlockInstance instance(String instanceId) {
        return requireInstance(instanceId);
    }

    public Optional<BlockInstance> find(String instanceId) {
        return instanceId == null ? Optional.empty() : Optional.ofNullable(instances.get(instanceId));
    }

    public boolean contains(String instanceId) {
        return instanceId != null && instances.containsKey(instanceId);
    }

    public Collection<BlockInstance> instances() {
        return Collections.unmodifiableCollection(instances.values());
    }

    public int size() {
        return instances.size();
    }

    public Program attach(String parentId, String container, String childId) {
        return insert(parentId, container, -1, childId);
    }

    /**
     * Inserts {@code childId} at {@code index} of the parent's container; a negative or
     * out-of-range index appends.
     */
    public Program insert(String parentId, String container, int index, String childId) {
        Objects.requireNonNull(container, "container");
        var parent = requireInstance(parentId);
        requireInstance(childId);
        if (childId.equals(rootId)) {
            throw new IllegalStateException("The root block " + childId + " cannot be nested");
        }
        if (parents.containsKey(childId)) {
            throw new IllegalStateException("Block " + childId + " is already nested in " + parents.get(childId));
        }
        for (String cursor = parentId; cursor != null; cursor = parents.get(cursor)) {
            if (cursor.equals(childId)) {
                throw new IllegalArgumentException("Nesting " + childId + " under " + parentId + " would create a cycle");
            }
        }
        parent.insertChild(container, index, childId);
        parents.put(childId, parentId);
        return this;
    }

    /**
     * Declares an empty container on a block so that it is kept when the program is persisted.
     */
    public Program declareContainer(String instanceId, String container) {
        requireInstance(instanceId).ensureContainer(container);
        return this;
    }

    /**
     * Unlinks a block from its parent; the block and its subtree stay in the arena.
     */
    public Program detach(String childId) {
        var parentId = parents.remove(childId);
        if (parentId != null) {
            instances.get(parentId).removeChild(childId);
        }
        return this;
    }

    /**
     * Removes a block with its whole subtree.
     */
    public Program remove(String instanceId) {
        requireInstance(instanceId);
        detach(instanceId);
        var stack = new ArrayDeque<String>();
        stack.push(instanceId);
        while (!stack.isEmpty()) {
            var current = instances.remove(stack.pop());
            if (current == null) continue;
            parents.remove(current.id());
            if (current.id().equals(rootId)) {
                rootId = null;
            }
            for (var container : current.containerNames()) {
                current.childIds(container).forEach(stack::push);
            }
        }
        return this;
    }

    public Optional<BlockInstance> parentOf(String instanceId) {
        return Optional.ofNullable(parents.get(instanceId)).map(instances::get);
    }

    /**
     * Name of the container holding {@code instanceId} within its parent.
     */
    public Optional<String> containerOf(String instanceId) {
        return parentOf(instanceId).flatMap(parent -> parent.containerNames().stream()
            .filter(container -> parent.childIds(container).contains(instanceId))
            .findFirst());
    }

    public List<BlockInstance> children(BlockInstance parent, String container) {
        var ids = parent.childIds(container);
        var result = new ArrayList<BlockInstance>(ids.size());
        for (var id : ids) {
            result.add(requireInstance(id));
        }
        return result;
    }

    /**
     * Blocks reachable from the root in depth-first pre-order; containers in declaration order.
     */
    public List<BlockInstance> traverse() {
        var ordered = new ArrayList<BlockInstance>();
        if (rootId == null) {
            return ordered;
        }
        var stack = new ArrayDeque<BlockInstance>();
        stack.push(requireInstance(rootId));
        while (!stack.isEmpty()) {
            var block = stack.pop();
            ordered.add(block);
            var pending = new ArrayList<BlockInstance>();
            for (var container : block.containerNames()) {
                pending.addAll(children(block, container));
            }
            for (int i = pending.size() - 1; i >= 0; i--) {
                stack.push(pending.get(i));
            }
        }
        return ordered;
    }

    private BlockInstance requireInstance(String instanceId) {
        var instance = instanceId == null ? null : instances.get(instanceId);
        if (instance == null) {
            throw new IllegalArgumentException("Unknown block instance: " + instanceId);
        }
        return instance;
    }
}
