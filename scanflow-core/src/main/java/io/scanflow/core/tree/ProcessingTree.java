package io.scanflow.core.tree;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.ConfigurationException;
import io.scanflow.core.exception.PluginExecutionException;
import io.scanflow.core.exception.PluginNotFoundException;
import io.scanflow.core.exception.TreeStructureException;
import io.scanflow.core.plugin.Plugin;
import io.scanflow.core.plugin.PluginOutput;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.plugin.Rank;
import io.scanflow.core.scan.ProcessingContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// A rooted tree of plugins executed depth-first for one scan point at a time.
///
/// The tree owns its {@link ProcessingNode}s. Nodes are assembled with
/// {@link #addNode(Plugin, Integer)}, pruned with {@link #removeNode(int, RemovalMode)} and
/// reordered with {@link #moveNode(int, int)}. A single call to
/// {@link #execute(int, ProcessingContext)} runs every plugin once for the given task: the root
/// receives a scalar holding the task index, and every node hands its output to all of its
/// children.
///
/// ### Contracts
/// - **Invariant**: the nodes form a single rooted tree without cycles
/// - **Invariant**: every non-root node has exactly one parent, and that parent exists
/// - **Invariant**: node ids are assigned from a monotonically increasing counter and never
///   reused within one tree
/// - **Postcondition**: a failed mutation leaves the tree unchanged
///
/// ### Execution
/// {@link Plugin#preExecute(ProcessingContext)} runs lazily, once per node, before the first
/// execution. It runs again after the tree changed or when a different context is supplied.
/// Plugins whose parameters are changed in place need {@link #invalidate()}.
///
/// @implNote **Not thread-safe**. The run coordinator gives every worker its own copy via
/// {@link #copyOf(ProcessingTree, PluginRegistry)}.
///
/// @see ProcessingNode
/// @see TreeSnapshot
public class ProcessingTree {

    private static final Logger logger = Logger.getLogger(ProcessingTree.class.getName());

    /// Option key carrying the flat scan index of the task being processed.
    public static final String GLOBAL_INDEX = "global_index";

    private final Map<Integer, ProcessingNode> nodes = new HashMap<>();
    private Integer rootId;
    private Integer activeNodeId;
    private int nextId;
    private boolean treeChanged = true;
    private ProcessingContext preparedContext;

    // -- Assembly --------------------------------------------------------------------------

    /// Adds a plugin below the active node.
    ///
    /// The first plugin added to an empty tree becomes the root.
    ///
    /// @param plugin plugin to add, not null
    /// @return id of the new node
    /// @throws TreeStructureException if the tree has nodes but no active node
    public int addNode(Plugin plugin) {
        if (rootId != null && activeNodeId == null) {
            throw new TreeStructureException("No active node to attach the new node to");
        }
        return addNode(plugin, activeNodeId);
    }

    /// Adds a plugin below the given parent.
    ///
    /// The new node becomes the active node.
    ///
    /// @param plugin plugin to add, not null
    /// @param parentId parent node id, or null to create the root of an empty tree
    /// @return id of the new node
    /// @throws TreeStructureException if the parent is unknown, or if a second root is added
    public int addNode(Plugin plugin, Integer parentId) {
        Objects.requireNonNull(plugin, "plugin must not be null");
        if (parentId == null) {
            if (rootId != null) {
                throw new TreeStructureException(
                        "Tree already has root node #" + rootId + "; a parent is required");
            }
        } else if (!nodes.containsKey(parentId)) {
            throw new TreeStructureException("Unknown parent node #" + parentId);
        }

        int id = nextId++;
        ProcessingNode node = new ProcessingNode(id, plugin, parentId);
        nodes.put(id, node);
        if (parentId == null) {
            rootId = id;
        } else {
            nodes.get(parentId).mutableChildIds().add(id);
        }
        activeNodeId = id;
        treeChanged = true;
        logger.fine("Added node #" + id + " (" + plugin.getName() + ") under " + parentId);
        return id;
    }

    /// Removes a node.
    ///
    /// With {@link RemovalMode#NODE_ONLY} the children of the node take its position among
    /// the parent's children, keeping their relative order. Removing a root with exactly one
    /// child promotes that child; removing a root with several children is rejected. With
    /// {@link RemovalMode#BRANCH} the node and all its descendants are removed.
    ///
    /// If the active node is removed, the active node falls back to the removed node's parent,
    /// or to the promoted child when a root is removed alone.
    ///
    /// @param id node id
    /// @param mode what happens to the children, not null
    /// @throws TreeStructureException if the node is unknown or the removal is ambiguous
    public void removeNode(int id, RemovalMode mode) {
        ProcessingNode node = getNodeOrThrow(id);
        Integer parentId = node.getParentId();

        Set<Integer> removed;
        if (mode == RemovalMode.BRANCH) {
            removed = new HashSet<>(collectSubtree(id));
            if (parentId != null) {
                nodes.get(parentId).mutableChildIds().remove(Integer.valueOf(id));
            } else {
                rootId = null;
            }
        } else {
            List<Integer> children = node.mutableChildIds();
            if (parentId == null) {
                if (children.size() > 1) {
                    throw new TreeStructureException(
                            "Cannot remove root node #"
                                    + id
                                    + " with "
                                    + children.size()
                                    + " children; the new root would be ambiguous");
                }
                rootId = children.isEmpty() ? null : children.get(0);
            } else {
                List<Integer> siblings = nodes.get(parentId).mutableChildIds();
                int position = siblings.indexOf(id);
                siblings.remove(position);
                siblings.addAll(position, children);
            }
            for (int childId : children) {
                nodes.get(childId).setParentId(parentId);
            }
            removed = Set.of(id);
        }

        for (int removedId : removed) {
            nodes.remove(removedId);
        }
        if (activeNodeId != null && removed.contains(activeNodeId)) {
            activeNodeId = parentId != null ? parentId : rootId;
        }
        if (nodes.isEmpty()) {
            activeNodeId = null;
        }
        treeChanged = true;
        logger.fine("Removed " + removed.size() + " node(s) starting at #" + id + " (" + mode + ")");
    }

    /// Moves a node, together with its subtree, below a new parent.
    ///
    /// The node is appended after the new parent's existing children.
    ///
    /// @param id node to move
    /// @param newParentId new parent
    /// @throws TreeStructureException if either node is unknown, if `id` is the root, or if
    ///     the new parent lies inside the moved subtree
    public void moveNode(int id, int newParentId) {
        ProcessingNode node = getNodeOrThrow(id);
        ProcessingNode newParent = getNodeOrThrow(newParentId);
        if (node.isRoot()) {
            throw new TreeStructureException("Cannot move root node #" + id);
        }
        if (collectSubtree(id).contains(newParentId)) {
            throw new TreeStructureException(
                    "Cannot move node #" + id + " below its own descendant #" + newParentId);
        }
        nodes.get(node.getParentId()).mutableChildIds().remove(Integer.valueOf(id));
        newParent.mutableChildIds().add(id);
        node.setParentId(newParentId);
        treeChanged = true;
    }

    /// Replaces the plugin of a node.
    ///
    /// Clears the node's recorded result shape.
    ///
    /// @param id node id
    /// @param plugin new plugin, not null
    /// @throws TreeStructureException if the node is unknown
    public void replacePlugin(int id, Plugin plugin) {
        getNodeOrThrow(id).setPlugin(plugin);
        treeChanged = true;
    }

    /// Removes all nodes. The id counter restarts at 0.
    public void clear() {
        nodes.clear();
        rootId = null;
        activeNodeId = null;
        nextId = 0;
        treeChanged = true;
    }

    /// Forces {@link Plugin#preExecute(ProcessingContext)} to run again before the next
    /// execution.
    public void invalidate() {
        treeChanged = true;
    }

    // -- Queries ---------------------------------------------------------------------------

    public ProcessingNode getNode(int id) {
        return getNodeOrThrow(id);
    }

    public boolean hasNode(int id) {
        return nodes.containsKey(id);
    }

    /// Returns all node ids in depth-first order, children in insertion order.
    ///
    /// @return new list, empty for an empty tree
    public List<Integer> getNodeIds() {
        List<Integer> order = new ArrayList<>(nodes.size());
        if (rootId == null) {
            return order;
        }
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(rootId);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            order.add(id);
            List<Integer> children = nodes.get(id).getChildIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return order;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /// Returns the root node.
    ///
    /// @return root node
    /// @throws TreeStructureException if the tree is empty
    public ProcessingNode getRoot() {
        if (rootId == null) {
            throw new TreeStructureException("Tree is empty");
        }
        return nodes.get(rootId);
    }

    /// Returns the active node id, the default parent for {@link #addNode(Plugin)}.
    ///
    /// @return active node id, or null
    public Integer getActiveNodeId() {
        return activeNodeId;
    }

    /// Sets the active node.
    ///
    /// @param id node id, or null to clear
    /// @throws TreeStructureException if the node is unknown
    public void setActiveNodeId(Integer id) {
        if (id != null) {
            getNodeOrThrow(id);
        }
        activeNodeId = id;
    }

    /// Returns all leaves in depth-first order.
    ///
    /// @return new list, never null
    public List<ProcessingNode> getLeaves() {
        List<ProcessingNode> leaves = new ArrayList<>();
        for (int id : getNodeIds()) {
            ProcessingNode node = nodes.get(id);
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /// Returns the nodes whose results go into the result store, in depth-first order.
    ///
    /// @return new list, never null
    public List<ProcessingNode> getResultProducingNodes() {
        List<ProcessingNode> producing = new ArrayList<>();
        for (int id : getNodeIds()) {
            ProcessingNode node = nodes.get(id);
            if (node.isResultProducing()) {
                producing.add(node);
            }
        }
        return producing;
    }

    /// Returns the per-point result shapes of all result-producing nodes.
    ///
    /// @return shapes keyed by node id, in depth-first order
    /// @throws ConfigurationException if a result-producing node has not run yet
    public Map<Integer, int[]> getResultShapes() {
        Map<Integer, int[]> shapes = new LinkedHashMap<>();
        for (ProcessingNode node : getResultProducingNodes()) {
            int[] shape =
                    node.getResultShape()
                            .orElseThrow(
                                    () ->
                                            new ConfigurationException(
                                                    "Result shape of node #"
                                                            + node.getId()
                                                            + " is unknown; run the tree once"
                                                            + " first"));
            shapes.put(node.getId(), shape);
        }
        return shapes;
    }

    /// Checks declared ranks along every edge of the tree.
    ///
    /// A node is flagged when its plugin's input rank does not accept the rank its parent
    /// produces. The parent's rank is taken from its last result if it has run, otherwise from
    /// its declared output rank. All descendants of a flagged node are flagged too.
    ///
    /// @return report of flagged nodes, never null
    public ConsistencyReport checkConsistency() {
        Set<Integer> inconsistent = new HashSet<>();
        for (int id : getNodeIds()) {
            ProcessingNode node = nodes.get(id);
            if (node.isRoot()) {
                continue;
            }
            ProcessingNode parent = nodes.get(node.getParentId());
            if (inconsistent.contains(parent.getId())
                    || !node.getPlugin().getInputRank().accepts(effectiveOutputRank(parent))) {
                inconsistent.add(id);
            }
        }
        if (!inconsistent.isEmpty()) {
            logger.fine("Inconsistent nodes: " + inconsistent);
        }
        return new ConsistencyReport(inconsistent);
    }

    private Rank effectiveOutputRank(ProcessingNode node) {
        return node.getResultShape()
                .map(shape -> Rank.of(shape.length))
                .orElse(node.getPlugin().getOutputRank());
    }

    // -- Execution -------------------------------------------------------------------------

    /// Runs the whole tree for one task without collecting results.
    ///
    /// Results of result-producing nodes remain available through
    /// {@link ProcessingNode#getLatestResult()} until the next execution.
    ///
    /// @param task flat scan index
    /// @param context scan and experiment of the run, not null
    /// @throws PluginExecutionException if any plugin fails
    /// @throws TreeStructureException if the tree is empty
    public void execute(int task, ProcessingContext context) throws PluginExecutionException {
        runTree(task, context, null);
    }

    /// Runs the whole tree for one task and collects the results.
    ///
    /// @param task flat scan index
    /// @param context scan and experiment of the run, not null
    /// @return results of the result-producing nodes in depth-first order, keyed by node id
    /// @throws PluginExecutionException if any plugin fails
    /// @throws TreeStructureException if the tree is empty
    public Map<Integer, Dataset> executeAndCollect(int task, ProcessingContext context)
            throws PluginExecutionException {
        Map<Integer, Dataset> results = new LinkedHashMap<>();
        runTree(task, context, results);
        return results;
    }

    /// Runs the plugin of a single node on explicit input.
    ///
    /// Useful for inspecting one step in isolation. The node's result shape is updated.
    ///
    /// @param id node id
    /// @param input input data
    /// @param options input options, not null
    /// @return plugin output, never null
    /// @throws PluginExecutionException if the plugin fails
    public PluginOutput executeSingle(int id, Dataset input, Map<String, Object> options)
            throws PluginExecutionException {
        ProcessingNode node = getNodeOrThrow(id);
        int task = options.get(GLOBAL_INDEX) instanceof Number n ? n.intValue() : -1;
        return runNode(node, input, new HashMap<>(options), task);
    }

    /// Calls {@link Plugin#preExecute(ProcessingContext)} on every node, if needed.
    ///
    /// @param context scan and experiment of the run, not null
    /// @throws PluginExecutionException if a plugin fails to prepare
    public void prepare(ProcessingContext context) throws PluginExecutionException {
        Objects.requireNonNull(context, "context must not be null");
        if (!treeChanged && context.equals(preparedContext)) {
            return;
        }
        for (int id : getNodeIds()) {
            try {
                nodes.get(id).getPlugin().preExecute(context);
            } catch (Exception e) {
                throw new PluginExecutionException(id, e);
            }
        }
        preparedContext = context;
        treeChanged = false;
        logger.fine("Prepared " + nodes.size() + " plugins");
    }

    private void runTree(int task, ProcessingContext context, Map<Integer, Dataset> results)
            throws PluginExecutionException {
        if (rootId == null) {
            throw new TreeStructureException("Cannot execute an empty tree");
        }
        prepare(context);
        Map<String, Object> options = new HashMap<>();
        options.put(GLOBAL_INDEX, task);
        runBranch(nodes.get(rootId), Dataset.scalar(task), options, task, results);
    }

    private void runBranch(
            ProcessingNode node,
            Dataset input,
            Map<String, Object> options,
            int task,
            Map<Integer, Dataset> results)
            throws PluginExecutionException {
        PluginOutput output = runNode(node, input, options, task);
        if (results != null && node.isResultProducing()) {
            results.put(node.getId(), node.getLatestResult().orElse(null));
        }
        List<Integer> children = node.getChildIds();
        for (int childId : children) {
            PluginOutput childInput = children.size() > 1 ? output.copy() : output;
            runBranch(nodes.get(childId), childInput.data(), childInput.options(), task, results);
        }
    }

    private PluginOutput runNode(
            ProcessingNode node, Dataset input, Map<String, Object> options, int task)
            throws PluginExecutionException {
        long start = System.nanoTime();
        PluginOutput output;
        try {
            output = node.getPlugin().execute(input, options);
        } catch (Exception e) {
            throw new PluginExecutionException(node.getId(), task, e);
        }
        if (output == null) {
            throw new PluginExecutionException(
                    node.getId(), task, new IllegalStateException("plugin returned no output"));
        }
        node.recordExecution(output.data(), System.nanoTime() - start);
        return output;
    }

    // -- Snapshots -------------------------------------------------------------------------

    /// Captures the structure and plugin parameters of this tree.
    ///
    /// @return snapshot with parents before children, never null
    public TreeSnapshot exportSnapshot() {
        List<NodeRecord> records = new ArrayList<>(nodes.size());
        for (int id : getNodeIds()) {
            ProcessingNode node = nodes.get(id);
            records.add(
                    new NodeRecord(
                            id,
                            node.getParentId(),
                            node.getPlugin().getPluginClassName(),
                            node.getPlugin().getParameterValues()));
        }
        return TreeSnapshot.of(records);
    }

    /// Replaces the whole tree with the content of a snapshot.
    ///
    /// Node ids are kept; the id counter continues after the largest restored id. The node
    /// with the largest id becomes active.
    ///
    /// @param snapshot snapshot to restore, not null
    /// @param registry creates the plugins, not null
    /// @throws PluginNotFoundException if a plugin class is not registered
    /// @throws TreeStructureException if the snapshot does not describe a single rooted tree
    public void restore(TreeSnapshot snapshot, PluginRegistry registry)
            throws PluginNotFoundException {
        Map<Integer, ProcessingNode> restored = new HashMap<>();
        Integer newRoot = null;
        for (NodeRecord record : snapshot.nodes()) {
            if (restored.containsKey(record.nodeId())) {
                throw new TreeStructureException("Duplicate node id #" + record.nodeId());
            }
            Plugin plugin = registry.createPluginOrThrow(record.pluginClassName());
            record.parameterValues().forEach(plugin::setParameterValue);
            restored.put(
                    record.nodeId(),
                    new ProcessingNode(record.nodeId(), plugin, record.parentId()));
            if (record.parentId() == null) {
                if (newRoot != null) {
                    throw new TreeStructureException(
                            "Snapshot has more than one root: #" + newRoot + ", #" + record.nodeId());
                }
                newRoot = record.nodeId();
            }
        }
        for (NodeRecord record : snapshot.nodes()) {
            if (record.parentId() == null) {
                continue;
            }
            ProcessingNode parent = restored.get(record.parentId());
            if (parent == null) {
                throw new TreeStructureException(
                        "Node #" + record.nodeId() + " refers to unknown parent #" + record.parentId());
            }
            parent.mutableChildIds().add(record.nodeId());
        }
        if (!restored.isEmpty() && newRoot == null) {
            throw new TreeStructureException("Snapshot has no root node");
        }
        if (newRoot != null && countReachable(restored, newRoot) != restored.size()) {
            throw new TreeStructureException("Snapshot contains nodes not connected to the root");
        }

        nodes.clear();
        nodes.putAll(restored);
        rootId = newRoot;
        int maxId = restored.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1);
        nextId = maxId + 1;
        activeNodeId = maxId >= 0 ? maxId : null;
        treeChanged = true;
        logger.fine("Restored tree with " + nodes.size() + " nodes");
    }

    /// Creates an independent deep copy of a tree.
    ///
    /// The copy has fresh plugin instances built through the registry, configured with the
    /// original's parameter values. The active node is carried over.
    ///
    /// @param tree tree to copy, not null
    /// @param registry creates the plugins, not null
    /// @return new tree, never null
    /// @throws PluginNotFoundException if a plugin class is not registered
    public static ProcessingTree copyOf(ProcessingTree tree, PluginRegistry registry)
            throws PluginNotFoundException {
        ProcessingTree copy = new ProcessingTree();
        copy.restore(tree.exportSnapshot(), registry);
        copy.nextId = Math.max(copy.nextId, tree.nextId);
        copy.activeNodeId = tree.activeNodeId;
        return copy;
    }

    // -- Helpers ---------------------------------------------------------------------------

    private ProcessingNode getNodeOrThrow(int id) {
        ProcessingNode node = nodes.get(id);
        if (node == null) {
            throw new TreeStructureException("Unknown node #" + id);
        }
        return node;
    }

    private List<Integer> collectSubtree(int id) {
        List<Integer> subtree = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(id);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            subtree.add(current);
            for (int childId : nodes.get(current).getChildIds()) {
                stack.push(childId);
            }
        }
        return subtree;
    }

    private static int countReachable(Map<Integer, ProcessingNode> graph, int start) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (seen.add(current)) {
                graph.get(current).getChildIds().forEach(stack::push);
            }
        }
        return seen.size();
    }

    @Override
    public String toString() {
        return "ProcessingTree{nodes=" + getNodeIds() + ", active=" + activeNodeId + "}";
    }
}
