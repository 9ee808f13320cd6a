package io.scanflow.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.ConfigurationException;
import io.scanflow.core.exception.PluginExecutionException;
import io.scanflow.core.exception.PluginNotFoundException;
import io.scanflow.core.exception.TreeStructureException;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.DefaultPluginRegistry;
import io.scanflow.core.plugin.PluginOutput;
import io.scanflow.core.plugin.PluginType;
import io.scanflow.core.plugin.Rank;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.testsupport.ImageLoader;
import io.scanflow.core.testsupport.PassThrough;
import io.scanflow.core.testsupport.RangeSelector;
import io.scanflow.core.testsupport.Sink;
import io.scanflow.core.testsupport.TestPlugins;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProcessingTreeTest {

    private ProcessingTree tree;
    private ProcessingContext context;

    @BeforeEach
    void setUp() {
        tree = new ProcessingTree();
        context = TestPlugins.context();
    }

    @Nested
    class AssemblyTest {

        @Test
        void shouldMakeFirstNodeRootAndActive() {
            int root = tree.addNode(new ImageLoader());

            assertThat(root).isZero();
            assertThat(tree.getRoot().getId()).isEqualTo(root);
            assertThat(tree.getActiveNodeId()).isEqualTo(root);
        }

        @Test
        void shouldAttachBelowActiveNode() {
            int root = tree.addNode(new ImageLoader());
            int selector = tree.addNode(RangeSelector.of(0, 2));
            int pass = tree.addNode(new PassThrough());

            assertThat(tree.getNode(selector).getParentId()).isEqualTo(root);
            assertThat(tree.getNode(pass).getParentId()).isEqualTo(selector);
            assertThat(tree.getNodeIds()).containsExactly(root, selector, pass);
        }

        @Test
        void shouldRejectSecondRoot() {
            tree.addNode(new ImageLoader(), null);

            assertThatThrownBy(() -> tree.addNode(new ImageLoader(), null))
                    .isInstanceOf(TreeStructureException.class);
        }

        @Test
        void shouldRejectUnknownParent() {
            tree.addNode(new ImageLoader(), null);

            assertThatThrownBy(() -> tree.addNode(new PassThrough(), 42))
                    .isInstanceOf(TreeStructureException.class)
                    .hasMessageContaining("42");
        }

        @Test
        void shouldRestartIdsAfterClear() {
            tree.addNode(new ImageLoader());
            tree.addNode(new PassThrough());

            tree.clear();

            assertThat(tree.isEmpty()).isTrue();
            assertThat(tree.addNode(new ImageLoader())).isZero();
        }
    }

    @Nested
    class RemovalTest {

        private int root;
        private int middle;
        private int first;
        private int second;
        private int sibling;

        @BeforeEach
        void buildTree() {
            root = tree.addNode(new ImageLoader(), null);
            middle = tree.addNode(new PassThrough(), root);
            first = tree.addNode(RangeSelector.of(0, 2), middle);
            second = tree.addNode(RangeSelector.of(2, 4), middle);
            sibling = tree.addNode(RangeSelector.of(4, 6), root);
        }

        @Test
        void shouldSpliceChildrenIntoParentPosition() {
            // When
            tree.removeNode(middle, RemovalMode.NODE_ONLY);

            // Then
            assertThat(tree.getRoot().getChildIds()).containsExactly(first, second, sibling);
            assertThat(tree.getNode(first).getParentId()).isEqualTo(root);
            assertThat(tree.hasNode(middle)).isFalse();
        }

        @Test
        void shouldRemoveWholeBranch() {
            tree.removeNode(middle, RemovalMode.BRANCH);

            assertThat(tree.getNodeIds()).containsExactly(root, sibling);
        }

        @Test
        void shouldFallBackToParentWhenActiveNodeIsRemoved() {
            tree.setActiveNodeId(second);

            tree.removeNode(middle, RemovalMode.BRANCH);

            assertThat(tree.getActiveNodeId()).isEqualTo(root);
        }

        @Test
        void shouldRejectRemovingRootWithSeveralChildren() {
            assertThatThrownBy(() -> tree.removeNode(root, RemovalMode.NODE_ONLY))
                    .isInstanceOf(TreeStructureException.class);
            assertThat(tree.size()).isEqualTo(5);
        }

        @Test
        void shouldPromoteOnlyChildOfRemovedRoot() {
            // Given
            tree.removeNode(sibling, RemovalMode.BRANCH);

            // When
            tree.removeNode(root, RemovalMode.NODE_ONLY);

            // Then
            assertThat(tree.getRoot().getId()).isEqualTo(middle);
            assertThat(tree.getNode(middle).isRoot()).isTrue();
        }

        @Test
        void shouldActivatePromotedChildWhenActiveRootIsRemoved() {
            // Given
            tree.removeNode(sibling, RemovalMode.BRANCH);
            tree.setActiveNodeId(root);

            // When
            tree.removeNode(root, RemovalMode.NODE_ONLY);
            int added = tree.addNode(new PassThrough());

            // Then
            assertThat(tree.getNode(added).getParentId()).isEqualTo(middle);
            assertThat(tree.getActiveNodeId()).isEqualTo(added);
        }

        @Test
        void shouldMoveSubtreeBelowNewParent() {
            tree.moveNode(middle, sibling);

            assertThat(tree.getNode(middle).getParentId()).isEqualTo(sibling);
            assertThat(tree.getNodeIds()).containsExactly(root, sibling, middle, first, second);
        }

        @Test
        void shouldRejectMoveBelowOwnDescendant() {
            assertThatThrownBy(() -> tree.moveNode(middle, first))
                    .isInstanceOf(TreeStructureException.class);
            assertThatThrownBy(() -> tree.moveNode(root, sibling))
                    .isInstanceOf(TreeStructureException.class);
        }
    }

    @Nested
    class ConsistencyTest {

        @Test
        void shouldFlagRankMismatchAndDescendants() {
            // Given
            int root = tree.addNode(new ImageLoader());
            int profile = tree.addNode(RangeSelector.of(0, 2));
            int wrong = tree.addNode(RangeSelector.of(0, 1));
            int below = tree.addNode(new PassThrough());

            // When
            ConsistencyReport report = tree.checkConsistency();

            // Then
            assertThat(report.isConsistent()).isFalse();
            assertThat(report.inconsistentNodeIds()).containsExactlyInAnyOrder(wrong, below);
            assertThat(report.isConsistent(root)).isTrue();
            assertThat(report.isConsistent(profile)).isTrue();
        }

        @Test
        void shouldUseObservedRankOnceParentHasRun() {
            // Given
            tree.addNode(new ImageLoader());
            tree.addNode(RangeSelector.of(0, 2));
            tree.addNode(new PassThrough());
            int consumer = tree.addNode(RangeSelector.of(0, 1));
            assertThat(tree.checkConsistency().isConsistent()).isTrue();

            // When
            assertThatThrownBy(() -> tree.execute(0, context))
                    .isInstanceOf(PluginExecutionException.class);

            // Then
            assertThat(tree.checkConsistency().inconsistentNodeIds()).containsExactly(consumer);
        }
    }

    @Nested
    class ExecutionTest {

        @Test
        void shouldCollectOneResultPerLeaf() throws Exception {
            // Given
            ProcessingTree branching = TestPlugins.branchingTree();

            // When
            Map<Integer, Dataset> results = branching.executeAndCollect(7, context);

            // Then
            assertThat(results).containsOnlyKeys(1, 2);
            assertThat(results.get(1).getData()).containsExactly(7155.0, 7156.0, 7157.0);
            assertThat(results.get(2).getData())
                    .containsExactly(7160.0, 7161.0, 7162.0, 7163.0);
            assertThat(results.get(2).getAxis(0).range())
                    .containsExactly(10.0, 11.0, 12.0, 13.0);
        }

        @Test
        void shouldRecordShapesAndMetadata() throws Exception {
            ProcessingTree branching = TestPlugins.branchingTree();
            assertThatThrownBy(branching::getResultShapes)
                    .isInstanceOf(ConfigurationException.class);

            branching.execute(0, context);

            assertThat(branching.getResultShapes()).containsOnlyKeys(1, 2);
            assertThat(branching.getResultShapes().get(2)).containsExactly(4);
            assertThat(branching.getNode(1).getResultDataLabel()).isEqualTo("mean intensity");
            assertThat(branching.getNode(0).getRuntimeNanos()).isNotNegative();
        }

        @Test
        void shouldStoreIntermediateResultsWhenKeepResultsIsSet() throws Exception {
            // Given
            ProcessingTree branching = TestPlugins.branchingTree();
            branching.getRoot().getPlugin().setParameterValue(BasePlugin.KEEP_RESULTS, true);

            // When
            Map<Integer, Dataset> results = branching.executeAndCollect(1, context);

            // Then
            assertThat(results.keySet()).containsExactly(0, 1, 2);
            assertThat(results.get(0).getShape()).containsExactly(4, 16);
        }

        @Test
        void shouldNotStoreOutputPluginResults() throws Exception {
            tree.addNode(new ImageLoader());
            tree.addNode(new Sink());

            assertThat(tree.getResultProducingNodes()).isEmpty();
            assertThat(tree.executeAndCollect(0, context)).isEmpty();
        }

        @Test
        void shouldGiveEachChildItsOwnCopyOnFanOut() throws Exception {
            // Given
            int root = tree.addNode(new ImageLoader(), null);
            tree.addNode(new ZeroingPlugin(), root);
            int selector = tree.addNode(RangeSelector.of(0, 1), root);

            // When
            Map<Integer, Dataset> results = tree.executeAndCollect(2, context);

            // Then
            assertThat(results.get(selector).getData()).containsExactly(2150.0);
        }

        @Test
        void shouldWrapPluginFailureWithNodeAndTask() {
            tree.addNode(new ImageLoader());
            int failing = tree.addNode(PassThrough.with(PassThrough.FAIL_AT, 3));

            assertThatThrownBy(() -> tree.execute(3, context))
                    .isInstanceOfSatisfying(
                            PluginExecutionException.class,
                            e -> {
                                assertThat(e.getNodeId()).isEqualTo(failing);
                                assertThat(e.getTask()).isEqualTo(3);
                                assertThat(e.getCause())
                                        .isInstanceOf(IllegalStateException.class);
                            });
        }

        @Test
        void shouldRejectEmptyTree() {
            assertThatThrownBy(() -> tree.execute(0, context))
                    .isInstanceOf(TreeStructureException.class);
        }

        @Test
        void shouldRunSingleNodeOnExplicitInput() throws Exception {
            tree.addNode(new ImageLoader());
            int selector = tree.addNode(RangeSelector.of(0, 2));
            Dataset frame = Dataset.of(new int[] {2, 2}, new double[] {1, 2, 3, 4});

            PluginOutput output =
                    tree.executeSingle(selector, frame, Map.of(ProcessingTree.GLOBAL_INDEX, 0));

            assertThat(output.data().getData()).containsExactly(2.0, 3.0);
        }
    }

    @Nested
    class PreparationTest {

        @Test
        void shouldPrepareOnlyOnceForUnchangedTreeAndContext() throws Exception {
            // Given
            ImageLoader loader = new ImageLoader();
            tree.addNode(loader);

            // When
            tree.execute(0, context);
            tree.execute(1, context);

            // Then
            assertThat(loader.getPreExecuteCalls()).isEqualTo(1);
        }

        @Test
        void shouldPrepareAgainAfterChangeOrInvalidate() throws Exception {
            ImageLoader loader = new ImageLoader();
            tree.addNode(loader);
            tree.execute(0, context);

            tree.addNode(new PassThrough());
            tree.execute(0, context);
            tree.invalidate();
            tree.execute(0, context);
            tree.execute(0, TestPlugins.context(3));

            assertThat(loader.getPreExecuteCalls()).isEqualTo(4);
        }

        @Test
        void shouldReportPreparationFailureWithoutTask() {
            tree.addNode(new ImageLoader());
            int failing = tree.addNode(new FailingPreparation());

            assertThatThrownBy(() -> tree.prepare(context))
                    .isInstanceOfSatisfying(
                            PluginExecutionException.class,
                            e -> {
                                assertThat(e.getNodeId()).isEqualTo(failing);
                                assertThat(e.getTask()).isEqualTo(-1);
                            });
        }
    }

    @Nested
    class SnapshotTest {

        @Test
        void shouldRestoreIdsParentsAndParameters() throws Exception {
            // Given
            ProcessingTree original = TestPlugins.branchingTree();
            original.getNode(2).getPlugin().setParameterValue(BasePlugin.LABEL, "peak");
            TreeSnapshot snapshot = original.exportSnapshot();

            // When
            ProcessingTree restored = new ProcessingTree();
            restored.restore(snapshot, TestPlugins.registry());

            // Then
            assertThat(restored.getNodeIds()).containsExactly(0, 1, 2);
            assertThat(restored.getNode(2).getParentId()).isZero();
            assertThat(restored.getNode(2).getPlugin().getParameterValues())
                    .containsEntry(BasePlugin.LABEL, "peak")
                    .containsEntry(RangeSelector.START, 10);
            assertThat(restored.getActiveNodeId()).isEqualTo(2);
            assertThat(restored.addNode(new PassThrough(), 0)).isEqualTo(3);
        }

        @Test
        void shouldCopyWithIndependentPlugins() throws Exception {
            ProcessingTree original = TestPlugins.branchingTree();

            ProcessingTree copy = ProcessingTree.copyOf(original, TestPlugins.registry());
            copy.getNode(1).getPlugin().setParameterValue(RangeSelector.STOP, 6);

            assertThat(copy.getNode(1).getPlugin()).isNotSameAs(original.getNode(1).getPlugin());
            assertThat(original.getNode(1).getPlugin().getParameterValues())
                    .containsEntry(RangeSelector.STOP, 8);
        }

        @Test
        void shouldFailForUnregisteredPlugin() {
            TreeSnapshot snapshot = TestPlugins.branchingTree().exportSnapshot();

            assertThatThrownBy(() -> tree.restore(snapshot, new DefaultPluginRegistry()))
                    .isInstanceOf(PluginNotFoundException.class);
        }

        @Test
        void shouldRejectSnapshotWithTwoRoots() {
            String loader = ImageLoader.class.getName();
            TreeSnapshot snapshot =
                    TreeSnapshot.of(
                            List.of(
                                    new NodeRecord(0, null, loader, Map.of()),
                                    new NodeRecord(1, null, loader, Map.of())));

            assertThatThrownBy(() -> tree.restore(snapshot, TestPlugins.registry()))
                    .isInstanceOf(TreeStructureException.class)
                    .hasMessageContaining("more than one root");
        }

        @Test
        void shouldRejectSnapshotWithUnknownParent() {
            String loader = ImageLoader.class.getName();
            TreeSnapshot snapshot =
                    TreeSnapshot.of(
                            List.of(
                                    new NodeRecord(0, null, loader, Map.of()),
                                    new NodeRecord(1, 5, PassThrough.class.getName(), Map.of())));

            assertThatThrownBy(() -> tree.restore(snapshot, TestPlugins.registry()))
                    .isInstanceOf(TreeStructureException.class);
        }
    }

    /// Zeroes its input in place to expose shared buffers between siblings.
    static class ZeroingPlugin extends BasePlugin {

        ZeroingPlugin() {
            super("Zeroing", PluginType.PROCESSING, Rank.ANY, Rank.ANY);
        }

        @Override
        public PluginOutput execute(Dataset input, Map<String, Object> options) {
            int[] shape = input.getShape();
            for (int row = 0; row < shape[0]; row++) {
                for (int col = 0; col < shape[1]; col++) {
                    input.set(0, row, col);
                }
            }
            return new PluginOutput(input, options);
        }
    }

    static class FailingPreparation extends BasePlugin {

        FailingPreparation() {
            super("Failing preparation", PluginType.PROCESSING, Rank.ANY, Rank.ANY);
        }

        @Override
        public void preExecute(ProcessingContext context) throws Exception {
            throw new IllegalStateException("calibration file missing");
        }

        @Override
        public PluginOutput execute(Dataset input, Map<String, Object> options) {
            return new PluginOutput(input, options);
        }
    }
}
