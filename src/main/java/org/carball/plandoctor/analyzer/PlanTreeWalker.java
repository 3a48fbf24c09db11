package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.model.plan.PlanNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Depth-first pre-order traversal of a plan tree: a node is visited before its children,
 * and children are visited in the order the engine reported them.
 */
public final class PlanTreeWalker {

    private PlanTreeWalker() {
        // Utility class - prevent instantiation
    }

    public static void walk(PlanNode root, Consumer<PlanNode> visitor) {
        traverse(root, node -> {
            visitor.accept(node);
            return false;
        });
    }

    /**
     * Returns true as soon as one node matches; the rest of the tree is not visited.
     */
    public static boolean anyMatch(PlanNode root, Predicate<PlanNode> predicate) {
        return traverse(root, predicate);
    }

    public static int count(PlanNode root) {
        int[] count = {0};
        walk(root, node -> count[0]++);
        return count[0];
    }

    private static boolean traverse(PlanNode root, Predicate<PlanNode> stopAt) {
        if (root == null) {
            return false;
        }

        // Explicit stack so that very deep plans cannot overflow the call stack
        Deque<PlanNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            PlanNode node = stack.pop();
            if (stopAt.test(node)) {
                return true;
            }

            List<PlanNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                PlanNode child = children.get(i);
                if (child != null) {
                    stack.push(child);
                }
            }
        }
        return false;
    }
}
