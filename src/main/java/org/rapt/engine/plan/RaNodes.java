package org.rapt.engine.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversals over node trees.
 */
public final class RaNodes {

    private RaNodes() {
    }

    /**
     * Children before parents, left before right.
     */
    public static List<RaNode> postOrder(RaNode root) {
        List<RaNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    public static int depth(RaNode root) {
        int deepest = 0;
        for (RaNode child : root.children()) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    private static void collect(RaNode node, List<RaNode> nodes) {
        for (RaNode child : node.children()) {
            collect(child, nodes);
        }
        nodes.add(node);
    }
}
