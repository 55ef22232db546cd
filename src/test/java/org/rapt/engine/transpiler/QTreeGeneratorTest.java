package org.rapt.engine.transpiler;

import org.rapt.dsl.RaParser;
import org.rapt.dsl.TreeBuilder;
import org.rapt.engine.store.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QTreeGeneratorTest {

    private Schema schema;

    @BeforeEach
    void setUp() {
        schema = new Schema(Map.of(
                "alpha", List.of("a1", "a2", "a3"),
                "alpha_copy", List.of("a1", "a2", "a3"),
                "beta", List.of("b1", "b2"),
                "delta", List.of("a1", "d1")));
    }

    private String qtree(String input) {
        List<String> trees = new QTreeGenerator().generateAll(new TreeBuilder(schema).build(RaParser.parse(input)));
        assertEquals(1, trees.size());
        return trees.get(0);
    }

    @Test
    @DisplayName("A relation is a leaf")
    void testRelation() {
        assertEquals("\\Tree[.$alpha$ ]", qtree("alpha;"));
        assertEquals("\\Tree[.$alpha\\_copy$ ]", qtree("alpha_copy;"));
    }

    @Test
    @DisplayName("Unary operators label a branch with their parameters")
    void testUnaryOperators() {
        assertEquals("\\Tree[.$\\pi_{a1,\\,a2}$ [.$alpha$ ] ]", qtree("\\project_{a1, a2} alpha;"));
        assertEquals("\\Tree[.$\\sigma_{(a1 \\eq 'x')}$ [.$alpha$ ] ]", qtree("\\select_{a1 = 'x'} alpha;"));
        assertEquals("\\Tree[.$\\rho_{new\\_alpha(x,\\,y,\\,z)}$ [.$alpha$ ] ]",
                qtree("\\rename_{new_alpha(x, y, z)} alpha;"));
    }

    @Test
    @DisplayName("Nested unary operators nest branches")
    void testNesting() {
        assertEquals("\\Tree[.$\\pi_{a1}$ [.$\\sigma_{((a1 \\neq 'x') \\lor \\neg (a2 \\geq 3))}$ [.$alpha$ ] ] ]",
                qtree("\\project_{a1} \\select_{a1 <> 'x' or not a2 >= 3} alpha;"));
    }

    @Test
    @DisplayName("Assignment labels the branch with the new relation")
    void testAssignment() {
        assertEquals("\\Tree[.$new\\_alpha(x,\\,y,\\,z)$ [.$alpha$ ] ]", qtree("new_alpha(x, y, z) := alpha;"));
    }

    @Test
    @DisplayName("Definitions are leaves listing their attributes")
    void testDefinition() {
        assertEquals("\\Tree[.$omega(o1,\\,o2)$ ]", qtree("omega(o1, o2);"));
    }

    @Test
    @DisplayName("Binary operators have two children")
    void testBinaryOperators() {
        assertEquals("\\Tree[.$\\times$ [.$alpha$ ] [.$beta$ ] ]", qtree("alpha \\join beta;"));
        assertEquals("\\Tree[.$\\times_{(a1 \\eq b1)}$ [.$alpha$ ] [.$beta$ ] ]", qtree("alpha \\join_{a1 = b1} beta;"));
        assertEquals("\\Tree[.$\\bowtie$ [.$alpha$ ] [.$delta$ ] ]", qtree("alpha \\natural_join delta;"));
        assertEquals("\\Tree[.$\\leftouterjoin_{(a1 \\eq b1)}$ [.$alpha$ ] [.$beta$ ] ]",
                qtree("alpha \\left_outer_join_{a1 = b1} beta;"));
        assertEquals("\\Tree[.$\\cup$ [.$alpha$ ] [.$alpha\\_copy$ ] ]", qtree("alpha \\union alpha_copy;"));
        assertEquals("\\Tree[.$-$ [.$alpha$ ] [.$alpha\\_copy$ ] ]", qtree("alpha \\difference alpha_copy;"));
        assertEquals("\\Tree[.$\\cap$ [.$alpha$ ] [.$alpha\\_copy$ ] ]", qtree("alpha \\intersect alpha_copy;"));
    }

    @Test
    @DisplayName("Dependencies are single leaves")
    void testDependencies() {
        assertEquals("\\Tree[.$\\text{pk}_{a1,\\,a2}(alpha)$ ]", qtree("pk_{a1, a2} alpha;"));
        assertEquals("\\Tree[.$\\text{mvd}_{a1,\\,a2}(alpha)$ ]", qtree("mvd_{a1, a2} alpha;"));
        assertEquals("\\Tree[.$\\sigma_{(a1 \\eq 1)} (alpha) : a1 \\rightarrow a2$ ]",
                qtree("fd_{a1, a2} \\select_{a1 = 1} alpha;"));
        assertEquals("\\Tree[.$alpha[a1] \\equiv beta[b1]$ ]", qtree("inc=_{a1, b1} (alpha, beta);"));
        assertEquals("\\Tree[.$alpha[a1] \\subseteq beta[b1]$ ]", qtree("inc⊆_{a1, b1} (alpha, beta);"));
    }

    @Test
    @DisplayName("Each statement of a batch produces its own tree")
    void testBatch() {
        List<String> trees = new QTreeGenerator().generateAll(new TreeBuilder(schema).build(RaParser.parse("""
                omega(o1);
                \\project_{o1} omega;
                """)));

        assertEquals(List.of("\\Tree[.$omega(o1)$ ]", "\\Tree[.$\\pi_{o1}$ [.$omega$ ] ]"), trees);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "alpha;",
            "omega(o1, o2);",
            "\\select_{a1 = 'x' and not a2 <= 3} alpha;",
            "\\project_{a1, a3} alpha;",
            "\\rename_{new_alpha(x, y, z)} alpha;",
            "\\rename_{new_alpha} alpha;",
            "new_alpha(x, y, z) := alpha;",
            "alpha \\join beta;",
            "alpha \\join_{a1 = b1} beta;",
            "alpha \\natural_join delta;",
            "alpha \\full_outer_join_{a1 = b1} beta;",
            "alpha \\left_outer_join_{a1 = b1} beta;",
            "alpha \\right_outer_join_{a1 = b1} beta;",
            "alpha \\union alpha_copy;",
            "alpha \\difference alpha_copy;",
            "alpha \\intersect alpha_copy;",
            "\\project_{b1} \\select_{b2 = 'p'} ((alpha \\union alpha_copy) \\join beta);",
            "pk_{a1, a2} alpha;",
            "mvd_{a1, a2} alpha;",
            "fd_{a1, a2} \\select_{a1 = 1} alpha;",
            "inc=_{a1, b1} (alpha, beta);",
            "inc⊆_{a1, b1} (alpha, beta);"})
    @DisplayName("Every operator renders one well-formed tree")
    void testWellFormedTrees(String input) {
        String tree = qtree(input);

        assertTrue(tree.startsWith("\\Tree"), tree);
        assertBalanced(tree, '[', ']');
        assertBalanced(tree, '{', '}');
    }

    private static void assertBalanced(String tree, char open, char close) {
        int depth = 0;
        for (char c : tree.toCharArray()) {
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                assertTrue(depth >= 0, "unmatched " + close + " in " + tree);
            }
        }
        assertEquals(0, depth, "unclosed " + open + " in " + tree);
    }
}
