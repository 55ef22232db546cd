package org.rapt.engine.transpiler;

import org.rapt.dsl.RaParser;
import org.rapt.dsl.TreeBuilder;
import org.rapt.engine.plan.PrimaryKeyNode;
import org.rapt.engine.plan.ProjectNode;
import org.rapt.engine.plan.RaNode;
import org.rapt.engine.plan.RelationNode;
import org.rapt.engine.plan.TranslationException;
import org.rapt.engine.store.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLGeneratorTest {

    private Schema schema;

    @BeforeEach
    void setUp() {
        schema = new Schema(Map.of(
                "alpha", List.of("a1", "a2", "a3"),
                "beta", List.of("b1", "b2"),
                "gamma", List.of("a1", "a2", "a3"),
                "delta", List.of("a1", "d1")));
    }

    private List<RaNode> build(String input) {
        return new TreeBuilder(schema).build(RaParser.parse(input));
    }

    private String bag(String input) {
        List<String> sql = new SQLGenerator().generateAll(build(input));
        assertEquals(1, sql.size());
        return sql.get(0);
    }

    private String set(String input) {
        List<String> sql = new SetSemanticsSQLGenerator().generateAll(build(input));
        assertEquals(1, sql.size());
        return sql.get(0);
    }

    @Nested
    @DisplayName("Bag semantics")
    class BagSemantics {

        @Test
        @DisplayName("Relation reference selects every attribute")
        void testRelation() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha", bag("alpha;"));
        }

        @Test
        @DisplayName("Project replaces the select list")
        void testProject() {
            assertEquals("SELECT alpha.a2, alpha.a1 FROM alpha", bag("\\project_{a2, a1} alpha;"));
            assertEquals("SELECT alpha.a1 FROM alpha", bag("\\project_{a1} \\project_{a1, a2} alpha;"));
        }

        @Test
        @DisplayName("Select adds a WHERE clause")
        void testSelect() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha WHERE (a1 = 'x')",
                    bag("\\select_{a1 = \"x\"} alpha;"));
            assertEquals("SELECT alpha.a1 FROM alpha WHERE (a1 <> 'x')", bag("\\project_{a1} \\select_{a1 != 'x'} alpha;"));
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha WHERE (a2 = 'it''s')",
                    bag("\\select_{a2 = 'it''s'} alpha;"));
        }

        @Test
        @DisplayName("Nested selects combine their conditions")
        void testNestedSelect() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha WHERE ((a2 = 'b')) AND ((a1 = '1'))",
                    bag("\\select_{a1 = '1'} \\select_{a2 = 'b'} alpha;"));
        }

        @Test
        @DisplayName("Conditions are fully parenthesized")
        void testConditionPrecedence() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                            + "WHERE ((a1 = '1') OR ((a2 = '2') AND NOT (a3 = '3')))",
                    bag("\\select_{a1 = '1' or a2 = '2' and not a3 = '3'} alpha;"));
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha WHERE a1 IS NOT NULL",
                    bag("\\select_{defined(a1)} alpha;"));
        }

        @Test
        @DisplayName("Rename wraps the child in a derived table")
        void testRename() {
            assertEquals("SELECT apex.x, apex.y, apex.z FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha) "
                    + "AS apex(x, y, z)", bag("\\rename_{apex(x, y, z)} alpha;"));
        }

        @Test
        @DisplayName("Set operations keep duplicates")
        void testSetOperations() {
            assertEquals("SELECT a1, a2, a3 FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                    + "UNION ALL SELECT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1", bag("alpha \\union gamma;"));
            assertEquals("SELECT a1, a2, a3 FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                    + "EXCEPT ALL SELECT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1", bag("alpha \\difference gamma;"));
            assertEquals("SELECT a1 FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                            + "INTERSECT ALL SELECT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1",
                    bag("\\project_{a1} (alpha \\intersect gamma);"));
        }

        @Test
        @DisplayName("Synthetic aliases are unique within a statement")
        void testSyntheticAliases() {
            assertEquals("SELECT a1, a2, a3 FROM (SELECT a1, a2, a3 FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                    + "UNION ALL SELECT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1 "
                    + "UNION ALL SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha) AS _2",
                    bag("alpha \\union gamma \\union alpha;"));
        }
    }

    @Nested
    @DisplayName("Joins")
    class Joins {

        @Test
        @DisplayName("Relations are joined directly")
        void testCrossJoin() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha CROSS JOIN beta",
                    bag("alpha \\join beta;"));
        }

        @Test
        @DisplayName("Other operands become derived tables named after their relation")
        void testDerivedOperand() {
            assertEquals("SELECT alpha.a1, beta.b1, beta.b2 FROM (SELECT alpha.a1 FROM alpha) AS alpha CROSS JOIN beta",
                    bag("\\project_{a1} alpha \\join beta;"));
        }

        @Test
        @DisplayName("Joins chain left to right and parenthesize a right-hand join")
        void testNestedJoins() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2, delta.a1, delta.d1 "
                    + "FROM alpha CROSS JOIN beta CROSS JOIN delta", bag("alpha \\join beta \\join delta;"));
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2, delta.a1, delta.d1 "
                    + "FROM alpha CROSS JOIN (beta CROSS JOIN delta)", bag("alpha \\join (beta \\join delta);"));
        }

        @Test
        @DisplayName("Conditional joins emit ON")
        void testConditionalJoins() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha JOIN beta ON (a1 = b1)",
                    bag("alpha \\join_{a1 = b1} beta;"));
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha JOIN beta ON (a1 = b1)",
                    bag("alpha \\theta_join_{a1 = b1} beta;"));
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 "
                    + "FROM alpha LEFT OUTER JOIN beta ON (a1 = b1)", bag("alpha \\left_outer_join_{a1 = b1} beta;"));
        }

        @Test
        @DisplayName("Natural join lists the shared attribute once")
        void testNaturalJoin() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, delta.d1 FROM alpha NATURAL JOIN delta",
                    bag("alpha \\natural_join delta;"));
        }

        @Test
        @DisplayName("Select over a join filters the joined rows")
        void testSelectOverJoin() {
            assertEquals("SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha CROSS JOIN beta "
                    + "WHERE (a1 = b1)", bag("\\select_{a1 = b1} (alpha \\join beta);"));
        }

        @Test
        @DisplayName("An unnamed derived operand is referenced through a column list")
        void testUnnamedDerivedOperand() {
            assertEquals("SELECT _1.a1, _1.a2, _1.a3, _1.b1, _1.b2, delta.a1, delta.d1 FROM (SELECT alpha.a1, "
                    + "alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha CROSS JOIN beta WHERE (a1 = b1)) "
                    + "AS _1(a1, a2, a3, b1, b2) CROSS JOIN delta",
                    bag("(\\select_{a1 = b1} (alpha \\join beta)) \\join delta;"));
            assertEquals("SELECT _1.a1, _1.b1, delta.a1, delta.d1 FROM (SELECT alpha.a1, beta.b1 "
                    + "FROM alpha CROSS JOIN beta) AS _1(a1, b1) CROSS JOIN delta",
                    bag("(\\project_{a1, b1} (alpha \\join beta)) \\join delta;"));
        }

        @Test
        @DisplayName("Join conditions reference a derived operand through its alias")
        void testDerivedOperandCondition() {
            assertEquals("SELECT _1.a1, _1.a2, _1.a3, _1.b1, _1.b2, delta.a1, delta.d1 FROM (SELECT alpha.a1, "
                    + "alpha.a2, alpha.a3, beta.b1, beta.b2 FROM alpha CROSS JOIN beta WHERE (a1 = b1)) "
                    + "AS _1(a1, a2, a3, b1, b2) JOIN delta ON ((_1.a1 = delta.a1) AND (_1.b2 = 'p'))",
                    bag("(\\select_{a1 = b1} (alpha \\join beta)) \\join_{alpha.a1 = delta.a1 and b2 = 'p'} delta;"));
        }

        @Test
        @DisplayName("Operators above the join keep the derived references")
        void testReferencesPropagate() {
            assertEquals("SELECT _1.b1, delta.d1 FROM (SELECT alpha.a1, alpha.a2, alpha.a3, beta.b1, beta.b2 "
                    + "FROM alpha CROSS JOIN beta WHERE (a1 = b1)) AS _1(a1, a2, a3, b1, b2) CROSS JOIN delta "
                    + "WHERE (_1.b2 = 'p')",
                    bag("\\project_{b1, d1} \\select_{b2 = 'p'} ((\\select_{a1 = b1} (alpha \\join beta)) \\join delta);"));
        }

        @Test
        @DisplayName("Repeated attribute names get qualified column names")
        void testRepeatedNames() {
            assertEquals("SELECT _1.alpha_a1, _1.delta_a1, beta.b1, beta.b2 FROM (SELECT alpha.a1, delta.a1 "
                    + "FROM alpha CROSS JOIN delta) AS _1(alpha_a1, delta_a1) CROSS JOIN beta",
                    bag("\\project_{alpha.a1, delta.a1} (alpha \\join delta) \\join beta;"));
        }

        @Test
        @DisplayName("Natural join with a derived operand drops the shared column once")
        void testNaturalJoinDerivedOperand() {
            assertEquals("SELECT _1.a1, _1.b1, delta.d1 FROM (SELECT alpha.a1, beta.b1 FROM alpha CROSS JOIN beta) "
                    + "AS _1(a1, b1) NATURAL JOIN delta",
                    bag("(\\project_{a1, b1} (alpha \\join beta)) \\natural_join delta;"));
        }

        @Test
        @DisplayName("A set operation side is inlined with its alias")
        void testSetOperationOperand() {
            assertEquals("SELECT a1, a2, a3, beta.b1, beta.b2 FROM (SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                    + "UNION ALL SELECT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1 CROSS JOIN beta",
                    bag("(alpha \\union gamma) \\join beta;"));
        }
    }

    @Nested
    @DisplayName("Set semantics")
    class SetSemantics {

        @Test
        @DisplayName("Every select is distinct")
        void testDistinct() {
            assertEquals("SELECT DISTINCT alpha.a1 FROM alpha", set("\\project_{a1} alpha;"));
            assertEquals("SELECT DISTINCT alpha.a1, beta.b1, beta.b2 FROM (SELECT DISTINCT alpha.a1 FROM alpha) "
                    + "AS alpha CROSS JOIN beta", set("\\project_{a1} alpha \\join beta;"));
        }

        @Test
        @DisplayName("Set operations drop ALL")
        void testSetOperations() {
            assertEquals("SELECT DISTINCT a1, a2, a3 FROM (SELECT DISTINCT alpha.a1, alpha.a2, alpha.a3 FROM alpha "
                    + "UNION SELECT DISTINCT gamma.a1, gamma.a2, gamma.a3 FROM gamma) AS _1", set("alpha \\union gamma;"));
            assertTrue(set("alpha \\difference gamma;").contains(" EXCEPT SELECT "));
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Assignment creates a temporary table")
        void testAssignment() {
            List<String> sql = new SQLGenerator().generateAll(build("""
                    alpha_prime(x, y, z) := alpha;
                    \\project_{x} alpha_prime;
                    """));

            assertEquals(List.of(
                    "CREATE TEMPORARY TABLE alpha_prime(x, y, z) AS SELECT alpha.a1, alpha.a2, alpha.a3 FROM alpha",
                    "SELECT alpha_prime.x FROM alpha_prime"), sql);
        }

        @Test
        @DisplayName("Primary keys alter the table")
        void testPrimaryKey() {
            assertEquals("ALTER TABLE alpha ADD PRIMARY KEY (a1, a2)", bag("pk_{a1, a2} alpha;"));
        }

        @Test
        @DisplayName("Statements without an SQL form are skipped")
        void testSkipped() {
            List<String> sql = new SQLGenerator().generateAll(build("""
                    omega(o1, o2);
                    fd_{a1, a2} alpha;
                    mvd_{a1, a2} alpha;
                    inc=_{a1, b1} (alpha, beta);
                    \\project_{o1} omega;
                    """));

            assertEquals(List.of("SELECT omega.o1 FROM omega"), sql);
            assertTrue(new SQLGenerator().generate(build("fd_{b1, b2} beta;").get(0)).isEmpty());
        }

        @Test
        @DisplayName("A constraint cannot be used as a subquery")
        void testConstraintAsSubquery() {
            PrimaryKeyNode key = new PrimaryKeyNode(RelationNode.of("alpha", schema), List.of("a1"));
            ProjectNode project = ProjectNode.of(key, List.of("a1"));

            TranslationException e = assertThrows(TranslationException.class,
                    () -> new SQLGenerator().generate(project));
            assertFalse(e.isUserError());
        }
    }
}
