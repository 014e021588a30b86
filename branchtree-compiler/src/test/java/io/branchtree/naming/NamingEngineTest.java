package io.branchtree.naming;

import static org.junit.jupiter.api.Assertions.*;

import io.branchtree.SampleTrees;
import io.branchtree.paths.PathEnumerator;
import io.branchtree.paths.ScenarioPath;
import io.branchtree.tree.BranchTree;
import io.branchtree.tree.Node;
import io.branchtree.tree.NodeKind;
import io.branchtree.tree.TreeIndex;
import io.branchtree.tree.TreeParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NamingEngineTest {
  private final NamingEngine engine = new NamingEngine();

  @Test
  void normalizesLabels() {
    assertEquals("whenIdNotNull", NamingEngine.normalize(NodeKind.WHEN, "id is not null"));
    assertEquals("givenFullyWithdrawn", NamingEngine.normalize(NodeKind.GIVEN, "fully withdrawn"));
    assertEquals("itShouldReturnDepleted", NamingEngine.normalize(NodeKind.THEN, "return DEPLETED"));
    assertEquals("whenStartTimeInFuture", NamingEngine.normalize(NodeKind.WHEN, "start time is in the future"));
    assertEquals("whenAmount0", NamingEngine.normalize(NodeKind.WHEN, "amount > 0"));
    assertEquals("givenCafeOpen", NamingEngine.normalize(NodeKind.GIVEN, "café open"));
    assertEquals("when", NamingEngine.normalize(NodeKind.WHEN, "is the"));
  }

  @Test
  void typeNames() {
    assertEquals("WithdrawTest", NamingEngine.typeName("WithdrawTest"));
    assertEquals("VaultWithdraw", NamingEngine.typeName("Vault::withdraw"));
    assertEquals("T2Step", NamingEngine.typeName("2 step"));
    assertEquals("T", NamingEngine.typeName("::"));
  }

  @Test
  void namesSampleTree() throws Exception {
    var index = TreeIndex.of(TreeParser.parse(SampleTrees.WITHDRAW));
    var names = engine.assign(index);
    List<String> keys = new ArrayList<>();
    for (ScenarioPath path : new PathEnumerator(index)) keys.add(names.key(path));
    assertEquals(
        List.of(
            "whenIdNull/itShouldRevert",
            SampleTrees.DEPLETED_KEY,
            "whenIdNotNull/givenNotFullyWithdrawn/givenCanceled/itShouldReturnCanceled",
            "whenIdNotNull/givenNotFullyWithdrawn/givenNotCanceled/whenStartTimeInFuture/itShouldReturnPending",
            "whenIdNotNull/givenNotFullyWithdrawn/givenNotCanceled/whenStartTimeNotInFuture/itShouldReturnStreaming"),
        keys);
    assertEquals("givenFullyWithdrawn", names.identifier(3));
  }

  @Test
  void siblingCollisionsGetTheirRank() {
    var index =
        TreeIndex.of(
            BranchTree.of(
                "T",
                Node.when("id is null", Node.it("revert")),
                Node.when("id null", Node.it("pass"))));
    var names = engine.assign(index);
    assertEquals("whenIdNull_1", names.segment(0));
    assertEquals("whenIdNull_2", names.segment(2));
    assertEquals("whenIdNull_1", names.identifier(0));
    assertEquals("whenIdNull_2", names.identifier(2));
  }

  @Test
  void repeatedConditionsAreQualifiedByTheirParent() {
    var index =
        TreeIndex.of(
            BranchTree.of(
                "T",
                Node.when(
                    "owner",
                    Node.given("paused", Node.it("revert")),
                    Node.given("active", Node.it("pass"))),
                Node.when(
                    "stranger",
                    Node.given("paused", Node.it("revert")),
                    Node.given("active", Node.it("revert")))));
    var names = engine.assign(index);
    // preorder: 0 owner, 1 paused, 3 active, 5 stranger, 6 paused, 8 active
    assertEquals("givenPaused", names.segment(1));
    assertEquals("givenPaused", names.segment(6));
    assertEquals("whenOwnerGivenPaused", names.identifier(1));
    assertEquals("whenOwnerGivenActive", names.identifier(3));
    assertEquals("whenStrangerGivenPaused", names.identifier(6));
    assertEquals("whenStrangerGivenActive", names.identifier(8));
  }

  @Test
  void repeatsInDifferentOrderAreStillQualifiedByParent() {
    var index =
        TreeIndex.of(
            BranchTree.of(
                "T",
                Node.when(
                    "owner",
                    Node.given("paused", Node.it("revert")),
                    Node.given("active", Node.it("pass"))),
                Node.when(
                    "stranger",
                    Node.given("active", Node.it("revert")),
                    Node.given("paused", Node.it("revert")))));
    var names = engine.assign(index);
    assertEquals("whenOwnerGivenPaused", names.identifier(1));
    assertEquals("whenOwnerGivenActive", names.identifier(3));
    assertEquals("whenStrangerGivenActive", names.identifier(6));
    assertEquals("whenStrangerGivenPaused", names.identifier(8));
  }

  @Test
  void rankedSegmentsNeverMeetAnotherSiblingName() {
    var index =
        TreeIndex.of(
            BranchTree.of(
                "T", Node.when("x", Node.it("fail x"), Node.it("fail-x"), Node.it("fail x 2"))));
    var names = engine.assign(index);
    assertEquals(
        List.of("whenX/itShouldFailX_1", "whenX/itShouldFailX_2", "whenX/itShouldFailX2"),
        keys(index, names));
    assertEquals("itShouldFailX_2", names.identifier(2));
    assertEquals("itShouldFailX2", names.identifier(3));
  }

  @Test
  void movingAnUnrelatedSiblingKeepsRankedKeys() {
    var before =
        BranchTree.of(
            "T",
            Node.when("x", Node.it("a")),
            Node.when("y", Node.it("b")),
            Node.when("x!", Node.it("c")));
    var after =
        BranchTree.of(
            "T",
            Node.when("y", Node.it("b")),
            Node.when("x", Node.it("a")),
            Node.when("x!", Node.it("c")));
    var beforeIndex = TreeIndex.of(before);
    var afterIndex = TreeIndex.of(after);
    var beforeKeys = keys(beforeIndex, engine.assign(beforeIndex));
    assertEquals(List.of("whenX_1/itShouldA", "whenY/itShouldB", "whenX_2/itShouldC"), beforeKeys);
    assertEquals(
        Set.copyOf(beforeKeys), Set.copyOf(keys(afterIndex, engine.assign(afterIndex))));
  }

  @Test
  void nestedRepeatOfATopLevelNameIsQualified() {
    var index =
        TreeIndex.of(
            BranchTree.of(
                "T",
                Node.when(
                    "owner",
                    Node.when("paused", Node.it("revert")),
                    Node.it("pass")),
                Node.when("paused", Node.it("revert"))));
    var names = engine.assign(index);
    // preorder: 0 owner, 1 paused, 2 revert, 3 pass, 4 paused
    assertEquals("whenOwnerWhenPaused", names.identifier(1));
    assertEquals("whenPaused", names.identifier(4));
  }

  private static List<String> keys(TreeIndex index, Names names) {
    List<String> keys = new ArrayList<>();
    for (ScenarioPath path : new PathEnumerator(index)) keys.add(names.key(path));
    return keys;
  }

  @Test
  void identifiersAlongPathEndWithLeafSegment() throws Exception {
    var index = TreeIndex.of(TreeParser.parse(SampleTrees.WITHDRAW));
    var names = engine.assign(index);
    var depleted = new PathEnumerator(index).stream().skip(1).findFirst().orElseThrow();
    assertEquals(
        List.of("whenIdNotNull", "givenFullyWithdrawn", "itShouldReturnDepleted"),
        names.identifiers(depleted));
  }
}
