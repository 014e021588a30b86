package io.branchtree.tree;

import static org.junit.jupiter.api.Assertions.*;

import io.branchtree.SampleTrees;
import org.junit.jupiter.api.Test;

class TreeParserTest {

  @Test
  void parsesBoxDrawingTree() throws Exception {
    var tree = TreeParser.parse(SampleTrees.WITHDRAW);
    assertEquals("WithdrawTest", tree.subject());
    assertEquals(1, tree.line());
    assertEquals(2, tree.children().size());

    var idNull = tree.children().get(0);
    assertEquals(NodeKind.WHEN, idNull.kind());
    assertEquals("id is null", idNull.label());
    assertEquals(2, idNull.line());
    assertEquals(Node.it("revert"), idNull.children().get(0));

    var withdrawn = tree.children().get(1).children().get(0);
    assertEquals(NodeKind.GIVEN, withdrawn.kind());
    assertEquals("fully withdrawn", withdrawn.label());
    assertEquals(5, withdrawn.line());
    assertEquals("return DEPLETED", withdrawn.children().get(0).label());
  }

  @Test
  void connectorStylesParseToTheSameTree() throws Exception {
    var box = TreeParser.parse(SampleTrees.WITHDRAW);
    assertEquals(box, TreeParser.parse(SampleTrees.WITHDRAW_ASCII));
    assertEquals(box, TreeParser.parse(SampleTrees.WITHDRAW_PLAIN));
  }

  @Test
  void acceptsCrlfTabsBlankAndSpacerLines() throws Exception {
    var text =
        "\r\n"
            + "Vault\r\n"
            + "\twhen amount is zero\r\n"
            + "\t\tit should revert\r\n"
            + "│\r\n"
            + "\twhen amount is positive   \r\n"
            + "\r\n"
            + "\t\tit should transfer\r\n";
    var tree = TreeParser.parse(text.replace("\r\n", "\n"));
    assertEquals(
        BranchTree.of(
            "Vault",
            Node.when("amount is zero", Node.it("revert")),
            Node.when("amount is positive", Node.it("transfer"))),
        tree);
    assertEquals(2, tree.line());
  }

  @Test
  void keywordsAreCaseInsensitiveAndWhitespaceIsCollapsed() throws Exception {
    var tree = TreeParser.parse("T\n└── When   ID   is null\n    └── It Should revert\n");
    var node = tree.children().get(0);
    assertEquals(NodeKind.WHEN, node.kind());
    assertEquals("ID is null", node.label());
    assertEquals(NodeKind.THEN, node.children().get(0).kind());
    assertEquals("when ID is null", node.text());
  }

  @Test
  void leavesMayHaveChildrenUntilValidation() throws Exception {
    var tree = TreeParser.parse("T\n└── it should pass\n    └── when later\n");
    var leaf = tree.children().get(0);
    assertTrue(leaf.isLeaf());
    assertEquals(1, leaf.children().size());
  }

  @Test
  void rejectsEmptyInput() {
    var e = assertThrows(MalformedTreeException.class, () -> TreeParser.parse("  \n\n"));
    assertEquals(0, e.line());
  }

  @Test
  void rejectsIndentedRoot() {
    var e =
        assertThrows(
            MalformedTreeException.class,
            () -> TreeParser.parse("├── when a\n│   └── it should b\n"));
    assertEquals(1, e.line());
  }

  @Test
  void rejectsConditionAsRoot() {
    assertThrows(
        MalformedTreeException.class, () -> TreeParser.parse("when a\n└── it should b\n"));
  }

  @Test
  void outcomeAsRootIsDangling() {
    assertThrows(DanglingLeafException.class, () -> TreeParser.parse("it should pass\n"));
  }

  @Test
  void rejectsUnknownKeyword() {
    var e =
        assertThrows(
            MalformedTreeException.class,
            () -> TreeParser.parse("T\n├── when a\n│   └── it should b\n└── if c\n"));
    assertEquals(4, e.line());
    assertTrue(e.getMessage().startsWith("line 4: "), e.getMessage());
  }

  @Test
  void rejectsKeywordWithoutLabel() {
    var e =
        assertThrows(
            MalformedTreeException.class, () -> TreeParser.parse("T\n└── when\n    └── it should b\n"));
    assertEquals(2, e.line());
  }

  @Test
  void keywordMustBeAWholeWord() {
    assertThrows(
        MalformedTreeException.class, () -> TreeParser.parse("T\n└── whenever a\n"));
  }

  @Test
  void rejectsSecondRoot() {
    var e =
        assertThrows(
            MalformedTreeException.class,
            () -> TreeParser.parse("T\n└── when a\n    └── it should b\nU\n"));
    assertEquals(4, e.line());
  }

  @Test
  void rejectsColumnOffTheIndentationGrid() {
    var e =
        assertThrows(
            MalformedTreeException.class,
            () -> TreeParser.parse("T\n    when a\n      it should b\n"));
    assertEquals(3, e.line());
  }

  @Test
  void rejectsDepthJump() {
    var e =
        assertThrows(
            MalformedTreeException.class,
            () -> TreeParser.parse("T\n  when a\n      it should b\n"));
    assertEquals(3, e.line());
  }
}
