package io.branchtree;

import io.branchtree.reconcile.DriftReport;
import io.branchtree.reconcile.Reconciliation;
import io.branchtree.tree.BranchTree;

/**
 * Everything one compilation produces for one tree.
 *
 * @param tree validated tree
 * @param canonicalTree canonical rendering of the tree text
 * @param reconciliation merge of the fresh scaffold with the previous artifact
 * @param output source text of the merged artifact
 * @param fileName suggested artifact file name for the target
 * @param report drift between stored state and this result
 */
public record CompilationResult(
    BranchTree tree,
    String canonicalTree,
    Reconciliation reconciliation,
    String output,
    String fileName,
    DriftReport report) {}
