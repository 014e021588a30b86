package io.branchtree.codegen;

/**
 * Target-specific settings for rendering an artifact.
 *
 * @param packageName Java package of generated test classes, empty for the default package
 * @param sourceName name of the tree file, quoted in the header comment
 * @param solidityPragma version pragma of generated Solidity tests
 * @param solidityTestImport import path of the forge-std {@code Test} contract
 */
public record EmitOptions(
    String packageName, String sourceName, String solidityPragma, String solidityTestImport) {

  public static EmitOptions defaults() {
    return new EmitOptions("", "tree", "^0.8.0", "forge-std/Test.sol");
  }

  public EmitOptions withSourceName(String name) {
    return new EmitOptions(packageName, name, solidityPragma, solidityTestImport);
  }

  public EmitOptions withPackageName(String name) {
    return new EmitOptions(name == null ? "" : name, sourceName, solidityPragma, solidityTestImport);
  }
}
