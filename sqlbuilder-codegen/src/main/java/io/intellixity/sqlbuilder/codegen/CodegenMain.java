package io.intellixity.sqlbuilder.codegen;

import java.nio.file.*;
import java.util.*;

/**
 * CLI:
 *   CodegenMain <descriptorDir> <generatedOutDir> [resourcesOutDir]
 */
public final class CodegenMain {
  private CodegenMain() {}

  public static void main(String[] args) throws Exception {
    int code = run(args);
    if (code != 0) System.exit(code);
  }

  static int run(String[] args) throws Exception {
    if (args.length < 2 || args.length > 3) {
      System.err.println("Usage: CodegenMain <descriptorDir> <generatedOutDir> [resourcesOutDir]");
      return 2;
    }

    Path descriptorDir = Paths.get(args[0]);
    Path outDir = Paths.get(args[1]);

    List<RowMapperDescriptor> descriptors = new DescriptorLoader().loadDir(descriptorDir);

    RowMapperGenerator mapperGen = new RowMapperGenerator();
    for (RowMapperDescriptor d : descriptors) {
      mapperGen.generate(d, outDir);
    }
    RowMapperProviderGenerator providerGen = new RowMapperProviderGenerator(descriptors);
    providerGen.generate(outDir);
    if (args.length == 3) providerGen.writeFactories(Paths.get(args[2]));

    System.out.println("Generated: " + descriptors.size() + " row mappers into: " + outDir);
    return 0;
  }
}
