package io.intellixity.sqlbuilder.codegen.internal;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public final class JavaFiles {
  private JavaFiles() {}

  public static Path filePath(Path outDir, String pkg, String simpleName) {
    Path dir = (pkg == null || pkg.isBlank()) ? outDir : outDir.resolve(pkg.replace('.', '/'));
    return dir.resolve(simpleName + ".java");
  }

  public static IndentedWriter open(Path outDir, String pkg, String simpleName) throws IOException {
    Path file = filePath(outDir, pkg, simpleName);
    Files.createDirectories(file.getParent());
    return new IndentedWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  public static String pkg(String fqcn) {
    if (fqcn == null) return "";
    int i = fqcn.lastIndexOf('.');
    return i < 0 ? "" : fqcn.substring(0, i);
  }

  public static String simple(String fqcn) {
    if (fqcn == null) return "";
    int i = fqcn.lastIndexOf('.');
    return i < 0 ? fqcn : fqcn.substring(i + 1);
  }

  /** Java string literal for {@code s}, quotes included. */
  public static String literal(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  /** Line writer with two-space indentation and brace-block helpers. */
  public static final class IndentedWriter implements Closeable {
    private final Writer out;
    private int depth;

    IndentedWriter(Writer out) {
      this.out = out;
    }

    public void println(String line) throws IOException {
      out.write("  ".repeat(depth));
      out.write(line);
      out.write('\n');
    }

    public void blank() throws IOException {
      out.write('\n');
    }

    /** Write {@code header} followed by an opening brace and indent one level. */
    public void block(String header) throws IOException {
      println(header + " {");
      depth++;
    }

    /** Close the innermost block. */
    public void end() throws IOException {
      depth = Math.max(0, depth - 1);
      println("}");
    }

    @Override
    public void close() throws IOException {
      out.close();
    }
  }
}
