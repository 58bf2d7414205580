package io.intellixity.sqlbuilder.util;

import java.util.ArrayList;
import java.util.List;

/** Escaping of identifiers so they survive placeholder compilation ('$' is the token marker). */
public final class Escapes {
  private Escapes() {}

  public static String escape(String ident) {
    if (ident == null || ident.indexOf('$') < 0) return ident;
    return ident.replace("$", "$$");
  }

  public static List<String> escapeAll(String... idents) {
    if (idents == null || idents.length == 0) return List.of();
    List<String> out = new ArrayList<>(idents.length);
    for (String s : idents) out.add(escape(s));
    return List.copyOf(out);
  }
}
