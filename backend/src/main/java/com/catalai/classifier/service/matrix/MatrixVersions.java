package com.catalai.classifier.service.matrix;

import java.util.Comparator;

/** Dotted {@code major.minor} version identifiers. */
public final class MatrixVersions {

  public static final String INITIAL = "1.0";

  /** Orders versions numerically, so "1.10" follows "1.9". */
  public static final Comparator<String> ORDER =
      Comparator.<String>comparingInt(v -> parse(v)[0]).thenComparingInt(v -> parse(v)[1]);

  private MatrixVersions() {}

  public static String next(String current, boolean majorBump) {
    if (current == null) {
      return INITIAL;
    }
    int[] parts = parse(current);
    return majorBump ? (parts[0] + 1) + ".0" : parts[0] + "." + (parts[1] + 1);
  }

  public static boolean isValid(String version) {
    return version != null && version.matches("\\d+\\.\\d+");
  }

  static int[] parse(String version) {
    if (!isValid(version)) {
      throw new IllegalArgumentException("Invalid matrix version: " + version);
    }
    String[] parts = version.split("\\.");
    return new int[] {Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
  }
}
