package com.gentoro.graphguard.utility;

import com.gentoro.graphguard.exception.ExceptionUtil;
import java.io.PrintStream;
import java.util.Objects;

/** User-facing console output. Log output goes to stderr through Logback instead. */
public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String yellow = "\u001B[33m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  private final PrintStream out;
  private final boolean colors;

  public StdoutUtility(PrintStream out, boolean colors) {
    this.out = Objects.requireNonNull(out, "out");
    this.colors = colors;
  }

  /** Console on {@code System.out}, colored only when attached to a terminal. */
  public static StdoutUtility system() {
    return new StdoutUtility(System.out, System.console() != null);
  }

  public PrintStream stream() {
    return out;
  }

  public void printNewLine(String message) {
    out.printf("%s%n", message);
  }

  public void printSuccessLine(String message) {
    for (String line : message.split("\n")) {
      out.printf("%s%n", paint(green, line));
    }
  }

  public void printWarningLine(String message) {
    for (String line : message.split("\n")) {
      out.printf("%s%n", paint(yellow, line));
    }
  }

  public void printError(String message, Throwable cause) {
    out.printf("%s%n", paint(red, "Error: " + message));
    if (cause != null) {
      for (String line : ExceptionUtil.formatCompactStackTrace(cause).split(" > ")) {
        out.printf("  %s%n", paint(red, line));
      }
    }
    out.flush();
  }

  private String paint(String color, String text) {
    return colors ? color + text + reset : text;
  }
}
