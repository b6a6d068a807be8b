package callfsm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a scenario file into {@link Scenario}s.
 *
 * <p>Lines starting with {@code //} and blank lines are ignored. The others
 * are stripped, and may spell any character as a backslash, {@code u} and
 * four hex digits (the epsilon label is {@code 03b5}).
 */
public class ScenarioFileReader {

  private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader lines;
  private final String source;
  private int lineNumber = 0;

  public ScenarioFileReader(Reader reader, String source) {
    this.lines = new BufferedReader(reader);
    this.source = source;
  }

  /**
   * Open a scenario file.
   *
   * @param path file to read
   */
  public static ScenarioFileReader open(Path path) throws IOException {
    return new ScenarioFileReader(Files.newBufferedReader(path, StandardCharsets.UTF_8), path.toString());
  }

  /**
   * Next scenario in the file.
   *
   * @return scenario, or {@code null} once the file is exhausted
   * @throws IOException if the file ends in the middle of a scenario
   */
  public Scenario nextScenario() throws IOException {
    final String automaton = nextContentLine();
    if (automaton == null) {
      return null;
    }
    final int firstLine = lineNumber;

    final String events = nextContentLine();
    final String expected = nextContentLine();
    if (events == null || expected == null) {
      throw new IOException("incomplete scenario at " + source + ":" + firstLine);
    }
    return new Scenario(automaton, events, expected, source, firstLine);
  }

  /**
   * Hand every remaining scenario to an action, then close the file.
   *
   * @param action action to run on each scenario
   */
  public void forEachScenario(Consumer<? super Scenario> action) throws IOException {
    try (BufferedReader in = lines) {
      for (Scenario scenario = nextScenario(); scenario != null; scenario = nextScenario()) {
        action.accept(scenario);
      }
    }
  }

  private String nextContentLine() throws IOException {
    for (String line = lines.readLine(); line != null; line = lines.readLine()) {
      lineNumber++;
      if (!line.isBlank() && !line.startsWith("//")) {
        return expandEscapes(line.strip());
      }
    }
    return null;
  }

  private static String expandEscapes(String line) {
    return UNICODE_ESCAPE
      .matcher(line)
      .replaceAll(match -> Matcher.quoteReplacement(Character.toString((char) Integer.parseInt(match.group(1), 16))));
  }
}
