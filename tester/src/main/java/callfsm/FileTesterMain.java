package callfsm;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;

/**
 * Processes {@code .txt} files that encode automaton scenarios.
 *
 * <p>Every scenario is three lines: the automaton, the events to feed to it
 * and the expected output ({@code <accepted> <merged state count>}, or
 * {@code error} if the automaton description is meant to be rejected).
 */
class FileTesterMain {

  static int successes = 0;
  static int failures = 0;

  public static void main(String[] testFiles) throws IOException {

    // Failures go to stderr as they happen, passes are only counted
    final var console = new ScenarioListener() {
      @Override
      public void passed(Scenario scenario) {
        successes++;
      }

      @Override
      public void rejected(Scenario scenario, IllegalArgumentException cause) {
        System.err.println(scenario.location() + ": cannot parse scenario (" + cause.getMessage() + ")");
        failures++;
      }

      @Override
      public void mismatched(Scenario scenario, String actual) {
        System.err.println(scenario.location() + ": wanted '" + scenario.expected() + "', got '" + actual + "'");
        failures++;
      }
    };

    final var runner = new TestRunner(console);
    for (String testFile : testFiles) {
      processFileOfTests(runner, testFile);
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures);
    if (failures > 0) {
      System.exit(1);
    }
  }

  /**
   * Run every scenario of a file.
   *
   * @param runner scenario runner
   * @param testFile path to the scenario file
   */
  public static void processFileOfTests(TestRunner runner, String testFile) throws IOException {
    final ScenarioFileReader reader;
    try {
      reader = ScenarioFileReader.open(Paths.get(testFile));
    } catch (NoSuchFileException err) {
      System.err.println("No such scenario file " + testFile);
      FileTesterMain.failures++;
      return;
    }

    reader.forEachScenario(runner);
  }
}
