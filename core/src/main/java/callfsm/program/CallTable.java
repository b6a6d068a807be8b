package callfsm.program;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sorted table of known library calls.
 *
 * <p>The position of a name in the sorted table is its dummy syscall number:
 * instrumentation emits that number in front of every call to the function.
 */
public final class CallTable implements CallClassifier {

  // Sorted and distinct
  private final List<String> names;

  private final Set<String> terminatingCalls;

  public CallTable(Collection<String> names, Collection<String> terminatingCalls) {
    this.names = List.copyOf(new TreeSet<>(names));
    this.terminatingCalls = Set.copyOf(terminatingCalls);
  }

  /**
   * Read a table with one call name per line. Blank lines and lines starting
   * with {@code #} are skipped.
   *
   * @param input text to read (closed when done)
   * @param terminatingCalls names of calls which end the process
   */
  public static CallTable read(InputStream input, Collection<String> terminatingCalls) throws IOException {
    final var names = new TreeSet<String>();
    try (var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        line = line.strip();
        if (!line.isEmpty() && !line.startsWith("#")) {
          names.add(line);
        }
      }
    }
    return new CallTable(names, terminatingCalls);
  }

  /**
   * Load the table named by the configuration from the classpath.
   *
   * @param config analysis settings
   */
  public static CallTable load(AnalysisConfig config) throws IOException {
    final String resource = config.libraryCallsResource();
    final InputStream input = CallTable.class.getClassLoader().getResourceAsStream(resource);
    if (input == null) {
      throw new IOException("library call table " + resource + " not found on the classpath");
    }
    return read(input, config.terminatingCalls());
  }

  /**
   * Dummy syscall number of a library call.
   *
   * @param calleeName name of the called function
   * @return index in the table, or {@code -1} if the function is not in the table
   */
  public int indexOf(String calleeName) {
    final int index = Collections.binarySearch(names, calleeName);
    return index < 0 ? -1 : index;
  }

  List<String> names() {
    return names;
  }

  int size() {
    return names.size();
  }

  @Override
  public boolean isLibraryCall(String calleeName) {
    return indexOf(calleeName) >= 0;
  }

  @Override
  public boolean isTerminatingCall(String calleeName) {
    return terminatingCalls.contains(calleeName);
  }
}
