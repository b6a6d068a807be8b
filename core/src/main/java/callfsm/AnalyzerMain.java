package callfsm;

import callfsm.bytecode.BytecodeProgramReader;
import callfsm.bytecode.SyscallInstrumenter;
import callfsm.graph.Automaton;
import callfsm.program.AnalysisConfig;
import callfsm.program.AnalysisPass;
import callfsm.program.CallTable;
import callfsm.program.ProgramModel;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 *   AnalyzerMain (cfg|syscall|libc) OUTPUT-STEM CLASS-FILE...
 *   AnalyzerMain instrument INPUT-CLASS OUTPUT-CLASS
 * </pre>
 *
 * The analyses write their automaton to {@code OUTPUT-STEM_cfg.dot}.
 */
public final class AnalyzerMain {

  private static final String USAGE =
    "usage: AnalyzerMain (cfg|syscall|libc) OUTPUT-STEM CLASS-FILE...\n" +
    "       AnalyzerMain instrument INPUT-CLASS OUTPUT-CLASS";

  private AnalyzerMain() { }

  public static void main(String[] args) {
    final int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Run a command.
   *
   * @param args command line arguments
   * @return process exit status
   */
  static int run(String[] args) {
    if (args.length < 3) {
      System.err.println(USAGE);
      return 2;
    }

    try {
      final AnalysisConfig config = AnalysisConfig.load();
      final CallTable table = CallTable.load(config);

      if (args[0].equals("instrument")) {
        if (args.length != 3) {
          System.err.println(USAGE);
          return 2;
        }
        final Path output = instrument(table, config, Paths.get(args[1]), Paths.get(args[2]));
        System.err.println("Wrote " + output);
      } else {
        final AnalysisPass pass = AnalysisPass.forName(args[0]);
        final List<Path> classFiles = new ArrayList<>();
        for (String classFile : Arrays.asList(args).subList(2, args.length)) {
          classFiles.add(Paths.get(classFile));
        }
        final Path output = analyze(pass, table, config, args[1], classFiles);
        System.err.println("Wrote " + output);
      }
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("error: " + e.getMessage());
      return 1;
    }
    return 0;
  }

  /**
   * Run an analysis and write its DOT graph.
   *
   * @return path of the written graph
   */
  static Path analyze(
    AnalysisPass pass,
    CallTable table,
    AnalysisConfig config,
    String outputStem,
    List<Path> classFiles
  ) throws IOException {
    final ProgramModel program = BytecodeProgramReader.readProgram(classFiles);
    final Automaton automaton = pass.run(program, table, config);

    final Path output = Paths.get(outputStem + "_cfg.dot");
    try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      automaton.writeDotGraph("CFG", out);
    }
    automaton.clear();
    return output;
  }

  /**
   * Instrument one class file.
   *
   * @return path of the written class
   */
  static Path instrument(CallTable table, AnalysisConfig config, Path input, Path output) throws IOException {
    final var instrumenter = new SyscallInstrumenter(table, config);
    final SyscallInstrumenter.Result result;
    try {
      result = instrumenter.instrument(Files.readAllBytes(input));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(input + ": " + e.getMessage(), e);
    }
    Files.write(output, result.classBytes());
    return output;
  }
}
