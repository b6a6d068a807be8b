package callfsm.bytecode;

import callfsm.program.BlockModel;
import callfsm.program.CallSite;
import callfsm.program.FunctionModel;
import callfsm.program.ProgramModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicInterpreter;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;

/**
 * Reads class files into a {@link ProgramModel}.
 *
 * <p>Every method with code becomes a function whose basic blocks come from
 * the intraprocedural control-flow graph computed by ASM's {@code Analyzer}.
 * A block starts at the first instruction, at the target of any branch,
 * switch or exception handler, and right after any instruction that does not
 * simply fall through. Exceptional edges are kept as block successors.
 * Abstract and native methods become declarations.
 */
public final class BytecodeProgramReader {

  private static final Logger logger = Logger.getLogger("callfsm.bytecode");

  private final List<FunctionModel> functions = new ArrayList<>();
  private String programName = null;

  /**
   * Read all of the given class files into one program.
   *
   * @param classFiles paths to {@code .class} files
   * @return program containing all of their methods
   */
  public static ProgramModel readProgram(List<Path> classFiles) throws IOException {
    final var reader = new BytecodeProgramReader();
    for (Path classFile : classFiles) {
      reader.read(classFile);
    }
    return reader.toProgram();
  }

  /**
   * Add the methods of a class file.
   *
   * @param classFile path to a {@code .class} file
   */
  public BytecodeProgramReader read(Path classFile) throws IOException {
    return read(Files.readAllBytes(classFile), classFile.toString());
  }

  /**
   * Add the methods of a class.
   *
   * @param classBytes contents of the class file
   * @param source where the bytes came from (used in error messages)
   * @throws IllegalArgumentException if the bytes are not a valid class
   */
  public BytecodeProgramReader read(byte[] classBytes, String source) {
    final var classNode = new ClassNode();
    try {
      new ClassReader(classBytes).accept(classNode, ClassReader.SKIP_DEBUG);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("malformed class file " + source, e);
    }

    if (programName == null) {
      programName = classNode.name.substring(classNode.name.lastIndexOf('/') + 1);
    }

    for (MethodNode method : classNode.methods) {
      functions.add(readMethod(classNode.name, method));
    }
    logger.log(Level.FINE, "Read {0} methods from {1}", new Object[] { classNode.methods.size(), source });
    return this;
  }

  /**
   * Program made of every class read so far.
   */
  public ProgramModel toProgram() {
    return new ProgramModel(programName == null ? "program" : programName, functions);
  }

  private static FunctionModel readMethod(String owner, MethodNode method) {
    final String id = Method.functionId(owner, method.name, method.desc);
    final String name = Method.functionName(owner, method.name);
    if ((method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0 || method.instructions.size() == 0) {
      return new FunctionModel(id, name, List.of());
    }

    final InsnList insns = method.instructions;
    final int size = insns.size();

    final List<Set<Integer>> successors = new ArrayList<>(size);
    final List<Set<Integer>> handlers = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      successors.add(new TreeSet<>());
      handlers.add(new TreeSet<>());
    }

    final var analyzer = new Analyzer<BasicValue>(new BasicInterpreter()) {
      @Override
      protected void newControlFlowEdge(int insnIndex, int successorIndex) {
        successors.get(insnIndex).add(successorIndex);
      }

      @Override
      protected boolean newControlFlowExceptionEdge(int insnIndex, int successorIndex) {
        handlers.get(insnIndex).add(successorIndex);
        return true;
      }
    };
    final Frame<BasicValue>[] frames;
    try {
      frames = analyzer.analyze(owner, method);
    } catch (AnalyzerException e) {
      throw new IllegalArgumentException("cannot analyze " + name + method.desc, e);
    }

    // Find the first instruction of every block
    final boolean[] leaders = new boolean[size];
    leaders[0] = true;
    for (int i = 0; i < size; i++) {
      if (frames[i] == null) {
        continue;
      }
      final Set<Integer> next = successors.get(i);
      final boolean fallsThrough = next.size() == 1 && next.contains(i + 1);
      if (!fallsThrough) {
        for (int target : next) {
          leaders[target] = true;
        }
        if (i + 1 < size) {
          leaders[i + 1] = true;
        }
      }
    }
    for (TryCatchBlockNode tryCatch : method.tryCatchBlocks) {
      leaders[insns.indexOf(tryCatch.handler)] = true;
    }

    final int[] blockOf = new int[size];
    int blockCount = -1;
    for (int i = 0; i < size; i++) {
      if (leaders[i]) {
        blockCount++;
      }
      blockOf[i] = blockCount;
    }
    blockCount++;

    final var blocks = new ArrayList<BlockModel>(blockCount);
    int blockStart = 0;
    for (int block = 0; block < blockCount; block++) {
      int blockEnd = blockStart + 1;
      while (blockEnd < size && !leaders[blockEnd]) {
        blockEnd++;
      }

      final var calls = new ArrayList<CallSite>();
      final var blockSuccessors = new TreeSet<Integer>();
      for (int i = blockStart; i < blockEnd; i++) {
        final AbstractInsnNode insn = insns.get(i);
        if (insn instanceof MethodInsnNode call) {
          calls.add(callSite(call));
        }
        for (int handler : handlers.get(i)) {
          blockSuccessors.add(blockOf[handler]);
        }
      }
      for (int target : successors.get(blockEnd - 1)) {
        blockSuccessors.add(blockOf[target]);
      }

      final int lastOpcode = insns.get(blockEnd - 1).getOpcode();
      final boolean returns = Opcodes.IRETURN <= lastOpcode && lastOpcode <= Opcodes.RETURN;

      blocks.add(new BlockModel(block, calls, new ArrayList<>(blockSuccessors), returns));
      blockStart = blockEnd;
    }

    return new FunctionModel(id, name, blocks);
  }

  private static CallSite callSite(MethodInsnNode call) {
    final String id = Method.functionId(call.owner, call.name, call.desc);
    final String name = Method.functionName(call.owner, call.name);

    final Type[] arguments = Type.getArgumentTypes(call.desc);
    if (arguments.length == 1 && isIntegral(arguments[0])) {
      final AbstractInsnNode previous = BytecodeHelpers.previousRealInsn(call);
      if (previous != null) {
        return new CallSite(id, name, BytecodeHelpers.constantValue(previous));
      }
    }
    return new CallSite(id, name, OptionalLong.empty());
  }

  private static boolean isIntegral(Type type) {
    switch (type.getSort()) {
      case Type.BYTE:
      case Type.CHAR:
      case Type.SHORT:
      case Type.INT:
      case Type.LONG:
        return true;
      default:
        return false;
    }
  }
}
