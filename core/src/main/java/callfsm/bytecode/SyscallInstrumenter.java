package callfsm.bytecode;

import callfsm.program.AnalysisConfig;
import callfsm.program.CallTable;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Inserts a call to the dummy syscall hook in front of every library call.
 *
 * <p>The hook receives the index of the library call in the {@link CallTable},
 * so that a later syscall analysis of the instrumented class sees a
 * {@code dummy_syscall(<n>)} event wherever the uninstrumented code called a
 * library function. The hook itself is never instrumented.
 */
public final class SyscallInstrumenter {

  private static final Logger logger = Logger.getLogger("callfsm.bytecode");

  /**
   * Outcome of instrumenting a class.
   *
   * @param classBytes contents of the rewritten class file
   * @param instrumentedCalls number of call sites preceded by a hook call
   */
  public record Result(byte[] classBytes, int instrumentedCalls) {

    public boolean modified() {
      return instrumentedCalls > 0;
    }
  }

  private final CallTable table;
  private final Method hook;
  private final String hookOwner;

  public SyscallInstrumenter(CallTable table, AnalysisConfig config) {
    this.table = table;
    this.hook = Method.dummySyscall(config.dummySyscallFunction());
    this.hookOwner = config.dummySyscallOwner();
  }

  /**
   * Instrument a class.
   *
   * @param classBytes contents of the class file
   * @return rewritten class (identical in behaviour apart from the hook calls)
   * @throws IllegalArgumentException if the bytes are not a valid class
   */
  public Result instrument(byte[] classBytes) {
    final ClassReader reader;
    try {
      reader = new ClassReader(classBytes);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("malformed class file", e);
    }

    final var writer = new ClassWriter(reader, ClassWriter.COMPUTE_MAXS);
    final var visitor = new InstrumentingClassVisitor(writer);
    reader.accept(visitor, 0);

    logger.log(
      Level.FINE,
      "Instrumented {0} library calls in {1}",
      new Object[] { visitor.instrumentedCalls, reader.getClassName() }
    );
    return new Result(writer.toByteArray(), visitor.instrumentedCalls);
  }

  private final class InstrumentingClassVisitor extends ClassVisitor {

    private String className;
    int instrumentedCalls = 0;

    InstrumentingClassVisitor(ClassVisitor cv) {
      super(Opcodes.ASM9, cv);
    }

    @Override
    public void visit(
      int version,
      int access,
      String name,
      String signature,
      String superName,
      String[] interfaces
    ) {
      className = name;
      super.visit(version, access, name, signature, superName, interfaces);
    }

    @Override
    public MethodVisitor visitMethod(
      int access,
      String name,
      String descriptor,
      String signature,
      String[] exceptions
    ) {
      final MethodVisitor mv = super.visitMethod(access, name, descriptor, signature, exceptions);
      if (mv == null || hook.matches(className, name, descriptor, hookOwner)) {
        return mv;
      }
      return new InstrumentingMethodVisitor(mv, this);
    }
  }

  private final class InstrumentingMethodVisitor extends MethodVisitor {

    private final InstrumentingClassVisitor owningClass;

    InstrumentingMethodVisitor(MethodVisitor mv, InstrumentingClassVisitor owningClass) {
      super(Opcodes.ASM9, mv);
      this.owningClass = owningClass;
    }

    @Override
    public void visitMethodInsn(
      int opcode,
      String owner,
      String name,
      String descriptor,
      boolean isInterface
    ) {
      final int number = table.indexOf(Method.functionName(owner, name));
      if (number >= 0) {
        BytecodeHelpers.visitConstantInt(mv, number);
        hook.invokeMethod(mv, hookOwner);
        owningClass.instrumentedCalls++;
      }
      super.visitMethodInsn(opcode, owner, name, descriptor, isInterface);
    }
  }
}
