package callfsm.bytecode;

import java.util.OptionalLong;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;

/**
 * Utilities for emitting and recognizing integer constants in bytecode.
 */
final class BytecodeHelpers {

  private BytecodeHelpers() { }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but possibly shorter
   * and ideally not consuming a slot in the constants table.
   *
   * @param mv method visitor into which code will be emitted
   * @param constant integer constant
   */
  static void visitConstantInt(MethodVisitor mv, int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }

  /**
   * Recognize an instruction pushing an integral constant.
   *
   * @param insn instruction to inspect
   * @return pushed value, or empty if the instruction is not a constant push
   */
  static OptionalLong constantValue(AbstractInsnNode insn) {
    final int opcode = insn.getOpcode();
    if (Opcodes.ICONST_M1 <= opcode && opcode <= Opcodes.ICONST_5) {
      return OptionalLong.of(opcode - Opcodes.ICONST_0);
    } else if (opcode == Opcodes.LCONST_0 || opcode == Opcodes.LCONST_1) {
      return OptionalLong.of(opcode - Opcodes.LCONST_0);
    } else if (opcode == Opcodes.BIPUSH || opcode == Opcodes.SIPUSH) {
      return OptionalLong.of(((IntInsnNode) insn).operand);
    } else if (insn instanceof LdcInsnNode ldc) {
      if (ldc.cst instanceof Integer value) {
        return OptionalLong.of(value.longValue());
      } else if (ldc.cst instanceof Long value) {
        return OptionalLong.of(value.longValue());
      }
    }
    return OptionalLong.empty();
  }

  /**
   * Closest preceding instruction which is not a label, line number or frame.
   *
   * @param insn instruction from which to search backwards
   * @return preceding real instruction, or {@code null} if there is none
   */
  static AbstractInsnNode previousRealInsn(AbstractInsnNode insn) {
    AbstractInsnNode previous = insn.getPrevious();
    while (previous != null && previous.getOpcode() < 0) {
      previous = previous.getPrevious();
    }
    return previous;
  }
}
