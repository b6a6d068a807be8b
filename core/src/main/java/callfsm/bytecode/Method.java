package callfsm.bytecode;

import java.lang.invoke.MethodType;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Helper class to simplify codegen around calling methods.
 *
 * @param name name of the method
 * @param typ type of the method (does not include the receiver)
 * @param invokeSort one of the {@code Opcodes.INVOKE*} codes
 */
record Method(
  String name,
  MethodType typ,
  int invokeSort
) {

  /**
   * Static instrumentation hook taking the dummy syscall number.
   *
   * @param name name of the hook
   */
  static Method dummySyscall(String name) {
    return new Method(name, MethodType.methodType(void.class, int.class), Opcodes.INVOKESTATIC);
  }

  /**
   * Is a method of some class this method?
   *
   * @param owner internal name of the class declaring the other method
   * @param methodName name of the other method
   * @param descriptor descriptor of the other method
   * @param className internal name of the class on which this method is defined
   */
  boolean matches(String owner, String methodName, String descriptor, String className) {
    return owner.equals(className) && name.equals(methodName) && typ.descriptorString().equals(descriptor);
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className internal name of the class on which this method is defined
   */
  void invokeMethod(MethodVisitor mv, String className) {
    mv.visitMethodInsn(
      invokeSort,
      className,
      name,
      typ.descriptorString(),
      invokeSort == Opcodes.INVOKEINTERFACE
    );
  }

  /**
   * Identifier of a method in a {@code ProgramModel}.
   *
   * @param owner internal name of the declaring class
   * @param name method name
   * @param descriptor method descriptor
   */
  static String functionId(String owner, String name, String descriptor) {
    return owner + "." + name + descriptor;
  }

  /**
   * Name of a method as it appears in labels and in the library call table.
   *
   * @param owner internal name of the declaring class
   * @param name method name
   */
  static String functionName(String owner, String name) {
    return owner + "." + name;
  }
}
