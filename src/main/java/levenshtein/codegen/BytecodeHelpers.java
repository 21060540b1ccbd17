package levenshtein.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing utility methods for emitting bytecode.
 *
 * <p>Method bodies are limited in length by the fact the code array must
 * have length fitting in an unsigned 16-bit number, so these prefer the
 * shortest encoding of each instruction.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  public BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Branch on the {@code int} at the top of the stack, which is expected to
   * be in {@code [0, labels.length)}.
   *
   * @param dflt label to jump to if the value is out of range
   * @param labels labels to jump to, indexed by value
   */
  protected void visitDenseBranch(Label dflt, Label[] labels) {
    if (labels.length == 1) {
      mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else {
      mv.visitTableSwitchInsn(0, labels.length - 1, dflt, labels);
    }
  }

  /**
   * Emit code to throw an {@code IllegalArgumentException} with a constant
   * message.
   *
   * @param message exception message
   */
  protected void visitThrowIllegalArgument(String message) {
    mv.visitTypeInsn(Opcodes.NEW, Method.ILLEGALARGUMENT_CLASS_NAME);
    mv.visitInsn(Opcodes.DUP);
    mv.visitLdcInsn(message);
    Method.MESSAGEINIT_M.invokeMethod(mv, Method.ILLEGALARGUMENT_CLASS_NAME);
    mv.visitInsn(Opcodes.ATHROW);
  }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but possibly shorter
   * and ideally not consuming a slot in the constants table.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    switch (constant) {
      case -1:
        mv.visitInsn(Opcodes.ICONST_M1);
        return;

      case 0:
        mv.visitInsn(Opcodes.ICONST_0);
        return;

      case 1:
        mv.visitInsn(Opcodes.ICONST_1);
        return;

      case 2:
        mv.visitInsn(Opcodes.ICONST_2);
        return;

      case 3:
        mv.visitInsn(Opcodes.ICONST_3);
        return;

      case 4:
        mv.visitInsn(Opcodes.ICONST_4);
        return;

      case 5:
        mv.visitInsn(Opcodes.ICONST_5);
        return;
    }

    if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
