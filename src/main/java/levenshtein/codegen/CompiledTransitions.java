package levenshtein.codegen;

import levenshtein.graph.ParametricDfa;
import levenshtein.graph.ParametricTransitions;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Compiles the transition table of a parametric automaton into bytecode.
 *
 * <p>The generated class implements {@link ParametricTransitions}. Its
 * {@code transition} method jumps on the state to a static method holding
 * that state's row of the table, which in turn jumps on the characteristic
 * vector to a block returning the packed transition as a constant. Vectors
 * with the same outcome share a block, so rows like the dead state's collapse
 * into a single return.
 */
public final class CompiledTransitions {

  /**
   * Largest number of states that fit in the dispatching method (every state
   * costs a jump table entry plus a call).
   */
  public static final int MAX_STATES = 4096;

  /**
   * Largest table (states times vectors) compiled.
   */
  public static final int MAX_TABLE_SIZE = 1 << 20;

  private static final String CLASS_NAME = "levenshtein/codegen/CompiledTransitions$Generated";

  private CompiledTransitions() { }

  /**
   * Compile and load the transitions of a parametric automaton.
   *
   * @param dfa parametric automaton
   * @param printDebugInfo print to STDERR the size of the generated class
   * @return transitions backed by the generated class
   */
  public static ParametricTransitions compile(ParametricDfa dfa, boolean printDebugInfo) {
    final int numStates = dfa.numStates();
    if (numStates > MAX_STATES || (long) numStates * dfa.numVectors() > MAX_TABLE_SIZE) {
      throw new IllegalArgumentException(
        "Parametric automaton is too large to compile: " + numStates + " states, " +
        dfa.numVectors() + " vectors"
      );
    }

    final int classFlags = Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
    final byte[] classBytes = generateTransitionsClass(dfa, CLASS_NAME, classFlags).toByteArray();
    if (printDebugInfo) {
      System.err.println(
        "[CompiledTransitions] generated " + classBytes.length + " bytes for " +
        numStates + " states over " + dfa.numVectors() + " vectors"
      );
    }

    // Load the class and instantiate it
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (ParametricTransitions) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to load compiled transitions", error);
    }
  }

  /**
   * Code generator for a class implementing {@code ParametricTransitions}.
   *
   * @param dfa parametric automaton whose table is compiled
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @return class writer containing the whole class
   */
  public static ClassWriter generateTransitionsClass(
    ParametricDfa dfa,
    String className,
    int classFlags
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.TRANSITIONS_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `transition` method (dispatches to the row of the state)
    {
      final var mv = Method.TRANSITION_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new DispatchCodegen(mv, className, dfa.numStates()).generate();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // One static method per row
    for (int state = 0; state < dfa.numStates(); state++) {
      final var mv = Method.stateTransitions(state).newMethod(cw, Opcodes.ACC_PRIVATE);
      mv.visitCode();
      new RowCodegen(mv, dfa, state).generate();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Body of {@code int transition(int state, int vector)}.
   */
  private static final class DispatchCodegen extends BytecodeHelpers {

    private static final int STATE_LOCAL = 1;
    private static final int VECTOR_LOCAL = 2;

    private final String className;
    private final int numStates;

    DispatchCodegen(MethodVisitor mv, String className, int numStates) {
      super(mv);
      this.className = className;
      this.numStates = numStates;
    }

    void generate() {
      final Label unknownState = new Label();
      final Label[] stateLabels = new Label[numStates];
      for (int state = 0; state < numStates; state++) {
        stateLabels[state] = new Label();
      }

      mv.visitVarInsn(Opcodes.ILOAD, STATE_LOCAL);
      visitDenseBranch(unknownState, stateLabels);

      for (int state = 0; state < numStates; state++) {
        mv.visitLabel(stateLabels[state]);
        mv.visitVarInsn(Opcodes.ILOAD, VECTOR_LOCAL);
        Method.stateTransitions(state).invokeMethod(mv, className);
        mv.visitInsn(Opcodes.IRETURN);
      }

      mv.visitLabel(unknownState);
      visitThrowIllegalArgument("Unknown parametric state");
    }
  }

  /**
   * Body of {@code static int state$N(int vector)}.
   */
  private static final class RowCodegen extends BytecodeHelpers {

    private static final int VECTOR_LOCAL = 0;

    private final int[] row;

    RowCodegen(MethodVisitor mv, ParametricDfa dfa, int state) {
      super(mv);
      this.row = new int[dfa.numVectors()];
      for (int vector = 0; vector < row.length; vector++) {
        row[vector] = dfa.transition(state, vector);
      }
    }

    void generate() {

      // One block per distinct outcome
      final Map<Integer, Label> outcomes = new LinkedHashMap<>();
      for (int packed : row) {
        outcomes.computeIfAbsent(packed, k -> new Label());
      }

      if (outcomes.size() == 1) {
        visitConstantInt(row[0]);
        mv.visitInsn(Opcodes.IRETURN);
        return;
      }

      final Label outOfRange = new Label();
      final Label[] vectorLabels = new Label[row.length];
      for (int vector = 0; vector < row.length; vector++) {
        vectorLabels[vector] = outcomes.get(row[vector]);
      }

      mv.visitVarInsn(Opcodes.ILOAD, VECTOR_LOCAL);
      visitDenseBranch(outOfRange, vectorLabels);

      for (Map.Entry<Integer, Label> outcome : outcomes.entrySet()) {
        mv.visitLabel(outcome.getValue());
        visitConstantInt(outcome.getKey());
        mv.visitInsn(Opcodes.IRETURN);
      }

      mv.visitLabel(outOfRange);
      visitThrowIllegalArgument("Characteristic vector out of range");
    }
  }
}
