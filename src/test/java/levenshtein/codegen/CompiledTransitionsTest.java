package levenshtein.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import levenshtein.graph.LevenshteinNfa;
import levenshtein.graph.ParametricDfa;
import levenshtein.graph.ParametricTransitions;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

@RunWith(Parameterized.class)
public class CompiledTransitionsTest {

  @Parameterized.Parameters(name = "d={0} transpositions={1}")
  public static Collection<Object[]> data() {
    final List<Object[]> data = new ArrayList<>();
    for (int d = 0; d <= 3; d++) {
      data.add(new Object[] { d, false });
      data.add(new Object[] { d, true });
    }
    return data;
  }

  private final ParametricDfa dfa;

  public CompiledTransitionsTest(int maxDistance, boolean transpositions) {
    this.dfa = ParametricDfa.fromNfa(new LevenshteinNfa(maxDistance, transpositions), false);
  }

  @Test
  public void testAgreesWithTable() {
    final ParametricTransitions compiled = CompiledTransitions.compile(dfa, false);
    for (int state = 0; state < dfa.numStates(); state++) {
      for (int vector = 0; vector < dfa.numVectors(); vector++) {
        assertThat(
          "state " + state + ", vector " + vector,
          compiled.transition(state, vector),
          is(dfa.transition(state, vector))
        );
      }
    }
  }

  @Test
  public void testCompilesTwice() {
    // Hidden classes with the same name do not clash
    final ParametricTransitions first = CompiledTransitions.compile(dfa, false);
    final ParametricTransitions second = CompiledTransitions.compile(dfa, false);
    assertThat(first.getClass() == second.getClass(), is(false));
    assertThat(first.transition(ParametricDfa.INITIAL_STATE, 1), is(second.transition(ParametricDfa.INITIAL_STATE, 1)));
  }

  @Test
  public void testUnknownState() {
    final ParametricTransitions compiled = CompiledTransitions.compile(dfa, false);
    assertThrows(IllegalArgumentException.class, () -> compiled.transition(dfa.numStates(), 0));
    assertThrows(IllegalArgumentException.class, () -> compiled.transition(-1, 0));
  }

  @Test
  public void testUnknownVector() {
    final ParametricTransitions compiled = CompiledTransitions.compile(dfa, false);

    // The initial state has more than one outcome, so its row checks the vector
    assertThrows(IllegalArgumentException.class, () -> compiled.transition(ParametricDfa.INITIAL_STATE, dfa.numVectors()));
  }

  @Test
  public void testGeneratedClassShape() {
    final byte[] classBytes = CompiledTransitions
      .generateTransitionsClass(dfa, "levenshtein/codegen/Shape", Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL)
      .toByteArray();

    final List<String> methods = new ArrayList<>();
    final List<String> interfaces = new ArrayList<>();
    new ClassReader(classBytes).accept(new ClassVisitor(Opcodes.ASM9) {
      @Override
      public void visit(int version, int access, String name, String signature, String superName, String[] ifaces) {
        interfaces.addAll(List.of(ifaces));
      }

      @Override
      public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
        methods.add(name + descriptor);
        return null;
      }
    }, ClassReader.SKIP_CODE);

    assertThat(interfaces, is(List.of(Method.TRANSITIONS_CLASS_NAME)));
    assertThat(methods.size(), is(dfa.numStates() + 2));
    assertThat(methods, hasItems("<init>()V", "transition(II)I", "state$0(I)I", "state$1(I)I"));
  }
}
