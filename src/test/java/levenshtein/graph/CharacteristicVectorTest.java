package levenshtein.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class CharacteristicVectorTest {

  private static final byte[] QUERY = "abcab".getBytes(StandardCharsets.UTF_8);

  @Test
  public void testOf() {
    assertThat(CharacteristicVector.of(QUERY, 0, 3, (byte) 'a'), is(0b001));
    assertThat(CharacteristicVector.of(QUERY, 0, 5, (byte) 'a'), is(0b01001));
    assertThat(CharacteristicVector.of(QUERY, 2, 3, (byte) 'a'), is(0b010));
    assertThat(CharacteristicVector.of(QUERY, 0, 3, (byte) 'z'), is(0));
  }

  @Test
  public void testPastTheEndNeverMatches() {
    assertThat(CharacteristicVector.of(QUERY, 3, 5, (byte) 'b'), is(0b10));
    assertThat(CharacteristicVector.of(QUERY, 5, 5, (byte) 'b'), is(0));
    assertThat(CharacteristicVector.of(QUERY, 7, 5, (byte) 'b'), is(0));
    assertThat(CharacteristicVector.of(new byte[0], 0, 3, (byte) 0), is(0));
  }

  @Test
  public void testCount() {
    assertThat(CharacteristicVector.count(1), is(2));
    assertThat(CharacteristicVector.count(5), is(32));
  }

  @Test
  public void testToString() {
    assertThat(CharacteristicVector.toString(0b011, 5), is("11000"));
    assertThat(CharacteristicVector.toString(0, 3), is("000"));
  }
}
