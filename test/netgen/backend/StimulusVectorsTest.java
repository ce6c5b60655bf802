package netgen.backend;

import java.util.List;
import netgen.netlist.BaseType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StimulusVectorsTest {

  @ParameterizedTest
  @ValueSource(longs = {0, 1, 42, -6733423670758169604L})
  void testDeterminism(long seed) throws Exception {
    List<BaseType> types = List.of(BaseType.unsigned(3), BaseType.BOOL, BaseType.signed(7));
    Assertions.assertEquals(new StimulusVectors(seed, 100).generate(types), new StimulusVectors(seed, 100).generate(types));
  }

  @Test
  void testOneUnsignedInput() throws Exception {
    String text = new StimulusVectors().generate(List.of(BaseType.unsigned(3)));
    Assertions.assertTrue(text.endsWith("\n"));
    String[] lines = text.split("\n");
    Assertions.assertEquals(StimulusVectors.DEFAULT_COUNT, lines.length);
    for (String line : lines)
      Assertions.assertTrue(line.matches("[01]{3}"), line);
  }

  @Test
  void testLineWidthIsSumOfInputWidths() throws Exception {
    String text = new StimulusVectors(7, 20).generate(List.of(BaseType.BOOL, BaseType.CONTROL_BIT, BaseType.unsigned(12), BaseType.signed(65)));
    for (String line : text.split("\n"))
      Assertions.assertEquals(1 + 1 + 12 + 65, line.length());
  }

  @Test
  void testSeedsDiffer() throws Exception {
    List<BaseType> types = List.of(BaseType.unsigned(16));
    Assertions.assertNotEquals(new StimulusVectors(1, 100).generate(types), new StimulusVectors(2, 100).generate(types));
  }

  @Test
  void testSignedCoversBothSigns() throws Exception {
    String text = new StimulusVectors(3, 200).generate(List.of(BaseType.signed(8)));
    Assertions.assertTrue(text.contains("\n1") || text.startsWith("1"));
    Assertions.assertTrue(text.contains("\n0") || text.startsWith("0"));
  }

  @Test
  void testClockAndResetAreLow() throws Exception {
    String text = new StimulusVectors(0, 10).generate(List.of(BaseType.CLOCK, BaseType.RESET));
    Assertions.assertEquals("00\n".repeat(10), text);
  }

  @Test
  void testNoVectors() throws Exception {
    Assertions.assertEquals("", new StimulusVectors(0, 0).generate(List.of(BaseType.BOOL)));
    Assertions.assertEquals("\n\n", new StimulusVectors(0, 2).generate(List.of()));
  }

  @Test
  void testUnsupportedType() {
    UnsupportedStimulusTypeException e = Assertions.assertThrows(
        UnsupportedStimulusTypeException.class, () -> new StimulusVectors().generate(List.of(BaseType.BOOL, BaseType.TABLE)));
    Assertions.assertEquals(BaseType.TABLE, e.getType());
  }
}
