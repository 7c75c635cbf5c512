package RegAlgebra.Registry;

import java.util.BitSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SubsetRegistryTest {
  private static BitSet bits(int... members) {
    BitSet b = new BitSet();
    for (int m : members) {
      b.set(m);
    }
    return b;
  }

  @Test
  void testPutAndGet() {
    SubsetRegistry registry = new SubsetRegistry();
    Assertions.assertEquals(SubsetRegistry.MISSING_ELEMENT, registry.get(bits(0, 1)));
    Assertions.assertNull(registry.getLabel(bits(0, 1)));

    Assertions.assertEquals(0, registry.put(bits(0, 1), "P0"));
    Assertions.assertEquals(1, registry.put(bits(1, 2, 5), "P1"));
    Assertions.assertEquals(2, registry.size());

    Assertions.assertEquals(0, registry.get(bits(1, 0)));
    Assertions.assertEquals("P1", registry.getLabel(bits(5, 2, 1)));
    Assertions.assertEquals("P0", registry.labelAt(0));
    Assertions.assertNull(registry.getLabel(bits(1)));
  }
}
