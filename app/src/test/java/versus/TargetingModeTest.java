package versus;

import org.junit.Test;

import static org.junit.Assert.*;

public class TargetingModeTest {

    @Test
    public void testParse() {
        assertEquals(TargetingMode.SEQUENTIAL, TargetingMode.parse(null));
        assertEquals(TargetingMode.SPLIT_EVENLY, TargetingMode.parse(" split_evenly "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownMode() {
        TargetingMode.parse("everyone");
    }
}
