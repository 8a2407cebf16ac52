package com.astrazeneca.cfdna.collection;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class VersionComparatorTest {

    @DataProvider(name = "ordered")
    public Object[][] ordered() {
        return new Object[][] {
                {"chr2:100", "chr10:50"},
                {"chr1:99", "chr1:100"},
                {"7.9", "7.10"},
                {"7.9", "8.0"},
                {"chr1:5", "chrX:5"},
                {"Sample2", "Sample10"},
                {"chr1:100", "chr1:100:ALK"},
        };
    }

    @Test(dataProvider = "ordered")
    public void firstGoesBeforeSecond(String first, String second) {
        assertTrue(VersionComparator.INSTANCE.compare(first, second) < 0);
        assertTrue(VersionComparator.INSTANCE.compare(second, first) > 0);
    }

    @Test
    public void equalStringsAreEqual() {
        assertEquals(VersionComparator.INSTANCE.compare("chr7:55086714", "chr7:55086714"), 0);
    }

    @Test
    public void separatorsOnlyDifferenceIsStillOrdered() {
        int cmp = VersionComparator.INSTANCE.compare("chr1:5", "chr1-5");
        assertTrue(cmp != 0);
        assertEquals(Integer.signum(cmp), -Integer.signum(VersionComparator.INSTANCE.compare("chr1-5", "chr1:5")));
    }

    @Test
    public void tokenizeSplitsDigitAndLetterRuns() {
        assertEquals(VersionComparator.tokenize("chr10:43609004:RET"),
                Arrays.asList("chr", "10", "43609004", "RET"));
    }

    @Test
    public void sortsChromosomesNaturally() {
        List<String> keys = new ArrayList<>(Arrays.asList("chr10:50", "chr2:100", "chr1:7", "chr2:20"));
        keys.sort(VersionComparator.INSTANCE);
        assertEquals(keys, Arrays.asList("chr1:7", "chr2:20", "chr2:100", "chr10:50"));
    }
}
