package com.astrazeneca.cfdna.annotation;

import com.astrazeneca.cfdna.annotation.SnvIndelSchema.Column;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertNull;

public class SnvIndelSchemaTest {
    static final String EGFR_T790M = "chr7:55249071\tC\tT\t2.5\t0.4\t3000\t1200\t30\tCOSM6240\tEGFR\tNM_005228.3"
            + "\tc.2369C>T\tp.Thr790Met\texonic\tmissense";

    @Test
    public void decodesRequiredColumnsAndFillsOptionalOnes() {
        AnnotatedVariant variant = SnvIndelSchema.decode(EGFR_T790M);

        assertNotNull(variant);
        assertEquals(variant.position(), "chr7:55249071");
        assertEquals(variant.vaf(), 2.5);
        assertEquals(variant.get(Column.GENE), "EGFR");
        assertEquals(variant.get(Column.FUNCTION), "missense");
        assertEquals(variant.get(Column.GENE_CLASS), SnvIndelSchema.EMPTY_VALUE);
        assertEquals(variant.get(Column.VARIANT_CLASS), SnvIndelSchema.EMPTY_VALUE);
    }

    @Test
    public void decodesOncomineColumns() {
        AnnotatedVariant variant = SnvIndelSchema.decode(EGFR_T790M + "\tGain-of-Function\tHotspot");

        assertEquals(variant.get(Column.GENE_CLASS), "Gain-of-Function");
        assertEquals(variant.get(Column.VARIANT_CLASS), "Hotspot");
    }

    @DataProvider(name = "malformed")
    public Object[][] malformed() {
        return new Object[][] {
                {"chr7:55249071\tC\tT\t2.5\t0.4"},
                {EGFR_T790M.replace("\t2.5\t", "\tNA\t")},
                {""},
        };
    }

    @Test(dataProvider = "malformed")
    public void malformedLinesAreSkipped(String line) {
        assertNull(SnvIndelSchema.decode(line));
    }

    @Test
    public void titlesFollowColumnOrder() {
        assertEquals(SnvIndelSchema.titles().size(), 17);
        assertEquals(SnvIndelSchema.titles().get(0), "Chr:Position");
        assertEquals(SnvIndelSchema.REQUIRED_COLUMNS, 15);
    }
}
