package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.VariantKey;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;

public class CnvRecordExtractorTest {
    private VcfLines vcf;

    @BeforeMethod
    public void setUp() throws Exception {
        File file = new File(getClass().getResource("/com/astrazeneca/cfdna/cnv.vcf").toURI());
        vcf = VcfFileReader.readVcf(file);
    }

    @Test
    public void extractsOnlyCnvRecords() {
        SampleRecords records = new CnvRecordExtractor().extract("cnv.vcf", vcf);

        assertEquals(records.records.size(), 3);
        assertFalse(records.records.containsKey(VariantKey.of(":", "chr1", "115256420", "NRAS", "T")));
    }

    @Test
    public void hotspotFlagAndCopyNumberAreFilled() {
        SampleRecords records = new CnvRecordExtractor().extract("cnv.vcf", vcf);

        FieldSet ret = records.records.get(VariantKey.of(":", "chr10", "43609004", "RET", "G"));
        assertEquals(ret.get("HS"), "Yes");
        assertEquals(ret.get("SD"), "NA");
        assertEquals(ret.get("CN"), "5.0");
        assertEquals(ret.get("END"), "43614004");
        assertEquals(ret.get("FILTER"), "PASS");

        FieldSet alk = records.records.get(VariantKey.of(":", "chr2", "29415640", "ALK", "A"));
        assertEquals(alk.get("HS"), "No");
        assertEquals(alk.get("SD"), "0.1");
        assertEquals(alk.get("CN"), "1.5");
    }

    @Test
    public void sampleIdentityIsTakenFromHeader() {
        SampleIdentity identity = new CnvRecordExtractor().extract("cnv.vcf", vcf).identity;

        assertEquals(identity.name(), "Sample1");
        assertEquals(identity.metadata(CnvRecordExtractor.GENDER), "Female");
        assertEquals(identity.metadata(CnvRecordExtractor.MAPD_FIELD), "0.121");
        assertEquals(identity.metadata(CnvRecordExtractor.CELLULARITY_FIELD), "0.3");
    }

    @Test
    public void assumedGenderIsTranslated() {
        VcfLines lines = new VcfLines(Arrays.asList("##AssumedGender=m", "##mapd=0.2"),
                "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tSample9", Collections.emptyList());

        SampleIdentity identity = CnvRecordExtractor.sampleIdentity(lines);

        assertEquals(identity.metadata(CnvRecordExtractor.GENDER), "Male");
        assertEquals(identity.metadata(CnvRecordExtractor.CELLULARITY_FIELD), SampleIdentity.MISSING);
    }

    @Test
    public void noColumnHeaderMeansNoIdentity() {
        VcfLines lines = new VcfLines(Collections.singletonList("##mapd=0.2"), null, Collections.emptyList());
        assertNull(CnvRecordExtractor.sampleIdentity(lines));
    }

    @Test
    public void parseInfoNormalizesFlags() {
        Map<String, String> info = CnvRecordExtractor.parseInfo("HS;LEN=10;SD");
        assertEquals(info.get("HS"), "Yes");
        assertEquals(info.get("SD"), "NA");
        assertEquals(info.get("LEN"), "10");

        Map<String, String> middle = CnvRecordExtractor.parseInfo("LEN=10;SD;HSX=1");
        assertEquals(middle.get("SD"), "NA");
        assertNull(middle.get("HS"));
    }
}
