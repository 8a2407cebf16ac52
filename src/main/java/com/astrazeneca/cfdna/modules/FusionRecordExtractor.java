package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.VariantKey;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.astrazeneca.cfdna.data.Patterns.*;

/**
 * Extracts fusion records of cfDNA fusion VCF. Record id "EML4-ALK.E13A20.COSF408" is split to gene pair,
 * junction and the optional fusion id; the genes of pair are assigned to driver and partner by the list of
 * known driver genes. Expression and process controls are collected apart from the fusions.
 */
public class FusionRecordExtractor extends RecordExtractor {
    private static final Log LOG = Log.getInstance(FusionRecordExtractor.class);

    public static final String UNKNOWN_DRIVER = "UNKNOWN";
    public static final String NO_FUSION_ID = "-";
    /**
     * Joins both genes of a partner with unknown driver; it is never the delimiter of CSV or TSV output.
     */
    public static final String UNKNOWN_PARTNER_SEPARATOR = "/";

    /**
     * Driver genes of the panel versions 1, 2 and 3. Not all of them exist in the current version,
     * all are kept for backward compatibility.
     */
    public static final Set<String> DRIVER_GENES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "ABL1", "AKT2", "AKT3", "ALK", "AR", "AXL", "BRAF", "BRCA1", "BRCA2", "CDKN2A", "EGFR", "ERBB2",
            "ERBB4", "ERG", "ESR1", "ETV1", "ETV1a", "ETV1b", "ETV4", "ETV4a", "ETV5", "ETV5a", "ETV5d", "FGFR1",
            "FGFR2", "FGFR3", "FGR", "FLT3", "JAK2", "KRAS", "MDM4", "MET", "MYB", "MYBL1", "NF1", "NOTCH1",
            "NOTCH4", "NRG1", "NTRK1", "NTRK2", "NTRK3", "NUTM1", "PDGFRA", "PDGFRB", "PIK3CA", "PPARG", "PRKACA",
            "PRKACB", "PTEN", "RAD51B", "RAF1", "RB1", "RELA", "RET", "ROS1", "RSPO2", "RSPO3", "TERT")));

    public static final Map<String, String> FIELDS;
    static {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("COUNT", "0");
        fields.put("DRIVER", UNKNOWN_DRIVER);
        fields.put("PARTNER", ".");
        fields.put("FILTER", ".");
        fields.put("ID", NO_FUSION_ID);
        FIELDS = Collections.unmodifiableMap(fields);
    }

    @Override
    public SampleRecords extract(String source, VcfLines vcf) {
        Map<VariantKey, FieldSet> records = new LinkedHashMap<>();
        Map<String, Integer> controls = new LinkedHashMap<>();

        for (String line : vcf.dataLines) {
            String[] columns = WHITESPACE.split(line.trim());
            if (columns.length < 8) {
                continue;
            }
            String info = columns[7];
            if (FUSION_SVTYPE.matcher(info).find()) {
                Integer count = molecularCount(info, line);
                if (count == null) {
                    continue;
                }
                String recordId = columns[2];
                // RNAExonVariant wild type records are the expression controls
                if (WILD_TYPE_END.matcher(recordId).find()) {
                    controls.put(recordId, count);
                    continue;
                }
                String[] idParts = recordId.split("\\.");
                if (idParts.length < 2) {
                    continue;
                }
                String pair = stripNumberedSuffix(idParts[0]);
                String junction = stripNumberedSuffix(idParts[1]);
                String fusionId = idParts.length > 2 ? stripNumberedSuffix(idParts[2]) : NO_FUSION_ID;

                String[] genes = pair.split("-", 2);
                String[] driverAndPartner = assignDriver(genes[0], genes.length > 1 ? genes[1] : genes[0]);

                Map<String, String> values = new HashMap<>();
                values.put("COUNT", String.valueOf(count));
                values.put("DRIVER", driverAndPartner[0]);
                values.put("PARTNER", driverAndPartner[1]);
                values.put("FILTER", columns[6]);
                values.put("ID", fusionId);
                records.put(VariantKey.of("|", pair, junction, fusionId), FieldSet.of(FIELDS, values));
            } else if (PROC_CONTROL_SVTYPE.matcher(info).find()) {
                String gene = findGroup(GENE_NAME, info);
                Integer count = molecularCount(info, line);
                if (gene != null && count != null) {
                    controls.put(gene, count);
                }
            }
        }
        return new SampleRecords(source, sampleIdentity(source), records, controls);
    }

    /**
     * Decides which gene of the fusion pair is the driver. Same genes are both driver and partner; otherwise
     * the first gene found in the driver list is driver and the other one is partner. If none of genes is
     * known driver, the driver is "UNKNOWN" and partner lists both genes joined by "/".
     * @param gene1 first (5') gene of the pair
     * @param gene2 second (3') gene of the pair
     * @return array of driver and partner
     */
    public static String[] assignDriver(String gene1, String gene2) {
        if (gene1.equals(gene2)) {
            return new String[] {gene1, gene1};
        } else if (DRIVER_GENES.contains(gene1)) {
            return new String[] {gene1, gene2};
        } else if (DRIVER_GENES.contains(gene2)) {
            return new String[] {gene2, gene1};
        }
        return new String[] {UNKNOWN_DRIVER, gene1 + UNKNOWN_PARTNER_SEPARATOR + gene2};
    }

    /**
     * Sample name of the fusion VCF is its file name without "_Fusion_filtered.vcf" (or ".vcf") and "_RNA".
     */
    static SampleIdentity sampleIdentity(String source) {
        String name = FUSION_FILE_SUFFIX.matcher(new File(source).getName()).replaceFirst("");
        name = name.replaceFirst("_RNA", "");
        return name.isEmpty() ? null : SampleIdentity.ofName(name);
    }

    /**
     * @return MOL_COUNT of the record, 0 if it is absent or null if it is too large to be a count
     */
    private static Integer molecularCount(String info, String line) {
        String count = findGroup(MOL_COUNT, info);
        if (count == null) {
            return 0;
        }
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            LOG.debug("Skipped record with wrong MOL_COUNT: ", line);
            return null;
        }
    }

    private static String stripNumberedSuffix(String part) {
        return NUMBERED_SUFFIX.matcher(part).replaceFirst("");
    }
}
