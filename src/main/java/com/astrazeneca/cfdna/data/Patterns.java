package com.astrazeneca.cfdna.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns from all classes of the reports stored in one place.
 */
public class Patterns {
    //CNV meta header patterns
    public static final Pattern SAMPLE_GENDER = Pattern.compile("sampleGender=(\\w+)");
    public static final Pattern ASSUMED_GENDER = Pattern.compile("AssumedGender=([mf])");
    public static final Pattern MAPD = Pattern.compile("mapd=(\\d\\.\\d+)");
    public static final Pattern CELLULARITY = Pattern.compile("CellularityAsAFractionBetween0-1=(.*)$");

    //CNV INFO field patterns
    /**
     * Regexp finds hotspot flag "HS" that comes without value
     */
    public static final Pattern HS_FLAG = Pattern.compile("(^|;)HS(?=;|$)");
    /**
     * Regexp finds "SD" key without value, in the middle or at the end of INFO field
     */
    public static final Pattern SD_NO_VALUE = Pattern.compile("(^|;)SD(?=;|$)");
    public static final Pattern LAST_COLON_FIELD = Pattern.compile(":([^:]+)$");

    //Fusion patterns
    public static final Pattern FUSION_SVTYPE = Pattern.compile("SVTYPE=(Fusion|RNAExonVariant)");
    public static final Pattern PROC_CONTROL_SVTYPE = Pattern.compile("SVTYPE=ProcControl");
    public static final Pattern MOL_COUNT = Pattern.compile("MOL_COUNT=(\\d+)");
    public static final Pattern GENE_NAME = Pattern.compile("GENE_NAME=(.*?);");
    public static final Pattern NUMBERED_SUFFIX = Pattern.compile("_\\d");
    public static final Pattern WILD_TYPE_END = Pattern.compile("WT$");
    public static final Pattern FUSION_FILE_SUFFIX = Pattern.compile("(_Fusion_filtered)?\\.vcf$", Pattern.CASE_INSENSITIVE);

    //SNV/Indel patterns
    public static final Pattern FILE_UTC_TIME = Pattern.compile("^##fileUTCtime=(.*?)$");
    public static final Pattern WHITESPACE = Pattern.compile("\\s+");

    //vcfExtractor version output, e.g. "vcfExtractor.pl - v8.0.1_031618"
    public static final Pattern EXTRACTOR_VERSION = Pattern.compile("v(\\d+)\\.(\\d+)\\.(?:\\d+_)?\\d{6}");

    //VCF header fix patterns
    public static final Pattern INFO_HEADER = Pattern.compile("##INFO=<(.*)>");
    public static final Pattern KEY_VALUE_PAIR = Pattern.compile("(\\w+=[^,]+)");
    public static final Pattern SPACE_QUOTE_END = Pattern.compile(" \"$");
}
