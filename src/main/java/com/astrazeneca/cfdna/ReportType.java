package com.astrazeneca.cfdna;

/**
 * Sub-commands of the tool. Each report keeps the name and version of the pipeline script it replaces.
 */
public enum ReportType {
    CNV("cnv", "cfdna_cnv_report", "v0.2.112117",
            "Parse a cfDNA CNV VCF file and output a simple table of CNVs to report. Filter by fold difference "
                    + "or copy number thresholds, genes and tiles."),
    FUSION("fusion", "cfdna_fusion_report", "v0.3.121817",
            "Parse cfDNA fusion VCF files and output a table of fusions with read counts above the threshold. "
                    + "Control and reference calls can be shown on demand."),
    SNV("snv", "cfdna_snv_report", "v0.7.012618",
            "Parse cfDNA VCF files through the variant extractor and output a table of SNVs and Indels with "
                    + "VAF above LOD."),
    FIXHEADER("fixheader", "fix_cfdna_vcf_header", "v1.0.111517",
            "Fix malformed INFO lines of cfDNA fusion VCF header, so that the file can be read by VCF tools.");

    public final String command;
    public final String scriptName;
    public final String version;
    public final String description;

    ReportType(String command, String scriptName, String version, String description) {
        this.command = command;
        this.scriptName = scriptName;
        this.version = version;
        this.description = description;
    }

    /**
     * @param command first command line argument
     * @return report type or null if there is no such command
     */
    public static ReportType fromCommand(String command) {
        for (ReportType type : values()) {
            if (type.command.equals(command)) {
                return type;
            }
        }
        return null;
    }
}
