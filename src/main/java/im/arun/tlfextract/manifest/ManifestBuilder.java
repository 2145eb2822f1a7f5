package im.arun.tlfextract.manifest;

import im.arun.tlfextract.model.Manifest;
import im.arun.tlfextract.model.ManifestRow;
import im.arun.tlfextract.model.NarrativeRecord;
import im.arun.tlfextract.model.TlfRecord;
import im.arun.tlfextract.segment.SegmentationResult;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a segmentation result into the manifest and its tabular projection.
 */
public class ManifestBuilder {
    private final int narrativePageCount;

    public ManifestBuilder(int narrativePageCount) {
        this.narrativePageCount = narrativePageCount;
    }

    /**
     * Assemble the manifest for one run.
     *
     * @param result Segmentation of the TLF section
     * @param sourceFile Base name of the source PDF
     * @param sourcePages Total page count of the source PDF
     * @param extractedAt Extraction time, truncated to seconds in the output
     * @return Manifest with the narrative entry and the TLFs in scan order
     */
    public Manifest build(SegmentationResult result, String sourceFile, int sourcePages, Instant extractedAt) {
        Manifest manifest = new Manifest();
        manifest.setSourceFile(sourceFile);
        manifest.setSourcePages(sourcePages);
        manifest.setExtractionDate(formatTimestamp(extractedAt));
        manifest.setNarrative(NarrativeRecord.ofPages(OutputLayout.narrativePdfFile(), narrativePageCount));
        manifest.setTlfs(List.copyOf(result.getRecords()));
        return manifest;
    }

    /**
     * ISO-8601 UTC at second precision, e.g. {@code 2023-06-02T09:15:00Z}.
     */
    public static String formatTimestamp(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * One row for the narrative body followed by one row per TLF in scan order.
     * Absent population and source program become empty cells.
     *
     * @param manifest Manifest to project
     * @return Rows in CSV order
     */
    public List<ManifestRow> toRows(Manifest manifest) {
        List<ManifestRow> rows = new ArrayList<>();
        NarrativeRecord narrative = manifest.getNarrative();
        rows.add(new ManifestRow(
                NarrativeRecord.ID,
                NarrativeRecord.TYPE,
                "",
                narrative.getFile(),
                narrative.getFirstPage(),
                narrative.getLastPage(),
                narrative.getPageCount(),
                "",
                ""));

        for (TlfRecord tlf : manifest.getTlfs()) {
            rows.add(new ManifestRow(
                    tlf.getId(),
                    tlf.getKind().getLabel(),
                    tlf.getTitle(),
                    tlf.getFile(),
                    tlf.getFirstPage(),
                    tlf.getLastPage(),
                    tlf.getPageCount(),
                    tlf.getPopulation(),
                    tlf.getSourceProgram() != null ? tlf.getSourceProgram() : ""));
        }
        return rows;
    }
}
