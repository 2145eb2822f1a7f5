package im.arun.tlfextract.service;

import im.arun.tlfextract.model.Manifest;
import im.arun.tlfextract.model.NarrativeRecord;
import im.arun.tlfextract.model.TlfKind;
import im.arun.tlfextract.model.TlfRecord;
import im.arun.tlfextract.segment.SegmentationResult;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * What an extraction run found, independent of whether anything was written.
 */
@Value
public class ExtractionSummary {
    Manifest manifest;
    SegmentationResult segmentation;

    public int getTlfCount() {
        return manifest.getTlfs().size();
    }

    public List<String> render() {
        NarrativeRecord narrative = manifest.getNarrative();
        long tables = segmentation.count(TlfKind.TABLE);
        long figures = segmentation.count(TlfKind.FIGURE);

        List<String> lines = new ArrayList<>();
        lines.add("=== Extraction Summary ===");
        lines.add(String.format("Source: %s (%d pages)", manifest.getSourceFile(), manifest.getSourcePages()));
        lines.add(String.format("Narrative: pages %d-%d -> %s",
                narrative.getFirstPage(), narrative.getLastPage(), narrative.getFile()));
        lines.add(String.format("TLFs extracted: %d (%d table%s, %d figure%s)", getTlfCount(),
                tables, tables != 1 ? "s" : "", figures, figures != 1 ? "s" : ""));
        lines.add("Total TLF pages: " + segmentation.getTotalTlfPages());
        lines.add("Warnings: " + segmentation.getWarnings());
        lines.add("");
        for (TlfRecord tlf : manifest.getTlfs()) {
            lines.add(String.format("%-14s %-6s %s", tlf.getId(), "(" + tlf.getPageCount() + "p)", tlf.getTitle()));
        }
        return lines;
    }
}
