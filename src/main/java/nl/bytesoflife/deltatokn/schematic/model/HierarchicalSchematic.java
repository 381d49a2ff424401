package nl.bytesoflife.deltatokn.schematic.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All sheets of a project, root first, in pre-order depth-first discovery order.
 */
public class HierarchicalSchematic {

    private final String rootFile;
    private final String projectName;
    private final List<SheetEntry> sheets;
    private final List<SkippedSheet> skippedSheets;

    public HierarchicalSchematic(String rootFile, String projectName, List<SheetEntry> sheets,
                                 List<SkippedSheet> skippedSheets) {
        this.rootFile = rootFile;
        this.projectName = projectName;
        this.sheets = List.copyOf(sheets);
        this.skippedSheets = List.copyOf(skippedSheets);
    }

    public String getRootFile() {
        return rootFile;
    }

    public String getProjectName() {
        return projectName;
    }

    public List<SheetEntry> getSheets() {
        return sheets;
    }

    public List<SkippedSheet> getSkippedSheets() {
        return skippedSheets;
    }

    public List<Component> getAllComponents() {
        List<Component> all = new ArrayList<>();
        for (SheetEntry sheet : sheets) {
            all.addAll(sheet.schematic().getComponents());
        }
        return all;
    }

    public Map<String, LibSymbol> getAllLibSymbols() {
        Map<String, LibSymbol> all = new LinkedHashMap<>();
        for (SheetEntry sheet : sheets) {
            all.putAll(sheet.schematic().getLibSymbols());
        }
        return all;
    }

    /**
     * Merges every sheet into a single schematic titled after the project.
     */
    public Schematic flatten() {
        Schematic merged = new Schematic(projectName);
        merged.setFilename(rootFile);
        for (SheetEntry sheet : sheets) {
            Schematic sch = sheet.schematic();
            sch.getLibSymbols().values().forEach(merged::addLibSymbol);
            sch.getComponents().forEach(merged::addComponent);
            sch.getWires().forEach(merged::addWire);
            sch.getJunctions().forEach(merged::addJunction);
            sch.getLabels().forEach(merged::addLabel);
        }
        return merged;
    }

    @Override
    public String toString() {
        return "HierarchicalSchematic{project='" + projectName + "', sheets=" + sheets.size()
                + ", skipped=" + skippedSheets.size() + "}";
    }
}
