package nl.bytesoflife.deltatokn.generator;

import nl.bytesoflife.deltatokn.schematic.model.SkippedSheet;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link NetlistGenerator#generate(GenerationSession)}. On failure the counts are zero
 * and {@code failureReason} says why.
 */
public record GenerationResult(boolean success, Path output, int components, int nets,
                               List<SkippedSheet> skippedSheets, String failureReason) {

    public GenerationResult {
        skippedSheets = List.copyOf(skippedSheets);
    }

    static GenerationResult succeeded(Path output, int components, int nets, List<SkippedSheet> skipped) {
        return new GenerationResult(true, output, components, nets, skipped, null);
    }

    static GenerationResult failed(Path output, String reason) {
        return new GenerationResult(false, output, 0, 0, List.of(), reason);
    }
}
