package nl.bytesoflife.deltatokn.generator;

import nl.bytesoflife.deltatokn.schematic.model.SkippedSheet;

import java.nio.file.Path;

/**
 * Progress of one generation run, published on the session's {@link EventChannel}.
 */
public sealed interface GenerationEvent
        permits GenerationEvent.GenerationStarted, GenerationEvent.SheetSkipped,
                GenerationEvent.GenerationCompleted, GenerationEvent.GenerationFailed {

    record GenerationStarted(Path projectDirectory) implements GenerationEvent {}

    record SheetSkipped(SkippedSheet sheet) implements GenerationEvent {}

    record GenerationCompleted(int components, int nets, Path output) implements GenerationEvent {}

    record GenerationFailed(String reason) implements GenerationEvent {}
}
