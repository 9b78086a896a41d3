package org.starledger.timeline.importer;

import org.starledger.parser.io.SaveFileScanner.SaveFile;
import org.starledger.parser.model.MapValue;

/**
 * The parse outcome of one save file, tagged with its position in the import order.
 *
 * @param sequence  Position of the file in the import order, starting at 0.
 * @param file      The save file.
 * @param gamestate The parsed snapshot, {@code null} if parsing failed.
 * @param failure   Why loading or parsing failed, {@code null} on success.
 */
public record ParsedSnapshot(int sequence, SaveFile file, MapValue gamestate, Exception failure) {

    public static ParsedSnapshot success(int sequence, SaveFile file, MapValue gamestate) {
        return new ParsedSnapshot(sequence, file, gamestate, null);
    }

    public static ParsedSnapshot failure(int sequence, SaveFile file, Exception failure) {
        return new ParsedSnapshot(sequence, file, null, failure);
    }

    public boolean isParsed() {
        return failure == null;
    }
}
