package org.starledger.parser.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads the raw snapshot text from a save file.
 * <p>
 * Save files ({@code .sav}) are ZIP archives whose {@code gamestate} member holds the text. Files that are
 * not archives are read directly. Text is decoded as windows-1252 and falls back to UTF-8, dropping
 * malformed input, if the bytes are not valid windows-1252.
 */
public final class SnapshotLoader {

    public static final String GAMESTATE_MEMBER = "gamestate";

    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");
    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    /**
     * Result of loading a save file.
     *
     * @param content     The decoded snapshot text.
     * @param logicalName The path of the file, used in log messages.
     */
    public record LoadResult(String content, String logicalName) {}

    private SnapshotLoader() {}

    /**
     * Loads and decodes the snapshot text of a save file.
     *
     * @param file The save file or plain-text snapshot.
     * @return The decoded content and the file name.
     * @throws IOException If the file cannot be read or the archive has no {@code gamestate} member.
     */
    public static LoadResult load(Path file) throws IOException {
        String logicalName = file.toString().replace('\\', '/');
        byte[] bytes = isZipArchive(file) ? readGamestateMember(file) : Files.readAllBytes(file);
        return new LoadResult(decode(bytes), logicalName);
    }

    /**
     * Decodes snapshot bytes as windows-1252, falling back to lenient UTF-8.
     *
     * @param bytes The raw bytes.
     * @return The decoded text.
     */
    public static String decode(byte[] bytes) {
        try {
            return WINDOWS_1252.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            try {
                return StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.IGNORE)
                        .onUnmappableCharacter(CodingErrorAction.IGNORE)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException impossible) {
                // IGNORE never reports
                throw new IllegalStateException(impossible);
            }
        }
    }

    private static byte[] readGamestateMember(Path file) throws IOException {
        try (ZipFile zip = new ZipFile(file.toFile())) {
            ZipEntry entry = zip.getEntry(GAMESTATE_MEMBER);
            if (entry == null) {
                throw new IOException("Save file has no '" + GAMESTATE_MEMBER + "' member: " + file);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return in.readAllBytes();
            }
        }
    }

    private static boolean isZipArchive(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] header = in.readNBytes(ZIP_MAGIC.length);
            if (header.length < ZIP_MAGIC.length) {
                return false;
            }
            for (int i = 0; i < ZIP_MAGIC.length; i++) {
                if (header[i] != ZIP_MAGIC[i]) {
                    return false;
                }
            }
            return true;
        }
    }
}
