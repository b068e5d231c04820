package uk.gegc.aiready.features.conversion.infra;

import org.apache.poi.poifs.filesystem.FileMagic;

/**
 * Container sniffing shared by the POI-based extractors.
 */
final class OfficeFiles {

    private OfficeFiles() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * OOXML (zip) or OLE2 signature of the content; {@link FileMagic#UNKNOWN} for input shorter than a header.
     */
    static FileMagic magicOf(byte[] bytes) {
        return bytes == null || bytes.length < 8 ? FileMagic.UNKNOWN : FileMagic.valueOf(bytes);
    }
}
