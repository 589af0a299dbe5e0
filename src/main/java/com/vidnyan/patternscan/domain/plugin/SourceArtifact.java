package com.vidnyan.patternscan.domain.plugin;

import com.vidnyan.patternscan.domain.error.UnsupportedInputException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Submitted source content. Bytes are decoded once as strict UTF-8; plugins
 * that need text get an {@link UnsupportedInputException} when that failed.
 */
public final class SourceArtifact {
    
    private final String filename;
    private final int sizeBytes;
    private final String text;
    private final String rejection;
    
    private SourceArtifact(String filename, int sizeBytes, String text, String rejection) {
        this.filename = filename;
        this.sizeBytes = sizeBytes;
        this.text = text;
        this.rejection = rejection;
    }
    
    public static SourceArtifact of(String filename, byte[] content) {
        byte[] bytes = content == null ? new byte[0] : content;
        try {
            String decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            if (decoded.indexOf('\0') >= 0) {
                return new SourceArtifact(filename, bytes.length, null, "content contains NUL bytes (binary data)");
            }
            return new SourceArtifact(filename, bytes.length, decoded, null);
        } catch (CharacterCodingException e) {
            return new SourceArtifact(filename, bytes.length, null, "content is not valid UTF-8: " + e.getMessage());
        }
    }
    
    public static SourceArtifact ofText(String filename, String text) {
        return of(filename, text.getBytes(StandardCharsets.UTF_8));
    }
    
    public String filename() {
        return filename;
    }
    
    public int sizeBytes() {
        return sizeBytes;
    }
    
    public boolean isText() {
        return rejection == null;
    }
    
    /**
     * Decoded text.
     *
     * @throws UnsupportedInputException if the content is binary or not UTF-8
     */
    public String text() {
        if (rejection != null) {
            throw new UnsupportedInputException(filename + ": " + rejection);
        }
        return text;
    }
}
