package com.sqllint.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 上传 SQL 文件解码：识别 BOM，否则严格按 UTF-8 解码，失败时依次回退到 GB18030、ISO-8859-1
 */
public final class SqlTextDecoder {

    private static final List<Charset> FALLBACKS = List.of(
            Charset.forName("GB18030"), StandardCharsets.ISO_8859_1);

    private enum Bom {
        UTF_8(StandardCharsets.UTF_8, (byte) 0xEF, (byte) 0xBB, (byte) 0xBF),
        UTF_16LE(StandardCharsets.UTF_16LE, (byte) 0xFF, (byte) 0xFE),
        UTF_16BE(StandardCharsets.UTF_16BE, (byte) 0xFE, (byte) 0xFF);

        private final Charset charset;
        private final byte[] marker;

        Bom(Charset charset, byte... marker) {
            this.charset = charset;
            this.marker = marker;
        }

        boolean matches(byte[] bytes) {
            if (bytes.length < marker.length) {
                return false;
            }
            for (int i = 0; i < marker.length; i++) {
                if (bytes[i] != marker[i]) {
                    return false;
                }
            }
            return true;
        }
    }

    private SqlTextDecoder() {
    }

    public static DecodedSql decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedSql("", StandardCharsets.UTF_8.name(), false);
        }

        for (Bom bom : Bom.values()) {
            if (bom.matches(bytes)) {
                int skip = bom.marker.length;
                return new DecodedSql(new String(bytes, skip, bytes.length - skip, bom.charset),
                        bom.charset.name(), false);
            }
        }

        String utf8 = tryStrictDecode(bytes, StandardCharsets.UTF_8);
        if (utf8 != null) {
            return new DecodedSql(utf8, StandardCharsets.UTF_8.name(), false);
        }
        for (Charset charset : FALLBACKS) {
            String decoded = tryStrictDecode(bytes, charset);
            if (decoded != null) {
                return new DecodedSql(decoded, charset.name(), true);
            }
        }
        // ISO-8859-1 可映射所有字节，不会走到这里
        throw new IllegalStateException("无法解码上传的 SQL 文件");
    }

    private static String tryStrictDecode(byte[] bytes, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    public record DecodedSql(String text, String charsetName, boolean usedFallbackCharset) {
        public String buildNotice(String fileName) {
            if (!usedFallbackCharset) {
                return null;
            }
            return fileName + " 不是有效的 UTF-8 编码，已按 " + charsetName + " 解码，位置信息以解码后的文本为准。";
        }
    }
}
