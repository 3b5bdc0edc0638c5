package com.sqllint.util;

import com.sqllint.util.SqlTextDecoder.DecodedSql;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SqlTextDecoderTest {

    private static byte[] concat(byte[] prefix, byte[] body) {
        byte[] result = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(body, 0, result, prefix.length, body.length);
        return result;
    }

    @Test
    void shouldFallBackToGb18030ForInvalidUtf8() {
        String sql = "SELECT '中文' UNION SELECT 1";
        byte[] bytes = sql.getBytes(Charset.forName("GB18030"));

        DecodedSql decoded = SqlTextDecoder.decode(bytes);

        assertTrue(decoded.usedFallbackCharset());
        assertEquals("GB18030", decoded.charsetName());
        assertEquals(sql, decoded.text());
        String notice = decoded.buildNotice("cn.sql");
        assertNotNull(notice);
        assertTrue(notice.contains("cn.sql"));
        assertTrue(notice.contains("GB18030"));
    }

    @Test
    void shouldStripUtf8Bom() {
        byte[] bytes = concat(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF},
                "SELECT 1".getBytes(StandardCharsets.UTF_8));

        DecodedSql decoded = SqlTextDecoder.decode(bytes);

        assertEquals("SELECT 1", decoded.text());
        assertFalse(decoded.usedFallbackCharset());
        assertNull(decoded.buildNotice("bom.sql"));
    }

    @Test
    void shouldDecodeUtf16LittleEndianBom() {
        byte[] bytes = concat(new byte[]{(byte) 0xFF, (byte) 0xFE},
                "SELECT 1\nUNION\nSELECT 2".getBytes(StandardCharsets.UTF_16LE));

        DecodedSql decoded = SqlTextDecoder.decode(bytes);

        assertEquals("SELECT 1\nUNION\nSELECT 2", decoded.text());
        assertEquals(StandardCharsets.UTF_16LE.name(), decoded.charsetName());
        assertNull(decoded.buildNotice("le.sql"));
    }

    @Test
    void shouldDecodeUtf16BigEndianBom() {
        byte[] bytes = concat(new byte[]{(byte) 0xFE, (byte) 0xFF},
                "SELECT 1".getBytes(StandardCharsets.UTF_16BE));

        assertEquals("SELECT 1", SqlTextDecoder.decode(bytes).text());
    }

    @Test
    void shouldReadPlainUtf8WithoutNotice() {
        DecodedSql decoded = SqlTextDecoder.decode("SELECT 'é'".getBytes(StandardCharsets.UTF_8));

        assertEquals("SELECT 'é'", decoded.text());
        assertNull(decoded.buildNotice("utf8.sql"));
    }

    @Test
    void shouldHandleEmptyInput() {
        DecodedSql decoded = SqlTextDecoder.decode(new byte[0]);

        assertEquals("", decoded.text());
        assertFalse(decoded.usedFallbackCharset());
        assertNull(decoded.buildNotice("empty.sql"));
        assertEquals("", SqlTextDecoder.decode(null).text());
    }
}
