package org.Aayush.tempo.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("File Zone Store Tests")
class FileZoneStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Write then open keeps every built-in record")
    void testFileRoundTrip() {
        InMemoryZoneStore builtIn = InMemoryZoneStore.builder()
                .addAll(new BuiltInZoneRecordProvider().records())
                .build();
        Path file = tempDir.resolve("zones.tzdb");

        FileZoneStore.write(file, builtIn);
        FileZoneStore loaded = FileZoneStore.open(file);

        assertEquals(file, loaded.source());
        assertEquals(builtIn.zoneNames(), loaded.zoneNames());
        for (String name : builtIn.zoneNames()) {
            assertEquals(builtIn.record(name), loaded.record(name), name);
        }
    }

    @Test
    @DisplayName("Encoded header is little-endian magic, version and counts")
    void testHeaderLayout() {
        InMemoryZoneStore store = InMemoryZoneStore.builder()
                .addFixed("UTC", Offset.UTC)
                .build();
        ByteBuffer encoded = FileZoneStore.encode(store).order(ByteOrder.LITTLE_ENDIAN);

        assertEquals((byte) 'T', encoded.get(0));
        assertEquals(FileZoneStore.FILE_IDENTIFIER, encoded.getInt(0));
        assertEquals(FileZoneStore.FORMAT_VERSION, encoded.getInt(4));
        assertEquals(0, encoded.getInt(8));
        assertEquals(1, encoded.getInt(12));
        assertEquals(16 + 2 + 3 + 1, encoded.remaining());
    }

    @Test
    @DisplayName("Exception Path: bad magic")
    void testBadMagic() {
        ZoneRecordException ex = assertThrows(ZoneRecordException.class,
                () -> FileZoneStore.decode(ByteBuffer.allocate(16)));
        assertEquals(ZoneRecordException.REASON_BAD_MAGIC, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + ZoneRecordException.REASON_BAD_MAGIC + "]"));
    }

    @Test
    @DisplayName("Exception Path: header too short")
    void testTruncatedHeader() {
        ZoneRecordException ex = assertThrows(ZoneRecordException.class,
                () -> FileZoneStore.decode(ByteBuffer.allocate(8)));
        assertEquals(ZoneRecordException.REASON_TRUNCATED, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: record section ends early")
    void testTruncatedRecords() {
        ByteBuffer encoded = FileZoneStore.encode(InMemoryZoneStore.builder()
                .addFixed("Asia/Tokyo", new Offset(9, 0, 1))
                .build());
        encoded.limit(encoded.limit() - 1);

        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(encoded));
        assertEquals(ZoneRecordException.REASON_TRUNCATED, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: unsupported version")
    void testUnsupportedVersion() {
        ByteBuffer encoded = FileZoneStore.encode(InMemoryZoneStore.empty()).order(ByteOrder.LITTLE_ENDIAN);
        encoded.putInt(4, FileZoneStore.FORMAT_VERSION + 1);

        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(encoded));
        assertEquals(ZoneRecordException.REASON_UNSUPPORTED_VERSION, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: duplicate zone names")
    void testDuplicateZone() {
        ByteBuffer buffer = header(0, 2);
        putFixed(buffer, "UTC", (byte) 0);
        putFixed(buffer, "UTC", (byte) 0);
        buffer.flip();

        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(buffer));
        assertEquals(ZoneRecordException.REASON_DUPLICATE_ZONE, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: reserved offset bits, unencodable DST offsets and negative counts")
    void testInvalidRecord() {
        ByteBuffer reserved = header(0, 1);
        putFixed(reserved, "UTC", (byte) 0x06);
        reserved.flip();
        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(reserved));
        assertEquals(ZoneRecordException.REASON_INVALID_RECORD, ex.reasonCode());

        ByteBuffer unencodable = header(1, 0);
        byte[] name = "Test/MinusQuarterTo".getBytes(StandardCharsets.UTF_8);
        unencodable.putShort((short) name.length);
        unencodable.put(name);
        unencodable.putInt(new TransitionRule(3, 6, false, 1, 2).bits() << 20
                | new TransitionRule(11, 6, false, 0, 2).bits() << 8
                | (new Offset(0, 45, -1).toByte() & 0xFF));
        unencodable.flip();
        ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(unencodable));
        assertEquals(ZoneRecordException.REASON_INVALID_RECORD, ex.reasonCode());

        ByteBuffer negative = header(-1, 0);
        negative.flip();
        ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.decode(negative));
        assertEquals(ZoneRecordException.REASON_INVALID_RECORD, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: missing file")
    void testMissingFile() {
        ZoneRecordException ex = assertThrows(ZoneRecordException.class,
                () -> FileZoneStore.open(tempDir.resolve("absent.tzdb")));
        assertEquals(ZoneRecordException.REASON_FILE_IO, ex.reasonCode());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    @DisplayName("Garbage file on disk is rejected by open")
    void testGarbageFile() throws IOException {
        Path file = tempDir.resolve("garbage.tzdb");
        Files.write(file, "not a zone database".getBytes(StandardCharsets.UTF_8));

        ZoneRecordException ex = assertThrows(ZoneRecordException.class, () -> FileZoneStore.open(file));
        assertEquals(ZoneRecordException.REASON_BAD_MAGIC, ex.reasonCode());
    }

    private static ByteBuffer header(int dstCount, int fixedCount) {
        ByteBuffer buffer = ByteBuffer.allocate(256).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(FileZoneStore.FILE_IDENTIFIER);
        buffer.putInt(FileZoneStore.FORMAT_VERSION);
        buffer.putInt(dstCount);
        buffer.putInt(fixedCount);
        return buffer;
    }

    private static void putFixed(ByteBuffer buffer, String name, byte offset) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        buffer.putShort((short) bytes.length);
        buffer.put(bytes);
        buffer.put(offset);
    }
}
