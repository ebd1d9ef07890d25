package org.Aayush.tempo.zone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Zone store loaded from a compact binary file.
 * <p>
 * Layout (little-endian):
 * </p>
 * <pre>
 * int32  magic    0x42445A54 ("TZDB")
 * int32  version  1
 * int32  dstCount
 * int32  fixedCount
 * dstCount   x { uint16 nameLength, UTF-8 name, int32 packed DstZone }
 * fixedCount x { uint16 nameLength, UTF-8 name, int8 packed Offset }
 * </pre>
 * <p>
 * The file is read once into an {@link InMemoryZoneStore}; lookups never touch disk.
 * </p>
 */
public final class FileZoneStore implements ZoneStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileZoneStore.class);

    /**
     * Zone file identifier as little-endian int. Hex value maps to ASCII "TZDB".
     */
    public static final int FILE_IDENTIFIER = 0x42445A54;
    public static final int FORMAT_VERSION = 1;

    private static final int HEADER_BYTES = 16;
    private static final int MAX_NAME_BYTES = 0xFFFF;

    private final Path source;
    private final InMemoryZoneStore delegate;

    private FileZoneStore(Path source, InMemoryZoneStore delegate) {
        this.source = source;
        this.delegate = delegate;
    }

    /**
     * Reads a zone file.
     *
     * @throws ZoneRecordException when the file is unreadable or malformed.
     */
    public static FileZoneStore open(Path path) {
        Objects.requireNonNull(path, "path");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ZoneRecordException(ZoneRecordException.REASON_FILE_IO, "cannot read zone file " + path, e);
        }
        InMemoryZoneStore store = decode(ByteBuffer.wrap(bytes), path.toString());
        LOGGER.debug("Loaded {} zones from {}", store.size(), path);
        return new FileZoneStore(path, store);
    }

    /**
     * Decodes zone records from an in-memory buffer.
     *
     * @throws ZoneRecordException when the buffer is malformed.
     */
    public static InMemoryZoneStore decode(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        return decode(buffer, "buffer");
    }

    /**
     * Writes every record of {@code store} to {@code path}, replacing any existing file.
     *
     * @throws ZoneRecordException when the file cannot be written.
     */
    public static void write(Path path, ZoneStore store) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(store, "store");
        ByteBuffer encoded = encode(store);
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        try {
            Files.write(path, bytes);
        } catch (IOException e) {
            throw new ZoneRecordException(ZoneRecordException.REASON_FILE_IO, "cannot write zone file " + path, e);
        }
        LOGGER.debug("Wrote {} zones to {}", store.size(), path);
    }

    /**
     * Encodes every record of {@code store}.
     *
     * @return little-endian buffer positioned at zero.
     */
    public static ByteBuffer encode(ZoneStore store) {
        Objects.requireNonNull(store, "store");
        List<byte[]> dstNames = new ArrayList<>();
        List<DstZone> dstZones = new ArrayList<>();
        List<byte[]> fixedNames = new ArrayList<>();
        List<Offset> fixedOffsets = new ArrayList<>();
        int size = HEADER_BYTES;
        for (String name : store.zoneNames().stream().sorted().toList()) {
            ZoneRecord record = store.record(name).orElse(null);
            if (record == null) {
                continue;
            }
            byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
            if (nameBytes.length > MAX_NAME_BYTES) {
                throw new ZoneRecordException(
                        ZoneRecordException.REASON_INVALID_RECORD,
                        "zone name exceeds " + MAX_NAME_BYTES + " bytes: " + name
                );
            }
            if (record.hasDst()) {
                dstNames.add(nameBytes);
                dstZones.add(record.dstZone().orElseThrow());
                size += Short.BYTES + nameBytes.length + Integer.BYTES;
            } else {
                fixedNames.add(nameBytes);
                fixedOffsets.add(record.offset());
                size += Short.BYTES + nameBytes.length + Byte.BYTES;
            }
        }

        ByteBuffer out = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        out.putInt(FILE_IDENTIFIER);
        out.putInt(FORMAT_VERSION);
        out.putInt(dstNames.size());
        out.putInt(fixedNames.size());
        for (int i = 0; i < dstNames.size(); i++) {
            putName(out, dstNames.get(i));
            out.putInt(dstZones.get(i).bits());
        }
        for (int i = 0; i < fixedNames.size(); i++) {
            putName(out, fixedNames.get(i));
            out.put(fixedOffsets.get(i).toByte());
        }
        out.flip();
        return out;
    }

    /**
     * Returns the file this store was read from.
     */
    public Path source() {
        return source;
    }

    @Override
    public Optional<DstZone> dstZone(String zoneName) {
        return delegate.dstZone(zoneName);
    }

    @Override
    public Optional<Offset> fixedOffset(String zoneName) {
        return delegate.fixedOffset(zoneName);
    }

    @Override
    public Set<String> zoneNames() {
        return delegate.zoneNames();
    }

    private static InMemoryZoneStore decode(ByteBuffer buffer, String origin) {
        ByteBuffer bb = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (bb.remaining() < HEADER_BYTES) {
            throw corrupt(ZoneRecordException.REASON_TRUNCATED, origin, "too small for zone file header");
        }
        int ident = bb.getInt();
        if (ident != FILE_IDENTIFIER) {
            throw corrupt(
                    ZoneRecordException.REASON_BAD_MAGIC,
                    origin,
                    String.format("invalid file identifier: expected 0x%08X, found 0x%08X", FILE_IDENTIFIER, ident)
            );
        }
        int version = bb.getInt();
        if (version != FORMAT_VERSION) {
            throw corrupt(ZoneRecordException.REASON_UNSUPPORTED_VERSION, origin, "unsupported version " + version);
        }
        int dstCount = bb.getInt();
        int fixedCount = bb.getInt();
        if (dstCount < 0 || fixedCount < 0) {
            throw corrupt(
                    ZoneRecordException.REASON_INVALID_RECORD,
                    origin,
                    "negative record count: dst=" + dstCount + ", fixed=" + fixedCount
            );
        }

        InMemoryZoneStore.Builder builder = InMemoryZoneStore.builder();
        HashSet<String> seen = new HashSet<>();
        try {
            for (int i = 0; i < dstCount; i++) {
                String name = readName(bb);
                int bits = bb.getInt();
                requireUnique(seen, name, origin);
                builder.addDst(name, DstZone.fromBits(bits));
            }
            for (int i = 0; i < fixedCount; i++) {
                String name = readName(bb);
                byte bits = bb.get();
                requireUnique(seen, name, origin);
                builder.addFixed(name, Offset.fromByte(bits));
            }
        } catch (BufferUnderflowException e) {
            throw corrupt(ZoneRecordException.REASON_TRUNCATED, origin, "record section ends early");
        } catch (IllegalArgumentException e) {
            throw corrupt(ZoneRecordException.REASON_INVALID_RECORD, origin, e.getMessage());
        }
        return builder.build();
    }

    private static void requireUnique(Set<String> seen, String name, String origin) {
        if (!seen.add(name)) {
            throw corrupt(ZoneRecordException.REASON_DUPLICATE_ZONE, origin, "duplicate zone " + name);
        }
    }

    private static String readName(ByteBuffer bb) {
        int length = Short.toUnsignedInt(bb.getShort());
        if (length > bb.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] bytes = new byte[length];
        bb.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void putName(ByteBuffer out, byte[] nameBytes) {
        out.putShort((short) nameBytes.length);
        out.put(nameBytes);
    }

    private static ZoneRecordException corrupt(String reasonCode, String origin, String detail) {
        LOGGER.warn("Rejecting zone data from {}: {}", origin, detail);
        return new ZoneRecordException(reasonCode, "corrupt zone data in " + origin + ": " + detail);
    }
}
