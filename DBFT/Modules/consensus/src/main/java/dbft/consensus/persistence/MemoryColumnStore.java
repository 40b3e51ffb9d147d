package dbft.consensus.persistence;

import dbft.common.util.Hex;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class MemoryColumnStore implements ColumnStore {
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, byte[]>> columns = new ConcurrentHashMap<>();

    @Override
    public void put(String column, byte[] key, byte[] value) {
        columns.computeIfAbsent(column, c -> new ConcurrentHashMap<>()).put(Hex.toHex(key), Arrays.copyOf(value, value.length));
    }

    @Override
    public Optional<byte[]> get(String column, byte[] key) {
        Map<String, byte[]> rows = columns.get(column);
        if (rows == null) return Optional.empty();
        byte[] v = rows.get(Hex.toHex(key));
        return v == null ? Optional.empty() : Optional.of(Arrays.copyOf(v, v.length));
    }

    @Override
    public void delete(String column, byte[] key) {
        Map<String, byte[]> rows = columns.get(column);
        if (rows != null) rows.remove(Hex.toHex(key));
    }

    public int size(String column) {
        Map<String, byte[]> rows = columns.get(column);
        return rows == null ? 0 : rows.size();
    }
}
