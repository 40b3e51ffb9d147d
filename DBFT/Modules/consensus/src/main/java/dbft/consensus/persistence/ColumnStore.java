package dbft.consensus.persistence;

import java.io.IOException;
import java.util.Optional;

/** Column-keyed byte store. Transactional guarantees, if any, belong to the implementation. */
public interface ColumnStore {

    void put(String column, byte[] key, byte[] value) throws IOException;

    Optional<byte[]> get(String column, byte[] key) throws IOException;

    void delete(String column, byte[] key) throws IOException;
}
