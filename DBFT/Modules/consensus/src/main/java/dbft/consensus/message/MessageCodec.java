package dbft.consensus.message;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import dbft.consensus.message.ConsensusMessage.ChangeView;
import dbft.consensus.message.ConsensusMessage.ChangeViewCompact;
import dbft.consensus.message.ConsensusMessage.Commit;
import dbft.consensus.message.ConsensusMessage.CommitCompact;
import dbft.consensus.message.ConsensusMessage.PrepareRequest;
import dbft.consensus.message.ConsensusMessage.PrepareRequestCompact;
import dbft.consensus.message.ConsensusMessage.PrepareResponse;
import dbft.consensus.message.ConsensusMessage.PreparationCompact;
import dbft.consensus.message.ConsensusMessage.RecoveryMessage;
import dbft.consensus.message.ConsensusMessage.RecoveryRequest;
import dbft.consensus.validator.ValidatorId;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical binary form of consensus messages, used for signing and for transport.
 * Integers are unsigned varints, hashes are 32 raw bytes, byte strings are length-prefixed,
 * kinds and reasons are single tag bytes. Field order is fixed; changing it breaks every
 * signature on the network.
 */
public final class MessageCodec {
    private MessageCodec() {}

    public static final int MAX_TX_HASHES = 0xFFFF;
    public static final int MAX_COMPACT_ENTRIES = 1024;

    public static final class CodecException extends IOException {
        public CodecException(String message) { super(message); }
        public CodecException(String message, Throwable cause) { super(message, cause); }
    }

    public static ByteString encode(SignedMessage m) {
        ByteString.Output buf = ByteString.newOutput();
        try {
            CodedOutputStream out = CodedOutputStream.newInstance(buf);
            writeSignedMessage(out, m);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toByteString();
    }

    public static ByteString encodeUnsigned(long height, ValidatorId validator, ViewNumber view, ConsensusMessage message) {
        ByteString.Output buf = ByteString.newOutput();
        try {
            CodedOutputStream out = CodedOutputStream.newInstance(buf);
            writeHeader(out, height, validator, view, message);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toByteString();
    }

    public static SignedMessage decode(ByteString bytes) throws CodecException {
        return decode(bytes.toByteArray());
    }

    public static SignedMessage decode(byte[] bytes) throws CodecException {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            SignedMessage m = readSignedMessage(in);
            if (!in.isAtEnd()) throw new CodecException("trailing bytes after signed message");
            return m;
        } catch (CodecException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new CodecException("malformed signed message: " + e.getMessage(), e);
        }
    }

    public static void writeSignedMessage(CodedOutputStream out, SignedMessage m) throws IOException {
        writeHeader(out, m.height(), m.validator(), m.view(), m.message());
        out.writeBytesNoTag(m.signature());
    }

    public static SignedMessage readSignedMessage(CodedInputStream in) throws IOException {
        long height = in.readUInt64();
        if (height < 0) throw new CodecException("height overflows a signed 64-bit value");
        ValidatorId validator = readValidatorId(in);
        ViewNumber view = readView(in);
        ConsensusMessage message = readMessage(in);
        ByteString signature = in.readBytes();
        return new SignedMessage(height, validator, view, message, signature);
    }

    private static void writeHeader(CodedOutputStream out, long height, ValidatorId validator, ViewNumber view,
                                    ConsensusMessage message) throws IOException {
        out.writeUInt64NoTag(height);
        out.writeUInt32NoTag(validator.value());
        out.writeUInt32NoTag(view.value());
        writeMessage(out, message);
    }

    public static void writeMessage(CodedOutputStream out, ConsensusMessage message) throws IOException {
        out.writeRawByte((byte) message.kind().tag());
        switch (message.kind()) {
            case CHANGE_VIEW -> {
                ChangeView cv = (ChangeView) message;
                out.writeRawByte((byte) cv.reason().tag());
                out.writeUInt64NoTag(cv.timestamp());
            }
            case PREPARE_REQUEST -> writePrepareRequest(out, (PrepareRequest) message);
            case PREPARE_RESPONSE -> writeHash(out, ((PrepareResponse) message).preparationHash());
            case COMMIT -> out.writeBytesNoTag(((Commit) message).signature());
            case RECOVERY_REQUEST -> out.writeUInt64NoTag(((RecoveryRequest) message).timestamp());
            case RECOVERY_MESSAGE -> writeRecovery(out, (RecoveryMessage) message);
        }
    }

    public static ConsensusMessage readMessage(CodedInputStream in) throws IOException {
        MessageKind kind;
        try {
            kind = MessageKind.fromTag(in.readRawByte() & 0xFF);
        } catch (IllegalArgumentException e) {
            throw new CodecException(e.getMessage(), e);
        }
        return switch (kind) {
            case CHANGE_VIEW -> new ChangeView(readReason(in), in.readUInt64());
            case PREPARE_REQUEST -> readPrepareRequest(in);
            case PREPARE_RESPONSE -> new PrepareResponse(readHash(in));
            case COMMIT -> new Commit(in.readBytes());
            case RECOVERY_REQUEST -> new RecoveryRequest(in.readUInt64());
            case RECOVERY_MESSAGE -> readRecovery(in);
        };
    }

    private static void writePrepareRequest(CodedOutputStream out, PrepareRequest pr) throws IOException {
        writeHash(out, pr.proposal());
        out.writeUInt64NoTag(pr.height());
        out.writeUInt32NoTag(pr.txHashes().size());
        for (Hash256 h : pr.txHashes()) writeHash(out, h);
        out.writeUInt64NoTag(pr.timestamp());
        out.writeUInt64NoTag(pr.nonce());
    }

    private static PrepareRequest readPrepareRequest(CodedInputStream in) throws IOException {
        Hash256 proposal = readHash(in);
        long height = in.readUInt64();
        int count = readCount(in, MAX_TX_HASHES, "tx hashes");
        List<Hash256> txs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) txs.add(readHash(in));
        long timestamp = in.readUInt64();
        long nonce = in.readUInt64();
        return new PrepareRequest(proposal, height, txs, timestamp, nonce);
    }

    private static void writeRecovery(CodedOutputStream out, RecoveryMessage rm) throws IOException {
        out.writeUInt32NoTag(rm.changeViews().size());
        for (ChangeViewCompact cv : rm.changeViews()) {
            out.writeUInt32NoTag(cv.validator().value());
            out.writeUInt32NoTag(cv.originalView().value());
            out.writeRawByte((byte) cv.reason().tag());
            out.writeUInt64NoTag(cv.timestamp());
            out.writeBytesNoTag(cv.signature());
        }
        out.writeBoolNoTag(rm.prepareRequest() != null);
        if (rm.prepareRequest() != null) {
            out.writeUInt32NoTag(rm.prepareRequest().validator().value());
            writePrepareRequest(out, rm.prepareRequest().request());
            out.writeBytesNoTag(rm.prepareRequest().signature());
        }
        out.writeBoolNoTag(rm.preparationHash() != null);
        if (rm.preparationHash() != null) writeHash(out, rm.preparationHash());
        out.writeUInt32NoTag(rm.preparations().size());
        for (PreparationCompact p : rm.preparations()) {
            out.writeUInt32NoTag(p.validator().value());
            out.writeBytesNoTag(p.signature());
        }
        out.writeUInt32NoTag(rm.commits().size());
        for (CommitCompact c : rm.commits()) {
            out.writeUInt32NoTag(c.validator().value());
            out.writeUInt32NoTag(c.view().value());
            out.writeBytesNoTag(c.commitSignature());
            out.writeBytesNoTag(c.signature());
        }
    }

    private static RecoveryMessage readRecovery(CodedInputStream in) throws IOException {
        int cvCount = readCount(in, MAX_COMPACT_ENTRIES, "change views");
        List<ChangeViewCompact> changeViews = new ArrayList<>(cvCount);
        for (int i = 0; i < cvCount; i++) {
            changeViews.add(new ChangeViewCompact(readValidatorId(in), readView(in), readReason(in),
                    in.readUInt64(), in.readBytes()));
        }
        PrepareRequestCompact request = null;
        if (in.readBool()) {
            ValidatorId v = readValidatorId(in);
            PrepareRequest pr = readPrepareRequest(in);
            request = new PrepareRequestCompact(v, pr, in.readBytes());
        }
        Hash256 preparationHash = in.readBool() ? readHash(in) : null;
        int pCount = readCount(in, MAX_COMPACT_ENTRIES, "preparations");
        List<PreparationCompact> preparations = new ArrayList<>(pCount);
        for (int i = 0; i < pCount; i++) {
            preparations.add(new PreparationCompact(readValidatorId(in), in.readBytes()));
        }
        int cCount = readCount(in, MAX_COMPACT_ENTRIES, "commits");
        List<CommitCompact> commits = new ArrayList<>(cCount);
        for (int i = 0; i < cCount; i++) {
            commits.add(new CommitCompact(readValidatorId(in), readView(in), in.readBytes(), in.readBytes()));
        }
        return new RecoveryMessage(changeViews, request, preparationHash, preparations, commits);
    }

    public static void writeHash(CodedOutputStream out, Hash256 hash) throws IOException {
        out.writeRawBytes(hash.bytes());
    }

    public static Hash256 readHash(CodedInputStream in) throws IOException {
        return Hash256.of(in.readRawBytes(Hash256.LENGTH));
    }

    public static ValidatorId readValidatorId(CodedInputStream in) throws IOException {
        int raw = in.readUInt32();
        if (raw < 0 || raw > ValidatorId.MAX) throw new CodecException("validator id out of range: " + Integer.toUnsignedString(raw));
        return ValidatorId.of(raw);
    }

    public static ViewNumber readView(CodedInputStream in) throws IOException {
        int raw = in.readUInt32();
        if (raw < 0) throw new CodecException("view out of range: " + Integer.toUnsignedString(raw));
        return ViewNumber.of(raw);
    }

    private static ChangeViewReason readReason(CodedInputStream in) throws IOException {
        try {
            return ChangeViewReason.fromTag(in.readRawByte() & 0xFF);
        } catch (IllegalArgumentException e) {
            throw new CodecException(e.getMessage(), e);
        }
    }

    public static int readCount(CodedInputStream in, int max, String what) throws IOException {
        int n = in.readUInt32();
        if (n < 0 || n > max) throw new CodecException("too many " + what + ": " + Integer.toUnsignedString(n));
        return n;
    }
}
