package dbft.consensus.persistence;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import dbft.common.crypto.KeyFiles;
import dbft.consensus.core.SnapshotState;
import dbft.consensus.message.ChangeViewReason;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageCodec;
import dbft.consensus.message.MessageCodec.CodecException;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.Validator;
import dbft.consensus.validator.ValidatorId;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Binary layout of a persisted {@link SnapshotState}:
 * <pre>
 * byte version
 * varint height | varint view
 * varint n | (varint id | bytes x509PublicKey | bool hasAlias [string alias])*
 * bool hasProposal [hash32]
 * varint n | (byte kindTag | varint m | SignedMessage*)*
 * varint n | (byte kindTag | varint m | varint id*)*
 * varint n | (varint id | byte reasonTag)*
 * varint n | (byte reasonTag | varint count)*
 * varint changeViewTotal
 * varint n | SignedMessage*   (change views of the last view change)
 * </pre>
 */
public final class SnapshotCodec {
    private SnapshotCodec() {}

    public static final int VERSION = 2;
    private static final int MAX_ENTRIES = 0xFFFF;

    public static byte[] encode(SnapshotState s) {
        ByteString.Output buf = ByteString.newOutput();
        try {
            CodedOutputStream out = CodedOutputStream.newInstance(buf);
            out.writeRawByte((byte) VERSION);
            out.writeUInt64NoTag(s.height());
            out.writeUInt32NoTag(s.view().value());

            out.writeUInt32NoTag(s.validators().size());
            for (Validator v : s.validators()) {
                out.writeUInt32NoTag(v.id().value());
                out.writeByteArrayNoTag(v.publicKey().getEncoded());
                out.writeBoolNoTag(v.alias() != null);
                if (v.alias() != null) out.writeStringNoTag(v.alias());
            }

            out.writeBoolNoTag(s.proposal() != null);
            if (s.proposal() != null) MessageCodec.writeHash(out, s.proposal());

            out.writeUInt32NoTag(s.records().size());
            for (var e : s.records().entrySet()) {
                out.writeRawByte((byte) e.getKey().tag());
                out.writeUInt32NoTag(e.getValue().size());
                for (SignedMessage m : e.getValue()) MessageCodec.writeSignedMessage(out, m);
            }

            out.writeUInt32NoTag(s.expected().size());
            for (var e : s.expected().entrySet()) {
                out.writeRawByte((byte) e.getKey().tag());
                out.writeUInt32NoTag(e.getValue().size());
                for (ValidatorId id : e.getValue()) out.writeUInt32NoTag(id.value());
            }

            out.writeUInt32NoTag(s.changeViewReasons().size());
            for (var e : s.changeViewReasons().entrySet()) {
                out.writeUInt32NoTag(e.getKey().value());
                out.writeRawByte((byte) e.getValue().tag());
            }

            out.writeUInt32NoTag(s.changeViewReasonCounts().size());
            for (var e : s.changeViewReasonCounts().entrySet()) {
                out.writeRawByte((byte) e.getKey().tag());
                out.writeUInt32NoTag(e.getValue());
            }
            out.writeUInt32NoTag(s.changeViewTotal());

            out.writeUInt32NoTag(s.lastChangeViews().size());
            for (SignedMessage m : s.lastChangeViews()) MessageCodec.writeSignedMessage(out, m);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toByteString().toByteArray();
    }

    public static SnapshotState decode(byte[] bytes) throws CodecException {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            int version = in.readRawByte() & 0xFF;
            if (version != VERSION) throw new CodecException("unsupported snapshot version " + version);
            long height = in.readUInt64();
            if (height < 0) throw new CodecException("height overflows a signed 64-bit value");
            ViewNumber view = MessageCodec.readView(in);

            int n = MessageCodec.readCount(in, MAX_ENTRIES, "validators");
            List<Validator> validators = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                ValidatorId id = MessageCodec.readValidatorId(in);
                PublicKey pk = decodeKey(in.readByteArray());
                String alias = in.readBool() ? in.readString() : null;
                validators.add(new Validator(id, pk, alias));
            }

            Hash256 proposal = in.readBool() ? MessageCodec.readHash(in) : null;

            Map<MessageKind, List<SignedMessage>> records = new EnumMap<>(MessageKind.class);
            n = MessageCodec.readCount(in, MessageKind.values().length, "record kinds");
            for (int i = 0; i < n; i++) {
                MessageKind kind = readKind(in);
                int m = MessageCodec.readCount(in, MAX_ENTRIES, "records");
                List<SignedMessage> list = new ArrayList<>(m);
                for (int j = 0; j < m; j++) {
                    SignedMessage msg = MessageCodec.readSignedMessage(in);
                    if (msg.kind() != kind) throw new CodecException(msg.kind() + " filed under " + kind);
                    list.add(msg);
                }
                records.put(kind, list);
            }

            Map<MessageKind, List<ValidatorId>> expected = new EnumMap<>(MessageKind.class);
            n = MessageCodec.readCount(in, MessageKind.values().length, "expected kinds");
            for (int i = 0; i < n; i++) {
                MessageKind kind = readKind(in);
                int m = MessageCodec.readCount(in, MAX_ENTRIES, "expected validators");
                List<ValidatorId> ids = new ArrayList<>(m);
                for (int j = 0; j < m; j++) ids.add(MessageCodec.readValidatorId(in));
                expected.put(kind, ids);
            }

            Map<ValidatorId, ChangeViewReason> reasons = new TreeMap<>();
            n = MessageCodec.readCount(in, MAX_ENTRIES, "change view reasons");
            for (int i = 0; i < n; i++) {
                reasons.put(MessageCodec.readValidatorId(in), readReason(in));
            }

            Map<ChangeViewReason, Integer> counts = new EnumMap<>(ChangeViewReason.class);
            n = MessageCodec.readCount(in, ChangeViewReason.values().length, "reason counts");
            for (int i = 0; i < n; i++) {
                counts.put(readReason(in), readNonNegative(in, "reason count"));
            }
            int total = readNonNegative(in, "change view total");

            n = MessageCodec.readCount(in, MAX_ENTRIES, "last change views");
            List<SignedMessage> lastChangeViews = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                SignedMessage msg = MessageCodec.readSignedMessage(in);
                if (msg.kind() != MessageKind.CHANGE_VIEW) throw new CodecException(msg.kind() + " among last change views");
                lastChangeViews.add(msg);
            }

            if (!in.isAtEnd()) throw new CodecException("trailing bytes after snapshot");
            return new SnapshotState(height, view, validators, records, expected, proposal, reasons, counts, total,
                    lastChangeViews);
        } catch (CodecException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new CodecException("malformed snapshot: " + e.getMessage(), e);
        }
    }

    private static PublicKey decodeKey(byte[] x509) throws CodecException {
        try {
            return KeyFiles.decodePublicKey(x509);
        } catch (InvalidKeySpecException e) {
            throw new CodecException("bad validator public key", e);
        }
    }

    private static int readNonNegative(CodedInputStream in, String what) throws IOException {
        int v = in.readUInt32();
        if (v < 0) throw new CodecException(what + " out of range: " + Integer.toUnsignedString(v));
        return v;
    }

    private static MessageKind readKind(CodedInputStream in) throws IOException {
        return MessageKind.fromTag(in.readRawByte() & 0xFF);
    }

    private static ChangeViewReason readReason(CodedInputStream in) throws IOException {
        return ChangeViewReason.fromTag(in.readRawByte() & 0xFF);
    }
}
