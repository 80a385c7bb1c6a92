package io.github.yok.flexretire.db.tx;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;
import javax.transaction.xa.Xid;

/**
 * Transaction branch identifier: a global id shared by all participants plus a per-participant
 * branch qualifier.
 *
 * @author Yasuharu.Okawauchi
 */
public final class BranchXid implements Xid {

    static final int FORMAT_ID = 0x46524554;

    private final byte[] globalTransactionId;
    private final byte[] branchQualifier;

    private BranchXid(byte[] globalTransactionId, byte[] branchQualifier) {
        this.globalTransactionId = globalTransactionId;
        this.branchQualifier = branchQualifier;
    }

    /**
     * Generates a new random global transaction id.
     *
     * @return 16-byte global id
     */
    public static byte[] newGlobalId() {
        UUID uuid = UUID.randomUUID();
        return ByteBuffer.allocate(16).putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits()).array();
    }

    /**
     * Creates the branch id of one participant.
     *
     * @param globalId shared global id
     * @param branch participant index
     * @return branch id
     */
    public static BranchXid of(byte[] globalId, int branch) {
        return new BranchXid(globalId.clone(),
                ("b" + branch).getBytes(StandardCharsets.US_ASCII));
    }

    @Override
    public int getFormatId() {
        return FORMAT_ID;
    }

    @Override
    public byte[] getGlobalTransactionId() {
        return globalTransactionId.clone();
    }

    @Override
    public byte[] getBranchQualifier() {
        return branchQualifier.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Xid)) {
            return false;
        }
        Xid other = (Xid) o;
        return other.getFormatId() == FORMAT_ID
                && Arrays.equals(globalTransactionId, other.getGlobalTransactionId())
                && Arrays.equals(branchQualifier, other.getBranchQualifier());
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(globalTransactionId) + Arrays.hashCode(branchQualifier);
    }

    @Override
    public String toString() {
        return "BranchXid[" + UUID.nameUUIDFromBytes(globalTransactionId) + "/"
                + new String(branchQualifier, StandardCharsets.US_ASCII) + "]";
    }
}
