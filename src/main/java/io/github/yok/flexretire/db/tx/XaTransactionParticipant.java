package io.github.yok.flexretire.db.tx;

import java.sql.SQLException;
import javax.transaction.xa.XAException;
import javax.transaction.xa.XAResource;
import javax.transaction.xa.Xid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Participant backed by an {@link XAResource}.
 *
 * <p>
 * {@link XAException}s are rethrown as {@link SQLException} carrying the XA error code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class XaTransactionParticipant implements TransactionParticipant {

    private final String name;
    private final XAResource resource;
    private Xid xid;
    private boolean ended;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void begin(Xid branch) throws SQLException {
        this.xid = branch;
        this.ended = false;
        try {
            resource.start(branch, XAResource.TMNOFLAGS);
        } catch (XAException e) {
            throw wrap("start", e);
        }
    }

    @Override
    public boolean prepare() throws SQLException {
        try {
            end(XAResource.TMSUCCESS);
            return resource.prepare(xid) != XAResource.XA_RDONLY;
        } catch (XAException e) {
            throw wrap("prepare", e);
        }
    }

    @Override
    public void commit(boolean onePhase) throws SQLException {
        try {
            if (onePhase) {
                end(XAResource.TMSUCCESS);
            }
            resource.commit(xid, onePhase);
        } catch (XAException e) {
            throw wrap("commit", e);
        }
    }

    @Override
    public void rollback() throws SQLException {
        try {
            end(XAResource.TMFAIL);
        } catch (XAException e) {
            // the branch may already be gone; rollback still decides
            log.debug("[{}] xa end(TMFAIL) failed: errorCode={}", name, e.errorCode);
        }
        try {
            resource.rollback(xid);
        } catch (XAException e) {
            throw wrap("rollback", e);
        }
    }

    private void end(int flags) throws XAException {
        if (!ended) {
            ended = true;
            resource.end(xid, flags);
        }
    }

    private SQLException wrap(String phase, XAException e) {
        return new SQLException("XA " + phase + " failed on " + name + " (errorCode=" + e.errorCode
                + ")", null, e.errorCode, e);
    }
}
