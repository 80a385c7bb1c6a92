package io.github.yok.flexretire.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexretire.catalog.JobDefinition;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.RowBatch;
import io.github.yok.flexretire.db.StoreConnector;
import io.github.yok.flexretire.db.StoreConnectorFactory;
import io.github.yok.flexretire.db.TableLocator;
import io.github.yok.flexretire.db.tx.TransactionCoordinator;
import io.github.yok.flexretire.db.tx.XaTransactionCoordinator;
import io.github.yok.flexretire.db.tx.XaTransactionParticipant;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import javax.transaction.xa.XAException;
import javax.transaction.xa.XAResource;
import javax.transaction.xa.Xid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link BatchExecutor} with mocked store connectors.
 */
class BatchExecutorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 30, 12, 0);

    private StoreConnectorFactory factory;
    private StoreConnector local;
    private TransactionCoordinator coordinator;
    private List<Duration> pauses;
    private BatchExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        factory = mock(StoreConnectorFactory.class);
        local = mock(StoreConnector.class);
        coordinator = mock(TransactionCoordinator.class);
        when(factory.openLocal("local")).thenReturn(local);
        when(factory.newCoordinator(anyBoolean())).thenReturn(coordinator);
        pauses = new ArrayList<>();
        executor = new BatchExecutor(factory, "local", Duration.ofMillis(100), pauses::add);
    }

    private static JobDefinition.JobDefinitionBuilder deleteJob() {
        return JobDefinition.builder().id(7L).sourceSchema("dbo").sourceTable("Events")
                .dateColumn("CreatedAt").retentionDays(10).batchSize(30).actionCode("DELETE")
                .enabled(true);
    }

    private static JobDefinition.JobDefinitionBuilder archiveJob() {
        return deleteJob().actionCode("ARCHIVE").targetSchema("dbo")
                .targetTable("Events_Archive");
    }

    private static RowBatch rows(int count) {
        ImmutableList.Builder<Object[]> rows = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            rows.add(new Object[] {i, "p" + i});
        }
        return new RowBatch(ImmutableList.of("Id", "Payload"), ImmutableList.of("Id"),
                rows.build());
    }

    @Test
    void runJob_正常ケース_DELETEを30件単位で実行する_30と25と0で停止すること() throws Exception {
        when(local.deleteBatch(any(), any(), eq(30))).thenReturn(30, 25, 0);

        JobOutcome outcome = executor.runJob(deleteJob().build(), NOW);

        assertFalse(outcome.isFailed());
        assertEquals("DELETE", outcome.getLabel());
        assertEquals(55, outcome.getRowsAffected());
        assertNull(outcome.getErrorMessage());
        verify(local, times(3)).begin();
        verify(local, times(3)).commit();
        verify(local, never()).rollback();
        verify(local).joinTransaction(coordinator);
        verify(factory).newCoordinator(false);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100)), pauses);
        verify(local).close();
    }

    @Test
    void runJob_正常ケース_カットオフは実行時刻から保持日数を引いた値であること() throws Exception {
        when(local.deleteBatch(any(), any(), anyInt())).thenReturn(0);

        executor.runJob(deleteJob().build(), NOW);

        ArgumentCaptor<CutoffPredicate> predicate = ArgumentCaptor.forClass(CutoffPredicate.class);
        verify(local).deleteBatch(eq(TableLocator.of("dbo", "Events")), predicate.capture(),
                eq(30));
        assertEquals(NOW.minusDays(10), predicate.getValue().getCutoff());
        assertEquals("CreatedAt", predicate.getValue().getDateColumn());
    }

    @Test
    void runJob_正常ケース_ドライラン_件数のみ取得され書き込みがないこと() throws Exception {
        when(local.count(any(), any())).thenReturn(55L);

        JobOutcome outcome = executor.runJob(deleteJob().dryRun(true).build(), NOW);

        assertEquals("TEST-DELETE", outcome.getLabel());
        assertEquals(55, outcome.getRowsAffected());
        verify(local, never()).begin();
        verify(local, never()).deleteBatch(any(), any(), anyInt());
        verify(local, never()).joinTransaction(any());
    }

    @Test
    void runJob_正常ケース_ARCHIVEのドライラン_ラベルがTEST_ARCHIVEであること() throws Exception {
        when(local.count(any(), any())).thenReturn(3L);

        JobOutcome outcome = executor.runJob(archiveJob().dryRun(true).build(), NOW);

        assertEquals("TEST-ARCHIVE", outcome.getLabel());
        verify(local, never()).selectBatch(any(), any(), anyInt());
    }

    @Test
    void runJob_正常ケース_同一ストアへのARCHIVE_コピーしたキーが削除されること() throws Exception {
        RowBatch batch = rows(2);
        RowBatch empty = RowBatch.empty(batch.getColumns(), batch.getKeyColumns());
        when(local.selectBatch(any(), any(), eq(30))).thenReturn(batch, empty);
        when(local.insertBatch(any(), eq(batch))).thenReturn(2);
        when(local.deleteByKeys(any(), eq(batch))).thenReturn(2);

        JobOutcome outcome = executor.runJob(archiveJob().build(), NOW);

        assertFalse(outcome.isFailed());
        assertEquals("ARCHIVE", outcome.getLabel());
        assertEquals(2, outcome.getRowsAffected());
        verify(local).insertBatch(new TableLocator(null, "dbo", "Events_Archive"), batch);
        verify(local).deleteByKeys(TableLocator.of("dbo", "Events"), batch);
        verify(local, never()).deleteBatch(any(), any(), anyInt());
        verify(local, times(2)).commit();
    }

    @Test
    void runJob_異常ケース_削除件数がコピー件数と異なる_ロールバックされERRORとなること()
            throws Exception {
        RowBatch batch = rows(2);
        when(local.selectBatch(any(), any(), anyInt())).thenReturn(batch);
        when(local.insertBatch(any(), any())).thenReturn(2);
        when(local.deleteByKeys(any(), any())).thenReturn(1);

        JobOutcome outcome = executor.runJob(archiveJob().build(), NOW);

        assertTrue(outcome.isFailed());
        assertEquals("ERROR", outcome.getLabel());
        assertEquals(0, outcome.getRowsAffected());
        assertTrue(outcome.getErrorMessage().contains("Deleted 1"));
        verify(local).rollback();
        verify(local, never()).commit();
    }

    @Test
    void runJob_異常ケース_2バッチ目でSQL例外_そのバッチのみロールバックされ行数0であること()
            throws Exception {
        when(local.deleteBatch(any(), any(), anyInt())).thenReturn(30)
                .thenThrow(new SQLException("deadlock victim"));

        JobOutcome outcome = executor.runJob(deleteJob().build(), NOW);

        assertTrue(outcome.isFailed());
        assertEquals(0, outcome.getRowsAffected());
        assertTrue(outcome.getErrorMessage().contains("deadlock victim"));
        verify(local, times(1)).commit();
        verify(local, times(1)).rollback();
        verify(local).close();
    }

    @Test
    void runJob_異常ケース_ロールバックも失敗_抑制例外として保持されERRORとなること()
            throws Exception {
        when(local.deleteBatch(any(), any(), anyInt())).thenThrow(new SQLException("boom"));
        doThrow(new SQLException("rollback failed")).when(local).rollback();

        JobOutcome outcome = executor.runJob(deleteJob().build(), NOW);

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getErrorMessage().contains("boom"));
    }

    @Test
    void runJob_異常ケース_定義が不正_接続せずERRORとなること() throws Exception {
        JobOutcome outcome =
                executor.runJob(deleteJob().sourceTable("Events; DROP TABLE x").build(), NOW);

        assertTrue(outcome.isFailed());
        assertEquals("ERROR", outcome.getLabel());
        verify(factory, never()).openLocal(anyString());
    }

    @Test
    void runJob_正常ケース_別ストアへのARCHIVE_XAコネクタ双方が同一コーディネータに参加すること()
            throws Exception {
        StoreConnector sourceXa = mock(StoreConnector.class);
        StoreConnector remoteXa = mock(StoreConnector.class);
        when(factory.openXa("local")).thenReturn(sourceXa);
        when(factory.openXa("REMOTE_SRV")).thenReturn(remoteXa);
        RowBatch batch = rows(3);
        RowBatch empty = RowBatch.empty(batch.getColumns(), batch.getKeyColumns());
        when(sourceXa.selectBatch(any(), any(), anyInt())).thenReturn(batch, empty);
        when(remoteXa.insertBatch(any(), any())).thenReturn(3);
        when(sourceXa.deleteByKeys(any(), any())).thenReturn(3);

        JobOutcome outcome = executor.runJob(archiveJob().targetStore("REMOTE_SRV")
                .targetDatabase("ArchiveDB").build(), NOW);

        assertEquals(3, outcome.getRowsAffected());
        verify(factory).newCoordinator(true);
        verify(sourceXa).joinTransaction(coordinator);
        verify(remoteXa).joinTransaction(coordinator);
        verify(remoteXa).insertBatch(new TableLocator("ArchiveDB", "dbo", "Events_Archive"),
                batch);
        verify(sourceXa, never()).insertBatch(any(), any());
        verify(factory, never()).openLocal(anyString());
        verify(sourceXa).close();
        verify(remoteXa).close();
    }

    /**
     * 実コーディネータに委譲するソース側コネクタを作成します（begin/commit/rollback のみ委譲）。
     */
    private static StoreConnector joinedTo(TransactionCoordinator tx) throws SQLException {
        StoreConnector connector = mock(StoreConnector.class);
        doAnswer(inv -> {
            tx.begin();
            return null;
        }).when(connector).begin();
        doAnswer(inv -> {
            tx.commit();
            return null;
        }).when(connector).commit();
        doAnswer(inv -> {
            tx.rollback();
            return null;
        }).when(connector).rollback();
        return connector;
    }

    private void crossStoreCoordinator(XAResource srcRes, XAResource tgtRes)
            throws SQLException {
        XaTransactionCoordinator xa = new XaTransactionCoordinator();
        xa.enlist(new XaTransactionParticipant("local", srcRes));
        xa.enlist(new XaTransactionParticipant("REMOTE_SRV", tgtRes));
        when(factory.newCoordinator(true)).thenReturn(xa);
        StoreConnector sourceXa = joinedTo(xa);
        StoreConnector remoteXa = mock(StoreConnector.class);
        when(factory.openXa("local")).thenReturn(sourceXa);
        when(factory.openXa("REMOTE_SRV")).thenReturn(remoteXa);
        RowBatch batch = rows(3);
        when(sourceXa.selectBatch(any(), any(), anyInt())).thenReturn(batch);
        when(remoteXa.insertBatch(any(), any())).thenReturn(3);
        when(sourceXa.deleteByKeys(any(), any())).thenReturn(3);
    }

    @Test
    void runJob_異常ケース_別ストアARCHIVEでターゲットのコミットが失敗_ソースの削除も確定しないこと()
            throws Exception {
        XAResource srcRes = mock(XAResource.class);
        XAResource tgtRes = mock(XAResource.class);
        crossStoreCoordinator(srcRes, tgtRes);
        doThrow(new XAException(XAException.XAER_RMFAIL)).when(tgtRes).commit(any(), eq(false));

        JobOutcome outcome =
                executor.runJob(archiveJob().targetStore("REMOTE_SRV").build(), NOW);

        assertTrue(outcome.isFailed());
        verify(srcRes, never()).commit(any(Xid.class), anyBoolean());
        verify(srcRes).rollback(any(Xid.class));
        verify(tgtRes).rollback(any(Xid.class));
    }

    @Test
    void runJob_異常ケース_別ストアARCHIVEでターゲット確定後にソースのコミットが失敗_ターゲットはロールバックされないこと()
            throws Exception {
        XAResource srcRes = mock(XAResource.class);
        XAResource tgtRes = mock(XAResource.class);
        crossStoreCoordinator(srcRes, tgtRes);
        doThrow(new XAException(XAException.XAER_RMFAIL)).when(srcRes).commit(any(), eq(false));

        JobOutcome outcome =
                executor.runJob(archiveJob().targetStore("REMOTE_SRV").build(), NOW);

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getErrorMessage().contains("left prepared for recovery"));
        verify(tgtRes).commit(any(Xid.class), eq(false));
        verify(tgtRes, never()).rollback(any(Xid.class));
        verify(srcRes, never()).rollback(any(Xid.class));
    }

    @Test
    void runJob_異常ケース_別ストアARCHIVEでターゲットのブランチ開始に失敗_ソースのブランチが終了されること()
            throws Exception {
        XAResource srcRes = mock(XAResource.class);
        XAResource tgtRes = mock(XAResource.class);
        crossStoreCoordinator(srcRes, tgtRes);
        doThrow(new XAException(XAException.XAER_RMFAIL)).when(tgtRes).start(any(), anyInt());

        JobOutcome outcome =
                executor.runJob(archiveJob().targetStore("REMOTE_SRV").build(), NOW);

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getErrorMessage().contains("XA start failed on REMOTE_SRV"));
        verify(srcRes).start(any(Xid.class), anyInt());
        verify(srcRes).end(any(Xid.class), eq(XAResource.TMFAIL));
        verify(srcRes).rollback(any(Xid.class));
    }

    @Test
    void runJob_異常ケース_ローカルのbeginが失敗_ロールバックが呼ばれERRORとなること()
            throws Exception {
        doThrow(new SQLException("connection reset")).when(local).begin();

        JobOutcome outcome = executor.runJob(deleteJob().build(), NOW);

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getErrorMessage().contains("connection reset"));
        verify(local).rollback();
        verify(local, never()).deleteBatch(any(), any(), anyInt());
    }

    @Test
    void runJob_正常ケース_ターゲットストアがソースと同じ_ローカルトランザクションで実行されること()
            throws Exception {
        when(local.selectBatch(any(), any(), anyInt())).thenReturn(RowBatch
                .empty(ImmutableList.of("Id"), ImmutableList.of("Id")));

        executor.runJob(archiveJob().targetStore("LOCAL").build(), NOW);

        verify(factory).newCoordinator(false);
        verify(factory, never()).openXa(anyString());
    }

    @Test
    void runJob_正常ケース_実行期限到達_次バッチを開始せず確定済み件数で終了すること()
            throws Exception {
        ManualTicker ticker = new ManualTicker();
        RunDeadline deadline = RunDeadline.after(Duration.ofSeconds(1), ticker);
        BatchExecutor sut = new BatchExecutor(factory, "local", Duration.ofMillis(100),
                d -> ticker.advance(Duration.ofSeconds(2)));
        when(local.deleteBatch(any(), any(), anyInt())).thenReturn(30, 30, 0);

        JobOutcome outcome = sut.runJob(deleteJob().build(), NOW, deadline);

        assertFalse(outcome.isFailed());
        assertTrue(outcome.isDeadlineReached());
        assertEquals("DELETE", outcome.getLabel());
        assertEquals(30, outcome.getRowsAffected());
        assertEquals(RunDeadline.DEFERRED_MESSAGE, outcome.getErrorMessage());
        verify(local, times(1)).deleteBatch(any(), any(), anyInt());
    }

    @Test
    void runJob_異常ケース_待機中に割り込み_ERRORとなり割り込み状態が復元されること()
            throws Exception {
        BatchExecutor sut = new BatchExecutor(factory, "local", Duration.ofMillis(100), d -> {
            throw new InterruptedException();
        });
        when(local.deleteBatch(any(), any(), anyInt())).thenReturn(30);

        JobOutcome outcome = sut.runJob(deleteJob().build(), NOW);

        assertTrue(Thread.interrupted());
        assertTrue(outcome.isFailed());
        verify(local, times(1)).commit();
    }
}
