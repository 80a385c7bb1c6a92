package io.github.yok.flexretire.core;

import io.github.yok.flexretire.catalog.JobDefinition;
import io.github.yok.flexretire.catalog.RetireAction;
import io.github.yok.flexretire.util.ForeignKeyDependencyReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Compares the operator-declared processing order with the foreign keys of the source store.
 *
 * <p>
 * Warns when a child table is archived before its parent (the archive copy of the child would
 * reference a parent row not yet archived) or when a parent table is purged before its child.
 * The order is never changed and no job is skipped. Metadata that cannot be read is logged and
 * ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ProcessingOrderAdvisor {

    private final JdbcTemplate jdbc;

    /**
     * Checks the order of the given jobs.
     *
     * @param jobs enabled jobs in processing order
     * @return warnings, in job order (also logged at WARN)
     */
    public List<String> check(List<JobDefinition> jobs) {
        // first position of each source table per action
        Map<String, Integer> archivePos = new LinkedHashMap<>();
        Map<String, Integer> deletePos = new LinkedHashMap<>();
        List<String[]> tables = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            JobDefinition job = jobs.get(i);
            Optional<RetireAction> action = RetireAction.find(job.getActionCode());
            if (!action.isPresent() || job.getSourceSchema() == null
                    || job.getSourceTable() == null) {
                continue;
            }
            String key = ForeignKeyDependencyReader.key(job.getSourceSchema(),
                    job.getSourceTable());
            Map<String, Integer> positions =
                    action.get() == RetireAction.COPY_THEN_DELETE ? archivePos : deletePos;
            positions.putIfAbsent(key, i);
            tables.add(new String[] {job.getSourceSchema(), job.getSourceTable()});
        }
        if (tables.size() < 2) {
            return Collections.emptyList();
        }

        Map<String, Set<String>> parents;
        try {
            parents = jdbc.execute((ConnectionCallback<Map<String, Set<String>>>) conn -> {
                return ForeignKeyDependencyReader.readParents(conn, tables);
            });
        } catch (DataAccessException e) {
            log.warn("Processing order not verified; foreign key metadata unavailable: {}",
                    e.getMessage());
            return Collections.emptyList();
        }
        if (parents == null) {
            return Collections.emptyList();
        }

        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : parents.entrySet()) {
            String child = e.getKey();
            for (String parent : e.getValue()) {
                Integer childArchive = archivePos.get(child);
                Integer parentArchive = archivePos.get(parent);
                if (childArchive != null && parentArchive != null
                        && childArchive < parentArchive) {
                    warnings.add(describe(jobs, childArchive, "ARCHIVE", child)
                            + " runs before " + describe(jobs, parentArchive, "ARCHIVE", parent)
                            + " although " + child + " references " + parent);
                }
                Integer childDelete = deletePos.get(child);
                Integer parentDelete = deletePos.get(parent);
                if (childDelete != null && parentDelete != null && parentDelete < childDelete) {
                    warnings.add(describe(jobs, parentDelete, "DELETE", parent) + " runs before "
                            + describe(jobs, childDelete, "DELETE", child) + " although " + child
                            + " references " + parent);
                }
            }
        }
        for (String warning : warnings) {
            log.warn("Processing order: {}", warning);
        }
        return warnings;
    }

    private static String describe(List<JobDefinition> jobs, int position, String code,
            String table) {
        return "job " + jobs.get(position).getId() + " (" + code + " " + table + ")";
    }
}
