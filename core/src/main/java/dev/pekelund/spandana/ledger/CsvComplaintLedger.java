package dev.pekelund.spandana.ledger;

import dev.pekelund.spandana.complaints.ComplaintHistory;
import dev.pekelund.spandana.complaints.ComplaintIdentity;
import dev.pekelund.spandana.complaints.ComplaintRecord;
import dev.pekelund.spandana.complaints.ComplaintTimestamps;
import dev.pekelund.spandana.complaints.Department;
import dev.pekelund.spandana.complaints.DepartmentComplaintRecord;
import dev.pekelund.spandana.complaints.UrgencyLevel;
import dev.pekelund.spandana.csv.CsvFiles;
import dev.pekelund.spandana.csv.CsvTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ComplaintLedger} kept in CSV files: the master ledger plus one file per
 * {@link Department}. Every lookup is a linear scan and every update rewrites the
 * whole file; rewrites replace the file atomically and the last writer wins.
 */
public class CsvComplaintLedger implements ComplaintLedger {

    private static final Logger log = LoggerFactory.getLogger(CsvComplaintLedger.class);

    private final Path directory;
    private final Path masterFile;
    private final Clock clock;
    private final LedgerSchema schema;

    public CsvComplaintLedger(Path directory, String masterFileName, Clock clock) {
        this.directory = directory;
        this.masterFile = directory.resolve(masterFileName);
        this.clock = clock;
        this.schema = new LedgerSchema(clock);
    }

    public Path getMasterFile() {
        return masterFile;
    }

    public Path departmentFile(Department department) {
        return directory.resolve(department.fileName());
    }

    /**
     * Create the master ledger or bring it onto the canonical header.
     */
    public void initialize() {
        masterRows();
    }

    @Override
    public void append(ComplaintRecord record, UrgencyLevel urgency) {
        masterRows();
        try {
            CsvFiles.append(masterFile, toMasterRow(record));
        } catch (IOException ex) {
            throw new LedgerStorageException("Failed to append ticket " + record.ticketId()
                + " to " + masterFile.getFileName(), ex);
        }

        Optional<Department> department = Department.fromDisplayName(record.assignedDepartment());
        if (department.isEmpty()) {
            log.warn("Ticket {} names unknown department '{}'; no department ledger written",
                record.ticketId(), record.assignedDepartment());
            return;
        }

        Path departmentFile = departmentFile(department.get());
        try {
            schema.ensureHeader(departmentFile, LedgerColumns.DEPARTMENT_HEADER);
            CsvFiles.append(departmentFile, toDepartmentRow(record.toDepartmentRecord(urgency)));
        } catch (IOException ex) {
            throw new LedgerStorageException("Ticket " + record.ticketId() + " was saved to "
                + masterFile.getFileName() + " but not to " + departmentFile.getFileName(), ex);
        }
        log.info("Recorded ticket {} for {}", record.ticketId(), department.get().displayName());
    }

    @Override
    public DuplicateCheck findDuplicate(ComplaintIdentity identity, String complaintType) {
        if (identity == null || !identity.isAuthenticated()) {
            return DuplicateCheck.none();
        }

        String wantedType = normalizeType(complaintType);
        int usernameIndex = LedgerColumns.masterIndex(LedgerColumns.USERNAME);
        int hashIndex = LedgerColumns.masterIndex(LedgerColumns.PASSWORD_HASH);
        int typeIndex = LedgerColumns.masterIndex(LedgerColumns.COMPLAINT_TYPE);
        int ticketIndex = LedgerColumns.masterIndex(LedgerColumns.TICKET_ID);

        for (List<String> row : masterRows()) {
            if (row.get(usernameIndex).trim().equals(identity.username())
                && row.get(hashIndex).trim().equals(identity.passwordHash())
                && normalizeType(row.get(typeIndex)).equals(wantedType)) {
                return DuplicateCheck.found(row.get(ticketIndex));
            }
        }
        return DuplicateCheck.none();
    }

    @Override
    public boolean updateStatus(String ticketId, String newStatus) {
        List<List<String>> rows = masterRows();
        int ticketIndex = LedgerColumns.masterIndex(LedgerColumns.TICKET_ID);

        List<String> match = rows.stream()
            .filter(row -> row.get(ticketIndex).trim().equals(ticketId))
            .findFirst()
            .orElse(null);
        if (match == null) {
            return false;
        }

        String now = ComplaintTimestamps.now(clock);
        match.set(LedgerColumns.masterIndex(LedgerColumns.STATUS), newStatus);
        match.set(LedgerColumns.masterIndex(LedgerColumns.LAST_UPDATED), now);
        try {
            CsvFiles.rewrite(masterFile, LedgerColumns.MASTER_HEADER, rows);
        } catch (IOException ex) {
            throw new LedgerStorageException("Failed to update ticket " + ticketId
                + " in " + masterFile.getFileName(), ex);
        }
        log.info("Ticket {} set to '{}'", ticketId, newStatus);

        String assignedDepartment = match.get(LedgerColumns.masterIndex(LedgerColumns.ASSIGNED_DEPARTMENT));
        Department.fromDisplayName(assignedDepartment).ifPresentOrElse(
            department -> updateDepartmentStatus(department, ticketId, newStatus, now),
            () -> log.warn("Ticket {} has no known department ('{}'); only the master ledger was updated",
                ticketId, assignedDepartment));
        return true;
    }

    @Override
    public Optional<ComplaintHistory> findHistory(String ticketId) {
        int ticketIndex = LedgerColumns.masterIndex(LedgerColumns.TICKET_ID);
        return masterRows().stream()
            .filter(row -> row.get(ticketIndex).trim().equals(ticketId))
            .findFirst()
            .map(CsvComplaintLedger::toComplaintRecord)
            .map(ComplaintRecord::toHistory);
    }

    @Override
    public List<DepartmentComplaintRecord> departmentComplaints(Department department) {
        Path departmentFile = departmentFile(department);
        try {
            return schema.ensureHeader(departmentFile, LedgerColumns.DEPARTMENT_HEADER).stream()
                .map(CsvComplaintLedger::toDepartmentRecord)
                .toList();
        } catch (IOException ex) {
            throw new LedgerStorageException("Failed to read " + departmentFile.getFileName(), ex);
        }
    }

    @Override
    public List<String> ticketIds() {
        int ticketIndex = LedgerColumns.masterIndex(LedgerColumns.TICKET_ID);
        return masterRows().stream()
            .map(row -> row.get(ticketIndex).trim())
            .toList();
    }

    private void updateDepartmentStatus(Department department, String ticketId, String newStatus, String now) {
        Path departmentFile = departmentFile(department);
        if (Files.notExists(departmentFile)) {
            log.warn("Department ledger {} does not exist; ticket {} only updated in the master ledger",
                departmentFile.getFileName(), ticketId);
            return;
        }

        try {
            List<List<String>> rows = schema.ensureHeader(departmentFile, LedgerColumns.DEPARTMENT_HEADER);
            int ticketIndex = LedgerColumns.departmentIndex(LedgerColumns.TICKET_ID);
            Optional<List<String>> match = rows.stream()
                .filter(row -> row.get(ticketIndex).trim().equals(ticketId))
                .findFirst();
            if (match.isEmpty()) {
                log.warn("Ticket {} missing from {}", ticketId, departmentFile.getFileName());
                return;
            }
            match.get().set(LedgerColumns.departmentIndex(LedgerColumns.STATUS), newStatus);
            match.get().set(LedgerColumns.departmentIndex(LedgerColumns.LAST_UPDATED), now);
            CsvFiles.rewrite(departmentFile, LedgerColumns.DEPARTMENT_HEADER, rows);
        } catch (IOException ex) {
            throw new LedgerStorageException("Ticket " + ticketId + " was updated in "
                + masterFile.getFileName() + " but not in " + departmentFile.getFileName(), ex);
        }
    }

    private List<List<String>> masterRows() {
        try {
            return schema.ensureHeader(masterFile, LedgerColumns.MASTER_HEADER);
        } catch (IOException ex) {
            throw new LedgerStorageException("Failed to read " + masterFile.getFileName(), ex);
        }
    }

    private static String normalizeType(String complaintType) {
        return complaintType != null ? complaintType.trim().toLowerCase(Locale.ROOT) : "";
    }

    private static List<String> toMasterRow(ComplaintRecord record) {
        return List.of(
            record.username(),
            record.passwordHash(),
            record.name(),
            record.mobileNumber(),
            record.location(),
            record.complaintType(),
            record.complaintDescription(),
            record.ticketId(),
            record.status(),
            record.ticketAlive(),
            record.createdAt(),
            record.lastUpdatedAt(),
            record.assignedDepartment());
    }

    private static List<String> toDepartmentRow(DepartmentComplaintRecord record) {
        return List.of(
            record.ticketId(),
            record.username(),
            record.name(),
            record.mobileNumber(),
            record.location(),
            record.complaintType(),
            record.complaintDescription(),
            record.status(),
            record.urgencyLevel(),
            record.createdAt(),
            record.lastUpdatedAt());
    }

    private static ComplaintRecord toComplaintRecord(List<String> row) {
        return new ComplaintRecord(
            CsvTable.value(row, 0),
            CsvTable.value(row, 1),
            CsvTable.value(row, 2),
            CsvTable.value(row, 3),
            CsvTable.value(row, 4),
            CsvTable.value(row, 5),
            CsvTable.value(row, 6),
            CsvTable.value(row, 7),
            CsvTable.value(row, 8),
            CsvTable.value(row, 9),
            CsvTable.value(row, 10),
            CsvTable.value(row, 11),
            CsvTable.value(row, 12));
    }

    private static DepartmentComplaintRecord toDepartmentRecord(List<String> row) {
        return new DepartmentComplaintRecord(
            CsvTable.value(row, 0),
            CsvTable.value(row, 1),
            CsvTable.value(row, 2),
            CsvTable.value(row, 3),
            CsvTable.value(row, 4),
            CsvTable.value(row, 5),
            CsvTable.value(row, 6),
            CsvTable.value(row, 7),
            CsvTable.value(row, 8),
            CsvTable.value(row, 9),
            CsvTable.value(row, 10));
    }
}
