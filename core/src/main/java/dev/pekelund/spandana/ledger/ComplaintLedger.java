package dev.pekelund.spandana.ledger;

import dev.pekelund.spandana.complaints.ComplaintHistory;
import dev.pekelund.spandana.complaints.ComplaintIdentity;
import dev.pekelund.spandana.complaints.ComplaintRecord;
import dev.pekelund.spandana.complaints.Department;
import dev.pekelund.spandana.complaints.DepartmentComplaintRecord;
import dev.pekelund.spandana.complaints.UrgencyLevel;
import java.util.List;
import java.util.Optional;

/**
 * Master ledger of complaints plus one mirrored ledger per department.
 *
 * <p>The master ledger and the department ledgers are written independently. A
 * failure between the two writes leaves them out of sync; nothing reconciles
 * them afterwards. All operations throw {@link LedgerStorageException} when a
 * file cannot be read or written.
 */
public interface ComplaintLedger {

    /**
     * Append {@code record} to the master ledger and its projection, tagged with
     * {@code urgency}, to the ledger of the assigned department.
     */
    void append(ComplaintRecord record, UrgencyLevel urgency);

    /**
     * Look for an earlier complaint filed by the same username and password hash
     * with the same complaint type, ignoring case. The status of the earlier
     * complaint does not matter.
     */
    DuplicateCheck findDuplicate(ComplaintIdentity identity, String complaintType);

    /**
     * Set the status of {@code ticketId} in the master ledger and in the ledger of
     * its department, stamping {@code Last_Updated} with the current time.
     *
     * @return {@code false} when the master ledger has no such ticket
     */
    boolean updateStatus(String ticketId, String newStatus);

    Optional<ComplaintHistory> findHistory(String ticketId);

    List<DepartmentComplaintRecord> departmentComplaints(Department department);

    /**
     * Every ticket id recorded in the master ledger, in file order.
     */
    List<String> ticketIds();
}
