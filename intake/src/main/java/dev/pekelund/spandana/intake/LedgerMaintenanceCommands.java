package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintHistory;
import dev.pekelund.spandana.complaints.Department;
import dev.pekelund.spandana.complaints.DepartmentComplaintRecord;
import dev.pekelund.spandana.ledger.ComplaintLedger;
import dev.pekelund.spandana.ledger.LedgerStorageException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-interactive ledger commands, run when the intake screen is started with
 * arguments.
 */
public class LedgerMaintenanceCommands {

    public static final int OK = 0;
    public static final int NOT_FOUND = 1;
    public static final int USAGE = 2;
    public static final int STORAGE_ERROR = 3;

    static final String USAGE_TEXT = String.join(System.lineSeparator(),
        "Usage:",
        "  update-status <ticket id> <status>",
        "  history <ticket id>",
        "  department <department name>");

    private static final Logger log = LoggerFactory.getLogger(LedgerMaintenanceCommands.class);

    private final ComplaintLedger ledger;
    private final PrintWriter out;

    public LedgerMaintenanceCommands(ComplaintLedger ledger, PrintWriter out) {
        this.ledger = ledger;
        this.out = out;
    }

    public int execute(List<String> args) {
        if (args.isEmpty()) {
            return usage();
        }
        try {
            return switch (args.get(0).toLowerCase(Locale.ROOT)) {
                case "update-status" -> args.size() < 3 ? usage() : updateStatus(args.get(1), join(args, 2));
                case "history" -> args.size() != 2 ? usage() : history(args.get(1));
                case "department" -> args.size() < 2 ? usage() : department(join(args, 1));
                default -> usage();
            };
        } catch (LedgerStorageException ex) {
            log.error("Ledger command {} failed", args, ex);
            print("Error: " + ex.getMessage());
            return STORAGE_ERROR;
        } finally {
            out.flush();
        }
    }

    private int updateStatus(String ticketId, String status) {
        if (!ledger.updateStatus(ticketId, status)) {
            print("Ticket " + ticketId + " not found.");
            return NOT_FOUND;
        }
        print("Ticket " + ticketId + " is now '" + status + "'.");
        return OK;
    }

    private int history(String ticketId) {
        Optional<ComplaintHistory> history = ledger.findHistory(ticketId);
        if (history.isEmpty()) {
            print("Ticket " + ticketId + " not found.");
            return NOT_FOUND;
        }
        ComplaintHistory entry = history.get();
        print("Ticket ID:    " + entry.ticketId());
        print("Status:       " + entry.status());
        print("Created:      " + entry.created());
        print("Last updated: " + entry.lastUpdated());
        print("Type:         " + entry.complaintType());
        print("Description:  " + entry.description());
        print("Department:   " + entry.department());
        return OK;
    }

    private int department(String name) {
        Optional<Department> department = resolveDepartment(name);
        if (department.isEmpty()) {
            print("Unknown department '" + name + "'. Known departments: "
                + String.join(", ", Arrays.stream(Department.values()).map(Department::displayName).toList()));
            return NOT_FOUND;
        }

        List<DepartmentComplaintRecord> complaints = ledger.departmentComplaints(department.get());
        print(department.get().displayName() + ": " + complaints.size() + " complaint(s)");
        for (DepartmentComplaintRecord complaint : complaints) {
            print(String.join(" | ", complaint.ticketId(), complaint.status(), complaint.urgencyLevel(),
                complaint.complaintType(), complaint.location(), complaint.lastUpdatedAt()));
        }
        return OK;
    }

    static Optional<Department> resolveDepartment(String name) {
        String wanted = name.trim();
        for (Department department : Department.values()) {
            String shortName = department.displayName().replace(" Department", "");
            if (department.displayName().equalsIgnoreCase(wanted)
                || shortName.equalsIgnoreCase(wanted)
                || department.name().equalsIgnoreCase(wanted)) {
                return Optional.of(department);
            }
        }
        return Optional.empty();
    }

    private int usage() {
        print(USAGE_TEXT);
        return USAGE;
    }

    private void print(String line) {
        out.println(line);
    }

    private static String join(List<String> args, int from) {
        return String.join(" ", args.subList(from, args.size()));
    }
}
